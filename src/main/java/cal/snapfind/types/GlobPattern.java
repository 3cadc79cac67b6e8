package cal.snapfind.types;

import java.util.regex.Pattern;

/**
 * A shell glob that matches single names (not paths).
 *
 * <ul>
 *   <li><code>*</code> matches any run of characters, including none</li>
 *   <li><code>?</code> matches exactly one character</li>
 *   <li><code>[abc]</code>, <code>[a-z]</code> match one character from the class;
 *       <code>[^...]</code> or <code>[!...]</code> match one character outside it</li>
 *   <li><code>\</code> makes the next character literal, also inside a class</li>
 * </ul>
 *
 * There is no recursive <code>**</code>: names never contain a path separator, so
 * <code>**</code> means the same as <code>*</code>.  Every other character matches
 * itself.
 */
public final class GlobPattern {

  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob, Pattern regex) {
    this.glob = glob;
    this.regex = regex;
  }

  /**
   * @throws BadPatternException if a class is empty, unclosed, or has a reversed range,
   *   or if the glob ends with an unfinished escape
   */
  public static GlobPattern compile(String glob) throws BadPatternException {
    return new GlobPattern(glob, Pattern.compile(new Translator(glob).translate(), Pattern.DOTALL));
  }

  public boolean matches(String name) {
    return regex.matcher(name).matches();
  }

  @Override
  public String toString() {
    return glob;
  }

  /** Translates a glob into an equivalent regular expression. */
  private static final class Translator {
    private final String glob;
    private final StringBuilder out = new StringBuilder();
    private int pos = 0;

    Translator(String glob) {
      this.glob = glob;
    }

    String translate() throws BadPatternException {
      while (pos < glob.length()) {
        char c = glob.charAt(pos);
        switch (c) {
          case '*' -> {
            ++pos;
            out.append("[^/]*");
          }
          case '?' -> {
            ++pos;
            out.append("[^/]");
          }
          case '[' -> {
            ++pos;
            translateClass();
          }
          default -> appendLiteral(nextCodePoint());
        }
      }
      return out.toString();
    }

    private void translateClass() throws BadPatternException {
      out.append('[');
      if (pos < glob.length() && (glob.charAt(pos) == '^' || glob.charAt(pos) == '!')) {
        ++pos;
        out.append('^');
      }
      int members = 0;
      for (;;) {
        if (pos >= glob.length()) {
          throw new BadPatternException(glob, "unclosed character class");
        }
        if (glob.charAt(pos) == ']') {
          if (members == 0) {
            throw new BadPatternException(glob, "empty character class");
          }
          ++pos;
          out.append(']');
          return;
        }
        int lo = nextClassCodePoint();
        appendLiteral(lo);
        if (pos < glob.length() && glob.charAt(pos) == '-') {
          ++pos;
          int hi = nextClassCodePoint();
          if (hi < lo) {
            throw new BadPatternException(glob, "reversed range in character class");
          }
          out.append('-');
          appendLiteral(hi);
        }
        ++members;
      }
    }

    private int nextClassCodePoint() throws BadPatternException {
      if (pos >= glob.length()) {
        throw new BadPatternException(glob, "unclosed character class");
      }
      char c = glob.charAt(pos);
      if (c == '-' || c == ']') {
        throw new BadPatternException(glob, "unescaped '" + c + "' in character class");
      }
      return nextCodePoint();
    }

    /** Consume one possibly-escaped character. */
    private int nextCodePoint() throws BadPatternException {
      if (glob.charAt(pos) == '\\') {
        ++pos;
        if (pos >= glob.length()) {
          throw new BadPatternException(glob, "unfinished escape at end of pattern");
        }
      }
      int cp = glob.codePointAt(pos);
      pos += Character.charCount(cp);
      return cp;
    }

    private void appendLiteral(int codePoint) {
      out.append("\\x{").append(Integer.toHexString(codePoint)).append('}');
    }
  }

}
