package cal.snapfind.types;

public class BadPatternException extends UsageException {
  public BadPatternException(String pattern, String problem) {
    super("bad pattern \"" + pattern + "\": " + problem);
  }
}
