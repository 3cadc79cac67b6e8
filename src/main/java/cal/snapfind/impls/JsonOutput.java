package cal.snapfind.impls;

import cal.snapfind.Util;
import cal.snapfind.types.FileMode;
import cal.snapfind.types.MatchSink;
import cal.snapfind.types.Node;
import cal.snapfind.types.Snapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * JSON output, written as matches arrive rather than after the search:
 *
 * <pre>
 * [{"matches":[{"path":"/a.txt","permissions":"-rw-r--r--",...},...],"hits":2,"snapshot":"5d4c..."},
 *  {"matches":[...],"hits":1,"snapshot":"9a1f..."}]
 * </pre>
 *
 * A match shows every attribute of its entry except the name (the path already has it)
 * and the inode, device, extended attributes, content and subtree.  A search without
 * matches produces <code>[]</code>.
 *
 * <p>The document is only complete after {@link #finish()}.
 */
public class JsonOutput implements MatchSink {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private static class JsonMatch {
    public @Nullable String path;
    public @Nullable String permissions;
    public @Nullable String type;
    public @Nullable Integer mode;
    public @Nullable String mtime;
    public @Nullable String atime;
    public @Nullable String ctime;
    public long uid;
    public long gid;
    public @Nullable String user;
    public @Nullable String group;
    public @Nullable Long device_id;
    public @Nullable Long size;
    public @Nullable Long links;
    public @Nullable String linktarget;
  }

  private final ObjectMapper mapper;
  private final JsonGenerator generator;
  private final PrintStream warnings;
  private final DateTimeFormatter timeFormat;

  // State of the partially-written document
  private boolean inUse = false;
  private @Nullable Snapshot currentSnapshot = null;
  private int hits = 0;

  /**
   * @param out where the document goes; it is flushed after every match but never closed
   * @param warnings where to report matches that could not be written
   * @param zone the time zone for timestamps
   */
  public JsonOutput(OutputStream out, PrintStream warnings, ZoneId zone) throws IOException {
    this(out, warnings, zone, new ObjectMapper());
  }

  JsonOutput(OutputStream out, PrintStream warnings, ZoneId zone, ObjectMapper mapper) throws IOException {
    this.mapper = mapper;
    this.generator = mapper.getFactory()
        .createGenerator(out)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    this.warnings = warnings;
    this.timeFormat = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(zone);
  }

  @Override
  public void emit(String prefix, Node node, Snapshot snapshot) throws IOException {
    String path = Util.joinPath(prefix, node.name());
    String json;
    try {
      json = mapper.writeValueAsString(toJsonMatch(path, node));
    } catch (JsonProcessingException e) {
      warnings.println("WARNING: unable to write match " + path + " as JSON: " + e.getOriginalMessage());
      return;
    }

    if (!inUse) {
      generator.writeStartArray();
      inUse = true;
    }
    if (currentSnapshot == null || !currentSnapshot.id().equals(snapshot.id())) {
      if (currentSnapshot != null) {
        closeGroup(currentSnapshot);
      }
      generator.writeStartObject();
      generator.writeArrayFieldStart("matches");
      currentSnapshot = snapshot;
      hits = 0;
    }
    generator.writeRawValue(json);
    ++hits;
    generator.flush();
  }

  private void closeGroup(Snapshot snapshot) throws IOException {
    generator.writeEndArray();
    generator.writeNumberField("hits", hits);
    generator.writeStringField("snapshot", snapshot.id().toString());
    generator.writeEndObject();
  }

  @Override
  public void finish() throws IOException {
    if (currentSnapshot != null) {
      closeGroup(currentSnapshot);
      currentSnapshot = null;
    }
    if (!inUse) {
      generator.writeStartArray();
    }
    generator.writeEndArray();
    generator.writeRaw('\n');
    generator.flush();
  }

  private JsonMatch toJsonMatch(String path, Node node) {
    JsonMatch res = new JsonMatch();
    res.path = path;
    res.permissions = FileMode.format(node.type(), node.mode());
    res.type = node.typeName();
    res.mode = node.mode() != 0 ? node.mode() : null;
    res.mtime = formatTime(node.modTime());
    res.atime = formatTime(node.accessTime());
    res.ctime = formatTime(node.changeTime());
    res.uid = node.uid();
    res.gid = node.gid();
    res.user = emptyToNull(node.user());
    res.group = emptyToNull(node.group());
    res.device_id = zeroToNull(node.deviceId());
    res.size = zeroToNull(node.size());
    res.links = zeroToNull(node.links());
    res.linktarget = emptyToNull(node.linkTarget());
    return res;
  }

  private @Nullable String formatTime(@Nullable Instant t) {
    return t == null ? null : timeFormat.format(t);
  }

  private static @Nullable String emptyToNull(@Nullable String s) {
    return s == null || s.isEmpty() ? null : s;
  }

  private static @Nullable Long zeroToNull(long x) {
    return x != 0 ? x : null;
  }

}
