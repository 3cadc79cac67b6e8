package cal.snapfind.repo;

import cal.prim.MalformedDataException;
import cal.snapfind.types.Node;
import cal.snapfind.types.NodeType;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.Tree;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.checker.nullness.qual.PolyNull;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The JSON encoding of repository objects.
 *
 * <p>A tree is <code>{"nodes":[...]}</code>; each node uses the keys
 * <code>name type mode mtime atime ctime uid gid user group inode device_id size links
 * linktarget extended_attributes device content subtree</code>.  A snapshot has
 * <code>time tree paths hostname username tags</code>.  Times are RFC 3339 strings and
 * ids are 64 hexadecimal digits.  Unknown keys are ignored.
 *
 * <p>The id of a stored object is the SHA-256 of exactly the bytes this class produces
 * (or reads), so the encoding of an object must not be changed once it has been stored.
 */
public class JsonObjectFormat {

  private static class JsonTree {
    public @Nullable List<JsonNode> nodes;
  }

  private static class JsonExtendedAttribute {
    public @Nullable String name;
    public @Nullable String value;
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  private static class JsonNode {
    public @Nullable String name;
    public @Nullable String type;
    public int mode;
    public @Nullable String mtime;
    public @Nullable String atime;
    public @Nullable String ctime;
    public long uid;
    public long gid;
    public @Nullable String user;
    public @Nullable String group;
    public long inode;
    @JsonProperty("device_id")
    public long deviceId;
    public long size;
    public long links;
    public @Nullable String linktarget;
    @JsonProperty("extended_attributes")
    public @Nullable List<JsonExtendedAttribute> extendedAttributes;
    public long device;
    public @Nullable List<String> content;
    public @Nullable String subtree;
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private static class JsonSnapshot {
    public @Nullable String time;
    public @Nullable String tree;
    public @Nullable List<String> paths;
    public @Nullable String hostname;
    public @Nullable String username;
    public @Nullable List<String> tags;
  }

  private static class JsonLock {
    public @Nullable String time;
    public boolean exclusive;
    public @Nullable String hostname;
    public @Nullable String username;
    public long pid;
  }

  private final ObjectMapper mapper;

  public JsonObjectFormat() {
    mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private <T> T parse(byte[] data, Class<T> type, String what) throws IOException, MalformedDataException {
    try {
      T result = mapper.readValue(data, type);
      if (result == null) {
        throw new MalformedDataException(what + " is JSON null");
      }
      return result;
    } catch (JsonParseException e) {
      throw new MalformedDataException(what + " is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException(what + " JSON is not well-formed", e);
    } catch (JsonProcessingException e) {
      throw new MalformedDataException(what + " JSON has an out-of-range value", e);
    }
  }

  private byte[] write(Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      // The Json* classes only hold strings, numbers and lists of them.
      throw new IllegalStateException("unable to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  // ---------------------------------------------------------------- trees

  public Tree loadTree(byte[] data) throws IOException, MalformedDataException {
    JsonTree t = parse(data, JsonTree.class, "Tree");
    List<Node> nodes = new ArrayList<>();
    for (JsonNode n : t.nodes != null ? t.nodes : Collections.<JsonNode>emptyList()) {
      nodes.add(toNode(n));
    }
    return new Tree(nodes);
  }

  public byte[] serializeTree(Tree tree) {
    JsonTree t = new JsonTree();
    t.nodes = new ArrayList<>();
    for (Node n : tree.nodes()) {
      t.nodes.add(toJsonNode(n));
    }
    return write(t);
  }

  private Node toNode(JsonNode n) throws MalformedDataException {
    String name = n.name;
    if (name == null) {
      throw new MalformedDataException("Tree entry has no name");
    }
    String type = n.type;
    if (type == null) {
      throw new MalformedDataException("Tree entry \"" + name + "\" has no type");
    }
    Instant modTime = parseTime(n.mtime, name);
    if (modTime == null) {
      throw new MalformedDataException("Tree entry \"" + name + "\" has no modification time");
    }

    List<Node.ExtendedAttribute> attributes = new ArrayList<>();
    if (n.extendedAttributes != null) {
      for (JsonExtendedAttribute a : n.extendedAttributes) {
        if (a.name == null) {
          throw new MalformedDataException("Tree entry \"" + name + "\" has an extended attribute without a name");
        }
        attributes.add(new Node.ExtendedAttribute(a.name, a.value != null ? a.value : ""));
      }
    }

    try {
      return Node.builder()
          .name(name)
          .type(NodeType.fromSerializedName(type))
          .typeName(type)
          .mode(n.mode)
          .modTime(modTime)
          .accessTime(parseTime(n.atime, name))
          .changeTime(parseTime(n.ctime, name))
          .uid(n.uid)
          .gid(n.gid)
          .user(n.user)
          .group(n.group)
          .inode(n.inode)
          .deviceId(n.deviceId)
          .size(n.size)
          .links(n.links)
          .linkTarget(n.linktarget)
          .extendedAttributes(attributes)
          .device(n.device)
          .content(parseIds(n.content))
          .subtree(n.subtree != null ? ObjectId.parse(n.subtree) : null)
          .build();
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("Tree entry \"" + name + "\" is invalid: " + e.getMessage(), e);
    }
  }

  private static JsonNode toJsonNode(Node n) {
    JsonNode res = new JsonNode();
    res.name = n.name();
    res.type = n.typeName();
    res.mode = n.mode();
    res.mtime = formatTime(n.modTime());
    res.atime = formatTime(n.accessTime());
    res.ctime = formatTime(n.changeTime());
    res.uid = n.uid();
    res.gid = n.gid();
    res.user = n.user();
    res.group = n.group();
    res.inode = n.inode();
    res.deviceId = n.deviceId();
    res.size = n.size();
    res.links = n.links();
    res.linktarget = n.linkTarget();
    res.extendedAttributes = new ArrayList<>();
    for (Node.ExtendedAttribute a : n.extendedAttributes()) {
      JsonExtendedAttribute ja = new JsonExtendedAttribute();
      ja.name = a.name();
      ja.value = a.value();
      res.extendedAttributes.add(ja);
    }
    res.device = n.device();
    res.content = n.content().stream().map(ObjectId::toString).toList();
    var subtree = n.subtree();
    res.subtree = subtree != null ? subtree.toString() : null;
    return res;
  }

  // ------------------------------------------------------------ snapshots

  public Snapshot loadSnapshot(ObjectId id, byte[] data) throws IOException, MalformedDataException {
    JsonSnapshot s = parse(data, JsonSnapshot.class, "Snapshot " + id.str());
    Instant time = parseTime(s.time, "snapshot " + id.str());
    if (time == null) {
      throw new MalformedDataException("Snapshot " + id.str() + " has no time");
    }
    if (s.tree == null) {
      throw new MalformedDataException("Snapshot " + id.str() + " has no tree");
    }
    if (s.hostname == null) {
      throw new MalformedDataException("Snapshot " + id.str() + " has no hostname");
    }
    ObjectId tree;
    try {
      tree = ObjectId.parse(s.tree);
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("Snapshot " + id.str() + " has an invalid tree id", e);
    }
    return new Snapshot(
        id,
        time,
        tree,
        s.paths != null ? s.paths : Collections.emptyList(),
        s.hostname,
        s.username,
        s.tags != null ? s.tags : Collections.emptyList());
  }

  public byte[] serializeSnapshot(Snapshot snapshot) {
    JsonSnapshot s = new JsonSnapshot();
    s.time = formatTime(snapshot.time());
    s.tree = snapshot.tree().toString();
    s.paths = snapshot.paths();
    s.hostname = snapshot.hostname();
    s.username = snapshot.username();
    s.tags = snapshot.tags().isEmpty() ? null : snapshot.tags();
    return write(s);
  }

  // ---------------------------------------------------------------- locks

  public RepositoryLock.Info loadLock(byte[] data) throws IOException, MalformedDataException {
    JsonLock l = parse(data, JsonLock.class, "Lock");
    Instant time = parseTime(l.time, "lock");
    if (time == null) {
      throw new MalformedDataException("Lock has no time");
    }
    return new RepositoryLock.Info(
        time,
        l.exclusive,
        l.hostname != null ? l.hostname : "",
        l.username != null ? l.username : "",
        l.pid);
  }

  public byte[] serializeLock(RepositoryLock.Info info) {
    JsonLock l = new JsonLock();
    l.time = formatTime(info.time());
    l.exclusive = info.exclusive();
    l.hostname = info.hostname();
    l.username = info.username();
    l.pid = info.pid();
    return write(l);
  }

  // --------------------------------------------------------------- values

  private static @PolyNull Instant parseTime(@PolyNull String s, String owner) throws MalformedDataException {
    if (s == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException e) {
      throw new MalformedDataException("Invalid time \"" + s + "\" in " + owner, e);
    }
  }

  private static @PolyNull String formatTime(@PolyNull Instant t) {
    return t == null ? null : t.toString();
  }

  private static List<ObjectId> parseIds(@Nullable List<String> ids) {
    if (ids == null) {
      return Collections.emptyList();
    }
    List<ObjectId> result = new ArrayList<>(ids.size());
    for (String id : ids) {
      result.add(ObjectId.parse(id));
    }
    return result;
  }

}
