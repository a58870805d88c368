package kryon.kir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kryon.kir.core.EventBinding;
import kryon.kir.core.KirMetadata;
import kryon.kir.core.Node;
import kryon.kir.core.PropertyField;
import kryon.kir.core.PropertyRecord;
import kryon.kir.runtime.CaseTranscoder;
import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.FormatException;
import kryon.kir.runtime.KirConfig;
import kryon.kir.runtime.ValidationException;
import kryon.kir.runtime.ValueCodecs;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 组件树 → KIR 文档。
 *
 * 先序遍历；每次 encode 调用拥有独立的 id 计数器（从 1 开始），显式 id 保持不变且不推进计数器，
 * 自动 id 会跳过树中已被显式 id 占用的值。编码器不修改树，同一棵树编码两次得到相同输出，
 * 实例本身无状态，可在多个线程间共享。
 */
public final class KirEncoder {

  private static final Logger LOGGER = Logger.getLogger(KirEncoder.class.getName());
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private static final ObjectMapper COMPACT = new ObjectMapper();
  private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final String language;
  private final boolean strictKeys;

  public KirEncoder() {
    this(KirConfig.DEFAULT_LANGUAGE);
  }

  public KirEncoder(String language) {
    this(language, KirConfig.STRICT_KEYS);
  }

  /**
   * @param strictKeys 为 true 时不可逆的通用键名转换以 WARNING 记录
   */
  public KirEncoder(String language, boolean strictKeys) {
    this.language = Objects.requireNonNull(language, "language");
    this.strictKeys = strictKeys;
  }

  public String language() {
    return language;
  }

  public boolean isStrictKeys() {
    return strictKeys;
  }

  /**
   * 编码为完整文档（version + metadata + root）。
   *
   * @throws ValidationException 树中存在重复的显式 id
   */
  public ObjectNode encode(Node root) {
    return encode(KirDocument.of(root, language));
  }

  public ObjectNode encode(KirDocument document) {
    ObjectNode out = NODES.objectNode();
    out.put("version", document.version());
    out.set("metadata", encodeMetadata(document));
    for (Map.Entry<String, JsonNode> e : document.sections().entrySet()) {
      out.set(e.getKey(), e.getValue().deepCopy());
    }
    out.set("root", encodeNode(document.root()));
    return out;
  }

  /**
   * 只编码节点本身（不含文档外壳）。
   */
  public ObjectNode encodeNode(Node root) {
    IdAllocator ids = new IdAllocator(root);
    ObjectNode encoded = encodeNode(root, ids);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("Encoded " + ids.visited + " nodes (" + ids.assigned + " auto ids)");
    }
    return encoded;
  }

  public String encodeToString(Node root) {
    return encodeToString(root, KirConfig.PRETTY);
  }

  public String encodeToString(Node root, boolean pretty) {
    return write(encode(root), pretty);
  }

  public String encodeToString(KirDocument document, boolean pretty) {
    return write(encode(document), pretty);
  }

  private static String write(JsonNode tree, boolean pretty) {
    try {
      return (pretty ? PRETTY : COMPACT).writeValueAsString(tree);
    } catch (JsonProcessingException e) {
      throw new FormatException(ErrorMessages.malformedDocument(e.getOriginalMessage()), e);
    }
  }

  private ObjectNode encodeMetadata(KirDocument document) {
    KirMetadata meta = document.metadata();
    ObjectNode obj = NODES.objectNode();
    obj.put("format", meta.format());
    obj.put("language", meta.language());
    if (meta.sourceFile() != null) obj.put("sourceFile", meta.sourceFile());
    if (meta.compilerVersion() != null) obj.put("compilerVersion", meta.compilerVersion());
    if (meta.timestamp() != null) obj.put("timestamp", meta.timestamp());
    for (Map.Entry<String, JsonNode> e : document.metadataExtras().entrySet()) {
      obj.set(e.getKey(), e.getValue().deepCopy());
    }
    return obj;
  }

  private ObjectNode encodeNode(Node node, IdAllocator ids) {
    ObjectNode obj = NODES.objectNode();
    obj.put("type", node.kind().toWireName());
    obj.put("id", ids.idFor(node));

    if (!node.attributes().isEmpty()) {
      ObjectNode props = NODES.objectNode();
      for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
        props.set(CaseTranscoder.encodeKey(e.getKey(), strictKeys), ValueCodecs.toJson(e.getValue()));
      }
      obj.set("properties", props);
    }
    if (node.style() != null && !node.style().isEmpty()) {
      obj.set("style", encodeRecord(node.style()));
    }
    if (node.layout() != null && !node.layout().isEmpty()) {
      obj.set("layout", encodeRecord(node.layout()));
    }
    if (node.childCount() > 0) {
      ArrayNode children = obj.putArray("children");
      for (Node child : node.children()) {
        children.add(encodeNode(child, ids));
      }
    }
    if (!node.events().isEmpty()) {
      ArrayNode events = obj.putArray("events");
      for (EventBinding ev : node.events()) {
        ObjectNode e = events.addObject();
        e.put("type", ev.type());
        e.put("handler", ev.handler());
      }
    }
    return obj;
  }

  private <F extends Enum<F> & PropertyField> ObjectNode encodeRecord(PropertyRecord<F, ?> record) {
    ObjectNode obj = NODES.objectNode();
    for (Map.Entry<F, Object> e : record.presentFields().entrySet()) {
      obj.set(CaseTranscoder.encodeKey(e.getKey().key(), strictKeys), ValueCodecs.encodeField(e.getKey(), e.getValue()));
    }
    for (Map.Entry<String, Object> e : record.extras().entrySet()) {
      obj.set(CaseTranscoder.encodeKey(e.getKey(), strictKeys), ValueCodecs.toJson(e.getValue()));
    }
    return obj;
  }

  /**
   * 单次编码的 id 分配状态。
   */
  private static final class IdAllocator {
    private final Set<Long> claimed = new HashSet<>();
    private long next = 1;
    int visited;
    int assigned;

    IdAllocator(Node root) {
      collect(root);
    }

    private void collect(Node node) {
      if (node.hasId() && !claimed.add(node.id())) {
        throw new ValidationException(ErrorMessages.duplicateNodeId(node.id()));
      }
      for (Node child : node.children()) {
        collect(child);
      }
    }

    long idFor(Node node) {
      visited++;
      if (node.hasId()) {
        return node.id();
      }
      while (claimed.contains(next)) {
        next++;
      }
      if (next > Node.MAX_ID) {
        throw new ValidationException(ErrorMessages.idOutOfRange(next));
      }
      assigned++;
      return next++;
    }
  }
}
