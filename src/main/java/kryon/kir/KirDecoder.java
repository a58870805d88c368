package kryon.kir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kryon.kir.core.KirMetadata;
import kryon.kir.core.Layout;
import kryon.kir.core.LayoutField;
import kryon.kir.core.Node;
import kryon.kir.core.Style;
import kryon.kir.core.StyleField;
import kryon.kir.nodes.Components;
import kryon.kir.runtime.CaseTranscoder;
import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.FormatException;
import kryon.kir.runtime.KirConfig;
import kryon.kir.runtime.ValidationException;
import kryon.kir.runtime.ValueCodecs;
import kryon.kir.types.NodeKind;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * KIR 文档 → 组件树。
 *
 * 未知的节点类型回退为 Container，未知的节点字段被忽略，未知的 style/layout 键保存在记录的 extras 中。
 * 每个节点都通过 {@link Components#reconstruct} 重建，因此解码得到的节点与 DSL 构造的节点完全一致，
 * 类型专属的校验（例如标题级别）同样生效。
 */
public final class KirDecoder {

  private static final Logger LOGGER = Logger.getLogger(KirDecoder.class.getName());


  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private final boolean strictKeys;

  public KirDecoder() {
    this(KirConfig.STRICT_KEYS);
  }

  /**
   * @param strictKeys 为 true 时不可逆的通用键名转换以 WARNING 记录
   */
  public KirDecoder(boolean strictKeys) {
    this.strictKeys = strictKeys;
  }

  public boolean isStrictKeys() {
    return strictKeys;
  }

  /**
   * 解码 JSON 文本，返回根节点。
   *
   * @throws FormatException JSON 不合法或结构不符合 KIR
   * @throws ValidationException 节点参数不合法（例如标题级别越界）
   */
  public Node decode(String json) {
    return decode(parse(json));
  }

  public Node decode(byte[] json) {
    return decode(parse(json));
  }

  /**
   * 解码已解析的 JSON 树；带 {@code root} 字段时解包，否则视为裸节点。
   */
  public Node decode(JsonNode tree) {
    int[] counter = new int[1];
    Node root = decodeNode(unwrap(tree), "root", counter);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("Decoded " + counter[0] + " nodes");
    }
    return root;
  }

  public KirDocument decodeDocument(String json) {
    return decodeDocument(parse(json));
  }

  public KirDocument decodeDocument(byte[] json) {
    return decodeDocument(parse(json));
  }

  /**
   * 解码完整文档，保留 version、metadata 以及其它顶层段。
   */
  public KirDocument decodeDocument(JsonNode tree) {
    if (tree == null || !tree.isObject()) {
      throw new FormatException(ErrorMessages.malformedDocument("document must be a JSON object, got " + typeOf(tree)));
    }
    Node root = decode(tree);
    if (!tree.has("root")) {
      return KirDocument.of(root, KirConfig.DEFAULT_LANGUAGE);
    }

    String version = tree.path("version").isTextual() ? tree.get("version").textValue() : KirDocument.VERSION;
    JsonNode meta = tree.path("metadata");
    KirMetadata metadata = new KirMetadata(
        textOr(meta, "format", KirMetadata.FORMAT),
        textOr(meta, "language", KirConfig.DEFAULT_LANGUAGE),
        textOr(meta, "sourceFile", null),
        textOr(meta, "compilerVersion", null),
        textOr(meta, "timestamp", null));

    Map<String, JsonNode> metadataExtras = new LinkedHashMap<>();
    if (meta.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = meta.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (!KirDocument.RESERVED_METADATA.contains(e.getKey())) {
          metadataExtras.put(e.getKey(), e.getValue());
        }
      }
    }
    Map<String, JsonNode> sections = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      if (!KirDocument.RESERVED_SECTIONS.contains(e.getKey())) {
        sections.put(e.getKey(), e.getValue());
      }
    }
    return new KirDocument(version, metadata, root, sections, metadataExtras);
  }

  private JsonNode parse(String json) {
    if (json == null) {
      throw new FormatException(ErrorMessages.malformedDocument("input is null"));
    }
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new FormatException(ErrorMessages.malformedDocument(e.getOriginalMessage()), e);
    }
  }

  private JsonNode parse(byte[] json) {
    if (json == null) {
      throw new FormatException(ErrorMessages.malformedDocument("input is null"));
    }
    try {
      return mapper.readTree(json);
    } catch (IOException e) {
      throw new FormatException(ErrorMessages.malformedDocument(e.getMessage()), e);
    }
  }

  private static JsonNode unwrap(JsonNode tree) {
    if (tree == null || !tree.isObject()) {
      throw new FormatException(ErrorMessages.malformedDocument("root must be a JSON object, got " + typeOf(tree)));
    }
    return tree.has("root") ? tree.get("root") : tree;
  }

  private Node decodeNode(JsonNode json, String path, int[] counter) {
    if (json == null || !json.isObject()) {
      throw new FormatException(ErrorMessages.malformedNodeField(path, "OBJECT", typeOf(json)));
    }
    counter[0]++;

    JsonNode typeNode = json.get("type");
    NodeKind kind = NodeKind.fromWireName(typeNode != null && typeNode.isTextual() ? typeNode.textValue() : null);

    Map<String, Object> attributes = new LinkedHashMap<>();
    JsonNode props = json.get("properties");
    if (props != null && !props.isNull()) {
      if (!props.isObject()) {
        throw new FormatException(ErrorMessages.malformedNodeField(path + ".properties", "OBJECT", typeOf(props)));
      }
      Iterator<Map.Entry<String, JsonNode>> it = props.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        attributes.put(CaseTranscoder.decodeKey(e.getKey(), strictKeys), ValueCodecs.fromJson(e.getValue()));
      }
    }

    Node node = Components.reconstruct(kind, attributes);

    JsonNode id = json.get("id");
    if (id != null && !id.isNull()) {
      node.setId(decodeId(id, path));
    }
    node.setStyle(decodeStyle(json.get("style"), path));
    node.setLayout(decodeLayout(json.get("layout"), path));

    JsonNode children = json.get("children");
    if (children != null && !children.isNull()) {
      if (!children.isArray()) {
        throw new FormatException(ErrorMessages.malformedNodeField(path + ".children", "ARRAY", typeOf(children)));
      }
      int i = 0;
      for (JsonNode child : children) {
        node.attachChild(decodeNode(child, path + ".children[" + i++ + "]", counter));
      }
    }

    JsonNode events = json.get("events");
    if (events != null && !events.isNull()) {
      if (!events.isArray()) {
        throw new FormatException(ErrorMessages.malformedNodeField(path + ".events", "ARRAY", typeOf(events)));
      }
      for (JsonNode ev : events) {
        if (!ev.isObject() || !ev.path("type").isTextual() || !ev.path("handler").isTextual()) {
          throw new FormatException(ErrorMessages.malformedNodeField(path + ".events", "{type, handler}", ev.toString()));
        }
        node.addEvent(ev.get("type").textValue(), ev.get("handler").textValue());
      }
    }
    return node;
  }

  private static long decodeId(JsonNode id, String path) {
    if (!id.isIntegralNumber() || !id.canConvertToLong()) {
      throw new FormatException(ErrorMessages.malformedNodeField(path + ".id", "uint32", id.toString()));
    }
    long value = id.longValue();
    if (value < 0 || value > Node.MAX_ID) {
      throw new FormatException(ErrorMessages.idOutOfRange(value));
    }
    return value;
  }

  private Style decodeStyle(JsonNode json, String path) {
    if (json == null || json.isNull()) {
      return null;
    }
    if (!json.isObject()) {
      throw new FormatException(ErrorMessages.malformedNodeField(path + ".style", "OBJECT", typeOf(json)));
    }
    Style style = new Style();
    Iterator<Map.Entry<String, JsonNode>> it = json.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String key = CaseTranscoder.decodeKey(e.getKey(), strictKeys);
      StyleField field = StyleField.byKey(key);
      if (field == null) {
        style.putExtra(key, ValueCodecs.fromJson(e.getValue()));
      } else if (!e.getValue().isNull()) {
        style.set(field, ValueCodecs.decodeField(field, e.getValue()));
      }
    }
    return style;
  }

  private Layout decodeLayout(JsonNode json, String path) {
    if (json == null || json.isNull()) {
      return null;
    }
    if (!json.isObject()) {
      throw new FormatException(ErrorMessages.malformedNodeField(path + ".layout", "OBJECT", typeOf(json)));
    }
    Layout layout = new Layout();
    Iterator<Map.Entry<String, JsonNode>> it = json.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String key = CaseTranscoder.decodeKey(e.getKey(), strictKeys);
      LayoutField field = LayoutField.byKey(key);
      if (field == null) {
        layout.putExtra(key, ValueCodecs.fromJson(e.getValue()));
      } else if (!e.getValue().isNull()) {
        layout.set(field, ValueCodecs.decodeField(field, e.getValue()));
      }
    }
    return layout;
  }

  private static String textOr(JsonNode obj, String field, String defaultValue) {
    JsonNode v = obj.path(field);
    return v.isTextual() ? v.textValue() : defaultValue;
  }

  private static String typeOf(JsonNode node) {
    return node == null ? "MISSING" : node.getNodeType().name();
  }
}
