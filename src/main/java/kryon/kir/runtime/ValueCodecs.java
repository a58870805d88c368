package kryon.kir.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.PropertyField;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 值编解码器：尺寸、颜色、数字以及属性值在 Java 值与 Jackson 树之间的转换。
 *
 * <ul>
 *   <li>尺寸：{@code {"value": "auto" | "<n>px" | "<n>%" | <原样字符串>}}</li>
 *   <li>颜色：不透明为 {@code #rrggbb}，否则为 {@code rgba(r, g, b, a)}</li>
 *   <li>数字：整数值输出为整数，避免 {@code 16.0} 这样的噪音</li>
 * </ul>
 */
public final class ValueCodecs {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ValueCodecs() {
    // 工具类，禁止实例化
  }

  // === Dimension ===

  public static ObjectNode encodeDimension(Dimension dimension) {
    ObjectNode obj = NODES.objectNode();
    obj.put("value", dimension.toText());
    return obj;
  }

  /**
   * 接受 {@code {"value": ...}}、裸字符串或裸数字（视为像素）。
   *
   * @throws FormatException 其它 JSON 形态
   */
  public static Dimension decodeDimension(JsonNode node) {
    if (node == null || node.isNull()) {
      throw new FormatException(ErrorMessages.unparseableDimension("null"));
    }
    if (node.isObject() && node.has("value")) {
      JsonNode value = node.get("value");
      if (value.isObject()) {
        throw new FormatException(ErrorMessages.unparseableDimension(node.toString()));
      }
      return decodeDimension(value);
    }
    if (node.isTextual()) {
      return Dimension.parse(node.textValue());
    }
    if (node.isNumber()) {
      return Dimension.px(node.doubleValue());
    }
    throw new FormatException(ErrorMessages.unparseableDimension(node.toString()));
  }

  // === Color ===

  public static String encodeColor(Color color) {
    return color.toKir();
  }

  /**
   * 接受十六进制 / rgba 字符串，以及原生序列化器输出的 {@code {"r":..,"g":..,"b":..,"a":..}} 对象。
   */
  public static Color decodeColor(JsonNode node) {
    if (node != null && node.isTextual()) {
      return Color.parse(node.textValue());
    }
    if (node != null && node.isObject() && node.has("r") && node.has("g") && node.has("b")) {
      double a = node.has("a") ? node.get("a").asDouble(1.0) : 1.0;
      // 原生格式中 alpha 也可能是 0..255 的整数
      if (a > 1.0 && node.get("a").isIntegralNumber()) {
        a = a / 255.0;
      }
      return new Color(node.get("r").asInt(), node.get("g").asInt(), node.get("b").asInt(), a);
    }
    throw new FormatException(ErrorMessages.unparseableColor(String.valueOf(node)));
  }

  // === Numbers ===

  public static JsonNode encodeNumber(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      long l = (long) value;
      if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
        return NODES.numberNode((int) l);
      }
      return NODES.numberNode(l);
    }
    return NODES.numberNode(value);
  }

  // === Style / Layout fields ===

  public static JsonNode encodeField(PropertyField field, Object value) {
    switch (field.type()) {
      case DIMENSION:
        return encodeDimension((Dimension) value);
      case COLOR:
        return NODES.textNode(encodeColor((Color) value));
      case NUMBER:
        return encodeNumber((Double) value);
      case STRING:
        return NODES.textNode((String) value);
      case BOOLEAN:
        return NODES.booleanNode((Boolean) value);
      default:
        throw new IllegalStateException("Unhandled field type: " + field.type());
    }
  }

  /**
   * 解码已知字段的值。
   *
   * @throws FormatException 值的 JSON 形态与字段类型不匹配
   */
  public static Object decodeField(PropertyField field, JsonNode node) {
    switch (field.type()) {
      case DIMENSION:
        return decodeDimension(node);
      case COLOR:
        return decodeColor(node);
      case NUMBER:
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) {
          Dimension d = Dimension.parse(node.textValue());
          if (d instanceof Dimension.Pixels) return ((Dimension.Pixels) d).value();
        }
        break;
      case STRING:
        if (node.isValueNode() && !node.isNull()) return node.asText();
        break;
      case BOOLEAN:
        if (node.isBoolean()) return node.booleanValue();
        break;
      default:
        break;
    }
    throw new FormatException(ErrorMessages.malformedNodeField(field.key(), field.type().name(), node.getNodeType().name()));
  }

  // === Attribute values ===

  /**
   * 属性值 → JSON。支持 String / Boolean / Number / List / Map / null，
   * 以及 Dimension 与 Color（按线上形式输出）；其余类型交给 Jackson 默认转换。
   */
  public static JsonNode toJson(Object value) {
    if (value == null) return NODES.nullNode();
    if (value instanceof String) return NODES.textNode((String) value);
    if (value instanceof Boolean) return NODES.booleanNode((Boolean) value);
    if (value instanceof Integer) return NODES.numberNode((Integer) value);
    if (value instanceof Long) return NODES.numberNode((Long) value);
    if (value instanceof Double || value instanceof Float) return NODES.numberNode(((Number) value).doubleValue());
    if (value instanceof Dimension) return encodeDimension((Dimension) value);
    if (value instanceof Color) return NODES.textNode(encodeColor((Color) value));
    if (value instanceof JsonNode) return ((JsonNode) value).deepCopy();
    if (value instanceof Map) {
      ObjectNode obj = NODES.objectNode();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        obj.set(String.valueOf(e.getKey()), toJson(e.getValue()));
      }
      return obj;
    }
    if (value instanceof List) {
      ArrayNode arr = NODES.arrayNode();
      for (Object item : (List<?>) value) {
        arr.add(toJson(item));
      }
      return arr;
    }
    return MAPPER.valueToTree(value);
  }

  /**
   * 把属性值规整为解码器产出的表示：整数在 int 范围内为 Integer，否则为 Long / BigInteger；
   * Float 变为 Double；Dimension 变为 {@code {"value": ...}} 映射，Color 变为线上字符串；
   * 列表与映射逐项规整。
   */
  public static Object normalizeAttribute(Object value) {
    if (value == null || value instanceof String || value instanceof Boolean
        || value instanceof Integer || value instanceof Double) {
      return value;
    }
    return fromJson(toJson(value));
  }

  /**
   * JSON → 属性值。整数优先解码为 Integer，超出范围时为 Long；对象键名保持原样。
   */
  public static Object fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return null;
    if (node.isTextual()) return node.textValue();
    if (node.isBoolean()) return node.booleanValue();
    if (node.isIntegralNumber()) {
      if (node.canConvertToInt()) return node.intValue();
      if (node.canConvertToLong()) return node.longValue();
      return node.bigIntegerValue();
    }
    if (node.isNumber()) return node.doubleValue();
    if (node.isArray()) {
      List<Object> list = new ArrayList<>(node.size());
      for (JsonNode item : node) {
        list.add(fromJson(item));
      }
      return list;
    }
    if (node.isObject()) {
      Map<String, Object> map = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        map.put(e.getKey(), fromJson(e.getValue()));
      }
      return map;
    }
    return node.asText();
  }
}
