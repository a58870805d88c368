package kryon.kir.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 内部键名与 KIR 键名之间的转换。
 *
 * <p>内部键名使用下划线分隔的小写形式（{@code background_color}），KIR 使用首字母小写的驼峰形式
 * （{@code backgroundColor}）。不规则的键名由覆盖表处理，覆盖表在两个方向上都优先于通用算法。</p>
 *
 * <p>通用算法对连续大写字母（缩写）并不可逆：{@code fooURL} 会被解码为 {@code foo_url}，
 * 再编码得到 {@code fooUrl}。这类键名被视为兼容性风险，通过日志标记而不是猜测更强的规则。</p>
 */
public final class CaseTranscoder {

  private static final Logger LOGGER = Logger.getLogger(CaseTranscoder.class.getName());

  private static final Map<String, String> INTERNAL_TO_WIRE;
  private static final Map<String, String> WIRE_TO_INTERNAL;

  static {
    Map<String, String> overrides = new LinkedHashMap<>();
    overrides.put("text_content", "textContent");
    overrides.put("custom_data", "customData");
    overrides.put("source_module", "sourceModule");
    overrides.put("export_name", "exportName");
    overrides.put("module_ref", "moduleRef");
    overrides.put("component_ref", "componentRef");
    overrides.put("component_props", "componentProps");
    overrides.put("selected_index", "selectedIndex");
    overrides.put("is_open", "isOpen");

    Map<String, String> inverse = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : overrides.entrySet()) {
      inverse.put(e.getValue(), e.getKey());
    }
    INTERNAL_TO_WIRE = Collections.unmodifiableMap(overrides);
    WIRE_TO_INTERNAL = Collections.unmodifiableMap(inverse);
  }

  private CaseTranscoder() {
    // 工具类，禁止实例化
  }

  /**
   * 内部键名 → KIR 键名；是否以 WARNING 报告不可逆转换取决于 {@link KirConfig#STRICT_KEYS}。
   */
  public static String encodeKey(String internalKey) {
    return encodeKey(internalKey, KirConfig.STRICT_KEYS);
  }

  /**
   * @param strict 为 true 时不可逆的通用转换以 WARNING 记录，否则以 FINE 记录
   */
  public static String encodeKey(String internalKey, boolean strict) {
    String override = INTERNAL_TO_WIRE.get(internalKey);
    if (override != null) {
      return override;
    }
    if (internalKey.indexOf('_') < 0 && internalKey.indexOf('-') < 0) {
      return internalKey;
    }
    StringBuilder sb = new StringBuilder(internalKey.length());
    boolean upperNext = false;
    boolean first = true;
    for (int i = 0; i < internalKey.length(); i++) {
      char c = internalKey.charAt(i);
      if (c == '_' || c == '-') {
        upperNext = !first;
        continue;
      }
      sb.append(upperNext ? Character.toUpperCase(c) : c);
      upperNext = false;
      first = false;
    }
    String wire = sb.toString();
    if (!wire.isEmpty() && !internalKey.equals(decodeGeneric(wire))) {
      reportRisk(strict, "encode", internalKey, wire);
    }
    return wire;
  }

  /**
   * KIR 键名 → 内部键名。
   */
  public static String decodeKey(String wireKey) {
    return decodeKey(wireKey, KirConfig.STRICT_KEYS);
  }

  public static String decodeKey(String wireKey, boolean strict) {
    String override = WIRE_TO_INTERNAL.get(wireKey);
    if (override != null) {
      return override;
    }
    String internal = decodeGeneric(wireKey);
    if (!internal.equals(wireKey) && !wireKey.equals(encodeGeneric(internal))) {
      reportRisk(strict, "decode", wireKey, internal);
    }
    return internal;
  }

  /**
   * 内部键名能否无损往返（{@code decodeKey(encodeKey(k)) == k}）。
   */
  public static boolean isRoundTripSafe(String internalKey) {
    return internalKey.equals(decodeKey(encodeKey(internalKey)));
  }

  /**
   * 是否由覆盖表处理（不走通用算法）。
   */
  public static boolean hasOverride(String key) {
    return INTERNAL_TO_WIRE.containsKey(key) || WIRE_TO_INTERNAL.containsKey(key);
  }

  public static Map<String, String> overrides() {
    return INTERNAL_TO_WIRE;
  }

  private static String encodeGeneric(String internalKey) {
    StringBuilder sb = new StringBuilder(internalKey.length());
    boolean upperNext = false;
    for (int i = 0; i < internalKey.length(); i++) {
      char c = internalKey.charAt(i);
      if (c == '_') {
        upperNext = sb.length() > 0;
        continue;
      }
      sb.append(upperNext ? Character.toUpperCase(c) : c);
      upperNext = false;
    }
    return sb.toString();
  }

  // 在每段大写字母之前插入下划线，然后整体转小写
  private static String decodeGeneric(String wireKey) {
    StringBuilder sb = new StringBuilder(wireKey.length() + 4);
    for (int i = 0; i < wireKey.length(); i++) {
      char c = wireKey.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && !Character.isUpperCase(wireKey.charAt(i - 1))) {
          sb.append('_');
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static void reportRisk(boolean strict, String direction, String from, String to) {
    Level level = strict ? Level.WARNING : Level.FINE;
    if (LOGGER.isLoggable(level)) {
      LOGGER.log(level, "Key ''{0}'' is not invertible under the generic {1} rule (-> ''{2}'')",
          new Object[] {from, direction, to});
    }
  }
}
