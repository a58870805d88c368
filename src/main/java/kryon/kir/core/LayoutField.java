package kryon.kir.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link Layout} 的全部字段。声明顺序即编码顺序。
 */
public enum LayoutField implements PropertyField {
  FLEX_DIRECTION("flex_direction", ValueType.STRING),
  JUSTIFY_CONTENT("justify_content", ValueType.STRING),
  ALIGN_ITEMS("align_items", ValueType.STRING),
  ALIGN_CONTENT("align_content", ValueType.STRING),
  GAP("gap", ValueType.NUMBER),
  ROW_GAP("row_gap", ValueType.NUMBER),
  COLUMN_GAP("column_gap", ValueType.NUMBER),
  FLEX_WRAP("flex_wrap", ValueType.STRING),
  TOP("top", ValueType.NUMBER),
  RIGHT("right", ValueType.NUMBER),
  BOTTOM("bottom", ValueType.NUMBER),
  LEFT("left", ValueType.NUMBER);

  private static final Map<String, LayoutField> BY_KEY;

  static {
    Map<String, LayoutField> m = new HashMap<>();
    for (LayoutField f : values()) m.put(f.key, f);
    BY_KEY = Collections.unmodifiableMap(m);
  }

  private final String key;
  private final ValueType type;

  LayoutField(String key, ValueType type) {
    this.key = key;
    this.type = type;
  }

  @Override
  public String key() {
    return key;
  }

  @Override
  public ValueType type() {
    return type;
  }

  public static LayoutField byKey(String key) {
    return BY_KEY.get(key);
  }
}
