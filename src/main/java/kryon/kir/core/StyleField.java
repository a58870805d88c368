package kryon.kir.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link Style} 的全部字段。声明顺序即编码顺序。
 */
public enum StyleField implements PropertyField {
  // Dimensions
  WIDTH("width", ValueType.DIMENSION),
  HEIGHT("height", ValueType.DIMENSION),
  MIN_WIDTH("min_width", ValueType.DIMENSION),
  MAX_WIDTH("max_width", ValueType.DIMENSION),
  MIN_HEIGHT("min_height", ValueType.DIMENSION),
  MAX_HEIGHT("max_height", ValueType.DIMENSION),

  // Colors
  BACKGROUND_COLOR("background_color", ValueType.COLOR),
  COLOR("color", ValueType.COLOR),
  BORDER_COLOR("border_color", ValueType.COLOR),

  // Border
  BORDER_WIDTH("border_width", ValueType.NUMBER),
  BORDER_RADIUS("border_radius", ValueType.NUMBER),

  // Spacing
  MARGIN("margin", ValueType.NUMBER),
  MARGIN_TOP("margin_top", ValueType.NUMBER),
  MARGIN_RIGHT("margin_right", ValueType.NUMBER),
  MARGIN_BOTTOM("margin_bottom", ValueType.NUMBER),
  MARGIN_LEFT("margin_left", ValueType.NUMBER),
  PADDING("padding", ValueType.NUMBER),
  PADDING_TOP("padding_top", ValueType.NUMBER),
  PADDING_RIGHT("padding_right", ValueType.NUMBER),
  PADDING_BOTTOM("padding_bottom", ValueType.NUMBER),
  PADDING_LEFT("padding_left", ValueType.NUMBER),

  // Typography
  FONT_SIZE("font_size", ValueType.NUMBER),
  FONT_FAMILY("font_family", ValueType.STRING),
  FONT_WEIGHT("font_weight", ValueType.STRING),
  FONT_STYLE("font_style", ValueType.STRING),
  LINE_HEIGHT("line_height", ValueType.NUMBER),
  TEXT_ALIGN("text_align", ValueType.STRING),

  // Display
  VISIBLE("visible", ValueType.BOOLEAN),
  OPACITY("opacity", ValueType.NUMBER),
  OVERFLOW("overflow", ValueType.STRING),

  // Flex
  FLEX_GROW("flex_grow", ValueType.NUMBER),
  FLEX_SHRINK("flex_shrink", ValueType.NUMBER),
  FLEX_BASIS("flex_basis", ValueType.DIMENSION),

  // Position
  POSITION("position", ValueType.STRING),
  X("x", ValueType.NUMBER),
  Y("y", ValueType.NUMBER);

  private static final Map<String, StyleField> BY_KEY;

  static {
    Map<String, StyleField> m = new HashMap<>();
    for (StyleField f : values()) m.put(f.key, f);
    BY_KEY = Collections.unmodifiableMap(m);
  }

  private final String key;
  private final ValueType type;

  StyleField(String key, ValueType type) {
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

  /** 按内部键名查找，未知键返回 null。 */
  public static StyleField byKey(String key) {
    return BY_KEY.get(key);
  }
}
