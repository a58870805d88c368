package kryon.kir.core;

import java.util.Objects;

/**
 * 尺寸值：auto、像素、百分比，或无法识别时原样保留的字符串。
 *
 * 文本形式：{@code "auto"}、{@code "100px"}、{@code "50%"}；数值无小数部分时输出为整数字面量。
 */
public sealed interface Dimension permits Dimension.Auto, Dimension.Pixels, Dimension.Percent, Dimension.Opaque {

  /** 文本形式，即 KIR 中 {@code {"value": ...}} 的内容。 */
  String toText();

  static Dimension auto() {
    return Auto.INSTANCE;
  }

  static Dimension px(double value) {
    return new Pixels(value);
  }

  static Dimension percent(double value) {
    return new Percent(value);
  }

  static Dimension opaque(String text) {
    return new Opaque(text);
  }

  /**
   * 解析文本形式：{@code "auto"} → auto；以 {@code %} 结尾 → 百分比；以 {@code px} 结尾 → 像素；
   * 其他数字 → 像素；其余一律原样保留为 opaque。
   */
  static Dimension parse(String text) {
    Objects.requireNonNull(text, "text");
    String t = text.trim();
    if (t.equals("auto")) {
      return auto();
    }
    if (t.endsWith("%")) {
      Double v = parseNumber(t.substring(0, t.length() - 1));
      if (v != null) return percent(v);
    } else if (t.endsWith("px")) {
      Double v = parseNumber(t.substring(0, t.length() - 2));
      if (v != null) return px(v);
    } else {
      Double v = parseNumber(t);
      if (v != null) return px(v);
    }
    return opaque(text);
  }

  /**
   * 数字格式化：整数值输出为整数字面量，否则输出最短的十进制表示。
   */
  static String formatNumber(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static Double parseNumber(String s) {
    String t = s.trim();
    if (t.isEmpty()) return null;
    // Double.parseDouble 接受 "NaN"、"Infinity" 与 "1d" 之类的后缀，这里只接受普通十进制数
    for (int i = 0; i < t.length(); i++) {
      char c = t.charAt(i);
      if (!(Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
        return null;
      }
    }
    try {
      return Double.parseDouble(t);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  enum Auto implements Dimension {
    INSTANCE;

    @Override
    public String toText() {
      return "auto";
    }

    @Override
    public String toString() {
      return "Dimension.auto";
    }
  }

  record Pixels(double value) implements Dimension {
    @Override
    public String toText() {
      return formatNumber(value) + "px";
    }
  }

  record Percent(double value) implements Dimension {
    @Override
    public String toText() {
      return formatNumber(value) + "%";
    }
  }

  record Opaque(String text) implements Dimension {
    public Opaque {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toText() {
      return text;
    }
  }
}
