package kryon.kir.core;

import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.FormatException;
import kryon.kir.runtime.ValidationException;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RGBA 颜色，r/g/b 取 0..255，a 取 0.0..1.0。
 */
public record Color(int r, int g, int b, double a) {

  private static final Pattern RGBA = Pattern.compile(
      "rgba?\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*(?:,\\s*([0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*)?\\)");

  public Color {
    checkChannel("r", r);
    checkChannel("g", g);
    checkChannel("b", b);
    if (!(a >= 0.0 && a <= 1.0)) {
      throw new ValidationException(ErrorMessages.colorComponentOutOfRange("a", a));
    }
  }

  public Color(int r, int g, int b) {
    this(r, g, b, 1.0);
  }

  public boolean isOpaque() {
    return a == 1.0;
  }

  /**
   * 解析 {@code #rgb}、{@code #rrggbb}、{@code #rrggbbaa}，前导 {@code #} 可省略。
   *
   * @throws ValidationException 长度不是 3、6、8
   * @throws FormatException 含有非十六进制字符
   */
  public static Color fromHex(String hex) {
    if (hex == null) {
      throw new FormatException(ErrorMessages.unparseableColor(null));
    }
    String h = hex.startsWith("#") ? hex.substring(1) : hex;
    switch (h.length()) {
      case 3: {
        int r = hexDigit(hex, h.charAt(0));
        int g = hexDigit(hex, h.charAt(1));
        int b = hexDigit(hex, h.charAt(2));
        return new Color(r * 17, g * 17, b * 17, 1.0);
      }
      case 6:
        return new Color(hexByte(hex, h, 0), hexByte(hex, h, 2), hexByte(hex, h, 4), 1.0);
      case 8:
        return new Color(hexByte(hex, h, 0), hexByte(hex, h, 2), hexByte(hex, h, 4), hexByte(hex, h, 6) / 255.0);
      default:
        throw new ValidationException(ErrorMessages.invalidHexColorLength(hex));
    }
  }

  /**
   * 解析 KIR 中出现的颜色字符串：十六进制或 {@code rgba(r, g, b, a)} / {@code rgb(r, g, b)}。
   */
  public static Color parse(String text) {
    if (text == null) {
      throw new FormatException(ErrorMessages.unparseableColor(null));
    }
    String t = text.trim();
    if (t.startsWith("#")) {
      return fromHex(t);
    }
    Matcher m = RGBA.matcher(t.toLowerCase(Locale.ROOT));
    if (m.matches()) {
      int r = Integer.parseInt(m.group(1));
      int g = Integer.parseInt(m.group(2));
      int b = Integer.parseInt(m.group(3));
      double a = m.group(4) == null ? 1.0 : Double.parseDouble(m.group(4));
      return new Color(r, g, b, a);
    }
    throw new FormatException(ErrorMessages.unparseableColor(text));
  }

  /**
   * 十六进制形式：不透明时为 6 位，否则 8 位（alpha 取 {@code round(a * 255)}）。
   */
  public String toHex() {
    if (isOpaque()) {
      return String.format(Locale.ROOT, "#%02x%02x%02x", r, g, b);
    }
    return String.format(Locale.ROOT, "#%02x%02x%02x%02x", r, g, b, (int) Math.round(a * 255));
  }

  /**
   * KIR 线上形式：不透明时为 {@code #rrggbb}，否则为 {@code rgba(r, g, b, a)}。
   */
  public String toKir() {
    if (isOpaque()) {
      return toHex();
    }
    return "rgba(" + r + ", " + g + ", " + b + ", " + formatAlpha(a) + ")";
  }

  // 始终输出普通小数，不使用科学计数法
  private static String formatAlpha(double a) {
    return BigDecimal.valueOf(a).stripTrailingZeros().toPlainString();
  }

  private static void checkChannel(String name, int value) {
    if (value < 0 || value > 255) {
      throw new ValidationException(ErrorMessages.colorComponentOutOfRange(name, value));
    }
  }

  private static int hexByte(String original, String h, int offset) {
    return hexDigit(original, h.charAt(offset)) * 16 + hexDigit(original, h.charAt(offset + 1));
  }

  private static int hexDigit(String original, char c) {
    int d = Character.digit(c, 16);
    if (d < 0) {
      throw new FormatException(ErrorMessages.invalidHexDigits(original));
    }
    return d;
  }
}
