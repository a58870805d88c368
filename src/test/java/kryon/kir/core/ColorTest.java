package kryon.kir.core;

import kryon.kir.runtime.FormatException;
import kryon.kir.runtime.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColorTest {

  @Test
  public void testShortAndLongHexAreEqual() {
    Color expected = new Color(255, 0, 0, 1.0);
    assertEquals(expected, Color.fromHex("#f00"));
    assertEquals(expected, Color.fromHex("#ff0000"));
    assertEquals(expected, Color.fromHex("ff0000"), "前导 # 可省略");
  }

  @Test
  public void testEightDigitHexCarriesAlpha() {
    Color c = Color.fromHex("#00ff0080");
    assertEquals(0, c.r());
    assertEquals(255, c.g());
    assertEquals(128 / 255.0, c.a(), 1e-12);
  }

  @Test
  public void testHexOutputIsLossless() {
    Color opaque = new Color(18, 52, 86);
    assertEquals("#123456", opaque.toHex());
    assertEquals(opaque, Color.fromHex(opaque.toHex()));

    Color translucent = Color.fromHex("#12345678");
    assertEquals("#12345678", translucent.toHex());
    assertEquals(translucent, Color.fromHex(translucent.toHex()));
  }

  @Test
  public void testKirForm() {
    assertEquals("#ff0000", new Color(255, 0, 0, 1.0).toKir());
    assertEquals("rgba(255, 0, 0, 0.5)", new Color(255, 0, 0, 0.5).toKir());
    assertEquals(new Color(255, 0, 0, 0.5), Color.parse("rgba(255, 0, 0, 0.5)"));
    assertEquals(new Color(1, 2, 3), Color.parse("rgb(1, 2, 3)"));
  }

  @Test
  public void testTinyAlphaUsesPlainDecimal() {
    Color faint = new Color(0, 0, 0, 0.0001);
    assertEquals("rgba(0, 0, 0, 0.0001)", faint.toKir(), "不使用科学计数法");
    assertEquals(faint, Color.parse(faint.toKir()));
    assertEquals("rgba(0, 0, 0, 0)", new Color(0, 0, 0, 0.0).toKir());
    assertEquals(faint, Color.parse("rgba(0, 0, 0, 1.0E-4)"), "兼容指数形式的输入");
  }

  @Test
  public void testInvalidInput() {
    ValidationException length = assertThrows(ValidationException.class, () -> Color.fromHex("#ff00"));
    assertTrue(length.getMessage().contains("#ff00"), "消息应包含原始输入");
    assertThrows(FormatException.class, () -> Color.fromHex("#gg0000"));
    assertThrows(FormatException.class, () -> Color.parse("red"));
    assertThrows(ValidationException.class, () -> new Color(256, 0, 0));
    assertThrows(ValidationException.class, () -> new Color(0, 0, 0, 1.5));
  }
}
