package kryon.kir.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DimensionTest {

  @Test
  public void testParseTextForms() {
    assertSame(Dimension.auto(), Dimension.parse("auto"));
    assertEquals(Dimension.percent(50), Dimension.parse("50%"));
    assertEquals(Dimension.percent(33.5), Dimension.parse("33.5%"));
    assertEquals(Dimension.px(100), Dimension.parse("100px"));
    assertEquals(Dimension.px(12), Dimension.parse("12"), "裸数字视为像素");
    assertEquals(Dimension.opaque("calc(100% - 4px)"), Dimension.parse("calc(100% - 4px)"));
    assertEquals(Dimension.opaque("NaN"), Dimension.parse("NaN"), "NaN 不是普通十进制数");
  }

  @Test
  public void testTextFormUsesIntegerLiteralWhenIntegral() {
    assertEquals("100px", Dimension.px(100).toText());
    assertEquals("0px", Dimension.px(0).toText());
    assertEquals("100%", Dimension.percent(100).toText());
    assertEquals("33.5%", Dimension.percent(33.5).toText());
    assertEquals("auto", Dimension.auto().toText());
    assertEquals("1fr", Dimension.opaque("1fr").toText());
  }

  @Test
  public void testParseIsInverseOfToText() {
    Dimension[] samples = {Dimension.auto(), Dimension.px(0), Dimension.px(100), Dimension.percent(50), Dimension.percent(33.5)};
    for (Dimension d : samples) {
      assertEquals(d, Dimension.parse(d.toText()), "往返失败: " + d);
    }
  }
}
