package kryon.kir.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.LayoutField;
import kryon.kir.core.StyleField;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueCodecsTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text);
  }

  @Test
  public void testDimensionWireForm() {
    assertEquals("{\"value\":\"auto\"}", ValueCodecs.encodeDimension(Dimension.auto()).toString());
    assertEquals("{\"value\":\"100px\"}", ValueCodecs.encodeDimension(Dimension.px(100)).toString());
    assertEquals("{\"value\":\"33.5%\"}", ValueCodecs.encodeDimension(Dimension.percent(33.5)).toString());
  }

  @Test
  public void testDimensionRoundTrip() {
    for (Dimension d : List.of(Dimension.auto(), Dimension.px(0), Dimension.px(100), Dimension.percent(50), Dimension.percent(33.5))) {
      assertEquals(d, ValueCodecs.decodeDimension(ValueCodecs.encodeDimension(d)), "往返失败: " + d);
    }
  }

  @Test
  public void testDimensionLenientForms() throws Exception {
    assertEquals(Dimension.px(12), ValueCodecs.decodeDimension(json("12")));
    assertEquals(Dimension.percent(50), ValueCodecs.decodeDimension(json("\"50%\"")));
    assertEquals(Dimension.px(8), ValueCodecs.decodeDimension(json("{\"value\": 8}")));
    assertThrows(FormatException.class, () -> ValueCodecs.decodeDimension(json("true")));
    assertThrows(FormatException.class, () -> ValueCodecs.decodeDimension(json("{\"unit\": \"px\"}")));
  }

  @Test
  public void testColorForms() throws Exception {
    assertEquals("#ff0000", ValueCodecs.encodeColor(new Color(255, 0, 0)));
    assertEquals(new Color(255, 0, 0, 0.5), ValueCodecs.decodeColor(json("\"rgba(255, 0, 0, 0.5)\"")));
    assertEquals(new Color(1, 2, 3, 1.0), ValueCodecs.decodeColor(json("{\"r\": 1, \"g\": 2, \"b\": 3, \"a\": 255}")));
    assertThrows(FormatException.class, () -> ValueCodecs.decodeColor(json("42")));
  }

  @Test
  public void testNumbersAreWrittenAsIntegersWhenIntegral() {
    assertTrue(ValueCodecs.encodeNumber(16.0).isInt());
    assertEquals("16", ValueCodecs.encodeNumber(16.0).toString());
    assertEquals("1.5", ValueCodecs.encodeNumber(1.5).toString());
  }

  @Test
  public void testFieldDecodingChecksShape() throws Exception {
    assertEquals(8.0, ValueCodecs.decodeField(LayoutField.GAP, json("8")));
    assertEquals("row", ValueCodecs.decodeField(LayoutField.FLEX_DIRECTION, json("\"row\"")));
    assertEquals(Boolean.FALSE, ValueCodecs.decodeField(StyleField.VISIBLE, json("false")));
    assertThrows(FormatException.class, () -> ValueCodecs.decodeField(StyleField.VISIBLE, json("\"yes\"")));
    assertThrows(FormatException.class, () -> ValueCodecs.decodeField(LayoutField.GAP, json("[1]")));
  }

  @Test
  public void testAttributeValuesSurviveJson() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("name", "x");
    nested.put("count", 3);
    nested.put("big", 5_000_000_000L);
    nested.put("ratio", 0.25);
    nested.put("flags", Arrays.asList(true, null, "s"));
    Object back = ValueCodecs.fromJson(ValueCodecs.toJson(nested));
    assertEquals(nested, back);
  }
}
