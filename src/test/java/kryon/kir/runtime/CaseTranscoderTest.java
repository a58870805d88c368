package kryon.kir.runtime;

import kryon.kir.core.LayoutField;
import kryon.kir.core.StyleField;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CaseTranscoderTest {

  @Test
  public void testOverrideTableWinsInBothDirections() {
    for (Map.Entry<String, String> e : CaseTranscoder.overrides().entrySet()) {
      assertEquals(e.getValue(), CaseTranscoder.encodeKey(e.getKey()));
      assertEquals(e.getKey(), CaseTranscoder.decodeKey(e.getValue()));
      assertTrue(CaseTranscoder.hasOverride(e.getKey()));
    }
    assertEquals(9, CaseTranscoder.overrides().size());
    assertEquals("selectedIndex", CaseTranscoder.encodeKey("selected_index"));
    assertEquals("is_open", CaseTranscoder.decodeKey("isOpen"));
  }

  @Test
  public void testGenericConversion() {
    assertEquals("backgroundColor", CaseTranscoder.encodeKey("background_color"));
    assertEquals("borderTopLeftRadius", CaseTranscoder.encodeKey("border-top-left_radius"));
    assertEquals("width", CaseTranscoder.encodeKey("width"));
    assertEquals("background_color", CaseTranscoder.decodeKey("backgroundColor"));
    assertEquals("foo_url", CaseTranscoder.decodeKey("fooURL"), "连续大写作为一段");
    assertEquals("width", CaseTranscoder.decodeKey("width"));
  }

  @TestFactory
  public Stream<DynamicTest> producedKeysRoundTrip() {
    List<String> keys = new ArrayList<>(CaseTranscoder.overrides().keySet());
    for (StyleField f : StyleField.values()) keys.add(f.key());
    for (LayoutField f : LayoutField.values()) keys.add(f.key());
    keys.addAll(List.of("component_name", "item_name", "url", "level", "from", "custom_data", "is_open"));
    return keys.stream().map(k -> DynamicTest.dynamicTest(k, () -> {
      assertEquals(k, CaseTranscoder.decodeKey(CaseTranscoder.encodeKey(k)));
      assertTrue(CaseTranscoder.isRoundTripSafe(k));
    }));
  }

  @Test
  public void testAmbiguousKeysAreFlagged() {
    assertFalse(CaseTranscoder.isRoundTripSafe("foo__bar"));
    assertFalse(CaseTranscoder.isRoundTripSafe("_private"));
  }
}
