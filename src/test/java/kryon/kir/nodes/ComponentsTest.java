package kryon.kir.nodes;

import kryon.kir.core.Layout;
import kryon.kir.core.Node;
import kryon.kir.runtime.ValidationException;
import kryon.kir.types.NodeKind;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Components 构造器测试：必需属性、参数校验以及从属性包重建。
 */
public class ComponentsTest {

  @Test
  public void testEveryKindHasAConstructor() {
    assertEquals(NodeKind.values().length, Components.recipes().size());
    for (NodeKind kind : NodeKind.values()) {
      Components.Recipe recipe = Components.recipe(kind);
      assertNotNull(recipe, "缺少构造器: " + kind);
      assertSame(kind, recipe.kind());
    }
  }

  @Test
  public void testSeededAttributes() {
    assertEquals(Map.of("text_content", "Hello"), Components.text("Hello").attributes());
    assertEquals(Map.of("title", "OK"), Components.button("OK").attributes());
    assertEquals(Map.of("width", 300, "height", 150), Components.canvas().attributes());
    assertEquals(Map.of("text", "Title", "level", 2), Components.heading("Title", 2).attributes());
    assertEquals(Map.of("component_name", "Card"), Components.custom("Card").attributes());
    assertEquals(Map.of("item_name", "item"), Components.forEach(null, "item").attributes());
    assertEquals(Map.of("id", "A", "label", "Start"), Components.flowchartNode("A", "Start").attributes());
    assertTrue(Components.strong("").attributes().isEmpty(), "空文本不写入");
    assertEquals(Map.of("checked", true, "label", "Agree"), Components.checkbox(true, "Agree").attributes());
    assertEquals(Map.of("options", List.of("a", "b"), "selected_index", 1),
        Components.dropdown(List.of("a", "b"), 1).attributes());
  }

  @Test
  public void testButtonWithHandlerAddsClickEvent() {
    Node button = Components.button("Save", "onSave");
    assertEquals(1, button.events().size());
    assertEquals("click", button.events().get(0).type());
    assertEquals("onSave", button.events().get(0).handler());
  }

  @Test
  public void testLayoutContainers() {
    assertEquals("row", Components.row().layout().flexDirection());
    assertEquals("column", Components.column().layout().flexDirection());
    Layout layout = Components.row(8.0, "space-between", null).layout();
    assertEquals(Double.valueOf(8), layout.gap());
    assertEquals("space-between", layout.justifyContent());
    assertNull(layout.alignItems());
    assertEquals(new Layout().justifyContent("center").alignItems("center"), Components.center().layout());
  }

  @TestFactory
  public Stream<DynamicTest> headingLevels() {
    return Stream.of(1, 2, 3, 4, 5, 6).map(level -> DynamicTest.dynamicTest("H" + level, () -> {
      Node h = Components.heading("Title", level);
      assertEquals(level, h.attribute("level"));
      assertEquals("Title", h.attribute("text"));
    }));
  }

  @Test
  public void testHeadingLevelOutOfRange() {
    ValidationException e = assertThrows(ValidationException.class, () -> Components.heading("Title", 7));
    assertTrue(e.getMessage().contains("got 7"), "消息应包含越界的级别");
    assertThrows(ValidationException.class, () -> Components.heading("Title", 0));
  }

  @Test
  public void testReconstructMatchesBagExactly() {
    Map<String, Object> bag = new LinkedHashMap<>();
    bag.put("text", "Intro");
    bag.put("level", 3);
    bag.put("anchor", "intro");
    Node h = Components.reconstruct(NodeKind.HEADING, bag);
    assertEquals(bag, h.attributes());

    Node canvas = Components.reconstruct(NodeKind.CANVAS, Map.of("width", 640));
    assertEquals(Map.of("width", 640), canvas.attributes(), "构造器的缺省值不应泄漏到结果中");

    Node row = Components.reconstruct(NodeKind.ROW, Map.of());
    assertNull(row.layout(), "布局由调用方设置");
  }

  @Test
  public void testReconstructRunsKindValidation() {
    assertThrows(ValidationException.class, () -> Components.reconstruct(NodeKind.HEADING, Map.of("text", "x", "level", 9)));
  }

  @Test
  public void testCoerce() {
    Components.Param level = new Components.Param("level", Integer.class, 1);
    assertEquals(2, Components.coerce(level, 2.0));
    assertEquals(4, Components.coerce(level, "4"));
    assertEquals(1, Components.coerce(level, "four"));
    assertEquals(1, Components.coerce(level, null));
    Components.Param text = new Components.Param("text", String.class, "");
    assertEquals("5", Components.coerce(text, 5));
    assertEquals("", Components.coerce(text, Arrays.asList(1)));
  }

  @Test
  public void testGenericCreate() {
    Node n = Components.create(NodeKind.SPRITE, Map.of("src", "a.png", "frame", 2));
    assertSame(NodeKind.SPRITE, n.kind());
    assertEquals(Map.of("src", "a.png", "frame", 2), n.attributes());
    assertTrue(Components.create(NodeKind.TEXT).attributes().isEmpty());
  }
}
