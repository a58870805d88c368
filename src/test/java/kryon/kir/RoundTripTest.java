package kryon.kir;

import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.Layout;
import kryon.kir.core.Node;
import kryon.kir.core.Style;
import kryon.kir.nodes.Components;
import kryon.kir.types.NodeKind;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * encode → decode → encode 往返测试。
 */
public class RoundTripTest {

  private final KirEncoder encoder = new KirEncoder("java");
  private final KirDecoder decoder = new KirDecoder();

  private Node roundTrip(Node root) {
    return decoder.decode(encoder.encode(root));
  }

  private static Node sample() {
    return Components.column(12.0, "start", "stretch")
        .setStyle(new Style()
            .width(Dimension.percent(100))
            .height(Dimension.auto())
            .minWidth(Dimension.px(320))
            .backgroundColor(Color.fromHex("#202020"))
            .borderColor(new Color(10, 20, 30, 0.25))
            .borderRadius(4.5)
            .fontFamily("Inter")
            .visible(true))
        .attachChildren(
            Components.heading("Dashboard", 2),
            Components.row().attachChildren(
                Components.text("left").setAttribute("custom_data", Map.of("k", List.of(1, 2))),
                Components.image("logo.png", 64, 64)),
            Components.tabGroup(1).attachChildren(
                Components.tabBar().attachChild(Components.tab("One")),
                Components.tabContent().attachChild(Components.tabPanel("One").attachChild(Components.markdown("# hi")))),
            Components.modal(true, "Confirm").setLayout(new Layout().gap(2).putExtra("grid_area", "main")),
            Components.flowchart().attachChildren(
                Components.flowchartNode("A", "Start"),
                Components.flowchartEdge("A", "B", null)),
            Components.button("Submit", "onSubmit"));
  }

  @Test
  public void testDecodeOfEncodeReproducesTheTree() {
    Node original = sample();
    Node decoded = roundTrip(original);
    assertTrue(original.sameStructure(decoded), "结构应完全一致");

    // ids 按先序从 1 开始
    List<Long> ids = new ArrayList<>();
    collectIds(decoded, ids);
    for (int i = 0; i < ids.size(); i++) {
      assertEquals(Long.valueOf(i + 1), ids.get(i));
    }
  }

  @Test
  public void testEncodeIsIdempotent() {
    Node original = sample();
    String first = encoder.encodeToString(original, false);
    String second = encoder.encodeToString(decoder.decode(first), false);
    assertEquals(first, second);
  }

  @TestFactory
  public Stream<DynamicTest> everyKindRoundTrips() {
    return Arrays.stream(NodeKind.values()).map(kind -> DynamicTest.dynamicTest(kind.toWireName(), () -> {
      Components.Recipe recipe = Components.recipe(kind);
      Object[] args = recipe.params().stream().map(Components.Param::defaultValue).toArray();
      Node node = recipe.build(args);
      Node decoded = roundTrip(node);
      assertSame(kind, decoded.kind());
      assertTrue(node.sameStructure(decoded), "往返失败: " + kind);
    }));
  }

  @Test
  public void testHeadingLevelsRoundTrip() {
    for (int level = 1; level <= 6; level++) {
      Node decoded = roundTrip(Components.heading("T" + level, level));
      assertEquals("T" + level, decoded.attribute("text"));
      assertEquals(level, decoded.attribute("level"));
    }
  }

  @Test
  public void testTranslucentColorSurvives() {
    Color c = new Color(255, 0, 0, 0.5);
    Node decoded = roundTrip(Components.container().setStyle(new Style().color(c)));
    assertEquals(c, decoded.style().color());
  }

  @Test
  public void testTinyAlphaSurvives() {
    Color faint = new Color(0, 0, 0, 0.0001);
    Node original = Components.container().setStyle(new Style().backgroundColor(faint));
    Node decoded = decoder.decode(encoder.encodeToString(original));
    assertEquals(faint, decoded.style().backgroundColor());
  }

  @Test
  public void testNumericAttributesKeepTheirValueAcrossTheWire() {
    Node original = Components.container()
        .setAttribute("count", 5L)
        .setAttribute("big", 5_000_000_000L)
        .setAttribute("ratio", 0.25f)
        .setAttribute("nested", List.of(1L, 2L));
    assertEquals(5, original.attribute("count"), "int 范围内的整数统一为 Integer");
    assertEquals(5_000_000_000L, original.attribute("big"));

    Node decoded = roundTrip(original);
    assertTrue(original.sameStructure(decoded), "数字属性往返后应相等");
    assertEquals(original.attributes(), decoded.attributes());
  }

  @Test
  public void testDimensionAndColorAttributesRoundTrip() {
    Node original = Components.image("a.png", Dimension.px(64), Dimension.percent(50))
        .setAttribute("tint", new Color(255, 0, 0, 0.5));
    assertEquals(Map.of("value", "64px"), original.attribute("width"), "尺寸属性按线上形式保存");
    assertEquals("rgba(255, 0, 0, 0.5)", original.attribute("tint"));

    Node decoded = roundTrip(original);
    assertTrue(original.sameStructure(decoded), "尺寸与颜色属性往返后应相等");
  }

  @Test
  public void testUnknownWidgetSurvivesReEncoding() throws Exception {
    String original = KirDecoderTest.resource("future_widget.kir");
    Node decoded = decoder.decode(original);
    Node again = roundTrip(decoded);
    assertTrue(decoded.sameTree(again));
    assertEquals("1px solid", again.style().extras().get("outline"));
  }

  private static void collectIds(Node node, List<Long> out) {
    out.add(node.id());
    for (Node child : node.children()) {
      collectIds(child, out);
    }
  }
}
