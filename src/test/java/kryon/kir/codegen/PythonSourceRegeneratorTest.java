package kryon.kir.codegen;

import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.Node;
import kryon.kir.core.Style;
import kryon.kir.nodes.Components;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PythonSourceRegeneratorTest {

  private final PythonSourceRegenerator generator = new PythonSourceRegenerator();

  @Test
  public void testTreeShape() {
    Node root = Components.column()
        .setStyle(new Style().width(Dimension.percent(100)).backgroundColor(new Color(255, 0, 0, 0.5)))
        .attachChildren(
            Components.row().attachChildren(Components.text("Hello"), Components.text("World")),
            Components.button("Go", "onGo"));
    String code = generator.generate(root);

    assertTrue(code.startsWith("import kryon\nfrom kryon.dsl import (\n"));
    assertTrue(code.contains("    Text, Button, Row, Column,\n"), "只导入用到的组件：\n" + code);
    assertTrue(code.contains("from kryon.dsl import Style, Layout, Color\n"));
    assertTrue(code.contains(
        "app = Column(style=Style(width={\"value\": \"100%\"}, background_color=\"rgba(255, 0, 0, 0.5)\"), "
            + "layout=Layout(flex_direction=\"column\"))\n"));
    assertTrue(code.contains("    app_child_0 = Row(layout=Layout(flex_direction=\"row\"))\n"));
    assertTrue(code.contains("        app_child_0_child_0 = Text(text_content=\"Hello\")\n"));
    assertTrue(code.contains("        app_child_0.add_child(app_child_0_child_1)\n"));
    assertTrue(code.contains("    app.add_child(app_child_0)\n"));
    assertTrue(code.contains("    app_child_1 = Button(title=\"Go\")\n    app_child_1.on(\"click\", \"onGo\")\n"));
    assertTrue(code.endsWith("    app.add_child(app_child_1)\n"));
  }

  @Test
  public void testPythonLiterals() {
    Node node = Components.container()
        .setAttribute("flags", Arrays.asList(true, false, null))
        .setAttribute("ratio", 0.5)
        .setAttribute("count", 3)
        .setAttribute("meta", Map.of("k", "v"));
    String code = generator.generate(node);
    assertTrue(code.contains("app = Container(flags=[True, False, None], ratio=0.5, count=3, meta={\"k\": \"v\"})"), code);
  }

  @Test
  public void testCustomComponentClassName() {
    String code = generator.generate(Components.custom("Card"));
    assertTrue(code.contains("app = CustomComponent(component_name=\"Card\")"));
  }

  @Test
  public void testMultilineStringsUseTripleQuotes() {
    assertEquals("\"\"\"a\nb\"\"\"", PythonSourceRegenerator.pythonString("a\nb"));
    assertEquals("\"say \\\"hi\\\"\"", PythonSourceRegenerator.pythonString("say \"hi\""));
  }
}
