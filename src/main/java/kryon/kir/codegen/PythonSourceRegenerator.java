package kryon.kir.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import kryon.kir.core.EventBinding;
import kryon.kir.core.Node;
import kryon.kir.core.PropertyField;
import kryon.kir.core.PropertyRecord;
import kryon.kir.runtime.ValueCodecs;
import kryon.kir.types.NodeKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 生成 Python DSL 形式的源代码：
 *
 * <pre>
 * app = Column(style=Style(width={"value": "100%"}))
 *     app_child_0 = Text(text_content="Hello")
 *     app.add_child(app_child_0)
 * </pre>
 *
 * 属性以关键字参数输出（内部键名），style / layout 输出为 {@code Style(...)} / {@code Layout(...)}，
 * 字段值取 KIR 线上形式。事件输出为 {@code .on(type, handler)} 调用。
 */
public final class PythonSourceRegenerator implements SourceRegenerator {

  private static final String INDENT = "    ";

  @Override
  public String language() {
    return "python";
  }

  @Override
  public String generate(Node root) {
    Objects.requireNonNull(root, "root");
    Set<NodeKind> used = EnumSet.noneOf(NodeKind.class);
    collectKinds(root, used);

    SourceWriter w = new SourceWriter(INDENT);
    w.line("import kryon");
    w.line("from kryon.dsl import (").indent();
    List<String> names = new ArrayList<>();
    for (NodeKind kind : used) {
      names.add(className(kind));
    }
    // 每行最多 6 个名字
    for (int i = 0; i < names.size(); i += 6) {
      w.line(String.join(", ", names.subList(i, Math.min(i + 6, names.size()))) + ",");
    }
    w.dedent().line(")");
    w.line("from kryon.dsl import Style, Layout, Color");
    w.blank();
    emitNode(w, root, "app");
    return w.toString();
  }

  private static void collectKinds(Node node, Set<NodeKind> used) {
    used.add(node.kind());
    for (Node child : node.children()) {
      collectKinds(child, used);
    }
  }

  private static String className(NodeKind kind) {
    return kind == NodeKind.CUSTOM ? "CustomComponent" : kind.toWireName();
  }

  private static void emitNode(SourceWriter w, Node node, String var) {
    List<String> args = new ArrayList<>();
    for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
      args.add(e.getKey() + "=" + pythonLiteral(ValueCodecs.toJson(e.getValue())));
    }
    if (node.style() != null && !node.style().isEmpty()) {
      args.add("style=" + recordCall("Style", node.style()));
    }
    if (node.layout() != null && !node.layout().isEmpty()) {
      args.add("layout=" + recordCall("Layout", node.layout()));
    }
    w.line(var + " = " + className(node.kind()) + "(" + String.join(", ", args) + ")");
    for (EventBinding ev : node.events()) {
      w.line(var + ".on(" + pythonString(ev.type()) + ", " + pythonString(ev.handler()) + ")");
    }
    if (node.childCount() > 0) {
      w.indent();
      for (int i = 0; i < node.childCount(); i++) {
        String childVar = var + "_child_" + i;
        emitNode(w, node.childAt(i), childVar);
        w.line(var + ".add_child(" + childVar + ")");
      }
      w.dedent();
    }
  }

  private static <F extends Enum<F> & PropertyField> String recordCall(String type, PropertyRecord<F, ?> record) {
    List<String> args = new ArrayList<>();
    for (Map.Entry<F, Object> e : record.presentFields().entrySet()) {
      args.add(e.getKey().key() + "=" + pythonLiteral(ValueCodecs.encodeField(e.getKey(), e.getValue())));
    }
    for (Map.Entry<String, Object> e : record.extras().entrySet()) {
      args.add(e.getKey() + "=" + pythonLiteral(ValueCodecs.toJson(e.getValue())));
    }
    return type + "(" + String.join(", ", args) + ")";
  }

  /**
   * JSON 值 → Python 字面量。
   */
  static String pythonLiteral(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return "None";
    if (value.isBoolean()) return value.booleanValue() ? "True" : "False";
    if (value.isIntegralNumber()) return value.bigIntegerValue().toString();
    if (value.isNumber()) {
      double d = value.doubleValue();
      if (Double.isNaN(d)) return "float(\"nan\")";
      if (Double.isInfinite(d)) return d > 0 ? "float(\"inf\")" : "float(\"-inf\")";
      return Double.toString(d).replace("E", "e");
    }
    if (value.isTextual()) return pythonString(value.textValue());
    if (value.isArray()) {
      List<String> items = new ArrayList<>();
      for (JsonNode item : value) {
        items.add(pythonLiteral(item));
      }
      return "[" + String.join(", ", items) + "]";
    }
    if (value.isObject()) {
      List<String> entries = new ArrayList<>();
      Iterator<Map.Entry<String, JsonNode>> it = value.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        entries.add(pythonString(e.getKey()) + ": " + pythonLiteral(e.getValue()));
      }
      return "{" + String.join(", ", entries) + "}";
    }
    return "None";
  }

  static String pythonString(String s) {
    if (s.indexOf('\n') >= 0 && s.indexOf("\"\"\"") < 0 && !s.endsWith("\"") && !s.endsWith("\\")) {
      return "\"\"\"" + s.replace("\\", "\\\\") + "\"\"\"";
    }
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"': sb.append("\\\""); break;
        case '\\': sb.append("\\\\"); break;
        case '\n': sb.append("\\n"); break;
        case '\r': sb.append("\\r"); break;
        case '\t': sb.append("\\t"); break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }
}
