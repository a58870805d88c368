package kryon.kir.codegen;

import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.EventBinding;
import kryon.kir.core.Node;
import kryon.kir.core.PropertyField;
import kryon.kir.core.PropertyRecord;
import kryon.kir.nodes.Components;
import kryon.kir.runtime.ValidationException;
import kryon.kir.runtime.ValueCodecs;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import javax.lang.model.SourceVersion;

/**
 * 生成可编译的 Java 类，其 {@code public static Node build()} 方法重建输入的组件树。
 *
 * 每个节点优先使用 {@link Components} 中的类型专属构造器（参数取自节点属性），再用
 * {@code setAttribute} / {@code removeAttribute} 修正构造器填入的属性，使重建结果与输入逐项相等。
 */
public final class JavaSourceRegenerator implements SourceRegenerator {

  private static final Logger LOGGER = Logger.getLogger(JavaSourceRegenerator.class.getName());

  public static final String DEFAULT_PACKAGE = "kryon.generated";
  public static final String DEFAULT_CLASS = "KirApp";

  private final String packageName;
  private final String className;

  public JavaSourceRegenerator() {
    this(DEFAULT_PACKAGE, DEFAULT_CLASS);
  }

  /**
   * @param packageName 目标包名；null 或空串表示默认包
   * @param className 目标类名
   */
  public JavaSourceRegenerator(String packageName, String className) {
    if (packageName != null && !packageName.isEmpty() && !SourceVersion.isName(packageName)) {
      throw new IllegalArgumentException("Invalid Java package name: " + packageName);
    }
    if (className == null || !SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
      throw new IllegalArgumentException("Invalid Java class name: " + className);
    }
    this.packageName = packageName == null ? "" : packageName;
    this.className = className;
  }

  @Override
  public String language() {
    return "java";
  }

  public String packageName() {
    return packageName;
  }

  public String className() {
    return className;
  }

  /** 生成类的全限定名。 */
  public String qualifiedName() {
    return packageName.isEmpty() ? className : packageName + "." + className;
  }

  @Override
  public String generate(Node root) {
    Objects.requireNonNull(root, "root");
    Emission em = new Emission();
    SourceWriter body = em.methodBody();
    emitSubtree(em, body, root, "app");
    body.line("return app;");

    SourceWriter out = new SourceWriter("  ");
    if (!packageName.isEmpty()) {
      out.line("package " + packageName + ";").blank();
    }
    out.line("import java.util.ArrayList;");
    out.line("import java.util.Arrays;");
    out.line("import java.util.LinkedHashMap;");
    out.line("import java.util.List;");
    out.line("import java.util.Map;");
    out.line("import kryon.kir.core.Color;");
    out.line("import kryon.kir.core.Dimension;");
    out.line("import kryon.kir.core.Layout;");
    out.line("import kryon.kir.core.Node;");
    out.line("import kryon.kir.core.Style;");
    out.line("import kryon.kir.nodes.Components;");
    out.line("import kryon.kir.types.NodeKind;");
    out.blank();
    out.line("public final class " + className + " {").indent();
    out.line("private " + className + "() {}").blank();
    out.line("public static Node build() {");
    StringBuilder code = new StringBuilder(out.toString()).append(body).append("  }\n");
    for (String part : em.parts) {
      code.append('\n').append(part);
    }
    code.append('\n').append(HELPERS).append("}\n");
    LOGGER.fine("Generated Java source for " + em.nodeCount + " nodes in " + (em.parts.size() + 1) + " methods");
    return code.toString();
  }

  /**
   * 单次生成的状态。单个方法的字节码不能超过 64KB，大树被拆成多个私有静态方法：
   * 行数超过 {@code SUBTREE_LINES} 的子树单独成为 {@code partN()}，
   * 当前方法写满 {@code METHOD_LINES} 行后，剩余的兄弟节点转入 {@code attachPartN(parent)}。
   */
  private static final class Emission {
    final List<String> parts = new ArrayList<>();
    final Map<Node, Integer> weights = new IdentityHashMap<>();
    int partCounter;
    int nodeCount;

    SourceWriter methodBody() {
      SourceWriter w = new SourceWriter("  ");
      w.indent().indent();
      return w;
    }

    String nextPart(String prefix) {
      return prefix + (++partCounter);
    }

    void addPart(String signature, SourceWriter body) {
      parts.add("  " + signature + " {\n" + body + "  }\n");
    }
  }

  static final int METHOD_LINES = 400;
  static final int SUBTREE_LINES = 200;

  private void emitSubtree(Emission em, SourceWriter w, Node node, String var) {
    emitNode(w, node, var);
    em.nodeCount++;

    SourceWriter target = w;
    String continuation = null;
    for (int i = 0; i < node.childCount(); i++) {
      Node child = node.childAt(i);
      String childVar = var + "_child_" + i;
      int weight = weight(child, em);
      boolean separate = weight > SUBTREE_LINES;
      if (target.lineCount() + (separate ? 1 : weight + 1) > METHOD_LINES) {
        if (continuation != null) {
          em.addPart(continuation, target);
        }
        String name = em.nextPart("attachPart");
        target.line(name + "(" + var + ");");
        continuation = "private static void " + name + "(Node " + var + ")";
        target = em.methodBody();
      }
      if (separate) {
        String name = em.nextPart("part");
        SourceWriter part = em.methodBody();
        // 先占位，保证方法按出现顺序输出
        int slot = em.parts.size();
        em.parts.add("");
        emitSubtree(em, part, child, childVar);
        part.line("return " + childVar + ";");
        em.parts.set(slot, "  private static Node " + name + "() {\n" + part + "  }\n");
        target.line(var + ".attachChild(" + name + "());");
      } else {
        emitSubtree(em, target, child, childVar);
        target.line(var + ".attachChild(" + childVar + ");");
      }
    }
    if (continuation != null) {
      em.addPart(continuation, target);
    }
  }

  // 子树内联时占用的行数
  private int weight(Node node, Emission em) {
    Integer cached = em.weights.get(node);
    if (cached != null) {
      return cached;
    }
    SourceWriter scratch = new SourceWriter("");
    emitNode(scratch, node, "x");
    int total = scratch.lineCount();
    for (Node child : node.children()) {
      total += weight(child, em) + 1;
    }
    em.weights.put(node, total);
    return total;
  }

  private static final String HELPERS =
      "  private static List<Object> list(Object... items) {\n"
          + "    return new ArrayList<>(Arrays.asList(items));\n"
          + "  }\n"
          + "\n"
          + "  private static Map<String, Object> map(Object... keyValues) {\n"
          + "    Map<String, Object> m = new LinkedHashMap<>();\n"
          + "    for (int i = 0; i < keyValues.length; i += 2) {\n"
          + "      m.put((String) keyValues[i], keyValues[i + 1]);\n"
          + "    }\n"
          + "    return m;\n"
          + "  }\n";

  private void emitNode(SourceWriter w, Node node, String var) {
    Components.Recipe recipe = Components.recipe(node.kind());
    Node seeded = null;
    String constructor = null;
    if (usesRecipe(recipe, node)) {
      try {
        Object[] args = new Object[recipe.params().size()];
        StringBuilder call = new StringBuilder("Components.").append(recipe.methodName()).append('(');
        for (int i = 0; i < args.length; i++) {
          Components.Param param = recipe.params().get(i);
          args[i] = argValue(param, node.attribute(param.key()));
          if (i > 0) call.append(", ");
          call.append(argLiteral(param, args[i]));
        }
        seeded = recipe.build(args);
        constructor = call.append(')').toString();
      } catch (ValidationException e) {
        LOGGER.fine("Falling back to generic constructor for " + node + ": " + e.getMessage());
        seeded = null;
      }
    }
    if (seeded == null) {
      seeded = Components.create(node.kind());
      constructor = "Components.create(NodeKind." + node.kind().name() + ")";
    }

    w.line("Node " + var + " = " + constructor + ";");
    if (node.hasId()) {
      w.line(var + ".setId(" + node.id() + "L);");
    }
    for (String key : seeded.attributes().keySet()) {
      if (!node.hasAttribute(key)) {
        w.line(var + ".removeAttribute(" + stringLiteral(key) + ");");
      }
    }
    for (Map.Entry<String, Object> e : node.attributes().entrySet()) {
      if (!seeded.hasAttribute(e.getKey()) || !Objects.equals(seeded.attribute(e.getKey()), e.getValue())) {
        w.line(var + ".setAttribute(" + stringLiteral(e.getKey()) + ", " + valueLiteral(e.getValue()) + ");");
      }
    }
    if (node.style() != null && !node.style().isEmpty()) {
      w.line(var + ".setStyle(" + recordExpression("Style", node.style()) + ");");
    }
    if (node.layout() != null && !node.layout().isEmpty()) {
      w.line(var + ".setLayout(" + recordExpression("Layout", node.layout()) + ");");
    } else if (seeded.layout() != null) {
      w.line(var + ".setLayout(null);");
    }
    for (EventBinding ev : node.events()) {
      w.line(var + ".addEvent(" + stringLiteral(ev.type()) + ", " + stringLiteral(ev.handler()) + ");");
    }
  }

  // 没有任何构造参数出现在属性中时，用通用构造器更直观
  private static boolean usesRecipe(Components.Recipe recipe, Node node) {
    if (recipe.params().isEmpty()) {
      return true;
    }
    for (Components.Param p : recipe.params()) {
      if (node.hasAttribute(p.key())) return true;
    }
    return false;
  }

  private static Object argValue(Components.Param param, Object raw) {
    Object value = Components.coerce(param, raw);
    if (param.type() == List.class && value instanceof List<?> items) {
      String[] strings = new String[items.size()];
      for (int i = 0; i < strings.length; i++) {
        strings[i] = Objects.toString(items.get(i), "");
      }
      return List.of(strings);
    }
    return value;
  }

  private static String argLiteral(Components.Param param, Object value) {
    if (param.type() == List.class) {
      List<?> items = (List<?>) value;
      if (items.isEmpty()) return "List.of()";
      StringBuilder sb = new StringBuilder("Arrays.asList(");
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(stringLiteral((String) items.get(i)));
      }
      return sb.append(')').toString();
    }
    if (param.type() == Integer.class) {
      return String.valueOf(value);
    }
    return valueLiteral(value);
  }

  private static <F extends Enum<F> & PropertyField> String recordExpression(String type, PropertyRecord<F, ?> record) {
    StringBuilder sb = new StringBuilder("new ").append(type).append("()");
    for (Map.Entry<F, Object> e : record.presentFields().entrySet()) {
      sb.append('.').append(setterName(e.getKey().key())).append('(').append(fieldLiteral(e.getValue())).append(')');
    }
    for (Map.Entry<String, Object> e : record.extras().entrySet()) {
      sb.append(".putExtra(").append(stringLiteral(e.getKey())).append(", ").append(valueLiteral(e.getValue())).append(')');
    }
    return sb.toString();
  }

  // 内部键名 → 记录上的流式 setter 名（与线上驼峰键名一致）
  private static String setterName(String key) {
    StringBuilder sb = new StringBuilder(key.length());
    boolean upperNext = false;
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (c == '_') {
        upperNext = true;
        continue;
      }
      sb.append(upperNext ? Character.toUpperCase(c) : c);
      upperNext = false;
    }
    return sb.toString();
  }

  private static String fieldLiteral(Object value) {
    if (value instanceof Double d) return doubleLiteral(d);
    return valueLiteral(value);
  }

  static String valueLiteral(Object value) {
    if (value == null) return "(Object) null";
    if (value instanceof String s) return stringLiteral(s);
    if (value instanceof Boolean b) return b.toString();
    if (value instanceof Integer i) return i.toString();
    if (value instanceof Long l) return l + "L";
    if (value instanceof Double d) return "Double.valueOf(" + doubleLiteral(d) + ")";
    if (value instanceof BigInteger big) return "new java.math.BigInteger(" + stringLiteral(big.toString()) + ")";
    if (value instanceof Dimension dim) return dimensionLiteral(dim);
    if (value instanceof Color c) return "new Color(" + c.r() + ", " + c.g() + ", " + c.b() + ", " + doubleLiteral(c.a()) + ")";
    if (value instanceof List<?> items) {
      StringBuilder sb = new StringBuilder("list(");
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(valueLiteral(items.get(i)));
      }
      return sb.append(')').toString();
    }
    if (value instanceof Map<?, ?> map) {
      StringBuilder sb = new StringBuilder("map(");
      boolean first = true;
      for (Map.Entry<?, ?> e : map.entrySet()) {
        if (!first) sb.append(", ");
        sb.append(stringLiteral(String.valueOf(e.getKey()))).append(", ").append(valueLiteral(e.getValue()));
        first = false;
      }
      return sb.append(')').toString();
    }
    // 其它类型先规整为 JSON 兼容值
    return valueLiteral(ValueCodecs.fromJson(ValueCodecs.toJson(value)));
  }

  private static String dimensionLiteral(Dimension dim) {
    if (dim instanceof Dimension.Pixels p) return "Dimension.px(" + doubleLiteral(p.value()) + ")";
    if (dim instanceof Dimension.Percent p) return "Dimension.percent(" + doubleLiteral(p.value()) + ")";
    if (dim instanceof Dimension.Opaque o) return "Dimension.opaque(" + stringLiteral(o.text()) + ")";
    return "Dimension.auto()";
  }

  private static String doubleLiteral(double v) {
    if (Double.isNaN(v)) return "Double.NaN";
    if (Double.isInfinite(v)) return v > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
    if (v == Math.rint(v) && Math.abs(v) <= Integer.MAX_VALUE && !(v == 0.0 && 1 / v < 0)) {
      return Long.toString((long) v);
    }
    return Double.toString(v);
  }

  static String stringLiteral(String s) {
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
          // \\u 转义会在词法分析前展开，控制字符用八进制转义
          if (c < 0x20) {
            sb.append(String.format("\\%03o", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }
}
