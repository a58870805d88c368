package kryon.kir.nodes;

import kryon.kir.core.Layout;
import kryon.kir.core.Node;
import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.ValidationException;
import kryon.kir.types.NodeKind;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 组件构造器注册表 - 每种 NodeKind 一个 DSL 构造器
 *
 * 构造器负责为节点填入该类型必需的属性（内部键名），例如 Text 的 {@code text_content}、
 * Heading 的 {@code text} 与 {@code level}。注册表同时记录每个构造器的参数键名，
 * 解码器据此从属性包中取出参数重建节点，代码生成器据此输出对应的构造调用。
 */
public final class Components {

  /**
   * 组件工厂：按 {@link Recipe#params()} 的顺序接收参数。
   */
  @FunctionalInterface
  public interface ComponentFactory {
    Node build(Object[] args);
  }

  /**
   * 构造器参数：内部键名、参数类型与缺省值。
   */
  public record Param(String key, Class<?> type, Object defaultValue) {}

  /**
   * 构造器定义（DSL 方法名 + 参数列表 + 工厂）。
   */
  public static final class Recipe {
    private final NodeKind kind;
    private final String methodName;
    private final List<Param> params;
    private final ComponentFactory factory;

    Recipe(NodeKind kind, String methodName, List<Param> params, ComponentFactory factory) {
      this.kind = kind;
      this.methodName = methodName;
      this.params = List.copyOf(params);
      this.factory = factory;
    }

    public NodeKind kind() {
      return kind;
    }

    /** {@link Components} 中对应的静态方法名。 */
    public String methodName() {
      return methodName;
    }

    public List<Param> params() {
      return params;
    }

    public Node build(Object... args) {
      if (args.length != params.size()) {
        throw new IllegalArgumentException(methodName + ": expected " + params.size() + " args, got " + args.length);
      }
      return factory.build(args);
    }
  }

  private static final Map<NodeKind, Recipe> REGISTRY = new EnumMap<>(NodeKind.class);

  static {
    // === Basic UI ===
    register(NodeKind.CONTAINER, "container", List.of(), args -> container());
    register(NodeKind.TEXT, "text", List.of(str("text_content")), args -> text((String) args[0]));
    register(NodeKind.BUTTON, "button", List.of(str("title")), args -> button((String) args[0]));
    register(NodeKind.INPUT, "input", List.of(str("placeholder"), str("value")),
        args -> input((String) args[0], (String) args[1]));
    register(NodeKind.CHECKBOX, "checkbox", List.of(bool("checked", false), str("label")),
        args -> checkbox((Boolean) args[0], (String) args[1]));
    register(NodeKind.DROPDOWN, "dropdown", List.of(new Param("options", List.class, List.of()), integer("selected_index", 0)),
        args -> dropdown(stringList(args[0]), (Integer) args[1]));
    register(NodeKind.TEXTAREA, "textarea", List.of(str("placeholder"), str("value")),
        args -> textarea((String) args[0], (String) args[1]));

    // === Layout ===
    register(NodeKind.ROW, "row", List.of(), args -> row());
    register(NodeKind.COLUMN, "column", List.of(), args -> column());
    register(NodeKind.CENTER, "center", List.of(), args -> center());

    // === Display ===
    register(NodeKind.IMAGE, "image", List.of(str("src")), args -> image((String) args[0]));
    register(NodeKind.CANVAS, "canvas", List.of(any("width", 300), any("height", 150)),
        args -> canvas(args[0], args[1]));
    register(NodeKind.NATIVE_CANVAS, "nativeCanvas", List.of(any("width", 300), any("height", 150)),
        args -> nativeCanvas(args[0], args[1]));
    register(NodeKind.MARKDOWN, "markdown", List.of(str("content")), args -> markdown((String) args[0]));
    register(NodeKind.SPRITE, "sprite", List.of(str("src")), args -> sprite((String) args[0]));

    // === Tabs ===
    register(NodeKind.TAB_GROUP, "tabGroup", List.of(integer("selected_index", 0)), args -> tabGroup((Integer) args[0]));
    register(NodeKind.TAB_BAR, "tabBar", List.of(), args -> tabBar());
    register(NodeKind.TAB, "tab", List.of(str("title")), args -> tab((String) args[0]));
    register(NodeKind.TAB_CONTENT, "tabContent", List.of(), args -> tabContent());
    register(NodeKind.TAB_PANEL, "tabPanel", List.of(str("title")), args -> tabPanel((String) args[0]));

    // === Overlay ===
    register(NodeKind.MODAL, "modal", List.of(bool("is_open", false), str("title")),
        args -> modal((Boolean) args[0], (String) args[1]));

    // === Tables ===
    register(NodeKind.TABLE, "table", List.of(), args -> table());
    register(NodeKind.TABLE_HEAD, "tableHead", List.of(), args -> tableHead());
    register(NodeKind.TABLE_BODY, "tableBody", List.of(), args -> tableBody());
    register(NodeKind.TABLE_FOOT, "tableFoot", List.of(), args -> tableFoot());
    register(NodeKind.TABLE_ROW, "tableRow", List.of(), args -> tableRow());
    register(NodeKind.TABLE_CELL, "tableCell", List.of(), args -> tableCell());
    register(NodeKind.TABLE_HEADER_CELL, "tableHeaderCell", List.of(), args -> tableHeaderCell());

    // === Markdown blocks ===
    register(NodeKind.HEADING, "heading", List.of(str("text"), integer("level", 1)),
        args -> heading((String) args[0], (Integer) args[1]));
    register(NodeKind.PARAGRAPH, "paragraph", List.of(str("text_content")), args -> paragraph((String) args[0]));
    register(NodeKind.BLOCKQUOTE, "blockquote", List.of(str("text_content")), args -> blockquote((String) args[0]));
    register(NodeKind.CODE_BLOCK, "codeBlock", List.of(str("code"), str("language")),
        args -> codeBlock((String) args[0], (String) args[1]));
    register(NodeKind.HORIZONTAL_RULE, "horizontalRule", List.of(), args -> horizontalRule());
    register(NodeKind.LIST, "list", List.of(bool("ordered", false), integer("start", 1)),
        args -> list((Boolean) args[0], (Integer) args[1]));
    register(NodeKind.LIST_ITEM, "listItem", List.of(str("text_content")), args -> listItem((String) args[0]));
    register(NodeKind.LINK, "link", List.of(str("text_content"), str("url")),
        args -> link((String) args[0], (String) args[1]));

    // === Inline ===
    register(NodeKind.SPAN, "span", List.of(), args -> span());
    register(NodeKind.STRONG, "strong", List.of(str("text_content")), args -> strong((String) args[0]));
    register(NodeKind.EM, "em", List.of(str("text_content")), args -> em((String) args[0]));
    register(NodeKind.CODE_INLINE, "codeInline", List.of(str("text_content")), args -> codeInline((String) args[0]));
    register(NodeKind.SMALL, "small", List.of(str("text_content")), args -> small((String) args[0]));
    register(NodeKind.MARK, "mark", List.of(str("text_content")), args -> mark((String) args[0]));

    // === Template / flow control ===
    register(NodeKind.CUSTOM, "custom", List.of(new Param("component_name", String.class, "Custom")),
        args -> custom((String) args[0]));
    register(NodeKind.STATIC_BLOCK, "staticBlock", List.of(), args -> staticBlock());
    register(NodeKind.FOR_LOOP, "forLoop", List.of(), args -> forLoop());
    register(NodeKind.FOR_EACH, "forEach", List.of(str("items"), new Param("item_name", String.class, "item")),
        args -> forEach((String) args[0], (String) args[1]));
    register(NodeKind.VAR_DECL, "varDecl", List.of(), args -> varDecl());
    register(NodeKind.PLACEHOLDER, "placeholder", List.of(str("name")), args -> placeholder((String) args[0]));

    // === Flowchart ===
    register(NodeKind.FLOWCHART, "flowchart", List.of(), args -> flowchart());
    register(NodeKind.FLOWCHART_NODE, "flowchartNode", List.of(str("id"), str("label")),
        args -> flowchartNode((String) args[0], (String) args[1]));
    register(NodeKind.FLOWCHART_EDGE, "flowchartEdge", List.of(str("from"), str("to"), str("label")),
        args -> flowchartEdge((String) args[0], (String) args[1], (String) args[2]));
    register(NodeKind.FLOWCHART_SUBGRAPH, "flowchartSubgraph", List.of(str("id")), args -> flowchartSubgraph((String) args[0]));
    register(NodeKind.FLOWCHART_LABEL, "flowchartLabel", List.of(str("text")), args -> flowchartLabel((String) args[0]));

    for (NodeKind kind : NodeKind.values()) {
      if (!REGISTRY.containsKey(kind)) {
        throw new ExceptionInInitializerError("No constructor registered for " + kind);
      }
    }
  }

  private Components() {
    // 工具类，禁止实例化
  }

  private static void register(NodeKind kind, String methodName, List<Param> params, ComponentFactory factory) {
    REGISTRY.put(kind, new Recipe(kind, methodName, params, factory));
  }

  public static Recipe recipe(NodeKind kind) {
    return REGISTRY.get(kind);
  }

  // === 通用路径 ===

  /**
   * 通用构造：只设置类型，不填充任何属性。
   */
  public static Node create(NodeKind kind) {
    return new Node(kind);
  }

  /**
   * 通用属性包构造。
   */
  public static Node create(NodeKind kind, Map<String, ?> attributes) {
    return new Node(kind).putAttributes(attributes);
  }

  /**
   * 按类型从属性包重建节点。
   *
   * 先从属性包中按内部键名取出构造器参数并调用类型专属构造器（因此会执行相同的校验，
   * 如标题级别检查），再用属性包替换构造器填入的属性，
   * 重建后的属性与属性包完全一致（包括键的顺序）。构造器设置的布局会被清除，由调用方决定是否设置。
   *
   * @throws ValidationException 参数不合法（例如标题级别不在 1..6）
   */
  public static Node reconstruct(NodeKind kind, Map<String, ?> attributes) {
    Recipe recipe = REGISTRY.get(kind);
    Object[] args = new Object[recipe.params.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = coerce(recipe.params.get(i), attributes.get(recipe.params.get(i).key()));
    }
    Node node = recipe.factory.build(args);
    // 清空后按属性包的顺序重新写入，保证往返后键的顺序不变
    for (String seeded : new ArrayList<>(node.attributes().keySet())) {
      node.removeAttribute(seeded);
    }
    node.putAttributes(attributes);
    node.setLayout(null);
    return node;
  }

  /**
   * 取出构造器参数的值：缺失或类型不符时使用缺省值。
   *
   * @throws ValidationException 整数参数带小数部分或超出 int 范围
   */
  public static Object coerce(Param param, Object value) {
    if (value == null) {
      return param.defaultValue();
    }
    Class<?> type = param.type();
    if (type == Object.class || type.isInstance(value)) {
      return value;
    }
    if (type == Integer.class) {
      if (value instanceof Number n) return exactInt(param, n);
      if (value instanceof String s) {
        BigDecimal parsed;
        try {
          parsed = new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
          return param.defaultValue();
        }
        return exactInt(param, parsed);
      }
    }
    if (type == Boolean.class && value instanceof String s) {
      return Boolean.parseBoolean(s);
    }
    if (type == String.class && (value instanceof Number || value instanceof Boolean)) {
      return String.valueOf(value);
    }
    return param.defaultValue();
  }

  // === Basic UI ===

  public static Node container() {
    return new Node(NodeKind.CONTAINER);
  }

  public static Node text(String content) {
    return new Node(NodeKind.TEXT).setAttribute("text_content", nullToEmpty(content));
  }

  public static Node button(String title) {
    return new Node(NodeKind.BUTTON).setAttribute("title", nullToEmpty(title));
  }

  /**
   * 带点击处理函数的按钮，等价于 {@code button(title).addEvent("click", onClick)}。
   */
  public static Node button(String title, String onClick) {
    Node node = button(title);
    if (onClick != null && !onClick.isEmpty()) {
      node.addEvent("click", onClick);
    }
    return node;
  }

  public static Node input(String placeholder, String value) {
    Node node = new Node(NodeKind.INPUT);
    putIfNotEmpty(node, "placeholder", placeholder);
    putIfNotEmpty(node, "value", value);
    return node;
  }

  public static Node checkbox(boolean checked, String label) {
    Node node = new Node(NodeKind.CHECKBOX).setAttribute("checked", checked);
    putIfNotEmpty(node, "label", label);
    return node;
  }

  public static Node dropdown(List<String> options, int selectedIndex) {
    Node node = new Node(NodeKind.DROPDOWN);
    if (options != null && !options.isEmpty()) {
      node.setAttribute("options", new ArrayList<>(options));
    }
    return node.setAttribute("selected_index", selectedIndex);
  }

  public static Node textarea(String placeholder, String value) {
    Node node = new Node(NodeKind.TEXTAREA);
    putIfNotEmpty(node, "placeholder", placeholder);
    putIfNotEmpty(node, "value", value);
    return node;
  }

  // === Layout ===

  public static Node row() {
    return row(null, null, null);
  }

  /**
   * 水平布局容器（flex-direction: row），可选 gap / justify_content / align_items。
   */
  public static Node row(Double gap, String justifyContent, String alignItems) {
    return flex(NodeKind.ROW, "row", gap, justifyContent, alignItems);
  }

  public static Node column() {
    return column(null, null, null);
  }

  public static Node column(Double gap, String justifyContent, String alignItems) {
    return flex(NodeKind.COLUMN, "column", gap, justifyContent, alignItems);
  }

  public static Node center() {
    Layout layout = new Layout().justifyContent("center").alignItems("center");
    return new Node(NodeKind.CENTER).setLayout(layout);
  }

  private static Node flex(NodeKind kind, String direction, Double gap, String justifyContent, String alignItems) {
    Layout layout = new Layout().flexDirection(direction);
    if (gap != null) layout.gap(gap);
    if (justifyContent != null) layout.justifyContent(justifyContent);
    if (alignItems != null) layout.alignItems(alignItems);
    return new Node(kind).setLayout(layout);
  }

  // === Display ===

  public static Node image(String src) {
    return new Node(NodeKind.IMAGE).setAttribute("src", nullToEmpty(src));
  }

  public static Node image(String src, Object width, Object height) {
    Node node = image(src);
    if (width != null) node.setAttribute("width", width);
    if (height != null) node.setAttribute("height", height);
    return node;
  }

  public static Node canvas() {
    return canvas(300, 150);
  }

  public static Node canvas(Object width, Object height) {
    return new Node(NodeKind.CANVAS).setAttribute("width", width).setAttribute("height", height);
  }

  public static Node nativeCanvas() {
    return nativeCanvas(300, 150);
  }

  public static Node nativeCanvas(Object width, Object height) {
    return new Node(NodeKind.NATIVE_CANVAS).setAttribute("width", width).setAttribute("height", height);
  }

  public static Node markdown(String content) {
    return new Node(NodeKind.MARKDOWN).setAttribute("content", nullToEmpty(content));
  }

  public static Node sprite(String src) {
    return new Node(NodeKind.SPRITE).setAttribute("src", nullToEmpty(src));
  }

  // === Tabs ===

  public static Node tabGroup(int selectedIndex) {
    return new Node(NodeKind.TAB_GROUP).setAttribute("selected_index", selectedIndex);
  }

  public static Node tabBar() {
    return new Node(NodeKind.TAB_BAR);
  }

  public static Node tab(String title) {
    return new Node(NodeKind.TAB).setAttribute("title", nullToEmpty(title));
  }

  public static Node tabContent() {
    return new Node(NodeKind.TAB_CONTENT);
  }

  public static Node tabPanel(String title) {
    return new Node(NodeKind.TAB_PANEL).setAttribute("title", nullToEmpty(title));
  }

  // === Overlay ===

  public static Node modal(boolean isOpen, String title) {
    Node node = new Node(NodeKind.MODAL).setAttribute("is_open", isOpen);
    putIfNotEmpty(node, "title", title);
    return node;
  }

  // === Tables ===

  public static Node table() {
    return new Node(NodeKind.TABLE);
  }

  public static Node tableHead() {
    return new Node(NodeKind.TABLE_HEAD);
  }

  public static Node tableBody() {
    return new Node(NodeKind.TABLE_BODY);
  }

  public static Node tableFoot() {
    return new Node(NodeKind.TABLE_FOOT);
  }

  public static Node tableRow() {
    return new Node(NodeKind.TABLE_ROW);
  }

  public static Node tableCell() {
    return new Node(NodeKind.TABLE_CELL);
  }

  public static Node tableHeaderCell() {
    return new Node(NodeKind.TABLE_HEADER_CELL);
  }

  // === Markdown blocks ===

  /**
   * 标题（H1-H6）。
   *
   * @throws ValidationException level 不在 1..6
   */
  public static Node heading(String text, int level) {
    if (level < 1 || level > 6) {
      throw new ValidationException(ErrorMessages.headingLevelOutOfRange(level));
    }
    return new Node(NodeKind.HEADING)
        .setAttribute("text", nullToEmpty(text))
        .setAttribute("level", level);
  }

  public static Node paragraph(String text) {
    return new Node(NodeKind.PARAGRAPH).setAttribute("text_content", nullToEmpty(text));
  }

  public static Node blockquote(String text) {
    return new Node(NodeKind.BLOCKQUOTE).setAttribute("text_content", nullToEmpty(text));
  }

  public static Node codeBlock(String code, String language) {
    Node node = new Node(NodeKind.CODE_BLOCK).setAttribute("code", nullToEmpty(code));
    putIfNotEmpty(node, "language", language);
    return node;
  }

  public static Node horizontalRule() {
    return new Node(NodeKind.HORIZONTAL_RULE);
  }

  public static Node list(boolean ordered, int start) {
    return new Node(NodeKind.LIST).setAttribute("ordered", ordered).setAttribute("start", start);
  }

  public static Node listItem(String text) {
    Node node = new Node(NodeKind.LIST_ITEM);
    putIfNotEmpty(node, "text_content", text);
    return node;
  }

  public static Node link(String text, String url) {
    return new Node(NodeKind.LINK)
        .setAttribute("text_content", nullToEmpty(text))
        .setAttribute("url", nullToEmpty(url));
  }

  // === Inline ===

  public static Node span() {
    return new Node(NodeKind.SPAN);
  }

  public static Node strong(String text) {
    return inline(NodeKind.STRONG, text);
  }

  public static Node em(String text) {
    return inline(NodeKind.EM, text);
  }

  public static Node codeInline(String text) {
    return new Node(NodeKind.CODE_INLINE).setAttribute("text_content", nullToEmpty(text));
  }

  public static Node small(String text) {
    return inline(NodeKind.SMALL, text);
  }

  public static Node mark(String text) {
    return inline(NodeKind.MARK, text);
  }

  private static Node inline(NodeKind kind, String text) {
    Node node = new Node(kind);
    putIfNotEmpty(node, "text_content", text);
    return node;
  }

  // === Template / flow control ===

  public static Node custom(String componentName) {
    return new Node(NodeKind.CUSTOM).setAttribute("component_name", componentName == null ? "Custom" : componentName);
  }

  public static Node staticBlock() {
    return new Node(NodeKind.STATIC_BLOCK);
  }

  public static Node forLoop() {
    return new Node(NodeKind.FOR_LOOP);
  }

  public static Node forEach(String items, String itemName) {
    Node node = new Node(NodeKind.FOR_EACH);
    putIfNotEmpty(node, "items", items);
    putIfNotEmpty(node, "item_name", itemName);
    return node;
  }

  public static Node varDecl() {
    return new Node(NodeKind.VAR_DECL);
  }

  public static Node placeholder(String name) {
    return new Node(NodeKind.PLACEHOLDER).setAttribute("name", nullToEmpty(name));
  }

  // === Flowchart ===

  public static Node flowchart() {
    return new Node(NodeKind.FLOWCHART);
  }

  /**
   * 流程图节点。{@code id} 是图中的节点名，与 KIR 节点 id 无关。
   */
  public static Node flowchartNode(String id, String label) {
    return new Node(NodeKind.FLOWCHART_NODE)
        .setAttribute("id", nullToEmpty(id))
        .setAttribute("label", nullToEmpty(label));
  }

  public static Node flowchartEdge(String from, String to, String label) {
    Node node = new Node(NodeKind.FLOWCHART_EDGE)
        .setAttribute("from", nullToEmpty(from))
        .setAttribute("to", nullToEmpty(to));
    putIfNotEmpty(node, "label", label);
    return node;
  }

  public static Node flowchartSubgraph(String id) {
    return new Node(NodeKind.FLOWCHART_SUBGRAPH).setAttribute("id", nullToEmpty(id));
  }

  public static Node flowchartLabel(String text) {
    return new Node(NodeKind.FLOWCHART_LABEL).setAttribute("text", nullToEmpty(text));
  }

  // === 辅助方法 ===

  private static Param str(String key) {
    return new Param(key, String.class, "");
  }

  private static Param bool(String key, boolean defaultValue) {
    return new Param(key, Boolean.class, defaultValue);
  }

  // 不做静默截断：3.7 与 4294967297 都按非法参数处理
  private static int exactInt(Param param, Number n) {
    BigDecimal d;
    if (n instanceof BigDecimal big) {
      d = big;
    } else if (n instanceof Double || n instanceof Float) {
      double v = n.doubleValue();
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new ValidationException(ErrorMessages.invalidIntegerArgument(param.key(), n));
      }
      d = new BigDecimal(v);
    } else {
      d = new BigDecimal(n.toString());
    }
    try {
      return d.intValueExact();
    } catch (ArithmeticException e) {
      throw new ValidationException(ErrorMessages.invalidIntegerArgument(param.key(), n));
    }
  }

  private static Param integer(String key, int defaultValue) {
    return new Param(key, Integer.class, defaultValue);
  }

  private static Param any(String key, Object defaultValue) {
    return new Param(key, Object.class, defaultValue);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  private static void putIfNotEmpty(Node node, String key, String value) {
    if (value != null && !value.isEmpty()) {
      node.setAttribute(key, value);
    }
  }

  private static List<String> stringList(Object value) {
    if (!(value instanceof List<?> raw)) {
      return List.of();
    }
    List<String> out = new ArrayList<>(raw.size());
    for (Object o : raw) {
      out.add(Objects.toString(o, ""));
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * 所有已注册的构造器，按 NodeKind 声明顺序。
   */
  public static Map<NodeKind, Recipe> recipes() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(REGISTRY));
  }
}
