package kryon.kir.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * KIR 节点类型注册表
 *
 * 封闭的节点类型枚举，以及类型与线上名称之间的双向映射：
 * <ul>
 *   <li>wire name：PascalCase，例如 {@code TableHead}，写入 KIR 文档的 {@code type} 字段</li>
 *   <li>lookup key：小写且去掉下划线，例如 {@code tablehead}，用于宽松查找</li>
 *   <li>code：稳定的数字编码（0..52），与原生 IR 库的类型编号一致</li>
 * </ul>
 * 未知名称不会报错，而是回退到 {@link #FALLBACK}（通用容器），保证新版本文档仍能解析。
 */
public enum NodeKind {
  // Basic UI
  CONTAINER("Container", KindGroup.BASIC),
  TEXT("Text", KindGroup.BASIC),
  BUTTON("Button", KindGroup.BASIC),
  INPUT("Input", KindGroup.BASIC),
  CHECKBOX("Checkbox", KindGroup.BASIC),
  DROPDOWN("Dropdown", KindGroup.BASIC),
  TEXTAREA("Textarea", KindGroup.BASIC),

  // Layout
  ROW("Row", KindGroup.LAYOUT),
  COLUMN("Column", KindGroup.LAYOUT),
  CENTER("Center", KindGroup.LAYOUT),

  // Display
  IMAGE("Image", KindGroup.DISPLAY),
  CANVAS("Canvas", KindGroup.DISPLAY),
  NATIVE_CANVAS("NativeCanvas", KindGroup.DISPLAY),
  MARKDOWN("Markdown", KindGroup.DISPLAY),
  SPRITE("Sprite", KindGroup.DISPLAY),

  // Tabs
  TAB_GROUP("TabGroup", KindGroup.TABS),
  TAB_BAR("TabBar", KindGroup.TABS),
  TAB("Tab", KindGroup.TABS),
  TAB_CONTENT("TabContent", KindGroup.TABS),
  TAB_PANEL("TabPanel", KindGroup.TABS),

  // Overlay
  MODAL("Modal", KindGroup.OVERLAY),

  // Tables
  TABLE("Table", KindGroup.TABLE),
  TABLE_HEAD("TableHead", KindGroup.TABLE),
  TABLE_BODY("TableBody", KindGroup.TABLE),
  TABLE_FOOT("TableFoot", KindGroup.TABLE),
  TABLE_ROW("TableRow", KindGroup.TABLE),
  TABLE_CELL("TableCell", KindGroup.TABLE),
  TABLE_HEADER_CELL("TableHeaderCell", KindGroup.TABLE),

  // Markdown blocks
  HEADING("Heading", KindGroup.MARKDOWN),
  PARAGRAPH("Paragraph", KindGroup.MARKDOWN),
  BLOCKQUOTE("Blockquote", KindGroup.MARKDOWN),
  CODE_BLOCK("CodeBlock", KindGroup.MARKDOWN),
  HORIZONTAL_RULE("HorizontalRule", KindGroup.MARKDOWN),
  LIST("List", KindGroup.MARKDOWN),
  LIST_ITEM("ListItem", KindGroup.MARKDOWN),
  LINK("Link", KindGroup.MARKDOWN),

  // Inline markdown
  SPAN("Span", KindGroup.INLINE),
  STRONG("Strong", KindGroup.INLINE),
  EM("Em", KindGroup.INLINE),
  CODE_INLINE("CodeInline", KindGroup.INLINE),
  SMALL("Small", KindGroup.INLINE),
  MARK("Mark", KindGroup.INLINE),

  // Template / flow-control pseudo nodes
  CUSTOM("Custom", KindGroup.TEMPLATE),
  STATIC_BLOCK("StaticBlock", KindGroup.TEMPLATE),
  FOR_LOOP("ForLoop", KindGroup.TEMPLATE),
  FOR_EACH("ForEach", KindGroup.TEMPLATE),
  VAR_DECL("VarDecl", KindGroup.TEMPLATE),
  PLACEHOLDER("Placeholder", KindGroup.TEMPLATE),

  // Flowchart (diagram) nodes
  FLOWCHART("Flowchart", KindGroup.FLOWCHART),
  FLOWCHART_NODE("FlowchartNode", KindGroup.FLOWCHART),
  FLOWCHART_EDGE("FlowchartEdge", KindGroup.FLOWCHART),
  FLOWCHART_SUBGRAPH("FlowchartSubgraph", KindGroup.FLOWCHART),
  FLOWCHART_LABEL("FlowchartLabel", KindGroup.FLOWCHART);

  /** Kind used for every name the registry does not know. */
  public static final NodeKind FALLBACK = CONTAINER;

  private static final Logger LOGGER = Logger.getLogger(NodeKind.class.getName());

  private static final Map<String, NodeKind> BY_WIRE_NAME;
  private static final Map<String, NodeKind> BY_LOOKUP_KEY;
  private static final NodeKind[] BY_CODE = values();

  static {
    Map<String, NodeKind> byWire = new HashMap<>();
    Map<String, NodeKind> byKey = new HashMap<>();
    for (NodeKind kind : BY_CODE) {
      if (byWire.put(kind.wireName, kind) != null) {
        throw new ExceptionInInitializerError("Duplicate wire name: " + kind.wireName);
      }
      if (byKey.put(kind.lookupKey, kind) != null) {
        throw new ExceptionInInitializerError("Duplicate lookup key: " + kind.lookupKey);
      }
    }
    BY_WIRE_NAME = Collections.unmodifiableMap(byWire);
    BY_LOOKUP_KEY = Collections.unmodifiableMap(byKey);
  }

  private final String wireName;
  private final String lookupKey;
  private final KindGroup group;

  NodeKind(String wireName, KindGroup group) {
    this.wireName = wireName;
    this.lookupKey = wireName.toLowerCase(Locale.ROOT);
    this.group = group;
  }

  /**
   * 返回写入 KIR {@code type} 字段的 PascalCase 名称。
   */
  public String toWireName() {
    return wireName;
  }

  /**
   * 返回宽松查找使用的小写键（无下划线）。
   */
  public String lookupKey() {
    return lookupKey;
  }

  public KindGroup group() {
    return group;
  }

  /**
   * 原生 IR 库使用的数字编码，等于声明顺序。
   */
  public int code() {
    return ordinal();
  }

  /**
   * 精确匹配 wire name；未知名称回退到 {@link #FALLBACK}。
   *
   * @param name KIR 文档中的 type 字段，可为 null
   * @return 对应的节点类型，永不为 null
   */
  public static NodeKind fromWireName(String name) {
    NodeKind kind = name == null ? null : BY_WIRE_NAME.get(name);
    if (kind == null) {
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.fine("Unknown node type '" + name + "', falling back to " + FALLBACK.wireName);
      }
      return FALLBACK;
    }
    return kind;
  }

  /**
   * 宽松匹配：忽略大小写与下划线，例如 {@code "table_head"}、{@code "TABLEHEAD"}、{@code "TableHead"}。
   * 未知名称同样回退到 {@link #FALLBACK}。
   */
  public static NodeKind fromLooseName(String name) {
    if (name == null) {
      return FALLBACK;
    }
    NodeKind kind = BY_LOOKUP_KEY.get(normalizeLoose(name));
    if (kind == null) {
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.fine("No node type matches '" + name + "', falling back to " + FALLBACK.wireName);
      }
      return FALLBACK;
    }
    return kind;
  }

  /**
   * 判断 wire name 是否为已知类型（不触发回退）。
   */
  public static boolean isKnownWireName(String name) {
    return name != null && BY_WIRE_NAME.containsKey(name);
  }

  public static NodeKind fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      throw new IllegalArgumentException("Unknown node type code: " + code);
    }
    return BY_CODE[code];
  }

  private static String normalizeLoose(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '_' || c == '-' || c == ' ') continue;
      sb.append(Character.toLowerCase(c));
    }
    return sb.toString();
  }

  /**
   * 节点类型分组，便于工具按类别筛选。
   */
  public enum KindGroup {
    BASIC,
    LAYOUT,
    DISPLAY,
    TABS,
    OVERLAY,
    TABLE,
    MARKDOWN,
    INLINE,
    TEMPLATE,
    FLOWCHART
  }
}
