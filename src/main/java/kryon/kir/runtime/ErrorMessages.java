package kryon.kir.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有错误消息均提供中英文双语描述并附带恢复提示，且总是包含出错的输入值，
 * 方便调用方直接定位问题。英文部分保持稳定，测试只断言英文关键字。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 标题级别越界。
   *
   * @param level 调用方传入的级别
   */
  public static String headingLevelOutOfRange(int level) {
    String english = "Heading level must be between 1 and 6, got " + level;
    String message = bilingual("标题级别必须在 1 到 6 之间，实际为 " + level, english);
    return withHint(message, "使用 1..6 之间的级别", "Use a level in 1..6");
  }

  /**
   * 十六进制颜色长度不在 {3, 6, 8} 中。
   *
   * @param hex 原始输入
   */
  public static String invalidHexColorLength(String hex) {
    String english = "Invalid hex color: '" + hex + "' (expected 3, 6 or 8 hex digits)";
    String message = bilingual("十六进制颜色长度无效：'" + hex + "'", english);
    return withHint(message, "使用 #rgb、#rrggbb 或 #rrggbbaa", "Use #rgb, #rrggbb or #rrggbbaa");
  }

  public static String invalidHexDigits(String hex) {
    String english = "Invalid hex color digits: '" + hex + "'";
    String message = bilingual("十六进制颜色包含非法字符：'" + hex + "'", english);
    return withHint(message, "只使用 0-9 与 a-f", "Only use 0-9 and a-f");
  }

  public static String colorComponentOutOfRange(String component, Object value) {
    String english = "Color component " + component + " out of range: " + value;
    String message = bilingual("颜色分量 " + component + " 越界：" + value, english);
    return withHint(message, "r/g/b 取 0..255，a 取 0.0..1.0", "r/g/b must be 0..255 and a must be 0.0..1.0");
  }

  public static String unparseableColor(String text) {
    String english = "Unparseable color: '" + text + "'";
    String message = bilingual("无法解析的颜色：'" + text + "'", english);
    return withHint(message, "使用十六进制或 rgba(r, g, b, a) 形式", "Use a hex string or rgba(r, g, b, a)");
  }

  public static String unparseableDimension(String text) {
    String english = "Unparseable dimension: " + text;
    String message = bilingual("无法解析的尺寸：" + text, english);
    return withHint(message, "尺寸应为 {\"value\": \"100px\"}、字符串或数字", "A dimension is {\"value\": \"100px\"}, a string or a number");
  }

  public static String malformedDocument(String detail) {
    String english = "Malformed KIR document: " + detail;
    String message = bilingual("KIR 文档格式错误：" + detail, english);
    return withHint(message, "确认输入是合法的 KIR JSON", "Make sure the input is valid KIR JSON");
  }

  public static String malformedNodeField(String field, String expected, String actual) {
    String english = "Malformed node field '" + field + "': expected " + expected + ", got " + actual;
    String message = bilingual("节点字段 '" + field + "' 格式错误：期望 " + expected + "，实际为 " + actual, english);
    return withHint(message, "检查生成该文档的工具版本", "Check the tool that produced the document");
  }

  public static String invalidIntegerArgument(String key, Object value) {
    String english = "Argument '" + key + "' must be an integer within int range, got " + value;
    String message = bilingual("参数 '" + key + "' 必须是 int 范围内的整数，实际为 " + value, english);
    return withHint(message, "去掉小数部分或使用更小的值", "Drop the fraction or use a smaller value");
  }

  public static String reservedDocumentKey(String where, String name) {
    String english = "'" + name + "' is reserved and cannot be used as a " + where + " name";
    String message = bilingual("'" + name + "' 是保留名称，不能用作" + ("section".equals(where) ? "文档段" : "metadata 字段") + "名", english);
    return withHint(message, "改用其它名称，或通过对应的专用方法设置", "Pick another name or use the dedicated setter");
  }

  public static String idOutOfRange(long id) {
    String english = "Node id out of uint32 range: " + id;
    String message = bilingual("节点 id 超出 uint32 范围：" + id, english);
    return withHint(message, "id 必须在 0..4294967295 之间", "Ids must be within 0..4294967295");
  }

  public static String duplicateNodeId(long id) {
    String english = "Duplicate node id: " + id;
    String message = bilingual("节点 id 重复：" + id, english);
    return withHint(message, "清除重复的显式 id，让编码器自动分配", "Clear the duplicate explicit id and let the encoder assign one");
  }

  public static String nodeAlreadyAttached(String child) {
    String english = "Node already has a parent: " + child;
    String message = bilingual("节点已经挂在其他父节点下：" + child, english);
    return withHint(message, "先调用 detachChild 再重新挂载", "Detach the node before attaching it again");
  }

  public static String nodeCycle(String child) {
    String english = "Attaching would create a cycle: " + child;
    String message = bilingual("挂载会形成环：" + child, english);
    return withHint(message, "节点不能成为自身或祖先的子节点", "A node cannot be a child of itself or of its descendants");
  }

  public static String childIndexOutOfBounds(int index, int size) {
    String english = "child index out of bounds: " + index + " (size=" + size + ")";
    String message = bilingual("子节点索引越界：索引 " + index + "，长度 " + size, english);
    return withHint(message, "确认索引满足 0 <= index <= size", "Ensure 0 <= index <= size");
  }

  public static String resourceUnavailable(String what, String detail) {
    String english = what + " is not available: " + detail;
    String message = bilingual(what + " 不可用：" + detail, english);
    return withHint(message, "检查路径与读写权限", "Check the path and file permissions");
  }
}
