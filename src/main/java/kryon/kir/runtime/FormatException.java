package kryon.kir.runtime;

/**
 * 文本或文档无法解析：尺寸/颜色字符串不可识别、JSON 损坏、节点结构不符合 KIR 格式。
 */
public final class FormatException extends KirException {
  private static final long serialVersionUID = 1L;

  public FormatException(String message) { super(message); }
  public FormatException(String message, Throwable cause) { super(message, cause); }
}
