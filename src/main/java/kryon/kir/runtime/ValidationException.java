package kryon.kir.runtime;

/**
 * 输入语义不合法：标题级别越界、十六进制颜色长度错误、颜色分量越界、id 越界或重复、非法的树结构。
 */
public final class ValidationException extends KirException {
  private static final long serialVersionUID = 1L;

  public ValidationException(String message) { super(message); }
}
