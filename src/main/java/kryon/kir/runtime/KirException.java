package kryon.kir.runtime;

/**
 * KIR 核心层所有异常的基类（非受检）。
 *
 * 核心操作都是对输入的确定性纯函数，因此这里的异常不会被重试，直接交给调用方处理。
 */
public class KirException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public KirException(String message) { super(message); }
  public KirException(String message, Throwable cause) { super(message, cause); }
}
