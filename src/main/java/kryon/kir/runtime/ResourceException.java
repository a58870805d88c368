package kryon.kir.runtime;

/**
 * 外部协作方（IR 库、文件）无法定位或加载。
 */
public final class ResourceException extends KirException {
  private static final long serialVersionUID = 1L;

  public ResourceException(String message) { super(message); }
  public ResourceException(String message, Throwable cause) { super(message, cause); }
}
