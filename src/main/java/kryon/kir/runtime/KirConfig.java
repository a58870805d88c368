package kryon.kir.runtime;

/**
 * KIR 运行时配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，避免在编码/解码路径上反复调用 System.getenv。
 */
public final class KirConfig {
  private KirConfig() {}

  /**
   * 调试模式开关
   * 环境变量：KRYON_KIR_DEBUG
   * 启用时 CLI 会在 stderr 打印输入路径与命令参数
   */
  public static final boolean DEBUG = System.getenv("KRYON_KIR_DEBUG") != null;

  /**
   * 编码器写入 metadata.language 的默认值
   * 环境变量：KRYON_KIR_LANGUAGE
   * 如果未指定，默认为 "java"
   */
  public static final String DEFAULT_LANGUAGE = getEnvOrDefault("KRYON_KIR_LANGUAGE", "java");

  /**
   * 默认是否缩进输出
   * 环境变量：KRYON_KIR_PRETTY
   */
  public static final boolean PRETTY = System.getenv("KRYON_KIR_PRETTY") != null;

  /**
   * 严格键名模式
   * 环境变量：KRYON_KIR_STRICT_KEYS
   * 启用时，无法保证可逆的通用键名转换以 WARNING 级别记录
   */
  public static final boolean STRICT_KEYS = System.getenv("KRYON_KIR_STRICT_KEYS") != null;

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null && !value.isEmpty() ? value : defaultValue;
  }
}
