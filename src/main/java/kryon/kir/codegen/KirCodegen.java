package kryon.kir.codegen;

import kryon.kir.KirDecoder;
import kryon.kir.core.Node;
import kryon.kir.runtime.FormatException;

/**
 * KIR → 组件树 → 源代码，一次调用完成。
 */
public final class KirCodegen {

  private KirCodegen() {
    // 工具类，禁止实例化
  }

  /**
   * @throws FormatException KIR 文本不合法
   */
  public static String fromKir(String json, SourceRegenerator target) {
    Node root = new KirDecoder().decode(json);
    return target.generate(root);
  }

  /**
   * 按语言名选择生成器：{@code java} 或 {@code python}。
   *
   * @throws IllegalArgumentException 不支持的语言
   */
  public static SourceRegenerator forLanguage(String language, String packageName, String className) {
    switch (language == null ? "" : language.toLowerCase(java.util.Locale.ROOT)) {
      case "java":
        return new JavaSourceRegenerator(
            packageName == null ? JavaSourceRegenerator.DEFAULT_PACKAGE : packageName,
            className == null ? JavaSourceRegenerator.DEFAULT_CLASS : className);
      case "python":
      case "py":
        return new PythonSourceRegenerator();
      default:
        throw new IllegalArgumentException("Unsupported codegen language: " + language);
    }
  }
}
