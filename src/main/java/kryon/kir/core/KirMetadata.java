package kryon.kir.core;

import java.util.Objects;

/**
 * KIR 文档的 metadata 段。format 与 language 必有，其余字段可选（null 表示省略）。
 */
public record KirMetadata(String format, String language, String sourceFile, String compilerVersion, String timestamp) {

  public static final String FORMAT = "KIR";

  public KirMetadata {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(language, "language");
  }

  public static KirMetadata of(String language) {
    return new KirMetadata(FORMAT, language, null, null, null);
  }

  public KirMetadata withSourceFile(String file) {
    return new KirMetadata(format, language, file, compilerVersion, timestamp);
  }

  public KirMetadata withCompilerVersion(String version) {
    return new KirMetadata(format, language, sourceFile, version, timestamp);
  }

  public KirMetadata withTimestamp(String value) {
    return new KirMetadata(format, language, sourceFile, compilerVersion, value);
  }
}
