package kryon.kir.codegen;

/**
 * 带缩进的逐行文本构建器。
 */
final class SourceWriter {
  private final StringBuilder sb = new StringBuilder(4096);
  private final String indentUnit;
  private int indent;
  private int lines;

  SourceWriter(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  SourceWriter line(String text) {
    if (!text.isEmpty()) {
      for (int i = 0; i < indent; i++) {
        sb.append(indentUnit);
      }
      sb.append(text);
    }
    sb.append('\n');
    lines++;
    return this;
  }

  SourceWriter blank() {
    sb.append('\n');
    lines++;
    return this;
  }

  SourceWriter indent() {
    indent++;
    return this;
  }

  SourceWriter dedent() {
    if (indent > 0) indent--;
    return this;
  }

  /** 已写入的行数（含空行）。 */
  int lineCount() {
    return lines;
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
