package kryon.kir.core;

/**
 * Style / Layout 记录中的一个字段：内部键名加值类型。
 */
public interface PropertyField {

  /** 内部键名（下划线分隔的小写形式）。 */
  String key();

  ValueType type();

  /**
   * 字段值类型，决定编解码时使用的值编解码器。
   */
  enum ValueType {
    DIMENSION,
    COLOR,
    NUMBER,
    STRING,
    BOOLEAN
  }
}
