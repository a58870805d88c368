package kryon.kir.core;

import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.ValidationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 扁平的可选字段记录，{@link Style} 与 {@link Layout} 的公共实现。
 *
 * 设计要点：
 * - 已知字段存放在 EnumMap 中，迭代顺序即字段声明顺序，保证编码输出稳定
 * - 字段值在写入时按 {@link PropertyField.ValueType} 归一化（数字统一为 Double，尺寸/颜色接受文本形式）
 * - 未知字段（来自更新版本的文档）保存在 extras 中，按原样往返
 */
public abstract class PropertyRecord<F extends Enum<F> & PropertyField, S extends PropertyRecord<F, S>> {

  private final EnumMap<F, Object> values;
  private final Map<String, Object> extras = new LinkedHashMap<>();

  protected PropertyRecord(Class<F> fieldType) {
    this.values = new EnumMap<>(fieldType);
  }

  protected abstract S self();

  /**
   * 写入字段；value 为 null 时清除该字段。
   *
   * @throws ValidationException 值类型与字段不匹配
   */
  public S set(F field, Object value) {
    Objects.requireNonNull(field, "field");
    if (value == null) {
      values.remove(field);
    } else {
      values.put(field, normalize(field, value));
    }
    return self();
  }

  public Object get(F field) {
    return values.get(field);
  }

  public boolean has(F field) {
    return values.containsKey(field);
  }

  /**
   * 所有已设置的字段，按声明顺序。
   */
  public Map<F, Object> presentFields() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * 记录未知字段（内部键名 → 原始 JSON 兼容值）。
   */
  public S putExtra(String key, Object value) {
    extras.put(Objects.requireNonNull(key, "key"), value);
    return self();
  }

  public Map<String, Object> extras() {
    return Collections.unmodifiableMap(extras);
  }

  public boolean isEmpty() {
    return values.isEmpty() && extras.isEmpty();
  }

  /**
   * 用 other 中已设置的字段覆盖当前记录，与 DSL 中“合并传入的 layout”语义一致。
   */
  public S merge(S other) {
    if (other != null) {
      PropertyRecord<F, S> o = other;
      values.putAll(o.values);
      extras.putAll(o.extras);
    }
    return self();
  }

  protected Double number(F field) {
    return (Double) values.get(field);
  }

  protected String string(F field) {
    return (String) values.get(field);
  }

  protected Dimension dimension(F field) {
    return (Dimension) values.get(field);
  }

  protected Color color(F field) {
    return (Color) values.get(field);
  }

  protected Boolean bool(F field) {
    return (Boolean) values.get(field);
  }

  private Object normalize(F field, Object value) {
    switch (field.type()) {
      case DIMENSION:
        if (value instanceof Dimension) return value;
        if (value instanceof Number) return Dimension.px(((Number) value).doubleValue());
        if (value instanceof String) return Dimension.parse((String) value);
        break;
      case COLOR:
        if (value instanceof Color) return value;
        if (value instanceof String) return Color.parse((String) value);
        break;
      case NUMBER:
        if (value instanceof Number) return ((Number) value).doubleValue();
        break;
      case STRING:
        if (value instanceof String) return value;
        break;
      case BOOLEAN:
        if (value instanceof Boolean) return value;
        break;
      default:
        break;
    }
    throw new ValidationException(ErrorMessages.bilingual(
        "字段 " + field.key() + " 的值类型不匹配：" + value.getClass().getSimpleName(),
        "Field " + field.key() + " expects " + field.type() + ", got " + value.getClass().getSimpleName()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PropertyRecord<?, ?> that = (PropertyRecord<?, ?>) o;
    return values.equals(that.values) && extras.equals(that.extras);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, extras);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
    boolean first = true;
    for (Map.Entry<F, Object> e : values.entrySet()) {
      if (!first) sb.append(", ");
      sb.append(e.getKey().key()).append('=').append(e.getValue());
      first = false;
    }
    for (Map.Entry<String, Object> e : extras.entrySet()) {
      if (!first) sb.append(", ");
      sb.append(e.getKey()).append('=').append(e.getValue());
      first = false;
    }
    return sb.append('}').toString();
  }
}
