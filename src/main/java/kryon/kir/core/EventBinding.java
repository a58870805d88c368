package kryon.kir.core;

import java.util.Objects;

/**
 * 事件绑定：事件类型（如 {@code click}）与处理函数名，按原样写入 KIR。
 */
public record EventBinding(String type, String handler) {
  public EventBinding {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
  }
}
