package kryon.kir.core;

import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.ValidationException;
import kryon.kir.runtime.ValueCodecs;
import kryon.kir.types.NodeKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 组件树中的一个节点。
 *
 * 节点独占自己的子节点、样式与布局：同一个节点不能同时挂在两个父节点下，也不能挂到自己的后代下。
 * 所有修改操作都返回自身，便于链式构建；这里不校验父子类型的合法组合，那是布局引擎的职责。
 */
public final class Node {
  /** uint32 上限。 */
  public static final long MAX_ID = 0xFFFFFFFFL;

  private final NodeKind kind;
  private Long id;
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private Style style;
  private Layout layout;
  private final List<Node> children = new ArrayList<>();
  private final List<EventBinding> events = new ArrayList<>();
  private Node parent;

  public Node(NodeKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public NodeKind kind() {
    return kind;
  }

  // === id ===

  /**
   * 显式 id；未设置时返回 null，由编码器在编码时分配。
   */
  public Long id() {
    return id;
  }

  public boolean hasId() {
    return id != null;
  }

  public Node setId(long id) {
    if (id < 0 || id > MAX_ID) {
      throw new ValidationException(ErrorMessages.idOutOfRange(id));
    }
    this.id = id;
    return this;
  }

  public Node clearId() {
    this.id = null;
    return this;
  }

  // === attributes ===

  public Map<String, Object> attributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Object attribute(String key) {
    return attributes.get(key);
  }

  public boolean hasAttribute(String key) {
    return attributes.containsKey(key);
  }

  /**
   * 写入属性；值先经 {@link ValueCodecs#normalizeAttribute} 规整，保证编码再解码后逐项相等。
   */
  public Node setAttribute(String key, Object value) {
    attributes.put(Objects.requireNonNull(key, "key"), ValueCodecs.normalizeAttribute(value));
    return this;
  }

  public Node putAttributes(Map<String, ?> values) {
    for (Map.Entry<String, ?> e : values.entrySet()) {
      setAttribute(e.getKey(), e.getValue());
    }
    return this;
  }

  public Object removeAttribute(String key) {
    return attributes.remove(key);
  }

  // === style / layout ===

  public Style style() {
    return style;
  }

  public Node setStyle(Style style) {
    this.style = style;
    return this;
  }

  public Layout layout() {
    return layout;
  }

  public Node setLayout(Layout layout) {
    this.layout = layout;
    return this;
  }

  // === children ===

  public List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  public int childCount() {
    return children.size();
  }

  public Node childAt(int index) {
    if (index < 0 || index >= children.size()) {
      throw new IndexOutOfBoundsException(ErrorMessages.childIndexOutOfBounds(index, children.size()));
    }
    return children.get(index);
  }

  public Node parent() {
    return parent;
  }

  /**
   * 追加子节点。
   *
   * @throws ValidationException 子节点已有父节点，或挂载会形成环
   */
  public Node attachChild(Node child) {
    return insertChild(children.size(), child);
  }

  public Node attachChildren(Node... nodes) {
    return attachChildren(Arrays.asList(nodes));
  }

  public Node attachChildren(List<Node> nodes) {
    for (Node child : nodes) {
      attachChild(child);
    }
    return this;
  }

  public Node insertChild(int index, Node child) {
    Objects.requireNonNull(child, "child");
    if (index < 0 || index > children.size()) {
      throw new IndexOutOfBoundsException(ErrorMessages.childIndexOutOfBounds(index, children.size()));
    }
    if (child.parent != null) {
      throw new ValidationException(ErrorMessages.nodeAlreadyAttached(child.toString()));
    }
    for (Node n = this; n != null; n = n.parent) {
      if (n == child) {
        throw new ValidationException(ErrorMessages.nodeCycle(child.toString()));
      }
    }
    children.add(index, child);
    child.parent = this;
    return this;
  }

  /**
   * 移除直接子节点。
   *
   * @return child 确实是本节点的子节点时返回 true
   */
  public boolean detachChild(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        children.remove(i);
        child.parent = null;
        return true;
      }
    }
    return false;
  }

  // === events ===

  public List<EventBinding> events() {
    return Collections.unmodifiableList(events);
  }

  public Node addEvent(String type, String handler) {
    events.add(new EventBinding(type, handler));
    return this;
  }

  // === queries ===

  /**
   * 先序查找显式 id 等于给定值的节点。
   */
  public Node findById(long targetId) {
    if (id != null && id == targetId) {
      return this;
    }
    for (Node child : children) {
      Node found = child.findById(targetId);
      if (found != null) return found;
    }
    return null;
  }

  /**
   * 结构等价：类型、属性、样式、布局、事件与子树逐一相等，忽略 id。
   */
  public boolean sameStructure(Node other) {
    return equivalent(this, other, false);
  }

  /**
   * 与 {@link #sameStructure} 相同，但同时比较 id。
   */
  public boolean sameTree(Node other) {
    return equivalent(this, other, true);
  }

  private static boolean equivalent(Node a, Node b, boolean compareIds) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    if (a.kind != b.kind) return false;
    if (compareIds && !Objects.equals(a.id, b.id)) return false;
    if (!a.attributes.equals(b.attributes)) return false;
    if (!Objects.equals(normalized(a.style), normalized(b.style))) return false;
    if (!Objects.equals(normalized(a.layout), normalized(b.layout))) return false;
    if (!a.events.equals(b.events)) return false;
    if (a.children.size() != b.children.size()) return false;
    for (int i = 0; i < a.children.size(); i++) {
      if (!equivalent(a.children.get(i), b.children.get(i), compareIds)) return false;
    }
    return true;
  }

  // 空记录与未设置等价：编码时二者都不会输出
  private static PropertyRecord<?, ?> normalized(PropertyRecord<?, ?> record) {
    return record == null || record.isEmpty() ? null : record;
  }

  @Override
  public String toString() {
    return kind.toWireName() + (id != null ? "#" + id : "") + (attributes.isEmpty() ? "" : attributes.toString());
  }
}
