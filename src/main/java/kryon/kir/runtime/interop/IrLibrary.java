package kryon.kir.runtime.interop;

import com.fasterxml.jackson.databind.JsonNode;
import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.Layout;
import kryon.kir.core.Node;
import kryon.kir.core.Style;
import kryon.kir.types.NodeKind;
import java.nio.file.Path;

/**
 * 组件/布局引擎的操作契约。
 *
 * 句柄即 {@link Node}、{@link Style}、{@link Layout} 引用。实现可以是原生引擎的绑定，
 * 也可以是 {@link InMemoryIrLibrary} 这样完全基于核心模型的实现。
 */
public interface IrLibrary {

  // === 节点 ===

  Node createNode(NodeKind kind);

  Node createNodeWithId(NodeKind kind, long id);

  /** 释放节点：从父节点摘下并清空其子节点。 */
  void destroy(Node node);

  void attachChild(Node parent, Node child);

  void detachChild(Node parent, Node child);

  void insertChild(Node parent, Node child, int index);

  /** 越界时返回 null。 */
  Node getChild(Node parent, int index);

  /** 找不到时返回 null。 */
  Node findById(Node root, long id);

  /** 写入 {@code text_content} 属性。 */
  void setText(Node node, String text);

  /** 写入 {@code custom_data} 属性。 */
  void setCustomData(Node node, String data);

  // === 样式 ===

  Style createStyle();

  void destroyStyle(Style style);

  void setStyle(Node node, Style style);

  Style getStyle(Node node);

  void setWidth(Style style, Dimension width);

  void setHeight(Style style, Dimension height);

  void setBackground(Style style, Color color);

  void setBorder(Style style, double width, Color color, double radius);

  void setMargin(Style style, double top, double right, double bottom, double left);

  void setPadding(Style style, double top, double right, double bottom, double left);

  // === 布局 ===

  Layout createLayout();

  void destroyLayout(Layout layout);

  // === 序列化 ===

  /**
   * 序列化完整文档。除 root 以外的参数均可为 null，非 null 时作为额外的文档段写出。
   */
  String serializeComplete(Node root, JsonNode manifest, JsonNode logicBlock, JsonNode sourceMeta, JsonNode sourceStructs);

  Node deserialize(String json);

  Node readFile(Path path);

  /**
   * @return 写入成功时返回 true
   */
  boolean writeFile(Node root, JsonNode manifest, Path path);

  // === 类型名 ===

  String kindToString(NodeKind kind);

  NodeKind stringToKind(String name);
}
