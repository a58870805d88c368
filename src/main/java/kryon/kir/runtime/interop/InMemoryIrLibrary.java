package kryon.kir.runtime.interop;

import com.fasterxml.jackson.databind.JsonNode;
import kryon.kir.KirDecoder;
import kryon.kir.KirDocument;
import kryon.kir.KirEncoder;
import kryon.kir.core.Color;
import kryon.kir.core.Dimension;
import kryon.kir.core.KirMetadata;
import kryon.kir.core.Layout;
import kryon.kir.core.Node;
import kryon.kir.core.Style;
import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.ResourceException;
import kryon.kir.types.NodeKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 纯内存实现：句柄就是核心模型对象，序列化委托给 {@link KirEncoder} / {@link KirDecoder}。
 *
 * serializeComplete 的附加参数分别写入 {@code reactive_manifest}、{@code logic_block}、
 * {@code source_structures} 文档段；sourceMeta 中的字段并入 metadata。
 */
public final class InMemoryIrLibrary implements IrLibrary {

  private static final Logger LOGGER = Logger.getLogger(InMemoryIrLibrary.class.getName());

  private final KirEncoder encoder;
  private final KirDecoder decoder;
  private final boolean pretty;

  public InMemoryIrLibrary(KirEncoder encoder, KirDecoder decoder, boolean pretty) {
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.pretty = pretty;
  }

  public InMemoryIrLibrary() {
    this(new KirEncoder(), new KirDecoder(), false);
  }

  // === 节点 ===

  @Override
  public Node createNode(NodeKind kind) {
    return new Node(kind);
  }

  @Override
  public Node createNodeWithId(NodeKind kind, long id) {
    return new Node(kind).setId(id);
  }

  @Override
  public void destroy(Node node) {
    if (node == null) {
      return;
    }
    if (node.parent() != null) {
      node.parent().detachChild(node);
    }
    for (Node child : new ArrayList<>(node.children())) {
      node.detachChild(child);
    }
  }

  @Override
  public void attachChild(Node parent, Node child) {
    parent.attachChild(child);
  }

  @Override
  public void detachChild(Node parent, Node child) {
    parent.detachChild(child);
  }

  @Override
  public void insertChild(Node parent, Node child, int index) {
    parent.insertChild(index, child);
  }

  @Override
  public Node getChild(Node parent, int index) {
    if (index < 0 || index >= parent.childCount()) {
      return null;
    }
    return parent.childAt(index);
  }

  @Override
  public Node findById(Node root, long id) {
    return root.findById(id);
  }

  @Override
  public void setText(Node node, String text) {
    node.setAttribute("text_content", text);
  }

  @Override
  public void setCustomData(Node node, String data) {
    node.setAttribute("custom_data", data);
  }

  // === 样式 ===

  @Override
  public Style createStyle() {
    return new Style();
  }

  @Override
  public void destroyStyle(Style style) {
    // 堆上对象，无需显式释放
  }

  @Override
  public void setStyle(Node node, Style style) {
    node.setStyle(style);
  }

  @Override
  public Style getStyle(Node node) {
    return node.style();
  }

  @Override
  public void setWidth(Style style, Dimension width) {
    style.width(width);
  }

  @Override
  public void setHeight(Style style, Dimension height) {
    style.height(height);
  }

  @Override
  public void setBackground(Style style, Color color) {
    style.backgroundColor(color);
  }

  @Override
  public void setBorder(Style style, double width, Color color, double radius) {
    style.borderWidth(width).borderColor(color).borderRadius(radius);
  }

  @Override
  public void setMargin(Style style, double top, double right, double bottom, double left) {
    style.marginTop(top).marginRight(right).marginBottom(bottom).marginLeft(left);
  }

  @Override
  public void setPadding(Style style, double top, double right, double bottom, double left) {
    style.paddingTop(top).paddingRight(right).paddingBottom(bottom).paddingLeft(left);
  }

  // === 布局 ===

  @Override
  public Layout createLayout() {
    return new Layout();
  }

  @Override
  public void destroyLayout(Layout layout) {
    // 同 destroyStyle
  }

  // === 序列化 ===

  @Override
  public String serializeComplete(Node root, JsonNode manifest, JsonNode logicBlock, JsonNode sourceMeta, JsonNode sourceStructs) {
    KirDocument doc = KirDocument.of(root, encoder.language());
    if (sourceMeta != null && sourceMeta.isObject()) {
      doc = mergeSourceMeta(doc, sourceMeta);
    }
    if (manifest != null && !manifest.isNull()) {
      doc = doc.withSection("reactive_manifest", manifest);
    }
    if (logicBlock != null && !logicBlock.isNull()) {
      doc = doc.withSection("logic_block", logicBlock);
    }
    if (sourceStructs != null && !sourceStructs.isNull()) {
      doc = doc.withSection("source_structures", sourceStructs);
    }
    return encoder.encodeToString(doc, pretty);
  }

  private static KirDocument mergeSourceMeta(KirDocument doc, JsonNode sourceMeta) {
    KirMetadata meta = doc.metadata();
    Iterator<Map.Entry<String, JsonNode>> it = sourceMeta.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String text = e.getValue().isTextual() ? e.getValue().textValue() : null;
      switch (e.getKey()) {
        case "sourceFile":
          meta = meta.withSourceFile(text);
          break;
        case "compilerVersion":
          meta = meta.withCompilerVersion(text);
          break;
        case "timestamp":
          meta = meta.withTimestamp(text);
          break;
        case "format":
        case "language":
          // 由编码器决定
          break;
        default:
          doc = doc.withMetadataExtra(e.getKey(), e.getValue());
      }
    }
    return doc.withMetadata(meta);
  }

  @Override
  public Node deserialize(String json) {
    return decoder.decode(json);
  }

  /**
   * @throws ResourceException 文件不存在或无法读取
   */
  @Override
  public Node readFile(Path path) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new ResourceException(ErrorMessages.resourceUnavailable("KIR file " + path, e.toString()), e);
    }
    return decoder.decode(bytes);
  }

  @Override
  public boolean writeFile(Node root, JsonNode manifest, Path path) {
    String json = serializeComplete(root, manifest, null, null, null);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(path, json.getBytes(StandardCharsets.UTF_8));
      return true;
    } catch (IOException e) {
      LOGGER.log(Level.WARNING, "Failed to write KIR file " + path, e);
      return false;
    }
  }

  // === 类型名 ===

  @Override
  public String kindToString(NodeKind kind) {
    return kind.toWireName();
  }

  @Override
  public NodeKind stringToKind(String name) {
    return NodeKind.fromWireName(name);
  }
}
