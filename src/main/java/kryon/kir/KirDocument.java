package kryon.kir;

import com.fasterxml.jackson.databind.JsonNode;
import kryon.kir.core.KirMetadata;
import kryon.kir.core.Node;
import kryon.kir.runtime.ErrorMessages;
import kryon.kir.runtime.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 完整的 KIR 文档：版本、metadata、根节点，以及原样保留的其它顶层段
 * （{@code app}、{@code component_definitions}、{@code reactive_manifest}、{@code logic_block} 等）。
 *
 * metadata 中除 format/language/sourceFile/compilerVersion/timestamp 以外的字段保存在 metadataExtras 中。
 */
public final class KirDocument {
  public static final String VERSION = "2.0";

  /** 文档外壳字段，不能作为附加段名。 */
  public static final Set<String> RESERVED_SECTIONS = Set.of("version", "metadata", "root");
  /** metadata 的固定字段，不能作为 metadataExtras 的键。 */
  public static final Set<String> RESERVED_METADATA = Set.of("format", "language", "sourceFile", "compilerVersion", "timestamp");

  private final String version;
  private final KirMetadata metadata;
  private final Node root;
  private final Map<String, JsonNode> sections;
  private final Map<String, JsonNode> metadataExtras;

  public KirDocument(String version, KirMetadata metadata, Node root,
                     Map<String, JsonNode> sections, Map<String, JsonNode> metadataExtras) {
    this.version = Objects.requireNonNull(version, "version");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.root = Objects.requireNonNull(root, "root");
    for (String name : sections.keySet()) {
      checkName("section", RESERVED_SECTIONS, name);
    }
    for (String name : metadataExtras.keySet()) {
      checkName("metadata", RESERVED_METADATA, name);
    }
    this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    this.metadataExtras = Collections.unmodifiableMap(new LinkedHashMap<>(metadataExtras));
  }

  public static KirDocument of(Node root, String language) {
    return new KirDocument(VERSION, KirMetadata.of(language), root, Map.of(), Map.of());
  }

  public String version() {
    return version;
  }

  public KirMetadata metadata() {
    return metadata;
  }

  public Node root() {
    return root;
  }

  /** 除 version / metadata / root 以外的顶层段，按文档中的顺序。 */
  public Map<String, JsonNode> sections() {
    return sections;
  }

  public JsonNode section(String name) {
    return sections.get(name);
  }

  public Map<String, JsonNode> metadataExtras() {
    return metadataExtras;
  }

  public KirDocument withMetadata(KirMetadata newMetadata) {
    return new KirDocument(version, newMetadata, root, sections, metadataExtras);
  }

  /**
   * @throws ValidationException name 为 version、metadata 或 root
   */
  public KirDocument withSection(String name, JsonNode value) {
    checkName("section", RESERVED_SECTIONS, name);
    Map<String, JsonNode> copy = new LinkedHashMap<>(sections);
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, value);
    }
    return new KirDocument(version, metadata, root, copy, metadataExtras);
  }

  /**
   * @throws ValidationException name 与 metadata 的固定字段重名
   */
  public KirDocument withMetadataExtra(String name, JsonNode value) {
    checkName("metadata", RESERVED_METADATA, name);
    Map<String, JsonNode> copy = new LinkedHashMap<>(metadataExtras);
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, value);
    }
    return new KirDocument(version, metadata, root, sections, copy);
  }

  private static void checkName(String where, Set<String> reserved, String name) {
    if (reserved.contains(Objects.requireNonNull(name, "name"))) {
      throw new ValidationException(ErrorMessages.reservedDocumentKey(where, name));
    }
  }
}
