package kryon.kir.codegen;

import kryon.kir.core.Node;

/**
 * 从组件树重新生成构建该树的源代码。
 *
 * 每个节点一条构造语句；变量名由位置决定：根节点为 {@code app}，子节点为 {@code <父变量>_child_<i>}，
 * 每个子节点的语句块之后紧跟一条挂载语句。
 */
public interface SourceRegenerator {

  /** 目标语言名称，写入 CLI 输出与日志。 */
  String language();

  String generate(Node root);
}
