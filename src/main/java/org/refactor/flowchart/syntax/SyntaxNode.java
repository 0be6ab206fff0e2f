package org.refactor.flowchart.syntax;

import java.util.List;
import java.util.Optional;

/**
 * 外部解析器提供的语法树节点（只读）。
 * <p>
 * 引擎只通过 kind 标签、源码区间、子节点和具名字段访问语法树，从不修改它。
 */
public interface SyntaxNode {

    /**
     * 节点类型标签，如 tree-sitter 的 "if_statement" 或 JavaParser 的 "IfStmt"
     */
    String kind();

    int startOffset();

    int endOffset();

    /**
     * 节点对应的源码文本
     */
    String text();

    /**
     * 有序子节点（只含具名节点）
     */
    List<SyntaxNode> children();

    Optional<SyntaxNode> field(String name);

    /**
     * 可重复字段的全部节点；默认实现返回 field(name) 的结果
     */
    default List<SyntaxNode> fields(String name) {
        return field(name).map(List::of).orElseGet(List::of);
    }

    Optional<SyntaxNode> parent();
}
