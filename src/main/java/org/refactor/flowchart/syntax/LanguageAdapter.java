package org.refactor.flowchart.syntax;

import java.util.List;
import java.util.Optional;

/**
 * 语言适配器：引擎与具体语法之间唯一的接缝。
 * <p>
 * 引擎本身不认识任何语言的节点名，所有 kind 名称表、字段名映射和方法名表都由适配器提供。
 */
public interface LanguageAdapter {

    String language();

    /**
     * 把语法节点归入一种语句形态；不认识的节点返回 {@link StatementKind#DEFAULT}
     */
    StatementKind classify(SyntaxNode node);

    String functionName(SyntaxNode function);

    Optional<SyntaxNode> functionBody(SyntaxNode function);

    /**
     * 按规范字段名（见 {@link Fields}）访问节点字段
     */
    default Optional<SyntaxNode> field(SyntaxNode node, String role) {
        return node.field(role);
    }

    default List<SyntaxNode> fields(SyntaxNode node, String role) {
        return node.fields(role);
    }

    /**
     * 语句块中的语句，未经过滤
     */
    default List<SyntaxNode> statements(SyntaxNode block) {
        return block.children();
    }

    /**
     * 条件是否恒为真（如 while (true)），恒真的循环没有正常出口
     */
    default boolean isConstantTrue(SyntaxNode condition) {
        return "true".equals(condition.text().trim());
    }

    CaseFallthrough fallthrough(SyntaxNode switchNode, SyntaxNode caseClause);

    default boolean isDefaultCase(SyntaxNode caseClause) {
        return fields(caseClause, Fields.VALUE).isEmpty();
    }

    boolean isCall(SyntaxNode expression);

    Optional<IterationOp> iterationOp(String methodName);

    Optional<PromiseLink> promiseLink(String methodName);
}
