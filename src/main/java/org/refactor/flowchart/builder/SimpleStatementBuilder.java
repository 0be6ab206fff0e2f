package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.SyntaxNode;

/**
 * 单节点语句：不认识的语句、await 和异步派发
 */
final class SimpleStatementBuilder {

    private final BuildContext ctx;

    SimpleStatementBuilder(BuildContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 兜底：标签是语句源码，保证引擎不会因为陌生语法失败
     */
    ProcessResult buildOpaque(SyntaxNode node) {
        return single("stmt", node, NodeType.PROCESS);
    }

    ProcessResult buildAwait(SyntaxNode node) {
        return single("await", node, NodeType.AWAIT);
    }

    /**
     * go f() / spawn：调用方不等待，控制流直接继续
     */
    ProcessResult buildAsyncDispatch(SyntaxNode node) {
        return single("async", node, NodeType.ASYNC_OPERATION);
    }

    private ProcessResult single(String prefix, SyntaxNode node, NodeType type) {
        return ProcessResult.single(ctx.node(prefix, Labels.statement(node.text()), type, node));
    }
}
