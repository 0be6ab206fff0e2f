package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.SyntaxNode;

/**
 * 跳转语句。return、throw、break、continue、goto 都是终止节点：出边在这里直接连好，
 * 节点记入 nodesConnectedToExit，不产生出口。
 */
final class JumpBuilder {

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    JumpBuilder(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    ProcessResult buildReturn(SyntaxNode node, String exitId, FinallyContext fin) {
        FlowchartNode ret = ctx.node("return", Labels.statement(node.text()), NodeType.RETURN, node);
        return terminal(ret, fin != null ? fin.finallyEntryId() : exitId);
    }

    ProcessResult buildThrow(SyntaxNode node, String exitId, FinallyContext fin) {
        FlowchartNode raise = ctx.node("throw", Labels.statement(node.text()), NodeType.EXCEPTION, node);
        return terminal(raise, fin != null ? fin.finallyEntryId() : exitId);
    }

    /**
     * 没有外层循环或 switch 的 break 不报错，退化为普通节点
     */
    ProcessResult buildBreak(SyntaxNode node, LoopContext loop, FinallyContext fin) {
        if (loop == null) {
            return opaque(node);
        }
        LoopContext target = loop.breakContext(label(node));
        FlowchartNode jump = ctx.node("break", Labels.statement(node.text()), NodeType.BREAK_CONTINUE, node);
        return terminal(jump, throughFinally(fin, target) ? fin.finallyEntryId() : target.breakTargetId());
    }

    ProcessResult buildContinue(SyntaxNode node, LoopContext loop, FinallyContext fin) {
        LoopContext target = loop == null ? null : loop.continueContext(label(node));
        if (target == null) {
            return opaque(node);
        }
        FlowchartNode jump = ctx.node("continue", Labels.statement(node.text()), NodeType.BREAK_CONTINUE, node);
        return terminal(jump, throughFinally(fin, target) ? fin.finallyEntryId() : target.continueTargetId());
    }

    /**
     * goto 的目标标签可能在后面才出现，边留到函数组装时解析
     */
    ProcessResult buildGoto(SyntaxNode node) {
        FlowchartNode jump = ctx.node("goto", Labels.statement(node.text()), NodeType.BREAK_CONTINUE, node);
        ctx.addPendingGoto(jump.id(), label(node));
        return ProcessResult.empty()
                .addNode(jump)
                .setEntry(jump.id())
                .markConnected(jump.id());
    }

    ProcessResult buildLabeled(SyntaxNode node, String exitId, LoopContext loop, FinallyContext fin) {
        String name = label(node);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);
        if (body.hasEntry()) {
            if (name != null) {
                ctx.registerLabel(name, body.entryNodeId());
            }
            return body;
        }
        FlowchartNode marker = ctx.node("label", name == null ? "label" : name, NodeType.PROCESS, node);
        if (name != null) {
            ctx.registerLabel(name, marker.id());
        }
        return ProcessResult.single(marker);
    }

    // 目标上下文是在当前 finally 之外建立的，跳出去要先经过 finally
    private static boolean throughFinally(FinallyContext fin, LoopContext target) {
        return fin != null && !fin.equals(target.finallyScope());
    }

    private String label(SyntaxNode node) {
        return adapter.field(node, Fields.LABEL)
                .map(l -> l.text().trim())
                .filter(l -> !l.isEmpty())
                .orElse(null);
    }

    private ProcessResult opaque(SyntaxNode node) {
        return ProcessResult.single(ctx.node("stmt", Labels.statement(node.text()), NodeType.PROCESS, node));
    }

    private static ProcessResult terminal(FlowchartNode node, String target) {
        return ProcessResult.empty()
                .addNode(node)
                .addEdge(node.id(), target)
                .setEntry(node.id())
                .markConnected(node.id());
    }
}
