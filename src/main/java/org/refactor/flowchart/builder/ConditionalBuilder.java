package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.Optional;

/**
 * if / else if / else，三元赋值和断言。判断节点的出边标为 True / False。
 */
final class ConditionalBuilder {

    static final String TRUE = "True";
    static final String FALSE = "False";

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    ConditionalBuilder(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    ProcessResult buildIf(SyntaxNode node, String exitId, LoopContext loop, FinallyContext fin) {
        ProcessResult result = ProcessResult.empty();
        FlowchartNode previous = null;
        SyntaxNode current = node;
        // else if 链逐环展开，不递归，也不经过块组合，避免多出汇合节点
        while (current != null) {
            if (previous != null && ctx.truncated()) {
                result.addExit(ExitPoint.of(previous.id(), FALSE));
                break;
            }
            String condition = adapter.field(current, Fields.CONDITION)
                    .map(c -> Labels.condition(c.text()))
                    .orElse("condition");
            FlowchartNode decision = ctx.node("if", "if (" + condition + ")", NodeType.DECISION, current);
            result.addNode(decision);
            if (previous == null) {
                result.setEntry(decision.id());
            } else {
                result.addEdge(previous.id(), decision.id(), FALSE);
            }

            ProcessResult then = dispatcher.dispatch(adapter.field(current, Fields.CONSEQUENCE), exitId, loop, fin);
            branch(result, decision, then, TRUE);

            Optional<SyntaxNode> alternative = adapter.field(current, Fields.ALTERNATIVE);
            previous = decision;
            current = null;
            if (alternative.isEmpty()) {
                result.addExit(ExitPoint.of(decision.id(), FALSE));
            } else if (adapter.classify(alternative.get()) == StatementKind.CONDITIONAL) {
                current = alternative.get();
            } else {
                branch(result, decision, dispatcher.dispatch(alternative.get(), exitId, loop, fin), FALSE);
            }
        }
        return result;
    }

    // 分支为空时判断节点本身带着标签成为出口
    private void branch(ProcessResult result, FlowchartNode decision, ProcessResult branch, String label) {
        result.absorb(branch);
        if (branch.hasEntry()) {
            result.addEdge(decision.id(), branch.entryNodeId(), label);
            result.addExits(branch.openExits());
        } else {
            result.addExit(ExitPoint.of(decision.id(), label));
        }
    }

    /**
     * x = c ? a : b：判断 c，两个赋值节点都是出口
     */
    ProcessResult buildTernary(SyntaxNode node) {
        String condition = adapter.field(node, Fields.CONDITION)
                .map(c -> Labels.condition(c.text()))
                .orElse("condition");
        String target = adapter.field(node, Fields.TARGET).map(SyntaxNode::text).orElse(null);

        FlowchartNode decision = ctx.node("ternary", condition, NodeType.DECISION, node);
        FlowchartNode whenTrue = ctx.node("ternary_then",
                assignment(target, adapter.field(node, Fields.CONSEQUENCE)), NodeType.ASSIGNMENT, null);
        FlowchartNode whenFalse = ctx.node("ternary_else",
                assignment(target, adapter.field(node, Fields.ALTERNATIVE)), NodeType.ASSIGNMENT, null);

        return ProcessResult.empty()
                .addNode(decision)
                .addNode(whenTrue)
                .addNode(whenFalse)
                .addEdge(decision.id(), whenTrue.id(), TRUE)
                .addEdge(decision.id(), whenFalse.id(), FALSE)
                .setEntry(decision.id())
                .addExit(ExitPoint.of(whenTrue.id()))
                .addExit(ExitPoint.of(whenFalse.id()));
    }

    private static String assignment(String target, Optional<SyntaxNode> value) {
        String text = value.map(SyntaxNode::text).orElse("...");
        return target == null ? text : target + " = " + text;
    }

    /**
     * assert c：不成立时抛出 AssertionError，与 throw 一样是终止节点
     */
    ProcessResult buildAssert(SyntaxNode node, String exitId, FinallyContext fin) {
        String condition = adapter.field(node, Fields.CONDITION)
                .map(c -> Labels.condition(c.text()))
                .orElse("condition");
        String message = adapter.field(node, Fields.MESSAGE).map(SyntaxNode::text).orElse(null);

        FlowchartNode decision = ctx.node("assert", "assert " + condition, NodeType.DECISION, node);
        FlowchartNode failure = ctx.node("assert_fail",
                message == null ? "raise AssertionError" : "raise AssertionError: " + message,
                NodeType.EXCEPTION, null);
        String target = fin != null ? fin.finallyEntryId() : exitId;

        return ProcessResult.empty()
                .addNode(decision)
                .addNode(failure)
                .addEdge(decision.id(), failure.id(), FALSE)
                .addEdge(failure.id(), target)
                .markConnected(failure.id())
                .setEntry(decision.id())
                .addExit(ExitPoint.of(decision.id(), TRUE));
    }
}
