package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 循环族：计数 for、while、do-while、for-each 以及无条件循环。
 * <p>
 * 每个循环新建自己的 {@link LoopContext}。循环出口节点的 id 先预留，
 * 只有条件可能为假或确实有 break 到达时才真正创建。
 */
final class LoopBuilder {

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    LoopBuilder(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    /**
     * 外层带标签语句的标签，用于 break L / continue L
     */
    static String statementLabel(LanguageAdapter adapter, SyntaxNode node) {
        return node.parent()
                .filter(p -> adapter.classify(p) == StatementKind.LABELED)
                .flatMap(p -> adapter.field(p, Fields.LABEL))
                .map(l -> l.text().trim())
                .orElse(null);
    }

    ProcessResult buildCounted(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin) {
        Optional<SyntaxNode> condition = adapter.field(node, Fields.CONDITION);
        boolean infinite = condition.map(adapter::isConstantTrue).orElse(true);
        String header = condition.map(c -> "for (" + Labels.condition(c.text()) + ")").orElse("for (;;)");

        ProcessResult result = ProcessResult.empty();
        FlowchartNode init = expressionNode("for_init", adapter.fields(node, Fields.INIT));
        FlowchartNode loopHead = ctx.node("for", header, NodeType.LOOP_START, node);
        FlowchartNode update = expressionNode("for_update", adapter.fields(node, Fields.UPDATE));
        String endId = ctx.nextId("for_end");

        if (init != null) {
            result.addNode(init).setEntry(init.id()).addEdge(init.id(), loopHead.id());
        } else {
            result.setEntry(loopHead.id());
        }
        result.addNode(loopHead);
        String continueTarget = loopHead.id();
        if (update != null) {
            result.addNode(update).addEdge(update.id(), loopHead.id());
            continueTarget = update.id();
        }

        LoopContext loop = new LoopContext(endId, continueTarget, statementLabel(adapter, node), outer, fin);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);
        closeBody(result, loopHead.id(), body, continueTarget, ConditionalBuilder.TRUE);
        if (!infinite) {
            result.addEdge(loopHead.id(), endId, ConditionalBuilder.FALSE);
        }
        return finish(result, endId, "end for");
    }

    ProcessResult buildConditional(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin) {
        Optional<SyntaxNode> condition = adapter.field(node, Fields.CONDITION);
        boolean infinite = condition.map(adapter::isConstantTrue).orElse(false);
        String text = condition.map(c -> Labels.condition(c.text())).orElse("condition");

        FlowchartNode loopHead = ctx.node("while", "while (" + text + ")", NodeType.LOOP_START, node);
        String endId = ctx.nextId("while_end");
        ProcessResult result = ProcessResult.empty().addNode(loopHead).setEntry(loopHead.id());

        LoopContext loop = new LoopContext(endId, loopHead.id(), statementLabel(adapter, node), outer, fin);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);
        closeBody(result, loopHead.id(), body, loopHead.id(), ConditionalBuilder.TRUE);
        if (!infinite) {
            result.addEdge(loopHead.id(), endId, ConditionalBuilder.FALSE);
        }
        return finish(result, endId, "end while");
    }

    /**
     * do-while：先执行循环体，条件节点是 continue 目标，回边从条件指向循环体入口
     */
    ProcessResult buildPostCondition(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin) {
        Optional<SyntaxNode> condition = adapter.field(node, Fields.CONDITION);
        boolean infinite = condition.map(adapter::isConstantTrue).orElse(false);
        String text = condition.map(c -> Labels.condition(c.text())).orElse("condition");

        FlowchartNode check = ctx.node("do_while", "do while (" + text + ")", NodeType.LOOP_START,
                condition.orElse(null));
        String endId = ctx.nextId("do_while_end");

        LoopContext loop = new LoopContext(endId, check.id(), statementLabel(adapter, node), outer, fin);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);

        ProcessResult result = ProcessResult.empty().absorb(body).addNode(check);
        if (body.hasEntry()) {
            result.setEntry(body.entryNodeId());
            result.connect(body.openExits(), check.id());
            result.addEdge(check.id(), body.entryNodeId(), ConditionalBuilder.TRUE);
        } else {
            result.setEntry(check.id());
            result.addEdge(check.id(), check.id(), ConditionalBuilder.TRUE);
        }
        if (!infinite) {
            result.addEdge(check.id(), endId, ConditionalBuilder.FALSE);
        }
        return finish(result, endId, "end do while");
    }

    ProcessResult buildIterator(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin) {
        String item = adapter.field(node, Fields.LEFT).map(n -> n.text().trim()).orElse("item");
        String source = adapter.field(node, Fields.RIGHT).map(n -> n.text().trim()).orElse("collection");

        FlowchartNode loopHead = ctx.node("for_each", "for each " + item + " in " + source,
                NodeType.LOOP_START, node);
        String endId = ctx.nextId("for_each_end");
        ProcessResult result = ProcessResult.empty().addNode(loopHead).setEntry(loopHead.id());

        LoopContext loop = new LoopContext(endId, loopHead.id(), statementLabel(adapter, node), outer, fin);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);
        closeBody(result, loopHead.id(), body, loopHead.id(), "next");
        result.addEdge(loopHead.id(), endId, "done");
        return finish(result, endId, "end for each");
    }

    /**
     * loop {}：没有条件，只能靠 break 或 return 离开
     */
    ProcessResult buildInfinite(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin) {
        FlowchartNode loopHead = ctx.node("loop", "loop", NodeType.LOOP_START, node);
        String endId = ctx.nextId("loop_end");
        ProcessResult result = ProcessResult.empty().addNode(loopHead).setEntry(loopHead.id());

        LoopContext loop = new LoopContext(endId, loopHead.id(), statementLabel(adapter, node), outer, fin);
        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, fin);
        closeBody(result, loopHead.id(), body, loopHead.id(), null);
        return finish(result, endId, "end loop");
    }

    // 循环体的未终止出口回到 continue 目标；空循环体时头节点直接转向 continue 目标
    private void closeBody(ProcessResult result, String headId, ProcessResult body, String continueTarget,
                           String enterLabel) {
        result.absorb(body);
        if (body.hasEntry()) {
            result.addEdge(headId, body.entryNodeId(), enterLabel);
            result.connect(body.openExits(), continueTarget);
        } else {
            result.addEdge(headId, continueTarget, enterLabel);
        }
    }

    private ProcessResult finish(ProcessResult result, String endId, String endLabel) {
        if (result.reaches(endId)) {
            FlowchartNode end = ctx.nodeWithId(endId, endLabel, NodeType.LOOP_END, null, null);
            result.addNode(end).addExit(ExitPoint.of(end.id()));
        }
        return result;
    }

    private FlowchartNode expressionNode(String prefix, List<SyntaxNode> expressions) {
        if (expressions.isEmpty()) {
            return null;
        }
        String text = expressions.stream()
                .map(e -> Labels.statement(e.text()))
                .collect(Collectors.joining(", "));
        SyntaxNode first = expressions.get(0);
        return ctx.node(prefix, text, NodeType.ASSIGNMENT, expressions.size() == 1 ? first : null);
    }
}
