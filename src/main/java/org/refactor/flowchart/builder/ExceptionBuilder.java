package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * try / catch / finally 以及 with、synchronized 这类作用域语句。
 * <p>
 * 整个 try 体视为一个可能出错的单元：每个 catch 都从 try 节点引出一条边，不区分具体哪条语句抛出。
 */
final class ExceptionBuilder {

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    ExceptionBuilder(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    ProcessResult buildTry(SyntaxNode node, String exitId, LoopContext loop, FinallyContext fin) {
        List<SyntaxNode> resources = adapter.fields(node, Fields.RESOURCES);
        String label = resources.isEmpty() ? "try" : "try (" + resources.stream()
                .map(r -> Labels.statement(r.text()))
                .collect(Collectors.joining("; ")) + ")";
        FlowchartNode tryNode = ctx.node("try", label, NodeType.EXCEPTION, node);

        // finally 先构建，它自身使用外层的 FinallyContext
        ProcessResult finalizer = dispatcher.dispatch(adapter.field(node, Fields.FINALIZER), exitId, loop, fin);
        FinallyContext inner = finalizer.hasEntry() ? new FinallyContext(finalizer.entryNodeId()) : fin;

        ProcessResult result = ProcessResult.empty().addNode(tryNode).setEntry(tryNode.id());
        List<ExitPoint> exits = new ArrayList<>();

        ProcessResult body = dispatcher.dispatch(adapter.field(node, Fields.BODY), exitId, loop, inner);
        result.absorb(body);
        if (body.hasEntry()) {
            result.addEdge(tryNode.id(), body.entryNodeId());
            exits.addAll(body.openExits());
        } else {
            exits.add(ExitPoint.of(tryNode.id()));
        }

        for (SyntaxNode handler : adapter.fields(node, Fields.HANDLER)) {
            Optional<String> type = adapter.field(handler, Fields.PARAMETER).map(p -> p.text().trim());
            FlowchartNode catchNode = ctx.node("catch", type.map(t -> "catch (" + t + ")").orElse("catch"),
                    NodeType.EXCEPTION, handler);
            result.addNode(catchNode).addEdge(tryNode.id(), catchNode.id(),
                    type.map(t -> Labels.escape(t, ctx.options().maxLabelLength())).orElse("error"));

            ProcessResult handled = dispatcher.dispatch(adapter.field(handler, Fields.BODY), exitId, loop, inner);
            result.absorb(handled);
            if (handled.hasEntry()) {
                result.addEdge(catchNode.id(), handled.entryNodeId());
                exits.addAll(handled.openExits());
            } else {
                exits.add(ExitPoint.of(catchNode.id()));
            }
        }

        if (finalizer.hasEntry()) {
            result.absorb(finalizer);
            result.connect(exits, finalizer.entryNodeId());
            result.addExits(finalizer.openExits());
        } else {
            result.addExits(exits);
        }
        return result;
    }

    /**
     * with / synchronized / using：头节点显示语句到块开始之前的部分，随后是块本身
     */
    ProcessResult buildScoped(SyntaxNode node, String exitId, LoopContext loop, FinallyContext fin) {
        Optional<SyntaxNode> block = adapter.field(node, Fields.BODY);
        String header = block.map(b -> headerText(node, b)).orElseGet(() -> Labels.statement(node.text()));
        FlowchartNode scope = ctx.node("scope", header, NodeType.PROCESS, node);

        ProcessResult body = dispatcher.dispatch(block, exitId, loop, fin);
        ProcessResult result = ProcessResult.empty().addNode(scope).setEntry(scope.id()).absorb(body);
        if (body.hasEntry()) {
            result.addEdge(scope.id(), body.entryNodeId());
            result.addExits(body.openExits());
        } else {
            result.addExit(ExitPoint.of(scope.id()));
        }
        return result;
    }

    private static String headerText(SyntaxNode node, SyntaxNode body) {
        int cut = body.startOffset() - node.startOffset();
        String text = node.text();
        if (cut <= 0 || cut > text.length()) {
            return Labels.statement(text);
        }
        return text.substring(0, cut).trim();
    }
}
