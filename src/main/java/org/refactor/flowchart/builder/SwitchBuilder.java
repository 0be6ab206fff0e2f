package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.CaseFallthrough;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * switch / match / select。
 * <p>
 * 头节点到每个 case 节点一条边，边标签是 case 的匹配值。是否落入下一个 case 由适配器决定；
 * 落入时接到后面第一个有语句的 case 的入口。break 跳到预留的 switch 出口节点。
 */
final class SwitchBuilder {

    static final String NO_MATCH = "no match";

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    SwitchBuilder(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    /**
     * 单个 case 的构建结果
     */
    private record CaseResult(ProcessResult body, List<ExitPoint> exits, boolean fallsThrough) {
    }

    /**
     * @param select 通道 select：没有落入，也没有 "no match" 出口（阻塞直到某个分支就绪）
     */
    ProcessResult buildSwitch(SyntaxNode node, String exitId, LoopContext outer, FinallyContext fin,
                              boolean select) {
        String header = select ? "select" : "switch (" + adapter.field(node, Fields.VALUE)
                .map(v -> Labels.condition(v.text()))
                .orElse("value") + ")";
        FlowchartNode head = ctx.node(select ? "select" : "switch", header, NodeType.DECISION, node);
        String endId = ctx.nextId(select ? "select_end" : "switch_end");
        LoopContext loop = LoopContext.forSwitch(endId, LoopBuilder.statementLabel(adapter, node), outer, fin);

        ProcessResult result = ProcessResult.empty().addNode(head).setEntry(head.id());
        List<CaseResult> cases = new ArrayList<>();
        boolean hasDefault = false;

        for (SyntaxNode clause : adapter.fields(node, Fields.CASE)) {
            boolean isDefault = adapter.isDefaultCase(clause);
            hasDefault |= isDefault;
            String values = adapter.fields(clause, Fields.VALUE).stream()
                    .map(v -> v.text().trim())
                    .collect(Collectors.joining(", "));
            FlowchartNode caseNode = ctx.node("case", isDefault ? "default" : "case " + values,
                    NodeType.PROCESS, clause);
            result.addNode(caseNode).addEdge(head.id(), caseNode.id(),
                    isDefault ? NO_MATCH : Labels.escape(values, ctx.options().maxLabelLength()));

            List<SyntaxNode> statements = new ArrayList<>(adapter.fields(clause, Fields.BODY));
            CaseFallthrough policy = select ? CaseFallthrough.NONE : adapter.fallthrough(node, clause);
            boolean fallsThrough = fallsThrough(policy, statements);

            ProcessResult body = dispatcher.compose(statements, exitId, loop, fin);
            result.absorb(body);
            List<ExitPoint> exits = new ArrayList<>();
            if (body.hasEntry()) {
                result.addEdge(caseNode.id(), body.entryNodeId());
                exits.addAll(body.openExits());
            } else {
                exits.add(ExitPoint.of(caseNode.id()));
            }
            cases.add(new CaseResult(body, exits, fallsThrough));
        }

        for (int i = 0; i < cases.size(); i++) {
            CaseResult current = cases.get(i);
            String next = current.fallsThrough() ? nextBodyEntry(cases, i + 1) : null;
            result.connect(current.exits(), next != null ? next : endId);
        }

        if (result.reaches(endId)) {
            FlowchartNode end = ctx.nodeWithId(endId, select ? "end select" : "end switch", NodeType.PROCESS,
                    null, null);
            result.addNode(end).addExit(ExitPoint.of(end.id()));
        }
        if (!hasDefault && !select) {
            result.addExit(ExitPoint.of(head.id(), NO_MATCH));
        }
        return result;
    }

    // EXPLICIT 策略下结尾的 fallthrough 标记只决定去向，不生成节点
    private boolean fallsThrough(CaseFallthrough policy, List<SyntaxNode> statements) {
        switch (policy) {
            case IMPLICIT:
                return true;
            case EXPLICIT:
                for (int i = statements.size() - 1; i >= 0; i--) {
                    StatementKind kind = adapter.classify(statements.get(i));
                    if (kind == StatementKind.IGNORED) {
                        continue;
                    }
                    if (kind == StatementKind.FALLTHROUGH) {
                        statements.remove(i);
                        return true;
                    }
                    return false;
                }
                return false;
            case NONE:
            default:
                return false;
        }
    }

    private static String nextBodyEntry(List<CaseResult> cases, int from) {
        for (int j = from; j < cases.size(); j++) {
            if (cases.get(j).body().hasEntry()) {
                return cases.get(j).body().entryNodeId();
            }
        }
        return null;
    }
}
