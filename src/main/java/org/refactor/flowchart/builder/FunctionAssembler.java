package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.FlowchartEdge;
import org.refactor.flowchart.ir.FlowchartIR;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.LocationMapEntry;
import org.refactor.flowchart.ir.NodeShape;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.ir.SourceSpan;
import org.refactor.flowchart.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 函数组装：给函数体加上 Start / End 节点，把剩余的悬空出口和 goto 全部解析成真正的边。
 */
final class FunctionAssembler {

    private static final Logger log = LoggerFactory.getLogger(FunctionAssembler.class);

    private final BuildContext ctx;

    FunctionAssembler(BuildContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @throws IllegalStateException 没有函数或函数没有函数体
     */
    FlowchartIR assemble(SyntaxNode function) {
        if (function == null) {
            throw new IllegalStateException("no function to process");
        }
        String name = ctx.adapter().functionName(function);
        SyntaxNode bodyNode = ctx.adapter().functionBody(function)
                .orElseThrow(() -> new IllegalStateException("function " + name + " has no body to process"));

        FlowchartNode start = ctx.node("start", "start: " + name, NodeType.ENTRY, NodeShape.ROUND, null);
        String exitId = ctx.nextId("end");

        ProcessResult body = new StatementDispatcher(ctx).dispatch(bodyNode, exitId, null, null);

        ProcessResult graph = ProcessResult.empty().addNode(start).setEntry(start.id());
        if (ctx.truncated()) {
            log.info("flowchart for {} truncated: {} nodes (limit {}), depth limit {}",
                    name, ctx.nodeCount(), ctx.options().maxNodes(), ctx.options().maxDepth());
            FlowchartNode sentinel = ctx.node("truncated", truncationLabel(), NodeType.PROCESS, null);
            graph.addNode(sentinel)
                    .addEdge(start.id(), sentinel.id())
                    .addEdge(sentinel.id(), exitId);
        } else {
            graph.absorb(body);
            if (body.hasEntry()) {
                graph.addEdge(start.id(), body.entryNodeId());
                graph.connect(body.openExits(), exitId);
            } else {
                graph.addEdge(start.id(), exitId);
            }
            for (BuildContext.PendingGoto pending : ctx.pendingGotos()) {
                String target = pending.label() == null ? null : ctx.labelEntry(pending.label());
                graph.addEdge(pending.fromId(), target != null ? target : exitId);
            }
        }
        graph.addNode(ctx.nodeWithId(exitId, "end", NodeType.EXIT, NodeShape.ROUND, null));

        FlowchartIR ir = validated(name, graph, start.id(), exitId,
                new SourceSpan(function.startOffset(), function.endOffset()));
        log.debug("flowchart for {}: {} nodes, {} edges", name, ir.nodes().size(), ir.edges().size());
        return ir;
    }

    private String truncationLabel() {
        if (ctx.nodeCount() > ctx.options().maxNodes()) {
            return "... (truncated at " + ctx.options().maxNodes() + " nodes)";
        }
        return "... (truncated at depth " + ctx.options().maxDepth() + ")";
    }

    // 丢弃端点不存在的边，正常构建不会出现
    private FlowchartIR validated(String name, ProcessResult graph, String entryId, String exitId,
                                  SourceSpan range) {
        Set<String> ids = graph.nodes().stream().map(FlowchartNode::id).collect(Collectors.toSet());
        List<FlowchartEdge> edges = new ArrayList<>();
        for (FlowchartEdge edge : graph.edges()) {
            if (ids.contains(edge.from()) && ids.contains(edge.to())) {
                edges.add(edge);
            } else {
                log.warn("dropping dangling edge {} -> {} in flowchart for {}", edge.from(), edge.to(), name);
            }
        }
        List<LocationMapEntry> locations = ctx.locationMap().stream()
                .filter(e -> ids.contains(e.nodeId()))
                .toList();
        return new FlowchartIR(name, graph.nodes(), edges, entryId, exitId, locations, range);
    }
}
