package org.refactor.flowchart;

import static com.google.common.truth.Truth.assertWithMessage;

import org.refactor.flowchart.ir.FlowchartEdge;
import org.refactor.flowchart.ir.FlowchartIR;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 测试用的流程图查询和结构检查
 */
public final class Graphs {

    private Graphs() {
    }

    /**
     * 标签完全相等的唯一节点
     */
    public static FlowchartNode node(FlowchartIR ir, String label) {
        List<FlowchartNode> found = ir.nodes().stream().filter(n -> n.label().equals(label)).toList();
        assertWithMessage("nodes labeled '%s' in %s", label, labels(ir)).that(found).hasSize(1);
        return found.get(0);
    }

    /**
     * 标签以 prefix 开头的唯一节点
     */
    public static FlowchartNode nodeStartingWith(FlowchartIR ir, String prefix) {
        List<FlowchartNode> found = ir.nodes().stream().filter(n -> n.label().startsWith(prefix)).toList();
        assertWithMessage("nodes starting with '%s' in %s", prefix, labels(ir)).that(found).hasSize(1);
        return found.get(0);
    }

    public static List<FlowchartNode> nodesOfType(FlowchartIR ir, NodeType type) {
        return ir.nodes().stream().filter(n -> n.type() == type).toList();
    }

    public static boolean hasLabel(FlowchartIR ir, String label) {
        return ir.nodes().stream().anyMatch(n -> n.label().equals(label));
    }

    public static List<String> labels(FlowchartIR ir) {
        return ir.nodes().stream().map(FlowchartNode::label).toList();
    }

    public static FlowchartNode entry(FlowchartIR ir) {
        return ir.node(ir.entryNodeId()).orElseThrow();
    }

    public static FlowchartNode exit(FlowchartIR ir) {
        return ir.node(ir.exitNodeId()).orElseThrow();
    }

    /**
     * from 到 to 之间的边，按边标签返回（无标签为 null）
     */
    public static List<String> edgeLabels(FlowchartIR ir, FlowchartNode from, FlowchartNode to) {
        return ir.edges().stream()
                .filter(e -> e.from().equals(from.id()) && e.to().equals(to.id()))
                .map(FlowchartEdge::label)
                .collect(Collectors.toList());
    }

    public static List<FlowchartNode> successors(FlowchartIR ir, FlowchartNode from) {
        return ir.outgoing(from.id()).stream()
                .map(e -> ir.node(e.to()).orElseThrow())
                .toList();
    }

    public static Set<String> reachableFrom(FlowchartIR ir, String startId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>();
        work.push(startId);
        while (!work.isEmpty()) {
            String id = work.pop();
            if (seen.add(id)) {
                ir.outgoing(id).forEach(e -> work.push(e.to()));
            }
        }
        return seen;
    }

    public static boolean reaches(FlowchartIR ir, FlowchartNode from, FlowchartNode to) {
        return reachableFrom(ir, from.id()).contains(to.id());
    }

    /**
     * 每个完成的流程图都必须满足：id 唯一，边只引用已有节点，终点没有出边，
     * 从起点可达的非终点节点都有出边（没有悬空出口）
     */
    public static void assertWellFormed(FlowchartIR ir) {
        Set<String> ids = new HashSet<>();
        for (FlowchartNode node : ir.nodes()) {
            assertWithMessage("duplicate id %s", node.id()).that(ids.add(node.id())).isTrue();
        }
        assertWithMessage("entry").that(ids).contains(ir.entryNodeId());
        assertWithMessage("exit").that(ids).contains(ir.exitNodeId());
        for (FlowchartEdge edge : ir.edges()) {
            assertWithMessage("edge source %s", edge).that(ids).contains(edge.from());
            assertWithMessage("edge target %s", edge).that(ids).contains(edge.to());
        }
        assertWithMessage("edges leaving the exit node").that(ir.outgoing(ir.exitNodeId())).isEmpty();
        for (String id : reachableFrom(ir, ir.entryNodeId())) {
            if (!id.equals(ir.exitNodeId())) {
                assertWithMessage("dangling node %s in %s", id, labels(ir)).that(ir.outgoing(id)).isNotEmpty();
            }
        }
        ir.locationMap().forEach(e -> assertWithMessage("location %s", e).that(ids).contains(e.nodeId()));
    }
}
