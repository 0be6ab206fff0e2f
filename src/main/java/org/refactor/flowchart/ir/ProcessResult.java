package org.refactor.flowchart.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 子图构建结果，也是组合的基本单位。
 * <p>
 * 每个语句构建器返回一个 ProcessResult，调用方把多个结果合并：
 * 节点和边直接并入，上一个结果的 exitPoints 连接到下一个结果的入口。
 * <ul>
 *     <li>entryNodeId 为 null 表示子图为空（空块、只有注释等），调用方应直接绕过</li>
 *     <li>exitPoints 是调用方仍需补出边的节点</li>
 *     <li>nodesConnectedToExit 是已经连到终点（函数出口、finally、循环目标）的节点，
 *     调用方不能再通过 exitPoints 连接它们</li>
 * </ul>
 */
public final class ProcessResult {

    private final List<FlowchartNode> nodes = new ArrayList<>();
    private final List<FlowchartEdge> edges = new ArrayList<>();
    private final List<ExitPoint> exitPoints = new ArrayList<>();
    private final Set<String> nodesConnectedToExit = new LinkedHashSet<>();
    private String entryNodeId;

    public static ProcessResult empty() {
        return new ProcessResult();
    }

    /**
     * 单节点结果：该节点既是入口也是唯一出口
     */
    public static ProcessResult single(FlowchartNode node) {
        ProcessResult result = new ProcessResult();
        result.addNode(node);
        result.setEntry(node.id());
        result.addExit(ExitPoint.of(node.id()));
        return result;
    }

    public ProcessResult addNode(FlowchartNode node) {
        nodes.add(node);
        return this;
    }

    public ProcessResult addEdge(String from, String to, String label) {
        edges.add(new FlowchartEdge(from, to, label));
        return this;
    }

    public ProcessResult addEdge(String from, String to) {
        return addEdge(from, to, null);
    }

    /**
     * 把一组出口连到 target，保留各自标签
     */
    public ProcessResult connect(Collection<ExitPoint> exits, String target) {
        for (ExitPoint exit : exits) {
            addEdge(exit.id(), target, exit.label());
        }
        return this;
    }

    /**
     * 并入另一个结果的节点、边和已连接集合；入口和出口由调用方决定如何处理
     */
    public ProcessResult absorb(ProcessResult other) {
        nodes.addAll(other.nodes);
        edges.addAll(other.edges);
        nodesConnectedToExit.addAll(other.nodesConnectedToExit);
        return this;
    }

    public ProcessResult setEntry(String nodeId) {
        this.entryNodeId = nodeId;
        return this;
    }

    public ProcessResult addExit(ExitPoint exit) {
        exitPoints.add(exit);
        return this;
    }

    public ProcessResult addExits(Collection<ExitPoint> exits) {
        exitPoints.addAll(exits);
        return this;
    }

    public ProcessResult markConnected(String nodeId) {
        nodesConnectedToExit.add(nodeId);
        return this;
    }

    public boolean hasEntry() {
        return entryNodeId != null;
    }

    /**
     * @return 入口节点 id，子图为空时为 null
     */
    public String entryNodeId() {
        return entryNodeId;
    }

    public List<FlowchartNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<FlowchartEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<ExitPoint> exitPoints() {
        return Collections.unmodifiableList(exitPoints);
    }

    /**
     * 尚未连接到终点的出口
     */
    public List<ExitPoint> openExits() {
        return exitPoints.stream().filter(e -> !nodesConnectedToExit.contains(e.id())).toList();
    }

    public Set<String> nodesConnectedToExit() {
        return Collections.unmodifiableSet(nodesConnectedToExit);
    }

    public boolean reaches(String targetId) {
        return edges.stream().anyMatch(e -> e.to().equals(targetId));
    }
}
