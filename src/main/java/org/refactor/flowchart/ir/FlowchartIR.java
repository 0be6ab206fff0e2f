package org.refactor.flowchart.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个函数的完整流程图：所有出口已解析，所有边只引用 nodes 中的节点。
 */
public record FlowchartIR(String title,
                          List<FlowchartNode> nodes,
                          List<FlowchartEdge> edges,
                          String entryNodeId,
                          String exitNodeId,
                          List<LocationMapEntry> locationMap,
                          SourceSpan functionRange) {
    public FlowchartIR {
        Objects.requireNonNull(entryNodeId, "entryNodeId");
        Objects.requireNonNull(exitNodeId, "exitNodeId");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        locationMap = List.copyOf(locationMap);
    }

    public Optional<FlowchartNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<FlowchartEdge> outgoing(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<FlowchartEdge> incoming(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).toList();
    }

    /**
     * 编辑器点击位置对应的最内层节点
     */
    public Optional<String> nodeAt(int offset) {
        LocationMapEntry best = null;
        for (LocationMapEntry entry : locationMap) {
            if (offset >= entry.start() && offset < entry.end()
                    && (best == null || entry.end() - entry.start() < best.end() - best.start())) {
                best = entry;
            }
        }
        return Optional.ofNullable(best).map(LocationMapEntry::nodeId);
    }
}
