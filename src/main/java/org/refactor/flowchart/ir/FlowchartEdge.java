package org.refactor.flowchart.ir;

import java.util.Objects;

/**
 * 已解析的有向边；label 可为 null
 */
public record FlowchartEdge(String from, String to, String label) {
    public FlowchartEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public FlowchartEdge(String from, String to) {
        this(from, to, null);
    }
}
