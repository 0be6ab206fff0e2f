package org.refactor.flowchart.ir;

import java.util.Objects;

/**
 * 子图的悬空出口：控制流从 id 节点离开，出边应带上 label。
 * 调用方知道下游入口后才把它变成真正的边。
 */
public record ExitPoint(String id, String label) {
    public ExitPoint {
        Objects.requireNonNull(id, "id");
    }

    public static ExitPoint of(String id) {
        return new ExitPoint(id, null);
    }

    public static ExitPoint of(String id, String label) {
        return new ExitPoint(id, label);
    }
}
