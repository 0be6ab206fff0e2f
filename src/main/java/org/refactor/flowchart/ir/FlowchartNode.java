package org.refactor.flowchart.ir;

import java.util.Objects;

/**
 * 流程图中的一个节点。创建后不可变。
 *
 * @param id         图内唯一编号
 * @param label      已转义的显示文本
 * @param shape      形状
 * @param type       语义类别
 * @param style      样式，可为 null
 * @param sourceSpan 对应源码区间，可为 null（如 Start/End 等合成节点）
 */
public record FlowchartNode(String id, String label, NodeShape shape, NodeType type, String style,
                            SourceSpan sourceSpan) {
    public FlowchartNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        label = label == null ? "" : label;
        shape = shape == null ? type.defaultShape() : shape;
    }
}
