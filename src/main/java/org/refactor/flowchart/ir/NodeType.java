package org.refactor.flowchart.ir;

import com.google.gson.annotations.SerializedName;

/**
 * 节点语义类别，决定默认形状和样式
 */
public enum NodeType {
    @SerializedName("entry")
    ENTRY(NodeShape.ROUND, "fill:#e8f5e8,stroke:#2e7d32,stroke-width:2px,color:#000"),
    @SerializedName("exit")
    EXIT(NodeShape.ROUND, "fill:#ffebee,stroke:#c62828,stroke-width:2px,color:#000"),
    @SerializedName("process")
    PROCESS(NodeShape.RECT, "fill:#f3e5f5,stroke:#7b1fa2,stroke-width:1.5px,color:#000"),
    @SerializedName("decision")
    DECISION(NodeShape.DIAMOND, "fill:#fff3e0,stroke:#f57c00,stroke-width:1.5px,color:#000"),
    @SerializedName("loop_start")
    LOOP_START(NodeShape.DIAMOND, "fill:#e3f2fd,stroke:#1976d2,stroke-width:1.5px,color:#000"),
    @SerializedName("loop_end")
    LOOP_END(NodeShape.STADIUM, "fill:#e1f5fe,stroke:#0288d1,stroke-width:1.5px,color:#000"),
    @SerializedName("exception")
    EXCEPTION(NodeShape.STADIUM, "fill:#ffebee,stroke:#d32f2f,stroke-width:1.5px,color:#000"),
    @SerializedName("break_continue")
    BREAK_CONTINUE(NodeShape.RECT, "fill:#ffe0b2,stroke:#f57c00,stroke-width:1.5px,color:#000"),
    @SerializedName("function_call")
    FUNCTION_CALL(NodeShape.RECT, "fill:#e8eaf6,stroke:#3f51b5,stroke-width:1.5px,color:#000"),
    @SerializedName("assignment")
    ASSIGNMENT(NodeShape.RECT, "fill:#f3e5f5,stroke:#7b1fa2,stroke-width:1.5px,color:#000"),
    @SerializedName("return")
    RETURN(NodeShape.STADIUM, "fill:#ffebee,stroke:#d32f2f,stroke-width:1.5px,color:#000"),
    @SerializedName("async_operation")
    ASYNC_OPERATION(NodeShape.RECT, "fill:#e0f2f1,stroke:#00695c,stroke-width:1.5px,color:#000"),
    @SerializedName("await")
    AWAIT(NodeShape.RECT, "fill:#e0f7fa,stroke:#0097a7,stroke-width:1.5px,color:#000");

    private final NodeShape defaultShape;
    private final String style;

    NodeType(NodeShape defaultShape, String style) {
        this.defaultShape = defaultShape;
        this.style = style;
    }

    public NodeShape defaultShape() {
        return defaultShape;
    }

    public String style() {
        return style;
    }
}
