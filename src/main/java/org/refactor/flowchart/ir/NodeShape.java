package org.refactor.flowchart.ir;

import com.google.gson.annotations.SerializedName;

/**
 * 流程图节点形状
 */
public enum NodeShape {
    @SerializedName("rect") RECT,
    @SerializedName("diamond") DIAMOND,
    @SerializedName("round") ROUND,
    @SerializedName("stadium") STADIUM
}
