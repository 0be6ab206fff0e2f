package org.refactor.flowchart.ir;

/**
 * 源码区间到节点的映射，用于编辑器联动
 */
public record LocationMapEntry(int start, int end, String nodeId) {
}
