package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.LocationMapEntry;
import org.refactor.flowchart.ir.NodeShape;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.SourceSpan;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次流程图生成的全部可变状态：节点编号、位置映射、语句标签、待解析的 goto、递归深度和截断标记。
 * <p>
 * 每次调用 {@link FlowchartEngine#generate} 新建一个，不在调用之间共享。
 */
final class BuildContext {

    /**
     * 等待函数组装阶段解析的 goto 边
     */
    record PendingGoto(String fromId, String label) {
    }

    private final LanguageAdapter adapter;
    private final FlowchartOptions options;
    private final List<LocationMapEntry> locationMap = new ArrayList<>();
    private final Map<String, String> labelEntries = new HashMap<>();
    private final List<PendingGoto> pendingGotos = new ArrayList<>();

    private int idCounter = 0;
    private int nodeCount = 0;
    private int depth = 0;
    private boolean truncated = false;

    BuildContext(LanguageAdapter adapter, FlowchartOptions options) {
        this.adapter = adapter;
        this.options = options;
    }

    LanguageAdapter adapter() {
        return adapter;
    }

    FlowchartOptions options() {
        return options;
    }

    String nextId(String prefix) {
        return prefix + "_" + idCounter++;
    }

    /**
     * 新建节点并登记位置映射；标签在这里统一转义和截断
     */
    FlowchartNode node(String prefix, String label, NodeType type, SyntaxNode source) {
        return nodeWithId(nextId(prefix), label, type, null, source);
    }

    FlowchartNode node(String prefix, String label, NodeType type, NodeShape shape, SyntaxNode source) {
        return nodeWithId(nextId(prefix), label, type, shape, source);
    }

    /**
     * 用预留的 id 建节点，用于循环出口这类先被引用、后决定是否创建的节点
     */
    FlowchartNode nodeWithId(String id, String label, NodeType type, NodeShape shape, SyntaxNode source) {
        SourceSpan span = null;
        if (source != null && source.endOffset() >= source.startOffset()) {
            span = new SourceSpan(source.startOffset(), source.endOffset());
            locationMap.add(new LocationMapEntry(span.start(), span.end(), id));
        }
        if (++nodeCount > options.maxNodes()) {
            truncated = true;
        }
        return new FlowchartNode(id, Labels.escape(label, options.maxLabelLength()), shape, type, type.style(), span);
    }

    /**
     * 进入一层语句递归；超过深度上限时标记截断并返回 false
     */
    boolean enter() {
        if (++depth > options.maxDepth()) {
            truncated = true;
        }
        return !truncated;
    }

    void leave() {
        depth--;
    }

    boolean truncated() {
        return truncated;
    }

    int nodeCount() {
        return nodeCount;
    }

    void registerLabel(String label, String entryNodeId) {
        labelEntries.putIfAbsent(label, entryNodeId);
    }

    String labelEntry(String label) {
        return labelEntries.get(label);
    }

    void addPendingGoto(String fromId, String label) {
        pendingGotos.add(new PendingGoto(fromId, label));
    }

    List<PendingGoto> pendingGotos() {
        return Collections.unmodifiableList(pendingGotos);
    }

    List<LocationMapEntry> locationMap() {
        return Collections.unmodifiableList(locationMap);
    }
}
