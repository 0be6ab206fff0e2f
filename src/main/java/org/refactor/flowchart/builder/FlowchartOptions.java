package org.refactor.flowchart.builder;

import java.util.Properties;

/**
 * 引擎配置：节点数、递归深度和标签长度的上限。
 *
 * @param maxNodes       单个流程图最多生成的节点数
 * @param maxDepth       语句嵌套的最大递归深度
 * @param maxLabelLength 节点标签最大长度，超出部分以 "..." 截断
 */
public record FlowchartOptions(int maxNodes, int maxDepth, int maxLabelLength) {

    public static final int DEFAULT_MAX_NODES = 500;
    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_MAX_LABEL_LENGTH = 80;

    public FlowchartOptions {
        if (maxNodes < 3) {
            throw new IllegalArgumentException("maxNodes must be at least 3, got " + maxNodes);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (maxLabelLength < 4) {
            throw new IllegalArgumentException("maxLabelLength must be at least 4, got " + maxLabelLength);
        }
    }

    public static FlowchartOptions defaults() {
        return new FlowchartOptions(DEFAULT_MAX_NODES, DEFAULT_MAX_DEPTH, DEFAULT_MAX_LABEL_LENGTH);
    }

    /**
     * 从 flowchart.maxNodes / flowchart.maxDepth / flowchart.maxLabelLength 读取，缺省用默认值
     */
    public static FlowchartOptions fromProperties(Properties properties) {
        return new FlowchartOptions(
                intProperty(properties, "flowchart.maxNodes", DEFAULT_MAX_NODES),
                intProperty(properties, "flowchart.maxDepth", DEFAULT_MAX_DEPTH),
                intProperty(properties, "flowchart.maxLabelLength", DEFAULT_MAX_LABEL_LENGTH));
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    public FlowchartOptions withMaxNodes(int maxNodes) {
        return new FlowchartOptions(maxNodes, maxDepth, maxLabelLength);
    }

    public FlowchartOptions withMaxDepth(int maxDepth) {
        return new FlowchartOptions(maxNodes, maxDepth, maxLabelLength);
    }

    public FlowchartOptions withMaxLabelLength(int maxLabelLength) {
        return new FlowchartOptions(maxNodes, maxDepth, maxLabelLength);
    }
}
