package org.refactor.flowchart.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内存中的通用语法树节点，供直接交出语法树的解析器（或 JSON 导出）使用。
 * <p>
 * 字段节点同时也是子节点；添加时自动建立父引用。
 */
public final class TreeNode implements SyntaxNode {

    private final String kind;
    private final String text;
    private final int start;
    private final int end;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final Map<String, List<SyntaxNode>> fields = new LinkedHashMap<>();
    private TreeNode parent;

    public TreeNode(String kind, String text, int start, int end) {
        this.kind = kind;
        this.text = text == null ? "" : text;
        this.start = start;
        this.end = end;
    }

    /**
     * 区间按文本长度从 0 开始推算，适合手工搭建的小树
     */
    public static TreeNode of(String kind, String text) {
        return new TreeNode(kind, text, 0, text == null ? 0 : text.length());
    }

    public TreeNode child(TreeNode child) {
        adopt(child);
        children.add(child);
        return this;
    }

    public TreeNode children(TreeNode... nodes) {
        for (TreeNode node : nodes) {
            child(node);
        }
        return this;
    }

    public TreeNode field(String name, TreeNode value) {
        adopt(value);
        children.add(value);
        fields.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public TreeNode fields(String name, TreeNode... values) {
        for (TreeNode value : values) {
            field(name, value);
        }
        return this;
    }

    private void adopt(TreeNode node) {
        if (node.parent != null && node.parent != this) {
            throw new IllegalArgumentException(node.kind + " already belongs to " + node.parent.kind);
        }
        node.parent = this;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public int startOffset() {
        return start;
    }

    @Override
    public int endOffset() {
        return end;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Optional<SyntaxNode> field(String name) {
        List<SyntaxNode> values = fields.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public List<SyntaxNode> fields(String name) {
        return Collections.unmodifiableList(fields.getOrDefault(name, List.of()));
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")";
    }
}
