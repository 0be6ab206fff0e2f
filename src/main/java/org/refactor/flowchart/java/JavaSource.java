package org.refactor.flowchart.java;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * 源码文本和行首偏移表，把 JavaParser 的行列位置（从 1 开始，结束位置包含在内）换算成字符偏移 [start, end)。
 */
final class JavaSource {

    private final String text;
    private final int[] lineStarts;

    JavaSource(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    String text() {
        return text;
    }

    int offset(Position position) {
        int line = Math.max(1, Math.min(position.line, lineStarts.length));
        int offset = lineStarts[line - 1] + Math.max(0, position.column - 1);
        return Math.min(offset, text.length());
    }

    int start(Node node) {
        return node.getRange().map(r -> offset(r.begin)).orElse(0);
    }

    int end(Node node) {
        return node.getRange().map(r -> Math.min(offset(r.end) + 1, text.length())).orElse(0);
    }

    String slice(int start, int end) {
        if (start < 0 || end > text.length() || end < start) {
            return "";
        }
        return text.substring(start, end);
    }
}
