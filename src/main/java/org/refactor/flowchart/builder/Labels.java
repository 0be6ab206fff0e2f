package org.refactor.flowchart.builder;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 节点标签的转义和截断
 */
final class Labels {

    private static final Pattern ENTITY = Pattern.compile("#(?:quot|\\d+);");
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    private Labels() {
    }

    static String escape(String raw, int maxLength) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '"':
                    sb.append("#quot;");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '<':
                    sb.append("#60;");
                    break;
                case '>':
                    sb.append("#62;");
                    break;
                case '`':
                    sb.append("#96;");
                    break;
                case '\n':
                case '\r':
                case '\t':
                    sb.append(' ');
                    break;
                default:
                    sb.append(c);
            }
        }
        String escaped = SPACES.matcher(sb).replaceAll(" ").trim();
        if (escaped.endsWith(":")) {
            escaped = escaped.substring(0, escaped.length() - 1).trim();
        }
        if (escaped.length() > maxLength) {
            escaped = escaped.substring(0, cutPoint(escaped, maxLength - 3)) + "...";
        }
        return escaped;
    }

    // 截断点不能落在 #quot; 这类实体或成对的反斜杠中间
    private static int cutPoint(String escaped, int limit) {
        Matcher entity = ENTITY.matcher(escaped);
        while (entity.find() && entity.start() < limit) {
            if (entity.end() > limit) {
                return entity.start();
            }
        }
        int slashes = 0;
        while (slashes < limit && escaped.charAt(limit - 1 - slashes) == '\\') {
            slashes++;
        }
        return slashes % 2 == 0 ? limit : limit - 1;
    }

    /**
     * 语句文本去掉结尾分号
     */
    static String statement(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    /**
     * 条件文本去掉一层包裹的括号，如 tree-sitter C 的 parenthesized_expression
     */
    static String condition(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '(' && trimmed.charAt(trimmed.length() - 1) == ')'
                && closingParen(trimmed) == trimmed.length() - 1) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static int closingParen(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
