package org.refactor.flowchart.syntax;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 读取 tree-sitter 风格的 JSON 语法树导出：
 * <pre>
 * {"kind": "if_statement", "start": 0, "end": 20, "text": "...",
 *  "fields": {"condition": {...}, "body": [{...}, {...}]},
 *  "children": [{...}]}
 * </pre>
 * 字段值可以是单个节点或节点数组；start/end 缺省时按 text 长度推算。
 */
public final class SyntaxTreeReader {

    private SyntaxTreeReader() {
    }

    public static TreeNode read(Reader reader) {
        try {
            return toNode(JsonParser.parseReader(reader), "$");
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid syntax tree JSON: " + e.getMessage(), e);
        }
    }

    public static TreeNode read(String json) {
        try {
            return toNode(JsonParser.parseString(json), "$");
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid syntax tree JSON: " + e.getMessage(), e);
        }
    }

    public static TreeNode read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    private static TreeNode toNode(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new IllegalArgumentException("expected a node object at " + path);
        }
        JsonObject obj = element.getAsJsonObject();
        if (!obj.has("kind")) {
            throw new IllegalArgumentException("node at " + path + " has no kind");
        }
        String kind = string(obj, "kind", path);
        String text = obj.has("text") ? string(obj, "text", path) : "";
        int start = obj.has("start") ? integer(obj, "start", path) : 0;
        int end = obj.has("end") ? integer(obj, "end", path) : start + text.length();
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ") at " + path);
        }
        TreeNode node = new TreeNode(kind, text, start, end);

        if (obj.has("fields")) {
            JsonElement fields = obj.get("fields");
            if (!fields.isJsonObject()) {
                throw new IllegalArgumentException("fields at " + path + " is not an object");
            }
            for (Map.Entry<String, JsonElement> entry : fields.getAsJsonObject().entrySet()) {
                String fieldPath = path + ".fields." + entry.getKey();
                JsonElement value = entry.getValue();
                if (value.isJsonArray()) {
                    JsonArray values = value.getAsJsonArray();
                    for (int i = 0; i < values.size(); i++) {
                        node.field(entry.getKey(), toNode(values.get(i), fieldPath + "[" + i + "]"));
                    }
                } else {
                    node.field(entry.getKey(), toNode(value, fieldPath));
                }
            }
        }
        if (obj.has("children")) {
            JsonElement children = obj.get("children");
            if (!children.isJsonArray()) {
                throw new IllegalArgumentException("children at " + path + " is not an array");
            }
            JsonArray list = children.getAsJsonArray();
            for (int i = 0; i < list.size(); i++) {
                node.child(toNode(list.get(i), path + ".children[" + i + "]"));
            }
        }
        return node;
    }

    private static String string(JsonObject obj, String key, String path) {
        JsonElement value = obj.get(key);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException(key + " at " + path + " is not a string: " + value);
        }
        return value.getAsString();
    }

    private static int integer(JsonObject obj, String key, String path) {
        JsonElement value = obj.get(key);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(key + " at " + path + " is not a number: " + value);
        }
        try {
            return value.getAsJsonPrimitive().getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " at " + path + " is not an int offset: " + value, e);
        }
    }
}
