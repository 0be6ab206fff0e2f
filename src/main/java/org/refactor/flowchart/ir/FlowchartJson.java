package org.refactor.flowchart.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 流程图的 JSON 输出，交给外部渲染器或编辑器。形状和类型输出为小写字符串。
 */
public final class FlowchartJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private FlowchartJson() {
    }

    public static String toJson(FlowchartIR ir) {
        return GSON.toJson(ir);
    }

    /**
     * @throws IllegalArgumentException JSON 格式不正确，或缺少必需字段
     */
    public static FlowchartIR fromJson(String json) {
        FlowchartIR ir;
        try {
            ir = GSON.fromJson(json, FlowchartIR.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid flowchart JSON: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // 记录构造器拒绝的值（缺少 id、非法区间等）由 Gson 包装后抛出
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("invalid flowchart JSON: " + cause.getMessage(), e);
        }
        if (ir == null) {
            throw new IllegalArgumentException("empty flowchart JSON");
        }
        return ir;
    }
}
