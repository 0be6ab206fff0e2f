package org.refactor.flowchart.builder;

import java.util.Objects;

/**
 * break/continue 的目标。每个循环（以及 switch）新建一个，按值向下传递，不在兄弟循环间共享。
 *
 * @param breakTargetId    break 跳转到的节点（循环或 switch 的出口节点）
 * @param continueTargetId continue 跳转到的节点；switch 上下文为 null
 * @param label            语句标签，用于 break L / continue L，可为 null
 * @param enclosing        外层上下文，可为 null
 * @param finallyScope     创建该上下文时所在的 finally，跳出它之外才需要经过 finally
 */
public record LoopContext(String breakTargetId,
                          String continueTargetId,
                          String label,
                          LoopContext enclosing,
                          FinallyContext finallyScope) {

    public LoopContext {
        Objects.requireNonNull(breakTargetId, "breakTargetId");
    }

    public static LoopContext of(String breakTargetId, String continueTargetId) {
        return new LoopContext(breakTargetId, continueTargetId, null, null, null);
    }

    /**
     * switch 内的 break 跳到 switch 出口，continue 仍属于外层循环
     */
    public static LoopContext forSwitch(String breakTargetId, String label, LoopContext outer,
                                        FinallyContext finallyScope) {
        return new LoopContext(breakTargetId, null, label, outer, finallyScope);
    }

    /**
     * break 的目标上下文：有标签时找同名的外层上下文，找不到就用最内层
     */
    public LoopContext breakContext(String targetLabel) {
        LoopContext labeled = findLabeled(targetLabel);
        return labeled != null ? labeled : this;
    }

    /**
     * continue 的目标上下文：只有循环才有 continue 目标
     */
    public LoopContext continueContext(String targetLabel) {
        LoopContext labeled = findLabeled(targetLabel);
        if (labeled != null && labeled.continueTargetId() != null) {
            return labeled;
        }
        for (LoopContext c = this; c != null; c = c.enclosing()) {
            if (c.continueTargetId() != null) {
                return c;
            }
        }
        return null;
    }

    private LoopContext findLabeled(String targetLabel) {
        if (targetLabel == null) {
            return null;
        }
        for (LoopContext c = this; c != null; c = c.enclosing()) {
            if (targetLabel.equals(c.label())) {
                return c;
            }
        }
        return null;
    }
}
