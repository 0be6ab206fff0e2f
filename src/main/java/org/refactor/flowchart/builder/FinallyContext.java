package org.refactor.flowchart.builder;

import java.util.Objects;

/**
 * 当前所在 try 的 finally 入口。return/throw/break/continue 先经过它再到达名义目标。
 */
public record FinallyContext(String finallyEntryId) {
    public FinallyContext {
        Objects.requireNonNull(finallyEntryId, "finallyEntryId");
    }
}
