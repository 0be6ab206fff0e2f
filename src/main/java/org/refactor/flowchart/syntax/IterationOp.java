package org.refactor.flowchart.syntax;

/**
 * 被展开为显式循环的高阶函数
 */
public enum IterationOp {
    MAP,
    FILTER,
    REDUCE,
    FOR_EACH,
    /** find、some、every 一类：找到匹配就提前结束 */
    MATCH,
    SORT
}
