package org.refactor.flowchart.syntax;

/**
 * 语句形态的封闭集合，分发器按它选择构建器
 */
public enum StatementKind {
    /** 语句块 */
    SEQUENCE,
    CONDITIONAL,
    /** x = c ? a : b */
    TERNARY_ASSIGNMENT,
    /** for (init; cond; update) */
    COUNTED_LOOP,
    /** while (cond) */
    CONDITIONAL_LOOP,
    /** do ... while (cond) */
    POST_CONDITION_LOOP,
    /** for-each / for-in / for-of / range */
    ITERATOR_LOOP,
    /** loop {}，没有条件 */
    INFINITE_LOOP,
    SWITCH,
    /** 通道 select */
    SELECT,
    TRY,
    /** with / synchronized / using */
    SCOPED,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    GOTO,
    LABELED,
    /** 显式 fallthrough 标记 */
    FALLTHROUGH,
    ASSERT,
    AWAIT,
    /** go f() / spawn / submit */
    ASYNC_DISPATCH,
    /** 表达式语句，可能是高阶函数或 Promise 链 */
    EXPRESSION,
    /** 注释、pass、空语句、声明等不可执行语句 */
    IGNORED,
    DEFAULT
}
