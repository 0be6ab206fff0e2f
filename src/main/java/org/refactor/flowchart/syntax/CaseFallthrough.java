package org.refactor.flowchart.syntax;

/**
 * case 执行完后控制流去向
 */
public enum CaseFallthrough {
    /** 没有 break 就落入下一个 case（C、Java 传统 switch） */
    IMPLICIT,
    /** 只有以 fallthrough 标记结尾才落入下一个 case（Go） */
    EXPLICIT,
    /** 从不落入（箭头 case、match） */
    NONE
}
