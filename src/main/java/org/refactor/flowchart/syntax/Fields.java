package org.refactor.flowchart.syntax;

/**
 * 引擎使用的规范字段名。适配器负责把语言自身的字段名映射到这些名字。
 */
public final class Fields {

    public static final String CONDITION = "condition";
    public static final String CONSEQUENCE = "consequence";
    public static final String ALTERNATIVE = "alternative";
    /** 语句体；lambda 等函数字面量的函数体也用这个名字 */
    public static final String BODY = "body";
    public static final String INIT = "init";
    public static final String UPDATE = "update";
    /** 迭代变量 */
    public static final String LEFT = "left";
    /** 被迭代的集合 */
    public static final String RIGHT = "right";
    /** switch 的判定值、case 的匹配值、return 的返回值 */
    public static final String VALUE = "value";
    public static final String CASE = "case";
    /** try 的 catch 子句 */
    public static final String HANDLER = "handler";
    public static final String PARAMETER = "parameter";
    public static final String FINALIZER = "finalizer";
    public static final String RESOURCES = "resources";
    public static final String LABEL = "label";
    /** 赋值左值 */
    public static final String TARGET = "target";
    public static final String EXPRESSION = "expression";
    /** 方法调用的接收者 */
    public static final String RECEIVER = "receiver";
    public static final String NAME = "name";
    public static final String ARGUMENTS = "arguments";
    public static final String MESSAGE = "message";

    private Fields() {
    }
}
