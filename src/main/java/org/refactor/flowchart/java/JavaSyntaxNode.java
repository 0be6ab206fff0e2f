package org.refactor.flowchart.java;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 把 JavaParser 的 AST 节点包装成 {@link SyntaxNode}。
 * <p>
 * kind 是节点类的简单名（IfStmt、ForEachStmt ...），字段按规范字段名映射到 JavaParser 的 getter。
 * 两个包装对象只要底层节点是同一个对象就相等。
 */
public final class JavaSyntaxNode implements SyntaxNode {

    private final Node node;
    private final JavaSource source;

    JavaSyntaxNode(Node node, JavaSource source) {
        this.node = node;
        this.source = source;
    }

    public Node node() {
        return node;
    }

    @Override
    public String kind() {
        return node.getClass().getSimpleName();
    }

    @Override
    public int startOffset() {
        return source.start(node);
    }

    @Override
    public int endOffset() {
        return source.end(node);
    }

    @Override
    public String text() {
        if (node.getRange().isEmpty()) {
            return node.toString();
        }
        return source.slice(startOffset(), endOffset());
    }

    @Override
    public List<SyntaxNode> children() {
        if (node instanceof BlockStmt block) {
            return wrap(block.getStatements());
        }
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(child);
            }
        }
        return wrap(children);
    }

    @Override
    public Optional<SyntaxNode> field(String name) {
        List<SyntaxNode> values = fields(name);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public List<SyntaxNode> fields(String name) {
        return wrap(rawFields(name));
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return node.getParentNode().map(p -> new JavaSyntaxNode(p, source));
    }

    private List<SyntaxNode> wrap(List<? extends Node> nodes) {
        List<SyntaxNode> wrapped = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            wrapped.add(new JavaSyntaxNode(n, source));
        }
        return wrapped;
    }

    private List<? extends Node> rawFields(String name) {
        if (node instanceof IfStmt s) {
            switch (name) {
                case Fields.CONDITION:
                    return List.of(s.getCondition());
                case Fields.CONSEQUENCE:
                    return List.of(s.getThenStmt());
                case Fields.ALTERNATIVE:
                    return optional(s.getElseStmt());
                default:
                    return List.of();
            }
        }
        if (node instanceof WhileStmt s) {
            return conditionAndBody(name, s.getCondition(), s.getBody());
        }
        if (node instanceof DoStmt s) {
            return conditionAndBody(name, s.getCondition(), s.getBody());
        }
        if (node instanceof ForStmt s) {
            switch (name) {
                case Fields.INIT:
                    return s.getInitialization();
                case Fields.CONDITION:
                    return optional(s.getCompare());
                case Fields.UPDATE:
                    return s.getUpdate();
                case Fields.BODY:
                    return List.of(s.getBody());
                default:
                    return List.of();
            }
        }
        if (node instanceof ForEachStmt s) {
            switch (name) {
                case Fields.LEFT:
                    return s.getVariable().getVariables().isEmpty()
                            ? List.of()
                            : List.of(s.getVariable().getVariables().get(0).getName());
                case Fields.RIGHT:
                    return List.of(s.getIterable());
                case Fields.BODY:
                    return List.of(s.getBody());
                default:
                    return List.of();
            }
        }
        if (node instanceof SwitchStmt s) {
            switch (name) {
                case Fields.VALUE:
                    return List.of(s.getSelector());
                case Fields.CASE:
                    return s.getEntries();
                default:
                    return List.of();
            }
        }
        if (node instanceof SwitchEntry s) {
            switch (name) {
                case Fields.VALUE:
                    return s.getLabels();
                case Fields.BODY:
                    return s.getStatements();
                default:
                    return List.of();
            }
        }
        if (node instanceof TryStmt s) {
            switch (name) {
                case Fields.BODY:
                    return List.of(s.getTryBlock());
                case Fields.HANDLER:
                    return s.getCatchClauses();
                case Fields.FINALIZER:
                    return optional(s.getFinallyBlock());
                case Fields.RESOURCES:
                    return s.getResources();
                default:
                    return List.of();
            }
        }
        if (node instanceof CatchClause s) {
            switch (name) {
                case Fields.PARAMETER:
                    return List.of(s.getParameter().getType());
                case Fields.BODY:
                    return List.of(s.getBody());
                default:
                    return List.of();
            }
        }
        if (node instanceof ReturnStmt s) {
            return Fields.VALUE.equals(name) ? optional(s.getExpression()) : List.of();
        }
        if (node instanceof ThrowStmt s) {
            return Fields.VALUE.equals(name) ? List.of(s.getExpression()) : List.of();
        }
        if (node instanceof YieldStmt s) {
            return Fields.VALUE.equals(name) ? List.of(s.getExpression()) : List.of();
        }
        if (node instanceof BreakStmt s) {
            return Fields.LABEL.equals(name) ? optional(s.getLabel()) : List.of();
        }
        if (node instanceof ContinueStmt s) {
            return Fields.LABEL.equals(name) ? optional(s.getLabel()) : List.of();
        }
        if (node instanceof LabeledStmt s) {
            switch (name) {
                case Fields.LABEL:
                    return List.of(s.getLabel());
                case Fields.BODY:
                    return List.of(s.getStatement());
                default:
                    return List.of();
            }
        }
        if (node instanceof AssertStmt s) {
            switch (name) {
                case Fields.CONDITION:
                    return List.of(s.getCheck());
                case Fields.MESSAGE:
                    return optional(s.getMessage());
                default:
                    return List.of();
            }
        }
        if (node instanceof SynchronizedStmt s) {
            switch (name) {
                case Fields.EXPRESSION:
                    return List.of(s.getExpression());
                case Fields.BODY:
                    return List.of(s.getBody());
                default:
                    return List.of();
            }
        }
        if (node instanceof ExpressionStmt s) {
            return expressionFields(s, name);
        }
        if (node instanceof MethodCallExpr s) {
            switch (name) {
                case Fields.RECEIVER:
                    return optional(s.getScope());
                case Fields.NAME:
                    return List.of(s.getName());
                case Fields.ARGUMENTS:
                    return s.getArguments();
                default:
                    return List.of();
            }
        }
        if (node instanceof LambdaExpr s) {
            // 表达式 lambda 的函数体是 ExpressionStmt，语句块 lambda 是 BlockStmt
            return Fields.BODY.equals(name) ? List.of(s.getBody()) : List.of();
        }
        if (node instanceof MethodDeclaration s) {
            switch (name) {
                case Fields.NAME:
                    return List.of(s.getName());
                case Fields.BODY:
                    return optional(s.getBody());
                default:
                    return List.of();
            }
        }
        if (node instanceof ConstructorDeclaration s) {
            switch (name) {
                case Fields.NAME:
                    return List.of(s.getName());
                case Fields.BODY:
                    return List.of(s.getBody());
                default:
                    return List.of();
            }
        }
        return List.of();
    }

    private static List<? extends Node> conditionAndBody(String name, Expression condition, Node body) {
        switch (name) {
            case Fields.CONDITION:
                return List.of(condition);
            case Fields.BODY:
                return List.of(body);
            default:
                return List.of();
        }
    }

    /**
     * 表达式语句：EXPRESSION 是赋值的右值（或单个变量的初始化表达式），TARGET 是左值；
     * 右值是三元表达式时还提供 CONDITION / CONSEQUENCE / ALTERNATIVE
     */
    private static List<? extends Node> expressionFields(ExpressionStmt stmt, String name) {
        Optional<Expression> value = assignedValue(stmt);
        switch (name) {
            case Fields.EXPRESSION:
                return value.isPresent() ? List.of(value.get()) : List.of(stmt.getExpression());
            case Fields.TARGET:
                return optional(assignedTarget(stmt));
            case Fields.CONDITION:
                return optional(ternary(stmt).map(ConditionalExpr::getCondition));
            case Fields.CONSEQUENCE:
                return optional(ternary(stmt).map(ConditionalExpr::getThenExpr));
            case Fields.ALTERNATIVE:
                return optional(ternary(stmt).map(ConditionalExpr::getElseExpr));
            default:
                return List.of();
        }
    }

    private static Optional<Expression> assignedValue(ExpressionStmt stmt) {
        Expression expression = stmt.getExpression();
        if (expression instanceof AssignExpr assign) {
            return Optional.of(assign.getValue());
        }
        return singleDeclarator(expression).flatMap(VariableDeclarator::getInitializer);
    }

    private static Optional<Node> assignedTarget(ExpressionStmt stmt) {
        Expression expression = stmt.getExpression();
        if (expression instanceof AssignExpr assign) {
            return Optional.of(assign.getTarget());
        }
        return singleDeclarator(expression)
                .filter(v -> v.getInitializer().isPresent())
                .map(v -> (Node) v.getName());
    }

    private static Optional<VariableDeclarator> singleDeclarator(Expression expression) {
        if (expression instanceof VariableDeclarationExpr declaration && declaration.getVariables().size() == 1) {
            return Optional.of(declaration.getVariables().get(0));
        }
        return Optional.empty();
    }

    /**
     * 形如 x = c ? a : b 或 T x = c ? a : b 的语句中的三元表达式；复合赋值（+= 等）不算
     */
    static Optional<ConditionalExpr> ternary(ExpressionStmt stmt) {
        Expression expression = stmt.getExpression();
        if (expression instanceof AssignExpr assign && assign.getOperator() != AssignExpr.Operator.ASSIGN) {
            return Optional.empty();
        }
        Optional<Expression> value = assignedValue(stmt);
        while (value.isPresent() && value.get() instanceof EnclosedExpr enclosed) {
            value = Optional.of(enclosed.getInner());
        }
        return value.filter(ConditionalExpr.class::isInstance).map(ConditionalExpr.class::cast);
    }

    private static List<? extends Node> optional(Optional<? extends Node> value) {
        return value.isPresent() ? List.of(value.get()) : List.of();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JavaSyntaxNode other && other.node == node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    @Override
    public String toString() {
        return kind() + "[" + startOffset() + "," + endOffset() + ")";
    }
}
