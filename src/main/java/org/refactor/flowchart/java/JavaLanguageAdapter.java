package org.refactor.flowchart.java;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import org.refactor.flowchart.syntax.CaseFallthrough;
import org.refactor.flowchart.syntax.IterationOp;
import org.refactor.flowchart.syntax.KindTableAdapter;
import org.refactor.flowchart.syntax.PromiseLink;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.Set;

/**
 * JavaParser AST 的适配器。
 * <p>
 * Stream API 的 map/filter/reduce/forEach、anyMatch 一类和 sorted 展开为循环，语句块 lambda 按语句展开成循环体；
 * CompletableFuture 的 thenXxx/exceptionally/whenComplete 按 Promise 链处理。传统 {@code case:} 分组会落入下一个分支，箭头 case 不会。
 */
public class JavaLanguageAdapter extends KindTableAdapter {

    private static final Set<String> ASYNC_DISPATCH_METHODS = Set.of("submit", "execute");

    public JavaLanguageAdapter() {
        super(table());
    }

    private static Builder table() {
        return builder("java")
                .kinds(StatementKind.SEQUENCE, "BlockStmt")
                .kinds(StatementKind.CONDITIONAL, "IfStmt")
                .kinds(StatementKind.COUNTED_LOOP, "ForStmt")
                .kinds(StatementKind.CONDITIONAL_LOOP, "WhileStmt")
                .kinds(StatementKind.POST_CONDITION_LOOP, "DoStmt")
                .kinds(StatementKind.ITERATOR_LOOP, "ForEachStmt")
                .kinds(StatementKind.SWITCH, "SwitchStmt")
                .kinds(StatementKind.TRY, "TryStmt")
                .kinds(StatementKind.SCOPED, "SynchronizedStmt")
                .kinds(StatementKind.RETURN, "ReturnStmt")
                .kinds(StatementKind.THROW, "ThrowStmt")
                // yield 只出现在 switch 表达式里，语义同 break
                .kinds(StatementKind.BREAK, "BreakStmt", "YieldStmt")
                .kinds(StatementKind.CONTINUE, "ContinueStmt")
                .kinds(StatementKind.LABELED, "LabeledStmt")
                .kinds(StatementKind.ASSERT, "AssertStmt")
                .kinds(StatementKind.EXPRESSION, "ExpressionStmt")
                .kinds(StatementKind.IGNORED, "EmptyStmt", "LocalClassDeclarationStmt",
                        "LocalRecordDeclarationStmt")
                .callKinds("MethodCallExpr")
                .iteration(IterationOp.MAP, "map", "mapToInt", "mapToLong", "mapToDouble", "mapToObj", "flatMap")
                .iteration(IterationOp.FILTER, "filter")
                .iteration(IterationOp.REDUCE, "reduce")
                .iteration(IterationOp.FOR_EACH, "forEach", "forEachOrdered")
                .iteration(IterationOp.MATCH, "anyMatch", "allMatch", "noneMatch")
                .iteration(IterationOp.SORT, "sorted", "sort")
                .promise(PromiseLink.THEN, "thenApply", "thenAccept", "thenRun", "thenCompose", "thenCombine",
                        "thenApplyAsync", "thenAcceptAsync", "thenRunAsync", "thenComposeAsync",
                        "thenCombineAsync")
                .promise(PromiseLink.CATCH, "exceptionally", "exceptionallyCompose")
                .promise(PromiseLink.FINALLY, "whenComplete", "whenCompleteAsync", "handle", "handleAsync");
    }

    @Override
    public StatementKind classify(SyntaxNode node) {
        if (node instanceof JavaSyntaxNode javaNode && javaNode.node() instanceof ExpressionStmt stmt) {
            if (JavaSyntaxNode.ternary(stmt).isPresent()) {
                return StatementKind.TERNARY_ASSIGNMENT;
            }
            if (stmt.getExpression() instanceof MethodCallExpr call
                    && ASYNC_DISPATCH_METHODS.contains(call.getNameAsString())) {
                return StatementKind.ASYNC_DISPATCH;
            }
        }
        return super.classify(node);
    }

    @Override
    public CaseFallthrough fallthrough(SyntaxNode switchNode, SyntaxNode caseClause) {
        if (caseClause instanceof JavaSyntaxNode javaNode && javaNode.node() instanceof SwitchEntry entry) {
            return entry.getType() == SwitchEntry.Type.STATEMENT_GROUP ? CaseFallthrough.IMPLICIT : CaseFallthrough.NONE;
        }
        return super.fallthrough(switchNode, caseClause);
    }
}
