package org.refactor.flowchart.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class KindTableAdapterTest {

    private final KindTableAdapter python = KindTableAdapter.builder("python")
            .kinds(StatementKind.CONDITIONAL, "if_statement", "elif_clause")
            .kinds(StatementKind.ITERATOR_LOOP, "for_statement")
            .kinds(StatementKind.SWITCH, "match_statement")
            .kinds(StatementKind.IGNORED, "pass_statement", "comment")
            .alias("for_statement.right", "iterable")
            .alias("case", "alternative")
            .callKinds("call")
            .constantTrue("True")
            .noFallthrough("match_statement")
            .fallthrough(CaseFallthrough.IMPLICIT)
            .defaultCaseKinds("case_wildcard")
            .iteration(IterationOp.MAP, "map")
            .promise(PromiseLink.THEN, "add_done_callback")
            .function("name", "body")
            .build();

    @Test
    public void testClassify() {
        assertThat(python.language()).isEqualTo("python");
        assertThat(python.classify(TreeNode.of("elif_clause", "elif x:"))).isEqualTo(StatementKind.CONDITIONAL);
        assertThat(python.classify(TreeNode.of("pass_statement", "pass"))).isEqualTo(StatementKind.IGNORED);
        assertThat(python.classify(TreeNode.of("print_statement", "print x"))).isEqualTo(StatementKind.DEFAULT);
    }

    @Test
    public void testKindSpecificAliasWins() {
        TreeNode loop = TreeNode.of("for_statement", "for x in xs:")
                .field("left", TreeNode.of("identifier", "x"))
                .field("iterable", TreeNode.of("identifier", "xs"));

        assertThat(python.field(loop, Fields.RIGHT).map(SyntaxNode::text)).hasValue("xs");
        assertThat(python.field(loop, Fields.LEFT).map(SyntaxNode::text)).hasValue("x");
    }

    @Test
    public void testAliasFallsBackToCanonicalName() {
        TreeNode match = TreeNode.of("match_statement", "match v:")
                .field("case", TreeNode.of("case_clause", "case 1:"));

        assertThat(python.fields(match, Fields.CASE)).hasSize(1);
    }

    @Test
    public void testRepeatedAliasedField() {
        TreeNode match = TreeNode.of("match_statement", "match v:")
                .fields("alternative", TreeNode.of("case_clause", "case 1:"), TreeNode.of("case_clause", "case 2:"));

        assertThat(python.fields(match, Fields.CASE)).hasSize(2);
    }

    @Test
    public void testConstantTrue() {
        assertThat(python.isConstantTrue(TreeNode.of("true", " True "))).isTrue();
        assertThat(python.isConstantTrue(TreeNode.of("true", "true"))).isTrue();
        assertThat(python.isConstantTrue(TreeNode.of("identifier", "running"))).isFalse();
    }

    @Test
    public void testFallthroughAndDefaults() {
        TreeNode match = TreeNode.of("match_statement", "match v:");
        TreeNode switchNode = TreeNode.of("switch_statement", "switch (v)");
        TreeNode wildcard = TreeNode.of("case_wildcard", "case _:");

        assertThat(python.fallthrough(match, wildcard)).isEqualTo(CaseFallthrough.NONE);
        assertThat(python.fallthrough(switchNode, wildcard)).isEqualTo(CaseFallthrough.IMPLICIT);
        assertThat(python.isDefaultCase(wildcard)).isTrue();
        assertThat(python.isDefaultCase(TreeNode.of("case_clause", "case 1:")
                .field("value", TreeNode.of("integer", "1")))).isFalse();
    }

    @Test
    public void testFunctionAccess() {
        TreeNode function = TreeNode.of("function_definition", "def f(): ...")
                .field("name", TreeNode.of("identifier", "f"))
                .field("body", TreeNode.of("block", "..."));

        assertThat(python.functionName(function)).isEqualTo("f");
        assertThat(python.functionBody(function)).isPresent();
        assertThat(python.functionName(TreeNode.of("lambda", "lambda: 1"))).isEqualTo("[anonymous]");
    }

    @Test
    public void testMethodTables() {
        assertThat(python.isCall(TreeNode.of("call", "f()"))).isTrue();
        assertThat(python.iterationOp("map")).hasValue(IterationOp.MAP);
        assertThat(python.iterationOp("filter")).isEmpty();
        assertThat(python.promiseLink("add_done_callback")).hasValue(PromiseLink.THEN);
    }

    @Test
    public void testEmptyTableRejected() {
        assertThrows(IllegalStateException.class, () -> KindTableAdapter.builder("empty").build());
    }
}
