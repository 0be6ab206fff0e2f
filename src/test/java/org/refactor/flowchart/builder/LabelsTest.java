package org.refactor.flowchart.builder;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LabelsTest {

    @Test
    public void testEscapeSpecialCharacters() {
        assertThat(Labels.escape("a < b && c > \"d\"", 80)).isEqualTo("a #60; b && c #62; #quot;d#quot;");
        assertThat(Labels.escape("`tpl`", 80)).isEqualTo("#96;tpl#96;");
        assertThat(Labels.escape("a\\b", 80)).isEqualTo("a\\\\b");
    }

    @Test
    public void testEscapeCollapsesWhitespace() {
        assertThat(Labels.escape("  foo(\n\t  bar)  ", 80)).isEqualTo("foo( bar)");
    }

    @Test
    public void testEscapeDropsTrailingColon() {
        assertThat(Labels.escape("case 1:", 80)).isEqualTo("case 1");
    }

    @Test
    public void testEscapeTruncates() {
        assertThat(Labels.escape("abcdefghij", 8)).isEqualTo("abcde...");
        assertThat(Labels.escape("abcdefgh", 8)).isEqualTo("abcdefgh");
    }

    @Test
    public void testTruncationKeepsEntitiesWhole() {
        assertThat(Labels.escape("ab\"cdef", 8)).isEqualTo("ab...");
        assertThat(Labels.escape("x > yyyyyy", 8)).isEqualTo("x ...");
        // 刚好放下的实体保留
        assertThat(Labels.escape("abc<defgh", 10)).isEqualTo("abc#60;...");
        assertThat(Labels.escape("abcd\\efgh", 8)).isEqualTo("abcd...");
        assertThat(Labels.escape("ab\\cdefgh", 8)).isEqualTo("ab\\\\c...");
    }

    @Test
    public void testEscapeEmpty() {
        assertThat(Labels.escape(null, 10)).isEmpty();
        assertThat(Labels.escape("", 10)).isEmpty();
    }

    @Test
    public void testStatement() {
        assertThat(Labels.statement("  return x; ")).isEqualTo("return x");
        assertThat(Labels.statement("x++")).isEqualTo("x++");
    }

    @Test
    public void testCondition() {
        assertThat(Labels.condition("(x > 0)")).isEqualTo("x > 0");
        assertThat(Labels.condition("x > 0")).isEqualTo("x > 0");
        // 两组括号不是一层包裹
        assertThat(Labels.condition("(a) && (b)")).isEqualTo("(a) && (b)");
        assertThat(Labels.condition("((a))")).isEqualTo("(a)");
    }
}
