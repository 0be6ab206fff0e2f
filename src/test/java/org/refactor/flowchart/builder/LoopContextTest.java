package org.refactor.flowchart.builder;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoopContextTest {

    private final LoopContext outer = new LoopContext("outer_end", "outer_head", "outer", null, null);
    private final LoopContext inner = new LoopContext("inner_end", "inner_head", null, outer, null);

    @Test
    public void testUnlabeledTargetsInnermost() {
        assertThat(inner.breakContext(null)).isSameInstanceAs(inner);
        assertThat(inner.continueContext(null)).isSameInstanceAs(inner);
    }

    @Test
    public void testLabeledTargetsEnclosing() {
        assertThat(inner.breakContext("outer")).isSameInstanceAs(outer);
        assertThat(inner.continueContext("outer")).isSameInstanceAs(outer);
    }

    @Test
    public void testUnknownLabelFallsBackToInnermost() {
        assertThat(inner.breakContext("nope")).isSameInstanceAs(inner);
        assertThat(inner.continueContext("nope")).isSameInstanceAs(inner);
    }

    @Test
    public void testSwitchBreaksButDoesNotContinue() {
        FinallyContext fin = new FinallyContext("finally_1");
        LoopContext sw = LoopContext.forSwitch("switch_end", null, inner, fin);

        assertThat(sw.breakContext(null)).isSameInstanceAs(sw);
        assertThat(sw.continueTargetId()).isNull();
        // continue 属于外层循环，保留外层循环自己的 finally 范围
        assertThat(sw.continueContext(null)).isSameInstanceAs(inner);
        assertThat(sw.continueContext(null).finallyScope()).isNull();
    }

    @Test
    public void testSwitchWithoutLoopHasNoContinue() {
        LoopContext sw = LoopContext.forSwitch("switch_end", null, null, null);

        assertThat(sw.continueContext(null)).isNull();
    }

    @Test
    public void testBreakTargetRequired() {
        assertThrows(NullPointerException.class, () -> LoopContext.of(null, "head"));
    }
}
