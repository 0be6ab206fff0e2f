package org.refactor.flowchart.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.List;

@RunWith(JUnit4.class)
public final class FlowchartIRTest {

    private static FlowchartIR sample() {
        List<FlowchartNode> nodes = List.of(
                new FlowchartNode("start_0", "start: f", NodeShape.ROUND, NodeType.ENTRY, null, null),
                new FlowchartNode("if_2", "if (c)", null, NodeType.DECISION, null, new SourceSpan(10, 60)),
                new FlowchartNode("call_3", "a()", null, NodeType.FUNCTION_CALL, null, new SourceSpan(20, 24)),
                new FlowchartNode("end_1", "end", NodeShape.ROUND, NodeType.EXIT, null, null));
        List<FlowchartEdge> edges = List.of(
                new FlowchartEdge("start_0", "if_2"),
                new FlowchartEdge("if_2", "call_3", "True"),
                new FlowchartEdge("if_2", "end_1", "False"),
                new FlowchartEdge("call_3", "end_1"));
        List<LocationMapEntry> locations = List.of(
                new LocationMapEntry(10, 60, "if_2"),
                new LocationMapEntry(20, 24, "call_3"));
        return new FlowchartIR("f", nodes, edges, "start_0", "end_1", locations, new SourceSpan(0, 70));
    }

    @Test
    public void testLookups() {
        FlowchartIR ir = sample();

        assertThat(ir.node("call_3").map(FlowchartNode::label)).hasValue("a()");
        assertThat(ir.node("nope")).isEmpty();
        assertThat(ir.outgoing("if_2")).hasSize(2);
        assertThat(ir.incoming("end_1")).hasSize(2);
    }

    @Test
    public void testNodeAtPrefersInnermost() {
        FlowchartIR ir = sample();

        assertThat(ir.nodeAt(22)).hasValue("call_3");
        assertThat(ir.nodeAt(40)).hasValue("if_2");
        assertThat(ir.nodeAt(60)).isEmpty();
        assertThat(ir.nodeAt(5)).isEmpty();
    }

    @Test
    public void testListsAreCopied() {
        List<FlowchartNode> nodes = new ArrayList<>(sample().nodes());
        FlowchartIR ir = new FlowchartIR("f", nodes, List.of(), "start_0", "end_1", List.of(), null);
        nodes.clear();

        assertThat(ir.nodes()).hasSize(4);
        assertThrows(UnsupportedOperationException.class, () -> ir.nodes().clear());
    }

    @Test
    public void testSpanValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(5, 4));
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(-1, 4));
        assertThat(new SourceSpan(3, 5).contains(5)).isFalse();
        assertThat(new SourceSpan(3, 5).contains(3)).isTrue();
    }
}
