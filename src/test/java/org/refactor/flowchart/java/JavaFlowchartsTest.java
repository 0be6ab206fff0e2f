package org.refactor.flowchart.java;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refactor.flowchart.Graphs;
import org.refactor.flowchart.ir.FlowchartIR;

import java.util.List;
import java.util.stream.Collectors;

@RunWith(JUnit4.class)
public final class JavaFlowchartsTest {

    private static final String SOURCE = "abstract class Shapes {\n"
            + "    Shapes() {\n"
            + "        init();\n"
            + "    }\n"
            + "\n"
            + "    abstract double area();\n"
            + "\n"
            + "    int count(int[] xs) {\n"
            + "        return xs.length;\n"
            + "    }\n"
            + "\n"
            + "    Runnable task = new Runnable() {\n"
            + "        public void run() {\n"
            + "            go();\n"
            + "        }\n"
            + "    };\n"
            + "}\n";

    private final JavaFlowcharts flowcharts = new JavaFlowcharts();

    @Test
    public void testListFunctions() {
        assertThat(flowcharts.listFunctions(SOURCE)).containsExactly("Shapes()", "area", "count", "run").inOrder();
    }

    @Test
    public void testFindFunctionAt() {
        assertThat(flowcharts.findFunctionAt(SOURCE, SOURCE.indexOf("xs.length"))).hasValue("count");
        assertThat(flowcharts.findFunctionAt(SOURCE, SOURCE.indexOf("init()"))).hasValue("Shapes()");
        // 匿名类里的方法优先
        assertThat(flowcharts.findFunctionAt(SOURCE, SOURCE.indexOf("go()"))).hasValue("run");
        assertThat(flowcharts.findFunctionAt(SOURCE, 0)).isEmpty();
    }

    @Test
    public void testGenerateByName() {
        FlowchartIR ir = flowcharts.generate(SOURCE, "count").orElseThrow();

        assertThat(ir.title()).isEqualTo("count");
        assertThat(Graphs.hasLabel(ir, "return xs.length")).isTrue();
        Graphs.assertWellFormed(ir);
    }

    @Test
    public void testGenerateConstructorByDisplayName() {
        FlowchartIR ir = flowcharts.generate(SOURCE, "Shapes()").orElseThrow();

        assertThat(ir.title()).isEqualTo("Shapes");
        assertThat(Graphs.hasLabel(ir, "init()")).isTrue();
    }

    @Test
    public void testGenerateUnknownName() {
        assertThat(flowcharts.generate(SOURCE, "missing")).isEmpty();
    }

    @Test
    public void testGenerateAbstractMethodFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> flowcharts.generate(SOURCE, "area"));
        assertThat(e).hasMessageThat().contains("area");
    }

    @Test
    public void testGenerateAt() {
        FlowchartIR ir = flowcharts.generateAt(SOURCE, SOURCE.indexOf("go()")).orElseThrow();

        assertThat(ir.title()).isEqualTo("run");
        assertThat(flowcharts.generateAt(SOURCE, 0)).isEmpty();
    }

    @Test
    public void testGenerateAllSkipsBodylessMethods() {
        List<FlowchartIR> graphs = flowcharts.generateAll(SOURCE);

        List<String> titles = graphs.stream().map(FlowchartIR::title).collect(Collectors.toList());
        assertThat(titles).containsExactly("Shapes", "count", "run").inOrder();
        graphs.forEach(Graphs::assertWellFormed);
    }

    @Test
    public void testSyntaxError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> flowcharts.listFunctions("class Broken {\n    void f( {\n}\n"));
        assertThat(e).hasMessageThat().startsWith("Java source has syntax errors");
        assertThat(e).hasMessageThat().contains("line ");
    }

    @Test
    public void testNullSource() {
        assertThrows(IllegalArgumentException.class, () -> flowcharts.listFunctions(null));
    }
}
