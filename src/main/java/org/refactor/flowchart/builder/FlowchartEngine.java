package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.FlowchartIR;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.Objects;

/**
 * 流程图引擎入口。
 * <p>
 * 引擎只持有适配器和配置，每次 {@link #generate} 新建构建状态，所以同一个实例可以重复使用，也可以并发调用。
 *
 * <pre>
 * FlowchartEngine engine = new FlowchartEngine(adapter);
 * FlowchartIR ir = engine.generate(functionNode);
 * </pre>
 */
public class FlowchartEngine {

    private final LanguageAdapter adapter;
    private final FlowchartOptions options;

    public FlowchartEngine(LanguageAdapter adapter) {
        this(adapter, FlowchartOptions.defaults());
    }

    public FlowchartEngine(LanguageAdapter adapter, FlowchartOptions options) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * 为一个函数生成流程图
     *
     * @param function 函数节点，适配器能从中取出函数名和函数体
     * @return 所有出口都已解析的流程图
     * @throws IllegalStateException function 为 null 或没有函数体
     */
    public FlowchartIR generate(SyntaxNode function) {
        return new FunctionAssembler(new BuildContext(adapter, options)).assemble(function);
    }

    public LanguageAdapter adapter() {
        return adapter;
    }

    public FlowchartOptions options() {
        return options;
    }
}
