package org.refactor.flowchart.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.refactor.flowchart.builder.FlowchartEngine;
import org.refactor.flowchart.builder.FlowchartOptions;
import org.refactor.flowchart.ir.FlowchartIR;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Java 源码的流程图入口：用 JavaParser 解析源码，列出方法和构造器，按名字或光标位置生成流程图。
 * <p>
 * 构造器在列表中显示为 {@code Name()}，以便和同名方法区分。
 */
public class JavaFlowcharts {

    private static final Logger log = LoggerFactory.getLogger(JavaFlowcharts.class);

    private final JavaParser parser;
    private final FlowchartEngine engine;

    public JavaFlowcharts() {
        this(FlowchartOptions.defaults());
    }

    public JavaFlowcharts(FlowchartOptions options) {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
        this.engine = new FlowchartEngine(new JavaLanguageAdapter(), options);
    }

    /**
     * 按源码顺序列出所有方法和构造器
     *
     * @throws IllegalArgumentException 源码有语法错误
     */
    public List<String> listFunctions(String source) {
        return functions(parse(source).unit()).stream()
                .map(JavaFlowcharts::displayName)
                .collect(Collectors.toList());
    }

    /**
     * 包含 offset 的最内层函数（匿名类、局部类里的方法优先于外层方法）
     */
    public Optional<String> findFunctionAt(String source, int offset) {
        Parsed parsed = parse(source);
        return innermostAt(parsed, offset).map(JavaFlowcharts::displayName);
    }

    /**
     * 为指定名字的函数生成流程图；name 为 null 时取第一个函数
     *
     * @return 找不到函数时为空
     * @throws IllegalStateException 函数没有函数体（abstract、interface 方法）
     */
    public Optional<FlowchartIR> generate(String source, String name) {
        Parsed parsed = parse(source);
        return functions(parsed.unit()).stream()
                .filter(f -> name == null || name.equals(displayName(f)) || name.equals(f.getNameAsString()))
                .findFirst()
                .map(f -> engine.generate(new JavaSyntaxNode(f, parsed.source())));
    }

    public Optional<FlowchartIR> generateAt(String source, int offset) {
        Parsed parsed = parse(source);
        return innermostAt(parsed, offset).map(f -> engine.generate(new JavaSyntaxNode(f, parsed.source())));
    }

    /**
     * 所有有函数体的方法和构造器
     */
    public List<FlowchartIR> generateAll(String source) {
        Parsed parsed = parse(source);
        List<FlowchartIR> graphs = new ArrayList<>();
        for (CallableDeclaration<?> function : functions(parsed.unit())) {
            if (function instanceof MethodDeclaration method && method.getBody().isEmpty()) {
                log.debug("skipping {}: no body", method.getNameAsString());
                continue;
            }
            graphs.add(engine.generate(new JavaSyntaxNode(function, parsed.source())));
        }
        return graphs;
    }

    private record Parsed(CompilationUnit unit, JavaSource source) {
    }

    private Parsed parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source is null");
        }
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("Java source has syntax errors: " + describe(result.getProblems()));
        }
        return new Parsed(result.getResult().get(), new JavaSource(source));
    }

    private static String describe(List<Problem> problems) {
        return problems.stream()
                .map(p -> {
                    int line = p.getLocation()
                            .flatMap(l -> l.getBegin().getRange())
                            .map(r -> r.begin.line)
                            .orElse(-1);
                    return "line " + line + ": " + p.getMessage();
                })
                .collect(Collectors.joining("; "));
    }

    private static List<CallableDeclaration<?>> functions(CompilationUnit unit) {
        List<CallableDeclaration<?>> functions = new ArrayList<>();
        unit.walk(Node.TreeTraversal.PREORDER, node -> {
            if (node instanceof MethodDeclaration || node instanceof ConstructorDeclaration) {
                functions.add((CallableDeclaration<?>) node);
            }
        });
        return functions;
    }

    private static Optional<CallableDeclaration<?>> innermostAt(Parsed parsed, int offset) {
        CallableDeclaration<?> best = null;
        for (CallableDeclaration<?> function : functions(parsed.unit())) {
            int start = parsed.source().start(function);
            int end = parsed.source().end(function);
            if (offset >= start && offset <= end
                    && (best == null || start >= parsed.source().start(best))) {
                best = function;
            }
        }
        return Optional.ofNullable(best);
    }

    private static String displayName(CallableDeclaration<?> function) {
        return function instanceof ConstructorDeclaration
                ? function.getNameAsString() + "()"
                : function.getNameAsString();
    }
}
