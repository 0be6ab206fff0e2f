package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.FlowchartNode;
import org.refactor.flowchart.ir.NodeType;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.Fields;
import org.refactor.flowchart.syntax.IterationOp;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.PromiseLink;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 表达式语句。调用链（xs.filter(..).map(..)、future.thenApply(..).exceptionally(..)）
 * 从最外层调用沿接收者走到根，再从左到右重放：
 * <ul>
 *     <li>高阶函数展开为显式循环：for each 头节点、回调（语句块 lambda 按语句展开）、收集节点，回到头节点</li>
 *     <li>Promise 链同时追踪 fulfilled 路径和累积的 rejection 来源</li>
 * </ul>
 * 其余表达式生成单个节点。
 */
final class ChainFlattener {

    static final String FULFILLED = "fulfilled";
    static final String REJECTED = "rejected";

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final StatementDispatcher dispatcher;

    ChainFlattener(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.dispatcher = dispatcher;
    }

    ProcessResult buildExpression(SyntaxNode node) {
        SyntaxNode expression = adapter.field(node, Fields.EXPRESSION).orElse(node);
        String target = adapter.field(node, Fields.TARGET).map(t -> t.text().trim()).orElse(null);
        if (!adapter.isCall(expression)) {
            return single(node, target != null ? NodeType.ASSIGNMENT : NodeType.PROCESS);
        }

        List<SyntaxNode> calls = chain(expression);
        int firstPromise = indexOf(calls, c -> adapter.promiseLink(methodName(c)).isPresent());
        if (firstPromise >= 0) {
            return promiseChain(node, target, calls, firstPromise);
        }
        int firstIteration = indexOf(calls, c -> adapter.iterationOp(methodName(c)).isPresent());
        if (firstIteration >= 0) {
            return iterationChain(node, target, calls, firstIteration);
        }
        return single(node, NodeType.FUNCTION_CALL);
    }

    // 从外到内收集调用，再反转成书写顺序
    private List<SyntaxNode> chain(SyntaxNode outermost) {
        List<SyntaxNode> calls = new ArrayList<>();
        SyntaxNode current = outermost;
        while (current != null) {
            if (adapter.isCall(current)) {
                calls.add(current);
            }
            current = adapter.field(current, Fields.RECEIVER).orElse(null);
        }
        Collections.reverse(calls);
        return calls;
    }

    private ProcessResult iterationChain(SyntaxNode node, String target, List<SyntaxNode> calls, int first) {
        ProcessResult result = ProcessResult.empty();
        List<ExitPoint> pending = new ArrayList<>();
        if (target != null) {
            FlowchartNode assign = ctx.node("assign", target + " = ...", NodeType.ASSIGNMENT, node);
            result.addNode(assign).setEntry(assign.id());
            pending.add(ExitPoint.of(assign.id()));
        }

        for (int i = first; i < calls.size(); i++) {
            SyntaxNode call = calls.get(i);
            String name = methodName(call);
            Optional<IterationOp> op = adapter.iterationOp(name);
            FlowchartNode entry;
            List<ExitPoint> exits;
            if (op.isPresent()) {
                String source = adapter.field(call, Fields.RECEIVER).map(r -> r.text().trim()).orElse("items");
                entry = ctx.node("hof", name + ": for each item in " + source, NodeType.LOOP_START, call);
                result.addNode(entry);
                List<ExitPoint> done = new ArrayList<>(List.of(ExitPoint.of(entry.id(), "done")));
                done.addAll(expandIteration(result, entry, op.get(), call));
                exits = done;
            } else {
                entry = ctx.node("call", name + "(" + arguments(call) + ")", NodeType.FUNCTION_CALL, call);
                result.addNode(entry);
                exits = List.of(ExitPoint.of(entry.id()));
            }
            if (!result.hasEntry()) {
                result.setEntry(entry.id());
            }
            result.connect(pending, entry.id());
            pending = exits;
        }
        return result.addExits(pending);
    }

    /**
     * 在头节点和回调之间展开一次迭代，返回头节点 "done" 之外的额外出口。
     * 回调是带语句块的 lambda 时语句块本身成为循环体，否则用一个节点概括回调。
     */
    private List<ExitPoint> expandIteration(ProcessResult result, FlowchartNode header, IterationOp op,
                                            SyntaxNode call) {
        String argument = arguments(call);
        switch (op) {
            case MAP: {
                Step apply = step(call, "map_apply", "apply " + argument);
                FlowchartNode collect = ctx.node("map_collect", "collect result", NodeType.PROCESS, null);
                result.addNode(collect).addEdge(collect.id(), header.id());
                apply.wire(result, header, collect.id());
                return List.of();
            }
            case FILTER: {
                Step test = step(call, "filter_test", "test " + argument);
                FlowchartNode keep = ctx.node("filter_keep", "keep item?", NodeType.DECISION, null);
                FlowchartNode collect = ctx.node("filter_collect", "keep item", NodeType.PROCESS, null);
                result.addNode(keep).addNode(collect)
                        .addEdge(keep.id(), collect.id(), "Yes")
                        .addEdge(keep.id(), header.id(), "No")
                        .addEdge(collect.id(), header.id());
                test.wire(result, header, keep.id());
                return List.of();
            }
            case MATCH: {
                Step test = step(call, "match_test", "test " + argument);
                FlowchartNode found = ctx.node("match_found", "match found?", NodeType.DECISION, null);
                result.addNode(found).addEdge(found.id(), header.id(), "No");
                test.wire(result, header, found.id());
                // 命中即停止遍历
                return List.of(ExitPoint.of(found.id(), "Yes"));
            }
            case REDUCE:
                step(call, "reduce_acc", "accumulate " + argument).wire(result, header, header.id());
                return List.of();
            case SORT:
                step(call, "sort_compare", "compare " + argument).wire(result, header, header.id());
                return List.of();
            case FOR_EACH:
            default:
                step(call, "for_each_run", "run " + argument).wire(result, header, header.id());
                return List.of();
        }
    }

    private Step step(SyntaxNode call, String prefix, String label) {
        // reduce(identity, (a, b) -> {...}) 的回调不在第一个参数
        Optional<SyntaxNode> body = adapter.fields(call, Fields.ARGUMENTS).stream()
                .map(argument -> adapter.field(argument, Fields.BODY))
                .flatMap(Optional::stream)
                .filter(b -> adapter.classify(b) == StatementKind.SEQUENCE)
                .findFirst();
        if (body.isPresent()) {
            return new Step(body.get(), null);
        }
        return new Step(null, ctx.node(prefix, label, NodeType.PROCESS, null));
    }

    /**
     * 一次迭代要执行的内容：回调的语句块，或者概括回调的单个节点
     */
    private final class Step {
        private final SyntaxNode body;
        private final FlowchartNode node;

        Step(SyntaxNode body, FlowchartNode node) {
            this.body = body;
            this.node = node;
        }

        /**
         * header --next--> 本步骤 --> next。回调里的 return 只结束当前元素，因此它的目标是 next；
         * 回调体外的循环和 finally 对回调不可见。
         */
        void wire(ProcessResult result, FlowchartNode header, String next) {
            if (node != null) {
                result.addNode(node)
                        .addEdge(header.id(), node.id(), "next")
                        .addEdge(node.id(), next);
                return;
            }
            ProcessResult callback = dispatcher.dispatch(body, next, null, null);
            result.absorb(callback);
            if (!callback.hasEntry()) {
                result.addEdge(header.id(), next, "next");
                return;
            }
            result.addEdge(header.id(), callback.entryNodeId(), "next")
                    .connect(callback.openExits(), next);
        }
    }

    private ProcessResult promiseChain(SyntaxNode node, String target, List<SyntaxNode> calls, int first) {
        String source = first > 0
                ? calls.get(first - 1).text().trim()
                : adapter.field(calls.get(0), Fields.RECEIVER).map(r -> r.text().trim()).orElse("promise");
        if (target != null) {
            source = target + " = " + source;
        }
        FlowchartNode origin = ctx.node("async", source, NodeType.ASYNC_OPERATION,
                first > 0 ? calls.get(first - 1) : node);

        ProcessResult result = ProcessResult.empty().addNode(origin).setEntry(origin.id());
        List<ExitPoint> fulfilled = new ArrayList<>(List.of(ExitPoint.of(origin.id(), FULFILLED)));
        Set<String> rejectionSources = new LinkedHashSet<>(List.of(origin.id()));

        for (int i = first; i < calls.size(); i++) {
            SyntaxNode call = calls.get(i);
            String name = methodName(call);
            List<SyntaxNode> args = adapter.fields(call, Fields.ARGUMENTS);
            Optional<PromiseLink> link = adapter.promiseLink(name);
            if (link.isEmpty()) {
                FlowchartNode step = ctx.node("call", name + "(" + arguments(call) + ")", NodeType.FUNCTION_CALL, call);
                result.addNode(step).connect(fulfilled, step.id());
                fulfilled = new ArrayList<>(List.of(ExitPoint.of(step.id(), FULFILLED)));
                rejectionSources.add(step.id());
                continue;
            }
            switch (link.get()) {
                case THEN: {
                    FlowchartNode onFulfilled = ctx.node("then", name + ": " + argument(args, 0),
                            NodeType.ASYNC_OPERATION, call);
                    result.addNode(onFulfilled).connect(fulfilled, onFulfilled.id());
                    fulfilled = new ArrayList<>(List.of(ExitPoint.of(onFulfilled.id(), FULFILLED)));
                    if (args.size() > 1) {
                        FlowchartNode onRejected = ctx.node("then_rejected", name + " rejected: " + argument(args, 1),
                                NodeType.ASYNC_OPERATION, null);
                        result.addNode(onRejected);
                        rejectionSources.forEach(s -> result.addEdge(s, onRejected.id(), REJECTED));
                        fulfilled.add(ExitPoint.of(onRejected.id(), FULFILLED));
                        rejectionSources = new LinkedHashSet<>(List.of(onFulfilled.id(), onRejected.id()));
                    } else {
                        rejectionSources.add(onFulfilled.id());
                    }
                    break;
                }
                case CATCH: {
                    FlowchartNode handler = ctx.node("catch", name + ": " + argument(args, 0),
                            NodeType.EXCEPTION, call);
                    result.addNode(handler);
                    rejectionSources.forEach(s -> result.addEdge(s, handler.id(), REJECTED));
                    // fulfilled 路径绕过 catch
                    fulfilled.add(ExitPoint.of(handler.id(), FULFILLED));
                    rejectionSources = new LinkedHashSet<>(List.of(handler.id()));
                    break;
                }
                case FINALLY:
                default: {
                    FlowchartNode always = ctx.node("finally", name + ": " + argument(args, 0),
                            NodeType.ASYNC_OPERATION, call);
                    result.addNode(always).connect(fulfilled, always.id());
                    Set<String> bothPaths = fulfilled.stream().map(ExitPoint::id).collect(Collectors.toSet());
                    // 同时在两条路径上的节点（如 catch）只连一条边
                    rejectionSources.stream()
                            .filter(s -> !bothPaths.contains(s))
                            .forEach(s -> result.addEdge(s, always.id(), REJECTED));
                    fulfilled = new ArrayList<>(List.of(ExitPoint.of(always.id(), FULFILLED)));
                    rejectionSources = new LinkedHashSet<>(List.of(always.id()));
                    break;
                }
            }
        }
        return result.addExits(fulfilled);
    }

    private ProcessResult single(SyntaxNode node, NodeType type) {
        String prefix = type == NodeType.FUNCTION_CALL ? "call" : type == NodeType.ASSIGNMENT ? "assign" : "stmt";
        return ProcessResult.single(ctx.node(prefix, Labels.statement(node.text()), type, node));
    }

    /**
     * 方法名；名字字段是 "obj.method" 这种成员表达式时取最后一段
     */
    private String methodName(SyntaxNode call) {
        String name = adapter.field(call, Fields.NAME).map(n -> n.text().trim()).orElse("");
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private String arguments(SyntaxNode call) {
        return adapter.fields(call, Fields.ARGUMENTS).stream()
                .map(a -> a.text().trim())
                .collect(Collectors.joining(", "));
    }

    private static String argument(List<SyntaxNode> args, int index) {
        return index < args.size() ? args.get(index).text().trim() : "";
    }

    private static int indexOf(List<SyntaxNode> calls, Predicate<SyntaxNode> test) {
        for (int i = 0; i < calls.size(); i++) {
            if (test.test(calls.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
