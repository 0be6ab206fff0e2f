package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.LanguageAdapter;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 语句分发器：按适配器给出的语句形态选择构建器，并在这里统一执行深度和节点数上限。
 * <p>
 * 与 {@link BlockComposer} 以及各构建器互相递归。
 */
final class StatementDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StatementDispatcher.class);

    private final BuildContext ctx;
    private final LanguageAdapter adapter;
    private final BlockComposer blocks;
    private final ConditionalBuilder conditionals;
    private final LoopBuilder loops;
    private final SwitchBuilder switches;
    private final ExceptionBuilder exceptions;
    private final JumpBuilder jumps;
    private final ChainFlattener chains;
    private final SimpleStatementBuilder simple;

    StatementDispatcher(BuildContext ctx) {
        this.ctx = ctx;
        this.adapter = ctx.adapter();
        this.blocks = new BlockComposer(ctx, this);
        this.conditionals = new ConditionalBuilder(ctx, this);
        this.loops = new LoopBuilder(ctx, this);
        this.switches = new SwitchBuilder(ctx, this);
        this.exceptions = new ExceptionBuilder(ctx, this);
        this.jumps = new JumpBuilder(ctx, this);
        this.chains = new ChainFlattener(ctx, this);
        this.simple = new SimpleStatementBuilder(ctx);
    }

    /**
     * 把一条语句变成子图
     *
     * @param node   语句节点
     * @param exitId 函数出口节点，return/throw 的最终目标
     * @param loop   最内层 break/continue 上下文，可为 null
     * @param fin    当前所在的 finally，可为 null
     */
    ProcessResult dispatch(SyntaxNode node, String exitId, LoopContext loop, FinallyContext fin) {
        if (ctx.truncated()) {
            return ProcessResult.empty();
        }
        try {
            if (!ctx.enter()) {
                log.debug("depth limit {} reached at {}", ctx.options().maxDepth(), node.kind());
                return ProcessResult.empty();
            }
            StatementKind kind = adapter.classify(node);
            switch (kind) {
                case SEQUENCE:
                    return blocks.compose(adapter.statements(node), exitId, loop, fin);
                case CONDITIONAL:
                    return conditionals.buildIf(node, exitId, loop, fin);
                case TERNARY_ASSIGNMENT:
                    return conditionals.buildTernary(node);
                case ASSERT:
                    return conditionals.buildAssert(node, exitId, fin);
                case COUNTED_LOOP:
                    return loops.buildCounted(node, exitId, loop, fin);
                case CONDITIONAL_LOOP:
                    return loops.buildConditional(node, exitId, loop, fin);
                case POST_CONDITION_LOOP:
                    return loops.buildPostCondition(node, exitId, loop, fin);
                case ITERATOR_LOOP:
                    return loops.buildIterator(node, exitId, loop, fin);
                case INFINITE_LOOP:
                    return loops.buildInfinite(node, exitId, loop, fin);
                case SWITCH:
                    return switches.buildSwitch(node, exitId, loop, fin, false);
                case SELECT:
                    return switches.buildSwitch(node, exitId, loop, fin, true);
                case TRY:
                    return exceptions.buildTry(node, exitId, loop, fin);
                case SCOPED:
                    return exceptions.buildScoped(node, exitId, loop, fin);
                case RETURN:
                    return jumps.buildReturn(node, exitId, fin);
                case THROW:
                    return jumps.buildThrow(node, exitId, fin);
                case BREAK:
                    return jumps.buildBreak(node, loop, fin);
                case CONTINUE:
                    return jumps.buildContinue(node, loop, fin);
                case GOTO:
                    return jumps.buildGoto(node);
                case LABELED:
                    return jumps.buildLabeled(node, exitId, loop, fin);
                case FALLTHROUGH:
                    return simple.buildOpaque(node);
                case AWAIT:
                    return simple.buildAwait(node);
                case ASYNC_DISPATCH:
                    return simple.buildAsyncDispatch(node);
                case EXPRESSION:
                    return chains.buildExpression(node);
                case IGNORED:
                    return ProcessResult.empty();
                case DEFAULT:
                default:
                    return simple.buildOpaque(node);
            }
        } finally {
            ctx.leave();
        }
    }

    /**
     * 语句体可能缺失（语法错误或空分支），缺失时返回空结果
     */
    ProcessResult dispatch(Optional<SyntaxNode> node, String exitId, LoopContext loop, FinallyContext fin) {
        return node.map(n -> dispatch(n, exitId, loop, fin)).orElseGet(ProcessResult::empty);
    }

    ProcessResult compose(List<SyntaxNode> statements, String exitId, LoopContext loop, FinallyContext fin) {
        return blocks.compose(statements, exitId, loop, fin);
    }
}
