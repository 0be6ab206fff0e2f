package org.refactor.flowchart.builder;

import org.refactor.flowchart.ir.ExitPoint;
import org.refactor.flowchart.ir.ProcessResult;
import org.refactor.flowchart.syntax.StatementKind;
import org.refactor.flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序组合一组语句：上一条语句的悬空出口连到下一条语句的入口。
 */
final class BlockComposer {

    private final BuildContext ctx;
    private final StatementDispatcher dispatcher;

    BlockComposer(BuildContext ctx, StatementDispatcher dispatcher) {
        this.ctx = ctx;
        this.dispatcher = dispatcher;
    }

    /**
     * 空列表（或全是注释、空语句）得到空结果，调用方应把它当作直接穿过
     */
    ProcessResult compose(List<SyntaxNode> statements, String exitId, LoopContext loop, FinallyContext fin) {
        ProcessResult block = ProcessResult.empty();
        List<ExitPoint> pending = new ArrayList<>();

        for (SyntaxNode statement : statements) {
            if (ctx.truncated()) {
                break;
            }
            if (ctx.adapter().classify(statement) == StatementKind.IGNORED) {
                continue;
            }
            ProcessResult current = dispatcher.dispatch(statement, exitId, loop, fin);
            block.absorb(current);
            // 空子图不打断顺序，上一条的出口留给下一条
            if (!current.hasEntry()) {
                continue;
            }
            if (!block.hasEntry()) {
                block.setEntry(current.entryNodeId());
            } else {
                block.connect(pending, current.entryNodeId());
            }
            pending = new ArrayList<>(current.openExits());
        }

        block.addExits(pending);
        return block;
    }
}
