package org.refactor.flowchart.syntax;

/**
 * Promise 链上的一环
 */
public enum PromiseLink {
    THEN,
    CATCH,
    FINALLY
}
