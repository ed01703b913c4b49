package org.quasar.compiler.frontend.parser.ast;

/**
 * The closed family of statement nodes. Declarations are statements as well, since
 * blocks and programs hold both in source order.
 */
public sealed interface Statement extends AstNode permits
        Block, ExpressionStmt, IfStmt, WhileStmt, ForStmt, ReturnStmt, BreakStmt, ContinueStmt,
        AssignStmt, IndexAssignStmt, MemberAssignStmt, PrintStmt, Declaration {

    /**
     * Dispatches to the visitor method for this node kind.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(StatementVisitor<R> visitor);
}
