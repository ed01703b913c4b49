package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.frontend.parser.ast.*;

import java.util.List;

/**
 * Decides whether a statement definitely returns, i.e. every control-flow path through it reaches a {@code return}.
 * <ul>
 *   <li>A sequence definitely returns iff its last statement does.</li>
 *   <li>An {@code if} definitely returns iff it has an {@code else} and both branches do.</li>
 *   <li>Loops never do, since their body may run zero times.</li>
 * </ul>
 */
final class ReturnPathAnalyzer implements StatementVisitor<Boolean> {

    static final ReturnPathAnalyzer INSTANCE = new ReturnPathAnalyzer();

    private ReturnPathAnalyzer() {}

    /**
     * @param statements A statement sequence.
     * @return {@code true} if the sequence definitely returns.
     */
    boolean definitelyReturns(List<Statement> statements) {
        if (statements.isEmpty()) {
            return false;
        }
        return statements.get(statements.size() - 1).accept(this);
    }

    @Override
    public Boolean visitBlock(Block node) {
        return definitelyReturns(node.statements());
    }

    @Override
    public Boolean visitReturnStmt(ReturnStmt node) {
        return true;
    }

    @Override
    public Boolean visitIfStmt(IfStmt node) {
        return node.elseBlock() != null
                && visitBlock(node.thenBlock())
                && visitBlock(node.elseBlock());
    }

    @Override
    public Boolean visitWhileStmt(WhileStmt node) {
        return false;
    }

    @Override
    public Boolean visitForStmt(ForStmt node) {
        return false;
    }

    @Override
    public Boolean visitExpressionStmt(ExpressionStmt node) {
        return false;
    }

    @Override
    public Boolean visitBreakStmt(BreakStmt node) {
        return false;
    }

    @Override
    public Boolean visitContinueStmt(ContinueStmt node) {
        return false;
    }

    @Override
    public Boolean visitAssignStmt(AssignStmt node) {
        return false;
    }

    @Override
    public Boolean visitIndexAssignStmt(IndexAssignStmt node) {
        return false;
    }

    @Override
    public Boolean visitMemberAssignStmt(MemberAssignStmt node) {
        return false;
    }

    @Override
    public Boolean visitPrintStmt(PrintStmt node) {
        return false;
    }

    @Override
    public Boolean visitVarDecl(VarDecl node) {
        return false;
    }

    @Override
    public Boolean visitConstDecl(ConstDecl node) {
        return false;
    }

    @Override
    public Boolean visitFnDecl(FnDecl node) {
        return false;
    }

    @Override
    public Boolean visitStructDecl(StructDecl node) {
        return false;
    }

    @Override
    public Boolean visitEnumDecl(EnumDecl node) {
        return false;
    }

    @Override
    public Boolean visitImportDecl(ImportDecl node) {
        return false;
    }
}
