package org.quasar.compiler.frontend.parser.ast;

/**
 * A visitor over every statement and declaration kind.
 *
 * @param <R> The result type.
 */
public interface StatementVisitor<R> {
    R visitBlock(Block node);
    R visitExpressionStmt(ExpressionStmt node);
    R visitIfStmt(IfStmt node);
    R visitWhileStmt(WhileStmt node);
    R visitForStmt(ForStmt node);
    R visitReturnStmt(ReturnStmt node);
    R visitBreakStmt(BreakStmt node);
    R visitContinueStmt(ContinueStmt node);
    R visitAssignStmt(AssignStmt node);
    R visitIndexAssignStmt(IndexAssignStmt node);
    R visitMemberAssignStmt(MemberAssignStmt node);
    R visitPrintStmt(PrintStmt node);
    R visitVarDecl(VarDecl node);
    R visitConstDecl(ConstDecl node);
    R visitFnDecl(FnDecl node);
    R visitStructDecl(StructDecl node);
    R visitEnumDecl(EnumDecl node);
    R visitImportDecl(ImportDecl node);
}
