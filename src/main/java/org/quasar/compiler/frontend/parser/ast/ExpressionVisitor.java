package org.quasar.compiler.frontend.parser.ast;

/**
 * A visitor over every expression kind. Adding a node kind forces every visitor to handle it.
 *
 * @param <R> The result type.
 */
public interface ExpressionVisitor<R> {
    R visitIntLiteral(IntLiteral node);
    R visitFloatLiteral(FloatLiteral node);
    R visitStringLiteral(StringLiteral node);
    R visitBoolLiteral(BoolLiteral node);
    R visitIdentifier(Identifier node);
    R visitListLiteral(ListLiteral node);
    R visitDictLiteral(DictLiteral node);
    R visitStructInit(StructInit node);
    R visitBinaryExpr(BinaryExpr node);
    R visitUnaryExpr(UnaryExpr node);
    R visitCallExpr(CallExpr node);
    R visitIndexExpr(IndexExpr node);
    R visitMemberAccess(MemberAccess node);
    R visitMethodCall(MethodCall node);
    R visitRangeExpr(RangeExpr node);
}
