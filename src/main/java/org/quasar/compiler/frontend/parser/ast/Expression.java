package org.quasar.compiler.frontend.parser.ast;

/**
 * The closed family of expression nodes. Every expression receives a resolved type
 * during semantic analysis.
 */
public sealed interface Expression extends AstNode permits
        IntLiteral, FloatLiteral, StringLiteral, BoolLiteral, Identifier,
        ListLiteral, DictLiteral, StructInit, BinaryExpr, UnaryExpr,
        CallExpr, IndexExpr, MemberAccess, MethodCall, RangeExpr {

    /**
     * Dispatches to the visitor method for this node kind.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
