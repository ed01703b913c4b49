package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.diagnostics.CompilerLogger;
import org.quasar.compiler.diagnostics.Span;
import org.quasar.compiler.frontend.parser.ast.*;
import org.quasar.compiler.types.DictType;
import org.quasar.compiler.types.EnumType;
import org.quasar.compiler.types.ListType;
import org.quasar.compiler.types.OpaqueType;
import org.quasar.compiler.types.PrimitiveType;
import org.quasar.compiler.types.StructType;
import org.quasar.compiler.types.Type;
import org.quasar.compiler.types.Types;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks statements and declarations: scoping, binding, control flow and definite returns.
 * Expressions are delegated to {@link ExpressionTyper}.
 */
final class StatementChecker implements StatementVisitor<Void> {

    private final AnalysisContext context;
    private final ExpressionTyper expressions;
    private final TypeResolver types;

    StatementChecker(AnalysisContext context) {
        this.context = context;
        this.expressions = new ExpressionTyper(context);
        this.types = new TypeResolver(context);
    }

    void check(Statement statement) {
        statement.accept(this);
    }

    private void checkAll(List<Statement> statements) {
        for (Statement statement : statements) {
            check(statement);
        }
    }

    // region Control flow

    @Override
    public Void visitBlock(Block node) {
        try (SymbolTable.ScopeGuard ignored = context.symbols.enterScope()) {
            checkAll(node.statements());
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node) {
        expressions.type(node.expression());
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node) {
        requireCondition(node.condition());
        visitBlock(node.thenBlock());
        if (node.elseBlock() != null) {
            visitBlock(node.elseBlock());
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node) {
        requireCondition(node.condition());
        context.loopDepth++;
        try {
            visitBlock(node.body());
        } finally {
            context.loopDepth--;
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node) {
        Type iterable = expressions.type(node.iterable());
        Type variableType;
        if (iterable instanceof ListType list) {
            variableType = list.elementType();
        } else if (iterable == OpaqueType.MODULE) {
            variableType = OpaqueType.MODULE;
        } else {
            throw context.error(CompilerErrorCode.NOT_ITERABLE,
                    "cannot iterate over type '" + iterable.displayName() + "'", node.iterable().span());
        }
        context.checkNotReserved(node.variable(), node.span());

        context.loopDepth++;
        // The loop variable and the body share one scope.
        try (SymbolTable.ScopeGuard ignored = context.symbols.enterScope()) {
            context.symbols.define(Symbol.variable(node.variable(), variableType));
            checkAll(node.body().statements());
        } finally {
            context.loopDepth--;
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node) {
        Type expected = context.currentReturnType;
        if (expected == null) {
            throw context.error(CompilerErrorCode.RETURN_OUTSIDE_FUNCTION, "return outside of function", node.span());
        }
        if (node.value() == null) {
            if (expected != PrimitiveType.VOID) {
                throw context.error(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                        "return type mismatch: expected " + expected.displayName() + ", got void", node.span());
            }
            return null;
        }
        Type actual = expressions.type(node.value());
        if (!Types.isAssignable(expected, actual)) {
            throw context.error(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                    "return type mismatch: expected " + expected.displayName() + ", got " + actual.displayName(),
                    node.value().span());
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node) {
        if (context.loopDepth == 0) {
            throw context.error(CompilerErrorCode.BREAK_OUTSIDE_LOOP, "'break' outside of loop", node.span());
        }
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node) {
        if (context.loopDepth == 0) {
            throw context.error(CompilerErrorCode.CONTINUE_OUTSIDE_LOOP, "'continue' outside of loop", node.span());
        }
        return null;
    }

    private void requireCondition(Expression condition) {
        Type type = expressions.type(condition);
        if (type != PrimitiveType.BOOL && type != OpaqueType.MODULE) {
            throw context.error(CompilerErrorCode.NON_BOOL_CONDITION,
                    "condition must be bool, got '" + type.displayName() + "'", condition.span());
        }
    }

    // endregion

    // region Assignments

    @Override
    public Void visitAssignStmt(AssignStmt node) {
        Symbol symbol = context.symbols.lookup(node.target())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                        "use of undeclared identifier '" + node.target() + "'", node.targetSpan()));
        if (symbol.isConst()) {
            throw context.error(CompilerErrorCode.CONST_REASSIGNMENT,
                    "cannot assign to constant '" + node.target() + "'", node.targetSpan());
        }
        Type actual = expressions.type(node.value());
        if (!Types.isAssignable(symbol.type(), actual)) {
            throw context.error(CompilerErrorCode.TYPE_MISMATCH,
                    "type mismatch: cannot assign '" + actual.displayName() + "' to '" + node.target()
                            + "' of type '" + symbol.type().displayName() + "'", node.value().span());
        }
        return null;
    }

    @Override
    public Void visitIndexAssignStmt(IndexAssignStmt node) {
        expressions.type(node.target());
        Type container = context.expressionTypes.get(node.target().target());
        Type actual = expressions.type(node.value());
        if (container instanceof ListType list && !Types.isAssignable(list.elementType(), actual)) {
            throw context.error(CompilerErrorCode.ELEMENT_TYPE_MISMATCH,
                    "cannot assign '" + actual.displayName() + "' to element of '" + list.displayName() + "'",
                    node.value().span());
        }
        if (container instanceof DictType dict && !Types.isAssignable(dict.valueType(), actual)) {
            throw context.error(CompilerErrorCode.DICT_VALUE_TYPE_MISMATCH,
                    "dict value type mismatch: expected '" + dict.valueType().displayName() + "', got '"
                            + actual.displayName() + "'", node.value().span());
        }
        return null;
    }

    @Override
    public Void visitMemberAssignStmt(MemberAssignStmt node) {
        Type field = expressions.type(node.target());
        if (field instanceof EnumType && !(context.expressionTypes.get(node.target().object()) instanceof StructType)) {
            throw context.error(CompilerErrorCode.CONST_REASSIGNMENT,
                    "cannot assign to enum variant '" + field.displayName() + "." + node.target().member() + "'",
                    node.target().span());
        }
        Type actual = expressions.type(node.value());
        if (!Types.isAssignable(field, actual)) {
            throw context.error(CompilerErrorCode.FIELD_ASSIGN_TYPE_MISMATCH,
                    "cannot assign '" + actual.displayName() + "' to field '" + node.target().member()
                            + "' of type '" + field.displayName() + "'", node.value().span());
        }
        return null;
    }

    @Override
    public Void visitPrintStmt(PrintStmt node) {
        checkFormatArguments(node.arguments());
        node.arguments().forEach(expressions::type);
        requireStr(node.separator(), CompilerErrorCode.PRINT_SEP_NOT_STR, "sep");
        requireStr(node.terminator(), CompilerErrorCode.PRINT_END_NOT_STR, "end");
        return null;
    }

    private void checkFormatArguments(List<Expression> arguments) {
        if (arguments.size() < 2 || !(arguments.get(0) instanceof StringLiteral format)) {
            return;
        }
        int placeholders = countPlaceholders(format.value());
        if (placeholders == 0) {
            return;
        }
        int supplied = arguments.size() - 1;
        if (supplied < placeholders) {
            throw context.error(CompilerErrorCode.FORMAT_TOO_FEW_ARGUMENTS,
                    "format string has " + placeholders + " placeholder(s) but only " + supplied + " argument(s)",
                    format.span());
        }
        if (supplied > placeholders) {
            throw context.error(CompilerErrorCode.FORMAT_TOO_MANY_ARGUMENTS,
                    "format string has " + placeholders + " placeholder(s) but " + supplied + " argument(s)",
                    format.span());
        }
    }

    static int countPlaceholders(String format) {
        String unescaped = format.replace("{{", "").replace("}}", "");
        int count = 0;
        int index = unescaped.indexOf("{}");
        while (index >= 0) {
            count++;
            index = unescaped.indexOf("{}", index + 2);
        }
        return count;
    }

    private void requireStr(Expression expression, CompilerErrorCode code, String keyword) {
        if (expression == null) {
            return;
        }
        Type type = expressions.type(expression);
        if (type != PrimitiveType.STR && type != OpaqueType.MODULE) {
            throw context.error(code,
                    "print '" + keyword + "' must be str, got '" + type.displayName() + "'", expression.span());
        }
    }

    // endregion

    // region Declarations

    @Override
    public Void visitVarDecl(VarDecl node) {
        Type declared = checkBinding(node.name(), node.type(), node.initializer(), node.span());
        defineOrFail(Symbol.variable(node.name(), declared), node.span());
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node) {
        Type declared = checkBinding(node.name(), node.type(), node.initializer(), node.span());
        defineOrFail(Symbol.constant(node.name(), declared), node.span());
        return null;
    }

    private Type checkBinding(String name, TypeRef annotation, Expression initializer, Span span) {
        context.checkNotReserved(name, span);
        Type declared = types.resolve(annotation);
        Type actual = expressions.type(initializer);
        if (!Types.isAssignable(declared, actual)) {
            throw context.error(CompilerErrorCode.TYPE_MISMATCH,
                    "type mismatch: expected '" + declared.displayName() + "', got '" + actual.displayName() + "'",
                    initializer.span());
        }
        return declared;
    }

    private void defineOrFail(Symbol symbol, Span span) {
        if (!context.symbols.define(symbol)) {
            throw context.error(CompilerErrorCode.REDECLARATION,
                    "redeclaration of '" + symbol.name() + "' in the same scope", span);
        }
    }

    @Override
    public Void visitFnDecl(FnDecl node) {
        context.checkNotReserved(node.name(), node.span());
        Type returnType = types.resolve(node.returnType());
        List<Type> parameterTypes = new ArrayList<>();
        for (Param param : node.params()) {
            parameterTypes.add(types.resolve(param.type()));
        }
        // Defined before the body so recursive calls resolve.
        defineOrFail(Symbol.function(node.name(), returnType, parameterTypes), node.span());
        CompilerLogger.trace("Checking function '{}' returning {}", node.name(), returnType);

        Type enclosingReturnType = context.currentReturnType;
        int enclosingLoopDepth = context.loopDepth;
        context.currentReturnType = returnType;
        context.loopDepth = 0;
        try (SymbolTable.ScopeGuard ignored = context.symbols.enterScope()) {
            for (int i = 0; i < node.params().size(); i++) {
                Param param = node.params().get(i);
                context.checkNotReserved(param.name(), param.span());
                if (!context.symbols.define(Symbol.variable(param.name(), parameterTypes.get(i)))) {
                    throw context.error(CompilerErrorCode.REDECLARATION,
                            "redeclaration of parameter '" + param.name() + "'", param.span());
                }
            }
            checkAll(node.body().statements());
        } finally {
            context.currentReturnType = enclosingReturnType;
            context.loopDepth = enclosingLoopDepth;
        }

        if (returnType != PrimitiveType.VOID && !ReturnPathAnalyzer.INSTANCE.definitelyReturns(node.body().statements())) {
            throw context.error(CompilerErrorCode.MISSING_RETURN,
                    "function '" + node.name() + "' may not return a value on all paths", node.span());
        }
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node) {
        context.checkNotReserved(node.name(), node.span());
        rejectDuplicateType(node.name(), node.span(), true);

        Map<String, Type> fields = new LinkedHashMap<>();
        for (FieldDecl field : node.fields()) {
            if (fields.containsKey(field.name())) {
                throw context.error(CompilerErrorCode.DUPLICATE_FIELD,
                        "duplicate field '" + field.name() + "' in struct '" + node.name() + "'", field.span());
            }
            fields.put(field.name(), types.resolve(field.type()));
        }
        StructType struct = new StructType(node.name(), fields);
        context.symbols.define(Symbol.typeName(node.name(), struct));
        context.declaredTypes.put(node.name(), struct);
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node) {
        context.checkNotReserved(node.name(), node.span());
        rejectDuplicateType(node.name(), node.span(), false);

        Set<String> seen = new HashSet<>();
        List<String> variants = new ArrayList<>();
        for (EnumVariant variant : node.variants()) {
            if (!seen.add(variant.name())) {
                throw context.error(CompilerErrorCode.DUPLICATE_VARIANT,
                        "duplicate variant '" + variant.name() + "' in enum '" + node.name() + "'", variant.span());
            }
            variants.add(variant.name());
        }
        EnumType enumType = new EnumType(node.name(), variants);
        context.symbols.define(Symbol.typeName(node.name(), enumType));
        context.declaredTypes.put(node.name(), enumType);
        return null;
    }

    /**
     * Rejects a type declaration whose name is already bound in the current scope. Only a struct
     * redeclaring a struct is E0800; every other clash between type names is E1200.
     */
    private void rejectDuplicateType(String name, Span span, boolean declaringStruct) {
        Optional<Symbol> existing = context.symbols.lookupCurrentScope(name);
        if (existing.isEmpty()) {
            return;
        }
        Symbol symbol = existing.get();
        if (symbol.kind() != Symbol.Kind.TYPE) {
            throw context.error(CompilerErrorCode.REDECLARATION,
                    "redeclaration of '" + name + "' in the same scope", span);
        }
        if (declaringStruct && symbol.type() instanceof StructType) {
            throw context.error(CompilerErrorCode.DUPLICATE_STRUCT, "struct '" + name + "' is already declared", span);
        }
        throw context.error(CompilerErrorCode.DUPLICATE_TYPE, "type '" + name + "' is already declared", span);
    }

    @Override
    public Void visitImportDecl(ImportDecl node) {
        String binding = node.bindingName();
        context.checkNotReserved(binding, node.span());
        Optional<Symbol> existing = context.symbols.lookupCurrentScope(binding);
        if (existing.isPresent()) {
            if (existing.get().kind() == Symbol.Kind.MODULE) {
                throw context.error(CompilerErrorCode.DUPLICATE_IMPORT,
                        "module '" + binding + "' is already imported", node.span());
            }
            throw context.error(CompilerErrorCode.REDECLARATION,
                    "redeclaration of '" + binding + "' in the same scope", node.span());
        }
        if (node.local() && !context.moduleResolver.exists(node.name())) {
            throw context.error(CompilerErrorCode.MODULE_NOT_FOUND, "module not found: '" + node.name() + "'", node.span());
        }
        context.symbols.define(Symbol.module(binding));
        CompilerLogger.debug("Imported module '{}' as '{}'", node.name(), binding);
        return null;
    }

    // endregion
}
