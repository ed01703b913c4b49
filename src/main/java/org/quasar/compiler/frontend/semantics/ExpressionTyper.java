package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.frontend.parser.ast.*;
import org.quasar.compiler.types.DictType;
import org.quasar.compiler.types.EnumType;
import org.quasar.compiler.types.ListType;
import org.quasar.compiler.types.OpaqueType;
import org.quasar.compiler.types.PrimitiveType;
import org.quasar.compiler.types.StructType;
import org.quasar.compiler.types.Type;
import org.quasar.compiler.types.Types;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes and records the type of every expression, validating operator, call, index,
 * member and method rules on the way.
 */
final class ExpressionTyper implements ExpressionVisitor<Type> {

    private final AnalysisContext context;

    ExpressionTyper(AnalysisContext context) {
        this.context = context;
    }

    /**
     * Types an expression and records the result in the type table.
     */
    Type type(Expression expression) {
        Type type = expression.accept(this);
        context.expressionTypes.put(expression, type);
        return type;
    }

    // region Literals and names

    @Override
    public Type visitIntLiteral(IntLiteral node) {
        return PrimitiveType.INT;
    }

    @Override
    public Type visitFloatLiteral(FloatLiteral node) {
        return PrimitiveType.FLOAT;
    }

    @Override
    public Type visitStringLiteral(StringLiteral node) {
        return PrimitiveType.STR;
    }

    @Override
    public Type visitBoolLiteral(BoolLiteral node) {
        return PrimitiveType.BOOL;
    }

    @Override
    public Type visitIdentifier(Identifier node) {
        Symbol symbol = context.symbols.lookup(node.name())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                        "use of undeclared identifier '" + node.name() + "'", node.span()));
        if (symbol.kind() == Symbol.Kind.TYPE) {
            throw context.error(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                    "'" + node.name() + "' is a type, not a value", node.span());
        }
        return symbol.type();
    }

    // endregion

    // region Collections

    @Override
    public Type visitListLiteral(ListLiteral node) {
        if (node.elements().isEmpty()) {
            return Types.EMPTY_LIST;
        }
        Type elementType = type(node.elements().get(0));
        for (Expression element : node.elements().subList(1, node.elements().size())) {
            Type actual = type(element);
            if (!Types.typesEqual(elementType, actual)) {
                throw context.error(CompilerErrorCode.HETEROGENEOUS_LIST,
                        "list elements must have the same type: expected '" + elementType.displayName()
                                + "', got '" + actual.displayName() + "'", element.span());
            }
        }
        return new ListType(elementType);
    }

    @Override
    public Type visitDictLiteral(DictLiteral node) {
        if (node.entries().isEmpty()) {
            return Types.EMPTY_DICT;
        }
        DictEntry first = node.entries().get(0);
        Type keyType = type(first.key());
        if (!Types.isHashable(keyType)) {
            throw context.error(CompilerErrorCode.UNHASHABLE_KEY,
                    "dict key type must be hashable (int, float, bool or str), got '" + keyType.displayName() + "'",
                    first.key().span());
        }
        Type valueType = type(first.value());
        for (DictEntry entry : node.entries().subList(1, node.entries().size())) {
            Type actualKey = type(entry.key());
            if (!Types.typesEqual(keyType, actualKey)) {
                throw context.error(CompilerErrorCode.HETEROGENEOUS_DICT_KEYS,
                        "dict keys must have the same type: expected '" + keyType.displayName()
                                + "', got '" + actualKey.displayName() + "'", entry.key().span());
            }
            Type actualValue = type(entry.value());
            if (!Types.typesEqual(valueType, actualValue)) {
                throw context.error(CompilerErrorCode.HETEROGENEOUS_DICT_VALUES,
                        "dict values must have the same type: expected '" + valueType.displayName()
                                + "', got '" + actualValue.displayName() + "'", entry.value().span());
            }
        }
        return new DictType(keyType, valueType);
    }

    @Override
    public Type visitStructInit(StructInit node) {
        StructType struct = context.symbols.lookup(node.name())
                .filter(symbol -> symbol.type() instanceof StructType)
                .map(symbol -> (StructType) symbol.type())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNDEFINED_STRUCT,
                        "struct '" + node.name() + "' is not defined", node.span()));

        Set<String> initialized = new HashSet<>();
        for (FieldInit field : node.fields()) {
            Type expected = struct.fieldType(field.name())
                    .orElseThrow(() -> context.error(CompilerErrorCode.UNKNOWN_FIELD_IN_INIT,
                            "struct '" + struct.name() + "' has no field '" + field.name() + "'", field.span()));
            if (!initialized.add(field.name())) {
                throw context.error(CompilerErrorCode.DUPLICATE_FIELD,
                        "field '" + field.name() + "' is initialized more than once", field.span());
            }
            Type actual = type(field.value());
            if (!Types.isAssignable(expected, actual)) {
                throw context.error(CompilerErrorCode.FIELD_INIT_TYPE_MISMATCH,
                        "field '" + field.name() + "' of '" + struct.name() + "' expects '" + expected.displayName()
                                + "', got '" + actual.displayName() + "'", field.value().span());
            }
        }

        Set<String> missing = new LinkedHashSet<>(struct.fields().keySet());
        missing.removeAll(initialized);
        if (!missing.isEmpty()) {
            throw context.error(CompilerErrorCode.MISSING_FIELDS,
                    "missing field(s) in '" + struct.name() + "' initialization: " + String.join(", ", missing),
                    node.span());
        }
        return struct;
    }

    @Override
    public Type visitRangeExpr(RangeExpr node) {
        Type start = type(node.start());
        if (start != PrimitiveType.INT) {
            throw context.error(CompilerErrorCode.RANGE_BOUND_NOT_INT,
                    "range start must be int, got '" + start.displayName() + "'", node.start().span());
        }
        Type end = type(node.end());
        if (end != PrimitiveType.INT) {
            throw context.error(CompilerErrorCode.RANGE_BOUND_NOT_INT,
                    "range end must be int, got '" + end.displayName() + "'", node.end().span());
        }
        return new ListType(PrimitiveType.INT);
    }

    // endregion

    // region Operators

    @Override
    public Type visitBinaryExpr(BinaryExpr node) {
        Type left = type(node.left());
        Type right = type(node.right());
        BinaryOperator operator = node.operator();

        if (left instanceof EnumType || right instanceof EnumType) {
            if (operator.category() == BinaryOperator.Category.EQUALITY) {
                if (!Types.typesEqual(left, right)) {
                    throw context.error(CompilerErrorCode.ENUM_COMPARISON_MISMATCH,
                            "cannot compare '" + left.displayName() + "' with '" + right.displayName() + "'", node.span());
                }
                return PrimitiveType.BOOL;
            }
            if (operator.category() == BinaryOperator.Category.RELATIONAL) {
                throw context.error(CompilerErrorCode.ENUM_RELATIONAL_OPERATOR,
                        "operator '" + operator.symbol() + "' is not supported for enum values, only '==' and '!=' are",
                        node.span());
            }
        }

        if (left == OpaqueType.MODULE || right == OpaqueType.MODULE) {
            return operator.category() == BinaryOperator.Category.ARITHMETIC ? OpaqueType.MODULE : PrimitiveType.BOOL;
        }

        switch (operator.category()) {
            case LOGICAL:
                requireBool(left, node.left(), "logical operator '" + operator.symbol() + "' requires bool operands");
                requireBool(right, node.right(), "logical operator '" + operator.symbol() + "' requires bool operands");
                return PrimitiveType.BOOL;
            case EQUALITY:
                if (!Types.isAssignable(left, right) && !Types.isAssignable(right, left)) {
                    throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                            "cannot compare '" + left.displayName() + "' with '" + right.displayName() + "'", node.span());
                }
                return PrimitiveType.BOOL;
            case RELATIONAL:
                if (left == PrimitiveType.STR || right == PrimitiveType.STR) {
                    throw context.error(CompilerErrorCode.STRING_COMPARISON,
                            "string comparison with '<', '>', '<=', '>=' is not supported", node.span());
                }
                if (!Types.typesEqual(left, right)) {
                    throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                            "cannot compare '" + left.displayName() + "' with '" + right.displayName() + "'", node.span());
                }
                if (!Types.isNumeric(left)) {
                    throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                            "comparison requires numeric operands, got '" + left.displayName() + "'", node.span());
                }
                return PrimitiveType.BOOL;
            case ARITHMETIC:
                return arithmetic(node, left, right);
            default:
                throw new IllegalStateException("Unhandled operator category: " + operator.category());
        }
    }

    private Type arithmetic(BinaryExpr node, Type left, Type right) {
        BinaryOperator operator = node.operator();
        if (left == PrimitiveType.STR && right == PrimitiveType.STR) {
            if (operator == BinaryOperator.ADD) {
                return PrimitiveType.STR;
            }
            throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                    "operator '" + operator.symbol() + "' is not supported for strings", node.span());
        }
        if (!Types.typesEqual(left, right)) {
            throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                    "cannot mix '" + left.displayName() + "' and '" + right.displayName() + "' in arithmetic", node.span());
        }
        if (!Types.isNumeric(left)) {
            throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                    "arithmetic operator '" + operator.symbol() + "' is not supported for '" + left.displayName() + "'",
                    node.span());
        }
        if ((operator == BinaryOperator.DIVIDE || operator == BinaryOperator.MODULO) && isLiteralZero(node.right())) {
            throw context.error(CompilerErrorCode.INVALID_LOGICAL_OPERAND,
                    "division by zero", node.right().span());
        }
        return left;
    }

    private static boolean isLiteralZero(Expression expression) {
        if (expression instanceof IntLiteral literal) {
            return literal.value() == 0L;
        }
        return expression instanceof FloatLiteral literal && literal.value() == 0.0;
    }

    @Override
    public Type visitUnaryExpr(UnaryExpr node) {
        Type operand = type(node.operand());
        if (operand == OpaqueType.MODULE) {
            return node.operator() == UnaryOperator.NOT ? PrimitiveType.BOOL : OpaqueType.MODULE;
        }
        if (node.operator() == UnaryOperator.NOT) {
            requireBool(operand, node.operand(), "logical NOT requires a bool operand");
            return PrimitiveType.BOOL;
        }
        if (!Types.isNumeric(operand)) {
            throw context.error(CompilerErrorCode.INVALID_OPERANDS,
                    "negation requires a numeric operand, got '" + operand.displayName() + "'", node.operand().span());
        }
        return operand;
    }

    private void requireBool(Type actual, Expression operand, String message) {
        if (actual != PrimitiveType.BOOL) {
            throw context.error(CompilerErrorCode.INVALID_LOGICAL_OPERAND,
                    message + ", got '" + actual.displayName() + "'", operand.span());
        }
    }

    // endregion

    // region Calls

    @Override
    public Type visitCallExpr(CallExpr node) {
        switch (node.callee()) {
            case "len":
                return builtinLen(node);
            case "push":
                return builtinPush(node);
            case "input":
                return builtinInput(node);
            case "keys":
                return builtinDictView(node, CompilerErrorCode.KEYS_ARGUMENT_NOT_DICT, true);
            case "values":
                return builtinDictView(node, CompilerErrorCode.VALUES_ARGUMENT_NOT_DICT, false);
            case "int":
            case "float":
            case "str":
            case "bool":
                return builtinCast(node);
            default:
                return userFunctionCall(node);
        }
    }

    private Type builtinLen(CallExpr node) {
        if (node.arguments().size() != 1) {
            throw context.error(CompilerErrorCode.LEN_ERROR,
                    "len() takes exactly 1 argument (" + node.arguments().size() + " given)", node.span());
        }
        Expression argument = node.arguments().get(0);
        Type type = type(argument);
        if (!(type instanceof ListType || type instanceof DictType || type == PrimitiveType.STR || type == OpaqueType.MODULE)) {
            throw context.error(CompilerErrorCode.LEN_ERROR,
                    "len() argument must be a list, dict or str, got '" + type.displayName() + "'", argument.span());
        }
        return PrimitiveType.INT;
    }

    private Type builtinPush(CallExpr node) {
        if (node.arguments().size() != 2) {
            throw context.error(CompilerErrorCode.PUSH_ERROR,
                    "push() takes exactly 2 arguments (" + node.arguments().size() + " given)", node.span());
        }
        Expression target = node.arguments().get(0);
        Type targetType = type(target);
        Expression value = node.arguments().get(1);
        Type valueType = type(value);
        if (targetType == OpaqueType.MODULE) {
            return PrimitiveType.VOID;
        }
        if (!(targetType instanceof ListType list)) {
            throw context.error(CompilerErrorCode.PUSH_ERROR,
                    "push() first argument must be a list, got '" + targetType.displayName() + "'", target.span());
        }
        if (!Types.isAssignable(list.elementType(), valueType)) {
            throw context.error(CompilerErrorCode.PUSH_ERROR,
                    "push() cannot add '" + valueType.displayName() + "' to list of '"
                            + list.elementType().displayName() + "'", value.span());
        }
        return PrimitiveType.VOID;
    }

    private Type builtinInput(CallExpr node) {
        if (node.arguments().size() > 1) {
            throw context.error(CompilerErrorCode.INPUT_ARGUMENT_COUNT,
                    "input() takes at most 1 argument (" + node.arguments().size() + " given)", node.span());
        }
        if (node.arguments().size() == 1) {
            Expression prompt = node.arguments().get(0);
            Type type = type(prompt);
            if (type != PrimitiveType.STR && type != OpaqueType.MODULE) {
                throw context.error(CompilerErrorCode.INPUT_PROMPT_NOT_STR,
                        "input() prompt must be str, got '" + type.displayName() + "'", prompt.span());
            }
        }
        return PrimitiveType.STR;
    }

    private Type builtinDictView(CallExpr node, CompilerErrorCode code, boolean keys) {
        if (node.arguments().size() != 1) {
            throw context.error(code,
                    node.callee() + "() takes exactly 1 argument (" + node.arguments().size() + " given)", node.span());
        }
        Expression argument = node.arguments().get(0);
        Type type = type(argument);
        if (type == OpaqueType.MODULE) {
            return OpaqueType.MODULE;
        }
        if (!(type instanceof DictType dict)) {
            throw context.error(code,
                    node.callee() + "() argument must be a dict, got '" + type.displayName() + "'", argument.span());
        }
        return new ListType(keys ? dict.keyType() : dict.valueType());
    }

    private Type builtinCast(CallExpr node) {
        if (node.arguments().size() != 1) {
            throw context.error(CompilerErrorCode.CAST_ARGUMENT_COUNT,
                    node.callee() + "() requires exactly 1 argument (" + node.arguments().size() + " given)", node.span());
        }
        type(node.arguments().get(0));
        return PrimitiveType.fromKeyword(node.callee());
    }

    private Type userFunctionCall(CallExpr node) {
        Symbol symbol = context.symbols.lookup(node.callee())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                        "use of undeclared function '" + node.callee() + "'", node.span()));
        if (symbol.kind() == Symbol.Kind.MODULE) {
            node.arguments().forEach(this::type);
            return OpaqueType.MODULE;
        }
        if (!symbol.isFunction()) {
            throw context.error(CompilerErrorCode.TYPE_MISMATCH,
                    "'" + node.callee() + "' is not a function", node.span());
        }
        List<Type> parameters = symbol.parameterTypes();
        if (parameters.size() != node.arguments().size()) {
            throw context.error(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "function '" + node.callee() + "' expects " + parameters.size() + " argument(s), got "
                            + node.arguments().size(), node.span());
        }
        for (int i = 0; i < parameters.size(); i++) {
            Expression argument = node.arguments().get(i);
            Type actual = type(argument);
            if (!Types.isAssignable(parameters.get(i), actual)) {
                throw context.error(CompilerErrorCode.ARGUMENT_TYPE_MISMATCH,
                        "argument " + (i + 1) + " of '" + node.callee() + "' expects '" + parameters.get(i).displayName()
                                + "', got '" + actual.displayName() + "'", argument.span());
            }
        }
        return symbol.type();
    }

    // endregion

    // region Subscripts, members and methods

    @Override
    public Type visitIndexExpr(IndexExpr node) {
        Type target = type(node.target());
        Type index = type(node.index());
        if (target == OpaqueType.MODULE) {
            return OpaqueType.MODULE;
        }
        if (target instanceof ListType list) {
            if (index != PrimitiveType.INT) {
                throw context.error(CompilerErrorCode.INDEX_NOT_INT,
                        "list index must be int, got '" + index.displayName() + "'", node.index().span());
            }
            return list.elementType();
        }
        if (target instanceof DictType dict) {
            if (!Types.isAssignable(dict.keyType(), index)) {
                throw context.error(CompilerErrorCode.KEY_TYPE_MISMATCH,
                        "dict key type mismatch: expected '" + dict.keyType().displayName() + "', got '"
                                + index.displayName() + "'", node.index().span());
            }
            return dict.valueType();
        }
        throw context.error(CompilerErrorCode.NOT_INDEXABLE,
                "cannot index into value of type '" + target.displayName() + "'", node.target().span());
    }

    @Override
    public Type visitMemberAccess(MemberAccess node) {
        Optional<Type> typeName = typeNameReceiver(node.object());
        if (typeName.isPresent()) {
            return enumVariant(node, typeName.get());
        }
        if (isNamespaceReceiver(node.object())) {
            String namespace = ((Identifier) node.object()).name();
            throw context.error(CompilerErrorCode.UNKNOWN_METHOD,
                    "'" + namespace + "." + node.member() + "' is not a value; builtin module members must be called",
                    node.span());
        }
        Type object = type(node.object());
        if (object == OpaqueType.MODULE) {
            return OpaqueType.MODULE;
        }
        if (!(object instanceof StructType struct)) {
            throw context.error(CompilerErrorCode.MEMBER_ACCESS_ON_NON_STRUCT,
                    "cannot access member '" + node.member() + "' on non-struct type '" + object.displayName() + "'",
                    node.span());
        }
        return struct.fieldType(node.member())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNKNOWN_FIELD,
                        "struct '" + struct.name() + "' has no field '" + node.member() + "'", node.span()));
    }

    private Type enumVariant(MemberAccess node, Type owner) {
        Identifier ownerName = (Identifier) node.object();
        if (!(owner instanceof EnumType enumType)) {
            throw context.error(CompilerErrorCode.MEMBER_ACCESS_ON_NON_STRUCT,
                    "cannot access member '" + node.member() + "' on type name '" + ownerName.name() + "'", node.span());
        }
        if (!enumType.hasVariant(node.member())) {
            throw context.error(CompilerErrorCode.UNKNOWN_VARIANT,
                    "enum '" + enumType.name() + "' has no variant '" + node.member() + "'", node.span());
        }
        context.expressionTypes.put(ownerName, enumType);
        return enumType;
    }

    @Override
    public Type visitMethodCall(MethodCall node) {
        if (isNamespaceReceiver(node.object())) {
            return namespaceCall(node);
        }
        Type receiver = type(node.object());
        if (receiver == OpaqueType.MODULE) {
            node.arguments().forEach(this::type);
            return OpaqueType.MODULE;
        }
        if (!BuiltinRegistry.hasMethods(receiver)) {
            throw context.error(CompilerErrorCode.UNKNOWN_METHOD,
                    "type '" + receiver.displayName() + "' has no methods", node.span());
        }
        MethodSignature signature = BuiltinRegistry.method(receiver, node.method())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNKNOWN_METHOD,
                        "type '" + receiver.displayName() + "' has no method '" + node.method() + "'", node.span()));
        if ("join".equals(signature.name()) && !receiver.equals(new ListType(PrimitiveType.STR))) {
            throw context.error(CompilerErrorCode.JOIN_REQUIRES_STR_LIST,
                    "join() only works on [str], got '" + receiver.displayName() + "'", node.span());
        }
        checkArguments(node, signature, receiver);
        return signature.returnType().apply(receiver);
    }

    private Type namespaceCall(MethodCall node) {
        Identifier namespace = (Identifier) node.object();
        context.expressionTypes.put(namespace, OpaqueType.MODULE);
        MethodSignature signature = BuiltinRegistry.namespaceFunction(namespace.name(), node.method())
                .orElseThrow(() -> context.error(CompilerErrorCode.UNKNOWN_METHOD,
                        "builtin module '" + namespace.name() + "' has no method '" + node.method() + "'", node.span()));
        checkArguments(node, signature, OpaqueType.MODULE);
        return signature.returnType().apply(OpaqueType.MODULE);
    }

    private void checkArguments(MethodCall node, MethodSignature signature, Type receiver) {
        List<MethodSignature.Parameter> parameters = signature.parameters();
        if (parameters.size() != node.arguments().size()) {
            throw context.error(CompilerErrorCode.METHOD_ARGUMENT_COUNT,
                    "method '" + signature.name() + "' expects " + parameters.size() + " argument(s), got "
                            + node.arguments().size(), node.span());
        }
        for (int i = 0; i < parameters.size(); i++) {
            MethodSignature.Parameter parameter = parameters.get(i);
            Expression argument = node.arguments().get(i);
            Type actual = type(argument);
            Type expected = parameter.expected(receiver);
            if (expected == PrimitiveType.VOID || Types.isAssignable(expected, actual)) {
                // A void slot comes from an empty literal receiver and accepts anything.
                continue;
            }
            if (parameter instanceof MethodSignature.Generic generic) {
                throw context.error(CompilerErrorCode.GENERIC_ARGUMENT_MISMATCH,
                        "method '" + signature.name() + "' expects " + generic.role().label() + " type '"
                                + expected.displayName() + "', got '" + actual.displayName() + "'", argument.span());
            }
            throw context.error(CompilerErrorCode.METHOD_ARGUMENT_TYPE,
                    "method '" + signature.name() + "' argument " + (i + 1) + " expects '" + expected.displayName()
                            + "', got '" + actual.displayName() + "'", argument.span());
        }
    }

    /**
     * Returns the declared type when the receiver is a bare struct or enum name.
     */
    private Optional<Type> typeNameReceiver(Expression object) {
        if (!(object instanceof Identifier identifier)) {
            return Optional.empty();
        }
        return context.symbols.lookup(identifier.name())
                .filter(symbol -> symbol.kind() == Symbol.Kind.TYPE)
                .map(Symbol::type);
    }

    private boolean isNamespaceReceiver(Expression object) {
        return object instanceof Identifier identifier
                && BuiltinRegistry.isNamespace(identifier.name())
                && context.symbols.lookup(identifier.name()).isEmpty();
    }

    // endregion
}
