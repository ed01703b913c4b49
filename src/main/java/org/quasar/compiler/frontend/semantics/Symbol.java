package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.types.OpaqueType;
import org.quasar.compiler.types.Type;

import java.util.List;

/**
 * Represents a single named entity in a scope.
 *
 * @param name The declared name.
 * @param type The resolved type. For functions this is the return type.
 * @param kind The kind of entity.
 * @param isConst Whether the name may not be assigned to.
 * @param parameterTypes The parameter types of a function, empty for all other kinds.
 */
public record Symbol(String name, Type type, Kind kind, boolean isConst, List<Type> parameterTypes) {

    /**
     * The kind of a symbol.
     */
    public enum Kind {
        /** A let binding, parameter or loop variable. */
        VARIABLE,
        /** A const binding. */
        CONSTANT,
        /** A user-defined function. */
        FUNCTION,
        /** A struct or enum type name. */
        TYPE,
        /** An imported module. */
        MODULE
    }

    public Symbol {
        parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * @return {@code true} if the symbol names a function.
     */
    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }

    public static Symbol variable(String name, Type type) {
        return new Symbol(name, type, Kind.VARIABLE, false, List.of());
    }

    public static Symbol constant(String name, Type type) {
        return new Symbol(name, type, Kind.CONSTANT, true, List.of());
    }

    /**
     * Creates a function symbol. Functions can never be reassigned.
     * @param name The function name.
     * @param returnType The declared return type.
     * @param parameterTypes The parameter types in declaration order.
     * @return The symbol.
     */
    public static Symbol function(String name, Type returnType, List<Type> parameterTypes) {
        return new Symbol(name, returnType, Kind.FUNCTION, true, parameterTypes);
    }

    public static Symbol typeName(String name, Type type) {
        return new Symbol(name, type, Kind.TYPE, true, List.of());
    }

    public static Symbol module(String name) {
        return new Symbol(name, OpaqueType.MODULE, Kind.MODULE, true, List.of());
    }
}
