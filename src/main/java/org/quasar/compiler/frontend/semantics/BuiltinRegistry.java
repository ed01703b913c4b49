package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.frontend.semantics.MethodSignature.Fixed;
import org.quasar.compiler.frontend.semantics.MethodSignature.Generic;
import org.quasar.compiler.frontend.semantics.MethodSignature.Parameter;
import org.quasar.compiler.frontend.semantics.MethodSignature.Role;
import org.quasar.compiler.types.DictType;
import org.quasar.compiler.types.ListType;
import org.quasar.compiler.types.PrimitiveType;
import org.quasar.compiler.types.Type;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * The fixed catalogue of built-in methods per receiver type and of the static namespaces
 * ({@code File}, {@code Env}). Lookups are side-effect free.
 */
public final class BuiltinRegistry {

    private static final Map<String, MethodSignature> STRING_METHODS = new LinkedHashMap<>();
    private static final Map<String, MethodSignature> LIST_METHODS = new LinkedHashMap<>();
    private static final Map<String, MethodSignature> DICT_METHODS = new LinkedHashMap<>();
    private static final Map<String, Map<String, MethodSignature>> NAMESPACES = new LinkedHashMap<>();

    static {
        Parameter str = new Fixed(PrimitiveType.STR);

        register(STRING_METHODS, "len", List.of(), PrimitiveType.INT);
        register(STRING_METHODS, "upper", List.of(), PrimitiveType.STR);
        register(STRING_METHODS, "lower", List.of(), PrimitiveType.STR);
        register(STRING_METHODS, "trim", List.of(), PrimitiveType.STR);
        register(STRING_METHODS, "replace", List.of(str, str), PrimitiveType.STR);
        register(STRING_METHODS, "split", List.of(str), new ListType(PrimitiveType.STR));
        register(STRING_METHODS, "contains", List.of(str), PrimitiveType.BOOL);
        register(STRING_METHODS, "starts_with", List.of(str), PrimitiveType.BOOL);
        register(STRING_METHODS, "ends_with", List.of(str), PrimitiveType.BOOL);
        register(STRING_METHODS, "to_int", List.of(), PrimitiveType.INT);
        register(STRING_METHODS, "to_float", List.of(), PrimitiveType.FLOAT);

        Parameter element = new Generic(Role.ELEMENT);
        register(LIST_METHODS, "len", List.of(), PrimitiveType.INT);
        register(LIST_METHODS, "push", List.of(element), PrimitiveType.VOID);
        register(LIST_METHODS, "pop", List.of(), receiver -> ((ListType) receiver).elementType());
        register(LIST_METHODS, "contains", List.of(element), PrimitiveType.BOOL);
        register(LIST_METHODS, "join", List.of(str), PrimitiveType.STR);
        register(LIST_METHODS, "reverse", List.of(), PrimitiveType.VOID);
        register(LIST_METHODS, "clear", List.of(), PrimitiveType.VOID);

        Parameter key = new Generic(Role.KEY);
        Parameter value = new Generic(Role.VALUE);
        register(DICT_METHODS, "len", List.of(), PrimitiveType.INT);
        register(DICT_METHODS, "has_key", List.of(key), PrimitiveType.BOOL);
        register(DICT_METHODS, "get", List.of(key, value), receiver -> ((DictType) receiver).valueType());
        register(DICT_METHODS, "remove", List.of(key), PrimitiveType.VOID);
        register(DICT_METHODS, "clear", List.of(), PrimitiveType.VOID);
        register(DICT_METHODS, "keys", List.of(), receiver -> new ListType(((DictType) receiver).keyType()));
        register(DICT_METHODS, "values", List.of(), receiver -> new ListType(((DictType) receiver).valueType()));

        Map<String, MethodSignature> file = new LinkedHashMap<>();
        register(file, "exists", List.of(str), PrimitiveType.BOOL);
        NAMESPACES.put("File", file);

        Map<String, MethodSignature> env = new LinkedHashMap<>();
        register(env, "args", List.of(), new ListType(PrimitiveType.STR));
        register(env, "get", List.of(str, str), PrimitiveType.STR);
        NAMESPACES.put("Env", env);
    }

    private BuiltinRegistry() {}

    private static void register(Map<String, MethodSignature> table, String name, List<Parameter> parameters, Type returnType) {
        register(table, name, parameters, receiver -> returnType);
    }

    private static void register(Map<String, MethodSignature> table, String name, List<Parameter> parameters, Function<Type, Type> returnType) {
        table.put(name, new MethodSignature(name, parameters, returnType));
    }

    /**
     * Checks whether a receiver type supports methods at all. {@code int}, {@code float} and
     * {@code bool} have none.
     *
     * @param receiver The receiver type.
     * @return {@code true} for strings, lists and dictionaries.
     */
    public static boolean hasMethods(Type receiver) {
        return receiver == PrimitiveType.STR || receiver instanceof ListType || receiver instanceof DictType;
    }

    /**
     * Finds a built-in method of a receiver type.
     * @param receiver The receiver type.
     * @param name The method name.
     * @return The signature, or empty if the type has no such method.
     */
    public static Optional<MethodSignature> method(Type receiver, String name) {
        if (receiver == PrimitiveType.STR) return Optional.ofNullable(STRING_METHODS.get(name));
        if (receiver instanceof ListType) return Optional.ofNullable(LIST_METHODS.get(name));
        if (receiver instanceof DictType) return Optional.ofNullable(DICT_METHODS.get(name));
        return Optional.empty();
    }

    /**
     * @return The names of the static namespaces. These names can never be declared.
     */
    public static Set<String> namespaces() {
        return NAMESPACES.keySet();
    }

    /**
     * @param name A name.
     * @return {@code true} if the name denotes a static namespace.
     */
    public static boolean isNamespace(String name) {
        return NAMESPACES.containsKey(name);
    }

    /**
     * Finds a function of a static namespace.
     * @param namespace The namespace, e.g. {@code "Env"}.
     * @param name The function name.
     * @return The signature, or empty if the namespace has no such function.
     */
    public static Optional<MethodSignature> namespaceFunction(String namespace, String name) {
        Map<String, MethodSignature> functions = NAMESPACES.get(namespace);
        return functions == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }
}
