package org.quasar.compiler.types;

/**
 * Pure compatibility rules over {@link Type} values. Holds no state.
 */
public final class Types {

    /** Type of the empty list literal {@code []}. */
    public static final ListType EMPTY_LIST = new ListType(PrimitiveType.VOID);
    /** Type of the empty dict literal <code>{}</code>. */
    public static final DictType EMPTY_DICT = new DictType(PrimitiveType.VOID, PrimitiveType.VOID);

    private Types() {}

    /**
     * Exact type equality: structural for lists and dictionaries, nominal for structs and enums.
     * There is no numeric widening.
     *
     * @param a The first type.
     * @param b The second type.
     * @return {@code true} if both types are identical.
     */
    public static boolean typesEqual(Type a, Type b) {
        return a.equals(b);
    }

    /**
     * @param type A type.
     * @return {@code true} if values of the type may be used as dictionary keys.
     */
    public static boolean isHashable(Type type) {
        return type == PrimitiveType.INT
                || type == PrimitiveType.FLOAT
                || type == PrimitiveType.BOOL
                || type == PrimitiveType.STR;
    }

    /**
     * @param type A type.
     * @return {@code true} for {@code int} and {@code float}.
     */
    public static boolean isNumeric(Type type) {
        return type == PrimitiveType.INT || type == PrimitiveType.FLOAT;
    }

    /**
     * Checks whether a value of type {@code actual} may be stored where {@code expected} is required.
     * Besides exact equality, the empty list and empty dict literals fit any list or dict type,
     * and module-derived values fit anything.
     *
     * @param expected The required type.
     * @param actual The type of the provided value.
     * @return {@code true} if the value is acceptable.
     */
    public static boolean isAssignable(Type expected, Type actual) {
        if (typesEqual(expected, actual)) {
            return true;
        }
        if (expected == OpaqueType.MODULE || actual == OpaqueType.MODULE) {
            return true;
        }
        if (expected instanceof ListType && actual.equals(EMPTY_LIST)) {
            return true;
        }
        return expected instanceof DictType && actual.equals(EMPTY_DICT);
    }
}
