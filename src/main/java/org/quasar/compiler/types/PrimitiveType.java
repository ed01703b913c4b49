package org.quasar.compiler.types;

/**
 * The primitive types. {@link #VOID} only appears as a function return type and as the
 * element type of an empty list literal.
 */
public enum PrimitiveType implements Type {
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    STR("str"),
    VOID("void");

    private final String keyword;

    PrimitiveType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String displayName() {
        return keyword;
    }

    /**
     * Looks up a primitive type by its source keyword.
     * @param keyword The keyword, e.g. {@code "int"}.
     * @return The matching type, or null if the keyword names no primitive.
     */
    public static PrimitiveType fromKeyword(String keyword) {
        for (PrimitiveType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
