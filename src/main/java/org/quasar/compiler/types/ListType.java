package org.quasar.compiler.types;

/**
 * A homogeneous list {@code [T]}. Equality is structural.
 *
 * @param elementType The element type; {@link PrimitiveType#VOID} for the empty list literal.
 */
public record ListType(Type elementType) implements Type {

    @Override
    public String displayName() {
        return "[" + elementType.displayName() + "]";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
