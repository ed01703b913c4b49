package org.quasar.compiler.types;

/**
 * A dictionary {@code Dict[K, V]}. Equality is structural.
 *
 * @param keyType The key type, which must be hashable in declarations.
 * @param valueType The value type.
 */
public record DictType(Type keyType, Type valueType) implements Type {

    @Override
    public String displayName() {
        return "Dict[" + keyType.displayName() + ", " + valueType.displayName() + "]";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
