package org.quasar.compiler.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A user-defined struct. Equality is nominal: two struct types are equal iff their names are.
 *
 * @param name The declared struct name.
 * @param fields The fields in declaration order.
 */
public record StructType(String name, Map<String, Type> fields) implements Type {

    public StructType {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Looks up the type of a field.
     * @param fieldName The field name.
     * @return The field type, or empty if the struct has no such field.
     */
    public Optional<Type> fieldType(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return displayName();
    }
}
