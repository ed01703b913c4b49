package org.quasar.compiler.types;

import java.util.List;

/**
 * A user-defined enum. Equality is nominal.
 *
 * @param name The declared enum name.
 * @param variants The variant names in declaration order.
 */
public record EnumType(String name, List<String> variants) implements Type {

    public EnumType {
        variants = List.copyOf(variants);
    }

    /**
     * @param variant A variant name.
     * @return {@code true} if the enum declares the variant.
     */
    public boolean hasVariant(String variant) {
        return variants.contains(variant);
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumType other && name.equals(other.name);
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
