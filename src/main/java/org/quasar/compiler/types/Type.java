package org.quasar.compiler.types;

/**
 * A resolved quasar type. The set of type kinds is closed.
 */
public sealed interface Type permits PrimitiveType, ListType, DictType, StructType, EnumType, OpaqueType {

    /**
     * @return The type as it is written in quasar source, used in diagnostics.
     */
    String displayName();
}
