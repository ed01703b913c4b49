package org.quasar.compiler.types;

/**
 * Types without a structure known to the front end.
 */
public enum OpaqueType implements Type {
    /**
     * An imported module and every value reached through it. Compatible with every type,
     * since the front end cannot see into host-language modules.
     */
    MODULE("module");

    private final String displayName;

    OpaqueType(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
