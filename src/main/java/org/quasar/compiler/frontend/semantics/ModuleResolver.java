package org.quasar.compiler.frontend.semantics;

/**
 * Decides whether a local module referenced by {@code import "./path.qsr"} exists.
 * Host-language imports such as {@code import math} are never checked.
 */
@FunctionalInterface
public interface ModuleResolver {

    /**
     * @param path The import path exactly as written, without quotes.
     * @return {@code true} if the module can be found.
     */
    boolean exists(String path);
}
