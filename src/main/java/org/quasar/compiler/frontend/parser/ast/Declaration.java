package org.quasar.compiler.frontend.parser.ast;

/**
 * The closed family of declarations: bindings, functions, and user-defined types and imports.
 */
public sealed interface Declaration extends Statement permits
        VarDecl, ConstDecl, FnDecl, StructDecl, EnumDecl, ImportDecl {

    /**
     * @return The declared name (the module path for imports).
     */
    String name();
}
