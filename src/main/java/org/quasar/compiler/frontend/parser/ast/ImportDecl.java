package org.quasar.compiler.frontend.parser.ast;

import org.quasar.compiler.diagnostics.Span;

/**
 * An import of a host-language module ({@code import math}) or a local source file
 * ({@code import "./utils.qsr"}).
 *
 * @param name The module name or the quoted path without quotes.
 * @param local Whether the import names a local file.
 * @param span The source range of the declaration.
 */
public record ImportDecl(String name, boolean local, Span span) implements Declaration {

    /**
     * Returns the name the module is bound to in the importing scope. For local imports
     * this is the file name without directories and extension ({@code "./lib/utils.qsr"} binds {@code utils}).
     *
     * @return The bound module name.
     */
    public String bindingName() {
        if (!local) {
            return name;
        }
        String fileName = name.substring(name.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImportDecl(this);
    }
}
