package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.api.CompilerErrorCode;
import org.quasar.compiler.frontend.parser.ast.DictTypeRef;
import org.quasar.compiler.frontend.parser.ast.ListTypeRef;
import org.quasar.compiler.frontend.parser.ast.NamedTypeRef;
import org.quasar.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.quasar.compiler.frontend.parser.ast.TypeRef;
import org.quasar.compiler.types.DictType;
import org.quasar.compiler.types.ListType;
import org.quasar.compiler.types.PrimitiveType;
import org.quasar.compiler.types.Type;
import org.quasar.compiler.types.Types;

/**
 * Turns source type annotations into resolved {@link Type}s. Named annotations must refer to
 * a struct or enum visible in the current scope.
 */
final class TypeResolver {

    private final AnalysisContext context;

    TypeResolver(AnalysisContext context) {
        this.context = context;
    }

    Type resolve(TypeRef ref) {
        if (ref instanceof PrimitiveTypeRef primitive) {
            PrimitiveType type = PrimitiveType.fromKeyword(primitive.keyword());
            if (type == null) {
                throw new IllegalStateException("Parser produced unknown primitive keyword: " + primitive.keyword());
            }
            return type;
        }
        if (ref instanceof ListTypeRef list) {
            return new ListType(resolve(list.element()));
        }
        if (ref instanceof DictTypeRef dict) {
            Type key = resolve(dict.key());
            if (!Types.isHashable(key)) {
                throw context.error(CompilerErrorCode.UNHASHABLE_KEY,
                        "dict key type must be hashable (int, float, bool or str), got '" + key.displayName() + "'",
                        dict.key().span());
            }
            return new DictType(key, resolve(dict.value()));
        }
        NamedTypeRef named = (NamedTypeRef) ref;
        return context.symbols.lookup(named.name())
                .filter(symbol -> symbol.kind() == Symbol.Kind.TYPE)
                .map(Symbol::type)
                .orElseThrow(() -> context.error(CompilerErrorCode.UNKNOWN_TYPE,
                        "unknown type '" + named.name() + "'", named.span()));
    }
}
