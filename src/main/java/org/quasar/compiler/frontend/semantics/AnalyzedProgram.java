package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.frontend.parser.ast.Expression;
import org.quasar.compiler.frontend.parser.ast.Program;
import org.quasar.compiler.types.Type;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A program that passed semantic analysis, together with the resolved type of every expression node.
 * <p>
 * The parsed tree is not modified. Types live in a side table keyed by node identity, so two
 * structurally equal expressions at different positions keep separate entries.
 * Emitters may rely on the program without any further validation.
 */
public final class AnalyzedProgram {

    private final Program program;
    private final Map<Expression, Type> expressionTypes;
    private final Map<String, Type> declaredTypes;

    AnalyzedProgram(Program program, IdentityHashMap<Expression, Type> expressionTypes, Map<String, Type> declaredTypes) {
        this.program = program;
        this.expressionTypes = Collections.unmodifiableMap(new IdentityHashMap<>(expressionTypes));
        this.declaredTypes = Collections.unmodifiableMap(new LinkedHashMap<>(declaredTypes));
    }

    /**
     * @return The analyzed tree.
     */
    public Program program() {
        return program;
    }

    /**
     * Returns the resolved type of an expression of this program.
     *
     * @param expression An expression node taken from {@link #program()}.
     * @return The resolved type.
     * @throws IllegalArgumentException if the node does not belong to this program.
     */
    public Type typeOf(Expression expression) {
        Type type = expressionTypes.get(expression);
        if (type == null) {
            throw new IllegalArgumentException("Expression is not part of the analyzed program: " + expression);
        }
        return type;
    }

    /**
     * @return The number of typed expression nodes.
     */
    public int typedExpressionCount() {
        return expressionTypes.size();
    }

    /**
     * @return The struct and enum types declared anywhere in the program, by name.
     */
    public Map<String, Type> declaredTypes() {
        return declaredTypes;
    }
}
