package org.quasar.compiler.frontend.semantics;

import org.quasar.compiler.types.DictType;
import org.quasar.compiler.types.ListType;
import org.quasar.compiler.types.Type;

import java.util.List;
import java.util.function.Function;

/**
 * The signature of a built-in method or static namespace function. Parameter and return types
 * may depend on the receiver, e.g. {@code push} on {@code [int]} takes an {@code int}.
 *
 * @param name The method name.
 * @param parameters The parameters in call order.
 * @param returnType Computes the return type from the receiver type.
 */
public record MethodSignature(String name, List<Parameter> parameters, Function<Type, Type> returnType) {

    public MethodSignature {
        parameters = List.copyOf(parameters);
    }

    /**
     * A method parameter.
     */
    public sealed interface Parameter permits Fixed, Generic {
        /**
         * @param receiver The receiver type.
         * @return The type the argument must have.
         */
        Type expected(Type receiver);
    }

    /**
     * A parameter of a fixed type, e.g. the separator of {@code split}.
     * @param type The required type.
     */
    public record Fixed(Type type) implements Parameter {
        @Override
        public Type expected(Type receiver) {
            return type;
        }
    }

    /**
     * A parameter typed by the receiver's element, key or value type.
     * @param role Which part of the receiver type the argument must match.
     */
    public record Generic(Role role) implements Parameter {
        @Override
        public Type expected(Type receiver) {
            return role.extract(receiver);
        }
    }

    /**
     * The parts of a container type a generic parameter can refer to.
     */
    public enum Role {
        ELEMENT("element"),
        KEY("key"),
        VALUE("value");

        private final String label;

        Role(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        Type extract(Type receiver) {
            if (this == ELEMENT) {
                return ((ListType) receiver).elementType();
            }
            DictType dict = (DictType) receiver;
            return this == KEY ? dict.keyType() : dict.valueType();
        }
    }
}
