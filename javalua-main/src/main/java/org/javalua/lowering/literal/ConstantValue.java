package org.javalua.lowering.literal;

import java.util.Objects;

/**
 * Compile-time constant, classified by how it has to be lowered.
 */
public sealed interface ConstantValue
        permits ConstantValue.CharacterConstant, ConstantValue.StringConstant, ConstantValue.PrimitiveConstant,
                ConstantValue.AbsentConstant {

    static ConstantValue of(Object value) {
        if (value == null) {
            return AbsentConstant.INSTANCE;
        }
        if (value instanceof Character) {
            return new CharacterConstant((Character) value);
        }
        if (value instanceof String) {
            return new StringConstant((String) value);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return new PrimitiveConstant(value);
        }
        throw new IllegalArgumentException("Not a constant value: " + value + " (" + value.getClass().getName() + ")");
    }

    static ConstantValue absent() {
        return AbsentConstant.INSTANCE;
    }

    record CharacterConstant(char value) implements ConstantValue {
    }

    record StringConstant(String value) implements ConstantValue {

        public StringConstant {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A boxed number or boolean.
     */
    record PrimitiveConstant(Object value) implements ConstantValue {

        public PrimitiveConstant {
            if (!(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("Not a primitive constant: " + value);
            }
        }
    }

    final class AbsentConstant implements ConstantValue {

        static final AbsentConstant INSTANCE = new AbsentConstant();

        private AbsentConstant() {
        }

        @Override
        public String toString() {
            return "AbsentConstant";
        }
    }
}
