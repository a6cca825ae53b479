package org.javalua.symbol;

import java.util.Objects;

import org.javalua.lowering.literal.ConstantValue;

/**
 * A {@code static final} field whose value is a compile-time constant.
 *
 * @param declaringTypeName simple name of the declaring type
 * @param fieldName         name of the field
 * @param value             the constant value
 * @param characterTyped    whether the field is declared {@code char}
 */
public record ConstantField(String declaringTypeName, String fieldName, ConstantValue value, boolean characterTyped) {

    public ConstantField {
        Objects.requireNonNull(declaringTypeName, "declaringTypeName");
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(value, "value");
    }

    public String qualifiedName() {
        return declaringTypeName + '.' + fieldName;
    }
}
