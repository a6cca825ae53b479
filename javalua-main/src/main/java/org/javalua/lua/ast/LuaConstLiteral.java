package org.javalua.lua.ast;

import java.util.Objects;

/**
 * Value of a constant field, printed with the field's name as a trailing comment,
 * e.g. {@code 100 --[[Limits.MAX]]}.
 */
public record LuaConstLiteral(LuaLiteralExpression value, String identifierToken) implements LuaLiteralExpression {

    public LuaConstLiteral {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(identifierToken, "identifierToken");
    }

    @Override
    public String text() {
        return value.text() + " --[[" + identifierToken + "]]";
    }

    @Override
    public String toString() {
        return text();
    }
}
