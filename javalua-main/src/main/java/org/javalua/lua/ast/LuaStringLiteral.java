package org.javalua.lua.ast;

import java.util.Objects;

/**
 * Quoted string literal. {@code value} is the string itself, {@code text} its escaped Lua spelling.
 */
public record LuaStringLiteral(String value, String text) implements LuaLiteralExpression {

    public LuaStringLiteral {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return text;
    }
}
