package org.javalua.lua.ast;

import java.util.Objects;

/**
 * Literal emitted exactly as written: numbers, {@code true}, {@code false} and {@code nil}.
 */
public record LuaIdentifierLiteral(String text) implements LuaLiteralExpression {

    public static final LuaIdentifierLiteral NIL = new LuaIdentifierLiteral(LuaIdentifierName.NIL.valueText());

    public LuaIdentifierLiteral {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return text;
    }
}
