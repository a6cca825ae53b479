package org.javalua.lua.ast;

import java.util.Objects;

/**
 * Long bracket string {@code [==[ ... ]==]}; {@code level} is the number of {@code =} signs.
 */
public record LuaVerbatimStringLiteral(String value, int level) implements LuaLiteralExpression {

    public LuaVerbatimStringLiteral {
        Objects.requireNonNull(value, "value");
        if (level < 0) {
            throw new IllegalArgumentException("Negative long bracket level: " + level);
        }
    }

    public String openBracket() {
        return "[" + "=".repeat(level) + "[";
    }

    public String closeBracket() {
        return "]" + "=".repeat(level) + "]";
    }

    @Override
    public String text() {
        return openBracket() + value + closeBracket();
    }

    @Override
    public String toString() {
        return text();
    }
}
