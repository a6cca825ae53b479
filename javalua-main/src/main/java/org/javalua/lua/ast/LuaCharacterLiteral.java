package org.javalua.lua.ast;

/**
 * A Java {@code char} lowered to its UTF-16 code unit, which is how characters live in the Lua runtime.
 */
public record LuaCharacterLiteral(char value) implements LuaLiteralExpression {

    public int codePoint() {
        return value;
    }

    @Override
    public String text() {
        return Integer.toString(value);
    }

    @Override
    public String toString() {
        return text();
    }
}
