package org.javalua.lua.ast;

import java.util.Objects;

/**
 * A name, or a run of native Lua text inside a code template.
 */
public record LuaIdentifierName(String valueText) implements LuaExpression {

    public static final LuaIdentifierName NIL = new LuaIdentifierName("nil");
    public static final LuaIdentifierName THIS = new LuaIdentifierName("this");

    public LuaIdentifierName {
        Objects.requireNonNull(valueText, "valueText");
    }

    @Override
    public String toString() {
        return valueText;
    }
}
