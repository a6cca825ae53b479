package org.javalua.lua.ast;

import java.util.Objects;

public record LuaParenthesizedExpression(LuaExpression expression) implements LuaExpression {

    public LuaParenthesizedExpression {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public String toString() {
        return "(" + expression + ")";
    }
}
