package org.javalua.lua.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The arguments matched by a {@code {*N}} placeholder, expanded in place as zero or more actual arguments.
 */
public record LuaCodeTemplateParamsExpression(List<LuaExpression> expressions) implements LuaExpression {

    public LuaCodeTemplateParamsExpression {
        expressions = List.copyOf(expressions);
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    @Override
    public String toString() {
        return expressions.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
