package org.javalua.lua.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expanded code template. Writing out {@link #codes()} in order yields the native Lua code with every
 * placeholder substituted.
 */
public record LuaCodeTemplateExpression(List<LuaExpression> codes) implements LuaExpression {

    public LuaCodeTemplateExpression {
        codes = List.copyOf(codes);
    }

    public boolean isEmpty() {
        return codes.isEmpty();
    }

    @Override
    public String toString() {
        return codes.stream().map(Object::toString).collect(Collectors.joining());
    }
}
