package org.javalua.lua.ast;

/**
 * Lua expression produced by the lowering core.
 * <p>
 * Nodes are immutable values. {@link #toString()} gives the Lua text of the node, which is meant for
 * diagnostics and tests; printing whole chunks is the job of the emitter.
 */
public sealed interface LuaExpression
        permits LuaIdentifierName, LuaLiteralExpression, LuaParenthesizedExpression,
                LuaCodeTemplateExpression, LuaCodeTemplateParamsExpression {
}
