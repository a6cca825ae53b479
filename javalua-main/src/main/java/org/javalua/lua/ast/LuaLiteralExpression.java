package org.javalua.lua.ast;

public sealed interface LuaLiteralExpression extends LuaExpression
        permits LuaIdentifierLiteral, LuaStringLiteral, LuaCharacterLiteral, LuaVerbatimStringLiteral,
                LuaConstLiteral {

    /**
     * Source text of the literal.
     */
    String text();
}
