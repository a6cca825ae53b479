package org.javalua.lowering;

import com.github.javaparser.ast.expr.Expression;
import org.javalua.lua.ast.LuaExpression;

/**
 * The pass that lowers a Java expression to Lua. Code templates call back into it for the arguments
 * they splice in.
 */
@FunctionalInterface
public interface ExpressionLowering {

    LuaExpression lower(Expression expression);
}
