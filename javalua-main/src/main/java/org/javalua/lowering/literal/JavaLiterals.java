package org.javalua.lowering.literal;

import java.util.Optional;

import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

/**
 * Values of Java literal tokens, with escapes, underscores, radix prefixes and type suffixes already
 * interpreted.
 */
public final class JavaLiterals {

    private JavaLiterals() {
    }

    public static ConstantValue valueOf(LiteralExpr literal) {
        if (literal instanceof NullLiteralExpr) {
            return ConstantValue.absent();
        }
        if (literal instanceof BooleanLiteralExpr) {
            return ConstantValue.of(((BooleanLiteralExpr) literal).getValue());
        }
        if (literal instanceof CharLiteralExpr) {
            return ConstantValue.of(((CharLiteralExpr) literal).asChar());
        }
        if (literal instanceof StringLiteralExpr) {
            return ConstantValue.of(((StringLiteralExpr) literal).asString());
        }
        if (literal instanceof TextBlockLiteralExpr) {
            return ConstantValue.of(((TextBlockLiteralExpr) literal).asString());
        }
        if (literal instanceof IntegerLiteralExpr) {
            return ConstantValue.of(((IntegerLiteralExpr) literal).asNumber());
        }
        if (literal instanceof LongLiteralExpr) {
            return ConstantValue.of(((LongLiteralExpr) literal).asNumber());
        }
        if (literal instanceof DoubleLiteralExpr) {
            DoubleLiteralExpr doubleLiteral = (DoubleLiteralExpr) literal;
            if (isFloatLiteral(doubleLiteral.getValue())) {
                return ConstantValue.of((float) doubleLiteral.asDouble());
            }
            return ConstantValue.of(doubleLiteral.asDouble());
        }
        throw new IllegalArgumentException("Unknown literal kind: " + literal.getClass().getSimpleName());
    }

    /**
     * Value of a constant initializer: a literal, optionally signed or parenthesized.
     */
    public static Optional<ConstantValue> constantOf(Expression initializer) {
        if (initializer instanceof EnclosedExpr) {
            return constantOf(((EnclosedExpr) initializer).getInner());
        }
        if (initializer instanceof LiteralExpr) {
            return Optional.of(valueOf((LiteralExpr) initializer));
        }
        if (initializer instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) initializer;
            if (unary.getOperator() == UnaryExpr.Operator.PLUS) {
                return constantOf(unary.getExpression()).filter(JavaLiterals::isNumeric);
            }
            if (unary.getOperator() == UnaryExpr.Operator.MINUS) {
                return constantOf(unary.getExpression())
                        .filter(JavaLiterals::isNumeric)
                        .map(value -> ConstantValue.of(negate((Number) ((ConstantValue.PrimitiveConstant) value).value())));
            }
        }
        return Optional.empty();
    }

    private static boolean isNumeric(ConstantValue value) {
        return value instanceof ConstantValue.PrimitiveConstant
               && ((ConstantValue.PrimitiveConstant) value).value() instanceof Number;
    }

    private static Number negate(Number number) {
        if (number instanceof Integer) {
            return -number.intValue();
        }
        if (number instanceof Long) {
            return -number.longValue();
        }
        if (number instanceof Float) {
            return -number.floatValue();
        }
        return -number.doubleValue();
    }

    private static boolean isFloatLiteral(String text) {
        char last = text.charAt(text.length() - 1);
        return last == 'f' || last == 'F';
    }
}
