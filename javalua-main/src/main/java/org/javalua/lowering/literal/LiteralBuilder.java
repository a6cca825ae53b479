package org.javalua.lowering.literal;

import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import org.javalua.lua.ast.LuaCharacterLiteral;
import org.javalua.lua.ast.LuaConstLiteral;
import org.javalua.lua.ast.LuaIdentifierLiteral;
import org.javalua.lua.ast.LuaLiteralExpression;
import org.javalua.lua.ast.LuaStringLiteral;
import org.javalua.lua.ast.LuaVerbatimStringLiteral;
import org.javalua.symbol.ConstantField;

/**
 * Builds Lua literals from constant values.
 */
public final class LiteralBuilder {

    private static final LuaIdentifierLiteral NOT_A_NUMBER = new LuaIdentifierLiteral("(0/0)");
    private static final LuaIdentifierLiteral POSITIVE_INFINITY = new LuaIdentifierLiteral("math.huge");
    private static final LuaIdentifierLiteral NEGATIVE_INFINITY = new LuaIdentifierLiteral("-math.huge");

    public LuaLiteralExpression literalFor(Object value) {
        return literalFor(ConstantValue.of(value));
    }

    public LuaLiteralExpression literalFor(ConstantValue value) {
        if (value instanceof ConstantValue.AbsentConstant) {
            return LuaIdentifierLiteral.NIL;
        }
        if (value instanceof ConstantValue.CharacterConstant) {
            return new LuaCharacterLiteral(((ConstantValue.CharacterConstant) value).value());
        }
        if (value instanceof ConstantValue.StringConstant) {
            return stringLiteral(((ConstantValue.StringConstant) value).value());
        }
        return primitiveLiteral(((ConstantValue.PrimitiveConstant) value).value());
    }

    /**
     * Literal for a read of a constant field. The value is annotated with the field's name, except for
     * {@code char} fields which lower to their plain code unit.
     */
    public LuaLiteralExpression literalFor(ConstantField field) {
        LuaLiteralExpression value = literalFor(field.value());
        if (field.characterTyped()) {
            return value;
        }
        return new LuaConstLiteral(value, field.qualifiedName());
    }

    /**
     * Literal for a Java literal token. Text blocks keep their line structure as long bracket strings.
     */
    public LuaLiteralExpression literalFor(LiteralExpr literal) {
        if (literal instanceof TextBlockLiteralExpr) {
            return verbatimString(((TextBlockLiteralExpr) literal).asString());
        }
        return literalFor(JavaLiterals.valueOf(literal));
    }

    public LuaStringLiteral stringLiteral(String value) {
        return new LuaStringLiteral(value, quote(value));
    }

    /**
     * Long bracket string holding {@code value} unescaped, using the fewest {@code =} signs that keep
     * the closing bracket out of the content.
     */
    public LuaVerbatimStringLiteral verbatimString(String value) {
        int level = verbatimLevel(value);
        // Lua drops a newline directly after the opening bracket
        if (!value.isEmpty() && (value.charAt(0) == '\n' || value.charAt(0) == '\r')) {
            value = value.charAt(0) + value;
        }
        return new LuaVerbatimStringLiteral(value, level);
    }

    /**
     * Smallest level whose closing bracket first occurs in {@code value + closer} at its own position.
     * A content ending in {@code ]} or {@code ]=} would otherwise merge with the closer.
     */
    public static int verbatimLevel(String value) {
        int level = 0;
        while (true) {
            String closer = "]" + "=".repeat(level) + "]";
            if ((value + closer).indexOf(closer) == value.length()) {
                return level;
            }
            level++;
        }
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case 0x07:
                    sb.append("\\a");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case 0x0B:
                    sb.append("\\v");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        // three digits so a following digit is not read as part of the escape
                        sb.append(String.format("\\%03d", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private static LuaIdentifierLiteral primitiveLiteral(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                return NOT_A_NUMBER;
            }
            if (Double.isInfinite(number)) {
                return number > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
            }
        }
        return new LuaIdentifierLiteral(value.toString());
    }
}
