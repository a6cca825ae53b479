package org.javalua.lowering.template;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import org.javalua.LoweringInvariantException;
import org.javalua.LuaLowering;
import org.javalua.lowering.LoweringContext;
import org.javalua.lua.ast.LuaCodeTemplateExpression;
import org.javalua.lua.ast.LuaCodeTemplateParamsExpression;
import org.javalua.lua.ast.LuaIdentifierName;
import org.javalua.lua.ast.LuaParenthesizedExpression;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javalua.test.JavaFixtures.lowering;
import static org.javalua.test.JavaFixtures.nth;
import static org.javalua.test.JavaFixtures.parse;

class CodeTemplateExpanderTest {

    private static final String CONSOLE =
            "import org.javalua.annotations.LuaTemplate;\n" +
            "\n" +
            "class Console {\n" +
            "    @LuaTemplate(\"{this}:Foo({0}, {*1})\")\n" +
            "    void foo(Object first, Object... rest) { }\n" +
            "\n" +
            "    @LuaTemplate(\"print({0})\")\n" +
            "    static void print(String text) { }\n" +
            "\n" +
            "    @LuaTemplate(\"System.typeof({^0})\")\n" +
            "    static <T> void typeOf() { }\n" +
            "\n" +
            "    @LuaTemplate(\"{class}.size\")\n" +
            "    int size() { return 0; }\n" +
            "\n" +
            "    @LuaTemplate(value = \"string.len(\" + \"{this})\")\n" +
            "    int length() { return 0; }\n" +
            "\n" +
            "    void plain() { }\n" +
            "\n" +
            "    void run(Console r, int a, int b, int c) {\n" +
            "        r.foo(a, b, c);\n" +
            "        r.foo(a);\n" +
            "        print(\"hi\");\n" +
            "        Console.<String>typeOf();\n" +
            "        r.size();\n" +
            "        r.length();\n" +
            "        r.plain();\n" +
            "    }\n" +
            "}\n";

    private final CompilationUnit unit = parse(CONSOLE);
    private final LuaLowering lowering = lowering(unit);

    @Test
    void variadicPlaceholder_takesRemainingArguments() {
        LuaCodeTemplateExpression expanded = expandCall("foo", 0);

        assertThat(expanded).hasToString("r:Foo(a, b, c)");
        assertThat(expanded.codes()).hasAtLeastOneElementOfType(LuaCodeTemplateParamsExpression.class);
    }

    @Test
    void emptyVariadicPlaceholder_dropsItsSeparator() {
        assertThat(expandCall("foo", 1)).hasToString("r:Foo(a)");
    }

    @Test
    void staticCall_needsNoReceiver() {
        assertThat(expandCall("print", 0)).hasToString("print(\"hi\")");
    }

    @Test
    void typeArgument_usesDisplayName() {
        assertThat(expandCall("typeOf", 0)).hasToString("System.typeof(java.lang.String)");
    }

    @Test
    void classPlaceholder_usesReceiverType() {
        assertThat(expandCall("size", 0)).hasToString("Console.size");
    }

    @Test
    void templateOf_joinsConcatenatedAnnotationValue() {
        MethodCallExpr call = nth(unit, MethodCallExpr.class, c -> c.getNameAsString().equals("length"), 0);

        assertThat(lowering.templates().templateOf(call)).contains("string.len({this})");
        assertThat(expandCall("length", 0)).hasToString("string.len(r)");
    }

    @Test
    void methodWithoutTemplate_hasNone() {
        MethodCallExpr call = nth(unit, MethodCallExpr.class, c -> c.getNameAsString().equals("plain"), 0);

        assertThat(lowering.templates().templateOf(call)).isEmpty();
        assertThat(lowering.templates().expandCall(call)).isEmpty();
    }

    @Test
    void outOfRangeArgument_expandsToNothing() {
        CodeTemplateExpander expander = new CodeTemplateExpander(lowering.context(), e -> new LuaIdentifierName(e.toString()));

        LuaCodeTemplateExpression expanded = expander.expand("f({0}, {2})", null, List.of(new NameExpr("x")), List.of());

        assertThat(expanded).hasToString("f(x)");
    }

    @Test
    void allPlaceholdersOutOfRange_leaveOnlyText() {
        CodeTemplateExpander expander = new CodeTemplateExpander(lowering.context(), e -> new LuaIdentifierName(e.toString()));

        assertThat(expander.expand("{0}", null, List.of(), List.of()).isEmpty()).isTrue();
        assertThat(expander.expand("f({^0}, {*0})", null, List.of(), List.of())).hasToString("f()");
    }

    @Test
    void literalReceiver_isParenthesized() {
        LuaCodeTemplateExpression expanded = lowering.templates().expand("{this}:upper()", new StringLiteralExpr("abc"));

        assertThat(expanded.codes().get(0)).isInstanceOf(LuaParenthesizedExpression.class);
        assertThat(expanded).hasToString("(\"abc\"):upper()");
    }

    @Test
    void nameReceiver_isNotParenthesized() {
        CodeTemplateExpander expander = new CodeTemplateExpander(lowering.context(), e -> new LuaIdentifierName(e.toString()));

        assertThat(expander.expand("#{this}", new NameExpr("items"))).hasToString("#items");
    }

    @Test
    void argumentsAreLoweredThroughThePass() {
        Expression two = new IntegerLiteralExpr("2");

        LuaCodeTemplateExpression expanded = lowering.templates().expand("math.max({0}, {1})", null,
                List.of(new IntegerLiteralExpr("0x10"), two), List.of());

        assertThat(expanded).hasToString("math.max(16, 2)");
    }

    @Test
    void receiverPlaceholderWithoutReceiver_isAnInvariantViolation() {
        LoweringContext context = lowering.context();
        CodeTemplateExpander expander = new CodeTemplateExpander(context, e -> new LuaIdentifierName(e.toString()));

        assertThatThrownBy(() -> expander.expand("{this}.n", null))
            .isInstanceOf(LoweringInvariantException.class)
            .hasMessageContaining("{this}.n")
            .hasMessageContaining("Console");
    }

    private LuaCodeTemplateExpression expandCall(String methodName, int occurrence) {
        MethodCallExpr call = nth(unit, MethodCallExpr.class, c -> c.getNameAsString().equals(methodName), occurrence);
        return lowering.templates().expandCall(call).orElseThrow();
    }
}
