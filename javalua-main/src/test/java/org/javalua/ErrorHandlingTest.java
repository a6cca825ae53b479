package org.javalua;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.NameExpr;
import org.javalua.lowering.template.CodeTemplate;
import org.javalua.symbol.DeclarationSymbol;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javalua.test.JavaFixtures.ORACLE;
import static org.javalua.test.JavaFixtures.find;
import static org.javalua.test.JavaFixtures.lowering;
import static org.javalua.test.JavaFixtures.parse;
import static org.javalua.test.JavaFixtures.use;

class ErrorHandlingTest {

    // 1. TemplateSyntaxException: unknown placeholder key
    @Test
    void templateSyntax_carriesTemplateAndOffset() {
        String template = "{this}.f({x})";
        assertThatThrownBy(() -> CodeTemplate.parse(template))
            .isInstanceOf(TemplateSyntaxException.class)
            .satisfies(e -> {
                TemplateSyntaxException tse = (TemplateSyntaxException) e;
                assertThat(tse.getTemplate()).isEqualTo(template);
                assertThat(tse.getOffset()).isEqualTo(9);
                assertThat(tse.getMessage()).contains("{x}");
                assertThat(tse).isInstanceOf(LoweringException.class);
                assertThat(tse).isInstanceOf(JavaLuaException.class);
            });
    }

    // 2. LoweringInvariantException: reserved name used before its declaration was renamed
    @Test
    void invariantViolation_reportsUnitAndPosition() {
        CompilationUnit unit = parse("class Loop {\n" +
                                     "    int last(int end) {\n" +
                                     "        return end;\n" +
                                     "    }\n" +
                                     "}\n");
        LuaLowering lowering = lowering(unit);
        DeclarationSymbol symbol = ORACLE.referencedSymbol(use(unit, "end"));

        assertThatThrownBy(() -> lowering.identifiers().resolveName(symbol, "end"))
            .isInstanceOf(LoweringInvariantException.class)
            .satisfies(e -> {
                LoweringInvariantException lie = (LoweringInvariantException) e;
                assertThat(lie.getUnitName()).isEqualTo("Loop");
                assertThat(lie.getLine()).isEqualTo(2);
                assertThat(lie.getColumn()).isEqualTo(14);
                assertThat(lie.getNodeDescription()).contains("Parameter").contains("int end");
                assertThat(lie.getMessage()).contains("Loop:2:14");
            });
    }

    // 3. SymbolResolutionException: the front end cannot resolve a name
    @Test
    void unresolvedName_wrapsSolverFailure() {
        CompilationUnit unit = parse("class Broken {\n" +
                                     "    Object get() { return missing; }\n" +
                                     "}\n");
        NameExpr missing = use(unit, "missing");

        assertThatThrownBy(() -> ORACLE.typeOf(missing))
            .isInstanceOf(SymbolResolutionException.class)
            .satisfies(e -> {
                SymbolResolutionException sre = (SymbolResolutionException) e;
                assertThat(sre.getSymbolName()).isEqualTo("missing");
                assertThat(sre.getMessage()).isEqualTo("Unable to resolve 'missing'");
                assertThat(sre.getCause()).isNotNull();
            });
    }

    // 4. LoweringException: expression outside what the core lowers
    @Test
    void unsupportedExpression_namesTheNode() {
        CompilationUnit unit = parse("class Sum {\n" +
                                     "    int add(int a, int b) { return a + b; }\n" +
                                     "}\n");
        BinaryExpr sum = find(unit, BinaryExpr.class, expr -> true);

        assertThatThrownBy(() -> lowering(unit).expressions().lower(sum))
            .isInstanceOf(LoweringException.class)
            .isNotInstanceOf(LoweringInvariantException.class)
            .satisfies(e -> {
                assertThat(e.getMessage()).contains("BinaryExpr");
                assertThat(((LoweringException) e).getNodeDescription()).isEqualTo("a + b");
                assertThat(((LoweringException) e).getRange())
                    .hasValueSatisfying(range -> assertThat(range.begin.line).isEqualTo(2));
            });
    }
}
