package org.javalua.symbol;

import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.stmt.ReturnStmt;
import org.javalua.lowering.literal.ConstantValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javalua.test.JavaFixtures.ORACLE;
import static org.javalua.test.JavaFixtures.call;
import static org.javalua.test.JavaFixtures.find;
import static org.javalua.test.JavaFixtures.parameter;
import static org.javalua.test.JavaFixtures.parse;
import static org.javalua.test.JavaFixtures.variable;

class JavaParserSymbolOracleTest {

    private static final String SHAPES =
            "import java.util.List;\n" +
            "\n" +
            "interface Limits {\n" +
            "    int MAX = 100;\n" +
            "}\n" +
            "class Shapes {\n" +
            "    static final int MIN = -(5);\n" +
            "    static final double RATIO = 1.5, SCALE = 2;\n" +
            "    static final char BELL = 7;\n" +
            "    static final String NAME = \"shapes\";\n" +
            "    static int counter = 3;\n" +
            "    final int width = 4;\n" +
            "\n" +
            "    int area(int end, List<String> names, String[] labels) {\n" +
            "        int local = end;\n" +
            "        Object o = Limits.MAX + MIN + RATIO + SCALE + BELL + NAME + counter + width + Math.abs(local)\n" +
            "                + names.size() + labels.length;\n" +
            "        return local;\n" +
            "    }\n" +
            "}\n";

    private final CompilationUnit unit = parse(SHAPES);

    @Test
    void declaredAndReferencedSymbols_agree() {
        Parameter end = parameter(unit, "end");
        NameExpr use = find(unit, NameExpr.class, n -> n.getNameAsString().equals("end"));

        assertThat(ORACLE.referencedSymbol(use)).isEqualTo(ORACLE.declaredSymbol(end));
        assertThat(ORACLE.declaredSymbol(end).getName()).isEqualTo("end");
    }

    @Test
    void localVariableReferences_resolveToTheirDeclarator() {
        VariableDeclarator local = variable(unit, "local");
        NameExpr use = find(unit, ReturnStmt.class, r -> true).getExpression().orElseThrow().asNameExpr();

        assertThat(ORACLE.referencedSymbol(use).getDeclaration()).isSameAs(local);
    }

    @Test
    void fieldReferences_resolveToTheirDeclarator() {
        NameExpr use = find(unit, NameExpr.class, n -> n.getNameAsString().equals("SCALE"));

        assertThat(ORACLE.referencedSymbol(use).getDeclaration()).isSameAs(variable(unit, "SCALE"));
    }

    @Test
    void patternBindings_areDeclarationSites() {
        CompilationUnit patterns = parse("class A {\n" +
                                         "    int m(Object o) {\n" +
                                         "        if (o instanceof String text) { return text.length(); }\n" +
                                         "        return 0;\n" +
                                         "    }\n" +
                                         "}\n");
        TypePatternExpr text = find(patterns, TypePatternExpr.class, p -> true);
        NameExpr use = find(patterns, NameExpr.class, n -> n.getNameAsString().equals("text"));

        assertThat(ORACLE.declaredSymbol(text).getName()).isEqualTo("text");
        assertThat(ORACLE.referencedSymbol(use)).isEqualTo(ORACLE.declaredSymbol(text));
    }

    @Test
    void declaredSymbol_rejectsOtherNodes() {
        assertThatThrownBy(() -> ORACLE.declaredSymbol(unit.getType(0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void displayNames_areQualified() {
        assertThat(ORACLE.typeDisplayName(use("names"))).isEqualTo("java.util.List");
        assertThat(ORACLE.typeDisplayName(use("labels"))).isEqualTo("java.lang.String[]");
        assertThat(ORACLE.typeDisplayName(use("end"))).isEqualTo("int");
    }

    @Test
    void typeReceiver_fallsBackToWrittenName() {
        MethodCallExpr abs = call(unit, "abs");

        assertThat(ORACLE.typeDisplayName(abs.getScope().orElseThrow())).isEqualTo("Math");
    }

    @Test
    void constantFields_carryTheirValue() {
        FieldAccessExpr max = find(unit, FieldAccessExpr.class, f -> f.getNameAsString().equals("MAX"));

        assertThat(ORACLE.constantFieldOf(max))
                .contains(new ConstantField("Limits", "MAX", ConstantValue.of(100), false));
        assertThat(ORACLE.constantFieldOf(use("MIN")).map(ConstantField::value)).contains(ConstantValue.of(-5));
        assertThat(ORACLE.constantFieldOf(use("SCALE")).map(ConstantField::value)).contains(ConstantValue.of(2.0d));
        assertThat(ORACLE.constantFieldOf(use("NAME")).map(ConstantField::qualifiedName)).contains("Shapes.NAME");
    }

    @Test
    void charConstant_initializedFromInt_isACharacter() {
        Optional<ConstantField> bell = ORACLE.constantFieldOf(use("BELL"));

        assertThat(bell).map(ConstantField::characterTyped).contains(true);
        assertThat(bell).map(ConstantField::value).contains(ConstantValue.of((char) 7));
    }

    @Test
    void nonConstantReads_areNotConstantFields() {
        assertThat(ORACLE.constantFieldOf(use("counter"))).isEmpty();
        assertThat(ORACLE.constantFieldOf(use("width"))).isEmpty();
        assertThat(ORACLE.constantFieldOf(use("local"))).isEmpty();
        assertThat(ORACLE.constantFieldOf(call(unit, "abs"))).isEmpty();
    }

    @Test
    void libraryMethods_haveNoSourceDeclaration() {
        assertThat(ORACLE.methodOf(call(unit, "abs"))).isEmpty();
    }

    private NameExpr use(String name) {
        return find(unit, NameExpr.class, n -> n.getNameAsString().equals(name));
    }
}
