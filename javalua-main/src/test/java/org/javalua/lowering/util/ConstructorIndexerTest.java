package org.javalua.lowering.util;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javalua.test.JavaFixtures.ORACLE;
import static org.javalua.test.JavaFixtures.find;
import static org.javalua.test.JavaFixtures.nth;
import static org.javalua.test.JavaFixtures.parse;

class ConstructorIndexerTest {

    private static final String POINTS =
            "class Point {\n" +
            "    Point() { }\n" +
            "    Point(int x) { }\n" +
            "    Point(int x, int y) { }\n" +
            "}\n" +
            "class Single {\n" +
            "    Single(String s) { }\n" +
            "}\n" +
            "class Factory {\n" +
            "    Object make() {\n" +
            "        Object a = new Point(1, 2);\n" +
            "        Object b = new Single(\"s\");\n" +
            "        Object c = new Factory();\n" +
            "        return new StringBuilder(\"x\");\n" +
            "    }\n" +
            "}\n";

    private final CompilationUnit unit = parse(POINTS);
    private final ConstructorIndexer indexer = new ConstructorIndexer(ORACLE);

    @Test
    void overloadedConstructors_areNumberedFromOne() {
        for (int i = 0; i < 3; i++) {
            ConstructorDeclaration constructor = nth(unit, ConstructorDeclaration.class,
                    c -> c.getNameAsString().equals("Point"), i);
            assertThat(indexer.constructorIndex(constructor)).isEqualTo(i + 1);
        }
    }

    @Test
    void soleConstructor_hasIndexZero() {
        ConstructorDeclaration constructor = find(unit, ConstructorDeclaration.class, c -> c.getNameAsString().equals("Single"));

        assertThat(indexer.constructorIndex(constructor)).isZero();
    }

    @Test
    void creation_usesTheInvokedConstructor() {
        assertThat(indexer.constructorIndex(creation("Point"))).isEqualTo(3);
        assertThat(indexer.constructorIndex(creation("Single"))).isZero();
    }

    @Test
    void constructorsNotDeclaredInSource_haveIndexZero() {
        // implicit default constructor and a library constructor
        assertThat(indexer.constructorIndex(creation("Factory"))).isZero();
        assertThat(indexer.constructorIndex(creation("StringBuilder"))).isZero();
    }

    private ObjectCreationExpr creation(String typeName) {
        return find(unit, ObjectCreationExpr.class, c -> c.getTypeAsString().equals(typeName));
    }
}
