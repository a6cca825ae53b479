package org.javalua.lowering.util;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import org.javalua.LoweringInvariantException;
import org.javalua.symbol.SymbolOracle;

/**
 * Numbers overloaded constructors. Lua has one constructor slot per class, so each overload is lowered
 * to a separate function selected by this index.
 */
public final class ConstructorIndexer {

    private final SymbolOracle oracle;

    public ConstructorIndexer(SymbolOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * 0 when the declaring type has a single constructor, otherwise the 1-based position of
     * {@code constructor} among the type's constructors.
     */
    public int constructorIndex(ConstructorDeclaration constructor) {
        TypeDeclaration<?> type = StructuralQueries.findNearestAncestor(constructor, TypeDeclaration.class);
        List<ConstructorDeclaration> constructors = type.getConstructors();
        if (constructors.size() <= 1) {
            return 0;
        }
        for (int index = 0; index < constructors.size(); index++) {
            if (constructors.get(index) == constructor) {
                return index + 1;
            }
        }
        throw LoweringInvariantException.at(constructor, "Constructor is not declared by its enclosing type");
    }

    /**
     * Index of the constructor an object creation invokes; 0 when that constructor is not declared in
     * source.
     */
    public int constructorIndex(Expression creation) {
        Optional<ConstructorDeclaration> constructor = oracle.constructorOf(creation);
        return constructor.map(this::constructorIndex).orElse(0);
    }
}
