package org.javalua.symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.types.ResolvedType;

/**
 * Semantic questions the lowering core asks about already-parsed Java code.
 * <p>
 * Methods throw {@link org.javalua.SymbolResolutionException} when the front end cannot answer.
 */
public interface SymbolOracle {

    /**
     * Symbol declared by a {@code Parameter}, {@code VariableDeclarator} or {@code TypePatternExpr}.
     */
    DeclarationSymbol declaredSymbol(Node declarationSite);

    /**
     * Symbol a simple name refers to.
     */
    DeclarationSymbol referencedSymbol(NameExpr name);

    /**
     * Static type of an expression.
     */
    ResolvedType typeOf(Expression expression);

    ResolvedType resolve(Type type);

    /**
     * Name under which a type is known in the generated Lua code.
     */
    String displayName(ResolvedType type);

    default String typeDisplayName(Expression expression) {
        return displayName(typeOf(expression));
    }

    /**
     * Source declaration of the constructor an object creation expression invokes; empty for
     * constructors that are not declared in source (library types, implicit default constructors).
     */
    Optional<ConstructorDeclaration> constructorOf(Expression creation);

    /**
     * Source declaration of the method a call invokes; empty for library methods.
     */
    Optional<MethodDeclaration> methodOf(MethodCallExpr call);

    /**
     * Fully-qualified name of an annotation's type.
     */
    String annotationTypeName(AnnotationExpr annotation);

    /**
     * Fully-qualified names of the annotations on a parameter, in declaration order.
     */
    default List<String> attributeTypeNames(Parameter parameter) {
        List<String> names = new ArrayList<>();
        for (AnnotationExpr annotation : parameter.getAnnotations()) {
            names.add(annotationTypeName(annotation));
        }
        return names;
    }

    /**
     * The constant field an expression reads, when it reads one.
     */
    Optional<ConstantField> constantFieldOf(Expression expression);
}
