package org.javalua.symbol;

import java.util.Objects;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.nodeTypes.NodeWithName;

/**
 * Opaque handle to a declared entity (parameter, local variable, pattern binding, field).
 * <p>
 * Two symbols are equal only when they wrap the same declaration node. JavaParser nodes compare
 * structurally, so two {@code int end} parameters of different methods would otherwise collide.
 */
public final class DeclarationSymbol {

    private final Node declaration;
    private final String name;

    private DeclarationSymbol(Node declaration, String name) {
        this.declaration = declaration;
        this.name = name;
    }

    public static DeclarationSymbol of(Node declaration) {
        Objects.requireNonNull(declaration, "declaration");
        return new DeclarationSymbol(declaration, nameOf(declaration));
    }

    public Node getDeclaration() {
        return declaration;
    }

    public String getName() {
        return name;
    }

    private static String nameOf(Node declaration) {
        if (declaration instanceof NodeWithSimpleName) {
            return ((NodeWithSimpleName<?>) declaration).getNameAsString();
        }
        if (declaration instanceof NodeWithName) {
            return ((NodeWithName<?>) declaration).getNameAsString();
        }
        return declaration.getClass().getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return declaration == ((DeclarationSymbol) o).declaration;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(declaration);
    }

    @Override
    public String toString() {
        return "DeclarationSymbol{" +
               "name='" + name + '\'' +
               ", kind=" + declaration.getClass().getSimpleName() +
               '}';
    }
}
