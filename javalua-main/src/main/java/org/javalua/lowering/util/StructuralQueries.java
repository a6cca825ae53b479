package org.javalua.lowering.util;

import java.util.function.Predicate;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.nodeTypes.SwitchNode;
import com.github.javaparser.ast.stmt.SwitchEntry;
import org.javalua.LoweringInvariantException;

/**
 * Ancestor lookups and single-purpose subtree searches used to make context-sensitive lowering
 * decisions.
 */
public final class StructuralQueries {

    private StructuralQueries() {
    }

    /**
     * Nearest strict ancestor of {@code node} accepted by {@code predicate}.
     *
     * @throws LoweringInvariantException if no ancestor matches; callers only ask where one must exist
     */
    public static Node findNearestAncestor(Node node, Predicate<Node> predicate) {
        Node parent = node.getParentNode().orElse(null);
        while (parent != null) {
            if (predicate.test(parent)) {
                return parent;
            }
            parent = parent.getParentNode().orElse(null);
        }
        throw LoweringInvariantException.at(node, "No enclosing construct matches the requested ancestor");
    }

    public static <N extends Node> N findNearestAncestor(Node node, Class<N> nodeType) {
        Node parent = node.getParentNode().orElse(null);
        while (parent != null) {
            if (nodeType.isInstance(parent)) {
                return nodeType.cast(parent);
            }
            parent = parent.getParentNode().orElse(null);
        }
        throw LoweringInvariantException.at(node, "No enclosing " + nodeType.getSimpleName());
    }

    /**
     * Whether a node is a member whose body forms one flat Lua scope: methods, constructors,
     * initializer blocks, field and enum constant declarations.
     */
    public static boolean isMemberLike(Node node) {
        return node instanceof CallableDeclaration
               || node instanceof CompactConstructorDeclaration
               || node instanceof InitializerDeclaration
               || node instanceof FieldDeclaration
               || node instanceof EnumConstantDeclaration
               || node instanceof AnnotationMemberDeclaration;
    }

    /**
     * Member whose Lua scope holds {@code node}. A record header component has no member of its own:
     * it is a parameter of the canonical constructor, so the record declaration is its scope.
     */
    public static BodyDeclaration<?> enclosingMember(Node node) {
        if (isRecordComponent(node)) {
            return (RecordDeclaration) node.getParentNode().get();
        }
        return (BodyDeclaration<?>) findNearestAncestor(node, StructuralQueries::isMemberLike);
    }

    public static boolean isRecordComponent(Node node) {
        return node instanceof Parameter
               && node.getParentNode().filter(RecordDeclaration.class::isInstance).isPresent();
    }

    /**
     * Whether {@code subtree} contains a construct of the given kind that belongs to the same function.
     * Nested lambdas and class bodies are not searched.
     */
    public static boolean containsConstruct(Node subtree, ConstructKind kind) {
        return containsMatch(subtree, kind::matches, child -> !isFunctionBoundary(child));
    }

    /**
     * Depth-first search that stops at the first node accepted by {@code match}. Children rejected by
     * {@code descendInto} are skipped with their whole subtree.
     */
    public static boolean containsMatch(Node node, Predicate<Node> match, Predicate<Node> descendInto) {
        if (match.test(node)) {
            return true;
        }
        for (Node child : node.getChildNodes()) {
            if (descendInto.test(child) && containsMatch(child, match, descendInto)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether any parameter, local variable or pattern binding anywhere inside {@code scope} is called
     * {@code name}.
     */
    public static boolean declaresName(Node scope, String name) {
        return containsMatch(scope, node -> isDeclarationNamed(node, name), child -> true);
    }

    /**
     * Index of the entry of the nearest enclosing switch whose case labels include {@code label},
     * compared by source text.
     */
    public static int switchEntryIndex(Node insideSwitch, Expression label) {
        SwitchNode switchNode = (SwitchNode) findNearestAncestor(insideSwitch, node -> node instanceof SwitchNode);
        String labelText = label.toString();
        NodeList<SwitchEntry> entries = switchNode.getEntries();
        for (int index = 0; index < entries.size(); index++) {
            for (Expression caseLabel : entries.get(index).getLabels()) {
                if (caseLabel.toString().equals(labelText)) {
                    return index;
                }
            }
        }
        throw LoweringInvariantException.at(insideSwitch, "No case labelled '" + labelText + "' in the enclosing switch");
    }

    private static boolean isDeclarationNamed(Node node, String name) {
        if (node instanceof Parameter) {
            return ((Parameter) node).getNameAsString().equals(name);
        }
        if (node instanceof VariableDeclarator) {
            return ((VariableDeclarator) node).getNameAsString().equals(name);
        }
        if (node instanceof TypePatternExpr) {
            return ((TypePatternExpr) node).getNameAsString().equals(name);
        }
        return false;
    }

    private static boolean isFunctionBoundary(Node node) {
        return node instanceof LambdaExpr || node instanceof BodyDeclaration;
    }
}
