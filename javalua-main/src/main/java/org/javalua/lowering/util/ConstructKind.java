package org.javalua.lowering.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.YieldStmt;

/**
 * Jump constructs whose presence changes how an enclosing construct is lowered.
 */
public enum ConstructKind {

    CONTINUE(ContinueStmt.class),
    BREAK(BreakStmt.class),
    RETURN(ReturnStmt.class),
    YIELD(YieldStmt.class),
    THROW(ThrowStmt.class);

    private final Class<? extends Node> nodeType;

    ConstructKind(Class<? extends Node> nodeType) {
        this.nodeType = nodeType;
    }

    public boolean matches(Node node) {
        return nodeType.isInstance(node);
    }
}
