package org.javalua;

import java.util.Optional;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

/**
 * A construct could not be lowered. Carries the construct's source text and, when the failure is
 * tied to a parsed node, its source range.
 */
public class LoweringException extends JavaLuaException {

    private final String nodeDescription;
    private final Range range;

    public LoweringException(String message, String nodeDescription) {
        this(message, nodeDescription, null, null);
    }

    public LoweringException(String message, String nodeDescription, Throwable cause) {
        this(message, nodeDescription, null, cause);
    }

    public LoweringException(String message, Node node) {
        this(message, node.toString(), node.getRange().orElse(null), null);
    }

    protected LoweringException(String message, String nodeDescription, Range range, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
        this.range = range;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }

    public Optional<Range> getRange() {
        return Optional.ofNullable(range);
    }
}
