package org.javalua;

import java.util.Optional;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;

/**
 * Raised when the driving lowering pass breaks a precondition of the core: a reserved name resolved
 * before it was declared, an ancestor that does not exist, a switch label with no matching entry.
 * <p>
 * The transformation of the current compilation unit must stop; the message carries the unit and
 * the source position of the offending construct.
 */
public class LoweringInvariantException extends LoweringException {

    private final String unitName;
    private final int line;
    private final int column;

    public LoweringInvariantException(String message, String unitName, int line, int column, String nodeDescription) {
        super(format(message, unitName, line, column), nodeDescription);
        this.unitName = unitName;
        this.line = line;
        this.column = column;
    }

    public static LoweringInvariantException at(Node node, String message) {
        String unitName = unitNameOf(node);
        Position begin = node.getBegin().orElse(null);
        int line = begin != null ? begin.line : -1;
        int column = begin != null ? begin.column : -1;
        return new LoweringInvariantException(message, unitName, line, column, describe(node));
    }

    public String getUnitName() {
        return unitName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    static String unitNameOf(Node node) {
        Optional<CompilationUnit> unit = node.findCompilationUnit();
        if (unit.isEmpty()) {
            return "<unknown unit>";
        }
        return unit.get().getStorage()
                .map(storage -> storage.getPath().toString())
                .or(() -> unit.get().getPrimaryTypeName())
                .orElseGet(() -> unit.get().getTypes().isEmpty()
                        ? "<unnamed unit>"
                        : unit.get().getType(0).getNameAsString());
    }

    static String describe(Node node) {
        String text = node.toString();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline) + " ...";
        }
        return node.getClass().getSimpleName() + " '" + text + "'";
    }

    private static String format(String message, String unitName, int line, int column) {
        if (line < 0) {
            return message + " (" + unitName + ")";
        }
        return message + " (" + unitName + ":" + line + ":" + column + ")";
    }
}
