package org.javalua.lowering;

import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;
import org.javalua.lowering.naming.LuaReservedWords;
import org.javalua.lowering.naming.ReservedNameMap;
import org.javalua.symbol.SymbolOracle;

/**
 * Mutable state of lowering one compilation unit. Not thread-safe: units lowered in parallel each
 * get their own context.
 */
public final class LoweringContext {

    private final CompilationUnit unit;
    private final SymbolOracle oracle;
    private final LoweringOptions options;
    private final ReservedNameMap reservedNames = new ReservedNameMap();
    private int mappingCounter;

    public LoweringContext(CompilationUnit unit, SymbolOracle oracle, LoweringOptions options) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.options = Objects.requireNonNull(options, "options");
    }

    public CompilationUnit getUnit() {
        return unit;
    }

    public SymbolOracle getOracle() {
        return oracle;
    }

    public LoweringOptions getOptions() {
        return options;
    }

    public LuaReservedWords getReservedWords() {
        return options.getReservedWords();
    }

    public ReservedNameMap getReservedNames() {
        return reservedNames;
    }

    /**
     * Path of the unit's source file as the front end reports it; empty when the unit was not read
     * from a file.
     */
    public String getSourcePath() {
        return options.getSourcePath()
                .or(() -> unit.getStorage().map(storage -> storage.getPath().toString()))
                .orElse("");
    }

    public String getUnitName() {
        String path = getSourcePath();
        if (!path.isEmpty()) {
            return path;
        }
        if (unit.getTypes().isEmpty()) {
            return "<unnamed unit>";
        }
        return unit.getPrimaryTypeName().orElse(unit.getType(0).getNameAsString());
    }

    /**
     * Next value of the unit-wide counter used to make generated names unique.
     */
    public int nextMappingIndex() {
        return ++mappingCounter;
    }
}
