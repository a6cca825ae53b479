package org.javalua.lowering.naming;

import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.TypePatternExpr;
import org.javalua.LoweringInvariantException;
import org.javalua.lowering.LoweringContext;
import org.javalua.lowering.util.StructuralQueries;
import org.javalua.lua.ast.LuaIdentifierName;
import org.javalua.symbol.DeclarationSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps Java declarations from clashing with Lua reserved words.
 * <p>
 * Lua has no block scoping equivalent to Java's, so every parameter, local and pattern binding of a
 * member shares one scope: a replacement name is free only if no declaration anywhere in the member already uses it.
 */
public final class IdentifierSafety {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierSafety.class);

    private final LoweringContext context;

    public IdentifierSafety(LoweringContext context) {
        this.context = context;
    }

    /**
     * Lua name for a declaration.
     *
     * @param candidateName   the declared Java name
     * @param declarationSite the declaring {@code Parameter}, {@code VariableDeclarator} or
     *                        {@code TypePatternExpr}
     * @return {@code candidateName} when it is not reserved, otherwise a replacement that is recorded
     *         for the declared symbol
     */
    public String ensureSafeName(String candidateName, Node declarationSite) {
        if (!isReserved(candidateName)) {
            return candidateName;
        }
        DeclarationSymbol symbol = context.getOracle().declaredSymbol(declarationSite);
        ReservedNameMap reservedNames = context.getReservedNames();
        Optional<String> recorded = reservedNames.lookup(symbol);
        if (recorded.isPresent()) {
            return recorded.get();
        }
        Node member = StructuralQueries.enclosingMember(declarationSite);
        String safeName = uniqueIdentifier(candidateName, member, 1);
        reservedNames.record(symbol, safeName, member);
        logger.debug("Renamed reserved word '{}' to '{}' in {}", candidateName, safeName, context.getUnitName());
        return safeName;
    }

    /**
     * Lua name for a use of a declared symbol.
     *
     * @throws LoweringInvariantException if {@code originalName} is reserved and its declaration was never
     *                                    passed to {@link #ensureSafeName(String, Node)}
     */
    public String resolveName(DeclarationSymbol symbol, String originalName) {
        if (!isReserved(originalName)) {
            return originalName;
        }
        return context.getReservedNames().lookup(symbol)
                .orElseThrow(() -> LoweringInvariantException.at(symbol.getDeclaration(),
                        "Reserved name '" + originalName + "' is used before its declaration was renamed"));
    }

    public LuaIdentifierName safeParameterName(Parameter parameter) {
        return new LuaIdentifierName(ensureSafeName(parameter.getNameAsString(), parameter));
    }

    public LuaIdentifierName safeVariableName(VariableDeclarator variable) {
        return new LuaIdentifierName(ensureSafeName(variable.getNameAsString(), variable));
    }

    /**
     * Name of the binding introduced by {@code o instanceof String s}.
     */
    public LuaIdentifierName safePatternName(TypePatternExpr pattern) {
        return new LuaIdentifierName(ensureSafeName(pattern.getNameAsString(), pattern));
    }

    /**
     * A fresh local name for compiler-introduced temporaries, e.g. {@code hint1}, unique within the
     * member enclosing {@code site}.
     */
    public String newTemporaryName(String hint, Node site) {
        Node member = StructuralQueries.enclosingMember(site);
        while (true) {
            String name = hint + context.nextMappingIndex();
            if (!isReserved(name) && isFree(name, member)) {
                context.getReservedNames().introduce(name, member);
                return name;
            }
        }
    }

    public boolean isReserved(String name) {
        return context.getReservedWords().isReserved(name);
    }

    private String uniqueIdentifier(String name, Node member, int index) {
        while (true) {
            String newName = newIdentifierName(name, index);
            if (isFree(newName, member)) {
                return newName;
            }
            ++index;
        }
    }

    private boolean isFree(String name, Node member) {
        return !context.getReservedNames().isIntroduced(name, member)
               && !StructuralQueries.declaresName(member, name);
    }

    static String newIdentifierName(String name, int index) {
        switch (index) {
            case 0:
                return name;
            case 1:
                return name + "_";
            case 2:
                return "_" + name;
            default:
                return name + (index - 2);
        }
    }
}
