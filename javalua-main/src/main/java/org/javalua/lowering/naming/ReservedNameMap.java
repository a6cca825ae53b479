package org.javalua.lowering.naming;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.Node;
import org.javalua.LoweringInvariantException;
import org.javalua.symbol.DeclarationSymbol;

/**
 * Replacement names chosen for declarations whose own name is reserved in Lua, plus every name the
 * lowering introduced into each member scope.
 * <p>
 * Entries live as long as the compilation unit they belong to; a symbol never maps to two names.
 */
public final class ReservedNameMap {

    private final Map<DeclarationSymbol, String> names = new HashMap<>();
    private final Map<Node, Set<String>> introducedNames = new IdentityHashMap<>();

    public void record(DeclarationSymbol symbol, String replacement, Node member) {
        String previous = names.putIfAbsent(symbol, replacement);
        if (previous != null && !previous.equals(replacement)) {
            throw LoweringInvariantException.at(symbol.getDeclaration(),
                    "'" + symbol.getName() + "' is already renamed to '" + previous + "', cannot rename it to '" + replacement + "'");
        }
        introduce(replacement, member);
    }

    public Optional<String> lookup(DeclarationSymbol symbol) {
        return Optional.ofNullable(names.get(symbol));
    }

    /**
     * Marks {@code name} as taken in {@code member} although no Java declaration spells it.
     */
    public void introduce(String name, Node member) {
        introducedNames.computeIfAbsent(member, key -> new HashSet<>()).add(name);
    }

    public boolean isIntroduced(String name, Node member) {
        Set<String> introduced = introducedNames.get(member);
        return introduced != null && introduced.contains(name);
    }

    public int size() {
        return names.size();
    }
}
