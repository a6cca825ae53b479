package org.javalua.lowering.naming;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Identifiers a lowered Java declaration must not use: Lua keywords and the globals generated chunks
 * depend on.
 */
public final class LuaReservedWords {

    public static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto", "if",
            "in", "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

    public static final Set<String> BUILTINS = Set.of(
            "this", "self", "_G", "_ENV", "System",
            "setmetatable", "getmetatable", "rawget", "rawset", "rawequal", "rawlen",
            "select", "pcall", "xpcall", "error", "assert", "require",
            "tostring", "tonumber", "type", "pairs", "ipairs", "next",
            "string", "table", "math", "coroutine");

    private static final LuaReservedWords DEFAULTS = new LuaReservedWords(Set.of());

    private final Set<String> words;

    private LuaReservedWords(Collection<String> extraWords) {
        Set<String> all = new HashSet<>(KEYWORDS);
        all.addAll(BUILTINS);
        all.addAll(extraWords);
        this.words = Collections.unmodifiableSet(all);
    }

    public static LuaReservedWords defaults() {
        return DEFAULTS;
    }

    public LuaReservedWords with(Collection<String> extraWords) {
        if (extraWords.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(words);
        merged.addAll(extraWords);
        return new LuaReservedWords(merged);
    }

    public boolean isReserved(String name) {
        return words.contains(name);
    }

    public Set<String> words() {
        return words;
    }
}
