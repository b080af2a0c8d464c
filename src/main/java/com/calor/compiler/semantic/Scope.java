package com.calor.compiler.semantic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One lexical frame. Children may shadow a parent binding; they never modify the parent.
 */
public final class Scope {
    private final Scope parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope child() {
        return new Scope(this);
    }

    public Scope getParent() {
        return parent;
    }

    /**
     * Define a symbol in this frame. Returns the existing symbol when the name is already
     * bound here, leaving the frame unchanged.
     */
    public Symbol define(Symbol symbol) {
        Symbol existing = symbols.get(symbol.getName());
        if (existing != null) {
            return existing;
        }
        symbols.put(symbol.getName(), symbol);
        return null;
    }

    public Symbol getLocal(String name) {
        return symbols.get(name);
    }

    /**
     * Nearest enclosing binding of {@code name}, or null.
     */
    public Symbol lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Every name visible from this frame, innermost first. Used for suggestions.
     */
    public List<String> visibleNames() {
        List<String> names = new ArrayList<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            for (String name : scope.symbols.keySet()) {
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }
}
