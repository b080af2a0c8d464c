package com.calor.compiler.codegen.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects {@code using} directives for one generated compilation unit.
 * Entries are kept sorted and de-duplicated.
 */
public class UsingManager {

    private final Set<String> usings = new TreeSet<>();
    private final String currentNamespace;

    public UsingManager(String currentNamespace) {
        this.currentNamespace = currentNamespace;
    }

    /**
     * Adds a plain namespace import. The enclosing namespace is skipped.
     */
    public void addUsing(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            return;
        }
        if (namespace.equals(currentNamespace)) {
            return;
        }
        usings.add(namespace.trim());
    }

    public void addAlias(String alias, String namespace) {
        usings.add(alias.trim() + " = " + namespace.trim());
    }

    public void addStatic(String typeName) {
        usings.add("static " + typeName.trim());
    }

    /**
     * Directive bodies in output order, without the {@code using} keyword.
     */
    public List<String> getUsings() {
        return new ArrayList<>(usings);
    }
}
