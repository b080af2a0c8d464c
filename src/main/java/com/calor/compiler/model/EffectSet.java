package com.calor.compiler.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import lombok.Value;

/**
 * Declared side-effect codes of a function or delegate. Advisory only.
 * Codes are kept sorted so every consumer iterates them in the same order.
 */
@Value
public class EffectSet {

    public static final EffectSet EMPTY = new EffectSet(Collections.emptySortedSet());

    /** Codes understood by the checker; anything else draws a warning. */
    public static final Set<String> KNOWN_CODES = Set.of(
            "cw", "cr", "fw", "fr", "fd", "net", "http", "db", "dbr", "dbw",
            "env", "proc", "alloc", "time", "rand");

    Set<String> codes;

    private EffectSet(Set<String> codes) {
        this.codes = codes;
    }

    public static EffectSet of(Collection<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return EMPTY;
        }
        return new EffectSet(Collections.unmodifiableSortedSet(new TreeSet<>(codes)));
    }

    public boolean isEmpty() {
        return codes.isEmpty();
    }
}
