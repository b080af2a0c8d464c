package com.calor.compiler.codegen;

import java.util.HashMap;
import java.util.Map;

/**
 * Mints fresh names for emitter scaffolding. One instance per emit call, so identical input
 * always yields identical names.
 */
public class IdCounter {

    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Next name for {@code prefix}: {@code u1}, {@code u2}, ... numbered per prefix.
     */
    public String next(String prefix) {
        int n = counters.merge(prefix, 1, Integer::sum);
        return prefix + n;
    }
}
