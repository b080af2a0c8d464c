package com.calor.compiler.semantic;

import java.util.HashMap;
import java.util.Map;

import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.model.Span;

/**
 * Tracks declaration IDs of one compilation and reports reuse.
 */
public class IdRegistry {

    private final Map<String, Span> firstUse = new HashMap<>();
    private final DiagnosticBag diagnostics;

    public IdRegistry(DiagnosticBag diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Record {@code id}; blank IDs are ignored since the parser already reported them.
     */
    public void register(String id, Span span, String owner) {
        if (id == null || id.isBlank()) {
            return;
        }
        Span previous = firstUse.putIfAbsent(id, span);
        if (previous != null) {
            diagnostics.report(DiagnosticCode.DUPLICATE_ID, span,
                    "ID '" + id + "' of " + owner + " is already used at line " + previous.getLine());
        }
    }

    public boolean contains(String id) {
        return firstUse.containsKey(id);
    }

    public int size() {
        return firstUse.size();
    }
}
