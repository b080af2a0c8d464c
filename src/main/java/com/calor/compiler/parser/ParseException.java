package com.calor.compiler.parser;

import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.model.Span;

/**
 * Raised inside the parser when a production cannot continue. Always caught by the
 * nearest recovery loop and turned into a diagnostic.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DiagnosticCode code;
    private final transient Span span;
    private final String suggestion;

    public ParseException(DiagnosticCode code, Span span, String message) {
        this(code, span, message, null);
    }

    public ParseException(DiagnosticCode code, Span span, String message, String suggestion) {
        super(message);
        this.code = code;
        this.span = span;
        this.suggestion = suggestion;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public Span getSpan() {
        return span;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
