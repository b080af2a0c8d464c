package com.calor.compiler.diagnostics;

import com.calor.compiler.model.Span;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single compiler message. Pure structure: no formatting, no IO.
 */
@Value
@Builder(toBuilder = true)
public class Diagnostic {

    @NonNull
    Severity severity;

    @NonNull
    DiagnosticCode code;

    @NonNull
    String message;

    @NonNull
    Span span;

    String suggestion;

    Fix fix;

    public int getLine() {
        return span.getLine();
    }

    public int getColumn() {
        return span.getColumn();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
