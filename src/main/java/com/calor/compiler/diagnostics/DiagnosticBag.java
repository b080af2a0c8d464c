package com.calor.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.calor.compiler.model.Span;

/**
 * Diagnostics accumulated by every stage of one compilation call.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class DiagnosticBag {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic report(DiagnosticCode code, Span span, String message) {
        return add(Diagnostic.builder()
                .severity(code.getDefaultSeverity())
                .code(code)
                .span(span)
                .message(message)
                .build());
    }

    public Diagnostic report(DiagnosticCode code, Span span, String message, String suggestion) {
        return add(Diagnostic.builder()
                .severity(code.getDefaultSeverity())
                .code(code)
                .span(span)
                .message(message)
                .suggestion(suggestion)
                .build());
    }

    public Diagnostic reportWithFix(DiagnosticCode code, Span span, String message, Fix fix) {
        return add(Diagnostic.builder()
                .severity(code.getDefaultSeverity())
                .code(code)
                .span(span)
                .message(message)
                .fix(fix)
                .build());
    }

    public Diagnostic add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public void addAll(DiagnosticBag other) {
        diagnostics.addAll(other.diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.getSeverity() == Severity.WARNING)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.getCode() == code).collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }
}
