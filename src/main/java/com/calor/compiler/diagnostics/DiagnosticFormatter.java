package com.calor.compiler.diagnostics;

import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Renders diagnostics as {@code file(line,col): error code: message} lines.
 */
@UtilityClass
public class DiagnosticFormatter {

    public String format(Diagnostic diagnostic, String fileName) {
        StringBuilder sb = new StringBuilder();
        if (fileName != null) {
            sb.append(fileName);
        }
        sb.append('(').append(diagnostic.getLine()).append(',').append(diagnostic.getColumn()).append("): ");
        sb.append(diagnostic.getSeverity().name().toLowerCase(Locale.ROOT)).append(' ');
        sb.append(diagnostic.getCode().getCode()).append(": ");
        sb.append(diagnostic.getMessage());
        if (diagnostic.getSuggestion() != null) {
            sb.append(" (").append(diagnostic.getSuggestion()).append(')');
        }
        return sb.toString();
    }
}
