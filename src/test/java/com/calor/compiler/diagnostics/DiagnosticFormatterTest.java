package com.calor.compiler.diagnostics;

import com.calor.compiler.model.Span;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiagnosticFormatter.
 */
class DiagnosticFormatterTest {

    @Test
    void testFormatWithSuggestion() {
        Diagnostic diagnostic = Diagnostic.builder()
                .severity(Severity.ERROR)
                .code(DiagnosticCode.UNDEFINED_REFERENCE)
                .message("Undefined reference 'cuont'")
                .span(Span.of(40, 3, 5, 5))
                .suggestion("Did you mean 'count'?")
                .build();

        String line = DiagnosticFormatter.format(diagnostic, "Demo.calr");

        assertThat(line).isEqualTo(
                "Demo.calr(3,5): error undefined_reference: Undefined reference 'cuont' (Did you mean 'count'?)");
    }

    @Test
    void testFormatWarningWithoutFile() {
        Diagnostic diagnostic = Diagnostic.builder()
                .severity(Severity.WARNING)
                .code(DiagnosticCode.NON_EXHAUSTIVE_MATCH)
                .message("Match is not exhaustive")
                .span(Span.of(0, 7, 1, 2))
                .build();

        assertThat(DiagnosticFormatter.format(diagnostic, null))
                .isEqualTo("(7,1): warning non_exhaustive_match: Match is not exhaustive");
    }
}
