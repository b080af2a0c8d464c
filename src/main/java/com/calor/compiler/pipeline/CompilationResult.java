package com.calor.compiler.pipeline;

import java.util.List;

import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.Severity;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.prover.ProverResult;
import com.calor.compiler.semantic.SemanticModel;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Outcome of one compiler call. Outputs are null when the stage producing them did not run.
 */
@Data
@Builder
public class CompilationResult {

    private boolean success;

    private ModuleDeclaration module;

    private SemanticModel semanticModel;

    /** Generated C# compilation unit. */
    private String csharp;

    /** Calor.Runtime support source, when requested. */
    private String runtimeSupport;

    /** Canonical Calor text produced by formatting. */
    private String calor;

    @Singular
    private List<Diagnostic> diagnostics;

    /** One verdict per exported contract proposition, in proposition order. */
    @Singular
    private List<ProverResult> proverResults;

    public long getErrorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public long getWarningCount() {
        return diagnostics.stream().filter(d -> d.getSeverity() == Severity.WARNING).count();
    }
}
