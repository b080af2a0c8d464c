package com.calor.compiler.codegen;

import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.semantic.SemanticModel;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Per-call state of one forward emission. Built fresh for every compile call and never shared.
 */
@Getter
@Builder(toBuilder = true)
public final class EmitContext {

    @NonNull
    @Builder.Default
    private final IdCounter ids = new IdCounter();

    @NonNull
    @Builder.Default
    private final SemanticModel model = SemanticModel.EMPTY;

    @NonNull
    @Builder.Default
    private final DiagnosticBag diagnostics = new DiagnosticBag();

    @NonNull
    @Builder.Default
    private final ContractMode contractMode = ContractMode.DEBUG;

    /** Replaces the module name as the C# namespace when set. */
    private final String namespaceOverride;

    @NonNull
    @Builder.Default
    private final String indent = "    ";
}
