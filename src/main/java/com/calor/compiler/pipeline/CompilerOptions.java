package com.calor.compiler.pipeline;

import java.time.Duration;

import com.calor.compiler.codegen.ContractMode;

import lombok.Builder;
import lombok.Data;

/**
 * Immutable-by-convention settings for one {@link CalorCompiler}.
 */
@Data
@Builder(toBuilder = true)
public class CompilerOptions {

    @Builder.Default
    private ContractMode contractMode = ContractMode.DEBUG;

    /** Also render the Calor.Runtime support source next to the module. */
    @Builder.Default
    private boolean emitRuntimeSupport = false;

    /** C# namespace to use instead of the module name. */
    private String namespaceOverride;

    @Builder.Default
    private Duration proverTimeout = Duration.ofSeconds(5);

    @Builder.Default
    private boolean treatWarningsAsErrors = false;

    @Builder.Default
    private String indent = "    ";

    public static CompilerOptions defaults() {
        return CompilerOptions.builder().build();
    }
}
