package com.calor.compiler.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.codegen.EmitContext;
import com.calor.compiler.codegen.calor.CalorEmitter;
import com.calor.compiler.codegen.csharp.CSharpEmitter;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.parser.CalorParser;
import com.calor.compiler.prover.ContractProver;
import com.calor.compiler.prover.DeadlineContractProver;
import com.calor.compiler.prover.ProverResult;
import com.calor.compiler.semantic.SemanticChecker;
import com.calor.compiler.semantic.SemanticModel;

/**
 * Entry point of the compiler core: parse, check, optionally prove, then emit.
 *
 * Stateless apart from its options, so one instance may serve concurrent callers. Every call
 * builds its own diagnostic bag, scopes and ID counter. No call throws on malformed input;
 * faults inside the pipeline come back as a single {@code internal_error} diagnostic.
 */
public class CalorCompiler {
    private static final Logger log = LoggerFactory.getLogger(CalorCompiler.class);

    private final CompilerOptions options;
    private final ContractProver prover;

    public CalorCompiler() {
        this(CompilerOptions.defaults());
    }

    public CalorCompiler(CompilerOptions options) {
        this(options, null);
    }

    /**
     * @param prover optional contract verifier, consulted with {@link CompilerOptions#getProverTimeout()}
     */
    public CalorCompiler(CompilerOptions options, ContractProver prover) {
        this.options = options;
        this.prover = prover;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public CompilationResult compile(String source) {
        return compile(source, options);
    }

    /**
     * Full pipeline with per-call options.
     */
    public CompilationResult compile(String source, CompilerOptions callOptions) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        try {
            ModuleDeclaration module = parse(source, diagnostics);
            if (module == null) {
                return finish("compile", null, null, null, diagnostics, callOptions).build();
            }
            return checkAndEmit(module, diagnostics, callOptions);
        } catch (RuntimeException | StackOverflowError e) {
            return internalError(e, diagnostics);
        }
    }

    /**
     * Parse and check only; nothing is emitted.
     */
    public CompilationResult check(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        try {
            ModuleDeclaration module = parse(source, diagnostics);
            SemanticModel model = null;
            List<ProverResult> verdicts = List.of();
            if (module != null && !diagnostics.hasErrors()) {
                model = new SemanticChecker(diagnostics).check(module);
                verdicts = prove(model, options);
            }
            return finish("check", module, model, verdicts, diagnostics, options).build();
        } catch (RuntimeException | StackOverflowError e) {
            return internalError(e, diagnostics);
        }
    }

    /**
     * Re-emit a source file in canonical Calor form. Sources with errors are not formatted.
     */
    public CompilationResult format(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        try {
            ModuleDeclaration module = parse(source, diagnostics);
            CompilationResult.CompilationResultBuilder result = finish("format", module, null, null, diagnostics, options);
            if (module != null && !diagnostics.hasErrors()) {
                result.calor(new CalorEmitter().emit(module));
            }
            return result.build();
        } catch (RuntimeException | StackOverflowError e) {
            return internalError(e, diagnostics);
        }
    }

    /**
     * Canonical Calor text of a pre-built module, such as one produced by a migration tool.
     */
    public CompilationResult emitCalor(ModuleDeclaration module) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        try {
            String calor = new CalorEmitter().emit(module);
            return finish("emit-calor", module, null, null, diagnostics, options)
                    .calor(calor)
                    .build();
        } catch (RuntimeException | StackOverflowError e) {
            return internalError(e, diagnostics);
        }
    }

    /**
     * Check and lower a pre-built module to C#.
     */
    public CompilationResult emitCSharp(ModuleDeclaration module) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        try {
            return checkAndEmit(module, diagnostics, options);
        } catch (RuntimeException | StackOverflowError e) {
            return internalError(e, diagnostics);
        }
    }

    private ModuleDeclaration parse(String source, DiagnosticBag diagnostics) {
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);
        log.debug("Parsed module {} with {} diagnostic(s)", module != null ? module.getName() : "<none>",
                diagnostics.size());
        return module;
    }

    private CompilationResult checkAndEmit(ModuleDeclaration module, DiagnosticBag diagnostics,
            CompilerOptions callOptions) {
        // Recovered trees from a failed parse are not checked; the emitter then reports the block
        SemanticModel model = SemanticModel.EMPTY;
        List<ProverResult> verdicts = List.of();
        if (!diagnostics.hasErrors()) {
            model = new SemanticChecker(diagnostics).check(module);
            verdicts = prove(model, callOptions);
        }

        if (callOptions.isTreatWarningsAsErrors() && !diagnostics.getWarnings().isEmpty()) {
            diagnostics.report(DiagnosticCode.EMISSION_BLOCKED, spanOf(module),
                    "C# emission blocked: " + diagnostics.getWarnings().size() + " warning(s) treated as errors");
            return finish("compile", module, model, verdicts, diagnostics, callOptions).build();
        }

        EmitContext context = EmitContext.builder()
                .model(model)
                .diagnostics(diagnostics)
                .contractMode(callOptions.getContractMode())
                .namespaceOverride(callOptions.getNamespaceOverride())
                .indent(callOptions.getIndent())
                .build();
        CSharpEmitter emitter = new CSharpEmitter();
        String csharp = emitter.emit(module, context);

        CompilationResult.CompilationResultBuilder result = finish("compile", module, model, verdicts, diagnostics,
                callOptions);
        result.csharp(csharp);
        if (csharp != null && callOptions.isEmitRuntimeSupport()) {
            result.runtimeSupport(emitter.emitRuntimeSupport());
        }
        return result.build();
    }

    private List<ProverResult> prove(SemanticModel model, CompilerOptions callOptions) {
        if (prover == null || model.getPropositions().isEmpty()) {
            return List.of();
        }
        try (DeadlineContractProver deadline = new DeadlineContractProver(prover)) {
            return deadline.proveAll(model.getPropositions(), callOptions.getProverTimeout());
        }
    }

    private CompilationResult.CompilationResultBuilder finish(String stage, ModuleDeclaration module,
            SemanticModel model, List<ProverResult> verdicts, DiagnosticBag diagnostics, CompilerOptions callOptions) {
        boolean blockedByWarnings = callOptions.isTreatWarningsAsErrors() && !diagnostics.getWarnings().isEmpty();
        boolean success = module != null && !diagnostics.hasErrors() && !blockedByWarnings;
        log.info("{} {}: {} error(s), {} warning(s)", stage, module != null ? module.getName() : "<no module>",
                diagnostics.getErrors().size(), diagnostics.getWarnings().size());
        return CompilationResult.builder()
                .success(success)
                .module(module)
                .semanticModel(model)
                .diagnostics(diagnostics.getDiagnostics())
                .proverResults(verdicts != null ? verdicts : List.of());
    }

    private CompilationResult internalError(Throwable e, DiagnosticBag diagnostics) {
        if (e instanceof StackOverflowError) {
            // the trace is thousands of identical frames
            log.error("Internal compiler error: input nested too deeply");
        } else {
            log.error("Internal compiler error", e);
        }
        diagnostics.report(DiagnosticCode.INTERNAL_ERROR, Span.EMPTY,
                "Internal compiler error: " + e.getClass().getSimpleName()
                        + (e.getMessage() != null ? ": " + e.getMessage() : ""));
        return CompilationResult.builder()
                .success(false)
                .diagnostics(diagnostics.getDiagnostics())
                .build();
    }

    private static Span spanOf(ModuleDeclaration module) {
        return module.getSpan() != null ? module.getSpan() : Span.EMPTY;
    }
}
