package com.calor.compiler.codegen.csharp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.codegen.EmitContext;
import com.calor.compiler.codegen.template.CompilationUnitRenderer;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.decl.ModuleDeclaration;

/**
 * Forward emitter: lowers a checked module to one C# compilation unit.
 *
 * Emission refuses to start while the context's diagnostics hold errors, and withholds its
 * output when it reports an error of its own.
 */
public class CSharpEmitter {
    private static final Logger log = LoggerFactory.getLogger(CSharpEmitter.class);

    private final CompilationUnitRenderer renderer;

    public CSharpEmitter() {
        this(new CompilationUnitRenderer());
    }

    public CSharpEmitter(CompilationUnitRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @return the C# source, or {@code null} when emission was blocked or failed
     */
    public String emit(ModuleDeclaration module, EmitContext context) {
        DiagnosticBag diagnostics = context.getDiagnostics();
        Span span = module.getSpan() != null ? module.getSpan() : Span.EMPTY;
        if (diagnostics.hasErrors()) {
            int errors = diagnostics.getErrors().size();
            diagnostics.report(DiagnosticCode.EMISSION_BLOCKED, span,
                    "C# emission blocked by " + errors + " unresolved error" + (errors == 1 ? "" : "s"));
            log.debug("Emission of module {} blocked by {} error(s)", module.getName(), errors);
            return null;
        }

        ModuleEmitter emitter = new ModuleEmitter(module, context);
        String body = emitter.emitBody();
        if (emitter.isFailed()) {
            log.debug("Emission of module {} failed on unsupported constructs", module.getName());
            return null;
        }

        String namespace = ModuleEmitter.namespace(module, context);
        log.debug("Emitted C# for module {} into namespace {}", module.getName(), namespace);
        return renderer.renderCompilationUnit(namespace, emitter.getUsings().getUsings(), body);
    }

    /**
     * Source of the {@code Calor.Runtime} support types referenced by emitted code.
     */
    public String emitRuntimeSupport() {
        return renderer.renderContractRuntime();
    }
}
