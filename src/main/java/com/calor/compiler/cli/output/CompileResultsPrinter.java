package com.calor.compiler.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.cli.model.CompileOptions;
import com.calor.compiler.cli.model.ValidatedCompileOptions;
import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.DiagnosticFormatter;
import com.calor.compiler.pipeline.CompilationResult;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(CompileOptions o, ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("Calor Compiler");
        log.info("=================================================");
        log.info("Sources: {}", v.getInputs().size());
        log.info("Contracts: {}", o.getContractMode());
        log.info("Namespace: {}", o.getNamespaceOverride() != null ? o.getNamespaceOverride() : "(module name)");
        log.info("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : "(next to each source)");
        log.info("Runtime Support: {}", o.isEmitRuntimeSupport());
        log.info("=================================================");
    }

    /**
     * One line per diagnostic, errors at ERROR and everything else at WARN.
     */
    public void printDiagnostics(Path source, CompilationResult result) {
        String fileName = source.getFileName().toString();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            String line = DiagnosticFormatter.format(diagnostic, fileName);
            if (diagnostic.isError()) {
                log.error(line);
            } else {
                log.warn(line);
            }
        }
    }

    public void printWritten(Path output) {
        log.info("Wrote {}", output);
    }

    public void printSummary(String action, int files, int failed) {
        log.info("=================================================");
        if (failed == 0) {
            log.info("{} SUCCESSFUL: {} file(s)", action, files);
        } else {
            log.error("{} FAILED: {} of {} file(s) had errors", action, failed, files);
        }
        log.info("=================================================");
    }
}
