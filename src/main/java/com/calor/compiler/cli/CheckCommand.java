package com.calor.compiler.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.cli.exception.OptionsValidationException;
import com.calor.compiler.cli.output.CompileResultsPrinter;
import com.calor.compiler.cli.validation.CompileOptionsValidator;
import com.calor.compiler.pipeline.CalorCompiler;
import com.calor.compiler.pipeline.CompilationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Parses and checks sources without writing anything.
 */
@Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Reports diagnostics for Calor source files without emitting code."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(paramLabel = "FILE", arity = "1..*", description = "Calor source files to check")
    private List<Path> inputs = new ArrayList<>();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        List<Path> sources;
        try {
            sources = validator.validateInputs(inputs);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return ExitCodes.USAGE;
        }

        CalorCompiler compiler = new CalorCompiler();
        int failed = 0;
        for (Path source : sources) {
            CompilationResult result;
            try {
                result = compiler.check(Files.readString(source, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.error("Cannot read {}: {}", source, e.getMessage());
                return ExitCodes.USAGE;
            }
            printer.printDiagnostics(source, result);
            if (!result.isSuccess()) {
                failed++;
            }
        }
        printer.printSummary("CHECK", sources.size(), failed);
        return failed == 0 ? ExitCodes.SUCCESS : ExitCodes.COMPILATION_ERRORS;
    }
}
