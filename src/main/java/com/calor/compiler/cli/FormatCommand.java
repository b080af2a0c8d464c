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
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Rewrites sources in canonical Calor form.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Re-emits Calor source files in canonical form."
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Parameters(paramLabel = "FILE", arity = "1..*", description = "Calor source files to format")
    private List<Path> inputs = new ArrayList<>();

    @Option(names = { "--write", "-w" }, description = "Overwrite each file instead of printing to standard output")
    private boolean write;

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
        try {
            for (Path source : sources) {
                CompilationResult result = compiler.format(Files.readString(source, StandardCharsets.UTF_8));
                printer.printDiagnostics(source, result);
                if (result.getCalor() == null) {
                    failed++;
                    continue;
                }
                if (write) {
                    Files.writeString(source, result.getCalor(), StandardCharsets.UTF_8);
                    printer.printWritten(source);
                } else {
                    System.out.print(result.getCalor());
                }
            }
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage());
            return ExitCodes.USAGE;
        }
        return failed == 0 ? ExitCodes.SUCCESS : ExitCodes.COMPILATION_ERRORS;
    }
}
