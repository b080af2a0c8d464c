package com.calor.compiler.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.cli.exception.OptionsValidationException;
import com.calor.compiler.cli.model.CompileOptions;
import com.calor.compiler.cli.model.ValidatedCompileOptions;
import com.calor.compiler.cli.output.CompileResultsPrinter;
import com.calor.compiler.cli.validation.CompileOptionsValidator;
import com.calor.compiler.pipeline.CalorCompiler;
import com.calor.compiler.pipeline.CompilationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Compiles Calor sources to C#, one {@code .g.cs} file per source.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles Calor source files to C#."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final String RUNTIME_FILE = "Calor.Runtime.g.cs";

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return ExitCodes.USAGE;
        }

        printer.printBanner(options, validated);
        CalorCompiler compiler = new CalorCompiler(validated.getCompilerOptions());
        int failed = 0;
        String runtime = null;
        Path runtimeDir = null;
        try {
            for (Path source : validated.getInputs()) {
                String text = Files.readString(source, StandardCharsets.UTF_8);
                CompilationResult result = compiler.compile(text);
                printer.printDiagnostics(source, result);
                if (!result.isSuccess() || result.getCsharp() == null) {
                    failed++;
                    continue;
                }
                Path outputDir = validated.getOutputDir() != null ? validated.getOutputDir() : source.getParent();
                Files.createDirectories(outputDir);
                Path output = outputDir.resolve(baseName(source) + ".g.cs");
                Files.writeString(output, result.getCsharp(), StandardCharsets.UTF_8);
                printer.printWritten(output);
                if (result.getRuntimeSupport() != null) {
                    runtime = result.getRuntimeSupport();
                    runtimeDir = outputDir;
                }
            }
            if (runtime != null) {
                Path output = runtimeDir.resolve(RUNTIME_FILE);
                Files.writeString(output, runtime, StandardCharsets.UTF_8);
                printer.printWritten(output);
            }
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage());
            return ExitCodes.USAGE;
        }

        printer.printSummary("COMPILATION", validated.getInputs().size(), failed);
        return failed == 0 ? ExitCodes.SUCCESS : ExitCodes.COMPILATION_ERRORS;
    }

    static String baseName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
