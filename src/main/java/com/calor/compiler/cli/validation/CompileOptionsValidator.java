package com.calor.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.calor.compiler.cli.exception.OptionsValidationException;
import com.calor.compiler.cli.model.CompileOptions;
import com.calor.compiler.cli.model.ValidatedCompileOptions;
import com.calor.compiler.pipeline.CompilerOptions;

public class CompileOptionsValidator {

    public ValidatedCompileOptions validate(CompileOptions o) {
        List<String> errors = new ArrayList<>();

        List<Path> inputs = normalizeInputs(o.getInputs(), errors);

        if (o.getIndent() < 1 || o.getIndent() > 8) {
            errors.add("Indent must be in range 1-8. Got: " + o.getIndent());
        }
        if (o.getProverTimeoutMs() <= 0) {
            errors.add("Prover timeout must be > 0. Got: " + o.getProverTimeoutMs());
        }
        if (o.getNamespaceOverride() != null && !o.getNamespaceOverride().matches("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*")) {
            errors.add("Namespace is not a valid C# namespace: " + o.getNamespaceOverride());
        }

        Path outputDir = null;
        if (o.getOutputDir() != null) {
            outputDir = o.getOutputDir().toAbsolutePath().normalize();
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                errors.add("Output path exists and is not a directory: " + outputDir);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        CompilerOptions compilerOptions = CompilerOptions.builder()
                .contractMode(o.getContractMode())
                .namespaceOverride(o.getNamespaceOverride())
                .emitRuntimeSupport(o.isEmitRuntimeSupport())
                .treatWarningsAsErrors(o.isTreatWarningsAsErrors())
                .indent(" ".repeat(o.getIndent()))
                .proverTimeout(Duration.ofMillis(o.getProverTimeoutMs()))
                .build();
        return new ValidatedCompileOptions(inputs, outputDir, compilerOptions);
    }

    /**
     * Source files for commands that take nothing else.
     */
    public List<Path> validateInputs(List<Path> rawInputs) {
        List<String> errors = new ArrayList<>();
        List<Path> inputs = normalizeInputs(rawInputs, errors);
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return inputs;
    }

    private static List<Path> normalizeInputs(List<Path> rawInputs, List<String> errors) {
        List<Path> inputs = new ArrayList<>();
        if (rawInputs == null || rawInputs.isEmpty()) {
            errors.add("At least one source file is required.");
            return inputs;
        }
        for (Path input : rawInputs) {
            Path normalized = input.toAbsolutePath().normalize();
            if (!Files.isRegularFile(normalized)) {
                errors.add("Source file does not exist or is not a file: " + input);
            } else {
                inputs.add(normalized);
            }
        }
        return inputs;
    }
}
