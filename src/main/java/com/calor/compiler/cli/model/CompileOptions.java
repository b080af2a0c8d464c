package com.calor.compiler.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.calor.compiler.codegen.ContractMode;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution logic, no printing.
 */
@Getter
public class CompileOptions {

    @Parameters(paramLabel = "FILE", arity = "1..*", description = "Calor source files to compile")
    private List<Path> inputs = new ArrayList<>();

    @Option(names = { "--output-dir", "-o" }, description = "Directory for generated C# files (defaults to each source's directory)")
    private Path outputDir;

    @Option(names = { "--contracts" }, defaultValue = "DEBUG", description = "Contract lowering: OFF, DEBUG or RELEASE (default: DEBUG)")
    private ContractMode contractMode;

    @Option(names = { "--namespace" }, description = "C# namespace to use instead of the module name")
    private String namespaceOverride;

    @Option(names = { "--runtime" }, description = "Also write the Calor.Runtime support source")
    private boolean emitRuntimeSupport;

    @Option(names = { "--warnings-as-errors" }, description = "Block emission when any warning is reported")
    private boolean treatWarningsAsErrors;

    @Option(names = { "--indent" }, defaultValue = "4", description = "Spaces per indent level in generated C# (default: 4)")
    private int indent;

    @Option(names = { "--prover-timeout-ms" }, defaultValue = "5000", description = "Deadline per contract proof in milliseconds")
    private long proverTimeoutMs;
}
