package com.calor.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.calor.compiler.pipeline.CompilerOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the compile command. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    List<Path> inputs;
    /** Null when each output goes next to its source. */
    Path outputDir;
    CompilerOptions compilerOptions;
}
