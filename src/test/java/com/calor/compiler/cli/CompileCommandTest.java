package com.calor.compiler.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the calor command line.
 */
class CompileCommandTest {

    private static final String VALID = """
        §M{m001:Math}
          §F{f001:Divide:pub}
            §I{i32:a}
            §I{i32:b}
            §O{i32}
            §Q (!= b 0)
            §R (/ a b)
          §/F{f001}
        §/M{m001}
        """;

    private static final String BROKEN = """
        §M{m001:Math}
          §F{f001:Run:pub}
            §R cuont
          §/F{f001}
        §/M{m001}
        """;

    @TempDir
    Path tempDir;

    @Test
    void testCompileWritesGeneratedFile() throws IOException {
        Path source = write("Math.calr", VALID);
        Path out = tempDir.resolve("out");

        int exitCode = run("compile", source.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        Path generated = out.resolve("Math.g.cs");
        assertThat(generated).exists();
        assertThat(Files.readString(generated)).contains("namespace Math").contains("ContractViolationException");
        assertThat(out.resolve(CompileCommand.RUNTIME_FILE)).doesNotExist();
    }

    @Test
    void testCompileOptionsReachTheCompiler() throws IOException {
        Path source = write("Math.calr", VALID);
        Path out = tempDir.resolve("out");

        int exitCode = run("compile", source.toString(), "-o", out.toString(), "--contracts", "off",
                "--namespace", "Acme.Numerics", "--runtime", "--indent", "2");

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        String csharp = Files.readString(out.resolve("Math.g.cs"));
        assertThat(csharp).contains("namespace Acme.Numerics");
        assertThat(csharp).contains("\n  public static class MathModule");
        assertThat(csharp).doesNotContain("ContractViolationException");
        assertThat(out.resolve(CompileCommand.RUNTIME_FILE)).exists();
    }

    @Test
    void testCompileDefaultsToSourceDirectory() throws IOException {
        Path source = write("Math.calr", VALID);

        int exitCode = run("compile", source.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(tempDir.resolve("Math.g.cs")).exists();
    }

    @Test
    void testCompileErrorsExitWithOne() throws IOException {
        Path good = write("Math.calr", VALID);
        Path bad = write("Broken.calr", BROKEN);
        Path out = tempDir.resolve("out");

        int exitCode = run("compile", good.toString(), bad.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.COMPILATION_ERRORS);
        assertThat(out.resolve("Math.g.cs")).exists();
        assertThat(out.resolve("Broken.g.cs")).doesNotExist();
    }

    @Test
    void testMissingFileIsUsageError() {
        int exitCode = run("compile", tempDir.resolve("Nope.calr").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.USAGE);
    }

    @Test
    void testInvalidOptionValuesAreUsageErrors() throws IOException {
        Path source = write("Math.calr", VALID);

        assertThat(run("compile", source.toString(), "--indent", "0")).isEqualTo(ExitCodes.USAGE);
        assertThat(run("compile", source.toString(), "--namespace", "1bad")).isEqualTo(ExitCodes.USAGE);
        assertThat(run("compile", source.toString(), "--prover-timeout-ms", "0")).isEqualTo(ExitCodes.USAGE);
    }

    @Test
    void testNoArgumentsIsUsageError() {
        assertThat(run()).isEqualTo(ExitCodes.USAGE);
        assertThat(run("compile")).isEqualTo(ExitCodes.USAGE);
    }

    @Test
    void testCheckReportsWithoutWriting() throws IOException {
        Path good = write("Math.calr", VALID);
        Path bad = write("Broken.calr", BROKEN);

        assertThat(run("check", good.toString())).isEqualTo(ExitCodes.SUCCESS);
        assertThat(run("check", bad.toString())).isEqualTo(ExitCodes.COMPILATION_ERRORS);
        assertThat(tempDir.resolve("Math.g.cs")).doesNotExist();
    }

    @Test
    void testFormatWriteRewritesFile() throws IOException {
        Path source = write("Math.calr", "§M{m001:Math}\n§F{f001:Zero:pub}\n§O{i32}\n§R 0\n§/F{f001}\n§/M{m001}\n");

        int exitCode = run("format", "--write", source.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(Files.readString(source)).isEqualTo("""
            §M{m001:Math}

              §F{f001:Zero:pub}
                §O{i32}
                §R 0
              §/F{f001}

            §/M{m001}
            """);
    }

    @Test
    void testCompiledNameStripsExtension() {
        assertThat(CompileCommand.baseName(Path.of("dir", "Orders.calr"))).isEqualTo("Orders");
        assertThat(CompileCommand.baseName(Path.of("Makefile"))).isEqualTo("Makefile");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static int run(String... args) {
        return CalorCommand.commandLine().execute(args);
    }
}
