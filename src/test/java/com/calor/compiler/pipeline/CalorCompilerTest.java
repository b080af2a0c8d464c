package com.calor.compiler.pipeline;

import com.calor.compiler.codegen.ContractMode;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.prover.ContractProver;
import com.calor.compiler.prover.ProverResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the CalorCompiler pipeline.
 */
class CalorCompilerTest {

    private static final String DIVIDE = """
        §M{m001:Math}
          §F{f001:Divide:pub}
            §I{i32:a}
            §I{i32:b}
            §O{i32}
            §Q (!= b 0)
            §S (<= result a)
            §R (/ a b)
          §/F{f001}
        §/M{m001}
        """;

    @Test
    void testCleanCompile() {
        CompilationResult result = new CalorCompiler().compile(DIVIDE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.getModule().getName()).isEqualTo("Math");
        assertThat(result.getSemanticModel().getPropositions()).hasSize(2);
        assertThat(result.getCsharp()).contains("public static int Divide(int a, int b)");
        assertThat(result.getRuntimeSupport()).isNull();
        assertThat(result.getProverResults()).isEmpty();
    }

    @Test
    void testParseErrorsBlockEmission() {
        CompilationResult result = new CalorCompiler().compile("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §R
              §/F{f002}
            §/M{m001}
            """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCsharp()).isNull();
        assertThat(result.getDiagnostics()).extracting(d -> d.getCode())
                .containsExactly(DiagnosticCode.ID_MISMATCH, DiagnosticCode.EMISSION_BLOCKED);
        assertThat(result.getErrorCount()).isEqualTo(2);
    }

    @Test
    void testSemanticErrorsBlockEmission() {
        CompilationResult result = new CalorCompiler().compile("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §O{i32}
                §R missing
              §/F{f001}
            §/M{m001}
            """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCsharp()).isNull();
        assertThat(result.getDiagnostics()).extracting(d -> d.getCode())
                .contains(DiagnosticCode.UNDEFINED_REFERENCE, DiagnosticCode.EMISSION_BLOCKED);
    }

    @Test
    void testSourceWithoutModule() {
        CompilationResult result = new CalorCompiler().compile("");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getModule()).isNull();
        assertThat(result.getDiagnostics()).extracting(d -> d.getCode()).containsExactly(DiagnosticCode.UNEXPECTED_TOKEN);
    }

    @Test
    void testInternalFaultBecomesDiagnostic() {
        CompilationResult result = new CalorCompiler().emitCSharp(null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics()).hasSize(1);
        assertThat(result.getDiagnostics().get(0).getCode()).isEqualTo(DiagnosticCode.INTERNAL_ERROR);
        assertThat(result.getDiagnostics().get(0).getMessage()).startsWith("Internal compiler error");
    }

    @Test
    void testDeeplyNestedSourceBecomesDiagnostic() {
        int depth = 200_000;
        String source = "§M{m001:Demo}\n§F{f001:Deep:pub}\n§O{i32}\n§R "
                + "(+ 1 ".repeat(depth) + "1" + ")".repeat(depth)
                + "\n§/F{f001}\n§/M{m001}\n";
        CalorCompiler compiler = new CalorCompiler();

        assertThatCode(() -> compiler.compile(source)).doesNotThrowAnyException();
        CompilationResult result = compiler.compile(source);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiagnostics()).extracting(d -> d.getCode()).contains(DiagnosticCode.INTERNAL_ERROR);
        assertThatCode(() -> compiler.check(source)).doesNotThrowAnyException();
        assertThatCode(() -> compiler.format(source)).doesNotThrowAnyException();
    }

    @Test
    void testEmitCalorFromModule() {
        CalorCompiler compiler = new CalorCompiler();
        CompilationResult compiled = compiler.compile(DIVIDE);

        CompilationResult result = compiler.emitCalor(compiled.getModule());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.getCalor()).isEqualTo(compiler.format(DIVIDE).getCalor());
    }

    @Test
    void testEmitCalorFaultBecomesDiagnostic() {
        CompilationResult result = new CalorCompiler().emitCalor(null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCalor()).isNull();
        assertThat(result.getDiagnostics()).extracting(d -> d.getCode())
                .containsExactly(DiagnosticCode.INTERNAL_ERROR);
    }

    @Test
    void testCheckDoesNotEmit() {
        CompilationResult result = new CalorCompiler().check(DIVIDE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCsharp()).isNull();
        assertThat(result.getSemanticModel()).isNotNull();
    }

    @Test
    void testFormatProducesCanonicalText() {
        CompilationResult result = new CalorCompiler().format("""
            §M{m001:Demo}
            §F{f001:Neg:pub}
            §I{i32:x}
            §O{i32}
            §R (- 0 x)
            §/F{f001}
            §/M{m001}
            """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCalor()).isEqualTo("""
            §M{m001:Demo}

              §F{f001:Neg:pub}
                §I{i32:x}
                §O{i32}
                §R (- 0 x)
              §/F{f001}

            §/M{m001}
            """);
    }

    @Test
    void testFormatRefusesBrokenSource() {
        CompilationResult result = new CalorCompiler().format("§M{m001:Demo}\n§F{f001:Run}\n§/F{f009}\n§/M{m001}\n");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCalor()).isNull();
    }

    @Test
    void testProverVerdictsFollowPropositions() {
        ContractProver prover = (proposition, timeout) -> proposition.getConditionText().contains("result")
                ? ProverResult.UNPROVEN : ProverResult.PROVEN;

        CompilationResult result = new CalorCompiler(CompilerOptions.defaults(), prover).compile(DIVIDE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProverResults()).containsExactly(ProverResult.PROVEN, ProverResult.UNPROVEN);
    }

    @Test
    void testRuntimeSupportOnRequest() {
        CompilerOptions options = CompilerOptions.builder().emitRuntimeSupport(true).build();

        CompilationResult result = new CalorCompiler(options).compile(DIVIDE);

        assertThat(result.getRuntimeSupport()).contains("ContractViolationException");
    }

    @Test
    void testPerCallOptions() {
        CalorCompiler compiler = new CalorCompiler();

        CompilationResult off = compiler.compile(DIVIDE, CompilerOptions.builder().contractMode(ContractMode.OFF).build());
        CompilationResult renamed = compiler.compile(DIVIDE,
                CompilerOptions.defaults().toBuilder().namespaceOverride("Acme").indent("\t").build());

        assertThat(off.getCsharp()).doesNotContain("ContractViolationException");
        assertThat(renamed.getCsharp()).contains("namespace Acme").contains("\tpublic static class MathModule");
    }

    @Test
    void testWarningsAsErrors() {
        String source = """
            §M{m001:Demo}
              §F{f001:Describe:pub}
                §I{i32:n}
                §O{str}
                §R §W{w1} n
                  §K 0 → "zero"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """;

        CompilationResult lenient = new CalorCompiler().compile(source);
        CompilationResult strict = new CalorCompiler(CompilerOptions.builder().treatWarningsAsErrors(true).build())
                .compile(source);

        assertThat(lenient.isSuccess()).isTrue();
        assertThat(lenient.getWarningCount()).isEqualTo(1);
        assertThat(lenient.getCsharp()).isNotNull();

        assertThat(strict.isSuccess()).isFalse();
        assertThat(strict.getCsharp()).isNull();
        assertThat(strict.getDiagnostics()).extracting(d -> d.getCode()).contains(DiagnosticCode.EMISSION_BLOCKED);
    }

    @Test
    void testConcurrentCallsAreIndependent() throws Exception {
        CalorCompiler compiler = new CalorCompiler();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> compiler.compile(DIVIDE).getCsharp()));
            }
            List<String> outputs = Collections.synchronizedList(new ArrayList<>());
            for (Future<String> future : futures) {
                outputs.add(future.get());
            }
            assertThat(outputs).hasSize(8).containsOnly(compiler.compile(DIVIDE).getCsharp());
        } finally {
            executor.shutdownNow();
        }
    }
}
