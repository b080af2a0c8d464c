package com.calor.compiler.codegen.csharp;

import com.calor.compiler.codegen.ContractMode;
import com.calor.compiler.codegen.EmitContext;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.parser.CalorParser;
import com.calor.compiler.semantic.SemanticChecker;
import com.calor.compiler.semantic.SemanticModel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CSharpEmitter.
 */
class CSharpEmitterTest {

    private static final String DIVIDE = """
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

    @Test
    void testCompilationUnitEnvelope() {
        String csharp = emit(DIVIDE, ContractMode.DEBUG);

        assertThat(csharp).startsWith("// <auto-generated>");
        assertThat(csharp).contains("using System;");
        assertThat(csharp).contains("namespace Math\n{");
        assertThat(csharp).contains("public static class MathModule");
        assertThat(csharp).contains("public static int Divide(int a, int b)");
        assertThat(csharp.trim()).endsWith("}");
    }

    @Test
    void testCheckedArithmetic() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Add:pub}
                §I{i32:a}
                §I{i32:b}
                §O{i32}
                §R (+ a b)
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return checked(a + b);");
    }

    @Test
    void testFloatingPointArithmeticIsNotChecked() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Half:pub}
                §I{f64:x}
                §O{f64}
                §R (/ x 2.0)
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return x / 2.0;");
        assertThat(csharp).doesNotContain("checked(");
    }

    @Test
    void testUncheckedBlockSuppressesOverflowCheck() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Hash:pub}
                §I{i32:a}
                §I{i32:b}
                §O{i32}
                §R (unchecked (* a b))
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return unchecked(a * b);");
        assertThat(csharp).doesNotContain(" checked(");
    }

    @Test
    void testIntegerLoopCounterStepsChecked() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Sum:pub}
                §I{i32:n}
                §O{i32}
                §B{~total:i32} 0
                §L{l1:i:1:n}
                  §ASSIGN total (+ total i)
                §/L{l1}
                §L{l2:k:n:0:-1}
                  §ASSIGN total (- total k)
                §/L{l2}
                §L{l3:j:0:n:3}
                  §ASSIGN total (+ total j)
                §/L{l3}
                §R total
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("for (var i = 1; i <= n; i = checked(i + 1))");
        assertThat(csharp).contains("for (var k = n; k >= 0; k = checked(k - 1))");
        assertThat(csharp).contains("for (var j = 0; j <= n; j = checked(j + 3))");
        assertThat(csharp).doesNotContain("i++").doesNotContain("k--").doesNotContain("j += ");
    }

    @Test
    void testFloatingLoopCounterStepsPlain() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Ticks:pub}
                §L{l1:x:0.0:1.0:0.5}
                  §P x
                §/L{l1}
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("for (var x = 0.0; x <= 1.0; x += 0.5)");
    }

    @Test
    void testPreconditionGuardPrecedesBody() {
        String csharp = emit(DIVIDE, ContractMode.DEBUG);

        String guard = "if (!((b != 0))) throw new Calor.Runtime.ContractViolationException("
                + "\"(!= b 0)\", \"f001\", \"Requires\", null);";
        assertThat(csharp).contains(guard);
        assertThat(csharp.indexOf(guard)).isLessThan(csharp.indexOf("return checked(a / b);"));
    }

    @Test
    void testPreconditionMessageIsPassedThrough() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Root:pub}
                §I{f64:x}
                §O{f64}
                §Q{"x must not be negative"} (>= x 0.0)
                §R x
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("\"(>= x 0.0)\", \"f001\", \"Requires\", \"x must not be negative\");");
    }

    @Test
    void testReleaseModeDropsConditionText() {
        String csharp = emit(DIVIDE, ContractMode.RELEASE);

        assertThat(csharp).contains("if (!((b != 0))) throw new Calor.Runtime.ContractViolationException("
                + "null, \"f001\", \"Requires\", null);");
    }

    @Test
    void testOffModeEmitsNoGuards() {
        String csharp = emit(DIVIDE, ContractMode.OFF);

        assertThat(csharp).doesNotContain("ContractViolationException");
        assertThat(csharp).contains("return checked(a / b);");
    }

    @Test
    void testPostconditionChecksStoredResult() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Add:pub}
                §I{i32:a}
                §I{i32:b}
                §O{i32}
                §S (>= result a)
                §R (+ a b)
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        String store = "var __result_1 = checked(a + b);";
        String guard = "if (!((__result_1 >= a))) throw new Calor.Runtime.ContractViolationException("
                + "\"(>= result a)\", \"f001\", \"Ensures\", null);";
        String ret = "return __result_1;";
        assertThat(csharp).contains(store, guard, ret);
        assertThat(csharp.indexOf(store)).isLessThan(csharp.indexOf(guard));
        assertThat(csharp.indexOf(guard)).isLessThan(csharp.indexOf(ret));
    }

    @Test
    void testFunctionsKeepSourceOrder() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:F:pub}
              §/F{f001}
              §F{f002:G:pub}
                §C{F} §/C
              §/F{f002}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp.indexOf("public static void F()")).isLessThan(csharp.indexOf("public static void G()"));
        assertThat(csharp).contains("F();");
    }

    private static final String CALLEES = """
          §F{f001:F:pub}
            §O{i32}
            §R 1
          §/F{f001}
          §F{f002:G:pub}
            §O{i32}
            §R 2
          §/F{f002}
          §F{f003:H:pub}
            §O{i32}
            §R 3
          §/F{f003}
        """;

    @Test
    void testOperandCallsKeepLeftToRightOrder() {
        String csharp = emit("§M{m001:Demo}\n" + CALLEES + """
              §F{f004:Sum:pub}
                §O{i32}
                §R (+ §C{F} §/C §C{G} §/C)
              §/F{f004}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return checked(F() + G());");
        String sum = csharp.substring(csharp.indexOf("public static int Sum()"));
        assertThat(sum.indexOf("F()")).isLessThan(sum.indexOf("G()"));
    }

    @Test
    void testThreeOperandCallsKeepLeftToRightOrder() {
        String csharp = emit("§M{m001:Demo}\n" + CALLEES + """
              §F{f004:Sum:pub}
                §O{i32}
                §R (+ §C{F} §/C §C{G} §/C §C{H} §/C)
              §/F{f004}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return checked((F() + G()) + H());");
        String sum = csharp.substring(csharp.indexOf("public static int Sum()"));
        assertThat(sum.indexOf("F()")).isLessThan(sum.indexOf("G()"));
        assertThat(sum.indexOf("G()")).isLessThan(sum.indexOf("H()"));
    }

    @Test
    void testValuedMatchBecomesSwitchExpression() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Describe:pub}
                §I{i32:n}
                §O{str}
                §R §W{w1} n
                  §K 0 → "zero"
                  §K _ → "many"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return n switch");
        assertThat(csharp).contains("0 => \"zero\",");
        assertThat(csharp).contains("_ => \"many\",");
        assertThat(csharp).contains("};");
    }

    @Test
    void testComparisonModeMapsToStringComparison() {
        String csharp = emit("""
            §M{m001:Demo}
              §F{f001:Has:pub}
                §I{str:s}
                §O{bool}
                §R (contains s "x" :ignore-case)
              §/F{f001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("return s.Contains(\"x\", StringComparison.OrdinalIgnoreCase);");
    }

    @Test
    void testClassInvariantsAreCheckedAfterPublicMembers() {
        String csharp = emit("""
            §M{m001:Counters}
              §CL{c001:Counter}
                §IV (>= count 0)
                §FLD{i32:count:pri}
                §CTOR{k001}
                  §ASSIGN count 0
                §/CTOR{k001}
                §MT{m002:Increment:pub}
                  §ASSIGN count (+ count 1)
                §/MT{m002}
              §/CL{c001}
            §/M{m001}
            """, ContractMode.DEBUG);

        assertThat(csharp).contains("public class Counter");
        assertThat(csharp).contains("private int count;");
        assertThat(csharp).contains("public Counter()");
        assertThat(csharp).contains("public void Increment()");
        assertThat(csharp).contains("private void __CheckInvariants()");
        assertThat(csharp).contains("if (!((count >= 0))) throw new Calor.Runtime.ContractViolationException("
                + "\"(>= count 0)\", \"c001\", \"Invariant\", null);");
        assertThat(csharp.split("__CheckInvariants\\(\\);", -1)).hasSize(3);
        assertThat(csharp).doesNotContain("CountersModule");
    }

    @Test
    void testNamespaceOverride() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(DIVIDE, diagnostics);
        SemanticModel model = new SemanticChecker(diagnostics).check(module);

        EmitContext context = EmitContext.builder()
                .model(model)
                .diagnostics(diagnostics)
                .namespaceOverride("Acme.Numerics")
                .build();
        String csharp = new CSharpEmitter().emit(module, context);

        assertThat(csharp).contains("namespace Acme.Numerics");
        assertThat(csharp).contains("public static class MathModule");
    }

    @Test
    void testEmissionBlockedByEarlierErrors() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(DIVIDE, diagnostics);
        diagnostics.report(DiagnosticCode.TYPE_MISMATCH, Span.of(0, 1, 1, 1), "forced");

        EmitContext context = EmitContext.builder().diagnostics(diagnostics).build();
        String csharp = new CSharpEmitter().emit(module, context);

        assertThat(csharp).isNull();
        assertThat(diagnostics.withCode(DiagnosticCode.EMISSION_BLOCKED)).hasSize(1);
        assertThat(diagnostics.withCode(DiagnosticCode.EMISSION_BLOCKED).get(0).getMessage())
                .isEqualTo("C# emission blocked by 1 unresolved error");
    }

    @Test
    void testEmissionIsDeterministic() {
        assertThat(emit(DIVIDE, ContractMode.DEBUG)).isEqualTo(emit(DIVIDE, ContractMode.DEBUG));
    }

    @Test
    void testRuntimeSupportDeclaresContractViolationException() {
        String runtime = new CSharpEmitter().emitRuntimeSupport();

        assertThat(runtime).contains("namespace Calor.Runtime");
        assertThat(runtime).contains("ContractViolationException");
    }

    private String emit(String source, ContractMode mode) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);
        SemanticModel model = new SemanticChecker(diagnostics).check(module);
        assertThat(diagnostics.hasErrors()).as("front-end errors: %s", diagnostics.getErrors()).isFalse();

        EmitContext context = EmitContext.builder()
                .model(model)
                .diagnostics(diagnostics)
                .contractMode(mode)
                .build();
        String csharp = new CSharpEmitter().emit(module, context);
        assertThat(csharp).isNotNull();
        return csharp;
    }
}
