package com.calor.compiler.semantic;

import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.Severity;
import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.parser.CalorParser;
import com.calor.compiler.prover.ContractProposition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SemanticChecker.
 */
class SemanticCheckerTest {

    @Test
    void testCleanModuleHasNoDiagnostics() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Math}
              §F{f001:Divide:pub}
                §I{i32:a}
                §I{i32:b}
                §O{i32}
                §Q (!= b 0)
                §R (/ a b)
              §/F{f001}
            §/M{m001}
            """);

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void testUndefinedReferenceSuggestsSimilarName() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Next:pub}
                §O{i32}
                §B{count} 1
                §R (+ cuont 1)
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> undefined = diagnostics.withCode(DiagnosticCode.UNDEFINED_REFERENCE);
        assertThat(undefined).hasSize(1);
        assertThat(undefined.get(0).getMessage()).contains("cuont");
        assertThat(undefined.get(0).getSuggestion()).isEqualTo("Did you mean 'count'?");
        assertThat(undefined.get(0).getLine()).isEqualTo(5);
    }

    @Test
    void testCapitalisedNamesAreExternal() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Now:pub}
                §B{t} DateTime.Now
                §P Console
              §/F{f001}
            §/M{m001}
            """);

        assertThat(diagnostics.withCode(DiagnosticCode.UNDEFINED_REFERENCE)).isEmpty();
    }

    @Test
    void testTypeMismatchOnBindingAndReturn() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §O{i32}
                §B{x:i32} "hello"
                §R "text"
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> mismatches = diagnostics.withCode(DiagnosticCode.TYPE_MISMATCH);
        assertThat(mismatches).hasSize(2);
        assertThat(mismatches).extracting(Diagnostic::getLine).containsExactly(4, 5);
    }

    @Test
    void testResultInPreconditionIsAScopeViolation() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Abs:pub}
                §I{i32:x}
                §O{i32}
                §Q (>= result 0)
                §S (>= result 0)
                §R x
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> violations = diagnostics.withCode(DiagnosticCode.CONTRACT_SCOPE_VIOLATION);
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getLine()).isEqualTo(5);
        assertThat(diagnostics.withCode(DiagnosticCode.UNDEFINED_REFERENCE)).isEmpty();
    }

    @Test
    void testMatchWithoutCatchAllWarns() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Describe:pub}
                §I{i32:n}
                §O{str}
                §R §W{w1} n
                  §K 0 → "zero"
                  §K 1 → "one"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> warnings = diagnostics.withCode(DiagnosticCode.NON_EXHAUSTIVE_MATCH);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testCaseAfterWildcardIsUnreachable() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Describe:pub}
                §I{i32:n}
                §O{str}
                §R §W{w1} n
                  §K _ → "any"
                  §K 0 → "zero"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> unreachable = diagnostics.withCode(DiagnosticCode.UNREACHABLE_PATTERN);
        assertThat(unreachable).hasSize(1);
        assertThat(unreachable.get(0).getLine()).isEqualTo(7);
        assertThat(diagnostics.withCode(DiagnosticCode.NON_EXHAUSTIVE_MATCH)).isEmpty();
    }

    @Test
    void testListPatternOnScalarIsTypeMismatch() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Inspect:pub}
                §I{i32:n}
                §W{w1} n
                  §K §PLIST 1 §REST{tail} → §P tail
                  §K _ → §P "other"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> mismatches = diagnostics.withCode(DiagnosticCode.TYPE_MISMATCH);
        assertThat(mismatches).hasSize(1);
        assertThat(mismatches.get(0).getMessage()).contains("List pattern").contains("i32");
        assertThat(mismatches.get(0).getLine()).isEqualTo(5);
    }

    @Test
    void testListPatternOnListIsAccepted() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Inspect:pub}
                §I{List<i32>:xs}
                §W{w1} xs
                  §K §PLIST 1 §REST{tail} → §P tail
                  §K _ → §P "other"
                §/W{w1}
              §/F{f001}
            §/M{m001}
            """);

        assertThat(diagnostics.withCode(DiagnosticCode.TYPE_MISMATCH)).isEmpty();
    }

    @Test
    void testDuplicateIdIsReported() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:First:pub}
              §/F{f001}
              §F{f001:Second:pub}
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> duplicates = diagnostics.withCode(DiagnosticCode.DUPLICATE_ID);
        assertThat(duplicates).hasSize(1);
        assertThat(duplicates.get(0).getMessage()).contains("'f001'").contains("line 2");
        assertThat(duplicates.get(0).getLine()).isEqualTo(4);
    }

    @Test
    void testRedeclaredLocal() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §I{i32:x}
                §B{x} 2
              §/F{f001}
            §/M{m001}
            """);

        assertThat(diagnostics.withCode(DiagnosticCode.REDECLARATION)).hasSize(1);
    }

    @Test
    void testUnknownEffectWarns() {
        DiagnosticBag diagnostics = check("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §E{cw,nett}
              §/F{f001}
            §/M{m001}
            """);

        List<Diagnostic> unknown = diagnostics.withCode(DiagnosticCode.UNKNOWN_EFFECT);
        assertThat(unknown).hasSize(1);
        assertThat(unknown.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(unknown.get(0).getSuggestion()).isEqualTo("Did you mean 'net'?");
    }

    @Test
    void testContractPropositionsAreExported() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse("""
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
            """, diagnostics);

        SemanticModel model = new SemanticChecker(diagnostics).check(module);

        List<ContractProposition> propositions = model.getPropositions();
        assertThat(propositions).hasSize(2);

        ContractProposition requires = propositions.get(0);
        assertThat(requires.getFunctionId()).isEqualTo("f001");
        assertThat(requires.getFunctionName()).isEqualTo("Divide");
        assertThat(requires.getKind()).isEqualTo(ContractKind.REQUIRES);
        assertThat(requires.getConditionText()).isEqualTo("(!= b 0)");
        assertThat(requires.getParameterTypes()).containsExactly(entry("a", "i32"), entry("b", "i32"));

        ContractProposition ensures = propositions.get(1);
        assertThat(ensures.getKind()).isEqualTo(ContractKind.ENSURES);
        assertThat(ensures.getParameterTypes()).containsKey("result");
    }

    @Test
    void testExpressionTypesAreRecorded() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse("""
            §M{m001:Demo}
              §F{f001:Half:pub}
                §I{f64:x}
                §O{f64}
                §R (/ x 2)
              §/F{f001}
            §/M{m001}
            """, diagnostics);

        SemanticModel model = new SemanticChecker(diagnostics).check(module);

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(model.size()).isGreaterThan(0);
    }

    private DiagnosticBag check(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);
        assertThat(diagnostics.getDiagnostics()).as("parse diagnostics").isEmpty();
        new SemanticChecker(diagnostics).check(module);
        return diagnostics;
    }
}
