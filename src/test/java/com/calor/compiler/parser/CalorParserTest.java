package com.calor.compiler.parser;

import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.TextEdit;
import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.decl.ClassDeclaration;
import com.calor.compiler.model.decl.FunctionDeclaration;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.model.decl.UnionTypeDeclaration;
import com.calor.compiler.model.expr.BinaryExpression;
import com.calor.compiler.model.expr.BinaryOperator;
import com.calor.compiler.model.expr.CallExpression;
import com.calor.compiler.model.expr.ComparisonMode;
import com.calor.compiler.model.expr.MatchExpression;
import com.calor.compiler.model.expr.StringOpExpression;
import com.calor.compiler.model.pattern.PatternKind;
import com.calor.compiler.model.stmt.BindStatement;
import com.calor.compiler.model.stmt.ForStatement;
import com.calor.compiler.model.stmt.IfStatement;
import com.calor.compiler.model.stmt.ReturnStatement;
import com.calor.compiler.model.stmt.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CalorParser.
 */
class CalorParserTest {

    @Test
    void testParseFunctionSignature() {
        String source = """
            §M{m001:Math}
              §F{f001:Add:pub}
                §I{i32:a}
                §I{i32:b}
                §O{i32}
                §E{cw}
                §Q{"a must be positive"} (> a 0)
                §S (>= result a)
                §R (+ a b)
              §/F{f001}
            §/M{m001}
            """;

        ModuleDeclaration module = parseClean(source);

        assertThat(module.getId()).isEqualTo("m001");
        assertThat(module.getName()).isEqualTo("Math");
        assertThat(module.getMembers()).hasSize(1);

        FunctionDeclaration function = (FunctionDeclaration) module.getMembers().get(0);
        assertThat(function.getName()).isEqualTo("Add");
        assertThat(function.getVisibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(function.getParameters()).extracting("name").containsExactly("a", "b");
        assertThat(function.getReturnType()).isEqualTo("i32");
        assertThat(function.getEffects().getCodes()).containsExactly("cw");
        assertThat(function.getPreconditions()).hasSize(1);
        assertThat(function.getPreconditions().get(0).getKind()).isEqualTo(ContractKind.REQUIRES);
        assertThat(function.getPreconditions().get(0).getMessage()).isEqualTo("a must be positive");
        assertThat(function.getPostconditions()).hasSize(1);

        ReturnStatement ret = (ReturnStatement) function.getBody().get(0);
        BinaryExpression sum = (BinaryExpression) ret.getValue();
        assertThat(sum.getOperator()).isEqualTo(BinaryOperator.ADD);
    }

    @Test
    void testVisibilityDefaultsToPrivate() {
        ModuleDeclaration module = parseClean("""
            §M{m001:Demo}
              §F{f001:Helper}
              §/F{f001}
            §/M{m001}
            """);

        FunctionDeclaration function = (FunctionDeclaration) module.getMembers().get(0);
        assertThat(function.getVisibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(function.getReturnType()).isNull();
        assertThat(function.getBody()).isEmpty();
    }

    @Test
    void testIdMismatchReportsOneDiagnosticWithFix() {
        String source = """
            §M{m001:Demo}
              §F{f001:Run:pub}
                §R
              §/F{f002}
            §/M{m001}
            """;

        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);

        assertThat(module).isNotNull();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);

        Diagnostic diagnostic = diagnostics.getDiagnostics().get(0);
        assertThat(diagnostic.getCode()).isEqualTo(DiagnosticCode.ID_MISMATCH);
        assertThat(diagnostic.getMessage()).contains("f002").contains("f001");
        assertThat(diagnostic.getLine()).isEqualTo(4);
        assertThat(diagnostic.getFix()).isNotNull();

        List<TextEdit> edits = diagnostic.getFix().getEdits();
        assertThat(edits).hasSize(1);
        assertThat(edits.get(0).getNewText()).isEqualTo("f001");
        assertThat(edits.get(0).getStartLine()).isEqualTo(4);
        assertThat(edits.get(0).getEndColumn() - edits.get(0).getStartColumn()).isEqualTo(4);
    }

    @Test
    void testRecoveryReportsEveryError() {
        String source = """
            §M{m001:Demo}
              §F{f001:First:pub}
                §B{x} (frob 1 2)
                §R
              §/F{f001}
              §F{f002:Second:pub}
                §B{y} (contians "abc" "b")
                §R
              §/F{f002}
            §/M{m001}
            """;

        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);

        assertThat(module).isNotNull();
        assertThat(module.getMembers()).hasSize(2);
        assertThat(diagnostics.getErrors()).hasSize(2);
        assertThat(diagnostics.getErrors().get(0).getMessage()).contains("frob");
        assertThat(diagnostics.getErrors().get(1).getSuggestion()).isEqualTo("Did you mean 'contains'?");
    }

    @Test
    void testMissingModuleReturnsNull() {
        DiagnosticBag diagnostics = new DiagnosticBag();

        ModuleDeclaration module = CalorParser.parse("§B{x} 1", diagnostics);

        assertThat(module).isNull();
        assertThat(diagnostics.withCode(DiagnosticCode.UNEXPECTED_TOKEN)).hasSize(1);
    }

    @Test
    void testArrowAndBlockIfForms() {
        String source = """
            §M{m001:Demo}
              §F{f001:Sign:pub}
                §I{i32:x}
                §O{i32}
                §IF{if1} (> x 0) → §R 1
                §EI (< x 0) → §R -1
                §EL → §R 0
                §/I{if1}
              §/F{f001}
              §F{f002:Log:pub}
                §I{i32:x}
                §IF{if2} (> x 0)
                  §P "positive"
                  §P x
                §/I{if2}
              §/F{f002}
            §/M{m001}
            """;

        ModuleDeclaration module = parseClean(source);

        IfStatement arrow = (IfStatement) ((FunctionDeclaration) module.getMembers().get(0)).getBody().get(0);
        assertThat(arrow.getForm()).isEqualTo(BodyForm.ARROW);
        assertThat(arrow.getThenBody()).hasSize(1);
        assertThat(arrow.getElseIfs()).hasSize(1);
        assertThat(arrow.getElseBody()).hasSize(1);
        assertThat(arrow.getElseForm()).isEqualTo(BodyForm.ARROW);

        IfStatement block = (IfStatement) ((FunctionDeclaration) module.getMembers().get(1)).getBody().get(0);
        assertThat(block.getForm()).isEqualTo(BodyForm.BLOCK);
        assertThat(block.getThenBody()).hasSize(2);
        assertThat(block.getElseBody()).isNull();
    }

    @Test
    void testForLoopBoundsAndStep() {
        ModuleDeclaration module = parseClean("""
            §M{m001:Demo}
              §F{f001:Count:pub}
                §L{l1:i:10:1:-1}
                  §P i
                §/L{l1}
              §/F{f001}
            §/M{m001}
            """);

        ForStatement loop = (ForStatement) ((FunctionDeclaration) module.getMembers().get(0)).getBody().get(0);
        assertThat(loop.getVariable()).isEqualTo("i");
        assertThat(loop.getStep()).isNotNull();
        assertThat(loop.getBody()).hasSize(1);
    }

    @Test
    void testMatchAsReturnValue() {
        ModuleDeclaration module = parseClean("""
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
            """);

        ReturnStatement ret = (ReturnStatement) ((FunctionDeclaration) module.getMembers().get(0)).getBody().get(0);
        assertThat(ret.getValue()).isInstanceOf(MatchExpression.class);

        MatchExpression match = (MatchExpression) ret.getValue();
        assertThat(match.getId()).isEqualTo("w1");
        assertThat(match.getCases()).hasSize(2);
        assertThat(match.getCases().get(0).getBody().get(0).kind()).isEqualTo(StatementKind.RETURN);
        assertThat(match.getCases().get(1).getPattern().kind()).isEqualTo(PatternKind.WILDCARD);
    }

    @Test
    void testStringOpWithComparisonMode() {
        ModuleDeclaration module = parseClean("""
            §M{m001:Demo}
              §F{f001:Has:pub}
                §I{str:s}
                §O{bool}
                §R (contains s "x" :ignore-case)
              §/F{f001}
            §/M{m001}
            """);

        ReturnStatement ret = (ReturnStatement) ((FunctionDeclaration) module.getMembers().get(0)).getBody().get(0);
        StringOpExpression op = (StringOpExpression) ret.getValue();
        assertThat(op.getArguments()).hasSize(2);
        assertThat(op.getComparisonMode()).isEqualTo(ComparisonMode.IGNORE_CASE);
    }

    @Test
    void testInvalidComparisonModeSuggestsKeyword() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        CalorParser.parse("""
            §M{m001:Demo}
              §F{f001:Has:pub}
                §I{str:s}
                §O{bool}
                §R (contains s "x" :ignore-cas)
              §/F{f001}
            §/M{m001}
            """, diagnostics);

        List<Diagnostic> invalid = diagnostics.withCode(DiagnosticCode.INVALID_COMPARISON_MODE);
        assertThat(invalid).hasSize(1);
        assertThat(invalid.get(0).getSuggestion()).isEqualTo("Did you mean ':ignore-case'?");
    }

    @Test
    void testCallWithArgumentsAndFallibleMarker() {
        ModuleDeclaration module = parseClean("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §B{n} §C{Parse!} §A "42" §A 10 §/C
              §/F{f001}
            §/M{m001}
            """);

        BindStatement bind = (BindStatement) ((FunctionDeclaration) module.getMembers().get(0)).getBody().get(0);
        CallExpression call = (CallExpression) bind.getValue();
        assertThat(call.getTarget()).isEqualTo("Parse");
        assertThat(call.isFallible()).isTrue();
        assertThat(call.getArguments()).hasSize(2);
    }

    @Test
    void testClassAndUnion() {
        ModuleDeclaration module = parseClean("""
            §M{m001:Shapes}
              §T{t001:Shape}
                §V{Circle}
                  §FL{f64:radius}
                §V{Square}
                  §FL{f64:side}
              §/T{t001}
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
            """);

        UnionTypeDeclaration union = (UnionTypeDeclaration) module.getMembers().get(0);
        assertThat(union.getCases()).extracting("name").containsExactly("Circle", "Square");

        ClassDeclaration counter = (ClassDeclaration) module.getMembers().get(1);
        assertThat(counter.getInvariants()).hasSize(1);
        assertThat(counter.getMembers()).hasSize(3);
    }

    @Test
    void testWrongOperatorArity() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        CalorParser.parse("""
            §M{m001:Demo}
              §F{f001:Run:pub}
                §B{x} (? true 1)
              §/F{f001}
            §/M{m001}
            """, diagnostics);

        assertThat(diagnostics.withCode(DiagnosticCode.OPERATOR_ARGUMENT_COUNT)).hasSize(1);
    }

    private ModuleDeclaration parseClean(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(module).isNotNull();
        return module;
    }
}
