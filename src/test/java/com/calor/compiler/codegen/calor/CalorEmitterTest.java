package com.calor.compiler.codegen.calor;

import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.model.decl.FunctionDeclaration;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.model.expr.MatchExpression;
import com.calor.compiler.model.stmt.ReturnStatement;
import com.calor.compiler.parser.CalorParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CalorEmitter.
 */
class CalorEmitterTest {

    private static final String SOURCE = """
        §M{m001:Demo}
        §F{f001:Divide:pub}
        §I{i32:a}
        §I{i32:b}
        §O{i32}
        §Q{"b must not be zero"} (!= b 0)
        §S (<= result a)
        §R (/ a b)
        §/F{f001}
        §F{f002:Sign}
        §I{i32:x}
        §O{i32}
        §IF{if1} (> x 0) → §R 1
        §EI (< x 0) → §R -1
        §EL → §R 0
        §/I{if1}
        §/F{f002}
        §F{f003:Describe:pub}
        §I{i32:n}
        §O{str}
        §R §W{w1} n
        §K 0 → "zero"
        §K _ → "many"
        §/W{w1}
        §/F{f003}
        §F{f004:Sum:pub}
        §I{str:s}
        §B{~total:i32} 0
        §L{l1:i:1:10}
        §ASSIGN total (+ total i)
        §/L{l1}
        §P (contains s "b" :ignore-case)
        §C{Console.Beep} §/C
        §/F{f004}
        §/M{m001}
        """;

    private static final String CLASS_SOURCE = """
        §M{m001:Shapes}
        §U{System.Text}
        §U{Col:System.Collections.Generic}
        §U{static:System.Math}
        §IV (> 1 0)
        §CL{c1:Counter:sealed}
        §EXT{CounterBase}
        §IMPL{ICounter}
        §IV (>= Count 0)
        §FLD{i32:limit:pri:static,readonly} = 100
        §FLD{str:label}
        §PROP{p1:Count:i32:pub}
        §GET
        §SET{pri}
        = 0
        §/PROP{p1}
        §PROP{p2:Name:str:pub}
        §GET
        §R label
        §/GET
        §INIT
        §/PROP{p2}
        §CTOR{ct1}
        §I{i32:start}
        §Q{"start must not be negative"} (>= start 0)
        §BASE §A start §/BASE
        §ASSIGN Count start
        §/CTOR{ct1}
        §MT{mt1:Next:pub:virtual}
        §O{i32}
        §S (> result Count)
        §R (+ Count 1)
        §/MT{mt1}
        §AMT{mt2:Load:pub}
        §O{Task}
        §E{io}
        §B{text} §AWAIT{false} §C{File.ReadAllTextAsync} §A "count.txt" §/C
        §/AMT{mt2}
        §EVT{ev1:Changed:pub:EventHandler}
        §/CL{c1}
        §IFACE{i1:ICounter}
        §MT{im1:Next}
        §O{i32}
        §/MT{im1}
        §/IFACE{i1}
        §/M{m001}
        """;

    private static final String TYPES_SOURCE = """
        §M{m001:Types}
        §EN{e1:Color:u8}
        Red
        Green = 5
        Blue
        §/EN{e1}
        §EEXT{x1:Color}
        §F{f1:IsRed:pub}
        §I{Color:c}
        §O{bool}
        §R (== c Color.Red)
        §/F{f1}
        §/EEXT{x1}
        §D{d1:Point}
        §FL{i32:X}
        §FL{i32:Y}
        §/D{d1}
        §T{t1:Shape}
        §V{Circle}
        §FL{f64:radius}
        §V{Square}
        §FL{f64:side}
        §V{Empty}
        §/T{t1}
        §DEL{dl1:Handler:pub}
        §I{str:message}
        §O{bool}
        §E{cw}
        §/DEL{dl1}
        §/M{m001}
        """;

    private static final String LOOPS_SOURCE = """
        §M{m001:Loops}
        §F{f001:Run:pub}
        §I{List<str>:items}
        §B{~i:i32} 0
        §WH{w1} (< i 10) → §ASSIGN i (+ i 1)
        §/WH{w1}
        §WH{w2} (> i 5)
        §ASSIGN i (- i 1)
        §P i
        §/WH{w2}
        §DO{d1}
        §ASSIGN i (- i 2)
        §/DO{d1} (> i 0)
        §EACH{e1:item:str} items → §P item
        §/EACH{e1}
        §EACH{e2:item} items
        §Pf item
        §/EACH{e2}
        §L{l1:k:10:0:-2}
        §IF{if1} (== k 4) → §BK
        §/I{if1}
        §IF{if2} (== k 6)
        §CN
        §EL
        §P k
        §/I{if2}
        §/L{l1}
        §PUSH{items} "x"
        §SETIDX{items} 0 "y"
        §CLR{items}
        §/F{f001}
        §/M{m001}
        """;

    private static final String TRY_SOURCE = """
        §M{m001:Errors}
        §F{f001:Guarded:pub}
        §I{str:path}
        §TR{t1}
        §TH §NEW{InvalidOperationException} §A "boom" §/NEW
        §CA{InvalidOperationException:ex} §WHEN (!= ex null)
        §P "caught"
        §CA{IOException}
        §P "io"
        §CA
        §RT
        §FI
        §P "done"
        §/TR{t1}
        §USE{u1:reader:StreamReader} §NEW{StreamReader} §A path §/NEW
        §P §C{reader.ReadLine} §/C
        §/USE{u1}
        §/F{f001}
        §/M{m001}
        """;

    private static final String LAMBDA_SOURCE = """
        §M{m001:Lambdas}
        §F{f001:Make:pub}
        §B{twice} §LAM{l1:x:i32} (* x 2) §/LAM{l1}
        §B{shout} §LAM{l2:async:s:str}
        §P (upper s)
        §R s
        §/LAM{l2}
        §B{half} (/ 2.5 (cast f64 §C{twice} §A 1 §/C))
        §B{maybe} §SM 1
        §B{nothing} §NN{i32}
        §B{ok} §OK "fine"
        §B{value} (unwrap-or maybe 0)
        §B{pick} (? (&& true (! false)) 1m 'c')
        §/F{f001}
        §/M{m001}
        """;

    private static final String PATTERN_SOURCE = """
        §M{m001:Patterns}
        §F{f001:Inspect:pub}
        §I{List<i32>:xs}
        §I{?i32:o}
        §I{Point:p}
        §W{w1} xs
        §K §PLIST 1 §REST{tail} → §P tail
        §K §PLIST → §P "empty"
        §K _ → §P "other"
        §/W{w1}
        §W{w2} o
        §K §SM §VAR{v} §WHEN (> v 0) → §P v
        §K §SM _ → §P "non-positive"
        §K §NN → §P "none"
        §/W{w2}
        §W{w3} p
        §K §PPROP{Point} §PMATCH{X} 0 §PMATCH{Y} §PREL{gte} 10 → §P "on axis"
        §K §PPOS{Point} (gt 0) _ → §P "right"
        §K §PPOS{Point} §PREL{lt} 0 y
        §P "left"
        §P y
        §/K
        §K _ → §P "origin"
        §/W{w3}
        §/F{f001}
        §/M{m001}
        """;

    private static final String BRACKET_SOURCE = """
        §M[m001:Brackets]
        §F[f001:Add:pub]
        §I[i32:a]
        §I[i32:b]
        §O[i32]
        §Q (>= a 0)
        §R (+ a b)
        §/F[f001]
        §/M[m001]
        """;

    @ParameterizedTest
    @ValueSource(strings = { CLASS_SOURCE, TYPES_SOURCE, LOOPS_SOURCE, TRY_SOURCE, LAMBDA_SOURCE, PATTERN_SOURCE,
            BRACKET_SOURCE })
    void testRoundTripAcrossConstructs(String source) {
        ModuleDeclaration original = parse(source);
        CalorEmitter emitter = new CalorEmitter();

        String once = emitter.emit(original);
        ModuleDeclaration reparsed = parse(once);

        assertThat(reparsed).isEqualTo(original);
        assertThat(emitter.emit(reparsed)).isEqualTo(once);
    }

    @Test
    void testBracketAttributesMatchBraces() {
        ModuleDeclaration brackets = parse(BRACKET_SOURCE);
        ModuleDeclaration braces = parse(BRACKET_SOURCE.replace('[', '{').replace(']', '}'));

        assertThat(brackets).isEqualTo(braces);
        assertThat(new CalorEmitter().emit(brackets)).contains("§F{f001:Add:pub}").doesNotContain("[");
    }

    @Test
    void testStructuralPatternsCanonicalForm() {
        String calor = new CalorEmitter().emit(parse(PATTERN_SOURCE));

        assertThat(calor).contains("§K §PLIST 1 §REST{tail} → §P tail");
        assertThat(calor).contains("§K §SM v §WHEN (> v 0) → §P v");
        assertThat(calor).contains("§K §PPROP{Point} §PMATCH{X} 0 §PMATCH{Y} §PREL{gte} 10 → §P \"on axis\"");
        assertThat(calor).contains("§K §PPOS{Point} §PREL{gt} 0 _ → §P \"right\"");
    }

    @Test
    void testCanonicalLayout() {
        String calor = new CalorEmitter().emit(parse(SOURCE));

        assertThat(calor).startsWith("§M{m001:Demo}\n");
        assertThat(calor).endsWith("§/M{m001}\n");
        assertThat(calor).contains("\n  §F{f001:Divide:pub}\n    §I{i32:a}\n");
        assertThat(calor).contains("    §Q{\"b must not be zero\"} (!= b 0)\n");
        assertThat(calor).contains("    §S (<= result a)\n");
        assertThat(calor).contains("  §F{f002:Sign:pri}\n");
        assertThat(calor).contains("    §IF{if1} (> x 0) → §R 1\n    §EI (< x 0) → §R -1\n    §EL → §R 0\n");
        assertThat(calor).contains("    §R §W{w1} n\n      §K 0 → \"zero\"\n      §K _ → \"many\"\n    §/W{w1}\n");
        assertThat(calor).contains("    §B{~total:i32} 0\n    §L{l1:i:1:10}\n      §ASSIGN total (+ total i)\n");
        assertThat(calor).contains("    §P (contains s \"b\" :ignore-case)\n");
        assertThat(calor).contains("    §C{Console.Beep} §/C\n");
    }

    @Test
    void testRoundTripPreservesStructure() {
        ModuleDeclaration original = parse(SOURCE);

        ModuleDeclaration reparsed = parse(new CalorEmitter().emit(original));

        assertThat(reparsed).isEqualTo(original);
    }

    @Test
    void testFormattingIsIdempotent() {
        CalorEmitter emitter = new CalorEmitter();
        String once = emitter.emit(parse(SOURCE));
        String twice = emitter.emit(parse(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void testValuedMatchReparsesAsMatchExpression() {
        String calor = new CalorEmitter().emit(parse(SOURCE));

        FunctionDeclaration describe = (FunctionDeclaration) parse(calor).getMembers().get(2);
        ReturnStatement ret = (ReturnStatement) describe.getBody().get(0);
        assertThat(ret.getValue()).isInstanceOf(MatchExpression.class);
        assertThat(((MatchExpression) ret.getValue()).getId()).isEqualTo("w1");
    }

    @Test
    void testFormatExpression() {
        FunctionDeclaration divide = (FunctionDeclaration) parse(SOURCE).getMembers().get(0);

        CalorEmitter emitter = new CalorEmitter();
        assertThat(emitter.formatExpression(divide.getPreconditions().get(0).getCondition())).isEqualTo("(!= b 0)");
        assertThat(emitter.formatExpression(((ReturnStatement) divide.getBody().get(0)).getValue()))
                .isEqualTo("(/ a b)");
    }

    @Test
    void testOperatorAliasesAreNormalised() {
        ModuleDeclaration module = parse("""
            §M{m001:Demo}
              §F{f001:Check:pub}
                §I{i32:a}
                §O{bool}
                §R (and (gte a 0) (lt a 10))
              §/F{f001}
            §/M{m001}
            """);

        String calor = new CalorEmitter().emit(module);

        assertThat(calor).contains("§R (&& (>= a 0) (< a 10))");
    }

    private ModuleDeclaration parse(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        ModuleDeclaration module = CalorParser.parse(source, diagnostics);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        return module;
    }
}
