package com.calor.compiler.parser;

import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CalorLexer.
 */
class CalorLexerTest {

    @Test
    void testTagWithAttributes() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = new CalorLexer("§F{f001:Add:pub}", diagnostics).tokenize();

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(tokens).hasSize(2);

        Token tag = tokens.get(0);
        assertThat(tag.getKind()).isEqualTo(TokenKind.TAG);
        assertThat(tag.getTag()).isEqualTo(Tag.FUNCTION);
        assertThat(tag.getAttributes().size()).isEqualTo(3);
        assertThat(tag.getAttributes().get(0)).isEqualTo("f001");
        assertThat(tag.getAttributes().get(1)).isEqualTo("Add");
        assertThat(tag.getAttributes().get(2)).isEqualTo("pub");
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.EOF);
    }

    @Test
    void testClosingTag() {
        List<Token> tokens = tokenize("§/F{f001} §/I{if1}");

        assertThat(tokens.get(0).isClosing(Tag.FUNCTION)).isTrue();
        assertThat(tokens.get(0).getAttributes().get(0)).isEqualTo("f001");
        assertThat(tokens.get(1).isClosing(Tag.IF)).isTrue();
    }

    @Test
    void testAttributeColonsInsideAngleBracketsDoNotSplit() {
        List<Token> tokens = tokenize("§I{Dict<str,i32>:counts}");

        assertThat(tokens.get(0).getAttributes().get(0)).isEqualTo("Dict<str,i32>");
        assertThat(tokens.get(0).getAttributes().get(1)).isEqualTo("counts");
    }

    @Test
    void testLiterals() {
        List<Token> tokens = tokenize("42 3.5 2.50m \"a\\nb\" 'x' true null");

        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.INT_LITERAL);
        assertThat(tokens.get(0).getValue()).isEqualTo(42L);
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.FLOAT_LITERAL);
        assertThat(tokens.get(1).getValue()).isEqualTo(3.5);
        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.DECIMAL_LITERAL);
        assertThat(tokens.get(2).getValue()).isEqualTo(new BigDecimal("2.50"));
        assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(3).getValue()).isEqualTo("a\nb");
        assertThat(tokens.get(4).getKind()).isEqualTo(TokenKind.CHAR_LITERAL);
        assertThat(tokens.get(4).getValue()).isEqualTo('x');
        assertThat(tokens.get(5).getKind()).isEqualTo(TokenKind.BOOL_LITERAL);
        assertThat(tokens.get(5).getValue()).isEqualTo(Boolean.TRUE);
        assertThat(tokens.get(6).getKind()).isEqualTo(TokenKind.NULL_LITERAL);
    }

    @Test
    void testTypedLiteralPinsKind() {
        List<Token> tokens = tokenize("INT:7 STR:\"hi\" FLOAT:2");

        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.INT_LITERAL);
        assertThat(tokens.get(0).getValue()).isEqualTo(7L);
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(1).getValue()).isEqualTo("hi");
        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.FLOAT_LITERAL);
        assertThat(tokens.get(2).getValue()).isEqualTo(2.0);
    }

    @Test
    void testMinusAfterParenIsOperator() {
        List<Token> tokens = tokenize("(- 5 3) -4");

        assertThat(tokens.get(1).isOperator("-")).isTrue();
        assertThat(tokens.get(2).getValue()).isEqualTo(5L);
        assertThat(tokens.get(5).getKind()).isEqualTo(TokenKind.INT_LITERAL);
        assertThat(tokens.get(5).getValue()).isEqualTo(-4L);
    }

    @Test
    void testArrowForms() {
        List<Token> tokens = tokenize("→ ->");

        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.ARROW);
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.ARROW);
    }

    @Test
    void testHyphenatedIdentifierAndComment() {
        List<Token> tokens = tokenize("unwrap-or // trailing comment\nx");

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0).getText()).isEqualTo("unwrap-or");
        assertThat(tokens.get(1).getText()).isEqualTo("x");
        assertThat(tokens.get(1).getLine()).isEqualTo(2);
    }

    @Test
    void testUnterminatedString() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = new CalorLexer("\"abc\nx", diagnostics).tokenize();

        assertThat(diagnostics.withCode(DiagnosticCode.UNTERMINATED_STRING)).hasSize(1);
        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(0).getValue()).isEqualTo("abc");
    }

    @Test
    void testUnknownTagSuggestsClosest() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        new CalorLexer("§IFF{if1}", diagnostics).tokenize();

        List<Diagnostic> unknown = diagnostics.withCode(DiagnosticCode.UNKNOWN_TAG);
        assertThat(unknown).hasSize(1);
        assertThat(unknown.get(0).getMessage()).contains("§IFF");
        assertThat(unknown.get(0).getSuggestion()).isEqualTo("Did you mean '§IF'?");
    }

    @Test
    void testSpansAreOneBased() {
        List<Token> tokens = tokenize("§M{m1:Demo}\n  §R 1");

        assertThat(tokens.get(0).getLine()).isEqualTo(1);
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
        assertThat(tokens.get(1).getLine()).isEqualTo(2);
        assertThat(tokens.get(1).getColumn()).isEqualTo(3);
    }

    private List<Token> tokenize(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = new CalorLexer(source, diagnostics).tokenize();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        return tokens;
    }
}
