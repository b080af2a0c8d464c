package com.calor.compiler.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.FuzzyMatcher;
import com.calor.compiler.model.Span;

/**
 * Tokenizer for Calor source text.
 *
 * Never throws on malformed input: problems are reported to the diagnostic bag and the
 * offending characters are skipped or recovered from.
 */
public class CalorLexer {
    private static final Logger log = LoggerFactory.getLogger(CalorLexer.class);

    public static final char SIGIL = '§';
    public static final char ARROW = '→';

    private static final Map<String, TokenKind> TYPED_LITERAL_PREFIXES = Map.ofEntries(
        Map.entry("INT", TokenKind.INT_LITERAL),
        Map.entry("FLOAT", TokenKind.FLOAT_LITERAL),
        Map.entry("DEC", TokenKind.DECIMAL_LITERAL),
        Map.entry("STR", TokenKind.STRING_LITERAL),
        Map.entry("BOOL", TokenKind.BOOL_LITERAL)
    );

    private static final List<String> TWO_CHAR_OPERATORS = List.of(
        "**", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>"
    );

    private static final String SINGLE_CHAR_OPERATORS = "+-*/%<>!~&|^?";

    private final String source;
    private final DiagnosticBag diagnostics;
    private final int baseOffset;
    private int pos = 0;
    private int line;
    private int column;
    private TokenKind lastKind = null;

    public CalorLexer(String source, DiagnosticBag diagnostics) {
        this(source, diagnostics, 0, 1, 1);
    }

    /**
     * Lexer over a fragment of a larger file, e.g. an expression written inside an
     * attribute block. Spans are reported relative to the enclosing file.
     */
    public CalorLexer(String source, DiagnosticBag diagnostics, int baseOffset, int line, int column) {
        this.source = source != null ? source : "";
        this.diagnostics = diagnostics;
        this.baseOffset = baseOffset;
        this.line = line;
        this.column = column;
    }

    /**
     * Tokenize the entire source. The list always ends with an EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                break;
            }

            Token token = nextToken();
            if (token != null) {
                tokens.add(token);
                lastKind = token.getKind();
            }
        }

        tokens.add(Token.simple(TokenKind.EOF, "", Span.of(baseOffset + pos, line, column, 0)));
        log.debug("Lexed {} tokens", tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else if (c == '/' && peekAt(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private Token nextToken() {
        char c = source.charAt(pos);
        int startPos = pos;
        int startLine = line;
        int startCol = column;

        if (c == SIGIL) {
            return readTag();
        }

        if (c == ARROW) {
            advance();
            return Token.simple(TokenKind.ARROW, "→", spanFrom(startPos, startLine, startCol));
        }

        if (c == '-' && peekAt(1) == '>') {
            advance();
            advance();
            return Token.simple(TokenKind.ARROW, "->", spanFrom(startPos, startLine, startCol));
        }

        if (c == '"') {
            return readStringLiteral();
        }

        if (c == '\'') {
            return readCharLiteral();
        }

        if (Character.isDigit(c)) {
            return readNumber(startPos, startLine, startCol, false);
        }

        // Negative literal: '-' glued to a digit anywhere but the operator slot of a Lisp form
        if (c == '-' && Character.isDigit(peekAt(1)) && lastKind != TokenKind.LPAREN) {
            advance();
            return readNumber(startPos, startLine, startCol, true);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifier();
        }

        switch (c) {
            case '(':
                advance();
                return Token.simple(TokenKind.LPAREN, "(", spanFrom(startPos, startLine, startCol));
            case ')':
                advance();
                return Token.simple(TokenKind.RPAREN, ")", spanFrom(startPos, startLine, startCol));
            case '{':
                advance();
                return Token.simple(TokenKind.LBRACE, "{", spanFrom(startPos, startLine, startCol));
            case '}':
                advance();
                return Token.simple(TokenKind.RBRACE, "}", spanFrom(startPos, startLine, startCol));
            case '[':
                advance();
                return Token.simple(TokenKind.LBRACKET, "[", spanFrom(startPos, startLine, startCol));
            case ']':
                advance();
                return Token.simple(TokenKind.RBRACKET, "]", spanFrom(startPos, startLine, startCol));
            case ':':
                advance();
                return Token.simple(TokenKind.COLON, ":", spanFrom(startPos, startLine, startCol));
            case ',':
                advance();
                return Token.simple(TokenKind.COMMA, ",", spanFrom(startPos, startLine, startCol));
            case '.':
                advance();
                return Token.simple(TokenKind.DOT, ".", spanFrom(startPos, startLine, startCol));
            default:
                break;
        }

        if (pos + 1 < source.length()) {
            String two = source.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(two)) {
                advance();
                advance();
                return Token.simple(TokenKind.OPERATOR, two, spanFrom(startPos, startLine, startCol));
            }
        }

        if (c == '=') {
            advance();
            return Token.simple(TokenKind.EQUALS, "=", spanFrom(startPos, startLine, startCol));
        }

        if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
            advance();
            return Token.simple(TokenKind.OPERATOR, String.valueOf(c), spanFrom(startPos, startLine, startCol));
        }

        advance();
        diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, spanFrom(startPos, startLine, startCol),
                "Unexpected character '" + c + "'");
        return null;
    }

    private Token readTag() {
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        advance(); // §

        boolean closing = false;
        if (peekAt(0) == '/') {
            closing = true;
            advance();
        }

        StringBuilder name = new StringBuilder();
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            name.append(source.charAt(pos));
            advance();
        }
        Span tagSpan = spanFrom(startPos, startLine, startCol);

        AttributeBlock attributes = AttributeBlock.NONE;
        if (peekAt(0) == '{' || peekAt(0) == '[') {
            attributes = readAttributeBlock();
        }

        if (name.length() == 0) {
            diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, tagSpan, "Expected a tag name after '§'");
            return null;
        }

        String tagName = name.toString();
        Tag tag = closing ? Tag.fromClosingName(tagName) : Tag.fromName(tagName);
        if (tag == null) {
            String written = (closing ? "§/" : "§") + tagName;
            String closest = FuzzyMatcher.findClosest(tagName, closing ? Tag.closingNames() : Tag.names());
            String suggestion = closest != null
                    ? "Did you mean '" + (closing ? "§/" : "§") + closest + "'?"
                    : null;
            diagnostics.report(DiagnosticCode.UNKNOWN_TAG, tagSpan, "Unknown tag '" + written + "'", suggestion);
            return null;
        }

        String text = (closing ? "§/" : "§") + tagName;
        return new Token(closing ? TokenKind.CLOSING_TAG : TokenKind.TAG, text, null, tagSpan, tag, attributes);
    }

    /**
     * Reads {@code {a:b:c}} splitting on colons at nesting depth zero. Quotes, parentheses,
     * brackets, braces and angle brackets nest.
     */
    private AttributeBlock readAttributeBlock() {
        int blockStart = pos;
        int blockLine = line;
        int blockCol = column;
        char open = source.charAt(pos);
        char close = open == '{' ? '}' : ']';
        advance();

        List<AttributePart> parts = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        boolean terminated = false;

        int partStart = pos;
        int partLine = line;
        int partCol = column;

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                break;
            }
            if (c == '"') {
                skipQuotedInAttribute();
                continue;
            }
            if (depth == 0 && angle == 0 && c == close) {
                addPart(parts, partStart, partLine, partCol);
                advance();
                terminated = true;
                break;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            } else if (c == '<' && depth == 0) {
                angle++;
            } else if (c == '>' && depth == 0 && angle > 0) {
                angle--;
            } else if (c == ':' && depth == 0 && angle == 0) {
                addPart(parts, partStart, partLine, partCol);
                advance();
                partStart = pos;
                partLine = line;
                partCol = column;
                continue;
            }
            advance();
        }

        Span blockSpan = spanFrom(blockStart, blockLine, blockCol);
        if (!terminated) {
            addPart(parts, partStart, partLine, partCol);
            diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, blockSpan,
                    "Unterminated attribute block, expected '" + close + "'");
        }

        // {} carries no positional values
        if (parts.size() == 1 && parts.get(0).getText().isBlank()) {
            parts.clear();
        }
        return new AttributeBlock(List.copyOf(parts), blockSpan, true);
    }

    private void skipQuotedInAttribute() {
        advance(); // opening quote
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                return;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                advance();
                advance();
                continue;
            }
            advance();
            if (c == '"') {
                return;
            }
        }
    }

    private void addPart(List<AttributePart> parts, int start, int startLine, int startCol) {
        String raw = source.substring(start, pos);
        int lead = 0;
        while (lead < raw.length() && raw.charAt(lead) == ' ') {
            lead++;
        }
        String trimmed = raw.trim();
        Span span = Span.of(baseOffset + start + lead, startLine, startCol + lead, trimmed.length());
        parts.add(new AttributePart(trimmed, span));
    }

    private Token readStringLiteral() {
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        advance(); // opening quote

        StringBuilder value = new StringBuilder();
        boolean terminated = false;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                advance();
                terminated = true;
                break;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < source.length() && source.charAt(pos + 1) != '\n') {
                advance();
                value.append(unescape(source.charAt(pos)));
                advance();
                continue;
            }
            value.append(c);
            advance();
        }

        Span span = spanFrom(startPos, startLine, startCol);
        if (!terminated) {
            diagnostics.report(DiagnosticCode.UNTERMINATED_STRING, span, "Unterminated string literal");
        }
        return Token.literal(TokenKind.STRING_LITERAL, source.substring(startPos, pos), value.toString(), span);
    }

    private Token readCharLiteral() {
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        advance(); // opening quote

        Character value = null;
        if (pos < source.length() && source.charAt(pos) == '\\' && pos + 1 < source.length()) {
            advance();
            value = unescape(source.charAt(pos));
            advance();
        } else if (pos < source.length() && source.charAt(pos) != '\n' && source.charAt(pos) != '\'') {
            value = source.charAt(pos);
            advance();
        }

        if (value == null || peekAt(0) != '\'') {
            Span span = spanFrom(startPos, startLine, startCol);
            diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, span, "Malformed character literal");
            return null;
        }
        advance(); // closing quote
        return Token.literal(TokenKind.CHAR_LITERAL, source.substring(startPos, pos), value,
                spanFrom(startPos, startLine, startCol));
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            default -> c; // \\ \" \'
        };
    }

    private Token readNumber(int startPos, int startLine, int startCol, boolean negative) {
        int digitsStart = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            advance();
        }
        boolean fractional = false;
        if (peekAt(0) == '.' && Character.isDigit(peekAt(1))) {
            fractional = true;
            advance();
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                advance();
            }
        }
        String digits = (negative ? "-" : "") + source.substring(digitsStart, pos);

        if (peekAt(0) == 'm' || peekAt(0) == 'M') {
            advance();
            return Token.literal(TokenKind.DECIMAL_LITERAL, source.substring(startPos, pos),
                    new BigDecimal(digits), spanFrom(startPos, startLine, startCol));
        }
        if (fractional) {
            return Token.literal(TokenKind.FLOAT_LITERAL, source.substring(startPos, pos),
                    Double.parseDouble(digits), spanFrom(startPos, startLine, startCol));
        }
        try {
            return Token.literal(TokenKind.INT_LITERAL, source.substring(startPos, pos),
                    Long.parseLong(digits), spanFrom(startPos, startLine, startCol));
        } catch (NumberFormatException e) {
            Span span = spanFrom(startPos, startLine, startCol);
            diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, span, "Integer literal out of range: " + digits);
            return Token.literal(TokenKind.INT_LITERAL, source.substring(startPos, pos), 0L, span);
        }
    }

    private Token readIdentifier() {
        int startPos = pos;
        int startLine = line;
        int startCol = column;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                advance();
            } else if ((c == '.' || c == '-') && isIdentifierStart(peekAt(1))) {
                advance();
            } else {
                break;
            }
        }
        String text = source.substring(startPos, pos);

        TokenKind typedKind = TYPED_LITERAL_PREFIXES.get(text);
        if (typedKind != null && peekAt(0) == ':') {
            return readTypedLiteral(typedKind, startPos, startLine, startCol);
        }

        Span span = spanFrom(startPos, startLine, startCol);
        return switch (text) {
            case "true" -> Token.literal(TokenKind.BOOL_LITERAL, text, Boolean.TRUE, span);
            case "false" -> Token.literal(TokenKind.BOOL_LITERAL, text, Boolean.FALSE, span);
            case "null" -> Token.literal(TokenKind.NULL_LITERAL, text, null, span);
            default -> Token.simple(TokenKind.IDENTIFIER, text, span);
        };
    }

    /**
     * {@code INT:5}, {@code STR:"x"} and friends: the prefix only pins the literal kind.
     */
    private Token readTypedLiteral(TokenKind kind, int startPos, int startLine, int startCol) {
        advance(); // ':'
        Token inner;
        char c = peekAt(0);
        if (c == '"') {
            inner = readStringLiteral();
        } else if (Character.isDigit(c)) {
            inner = readNumber(pos, line, column, false);
        } else if (c == '-' && Character.isDigit(peekAt(1))) {
            int p = pos;
            int l = line;
            int col = column;
            advance();
            inner = readNumber(p, l, col, true);
        } else if (Character.isLetter(c)) {
            inner = readIdentifier();
        } else {
            inner = null;
        }

        Span span = spanFrom(startPos, startLine, startCol);
        if (inner == null || !matchesTypedKind(kind, inner)) {
            diagnostics.report(DiagnosticCode.UNEXPECTED_CHARACTER, span,
                    "Invalid typed literal '" + source.substring(startPos, pos) + "'");
            return inner;
        }

        Object value = inner.getValue();
        if (kind == TokenKind.FLOAT_LITERAL && value instanceof Long l) {
            value = l.doubleValue();
        } else if (kind == TokenKind.DECIMAL_LITERAL && !(value instanceof BigDecimal)) {
            value = new BigDecimal(String.valueOf(value));
        }
        return Token.literal(kind, source.substring(startPos, pos), value, span);
    }

    private static boolean matchesTypedKind(TokenKind kind, Token inner) {
        TokenKind actual = inner.getKind();
        return switch (kind) {
            case INT_LITERAL -> actual == TokenKind.INT_LITERAL;
            case FLOAT_LITERAL, DECIMAL_LITERAL -> actual == TokenKind.INT_LITERAL
                    || actual == TokenKind.FLOAT_LITERAL || actual == TokenKind.DECIMAL_LITERAL;
            case STRING_LITERAL -> actual == TokenKind.STRING_LITERAL;
            case BOOL_LITERAL -> actual == TokenKind.BOOL_LITERAL;
            default -> false;
        };
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance() {
        if (pos < source.length()) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    /**
     * Span from a recorded start to the current position; multi-line tokens keep their real end.
     */
    private Span spanFrom(int startPos, int startLine, int startCol) {
        return new Span(baseOffset + startPos, startLine, startCol, pos - startPos, line, column);
    }
}
