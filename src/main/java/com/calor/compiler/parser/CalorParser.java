package com.calor.compiler.parser;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.Fix;
import com.calor.compiler.diagnostics.FuzzyMatcher;
import com.calor.compiler.diagnostics.TextEdit;
import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.EffectSet;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.decl.ClassDeclaration;
import com.calor.compiler.model.decl.ConstructorDeclaration;
import com.calor.compiler.model.decl.ConstructorInitializer;
import com.calor.compiler.model.decl.Declaration;
import com.calor.compiler.model.decl.DelegateDeclaration;
import com.calor.compiler.model.decl.EnumDeclaration;
import com.calor.compiler.model.decl.EnumExtensionDeclaration;
import com.calor.compiler.model.decl.EnumMember;
import com.calor.compiler.model.decl.EventDeclaration;
import com.calor.compiler.model.decl.FieldDeclaration;
import com.calor.compiler.model.decl.FunctionDeclaration;
import com.calor.compiler.model.decl.InterfaceDeclaration;
import com.calor.compiler.model.decl.ModuleDeclaration;
import com.calor.compiler.model.decl.PropertyAccessor;
import com.calor.compiler.model.decl.PropertyDeclaration;
import com.calor.compiler.model.decl.RecordDeclaration;
import com.calor.compiler.model.decl.UnionCase;
import com.calor.compiler.model.decl.UnionTypeDeclaration;
import com.calor.compiler.model.decl.UsingDirective;
import com.calor.compiler.model.expr.AwaitExpression;
import com.calor.compiler.model.expr.BinaryExpression;
import com.calor.compiler.model.expr.BinaryOperator;
import com.calor.compiler.model.expr.BuilderOp;
import com.calor.compiler.model.expr.BuilderOpExpression;
import com.calor.compiler.model.expr.CallExpression;
import com.calor.compiler.model.expr.CastExpression;
import com.calor.compiler.model.expr.CharOp;
import com.calor.compiler.model.expr.CharOpExpression;
import com.calor.compiler.model.expr.ComparisonMode;
import com.calor.compiler.model.expr.ConditionalExpression;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.expr.FieldAccessExpression;
import com.calor.compiler.model.expr.LambdaExpression;
import com.calor.compiler.model.expr.LiteralExpression;
import com.calor.compiler.model.expr.LiteralKind;
import com.calor.compiler.model.expr.MatchCase;
import com.calor.compiler.model.expr.MatchExpression;
import com.calor.compiler.model.expr.NewExpression;
import com.calor.compiler.model.expr.OptionResultExpression;
import com.calor.compiler.model.expr.OptionResultVariant;
import com.calor.compiler.model.expr.ReferenceExpression;
import com.calor.compiler.model.expr.StringOp;
import com.calor.compiler.model.expr.StringOpExpression;
import com.calor.compiler.model.expr.UnaryExpression;
import com.calor.compiler.model.expr.UnaryOperator;
import com.calor.compiler.model.expr.UncheckedExpression;
import com.calor.compiler.model.expr.UnwrapExpression;
import com.calor.compiler.model.pattern.ListPattern;
import com.calor.compiler.model.pattern.LiteralPattern;
import com.calor.compiler.model.pattern.OptionResultPattern;
import com.calor.compiler.model.pattern.Pattern;
import com.calor.compiler.model.pattern.PositionalPattern;
import com.calor.compiler.model.pattern.PropertyMatch;
import com.calor.compiler.model.pattern.PropertyPattern;
import com.calor.compiler.model.pattern.RelationalOperator;
import com.calor.compiler.model.pattern.RelationalPattern;
import com.calor.compiler.model.pattern.VariablePattern;
import com.calor.compiler.model.pattern.WildcardPattern;
import com.calor.compiler.model.stmt.AssignStatement;
import com.calor.compiler.model.stmt.BindStatement;
import com.calor.compiler.model.stmt.BreakStatement;
import com.calor.compiler.model.stmt.CatchClause;
import com.calor.compiler.model.stmt.CollectionOp;
import com.calor.compiler.model.stmt.CollectionOpStatement;
import com.calor.compiler.model.stmt.ContinueStatement;
import com.calor.compiler.model.stmt.DoWhileStatement;
import com.calor.compiler.model.stmt.ElseIfClause;
import com.calor.compiler.model.stmt.ExpressionStatement;
import com.calor.compiler.model.stmt.ForStatement;
import com.calor.compiler.model.stmt.ForeachStatement;
import com.calor.compiler.model.stmt.IfStatement;
import com.calor.compiler.model.stmt.MatchStatement;
import com.calor.compiler.model.stmt.PrintStatement;
import com.calor.compiler.model.stmt.RethrowStatement;
import com.calor.compiler.model.stmt.ReturnStatement;
import com.calor.compiler.model.stmt.Statement;
import com.calor.compiler.model.stmt.ThrowStatement;
import com.calor.compiler.model.stmt.TryStatement;
import com.calor.compiler.model.stmt.UsingStatement;
import com.calor.compiler.model.stmt.WhileStatement;

/**
 * Recursive-descent parser for Calor.
 *
 * Parsing only:
 * - Builds the AST
 * - Checks opening/closing tag correspondence and IDs
 * - Reports diagnostics and recovers, so one call surfaces many errors
 *
 * Name resolution and typing belong to the semantic checker.
 */
public class CalorParser {
    private static final Logger log = LoggerFactory.getLogger(CalorParser.class);

    private static final Set<Tag> DECLARATION_TAGS = EnumSet.of(
        Tag.MODULE, Tag.USING, Tag.FUNCTION, Tag.ASYNC_FUNCTION, Tag.CLASS, Tag.INTERFACE,
        Tag.ENUM, Tag.ENUM_EXTENSION, Tag.RECORD, Tag.UNION, Tag.DELEGATE, Tag.METHOD,
        Tag.ASYNC_METHOD, Tag.CONSTRUCTOR, Tag.PROPERTY, Tag.FIELD, Tag.EVENT
    );

    /** Tags that continue an enclosing construct and therefore end the current block. */
    private static final Set<Tag> CLAUSE_TAGS = EnumSet.of(
        Tag.ELSE_IF, Tag.ELSE, Tag.CATCH, Tag.FINALLY, Tag.CASE, Tag.GET, Tag.SET, Tag.INIT
    );

    private static final Set<Tag> EXPRESSION_TAGS = EnumSet.of(
        Tag.CALL, Tag.NEW, Tag.AWAIT, Tag.LAMBDA, Tag.SOME, Tag.NONE, Tag.OK, Tag.ERR, Tag.MATCH
    );

    /** Statement tags that can never begin an expression. */
    private static final Set<Tag> PURE_STATEMENT_TAGS = EnumSet.of(
        Tag.BIND, Tag.ASSIGN, Tag.RETURN, Tag.IF, Tag.FOR, Tag.WHILE, Tag.DO, Tag.FOREACH,
        Tag.TRY, Tag.THROW, Tag.RETHROW, Tag.BREAK, Tag.CONTINUE, Tag.PRINT, Tag.PRINT_INLINE,
        Tag.PUSH, Tag.PUT, Tag.REMOVE, Tag.SET_INDEX, Tag.CLEAR, Tag.INSERT, Tag.USE
    );

    private static final Set<Tag> PATTERN_TAGS = EnumSet.of(
        Tag.VAR, Tag.RELATIONAL_PATTERN, Tag.SOME, Tag.NONE, Tag.OK, Tag.ERR,
        Tag.PROPERTY_PATTERN, Tag.POSITIONAL_PATTERN, Tag.LIST_PATTERN
    );

    private final List<Token> tokens;
    private final DiagnosticBag diagnostics;
    private int pos = 0;

    /** Tags whose closing tag is still expected, innermost first. */
    private final Deque<Tag> openTags = new ArrayDeque<>();

    public CalorParser(List<Token> tokens, DiagnosticBag diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Lex and parse a whole source file. Returns null when no module could be recognised.
     */
    public static ModuleDeclaration parse(String source, DiagnosticBag diagnostics) {
        List<Token> tokens = new CalorLexer(source, diagnostics).tokenize();
        return new CalorParser(tokens, diagnostics).parseModule();
    }

    public ModuleDeclaration parseModule() {
        if (!check(Tag.MODULE)) {
            Token first = peek();
            diagnostics.report(DiagnosticCode.UNEXPECTED_TOKEN, first.getSpan(),
                    "Expected '§M{id:Name}' at the start of the file but found " + first.describe());
            while (!isAtEnd() && !check(Tag.MODULE)) {
                advance();
            }
            if (isAtEnd()) {
                return null;
            }
        }

        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");

        List<UsingDirective> usings = new ArrayList<>();
        List<Declaration> members = new ArrayList<>();
        List<ContractClause> invariants = new ArrayList<>();

        openTags.push(Tag.MODULE);
        try {
            while (!isAtEnd() && !checkClosing(Tag.MODULE)) {
                int start = pos;
                try {
                    Token token = peek();
                    if (token.isTag(Tag.USING)) {
                        usings.add(parseUsing());
                    } else if (token.isTag(Tag.INVARIANT)) {
                        invariants.add(parseContract(ContractKind.INVARIANT));
                    } else {
                        members.add(parseDeclaration());
                    }
                } catch (ParseException e) {
                    report(e);
                    synchronize(start, true);
                }
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.MODULE, id, open);

        if (!isAtEnd()) {
            diagnostics.report(DiagnosticCode.UNEXPECTED_TOKEN, peek().getSpan(),
                    "Unexpected " + peek().describe() + " after the end of module '" + name + "'");
        }

        log.debug("Parsed module {} with {} members", name, members.size());
        return new ModuleDeclaration(spanFrom(open), id, name, usings, members, invariants);
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private Declaration parseDeclaration() {
        Token token = peek();
        if (token.getKind() != TokenKind.TAG) {
            throw unexpected("a declaration");
        }
        return switch (token.getTag()) {
            case FUNCTION, ASYNC_FUNCTION, METHOD, ASYNC_METHOD -> parseFunction();
            case CLASS -> parseClass();
            case INTERFACE -> parseInterface();
            case ENUM -> parseEnum();
            case ENUM_EXTENSION -> parseEnumExtension();
            case RECORD -> parseRecord();
            case UNION -> parseUnion();
            case DELEGATE -> parseDelegate();
            default -> throw unexpected("a declaration");
        };
    }

    private UsingDirective parseUsing() {
        Token open = advance();
        AttributeBlock attrs = open.getAttributes();
        if (attrs.size() >= 2) {
            String first = attrs.get(0);
            String namespace = requireAttribute(open, 1, "namespace");
            if ("static".equals(first)) {
                return new UsingDirective(spanFrom(open), namespace, null, true);
            }
            return new UsingDirective(spanFrom(open), namespace, first, false);
        }
        return new UsingDirective(spanFrom(open), requireAttribute(open, 0, "namespace"), null, false);
    }

    /**
     * {@code §F}, {@code §AF}, {@code §MT} and {@code §AMT} share one shape.
     */
    private FunctionDeclaration parseFunction() {
        Token open = advance();
        Tag tag = open.getTag();
        boolean async = tag == Tag.ASYNC_FUNCTION || tag == Tag.ASYNC_METHOD;
        boolean method = tag == Tag.METHOD || tag == Tag.ASYNC_METHOD;

        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        Visibility visibility = parseVisibility(open, 2);
        List<String> modifiers = splitList(open.getAttributes().get(3));

        List<Parameter> parameters = new ArrayList<>();
        String returnType = null;
        EffectSet effects = EffectSet.EMPTY;
        List<ContractClause> preconditions = new ArrayList<>();
        List<ContractClause> postconditions = new ArrayList<>();
        List<Statement> body;

        openTags.push(tag);
        try {
            boolean signature = true;
            while (signature && !isAtEnd()) {
                Token token = peek();
                if (token.isTag(Tag.INPUT)) {
                    parameters.add(parseParameter());
                } else if (token.isTag(Tag.OUTPUT)) {
                    advance();
                    returnType = requireAttribute(token, 0, "type");
                } else if (token.isTag(Tag.EFFECTS)) {
                    advance();
                    effects = EffectSet.of(splitList(String.join(",", attributeTexts(token))));
                } else if (token.isTag(Tag.REQUIRES)) {
                    preconditions.add(parseContract(ContractKind.REQUIRES));
                } else if (token.isTag(Tag.ENSURES)) {
                    postconditions.add(parseContract(ContractKind.ENSURES));
                } else {
                    signature = false;
                }
            }
            body = parseStatementBlock();
        } finally {
            openTags.pop();
        }
        expectClosing(tag, id, open);

        return new FunctionDeclaration(spanFrom(open), id, name, visibility, async, method, modifiers,
                parameters, returnType, effects, preconditions, postconditions, body);
    }

    private Parameter parseParameter() {
        Token token = advance();
        String type = requireAttribute(token, 0, "type");
        String name = requireAttribute(token, 1, "name");
        return new Parameter(token.getFullSpan(), name, type);
    }

    private ContractClause parseContract(ContractKind kind) {
        Token open = advance();
        String message = unquote(open.getAttributes().get(0));
        Expression condition = parseExpression();
        return new ContractClause(spanFrom(open), kind, condition, message);
    }

    private ClassDeclaration parseClass() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        List<String> modifiers = splitList(open.getAttributes().get(2));

        String baseClass = null;
        List<String> interfaces = new ArrayList<>();
        List<Declaration> members = new ArrayList<>();
        List<ContractClause> invariants = new ArrayList<>();

        openTags.push(Tag.CLASS);
        try {
            while (!isAtEnd() && !checkClosing(Tag.CLASS) && !atEnclosingClose()) {
                int start = pos;
                try {
                    Token token = peek();
                    if (token.getKind() != TokenKind.TAG) {
                        throw unexpected("a class member");
                    }
                    switch (token.getTag()) {
                        case EXTENDS -> {
                            advance();
                            baseClass = requireAttribute(token, 0, "base class");
                        }
                        case IMPLEMENTS -> {
                            advance();
                            interfaces.add(requireAttribute(token, 0, "interface"));
                        }
                        case INVARIANT -> invariants.add(parseContract(ContractKind.INVARIANT));
                        case FIELD -> members.add(parseField());
                        case PROPERTY -> members.add(parseProperty());
                        case CONSTRUCTOR -> members.add(parseConstructor(name));
                        case EVENT -> members.add(parseEvent());
                        default -> members.add(parseDeclaration());
                    }
                } catch (ParseException e) {
                    report(e);
                    synchronize(start, true);
                }
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.CLASS, id, open);

        return new ClassDeclaration(spanFrom(open), id, name, modifiers, baseClass, interfaces, members, invariants);
    }

    private FieldDeclaration parseField() {
        Token open = advance();
        String type = requireAttribute(open, 0, "type");
        String name = requireAttribute(open, 1, "name");
        Visibility visibility = parseVisibility(open, 2);
        List<String> modifiers = splitList(open.getAttributes().get(3));

        Expression initializer = null;
        if (check(TokenKind.EQUALS)) {
            advance();
            initializer = parseExpression();
        }
        return new FieldDeclaration(spanFrom(open), name, type, visibility, modifiers, initializer);
    }

    private PropertyDeclaration parseProperty() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        String type = requireAttribute(open, 2, "type");
        Visibility visibility = parseVisibility(open, 3);

        List<PropertyAccessor> accessors = new ArrayList<>();
        Expression defaultValue = null;

        openTags.push(Tag.PROPERTY);
        try {
            while (check(Tag.GET) || check(Tag.SET) || check(Tag.INIT)) {
                accessors.add(parseAccessor());
            }
            if (check(TokenKind.EQUALS)) {
                advance();
                defaultValue = parseExpression();
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.PROPERTY, id, open);

        return new PropertyDeclaration(spanFrom(open), id, name, type, visibility, accessors, defaultValue);
    }

    private PropertyAccessor parseAccessor() {
        Token open = advance();
        PropertyAccessor.Kind kind = switch (open.getTag()) {
            case GET -> PropertyAccessor.Kind.GET;
            case SET -> PropertyAccessor.Kind.SET;
            default -> PropertyAccessor.Kind.INIT;
        };
        Visibility visibility = Visibility.fromText(open.getAttributes().get(0));

        List<Statement> body = List.of();
        if (kind != PropertyAccessor.Kind.INIT && startsStatement(peek())) {
            openTags.push(open.getTag());
            try {
                body = parseStatementBlock();
            } finally {
                openTags.pop();
            }
            expectClosing(open.getTag(), null, open);
        }
        return new PropertyAccessor(spanFrom(open), kind, visibility, body);
    }

    private ConstructorDeclaration parseConstructor(String className) {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        Visibility visibility = parseVisibility(open, 1, Visibility.PUBLIC);

        List<Parameter> parameters = new ArrayList<>();
        List<ContractClause> preconditions = new ArrayList<>();
        ConstructorInitializer initializer = null;
        List<Statement> body;

        openTags.push(Tag.CONSTRUCTOR);
        try {
            while (check(Tag.INPUT) || check(Tag.REQUIRES)) {
                if (check(Tag.INPUT)) {
                    parameters.add(parseParameter());
                } else {
                    preconditions.add(parseContract(ContractKind.REQUIRES));
                }
            }
            if (check(Tag.BASE) || check(Tag.THIS)) {
                Token init = advance();
                List<Expression> arguments = parseArguments();
                acceptClosing(init.getTag());
                initializer = new ConstructorInitializer(spanFrom(init), init.getTag() == Tag.BASE, arguments);
            }
            body = parseStatementBlock();
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.CONSTRUCTOR, id, open);

        return new ConstructorDeclaration(spanFrom(open), id, className, visibility, parameters,
                preconditions, initializer, body);
    }

    private EventDeclaration parseEvent() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        Visibility visibility = parseVisibility(open, 2);
        String delegateType = requireAttribute(open, 3, "delegate type");
        return new EventDeclaration(spanFrom(open), id, name, visibility, delegateType);
    }

    private InterfaceDeclaration parseInterface() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        List<FunctionDeclaration> methods = new ArrayList<>();

        openTags.push(Tag.INTERFACE);
        try {
            while (!isAtEnd() && !checkClosing(Tag.INTERFACE) && !atEnclosingClose()) {
                int start = pos;
                try {
                    if (!check(Tag.METHOD) && !check(Tag.ASYNC_METHOD)) {
                        throw unexpected("'§MT' method signature");
                    }
                    methods.add(parseFunction());
                } catch (ParseException e) {
                    report(e);
                    synchronize(start, true);
                }
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.INTERFACE, id, open);

        return new InterfaceDeclaration(spanFrom(open), id, name, methods);
    }

    private EnumDeclaration parseEnum() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        String underlying = open.getAttributes().get(2);
        List<EnumMember> members = new ArrayList<>();

        openTags.push(Tag.ENUM);
        try {
            while (check(TokenKind.IDENTIFIER)) {
                Token member = advance();
                String value = null;
                if (check(TokenKind.EQUALS)) {
                    advance();
                    Token literal = advance();
                    if (!literal.getKind().isLiteral()) {
                        throw new ParseException(DiagnosticCode.UNEXPECTED_TOKEN, literal.getSpan(),
                                "Expected a literal value for enum member '" + member.getText()
                                        + "' but found " + literal.describe());
                    }
                    value = literal.getText();
                }
                members.add(new EnumMember(spanFrom(member), member.getText(), value));
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.ENUM, id, open);

        return new EnumDeclaration(spanFrom(open), id, name, underlying, members);
    }

    private EnumExtensionDeclaration parseEnumExtension() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String enumName = requireAttribute(open, 1, "enum name");
        List<FunctionDeclaration> methods = new ArrayList<>();

        openTags.push(Tag.ENUM_EXTENSION);
        try {
            while (!isAtEnd() && !checkClosing(Tag.ENUM_EXTENSION) && !atEnclosingClose()) {
                int start = pos;
                try {
                    if (!check(Tag.FUNCTION) && !check(Tag.ASYNC_FUNCTION)) {
                        throw unexpected("'§F' extension method");
                    }
                    FunctionDeclaration method = parseFunction();
                    if (method.getParameters().isEmpty()
                            || !enumName.equals(method.getParameters().get(0).getType())) {
                        diagnostics.report(DiagnosticCode.MISSING_EXTENSION_SELF, method.getSpan(),
                                "Extension method '" + method.getName() + "' must take a first parameter of type '"
                                        + enumName + "'");
                    }
                    methods.add(method);
                } catch (ParseException e) {
                    report(e);
                    synchronize(start, true);
                }
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.ENUM_EXTENSION, id, open);

        return new EnumExtensionDeclaration(spanFrom(open), id, enumName, methods);
    }

    private RecordDeclaration parseRecord() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        List<Parameter> fields = new ArrayList<>();

        openTags.push(Tag.RECORD);
        try {
            while (check(Tag.RECORD_FIELD)) {
                fields.add(parseParameter());
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.RECORD, id, open);

        return new RecordDeclaration(spanFrom(open), id, name, fields);
    }

    private UnionTypeDeclaration parseUnion() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        List<UnionCase> cases = new ArrayList<>();

        openTags.push(Tag.UNION);
        try {
            while (check(Tag.VARIANT)) {
                Token variant = advance();
                String caseName = requireAttribute(variant, 0, "case name");
                List<Parameter> fields = new ArrayList<>();
                while (check(Tag.RECORD_FIELD)) {
                    fields.add(parseParameter());
                }
                cases.add(new UnionCase(spanFrom(variant), caseName, fields));
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.UNION, id, open);

        return new UnionTypeDeclaration(spanFrom(open), id, name, cases);
    }

    private DelegateDeclaration parseDelegate() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String name = requireAttribute(open, 1, "name");
        Visibility visibility = parseVisibility(open, 2);

        List<Parameter> parameters = new ArrayList<>();
        String returnType = null;
        EffectSet effects = EffectSet.EMPTY;

        openTags.push(Tag.DELEGATE);
        try {
            boolean signature = true;
            while (signature) {
                Token token = peek();
                if (token.isTag(Tag.INPUT)) {
                    parameters.add(parseParameter());
                } else if (token.isTag(Tag.OUTPUT)) {
                    advance();
                    returnType = requireAttribute(token, 0, "type");
                } else if (token.isTag(Tag.EFFECTS)) {
                    advance();
                    effects = EffectSet.of(splitList(String.join(",", attributeTexts(token))));
                } else {
                    signature = false;
                }
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.DELEGATE, id, open);

        return new DelegateDeclaration(spanFrom(open), id, name, visibility, parameters, returnType, effects);
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    /**
     * Statements up to the closing tag of an enclosing construct, a clause tag such as
     * {@code §EL}, a declaration tag or end of input. The terminator is not consumed.
     */
    private List<Statement> parseStatementBlock() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd() && !atBlockEnd()) {
            int start = pos;
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                report(e);
                synchronize(start, false);
            }
        }
        return statements;
    }

    private Statement parseStatement() {
        Token token = peek();

        if (token.getKind() == TokenKind.LPAREN) {
            Expression expression = parseExpression();
            return new ExpressionStatement(expression.getSpan(), expression);
        }
        if (token.getKind() != TokenKind.TAG) {
            throw unexpected("a statement");
        }

        return switch (token.getTag()) {
            case BIND -> parseBind();
            case ASSIGN -> parseAssign();
            case RETURN -> parseReturn();
            case IF -> parseIf();
            case FOR -> parseFor();
            case WHILE -> parseWhile();
            case DO -> parseDoWhile();
            case FOREACH -> parseForeach();
            case TRY -> parseTry();
            case THROW -> {
                advance();
                Expression exception = parseExpression();
                yield new ThrowStatement(spanFrom(token), exception);
            }
            case RETHROW -> {
                advance();
                yield new RethrowStatement(token.getFullSpan());
            }
            case BREAK -> {
                advance();
                yield new BreakStatement(token.getFullSpan());
            }
            case CONTINUE -> {
                advance();
                yield new ContinueStatement(token.getFullSpan());
            }
            case PRINT, PRINT_INLINE -> {
                advance();
                Expression value = parseExpression();
                yield new PrintStatement(spanFrom(token), value, token.getTag() == Tag.PRINT);
            }
            case PUSH, PUT, REMOVE, SET_INDEX, CLEAR, INSERT -> parseCollectionOp();
            case MATCH -> parseMatchStatement();
            case USE -> parseUsingStatement();
            case CALL, NEW, AWAIT, LAMBDA -> {
                Expression expression = parseExpression();
                yield new ExpressionStatement(expression.getSpan(), expression);
            }
            default -> throw unexpected("a statement");
        };
    }

    private BindStatement parseBind() {
        Token open = advance();
        String rawName = requireAttribute(open, 0, "name");
        boolean mutable = rawName.startsWith("~");
        String name = mutable ? rawName.substring(1).trim() : rawName;
        String type = open.getAttributes().get(1);
        Expression value = parseExpression();
        return new BindStatement(spanFrom(open), name, type, mutable, value);
    }

    private AssignStatement parseAssign() {
        Token open = advance();
        Expression target = parseExpression();
        Expression value = parseExpression();
        return new AssignStatement(spanFrom(open), target, value);
    }

    /**
     * {@code §R [value]}. A value is only taken from the same line, so a bare return
     * followed by an expression statement stays two statements.
     */
    private ReturnStatement parseReturn() {
        Token open = advance();
        Expression value = null;
        if (startsExpression(peek()) && peek().getLine() == open.getSpan().getEndLine()) {
            value = parseExpression();
        }
        return new ReturnStatement(spanFrom(open), value);
    }

    private IfStatement parseIf() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");

        Expression condition;
        BodyForm form;
        List<Statement> thenBody;
        List<ElseIfClause> elseIfs = new ArrayList<>();
        List<Statement> elseBody = null;
        BodyForm elseForm = null;

        openTags.push(Tag.IF);
        try {
            condition = parseExpression();
            form = bodyForm();
            thenBody = parseBody(form, false);

            while (check(Tag.ELSE_IF)) {
                Token clause = advance();
                Expression clauseCondition = parseExpression();
                BodyForm clauseForm = bodyForm();
                List<Statement> clauseBody = parseBody(clauseForm, false);
                elseIfs.add(new ElseIfClause(spanFrom(clause), clauseCondition, clauseForm, clauseBody));
            }

            if (check(Tag.ELSE)) {
                advance();
                elseForm = bodyForm();
                elseBody = parseBody(elseForm, false);
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.IF, id, open);

        return new IfStatement(spanFrom(open), id, condition, form, thenBody, elseIfs, elseBody, elseForm);
    }

    private ForStatement parseFor() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String variable = requireAttribute(open, 1, "loop variable");
        Expression from = attributeExpression(open, 2, "lower bound");
        Expression to = attributeExpression(open, 3, "upper bound");
        Expression step = open.getAttributes().get(4) != null ? attributeExpression(open, 4, "step") : null;

        BodyForm form;
        List<Statement> body;
        openTags.push(Tag.FOR);
        try {
            form = bodyForm();
            body = parseBody(form, false);
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.FOR, id, open);

        return new ForStatement(spanFrom(open), id, variable, from, to, step, form, body);
    }

    private WhileStatement parseWhile() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");

        Expression condition;
        BodyForm form;
        List<Statement> body;
        openTags.push(Tag.WHILE);
        try {
            condition = parseExpression();
            form = bodyForm();
            body = parseBody(form, false);
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.WHILE, id, open);

        return new WhileStatement(spanFrom(open), id, condition, form, body);
    }

    private DoWhileStatement parseDoWhile() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");

        List<Statement> body;
        openTags.push(Tag.DO);
        try {
            body = parseStatementBlock();
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.DO, id, open);
        Expression condition = parseExpression();

        return new DoWhileStatement(spanFrom(open), id, body, condition);
    }

    private ForeachStatement parseForeach() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String variable = requireAttribute(open, 1, "loop variable");
        String variableType = open.getAttributes().get(2);

        Expression collection;
        BodyForm form;
        List<Statement> body;
        openTags.push(Tag.FOREACH);
        try {
            collection = parseExpression();
            form = bodyForm();
            body = parseBody(form, false);
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.FOREACH, id, open);

        return new ForeachStatement(spanFrom(open), id, variable, variableType, collection, form, body);
    }

    private TryStatement parseTry() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");

        List<Statement> tryBody;
        List<CatchClause> catches = new ArrayList<>();
        List<Statement> finallyBody = null;

        openTags.push(Tag.TRY);
        try {
            tryBody = parseStatementBlock();

            while (check(Tag.CATCH)) {
                Token clause = advance();
                String exceptionType = clause.getAttributes().get(0);
                String variable = clause.getAttributes().get(1);
                Expression filter = null;
                if (check(Tag.WHEN)) {
                    advance();
                    filter = parseExpression();
                }
                List<Statement> body = parseStatementBlock();
                catches.add(new CatchClause(spanFrom(clause), exceptionType, variable, filter, body));
            }

            if (check(Tag.FINALLY)) {
                advance();
                finallyBody = parseStatementBlock();
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.TRY, id, open);

        return new TryStatement(spanFrom(open), id, tryBody, catches, finallyBody);
    }

    private CollectionOpStatement parseCollectionOp() {
        Token open = advance();
        CollectionOp operation = switch (open.getTag()) {
            case PUSH -> CollectionOp.PUSH;
            case PUT -> CollectionOp.PUT;
            case REMOVE -> CollectionOp.REMOVE;
            case SET_INDEX -> CollectionOp.SET_INDEX;
            case CLEAR -> CollectionOp.CLEAR;
            default -> CollectionOp.INSERT;
        };
        String collection = requireAttribute(open, 0, "collection");

        List<Expression> arguments = new ArrayList<>();
        for (int i = 0; i < operation.getArity(); i++) {
            arguments.add(parseExpression());
        }
        return new CollectionOpStatement(spanFrom(open), operation, collection, arguments);
    }

    private UsingStatement parseUsingStatement() {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");
        String variable = requireAttribute(open, 1, "variable");
        String variableType = open.getAttributes().get(2);

        Expression resource;
        List<Statement> body;
        openTags.push(Tag.USE);
        try {
            resource = parseExpression();
            body = parseStatementBlock();
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.USE, id, open);

        return new UsingStatement(spanFrom(open), id, variable, variableType, resource, body);
    }

    private MatchStatement parseMatchStatement() {
        Token open = peek();
        MatchExpression match = parseMatch(false);
        return new MatchStatement(spanFrom(open), match.getId(), match.getTarget(), match.getCases());
    }

    /**
     * {@code §W{id} target §K … §/W{id}}. When {@code valued}, arrow bodies that are plain
     * expressions become the case result.
     */
    private MatchExpression parseMatch(boolean valued) {
        Token open = advance();
        String id = requireAttribute(open, 0, "id");

        Expression target;
        List<MatchCase> cases = new ArrayList<>();
        openTags.push(Tag.MATCH);
        try {
            target = parseExpression();
            while (check(Tag.CASE)) {
                cases.add(parseCase(valued));
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.MATCH, id, open);

        return new MatchExpression(spanFrom(open), id, target, cases);
    }

    private MatchCase parseCase(boolean valued) {
        Token open = advance();
        Pattern pattern = parsePattern();

        Expression guard = null;
        if (check(Tag.WHEN)) {
            advance();
            guard = parseExpression();
        }

        BodyForm form = bodyForm();
        List<Statement> body;
        if (form == BodyForm.ARROW) {
            body = parseBody(form, valued);
        } else {
            openTags.push(Tag.CASE);
            try {
                body = parseStatementBlock();
            } finally {
                openTags.pop();
            }
            acceptClosing(Tag.CASE);
        }
        return new MatchCase(spanFrom(open), pattern, guard, form, body);
    }

    private BodyForm bodyForm() {
        return check(TokenKind.ARROW) ? BodyForm.ARROW : BodyForm.BLOCK;
    }

    private List<Statement> parseBody(BodyForm form, boolean valued) {
        if (form == BodyForm.BLOCK) {
            return parseStatementBlock();
        }
        advance(); // arrow

        Token token = peek();
        if (token.getKind() == TokenKind.TAG && PURE_STATEMENT_TAGS.contains(token.getTag())) {
            return List.of(parseStatement());
        }
        Expression expression = parseExpression();
        Statement statement = valued
                ? new ReturnStatement(expression.getSpan(), expression)
                : new ExpressionStatement(expression.getSpan(), expression);
        return List.of(statement);
    }

    // ---------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------

    private Pattern parsePattern() {
        Token token = peek();

        if (token.getKind() == TokenKind.IDENTIFIER) {
            advance();
            if (token.getText().equals("_")) {
                return new WildcardPattern(token.getSpan());
            }
            RelationalOperator relational = RelationalOperator.fromKeyword(token.getText());
            if (relational != null && startsExpression(peek())) {
                Expression value = parseExpression();
                return new RelationalPattern(spanFrom(token), relational, value);
            }
            return new VariablePattern(token.getSpan(), token.getText());
        }

        if (token.getKind().isLiteral()) {
            return new LiteralPattern(token.getSpan(), parseLiteral());
        }

        if (token.getKind() == TokenKind.LPAREN && peekAt(1).getKind() == TokenKind.IDENTIFIER
                && RelationalOperator.fromKeyword(peekAt(1).getText()) != null) {
            advance();
            RelationalOperator relational = RelationalOperator.fromKeyword(advance().getText());
            Expression value = parseExpression();
            expect(TokenKind.RPAREN, "')' to close the relational pattern");
            return new RelationalPattern(spanFrom(token), relational, value);
        }

        if (token.getKind() != TokenKind.TAG || !PATTERN_TAGS.contains(token.getTag())) {
            throw unexpected("a pattern");
        }

        advance();
        return switch (token.getTag()) {
            case VAR -> new VariablePattern(token.getFullSpan(), requireAttribute(token, 0, "variable name"));
            case RELATIONAL_PATTERN -> {
                String keyword = requireAttribute(token, 0, "relational operator");
                RelationalOperator relational = RelationalOperator.fromKeyword(keyword);
                if (relational == null) {
                    throw new ParseException(DiagnosticCode.UNEXPECTED_TOKEN, token.getFullSpan(),
                            "Unknown relational operator '" + keyword + "', expected gte, lte, gt or lt");
                }
                Expression value = parseExpression();
                yield new RelationalPattern(spanFrom(token), relational, value);
            }
            case SOME -> new OptionResultPattern(spanFrom(token), OptionResultVariant.SOME, parseInnerPattern());
            case NONE -> new OptionResultPattern(token.getFullSpan(), OptionResultVariant.NONE, null);
            case OK -> new OptionResultPattern(spanFrom(token), OptionResultVariant.OK, parseInnerPattern());
            case ERR -> new OptionResultPattern(spanFrom(token), OptionResultVariant.ERR, parseInnerPattern());
            case PROPERTY_PATTERN -> {
                String typeName = requireAttribute(token, 0, "type");
                List<PropertyMatch> matches = new ArrayList<>();
                while (check(Tag.PROPERTY_MATCH)) {
                    Token match = advance();
                    String property = requireAttribute(match, 0, "property");
                    Pattern inner = parsePattern();
                    matches.add(new PropertyMatch(spanFrom(match), property, inner));
                }
                yield new PropertyPattern(spanFrom(token), typeName, matches);
            }
            case POSITIONAL_PATTERN -> {
                String typeName = requireAttribute(token, 0, "type");
                List<Pattern> elements = new ArrayList<>();
                while (startsPattern()) {
                    elements.add(parsePattern());
                }
                yield new PositionalPattern(spanFrom(token), typeName, elements);
            }
            default -> {
                List<Pattern> elements = new ArrayList<>();
                String rest = null;
                while (startsPattern()) {
                    elements.add(parsePattern());
                }
                if (check(Tag.REST)) {
                    rest = requireAttribute(advance(), 0, "rest variable");
                }
                yield new ListPattern(spanFrom(token), elements, rest);
            }
        };
    }

    private Pattern parseInnerPattern() {
        if (!startsPattern()) {
            throw unexpected("a nested pattern");
        }
        return parsePattern();
    }

    private boolean startsPattern() {
        Token token = peek();
        if (token.getKind() == TokenKind.IDENTIFIER || token.getKind().isLiteral()) {
            return true;
        }
        if (token.getKind() == TokenKind.LPAREN) {
            Token next = peekAt(1);
            return next.getKind() == TokenKind.IDENTIFIER && RelationalOperator.fromKeyword(next.getText()) != null;
        }
        return token.getKind() == TokenKind.TAG && PATTERN_TAGS.contains(token.getTag());
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    public Expression parseExpression() {
        Token token = peek();

        if (token.getKind().isLiteral()) {
            return parseLiteral();
        }

        switch (token.getKind()) {
            case IDENTIFIER:
                advance();
                return referenceChain(token);
            case LPAREN:
                return parseLispForm();
            case TAG:
                break;
            default:
                throw unexpected("an expression");
        }

        return switch (token.getTag()) {
            case CALL -> parseCall();
            case NEW -> parseNew();
            case AWAIT -> {
                advance();
                String flag = token.getAttributes().get(0);
                Boolean configureAwait = flag != null ? Boolean.valueOf(flag) : null;
                Expression awaited = parseExpression();
                yield new AwaitExpression(spanFrom(token), awaited, configureAwait);
            }
            case LAMBDA -> parseLambda();
            case SOME, OK, ERR -> {
                advance();
                OptionResultVariant variant = token.getTag() == Tag.SOME ? OptionResultVariant.SOME
                        : token.getTag() == Tag.OK ? OptionResultVariant.OK : OptionResultVariant.ERR;
                Expression value = parseExpression();
                yield new OptionResultExpression(spanFrom(token), variant, value, null);
            }
            case NONE -> {
                advance();
                yield new OptionResultExpression(token.getFullSpan(), OptionResultVariant.NONE, null,
                        token.getAttributes().get(0));
            }
            case MATCH -> parseMatch(true);
            default -> throw unexpected("an expression");
        };
    }

    private LiteralExpression parseLiteral() {
        Token token = advance();
        Object value = token.getValue();
        LiteralKind kind = switch (token.getKind()) {
            case INT_LITERAL -> LiteralKind.INT;
            case FLOAT_LITERAL -> LiteralKind.FLOAT;
            case DECIMAL_LITERAL -> LiteralKind.DECIMAL;
            case STRING_LITERAL -> LiteralKind.STRING;
            case CHAR_LITERAL -> LiteralKind.CHAR;
            case BOOL_LITERAL -> LiteralKind.BOOL;
            default -> LiteralKind.NULL;
        };
        if (kind == LiteralKind.DECIMAL && !(value instanceof BigDecimal)) {
            value = new BigDecimal(String.valueOf(value));
        }
        return new LiteralExpression(token.getSpan(), kind, value);
    }

    /**
     * {@code a.b.c} becomes a reference to {@code a} with one member access per segment.
     */
    private Expression referenceChain(Token token) {
        String[] segments = token.getText().split("\\.");
        Expression expression = new ReferenceExpression(token.getSpan(), segments[0]);
        for (int i = 1; i < segments.length; i++) {
            expression = new FieldAccessExpression(token.getSpan(), expression, segments[i]);
        }
        return expression;
    }

    private Expression parseCall() {
        Token open = advance();
        String target = requireAttribute(open, 0, "call target");
        boolean fallible = target.endsWith("!");
        if (fallible) {
            target = target.substring(0, target.length() - 1);
        }

        List<Expression> arguments;
        openTags.push(Tag.CALL);
        try {
            arguments = parseArguments();
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.CALL, null, open);

        return memberSuffix(open, new CallExpression(spanFrom(open), target, fallible, arguments));
    }

    private Expression parseNew() {
        Token open = advance();
        String typeName = requireAttribute(open, 0, "type");

        List<Expression> arguments;
        openTags.push(Tag.NEW);
        try {
            arguments = parseArguments();
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.NEW, null, open);

        return memberSuffix(open, new NewExpression(spanFrom(open), typeName, arguments));
    }

    private List<Expression> parseArguments() {
        List<Expression> arguments = new ArrayList<>();
        while (check(Tag.ARG)) {
            advance();
            arguments.add(parseExpression());
        }
        return arguments;
    }

    /**
     * Optional {@code .Member} chain written directly after a closing tag.
     */
    private Expression memberSuffix(Token open, Expression expression) {
        while (check(TokenKind.DOT) && peekAt(1).getKind() == TokenKind.IDENTIFIER) {
            advance();
            Token member = advance();
            for (String segment : member.getText().split("\\.")) {
                expression = new FieldAccessExpression(spanFrom(open), expression, segment);
            }
        }
        return expression;
    }

    private LambdaExpression parseLambda() {
        Token open = advance();
        AttributeBlock attrs = open.getAttributes();
        String id = requireAttribute(open, 0, "id");

        int index = 1;
        boolean async = false;
        if ("async".equals(attrs.get(1))) {
            async = true;
            index = 2;
        }
        List<Parameter> parameters = new ArrayList<>();
        for (; index < attrs.size(); index += 2) {
            AttributePart namePart = attrs.part(index);
            String type = attrs.get(index + 1);
            if (type == null) {
                diagnostics.report(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE, namePart.getSpan(),
                        "Lambda parameter '" + namePart.getText() + "' is missing its type");
            }
            parameters.add(new Parameter(namePart.getSpan(), namePart.getText(), type));
        }

        Expression expressionBody = null;
        List<Statement> statementBody = List.of();
        openTags.push(Tag.LAMBDA);
        try {
            Token token = peek();
            if (token.getKind() == TokenKind.TAG && PURE_STATEMENT_TAGS.contains(token.getTag())) {
                statementBody = parseStatementBlock();
            } else {
                expressionBody = parseExpression();
            }
        } finally {
            openTags.pop();
        }
        expectClosing(Tag.LAMBDA, id, open);

        return new LambdaExpression(spanFrom(open), id, async, parameters, expressionBody, statementBody);
    }

    /**
     * {@code (head arg… [:mode])}: operators, word aliases and intrinsic calls.
     */
    private Expression parseLispForm() {
        Token open = advance();
        Token head = peek();
        if (head.getKind() != TokenKind.OPERATOR && head.getKind() != TokenKind.IDENTIFIER) {
            throw unexpected("an operator after '('");
        }
        advance();
        String op = head.getText();

        String castType = null;
        if (op.equals("cast")) {
            castType = readTypeName();
        }

        List<Expression> arguments = new ArrayList<>();
        Token modeToken = null;
        while (!isAtEnd() && !check(TokenKind.RPAREN)) {
            if (check(TokenKind.COLON)) {
                advance();
                modeToken = expect(TokenKind.IDENTIFIER, "a comparison mode after ':'");
            } else {
                arguments.add(parseExpression());
            }
        }
        expect(TokenKind.RPAREN, "')' to close '(" + op + "'");
        Span span = spanFrom(open);

        ComparisonMode mode = null;
        if (modeToken != null) {
            mode = ComparisonMode.fromKeyword(modeToken.getText());
            if (mode == null) {
                List<String> keywords = new ArrayList<>();
                for (ComparisonMode m : ComparisonMode.values()) {
                    keywords.add(m.getKeyword());
                }
                String closest = FuzzyMatcher.findClosest(modeToken.getText(), keywords);
                diagnostics.report(DiagnosticCode.INVALID_COMPARISON_MODE, modeToken.getSpan(),
                        "Unknown comparison mode '" + modeToken.getText() + "'",
                        closest != null ? "Did you mean ':" + closest + "'?" : null);
            }
        }

        switch (op) {
            case "?":
                checkArity(op, arguments, 3, 3, span);
                return new ConditionalExpression(span, arguments.get(0), arguments.get(1), arguments.get(2));
            case "cast":
                checkArity(op, arguments, 1, 1, span);
                return new CastExpression(span, castType, arguments.get(0));
            case "unchecked":
                checkArity(op, arguments, 1, 1, span);
                return new UncheckedExpression(span, arguments.get(0));
            case "unwrap":
                checkArity(op, arguments, 1, 1, span);
                return new UnwrapExpression(span, arguments.get(0), null);
            case "unwrap-or":
                checkArity(op, arguments, 2, 2, span);
                return new UnwrapExpression(span, arguments.get(0), arguments.get(1));
            default:
                break;
        }

        UnaryOperator unary = UnaryOperator.fromSpelling(op);
        BinaryOperator binary = BinaryOperator.fromSpelling(op);
        if (unary != null && (binary == null || arguments.size() == 1)) {
            checkArity(op, arguments, 1, 1, span);
            return new UnaryExpression(span, unary, arguments.get(0));
        }
        if (binary != null) {
            checkArity(op, arguments, 2, Integer.MAX_VALUE, span);
            Expression result = arguments.get(0);
            for (int i = 1; i < arguments.size(); i++) {
                result = new BinaryExpression(span, binary, result, arguments.get(i));
            }
            return result;
        }

        StringOp stringOp = StringOp.fromName(op);
        if (stringOp != null) {
            checkArity(op, arguments, stringOp.getMinArgs(), stringOp.getMaxArgs(), span);
            if (mode != null && !stringOp.isComparisonModeSupported()) {
                diagnostics.report(DiagnosticCode.INVALID_COMPARISON_MODE, modeToken.getSpan(),
                        "'" + op + "' does not take a comparison mode");
                mode = null;
            }
            return new StringOpExpression(span, stringOp, arguments, mode);
        }

        CharOp charOp = CharOp.fromName(op);
        if (charOp != null) {
            checkArity(op, arguments, charOp.getArity(), charOp.getArity(), span);
            return new CharOpExpression(span, charOp, arguments);
        }

        BuilderOp builderOp = BuilderOp.fromName(op);
        if (builderOp != null) {
            checkArity(op, arguments, builderOp.getMinArgs(), builderOp.getMaxArgs(), span);
            return new BuilderOpExpression(span, builderOp, arguments);
        }

        String closest = FuzzyMatcher.findClosest(op, knownOperators());
        throw new ParseException(DiagnosticCode.UNEXPECTED_TOKEN, head.getSpan(), "Unknown operator '" + op + "'",
                closest != null ? "Did you mean '" + closest + "'?" : null);
    }

    private void checkArity(String op, List<Expression> arguments, int min, int max, Span span) {
        int count = arguments.size();
        if (count >= min && count <= max) {
            return;
        }
        String expected;
        if (min == max) {
            expected = String.valueOf(min);
        } else if (max == Integer.MAX_VALUE) {
            expected = "at least " + min;
        } else {
            expected = min + " to " + max;
        }
        throw new ParseException(DiagnosticCode.OPERATOR_ARGUMENT_COUNT, span,
                "'" + op + "' expects " + expected + " argument(s) but got " + count);
    }

    private static Set<String> knownOperators() {
        Set<String> names = new LinkedHashSet<>();
        names.addAll(BinaryOperator.spellings());
        names.addAll(UnaryOperator.spellings());
        names.addAll(StringOp.names());
        names.addAll(CharOp.names());
        names.addAll(BuilderOp.names());
        names.addAll(List.of("?", "cast", "unchecked", "unwrap", "unwrap-or"));
        return names;
    }

    /**
     * Type written inline in a Lisp form, e.g. {@code (cast i32 x)} or {@code (cast List<str> xs)}.
     */
    private String readTypeName() {
        StringBuilder type = new StringBuilder();
        if (peek().isOperator("?")) {
            type.append(advance().getText());
        }
        type.append(expect(TokenKind.IDENTIFIER, "a type name").getText());

        if (peek().isOperator("<")) {
            advance();
            type.append('<');
            int depth = 1;
            while (depth > 0 && !isAtEnd()) {
                Token token = advance();
                if (token.isOperator("<")) {
                    depth++;
                } else if (token.isOperator(">")) {
                    depth--;
                } else if (token.isOperator(">>")) {
                    depth -= 2;
                }
                type.append(token.getText());
            }
        }
        while (check(TokenKind.LBRACKET) && peekAt(1).getKind() == TokenKind.RBRACKET) {
            advance();
            advance();
            type.append("[]");
        }
        if (peek().isOperator("!") && peekAt(1).getKind() == TokenKind.IDENTIFIER) {
            advance();
            type.append('!').append(readTypeName());
        }
        return type.toString();
    }

    /**
     * Expression written inside an attribute part, such as a loop bound.
     * It is lexed on its own with positions mapped back into the file.
     */
    private Expression attributeExpression(Token owner, int index, String what) {
        AttributePart part = owner.getAttributes().part(index);
        if (part == null || part.getText().isBlank()) {
            throw new ParseException(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE, owner.getFullSpan(),
                    owner.describe() + " is missing its " + what);
        }
        Span at = part.getSpan();
        List<Token> partTokens = new CalorLexer(part.getText(), diagnostics, at.getOffset(), at.getLine(),
                at.getColumn()).tokenize();
        CalorParser sub = new CalorParser(partTokens, diagnostics);
        Expression expression = sub.parseExpression();
        if (!sub.isAtEnd()) {
            throw new ParseException(DiagnosticCode.UNEXPECTED_TOKEN, sub.peek().getSpan(),
                    "Unexpected " + sub.peek().describe() + " in the " + what + " of " + owner.describe());
        }
        return expression;
    }

    // ---------------------------------------------------------------------
    // Closing tags and IDs
    // ---------------------------------------------------------------------

    /**
     * Consumes the closing tag for {@code tag}. A missing closing tag is reported without
     * consuming anything; an ID that differs from {@code openId} gets a fix that rewrites
     * only the closing ID.
     */
    private void expectClosing(Tag tag, String openId, Token open) {
        if (!checkClosing(tag)) {
            Token found = peek();
            String expected = "§/" + tag.getClosingName() + (openId != null ? "{" + openId + "}" : "");
            diagnostics.report(DiagnosticCode.UNEXPECTED_TOKEN, found.getSpan(),
                    "Expected '" + expected + "' to close '" + open.describe() + "' opened at line "
                            + open.getLine() + " but found " + found.describe());
            return;
        }

        Token close = advance();
        if (openId == null || openId.isEmpty()) {
            return;
        }

        AttributeBlock attrs = close.getAttributes();
        String closeId = attrs.get(0);
        if (openId.equals(closeId)) {
            return;
        }

        TextEdit edit;
        String message;
        if (closeId == null) {
            message = "Closing tag '" + close.describe() + "' is missing ID '" + openId + "'";
            edit = attrs.isPresent()
                    ? TextEdit.replace(attrs.getSpan(), "{" + openId + "}")
                    : TextEdit.insert(close.getSpan().getEndLine(), close.getSpan().getEndColumn(),
                            "{" + openId + "}");
        } else {
            message = "Closing ID '" + closeId + "' does not match opening ID '" + openId + "' of '"
                    + open.describe() + "' at line " + open.getLine();
            edit = TextEdit.replace(attrs.part(0).getSpan(), openId);
        }
        Fix fix = Fix.builder()
                .description("Change the closing ID to '" + openId + "'")
                .edit(edit)
                .build();
        diagnostics.reportWithFix(DiagnosticCode.ID_MISMATCH, close.getFullSpan(), message, fix);
    }

    private void acceptClosing(Tag tag) {
        if (checkClosing(tag)) {
            advance();
        }
    }

    private String requireAttribute(Token token, int index, String what) {
        String value = token.getAttributes().get(index);
        if (value == null) {
            diagnostics.report(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE, token.getFullSpan(),
                    token.describe() + " is missing its " + what);
            return "";
        }
        return value;
    }

    private Visibility parseVisibility(Token token, int index) {
        return parseVisibility(token, index, Visibility.PRIVATE);
    }

    private Visibility parseVisibility(Token token, int index, Visibility fallback) {
        String text = token.getAttributes().get(index);
        if (text == null) {
            return fallback;
        }
        Visibility visibility = Visibility.fromText(text);
        if (visibility == null) {
            diagnostics.report(DiagnosticCode.UNEXPECTED_TOKEN, token.getAttributes().part(index).getSpan(),
                    "Unknown visibility '" + text + "', expected pub, pri, pro or int");
            return fallback;
        }
        return visibility;
    }

    private static List<String> attributeTexts(Token token) {
        List<String> texts = new ArrayList<>();
        for (AttributePart part : token.getAttributes().getParts()) {
            texts.add(part.getText());
        }
        return texts;
    }

    private static List<String> splitList(String text) {
        List<String> items = new ArrayList<>();
        if (text == null) {
            return items;
        }
        for (String item : text.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static String unquote(String text) {
        if (text != null && text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1).replace("\\\"", "\"");
        }
        return text;
    }

    // ---------------------------------------------------------------------
    // Recovery
    // ---------------------------------------------------------------------

    private void report(ParseException e) {
        diagnostics.report(e.getCode(), e.getSpan(), e.getMessage(), e.getSuggestion());
    }

    /**
     * Skips to the next tag where parsing can resume at the same or a shallower depth.
     * Always moves past the token that caused the error when nothing was consumed.
     */
    private void synchronize(int errorStart, boolean declarationLevel) {
        if (pos == errorStart && !isAtEnd()) {
            advance();
        }
        int depth = 0;
        while (!isAtEnd()) {
            Token token = peek();
            if (depth == 0 && isResumePoint(token, declarationLevel)) {
                return;
            }
            if (token.getKind() == TokenKind.TAG && token.getTag().isRequiresClose()) {
                depth++;
            } else if (token.getKind() == TokenKind.CLOSING_TAG && token.getTag().isRequiresClose() && depth > 0) {
                depth--;
            }
            advance();
        }
    }

    private boolean isResumePoint(Token token, boolean declarationLevel) {
        if (token.getKind() == TokenKind.CLOSING_TAG) {
            return openTags.contains(token.getTag());
        }
        if (token.getKind() != TokenKind.TAG) {
            return false;
        }
        Tag tag = token.getTag();
        if (DECLARATION_TAGS.contains(tag) || tag == Tag.INVARIANT) {
            return true;
        }
        if (declarationLevel) {
            return false;
        }
        return PURE_STATEMENT_TAGS.contains(tag) || EXPRESSION_TAGS.contains(tag) || CLAUSE_TAGS.contains(tag);
    }

    private boolean atBlockEnd() {
        Token token = peek();
        if (token.getKind() == TokenKind.CLOSING_TAG) {
            return openTags.contains(token.getTag());
        }
        if (token.getKind() == TokenKind.TAG) {
            return DECLARATION_TAGS.contains(token.getTag()) || CLAUSE_TAGS.contains(token.getTag());
        }
        return false;
    }

    /**
     * True at a closing tag that belongs to a construct further out than the innermost one.
     */
    private boolean atEnclosingClose() {
        Token token = peek();
        return token.getKind() == TokenKind.CLOSING_TAG && openTags.contains(token.getTag())
                && openTags.peek() != token.getTag();
    }

    private boolean startsStatement(Token token) {
        if (token.getKind() == TokenKind.LPAREN) {
            return true;
        }
        return token.getKind() == TokenKind.TAG
                && (PURE_STATEMENT_TAGS.contains(token.getTag()) || EXPRESSION_TAGS.contains(token.getTag()));
    }

    private boolean startsExpression(Token token) {
        TokenKind kind = token.getKind();
        if (kind.isLiteral() || kind == TokenKind.IDENTIFIER || kind == TokenKind.LPAREN) {
            return true;
        }
        return kind == TokenKind.TAG && EXPRESSION_TAGS.contains(token.getTag());
    }

    // ---------------------------------------------------------------------
    // Token cursor
    // ---------------------------------------------------------------------

    private ParseException unexpected(String expected) {
        Token token = peek();
        String suggestion = null;
        if (token.getKind() == TokenKind.IDENTIFIER && expected.equals("a statement")) {
            suggestion = "Statements start with a tag such as '§B', '§R' or '§C'";
        }
        return new ParseException(DiagnosticCode.UNEXPECTED_TOKEN, token.getFullSpan(),
                "Expected " + expected + " but found " + token.describe(), suggestion);
    }

    private Span spanFrom(Token start) {
        return start.getSpan().union(previous().getFullSpan());
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(Math.max(pos - 1, 0));
    }

    private boolean isAtEnd() {
        return peek().getKind() == TokenKind.EOF;
    }

    private boolean check(TokenKind kind) {
        return peek().getKind() == kind;
    }

    private boolean check(Tag tag) {
        return peek().isTag(tag);
    }

    private boolean checkClosing(Tag tag) {
        return peek().isClosing(tag);
    }

    private Token advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private Token expect(TokenKind kind, String what) {
        if (check(kind)) {
            return advance();
        }
        throw unexpected(what);
    }
}
