package com.calor.compiler.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.codegen.calor.CalorEmitter;
import com.calor.compiler.diagnostics.DiagnosticBag;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.FuzzyMatcher;
import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.EffectSet;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.decl.ClassDeclaration;
import com.calor.compiler.model.decl.ConstructorDeclaration;
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
import com.calor.compiler.model.expr.AwaitExpression;
import com.calor.compiler.model.expr.BinaryExpression;
import com.calor.compiler.model.expr.BinaryOperator;
import com.calor.compiler.model.expr.BuilderOpExpression;
import com.calor.compiler.model.expr.CallExpression;
import com.calor.compiler.model.expr.CastExpression;
import com.calor.compiler.model.expr.CharOpExpression;
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
import com.calor.compiler.model.pattern.RelationalPattern;
import com.calor.compiler.model.pattern.VariablePattern;
import com.calor.compiler.model.stmt.AssignStatement;
import com.calor.compiler.model.stmt.BindStatement;
import com.calor.compiler.model.stmt.CatchClause;
import com.calor.compiler.model.stmt.CollectionOpStatement;
import com.calor.compiler.model.stmt.DoWhileStatement;
import com.calor.compiler.model.stmt.ElseIfClause;
import com.calor.compiler.model.stmt.ExpressionStatement;
import com.calor.compiler.model.stmt.ForStatement;
import com.calor.compiler.model.stmt.ForeachStatement;
import com.calor.compiler.model.stmt.IfStatement;
import com.calor.compiler.model.stmt.MatchStatement;
import com.calor.compiler.model.stmt.PrintStatement;
import com.calor.compiler.model.stmt.ReturnStatement;
import com.calor.compiler.model.stmt.Statement;
import com.calor.compiler.model.stmt.ThrowStatement;
import com.calor.compiler.model.stmt.TryStatement;
import com.calor.compiler.model.stmt.UsingStatement;
import com.calor.compiler.model.stmt.WhileStatement;
import com.calor.compiler.prover.ContractProposition;

/**
 * Name resolution, typing and contract checks over a parsed module.
 *
 * Diagnostics accumulate; nothing here throws on bad input, so every sibling declaration
 * is checked in the same pass. Expression types are recorded in the returned
 * {@link SemanticModel} for the emitters.
 */
public class SemanticChecker {
    private static final Logger log = LoggerFactory.getLogger(SemanticChecker.class);

    private final DiagnosticBag diagnostics;
    private final TypeResolver types = new TypeResolver();
    private final IdRegistry ids;
    private final Map<Expression, CalorType> expressionTypes = new IdentityHashMap<>();
    private final List<ContractProposition> propositions = new ArrayList<>();

    /** Record and union-case fields by type name, for member and pattern typing. */
    private final Map<String, List<Parameter>> structFields = new HashMap<>();

    private final Deque<ReturnTarget> returnTargets = new ArrayDeque<>();
    private boolean inPrecondition = false;

    public SemanticChecker(DiagnosticBag diagnostics) {
        this.diagnostics = diagnostics;
        this.ids = new IdRegistry(diagnostics);
    }

    public SemanticModel check(ModuleDeclaration module) {
        ids.register(module.getId(), module.getSpan(), "module '" + module.getName() + "'");

        Scope moduleScope = new Scope(null);
        declareMembers(module.getMembers(), moduleScope);

        for (Declaration member : module.getMembers()) {
            checkDeclaration(member, moduleScope);
        }
        for (ContractClause invariant : module.getInvariants()) {
            checkCondition(invariant.getCondition(), moduleScope, "module invariant");
        }

        log.debug("Checked module {}: {} typed expressions, {} contract propositions",
                module.getName(), expressionTypes.size(), propositions.size());
        return new SemanticModel(expressionTypes, propositions);
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private void declareMembers(List<Declaration> members, Scope scope) {
        for (Declaration member : members) {
            switch (member.kind()) {
                case FUNCTION -> {
                    FunctionDeclaration function = (FunctionDeclaration) member;
                    List<CalorType> parameterTypes = new ArrayList<>();
                    for (Parameter parameter : function.getParameters()) {
                        parameterTypes.add(types.resolve(parameter.getType()));
                    }
                    Symbol symbol = Symbol.function(function.getName(), parameterTypes,
                            returnTypeOf(function.getReturnType()), function.getSpan());
                    Symbol existing = scope.define(symbol);
                    // Overloads by arity are allowed
                    if (existing != null && (existing.getKind() != Symbol.Kind.FUNCTION
                            || existing.getParameterTypes().size() == parameterTypes.size())) {
                        reportRedeclaration(function.getName(), function.getSpan(), existing);
                    }
                }
                case FIELD, PROPERTY, EVENT -> {
                    CalorType type = switch (member.kind()) {
                        case FIELD -> types.resolve(((FieldDeclaration) member).getType());
                        case PROPERTY -> types.resolve(((PropertyDeclaration) member).getType());
                        default -> CalorType.named(((EventDeclaration) member).getDelegateType());
                    };
                    define(scope, Symbol.variable(member.getName(), Symbol.Kind.FIELD, type, true, member.getSpan()));
                }
                case CONSTRUCTOR -> {
                    // constructors share the class name and are not looked up by name
                }
                default -> {
                    if (member instanceof RecordDeclaration record) {
                        structFields.put(record.getName(), record.getFields());
                    } else if (member instanceof UnionTypeDeclaration union) {
                        for (UnionCase unionCase : union.getCases()) {
                            structFields.put(unionCase.getName(), unionCase.getFields());
                        }
                    }
                    define(scope, Symbol.variable(member.getName(), Symbol.Kind.TYPE,
                            CalorType.named(member.getName()), false, member.getSpan()));
                }
            }
        }
    }

    private void checkDeclaration(Declaration declaration, Scope scope) {
        switch (declaration.kind()) {
            case MODULE -> {
                ModuleDeclaration nested = (ModuleDeclaration) declaration;
                ids.register(nested.getId(), nested.getSpan(), "module '" + nested.getName() + "'");
            }
            case FUNCTION -> checkFunction((FunctionDeclaration) declaration, scope);
            case CLASS -> checkClass((ClassDeclaration) declaration, scope);
            case INTERFACE -> {
                InterfaceDeclaration iface = (InterfaceDeclaration) declaration;
                ids.register(iface.getId(), iface.getSpan(), "interface '" + iface.getName() + "'");
                for (FunctionDeclaration method : iface.getMethods()) {
                    checkFunction(method, scope);
                }
            }
            case ENUM -> checkEnum((EnumDeclaration) declaration);
            case ENUM_EXTENSION -> {
                EnumExtensionDeclaration extension = (EnumExtensionDeclaration) declaration;
                ids.register(extension.getId(), extension.getSpan(),
                        "enum extension for '" + extension.getEnumName() + "'");
                for (FunctionDeclaration method : extension.getMethods()) {
                    checkFunction(method, scope);
                }
            }
            case RECORD -> {
                RecordDeclaration record = (RecordDeclaration) declaration;
                ids.register(record.getId(), record.getSpan(), "record '" + record.getName() + "'");
                checkFieldNames(record.getFields());
            }
            case UNION -> {
                UnionTypeDeclaration union = (UnionTypeDeclaration) declaration;
                ids.register(union.getId(), union.getSpan(), "union '" + union.getName() + "'");
                Scope cases = new Scope(null);
                for (UnionCase unionCase : union.getCases()) {
                    define(cases, Symbol.variable(unionCase.getName(), Symbol.Kind.TYPE,
                            CalorType.named(unionCase.getName()), false, unionCase.getSpan()));
                    checkFieldNames(unionCase.getFields());
                }
            }
            case FIELD -> {
                FieldDeclaration field = (FieldDeclaration) declaration;
                if (field.getInitializer() != null) {
                    CalorType valueType = checkExpression(field.getInitializer(), scope);
                    checkAssignable(types.resolve(field.getType()), field.getInitializer(), valueType,
                            "field '" + field.getName() + "'");
                }
            }
            case PROPERTY -> checkProperty((PropertyDeclaration) declaration, scope);
            case CONSTRUCTOR -> checkConstructor((ConstructorDeclaration) declaration, scope);
            case DELEGATE -> {
                DelegateDeclaration delegate = (DelegateDeclaration) declaration;
                ids.register(delegate.getId(), delegate.getSpan(), "delegate '" + delegate.getName() + "'");
                checkEffects(delegate.getEffects(), delegate.getSpan());
            }
            case EVENT -> {
                EventDeclaration event = (EventDeclaration) declaration;
                ids.register(event.getId(), event.getSpan(), "event '" + event.getName() + "'");
            }
        }
    }

    private void checkFunction(FunctionDeclaration function, Scope parent) {
        ids.register(function.getId(), function.getSpan(), "function '" + function.getName() + "'");
        checkEffects(function.getEffects(), function.getSpan());

        Scope scope = parent.child();
        Map<String, String> parameterTypes = declareParameters(function.getParameters(), scope);
        CalorType returnType = returnTypeOf(function.getReturnType());

        checkPreconditions(function.getPreconditions(), scope, function.getId(), function.getName(), parameterTypes);

        Scope postScope = scope.child();
        Map<String, String> postTypes = new LinkedHashMap<>(parameterTypes);
        if (returnType.getKind() != CalorType.Kind.VOID) {
            postScope.define(Symbol.variable("result", Symbol.Kind.CONTRACT_RESULT, returnType, false,
                    function.getSpan()));
            postTypes.put("result", returnType.toString());
        }
        for (ContractClause clause : function.getPostconditions()) {
            checkCondition(clause.getCondition(), postScope, "postcondition");
            export(clause, function.getId(), function.getName(), postTypes);
        }

        returnTargets.push(ReturnTarget.declared(returnType));
        try {
            checkStatements(function.getBody(), scope);
        } finally {
            returnTargets.pop();
        }
    }

    private void checkClass(ClassDeclaration declaration, Scope parent) {
        ids.register(declaration.getId(), declaration.getSpan(), "class '" + declaration.getName() + "'");

        Scope classScope = parent.child();
        declareMembers(declaration.getMembers(), classScope);

        for (ContractClause invariant : declaration.getInvariants()) {
            checkCondition(invariant.getCondition(), classScope, "class invariant");
            export(invariant, declaration.getId(), declaration.getName(), Map.of());
        }
        for (Declaration member : declaration.getMembers()) {
            checkDeclaration(member, classScope);
        }
    }

    private void checkProperty(PropertyDeclaration property, Scope classScope) {
        ids.register(property.getId(), property.getSpan(), "property '" + property.getName() + "'");
        CalorType type = types.resolve(property.getType());

        for (PropertyAccessor accessor : property.getAccessors()) {
            Scope scope = classScope.child();
            CalorType accessorReturn = CalorType.VOID;
            if (accessor.getAccessorKind() == PropertyAccessor.Kind.GET) {
                accessorReturn = type;
            } else {
                scope.define(Symbol.variable("value", Symbol.Kind.PARAMETER, type, false, accessor.getSpan()));
            }
            returnTargets.push(ReturnTarget.declared(accessorReturn));
            try {
                checkStatements(accessor.getBody(), scope);
            } finally {
                returnTargets.pop();
            }
        }

        if (property.getDefaultValue() != null) {
            CalorType valueType = checkExpression(property.getDefaultValue(), classScope);
            checkAssignable(type, property.getDefaultValue(), valueType, "property '" + property.getName() + "'");
        }
    }

    private void checkConstructor(ConstructorDeclaration constructor, Scope classScope) {
        ids.register(constructor.getId(), constructor.getSpan(), "constructor of '" + constructor.getName() + "'");

        Scope scope = classScope.child();
        Map<String, String> parameterTypes = declareParameters(constructor.getParameters(), scope);
        checkPreconditions(constructor.getPreconditions(), scope, constructor.getId(), constructor.getName(),
                parameterTypes);

        if (constructor.getInitializer() != null) {
            for (Expression argument : constructor.getInitializer().getArguments()) {
                checkExpression(argument, scope);
            }
        }

        returnTargets.push(ReturnTarget.declared(CalorType.VOID));
        try {
            checkStatements(constructor.getBody(), scope);
        } finally {
            returnTargets.pop();
        }
    }

    private void checkEnum(EnumDeclaration declaration) {
        ids.register(declaration.getId(), declaration.getSpan(), "enum '" + declaration.getName() + "'");
        Scope members = new Scope(null);
        for (EnumMember member : declaration.getMembers()) {
            define(members, Symbol.variable(member.getName(), Symbol.Kind.FIELD,
                    CalorType.named(declaration.getName()), false, member.getSpan()));
        }
    }

    private void checkFieldNames(List<Parameter> fields) {
        Scope scope = new Scope(null);
        for (Parameter field : fields) {
            define(scope, Symbol.variable(field.getName(), Symbol.Kind.FIELD, types.resolve(field.getType()),
                    false, field.getSpan()));
        }
    }

    private Map<String, String> declareParameters(List<Parameter> parameters, Scope scope) {
        Map<String, String> parameterTypes = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            CalorType type = types.resolve(parameter.getType());
            define(scope, Symbol.variable(parameter.getName(), Symbol.Kind.PARAMETER, type, false,
                    parameter.getSpan()));
            parameterTypes.put(parameter.getName(), type.toString());
        }
        return parameterTypes;
    }

    /**
     * Requires-clauses see the parameters only; {@code result} is not in scope.
     */
    private void checkPreconditions(List<ContractClause> clauses, Scope scope, String ownerId, String ownerName,
            Map<String, String> parameterTypes) {
        for (ContractClause clause : clauses) {
            inPrecondition = true;
            try {
                checkCondition(clause.getCondition(), scope, "precondition");
            } finally {
                inPrecondition = false;
            }
            export(clause, ownerId, ownerName, parameterTypes);
        }
    }

    private void export(ContractClause clause, String ownerId, String ownerName, Map<String, String> parameterTypes) {
        propositions.add(ContractProposition.builder()
                .functionId(ownerId)
                .functionName(ownerName)
                .kind(clause.getKind())
                .conditionText(new CalorEmitter().formatExpression(clause.getCondition()))
                .condition(clause.getCondition())
                .parameterTypes(parameterTypes)
                .span(clause.getSpan())
                .build());
    }

    private void checkEffects(EffectSet effects, Span span) {
        for (String code : effects.getCodes()) {
            if (!EffectSet.KNOWN_CODES.contains(code)) {
                String closest = FuzzyMatcher.findClosest(code, EffectSet.KNOWN_CODES);
                diagnostics.report(DiagnosticCode.UNKNOWN_EFFECT, span, "Unknown effect '" + code + "'",
                        closest != null ? "Did you mean '" + closest + "'?" : null);
            }
        }
    }

    private CalorType returnTypeOf(String text) {
        return text == null ? CalorType.VOID : types.resolve(text);
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    private void checkStatements(List<Statement> statements, Scope scope) {
        for (Statement statement : statements) {
            checkStatement(statement, scope);
        }
    }

    private void checkStatement(Statement statement, Scope scope) {
        switch (statement.kind()) {
            case BIND -> checkBind((BindStatement) statement, scope);
            case ASSIGN -> {
                AssignStatement assign = (AssignStatement) statement;
                CalorType targetType = checkExpression(assign.getTarget(), scope);
                CalorType valueType = checkExpression(assign.getValue(), scope);
                checkAssignable(targetType, assign.getValue(), valueType, "assignment");
            }
            case RETURN -> checkReturn((ReturnStatement) statement, scope);
            case IF -> {
                IfStatement ifStatement = (IfStatement) statement;
                checkCondition(ifStatement.getCondition(), scope, "if condition");
                checkStatements(ifStatement.getThenBody(), scope.child());
                for (ElseIfClause clause : ifStatement.getElseIfs()) {
                    checkCondition(clause.getCondition(), scope, "else-if condition");
                    checkStatements(clause.getBody(), scope.child());
                }
                if (ifStatement.getElseBody() != null) {
                    checkStatements(ifStatement.getElseBody(), scope.child());
                }
            }
            case FOR -> checkFor((ForStatement) statement, scope);
            case WHILE -> {
                WhileStatement loop = (WhileStatement) statement;
                checkCondition(loop.getCondition(), scope, "while condition");
                checkStatements(loop.getBody(), scope.child());
            }
            case DO_WHILE -> {
                DoWhileStatement loop = (DoWhileStatement) statement;
                checkStatements(loop.getBody(), scope.child());
                checkCondition(loop.getCondition(), scope, "do-while condition");
            }
            case FOREACH -> checkForeach((ForeachStatement) statement, scope);
            case TRY -> checkTry((TryStatement) statement, scope);
            case THROW -> checkExpression(((ThrowStatement) statement).getException(), scope);
            case RETHROW, BREAK, CONTINUE -> {
                // nothing to resolve
            }
            case PRINT -> checkExpression(((PrintStatement) statement).getValue(), scope);
            case COLLECTION_OP -> checkCollectionOp((CollectionOpStatement) statement, scope);
            case MATCH -> {
                MatchStatement match = (MatchStatement) statement;
                checkMatch(match.getTarget(), match.getCases(), match.getSpan(), scope, false);
            }
            case EXPRESSION -> checkExpression(((ExpressionStatement) statement).getExpression(), scope);
            case USING -> {
                UsingStatement using = (UsingStatement) statement;
                CalorType resourceType = checkExpression(using.getResource(), scope);
                Scope inner = scope.child();
                CalorType variableType = using.getVariableType() != null
                        ? types.resolve(using.getVariableType()) : resourceType;
                define(inner, Symbol.variable(using.getVariable(), Symbol.Kind.LOCAL, variableType, false,
                        using.getSpan()));
                checkStatements(using.getBody(), inner);
            }
        }
    }

    private void checkBind(BindStatement bind, Scope scope) {
        CalorType valueType = checkExpression(bind.getValue(), scope);
        CalorType type = valueType;
        if (bind.getType() != null) {
            type = types.resolve(bind.getType());
            checkAssignable(type, bind.getValue(), valueType, "binding '" + bind.getName() + "'");
        } else if (valueType.getKind() == CalorType.Kind.VOID) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, bind.getSpan(),
                    "Cannot bind '" + bind.getName() + "' to an expression that returns no value");
        }
        define(scope, Symbol.variable(bind.getName(), Symbol.Kind.LOCAL, type, bind.isMutable(), bind.getSpan()));
    }

    private void checkReturn(ReturnStatement statement, Scope scope) {
        Expression value = statement.getValue();
        CalorType valueType = value != null ? checkExpression(value, scope) : CalorType.VOID;

        ReturnTarget target = returnTargets.peek();
        if (target == null) {
            return;
        }
        if (target.collected != null) {
            target.collected.add(valueType);
            return;
        }

        CalorType expected = target.expected;
        if (value == null) {
            if (expected.getKind() != CalorType.Kind.VOID && !expected.isUnknown()) {
                diagnostics.report(DiagnosticCode.TYPE_MISMATCH, statement.getSpan(),
                        "Missing return value of type " + expected);
            }
        } else if (expected.getKind() == CalorType.Kind.VOID) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, statement.getSpan(),
                    "Cannot return a value from a function without an output type");
        } else {
            checkAssignable(expected, value, valueType, "return value");
        }
    }

    private void checkFor(ForStatement loop, Scope scope) {
        CalorType fromType = checkBound(loop.getFrom(), scope, "lower bound");
        checkBound(loop.getTo(), scope, "upper bound");
        if (loop.getStep() != null) {
            checkBound(loop.getStep(), scope, "step");
        }

        Scope loopScope = scope.child();
        CalorType variableType = fromType.isNumeric() ? fromType : CalorType.I32;
        define(loopScope, Symbol.variable(loop.getVariable(), Symbol.Kind.LOCAL, variableType, true, loop.getSpan()));
        checkStatements(loop.getBody(), loopScope);
    }

    private CalorType checkBound(Expression bound, Scope scope, String what) {
        CalorType type = checkExpression(bound, scope);
        if (type.isWrapper()) {
            reportImplicitUnwrap(bound, type, "for-loop " + what);
        } else if (!type.isNumeric() && !type.isUnknown()) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, bound.getSpan(),
                    "For-loop " + what + " must be numeric but is " + type);
        }
        return type;
    }

    private void checkForeach(ForeachStatement loop, Scope scope) {
        CalorType collectionType = checkExpression(loop.getCollection(), scope);
        CalorType elementType = switch (collectionType.getKind()) {
            case LIST, ARRAY -> collectionType.payload();
            case STRING -> CalorType.CHAR;
            default -> CalorType.UNKNOWN;
        };
        if (loop.getVariableType() != null) {
            elementType = types.resolve(loop.getVariableType());
        }
        Scope loopScope = scope.child();
        define(loopScope, Symbol.variable(loop.getVariable(), Symbol.Kind.LOCAL, elementType, false, loop.getSpan()));
        checkStatements(loop.getBody(), loopScope);
    }

    private void checkTry(TryStatement statement, Scope scope) {
        checkStatements(statement.getTryBody(), scope.child());
        for (CatchClause clause : statement.getCatches()) {
            Scope catchScope = scope.child();
            if (clause.getVariable() != null) {
                String exceptionType = clause.getExceptionType() != null ? clause.getExceptionType() : "Exception";
                define(catchScope, Symbol.variable(clause.getVariable(), Symbol.Kind.LOCAL,
                        CalorType.named(exceptionType), false, clause.getSpan()));
            }
            if (clause.getFilter() != null) {
                checkCondition(clause.getFilter(), catchScope, "catch filter");
            }
            checkStatements(clause.getBody(), catchScope);
        }
        if (statement.getFinallyBody() != null) {
            checkStatements(statement.getFinallyBody(), scope.child());
        }
    }

    private void checkCollectionOp(CollectionOpStatement statement, Scope scope) {
        String root = statement.getCollection().split("\\.")[0];
        Symbol symbol = scope.lookup(root);
        if (symbol == null && !isExternalName(root)) {
            reportUndefined(root, statement.getSpan(), scope);
        }
        for (Expression argument : statement.getArguments()) {
            checkExpression(argument, scope);
        }
    }

    // ---------------------------------------------------------------------
    // Match
    // ---------------------------------------------------------------------

    /**
     * Checks cases in order; a valued match returns the type of its first typed case.
     */
    private CalorType checkMatch(Expression target, List<MatchCase> cases, Span span, Scope scope, boolean valued) {
        CalorType targetType = checkExpression(target, scope);

        boolean catchAll = false;
        List<CalorType> caseTypes = new ArrayList<>();
        for (MatchCase matchCase : cases) {
            if (catchAll) {
                diagnostics.report(DiagnosticCode.UNREACHABLE_PATTERN, matchCase.getSpan(),
                        "Case is unreachable: an earlier case already matches every value");
            }

            Scope caseScope = scope.child();
            bindPattern(matchCase.getPattern(), targetType, caseScope);
            if (matchCase.getGuard() != null) {
                checkCondition(matchCase.getGuard(), caseScope, "match guard");
            }

            if (valued) {
                ReturnTarget collecting = ReturnTarget.collecting();
                returnTargets.push(collecting);
                try {
                    checkStatements(matchCase.getBody(), caseScope);
                } finally {
                    returnTargets.pop();
                }
                caseTypes.addAll(collecting.collected);
            } else {
                checkStatements(matchCase.getBody(), caseScope);
            }

            if (matchCase.getGuard() == null && matchCase.getPattern().isIrrefutable()) {
                catchAll = true;
            }
        }

        if (!catchAll && !coversAllVariants(cases, targetType)) {
            diagnostics.report(DiagnosticCode.NON_EXHAUSTIVE_MATCH, span,
                    "Match has no wildcard or catch-all case; unmatched values will throw at runtime");
        }

        for (CalorType type : caseTypes) {
            if (!type.isUnknown()) {
                return type;
            }
        }
        return CalorType.UNKNOWN;
    }

    private boolean coversAllVariants(List<MatchCase> cases, CalorType targetType) {
        boolean some = false;
        boolean none = false;
        boolean ok = false;
        boolean err = false;
        boolean isTrue = false;
        boolean isFalse = false;
        for (MatchCase matchCase : cases) {
            if (matchCase.getGuard() != null) {
                continue;
            }
            Pattern pattern = matchCase.getPattern();
            if (pattern instanceof OptionResultPattern variant) {
                boolean total = variant.getInner() == null || variant.getInner().isIrrefutable();
                switch (variant.getVariant()) {
                    case SOME -> some |= total;
                    case NONE -> none = true;
                    case OK -> ok |= total;
                    case ERR -> err |= total;
                }
            } else if (pattern instanceof LiteralPattern literal
                    && literal.getLiteral().getLiteralKind() == LiteralKind.BOOL) {
                if (Boolean.TRUE.equals(literal.getLiteral().getValue())) {
                    isTrue = true;
                } else {
                    isFalse = true;
                }
            }
        }
        return some && none || ok && err || targetType.isBool() && isTrue && isFalse;
    }

    private void bindPattern(Pattern pattern, CalorType type, Scope scope) {
        switch (pattern.kind()) {
            case WILDCARD -> {
                // binds nothing
            }
            case LITERAL -> checkExpression(((LiteralPattern) pattern).getLiteral(), scope);
            case VARIABLE -> {
                VariablePattern variable = (VariablePattern) pattern;
                define(scope, Symbol.variable(variable.getName(), Symbol.Kind.LOCAL, type, false, variable.getSpan()));
            }
            case RELATIONAL -> checkExpression(((RelationalPattern) pattern).getValue(), scope);
            case OPTION_RESULT -> {
                OptionResultPattern variant = (OptionResultPattern) pattern;
                if (variant.getInner() != null) {
                    bindPattern(variant.getInner(), variantPayload(variant.getVariant(), type), scope);
                }
            }
            case PROPERTY -> {
                PropertyPattern property = (PropertyPattern) pattern;
                for (PropertyMatch match : property.getMatches()) {
                    bindPattern(match.getPattern(), fieldType(property.getTypeName(), match.getProperty()), scope);
                }
            }
            case POSITIONAL -> {
                PositionalPattern positional = (PositionalPattern) pattern;
                List<Parameter> fields = structFields.getOrDefault(positional.getTypeName(), List.of());
                for (int i = 0; i < positional.getElements().size(); i++) {
                    CalorType elementType = i < fields.size() ? types.resolve(fields.get(i).getType())
                            : CalorType.UNKNOWN;
                    bindPattern(positional.getElements().get(i), elementType, scope);
                }
            }
            case LIST -> {
                ListPattern list = (ListPattern) pattern;
                if (!supportsListPattern(type)) {
                    diagnostics.report(DiagnosticCode.TYPE_MISMATCH, list.getSpan(),
                            "List pattern cannot match a value of type " + type);
                }
                for (Pattern element : list.getElements()) {
                    bindPattern(element, type.payload(), scope);
                }
                if (list.getRest() != null) {
                    define(scope, Symbol.variable(list.getRest(), Symbol.Kind.LOCAL, type, false, list.getSpan()));
                }
            }
        }
    }

    /**
     * Sequences with a length and an indexer. Named host types are given the benefit of the doubt.
     */
    private static boolean supportsListPattern(CalorType type) {
        return switch (type.getKind()) {
            case LIST, ARRAY, STRING, NAMED, OBJECT, UNKNOWN -> true;
            default -> false;
        };
    }

    private static CalorType variantPayload(OptionResultVariant variant, CalorType type) {
        return switch (variant) {
            case SOME -> type.getKind() == CalorType.Kind.OPTION ? type.payload() : CalorType.UNKNOWN;
            case OK -> type.getKind() == CalorType.Kind.RESULT ? type.getArguments().get(0) : CalorType.UNKNOWN;
            case ERR -> type.getKind() == CalorType.Kind.RESULT ? type.getArguments().get(1) : CalorType.UNKNOWN;
            case NONE -> CalorType.UNKNOWN;
        };
    }

    private CalorType fieldType(String typeName, String member) {
        for (Parameter field : structFields.getOrDefault(typeName, List.of())) {
            if (field.getName().equals(member)) {
                return types.resolve(field.getType());
            }
        }
        return CalorType.UNKNOWN;
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    private CalorType checkExpression(Expression expression, Scope scope) {
        CalorType type = typeExpression(expression, scope);
        expressionTypes.put(expression, type);
        return type;
    }

    private CalorType typeExpression(Expression expression, Scope scope) {
        return switch (expression.kind()) {
            case LITERAL -> literalType((LiteralExpression) expression);
            case REFERENCE -> referenceType((ReferenceExpression) expression, scope, false);
            case FIELD_ACCESS -> fieldAccessType((FieldAccessExpression) expression, scope);
            case BINARY -> binaryType((BinaryExpression) expression, scope);
            case UNARY -> unaryType((UnaryExpression) expression, scope);
            case CALL -> callType((CallExpression) expression, scope);
            case NEW -> {
                NewExpression creation = (NewExpression) expression;
                checkArguments(creation.getArguments(), scope);
                yield types.resolve(creation.getTypeName());
            }
            case CONDITIONAL -> {
                ConditionalExpression conditional = (ConditionalExpression) expression;
                checkCondition(conditional.getCondition(), scope, "conditional test");
                CalorType whenTrue = checkExpression(conditional.getWhenTrue(), scope);
                CalorType whenFalse = checkExpression(conditional.getWhenFalse(), scope);
                if (whenTrue.isAssignableFrom(whenFalse)) {
                    yield whenTrue;
                }
                yield whenFalse.isAssignableFrom(whenTrue) ? whenFalse : CalorType.UNKNOWN;
            }
            case MATCH -> {
                MatchExpression match = (MatchExpression) expression;
                yield checkMatch(match.getTarget(), match.getCases(), match.getSpan(), scope, true);
            }
            case AWAIT -> {
                CalorType awaited = checkExpression(((AwaitExpression) expression).getAwaited(), scope);
                boolean task = awaited.getKind() == CalorType.Kind.NAMED && awaited.getName().equals("Task")
                        && awaited.getArguments().size() == 1;
                yield task ? awaited.getArguments().get(0) : CalorType.UNKNOWN;
            }
            case LAMBDA -> lambdaType((LambdaExpression) expression, scope);
            case STRING_OP -> stringOpType((StringOpExpression) expression, scope);
            case CHAR_OP -> {
                CharOpExpression op = (CharOpExpression) expression;
                checkArguments(op.getArguments(), scope);
                yield switch (op.getOperation()) {
                    case CHAR_AT, CHAR_FROM_CODE, TO_UPPER, TO_LOWER -> CalorType.CHAR;
                    case CHAR_CODE -> CalorType.I32;
                    default -> CalorType.BOOL;
                };
            }
            case BUILDER_OP -> {
                BuilderOpExpression op = (BuilderOpExpression) expression;
                checkArguments(op.getArguments(), scope);
                yield switch (op.getOperation()) {
                    case TO_STRING -> CalorType.STR;
                    case LENGTH -> CalorType.I32;
                    default -> CalorType.named("StringBuilder");
                };
            }
            case OPTION_RESULT -> optionResultType((OptionResultExpression) expression, scope);
            case CAST -> {
                CastExpression cast = (CastExpression) expression;
                checkExpression(cast.getOperand(), scope);
                yield types.resolve(cast.getTargetType());
            }
            case UNCHECKED -> checkExpression(((UncheckedExpression) expression).getOperand(), scope);
            case UNWRAP -> unwrapType((UnwrapExpression) expression, scope);
        };
    }

    private static CalorType literalType(LiteralExpression literal) {
        return switch (literal.getLiteralKind()) {
            case INT -> CalorType.I32.fits((Long) literal.getValue()) ? CalorType.I32 : CalorType.I64;
            case FLOAT -> CalorType.F64;
            case DECIMAL -> CalorType.DEC;
            case STRING -> CalorType.STR;
            case BOOL -> CalorType.BOOL;
            case CHAR -> CalorType.CHAR;
            case NULL -> CalorType.NULL;
        };
    }

    /**
     * {@code chainRoot} marks the leftmost name of {@code a.b.c}; an unknown root there is
     * an external namespace or type rather than an error.
     */
    private CalorType referenceType(ReferenceExpression reference, Scope scope, boolean chainRoot) {
        String name = reference.getName();
        Symbol symbol = scope.lookup(name);
        if (symbol != null) {
            return symbol.getType();
        }
        if (name.equals("result") && inPrecondition) {
            diagnostics.report(DiagnosticCode.CONTRACT_SCOPE_VIOLATION, reference.getSpan(),
                    "A precondition cannot refer to 'result'; use an ensures clause (§S) instead");
            return CalorType.UNKNOWN;
        }
        if (chainRoot || isExternalName(name)) {
            return CalorType.UNKNOWN;
        }
        reportUndefined(name, reference.getSpan(), scope);
        return CalorType.UNKNOWN;
    }

    private CalorType fieldAccessType(FieldAccessExpression access, Scope scope) {
        CalorType targetType;
        if (access.getTarget() instanceof ReferenceExpression root) {
            targetType = referenceType(root, scope, true);
            expressionTypes.put(root, targetType);
        } else {
            targetType = checkExpression(access.getTarget(), scope);
        }

        String member = access.getMember();
        return switch (targetType.getKind()) {
            case STRING, ARRAY -> member.equals("Length") ? CalorType.I32 : CalorType.UNKNOWN;
            case LIST, DICT -> member.equals("Count") ? CalorType.I32 : CalorType.UNKNOWN;
            case NAMED -> fieldType(targetType.getName(), member);
            default -> CalorType.UNKNOWN;
        };
    }

    private CalorType binaryType(BinaryExpression binary, Scope scope) {
        BinaryOperator op = binary.getOperator();
        CalorType left = checkExpression(binary.getLeft(), scope);
        CalorType right = checkExpression(binary.getRight(), scope);

        switch (op.getCategory()) {
            case LOGICAL -> {
                requireBool(binary.getLeft(), left, "operand of '" + op.getSymbol() + "'");
                requireBool(binary.getRight(), right, "operand of '" + op.getSymbol() + "'");
                return CalorType.BOOL;
            }
            case COMPARISON -> {
                boolean equality = op == BinaryOperator.EQUAL || op == BinaryOperator.NOT_EQUAL;
                if (!equality) {
                    if (left.isWrapper() || right.isWrapper()) {
                        reportImplicitUnwrap(left.isWrapper() ? binary.getLeft() : binary.getRight(),
                                left.isWrapper() ? left : right, "operand of '" + op.getSymbol() + "'");
                    } else if (!isOrdered(left) || !isOrdered(right)) {
                        diagnostics.report(DiagnosticCode.TYPE_MISMATCH, binary.getSpan(),
                                "Operator '" + op.getSymbol() + "' cannot compare " + left + " and " + right);
                    }
                }
                return CalorType.BOOL;
            }
            case ARITHMETIC -> {
                if (left.isWrapper() || right.isWrapper()) {
                    reportImplicitUnwrap(left.isWrapper() ? binary.getLeft() : binary.getRight(),
                            left.isWrapper() ? left : right, "operand of '" + op.getSymbol() + "'");
                    return CalorType.UNKNOWN;
                }
                if (op == BinaryOperator.ADD && (left.isString() || right.isString())) {
                    return CalorType.STR;
                }
                if (left.isUnknown() || right.isUnknown()) {
                    return op == BinaryOperator.POWER ? CalorType.F64 : CalorType.UNKNOWN;
                }
                if (!left.isNumeric() || !right.isNumeric()) {
                    diagnostics.report(DiagnosticCode.TYPE_MISMATCH, binary.getSpan(),
                            "Operator '" + op.getSymbol() + "' expects numeric operands but got " + left
                                    + " and " + right);
                    return CalorType.UNKNOWN;
                }
                return op == BinaryOperator.POWER ? CalorType.F64 : CalorType.promote(left, right);
            }
            default -> {
                if (left.isUnknown() || right.isUnknown()) {
                    return CalorType.UNKNOWN;
                }
                if (left.isBool() && right.isBool() && op != BinaryOperator.SHIFT_LEFT
                        && op != BinaryOperator.SHIFT_RIGHT) {
                    return CalorType.BOOL;
                }
                if (!left.isIntegral() || !right.isIntegral()) {
                    diagnostics.report(DiagnosticCode.TYPE_MISMATCH, binary.getSpan(),
                            "Operator '" + op.getSymbol() + "' expects integer operands but got " + left
                                    + " and " + right);
                    return CalorType.UNKNOWN;
                }
                if (op == BinaryOperator.SHIFT_LEFT || op == BinaryOperator.SHIFT_RIGHT) {
                    return CalorType.promote(left, CalorType.I32);
                }
                return CalorType.promote(left, right);
            }
        }
    }

    private static boolean isOrdered(CalorType type) {
        return type.isUnknown() || type.isNumeric() || type.getKind() == CalorType.Kind.CHAR
                || type.getKind() == CalorType.Kind.NAMED;
    }

    private CalorType unaryType(UnaryExpression unary, Scope scope) {
        CalorType operand = checkExpression(unary.getOperand(), scope);
        UnaryOperator op = unary.getOperator();

        if (op == UnaryOperator.NOT) {
            requireBool(unary.getOperand(), operand, "operand of '!'");
            return CalorType.BOOL;
        }
        if (operand.isWrapper()) {
            reportImplicitUnwrap(unary.getOperand(), operand, "operand of '" + op.getSymbol() + "'");
            return CalorType.UNKNOWN;
        }
        if (operand.isUnknown()) {
            return operand;
        }
        boolean valid = op == UnaryOperator.BITWISE_NOT ? operand.isIntegral() : operand.isNumeric();
        if (!valid) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, unary.getSpan(),
                    "Operator '" + op.getSymbol() + "' cannot be applied to " + operand);
            return CalorType.UNKNOWN;
        }
        return op == UnaryOperator.NEGATE || op == UnaryOperator.BITWISE_NOT
                ? CalorType.promote(operand, CalorType.I32.isAssignableFrom(operand) ? CalorType.I32 : operand)
                : operand;
    }

    private CalorType callType(CallExpression call, Scope scope) {
        List<CalorType> argumentTypes = checkArguments(call.getArguments(), scope);

        Symbol function = call.getTarget().contains(".") ? null : scope.lookup(call.getTarget());
        if (function == null || function.getKind() != Symbol.Kind.FUNCTION) {
            // host API, method on a value, or delegate held in a local
            return CalorType.UNKNOWN;
        }

        List<CalorType> parameterTypes = function.getParameterTypes();
        if (parameterTypes.size() == argumentTypes.size()) {
            for (int i = 0; i < parameterTypes.size(); i++) {
                checkAssignable(parameterTypes.get(i), call.getArguments().get(i), argumentTypes.get(i),
                        "argument " + (i + 1) + " of '" + call.getTarget() + "'");
            }
        }
        return function.getType();
    }

    private List<CalorType> checkArguments(List<Expression> arguments, Scope scope) {
        List<CalorType> argumentTypes = new ArrayList<>();
        for (Expression argument : arguments) {
            argumentTypes.add(checkExpression(argument, scope));
        }
        return argumentTypes;
    }

    private CalorType lambdaType(LambdaExpression lambda, Scope scope) {
        Scope lambdaScope = scope.child();
        declareParameters(lambda.getParameters(), lambdaScope);

        if (lambda.getExpressionBody() != null) {
            checkExpression(lambda.getExpressionBody(), lambdaScope);
        } else {
            returnTargets.push(ReturnTarget.collecting());
            try {
                checkStatements(lambda.getStatementBody(), lambdaScope);
            } finally {
                returnTargets.pop();
            }
        }
        return CalorType.UNKNOWN;
    }

    private CalorType stringOpType(StringOpExpression op, Scope scope) {
        List<CalorType> argumentTypes = checkArguments(op.getArguments(), scope);
        for (int i = 0; i < argumentTypes.size(); i++) {
            if (argumentTypes.get(i).isWrapper()) {
                reportImplicitUnwrap(op.getArguments().get(i), argumentTypes.get(i),
                        "argument of '" + op.getOperation().getName() + "'");
            }
        }
        return switch (op.getOperation()) {
            case LENGTH, INDEX_OF -> CalorType.I32;
            case CONTAINS, STARTS_WITH, ENDS_WITH, EQUALS, IS_EMPTY, IS_BLANK, REGEX_TEST -> CalorType.BOOL;
            case SPLIT -> CalorType.array(CalorType.STR);
            default -> CalorType.STR;
        };
    }

    private CalorType optionResultType(OptionResultExpression expression, Scope scope) {
        CalorType value = expression.getValue() != null ? checkExpression(expression.getValue(), scope)
                : CalorType.UNKNOWN;
        return switch (expression.getVariant()) {
            case SOME -> CalorType.option(value);
            case NONE -> CalorType.option(types.resolve(expression.getTypeName()));
            case OK -> CalorType.result(value, CalorType.UNKNOWN);
            case ERR -> CalorType.result(CalorType.UNKNOWN, value);
        };
    }

    private CalorType unwrapType(UnwrapExpression unwrap, Scope scope) {
        CalorType operand = checkExpression(unwrap.getOperand(), scope);
        CalorType payload = CalorType.UNKNOWN;
        if (operand.isWrapper()) {
            payload = operand.payload();
        } else if (!operand.isUnknown()) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, unwrap.getSpan(),
                    "unwrap expects an Option or Result value but got " + operand);
        }
        if (unwrap.getDefaultValue() != null) {
            CalorType fallback = checkExpression(unwrap.getDefaultValue(), scope);
            checkAssignable(payload, unwrap.getDefaultValue(), fallback, "unwrap-or default");
        }
        return payload;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void checkCondition(Expression condition, Scope scope, String what) {
        CalorType type = checkExpression(condition, scope);
        requireBool(condition, type, what);
    }

    private void requireBool(Expression expression, CalorType type, String what) {
        if (type.isWrapper()) {
            reportImplicitUnwrap(expression, type, what);
        } else if (!type.isBool() && !type.isUnknown()) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, expression.getSpan(),
                    "The " + what + " must be bool but is " + type);
        }
    }

    private void checkAssignable(CalorType target, Expression value, CalorType valueType, String what) {
        if (target.isAssignableFrom(valueType)) {
            return;
        }
        Long constant = integerConstant(value);
        if (constant != null && target.isIntegral() && target.fits(constant)) {
            return;
        }
        if (valueType.isWrapper() && !target.isWrapper() && target.isAssignableFrom(valueType.payload())) {
            reportImplicitUnwrap(value, valueType, what);
        } else if (target.isNarrowingFrom(valueType)) {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, value.getSpan(),
                    "Narrowing conversion from " + valueType + " to " + target + " in " + what
                            + " requires an explicit (cast " + target + " …)");
        } else {
            diagnostics.report(DiagnosticCode.TYPE_MISMATCH, value.getSpan(),
                    "Cannot use a value of type " + valueType + " for " + what + " of type " + target);
        }
    }

    private static Long integerConstant(Expression value) {
        if (value instanceof LiteralExpression literal && literal.getLiteralKind() == LiteralKind.INT) {
            return (Long) literal.getValue();
        }
        if (value instanceof UnaryExpression unary && unary.getOperator() == UnaryOperator.NEGATE) {
            Long inner = integerConstant(unary.getOperand());
            return inner != null ? -inner : null;
        }
        return null;
    }

    private void reportImplicitUnwrap(Expression expression, CalorType type, String what) {
        diagnostics.report(DiagnosticCode.IMPLICIT_UNWRAP, expression.getSpan(),
                "Value of type " + type + " used as " + what + " without unwrapping",
                "Use (unwrap …), (unwrap-or … default) or match on it with §W");
    }

    private void reportUndefined(String name, Span span, Scope scope) {
        List<String> similar = FuzzyMatcher.findSimilar(name, scope.visibleNames(), 3);
        String suggestion = similar.isEmpty() ? null : "Did you mean '" + String.join("', '", similar) + "'?";
        diagnostics.report(DiagnosticCode.UNDEFINED_REFERENCE, span, "Undefined reference '" + name + "'", suggestion);
    }

    private void reportRedeclaration(String name, Span span, Symbol existing) {
        String where = existing.getSpan() != null && !existing.getSpan().isEmpty()
                ? " at line " + existing.getSpan().getLine() : "";
        diagnostics.report(DiagnosticCode.REDECLARATION, span, "'" + name + "' is already declared in this scope" + where);
    }

    private void define(Scope scope, Symbol symbol) {
        Symbol existing = scope.define(symbol);
        if (existing != null) {
            reportRedeclaration(symbol.getName(), symbol.getSpan(), existing);
        }
    }

    /**
     * Capitalised names are types, namespaces or host members; {@code this} and {@code base}
     * refer to the enclosing instance.
     */
    private static boolean isExternalName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0))
                || name.equals("this") || name.equals("base");
    }

    /**
     * Where {@code §R} values go: a declared function type, or a collector for match-expression
     * cases and lambda bodies whose returns produce the enclosing expression's value.
     */
    private static final class ReturnTarget {
        final CalorType expected;
        final List<CalorType> collected;

        private ReturnTarget(CalorType expected, List<CalorType> collected) {
            this.expected = expected;
            this.collected = collected;
        }

        static ReturnTarget declared(CalorType expected) {
            return new ReturnTarget(expected, null);
        }

        static ReturnTarget collecting() {
            return new ReturnTarget(null, new ArrayList<>());
        }
    }
}
