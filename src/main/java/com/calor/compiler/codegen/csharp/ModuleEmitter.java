package com.calor.compiler.codegen.csharp;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.calor.compiler.codegen.CodeWriter;
import com.calor.compiler.codegen.ContractMode;
import com.calor.compiler.codegen.EmitContext;
import com.calor.compiler.codegen.calor.CalorEmitter;
import com.calor.compiler.diagnostics.Diagnostic;
import com.calor.compiler.diagnostics.DiagnosticCode;
import com.calor.compiler.diagnostics.Severity;
import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.Node;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.Visibility;
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
import com.calor.compiler.model.decl.UsingDirective;
import com.calor.compiler.model.expr.AwaitExpression;
import com.calor.compiler.model.expr.BinaryExpression;
import com.calor.compiler.model.expr.BinaryOperator;
import com.calor.compiler.model.expr.BuilderOpExpression;
import com.calor.compiler.model.expr.CallExpression;
import com.calor.compiler.model.expr.CastExpression;
import com.calor.compiler.model.expr.CharOpExpression;
import com.calor.compiler.model.expr.ConditionalExpression;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.expr.ExpressionKind;
import com.calor.compiler.model.expr.FieldAccessExpression;
import com.calor.compiler.model.expr.LambdaExpression;
import com.calor.compiler.model.expr.LiteralExpression;
import com.calor.compiler.model.expr.LiteralKind;
import com.calor.compiler.model.expr.MatchCase;
import com.calor.compiler.model.expr.MatchExpression;
import com.calor.compiler.model.expr.NewExpression;
import com.calor.compiler.model.expr.OptionResultExpression;
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
import com.calor.compiler.model.pattern.PatternKind;
import com.calor.compiler.model.pattern.PositionalPattern;
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
import com.calor.compiler.model.stmt.StatementKind;
import com.calor.compiler.model.stmt.ThrowStatement;
import com.calor.compiler.model.stmt.TryStatement;
import com.calor.compiler.model.stmt.UsingStatement;
import com.calor.compiler.model.stmt.WhileStatement;
import com.calor.compiler.semantic.CalorType;

/**
 * One forward emission of a module into the body of a C# namespace block.
 *
 * Instances hold the per-call walk state (function frames, overflow context, usings) and are
 * used once.
 */
class ModuleEmitter {

    private static final String VIOLATION = "throw new Calor.Runtime.ContractViolationException(";
    private static final String CHECK_INVARIANTS = "__CheckInvariants";

    private static final Map<String, String> MODIFIERS = Map.ofEntries(
        Map.entry("abs", "abstract"),
        Map.entry("seal", "sealed"),
        Map.entry("stat", "static"),
        Map.entry("part", "partial"),
        Map.entry("virt", "virtual"),
        Map.entry("ovr", "override"),
        Map.entry("ro", "readonly"),
        Map.entry("const", "const"),
        Map.entry("new", "new")
    );

    /** Where a function body is being emitted. */
    private enum Placement {
        MODULE,
        CLASS,
        INTERFACE,
        EXTENSION
    }

    private enum Overflow {
        DEFAULT,
        CHECKED,
        UNCHECKED
    }

    /**
     * Return-path obligations of the function whose body is being written.
     */
    private static final class Frame {
        final String functionId;
        final List<ContractClause> postconditions;
        final boolean checkInvariants;
        int catchDepth;

        Frame(String functionId, List<ContractClause> postconditions, boolean checkInvariants) {
            this.functionId = functionId;
            this.postconditions = postconditions;
            this.checkInvariants = checkInvariants;
        }
    }

    private final ModuleDeclaration module;
    private final EmitContext context;
    private final UsingManager usings;
    private final CSharpTypeMapper types;
    private final CalorEmitter conditionRenderer = new CalorEmitter();
    private final Set<String> moduleFunctions = new HashSet<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final String moduleClassName;

    private Overflow overflow = Overflow.DEFAULT;
    private boolean inModuleClass;
    private String resultAlias;
    private boolean failed;

    ModuleEmitter(ModuleDeclaration module, EmitContext context) {
        this.module = module;
        this.context = context;
        this.usings = new UsingManager(namespace(module, context));
        this.types = new CSharpTypeMapper(usings);
        this.moduleClassName = moduleClassName(module.getName());
    }

    static String namespace(ModuleDeclaration module, EmitContext context) {
        String override = context.getNamespaceOverride();
        return override != null && !override.isBlank() ? override.trim() : module.getName();
    }

    static String moduleClassName(String moduleName) {
        String last = moduleName.substring(moduleName.lastIndexOf('.') + 1);
        return last.replaceAll("[^A-Za-z0-9_]", "_") + "Module";
    }

    UsingManager getUsings() {
        return usings;
    }

    /**
     * True once an error-level emission diagnostic has been reported.
     */
    boolean isFailed() {
        return failed;
    }

    /**
     * Namespace body at depth 1.
     */
    String emitBody() {
        usings.addUsing("System");
        for (UsingDirective using : module.getUsings()) {
            if (using.isStaticImport()) {
                usings.addStatic(using.getNamespace());
            } else if (using.getAlias() != null) {
                usings.addAlias(using.getAlias(), using.getNamespace());
            } else {
                usings.addUsing(using.getNamespace());
            }
        }
        registerNames();

        CodeWriter out = new CodeWriter(context.getIndent());
        for (ContractClause invariant : module.getInvariants()) {
            warn(DiagnosticCode.UNSUPPORTED_CONSTRUCT, invariant,
                    "Module invariants have no C# mapping and are not enforced");
            out.line(1, "// Module invariant not enforced: " + conditionText(invariant.getCondition()));
        }

        List<Declaration> moduleMembers = module.getMembers().stream()
                .filter(ModuleEmitter::belongsToModuleClass)
                .collect(Collectors.toList());
        if (!moduleMembers.isEmpty()) {
            out.blank();
            moduleClass(moduleMembers, 1, out);
        }
        for (Declaration member : module.getMembers()) {
            if (!belongsToModuleClass(member)) {
                out.blank();
                declaration(member, 1, out);
            }
        }
        return out.render();
    }

    private static boolean belongsToModuleClass(Declaration declaration) {
        return switch (declaration.kind()) {
            case FUNCTION, FIELD, PROPERTY, EVENT -> true;
            default -> false;
        };
    }

    private void registerNames() {
        for (Declaration member : module.getMembers()) {
            if (member instanceof FunctionDeclaration function) {
                moduleFunctions.add(function.getName());
            } else if (member instanceof UnionTypeDeclaration union) {
                for (UnionCase unionCase : union.getCases()) {
                    types.registerQualifiedName(unionCase.getName(), union.getName() + "." + unionCase.getName());
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private void moduleClass(List<Declaration> members, int depth, CodeWriter out) {
        out.line(depth, "public static class " + moduleClassName);
        out.line(depth, "{");
        inModuleClass = true;
        boolean first = true;
        for (Declaration member : members) {
            if (!first) {
                out.blank();
            }
            first = false;
            switch (member.kind()) {
                case FUNCTION -> function((FunctionDeclaration) member, Placement.MODULE, null, depth + 1, out);
                case FIELD -> field((FieldDeclaration) member, true, depth + 1, out);
                case PROPERTY -> property((PropertyDeclaration) member, true, depth + 1, out);
                case EVENT -> event((EventDeclaration) member, true, depth + 1, out);
                default -> declaration(member, depth + 1, out);
            }
        }
        inModuleClass = false;
        out.line(depth, "}");
    }

    private void declaration(Declaration declaration, int depth, CodeWriter out) {
        switch (declaration.kind()) {
            case MODULE -> error(DiagnosticCode.UNSUPPORTED_CONSTRUCT, declaration,
                    "Nested module '" + declaration.getName() + "' has no C# mapping");
            case FUNCTION -> function((FunctionDeclaration) declaration, Placement.CLASS, null, depth, out);
            case CLASS -> classDeclaration((ClassDeclaration) declaration, depth, out);
            case INTERFACE -> {
                InterfaceDeclaration iface = (InterfaceDeclaration) declaration;
                out.line(depth, "public interface " + iface.getName());
                out.line(depth, "{");
                for (FunctionDeclaration method : iface.getMethods()) {
                    function(method, Placement.INTERFACE, null, depth + 1, out);
                }
                out.line(depth, "}");
            }
            case ENUM -> {
                EnumDeclaration enumeration = (EnumDeclaration) declaration;
                String underlying = enumeration.getUnderlyingType() != null
                        ? " : " + types.map(enumeration.getUnderlyingType()) : "";
                out.line(depth, "public enum " + enumeration.getName() + underlying);
                out.line(depth, "{");
                List<EnumMember> members = enumeration.getMembers();
                for (int i = 0; i < members.size(); i++) {
                    EnumMember member = members.get(i);
                    String text = member.getValue() != null ? member.getName() + " = " + member.getValue() : member.getName();
                    out.line(depth + 1, i < members.size() - 1 ? text + "," : text);
                }
                out.line(depth, "}");
            }
            case ENUM_EXTENSION -> {
                EnumExtensionDeclaration extension = (EnumExtensionDeclaration) declaration;
                out.line(depth, "public static class " + extension.getEnumName() + "Extensions");
                out.line(depth, "{");
                boolean first = true;
                for (FunctionDeclaration method : extension.getMethods()) {
                    if (!first) {
                        out.blank();
                    }
                    first = false;
                    function(method, Placement.EXTENSION, extension.getEnumName(), depth + 1, out);
                }
                out.line(depth, "}");
            }
            case RECORD -> {
                RecordDeclaration record = (RecordDeclaration) declaration;
                out.line(depth, "public sealed record " + record.getName() + "(" + parameters(record.getFields()) + ");");
            }
            case UNION -> union((UnionTypeDeclaration) declaration, depth, out);
            case FIELD -> field((FieldDeclaration) declaration, false, depth, out);
            case PROPERTY -> property((PropertyDeclaration) declaration, false, depth, out);
            case CONSTRUCTOR -> error(DiagnosticCode.UNSUPPORTED_CONSTRUCT, declaration,
                    "Constructor outside a class has no C# mapping");
            case DELEGATE -> {
                DelegateDeclaration delegate = (DelegateDeclaration) declaration;
                out.line(depth, delegate.getVisibility().getKeyword() + " delegate "
                        + returnType(delegate.getReturnType(), false) + " " + delegate.getName()
                        + "(" + parameters(delegate.getParameters()) + ");");
            }
            case EVENT -> event((EventDeclaration) declaration, false, depth, out);
        }
    }

    private void union(UnionTypeDeclaration union, int depth, CodeWriter out) {
        out.line(depth, "public abstract record " + union.getName());
        out.line(depth, "{");
        out.line(depth + 1, "private " + union.getName() + "() { }");
        for (UnionCase unionCase : union.getCases()) {
            out.blank();
            out.line(depth + 1, "public sealed record " + unionCase.getName() + "(" + parameters(unionCase.getFields())
                    + ") : " + union.getName() + ";");
        }
        out.line(depth, "}");
    }

    private void classDeclaration(ClassDeclaration declaration, int depth, CodeWriter out) {
        StringBuilder head = new StringBuilder("public ");
        for (String modifier : declaration.getModifiers()) {
            head.append(modifier(modifier)).append(' ');
        }
        head.append("class ").append(declaration.getName());
        List<String> bases = new ArrayList<>();
        if (declaration.getBaseClass() != null) {
            bases.add(types.map(declaration.getBaseClass()));
        }
        declaration.getInterfaces().forEach(iface -> bases.add(types.map(iface)));
        if (!bases.isEmpty()) {
            head.append(" : ").append(String.join(", ", bases));
        }

        boolean invariants = !declaration.getInvariants().isEmpty() && contractsEnabled();
        out.line(depth, head.toString());
        out.line(depth, "{");
        boolean first = true;
        for (Declaration member : declaration.getMembers()) {
            if (!first) {
                out.blank();
            }
            first = false;
            switch (member.kind()) {
                case FUNCTION -> function((FunctionDeclaration) member, Placement.CLASS,
                        invariants ? declaration.getName() : null, depth + 1, out);
                case CONSTRUCTOR -> constructor((ConstructorDeclaration) member, declaration.getName(), invariants,
                        depth + 1, out);
                default -> declaration(member, depth + 1, out);
            }
        }
        if (invariants) {
            if (!first) {
                out.blank();
            }
            out.line(depth + 1, "private void " + CHECK_INVARIANTS + "()");
            out.line(depth + 1, "{");
            for (ContractClause invariant : declaration.getInvariants()) {
                out.line(depth + 2, guard(invariant, declaration.getId(), "Invariant"));
            }
            out.line(depth + 1, "}");
        }
        out.line(depth, "}");
    }

    /**
     * @param owner enum name for extension methods; for class methods, non-null when the class
     *              carries invariants
     */
    private void function(FunctionDeclaration function, Placement placement, String owner, int depth, CodeWriter out) {
        List<String> parts = new ArrayList<>();
        if (placement != Placement.INTERFACE) {
            parts.add(function.getVisibility().getKeyword());
        }
        if ((placement == Placement.MODULE || placement == Placement.EXTENSION)
                && !function.getModifiers().contains("static") && !function.getModifiers().contains("stat")) {
            parts.add("static");
        }
        function.getModifiers().forEach(modifier -> parts.add(modifier(modifier)));
        if (function.isAsync() && placement != Placement.INTERFACE) {
            parts.add("async");
        }
        parts.add(returnType(function.getReturnType(), function.isAsync()));

        String params = placement == Placement.EXTENSION
                ? extensionParameters(function.getParameters(), owner)
                : parameters(function.getParameters());
        String signature = String.join(" ", parts) + " " + function.getName() + "(" + params + ")";

        boolean bodyless = placement == Placement.INTERFACE
                || (parts.contains("abstract") && function.getBody().isEmpty());
        if (bodyless) {
            out.line(depth, signature + ";");
            return;
        }

        boolean checkInvariants = placement == Placement.CLASS && owner != null
                && function.getVisibility() == Visibility.PUBLIC && !parts.contains("static");
        out.line(depth, signature);
        out.line(depth, "{");
        frames.push(new Frame(function.getId(), contractsEnabled() ? function.getPostconditions() : List.of(),
                checkInvariants));
        try {
            preconditions(function.getPreconditions(), function.getId(), depth + 1, out);
            statements(function.getBody(), depth + 1, out);
            boolean valued = function.getReturnType() != null && !function.getReturnType().equals("void");
            if (!valued && !endsInJump(function.getBody())) {
                returnPath(null, depth + 1, out, false);
            }
        } finally {
            frames.pop();
        }
        out.line(depth, "}");
    }

    private void constructor(ConstructorDeclaration constructor, String className, boolean invariants, int depth,
            CodeWriter out) {
        String head = constructor.getVisibility().getKeyword() + " " + className
                + "(" + parameters(constructor.getParameters()) + ")";
        if (constructor.getInitializer() != null) {
            head += " : " + (constructor.getInitializer().isBase() ? "base" : "this")
                    + "(" + arguments(constructor.getInitializer().getArguments(), depth) + ")";
        }
        out.line(depth, head);
        out.line(depth, "{");
        frames.push(new Frame(constructor.getId(), List.of(), invariants));
        try {
            preconditions(constructor.getPreconditions(), constructor.getId(), depth + 1, out);
            statements(constructor.getBody(), depth + 1, out);
            if (!endsInJump(constructor.getBody())) {
                returnPath(null, depth + 1, out, false);
            }
        } finally {
            frames.pop();
        }
        out.line(depth, "}");
    }

    private void field(FieldDeclaration field, boolean forceStatic, int depth, CodeWriter out) {
        StringBuilder text = new StringBuilder(field.getVisibility().getKeyword()).append(' ');
        if (forceStatic && !field.getModifiers().contains("const")) {
            text.append("static ");
        }
        for (String modifier : field.getModifiers()) {
            text.append(modifier(modifier)).append(' ');
        }
        text.append(types.map(field.getType())).append(' ').append(field.getName());
        if (field.getInitializer() != null) {
            text.append(" = ").append(bare(field.getInitializer(), depth));
        }
        out.line(depth, text + ";");
    }

    private void property(PropertyDeclaration property, boolean forceStatic, int depth, CodeWriter out) {
        String head = property.getVisibility().getKeyword() + (forceStatic ? " static " : " ")
                + types.map(property.getType()) + " " + property.getName();
        boolean auto = property.getAccessors().stream().allMatch(accessor -> accessor.getBody().isEmpty());
        if (auto) {
            String accessors = property.getAccessors().isEmpty()
                    ? "get; set;"
                    : property.getAccessors().stream().map(this::accessorHead).map(a -> a + ";")
                            .collect(Collectors.joining(" "));
            String initializer = property.getDefaultValue() != null
                    ? " = " + bare(property.getDefaultValue(), depth) + ";" : "";
            out.line(depth, head + " { " + accessors + " }" + initializer);
            return;
        }

        out.line(depth, head);
        out.line(depth, "{");
        for (PropertyAccessor accessor : property.getAccessors()) {
            if (accessor.getBody().isEmpty()) {
                out.line(depth + 1, accessorHead(accessor) + ";");
                continue;
            }
            out.line(depth + 1, accessorHead(accessor));
            out.line(depth + 1, "{");
            frames.push(new Frame(property.getId(), List.of(), false));
            try {
                statements(accessor.getBody(), depth + 2, out);
            } finally {
                frames.pop();
            }
            out.line(depth + 1, "}");
        }
        out.line(depth, "}");
    }

    private String accessorHead(PropertyAccessor accessor) {
        String keyword = switch (accessor.getAccessorKind()) {
            case GET -> "get";
            case SET -> "set";
            case INIT -> "init";
        };
        return accessor.getVisibility() != null ? accessor.getVisibility().getKeyword() + " " + keyword : keyword;
    }

    private void event(EventDeclaration event, boolean forceStatic, int depth, CodeWriter out) {
        out.line(depth, event.getVisibility().getKeyword() + (forceStatic ? " static" : "") + " event "
                + types.map(event.getDelegateType()) + " " + event.getName() + ";");
    }

    private String parameters(List<Parameter> parameters) {
        return parameters.stream()
                .map(p -> types.map(p.getType()).equals("var") ? "object " + p.getName()
                        : types.map(p.getType()) + " " + p.getName())
                .collect(Collectors.joining(", "));
    }

    private String extensionParameters(List<Parameter> parameters, String enumName) {
        if (parameters.isEmpty()) {
            return "this " + enumName + " self";
        }
        String self = "this " + enumName + " " + parameters.get(0).getName();
        String rest = parameters(parameters.subList(1, parameters.size()));
        return rest.isEmpty() ? self : self + ", " + rest;
    }

    private String returnType(String calorType, boolean async) {
        String mapped = calorType == null ? "void" : types.map(calorType);
        if (!async || mapped.startsWith("Task")) {
            if (mapped.startsWith("Task")) {
                usings.addUsing("System.Threading.Tasks");
            }
            return mapped;
        }
        usings.addUsing("System.Threading.Tasks");
        return mapped.equals("void") ? "Task" : "Task<" + mapped + ">";
    }

    private static String modifier(String modifier) {
        return MODIFIERS.getOrDefault(modifier, modifier);
    }

    // ---------------------------------------------------------------------
    // Contracts
    // ---------------------------------------------------------------------

    private boolean contractsEnabled() {
        return context.getContractMode() != ContractMode.OFF;
    }

    private void preconditions(List<ContractClause> preconditions, String functionId, int depth, CodeWriter out) {
        if (!contractsEnabled()) {
            return;
        }
        for (ContractClause clause : preconditions) {
            out.line(depth, guard(clause, functionId, "Requires"));
        }
    }

    private String guard(ContractClause clause, String functionId, String kind) {
        String text = context.getContractMode() == ContractMode.RELEASE
                ? "null" : literal(conditionText(clause.getCondition()), '"');
        String message = clause.getMessage() != null ? literal(clause.getMessage(), '"') : "null";
        return "if (!(" + expression(clause.getCondition(), 0) + ")) " + VIOLATION + text + ", "
                + literal(functionId, '"') + ", \"" + kind + "\", " + message + ");";
    }

    private String conditionText(Expression condition) {
        return conditionRenderer.formatExpression(condition);
    }

    /**
     * Writes one return: postcondition guards over the stored value, the invariant check, then
     * the return itself. {@code explicit} is false for the synthesized tail of a void body.
     */
    private void returnPath(Expression value, int depth, CodeWriter out, boolean explicit) {
        Frame frame = frames.peek();
        boolean guarded = frame != null && (!frame.postconditions.isEmpty() || frame.checkInvariants);
        if (!guarded) {
            if (explicit) {
                out.line(depth, value != null ? "return " + bare(value, depth) + ";" : "return;");
            }
            return;
        }

        String alias = null;
        if (value != null) {
            alias = context.getIds().next("__result_");
            out.line(depth, "var " + alias + " = " + bare(value, depth) + ";");
        }
        String saved = resultAlias;
        resultAlias = alias;
        try {
            for (ContractClause clause : frame.postconditions) {
                out.line(depth, guard(clause, frame.functionId, "Ensures"));
            }
        } finally {
            resultAlias = saved;
        }
        if (frame.checkInvariants) {
            out.line(depth, CHECK_INVARIANTS + "();");
        }
        if (alias != null) {
            out.line(depth, "return " + alias + ";");
        } else if (explicit) {
            out.line(depth, "return;");
        }
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    private void statements(List<Statement> statements, int depth, CodeWriter out) {
        for (Statement statement : statements) {
            statement(statement, depth, out);
        }
    }

    private void block(List<Statement> statements, int depth, CodeWriter out) {
        out.line(depth, "{");
        statements(statements, depth + 1, out);
        out.line(depth, "}");
    }

    private void statement(Statement statement, int depth, CodeWriter out) {
        switch (statement.kind()) {
            case BIND -> {
                BindStatement bind = (BindStatement) statement;
                out.line(depth, localType(bind) + " " + bind.getName() + " = " + bare(bind.getValue(), depth) + ";");
            }
            case ASSIGN -> {
                AssignStatement assign = (AssignStatement) statement;
                out.line(depth, bare(assign.getTarget(), depth) + " = " + bare(assign.getValue(), depth) + ";");
            }
            case RETURN -> {
                Expression value = ((ReturnStatement) statement).getValue();
                if (value instanceof MatchExpression match && !isSwitchExpression(match.getCases())) {
                    switchStatement(match.getTarget(), match.getCases(), true, depth, out);
                } else {
                    returnPath(value, depth, out, true);
                }
            }
            case IF -> ifStatement((IfStatement) statement, depth, out);
            case FOR -> {
                ForStatement loop = (ForStatement) statement;
                String variable = loop.getVariable();
                boolean descending = isNegative(loop.getStep());
                String step;
                if (loop.getStep() == null || isLiteral(loop.getStep(), 1L)) {
                    step = loopStep(loop, variable, "+ 1", variable + "++");
                } else if (isLiteral(loop.getStep(), -1L)) {
                    step = loopStep(loop, variable, "- 1", variable + "--");
                } else {
                    String by = bare(loop.getStep(), depth);
                    step = loopStep(loop, variable, "+ " + by, variable + " += " + by);
                }
                out.line(depth, "for (var " + variable + " = " + bare(loop.getFrom(), depth) + "; " + variable
                        + (descending ? " >= " : " <= ") + bare(loop.getTo(), depth) + "; " + step + ")");
                block(loop.getBody(), depth, out);
            }
            case WHILE -> {
                WhileStatement loop = (WhileStatement) statement;
                out.line(depth, "while (" + bare(loop.getCondition(), depth) + ")");
                block(loop.getBody(), depth, out);
            }
            case DO_WHILE -> {
                DoWhileStatement loop = (DoWhileStatement) statement;
                out.line(depth, "do");
                out.line(depth, "{");
                statements(loop.getBody(), depth + 1, out);
                out.line(depth, "} while (" + bare(loop.getCondition(), depth) + ");");
            }
            case FOREACH -> {
                ForeachStatement loop = (ForeachStatement) statement;
                out.line(depth, "foreach (" + types.map(loop.getVariableType()) + " " + loop.getVariable() + " in "
                        + bare(loop.getCollection(), depth) + ")");
                block(loop.getBody(), depth, out);
            }
            case TRY -> tryStatement((TryStatement) statement, depth, out);
            case THROW -> out.line(depth, "throw " + bare(((ThrowStatement) statement).getException(), depth) + ";");
            case RETHROW -> {
                Frame frame = frames.peek();
                if (frame == null || frame.catchDepth == 0) {
                    error(DiagnosticCode.UNSUPPORTED_CONSTRUCT, statement, "Rethrow outside a catch clause");
                }
                out.line(depth, "throw;");
            }
            case BREAK -> out.line(depth, "break;");
            case CONTINUE -> out.line(depth, "continue;");
            case PRINT -> {
                PrintStatement print = (PrintStatement) statement;
                out.line(depth, (print.isNewline() ? "Console.WriteLine(" : "Console.Write(")
                        + bare(print.getValue(), depth) + ");");
            }
            case COLLECTION_OP -> out.line(depth, collectionOp((CollectionOpStatement) statement, depth));
            case MATCH -> {
                MatchStatement match = (MatchStatement) statement;
                switchStatement(match.getTarget(), match.getCases(), false, depth, out);
            }
            case EXPRESSION -> out.line(depth, bare(((ExpressionStatement) statement).getExpression(), depth) + ";");
            case USING -> {
                UsingStatement using = (UsingStatement) statement;
                out.line(depth, "using (" + types.map(using.getVariableType()) + " " + using.getVariable() + " = "
                        + bare(using.getResource(), depth) + ")");
                block(using.getBody(), depth, out);
            }
        }
    }

    private String localType(BindStatement bind) {
        if (bind.getType() != null) {
            return types.map(bind.getType());
        }
        if (bind.getValue() instanceof LiteralExpression literal && literal.getLiteralKind() == LiteralKind.NULL) {
            return "object";
        }
        return "var";
    }

    private void ifStatement(IfStatement statement, int depth, CodeWriter out) {
        out.line(depth, "if (" + bare(statement.getCondition(), depth) + ")");
        block(statement.getThenBody(), depth, out);
        for (ElseIfClause elseIf : statement.getElseIfs()) {
            out.line(depth, "else if (" + bare(elseIf.getCondition(), depth) + ")");
            block(elseIf.getBody(), depth, out);
        }
        if (statement.getElseBody() != null) {
            out.line(depth, "else");
            block(statement.getElseBody(), depth, out);
        }
    }

    private void tryStatement(TryStatement statement, int depth, CodeWriter out) {
        out.line(depth, "try");
        block(statement.getTryBody(), depth, out);
        for (CatchClause clause : statement.getCatches()) {
            String head;
            if (clause.getVariable() != null) {
                String type = clause.getExceptionType() != null ? types.map(clause.getExceptionType()) : "Exception";
                head = "catch (" + type + " " + clause.getVariable() + ")";
            } else if (clause.getExceptionType() != null) {
                head = "catch (" + types.map(clause.getExceptionType()) + ")";
            } else {
                head = "catch";
            }
            if (clause.getFilter() != null) {
                head += " when (" + bare(clause.getFilter(), depth) + ")";
            }
            out.line(depth, head);
            Frame frame = frames.peek();
            if (frame != null) {
                frame.catchDepth++;
            }
            try {
                block(clause.getBody(), depth, out);
            } finally {
                if (frame != null) {
                    frame.catchDepth--;
                }
            }
        }
        if (statement.getFinallyBody() != null) {
            out.line(depth, "finally");
            block(statement.getFinallyBody(), depth, out);
        }
    }

    private String collectionOp(CollectionOpStatement op, int depth) {
        List<String> args = op.getArguments().stream().map(a -> bare(a, depth)).collect(Collectors.toList());
        String target = op.getCollection();
        return switch (op.getOperation()) {
            case PUSH -> target + ".Add(" + args.get(0) + ");";
            case PUT, SET_INDEX -> target + "[" + args.get(0) + "] = " + args.get(1) + ";";
            case REMOVE -> target + ".Remove(" + args.get(0) + ");";
            case CLEAR -> target + ".Clear();";
            case INSERT -> target + ".Insert(" + args.get(0) + ", " + args.get(1) + ");";
        };
    }

    /**
     * Pattern switch statement. Cases after the first unguarded catch-all are dropped; the
     * checker has already warned about them. In return position a missing catch-all gets a
     * throwing default so every path returns.
     */
    private void switchStatement(Expression target, List<MatchCase> cases, boolean returnPosition, int depth,
            CodeWriter out) {
        out.line(depth, "switch (" + bare(target, depth) + ")");
        out.line(depth, "{");
        boolean catchAll = false;
        for (MatchCase matchCase : cases) {
            if (catchAll) {
                break;
            }
            boolean irrefutable = matchCase.getGuard() == null && matchCase.getPattern().isIrrefutable();
            if (matchCase.getPattern().kind() == PatternKind.WILDCARD) {
                out.line(depth + 1, matchCase.getGuard() == null
                        ? "default:" : "case var _ when " + bare(matchCase.getGuard(), depth) + ":");
            } else {
                String guard = matchCase.getGuard() != null ? " when " + bare(matchCase.getGuard(), depth) : "";
                out.line(depth + 1, "case " + pattern(matchCase.getPattern(), depth) + guard + ":");
            }
            catchAll = irrefutable;

            if (breaksOut(matchCase.getBody())) {
                error(DiagnosticCode.UNSUPPORTED_CONSTRUCT, matchCase,
                        "Loop break inside a match case has no direct C# switch mapping");
            }
            out.line(depth + 1, "{");
            statements(matchCase.getBody(), depth + 2, out);
            if (!endsInJump(matchCase.getBody())) {
                out.line(depth + 2, "break;");
            }
            out.line(depth + 1, "}");
        }
        if (returnPosition && !catchAll) {
            out.line(depth + 1, "default:");
            out.line(depth + 2, "throw new InvalidOperationException(\"No match case for value\");");
        }
        out.line(depth, "}");
    }

    private static boolean endsInJump(List<Statement> body) {
        if (body.isEmpty()) {
            return false;
        }
        StatementKind last = body.get(body.size() - 1).kind();
        return last == StatementKind.RETURN || last == StatementKind.THROW || last == StatementKind.RETHROW
                || last == StatementKind.BREAK || last == StatementKind.CONTINUE;
    }

    /**
     * Whether a {@code break} in these statements targets an enclosing loop rather than a loop
     * of its own.
     */
    private static boolean breaksOut(List<Statement> body) {
        for (Statement statement : body) {
            boolean found = switch (statement.kind()) {
                case BREAK -> true;
                case IF -> {
                    IfStatement ifStatement = (IfStatement) statement;
                    boolean nested = breaksOut(ifStatement.getThenBody())
                            || ifStatement.getElseIfs().stream().anyMatch(e -> breaksOut(e.getBody()));
                    yield nested || (ifStatement.getElseBody() != null && breaksOut(ifStatement.getElseBody()));
                }
                case TRY -> {
                    TryStatement tryStatement = (TryStatement) statement;
                    yield breaksOut(tryStatement.getTryBody())
                            || tryStatement.getCatches().stream().anyMatch(c -> breaksOut(c.getBody()));
                }
                case USING -> breaksOut(((UsingStatement) statement).getBody());
                default -> false;
            };
            if (found) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    /**
     * Expression text safe to embed as an operand. Binary operators come back parenthesized.
     */
    private String expression(Expression expression, int depth) {
        return switch (expression.kind()) {
            case LITERAL -> literal((LiteralExpression) expression);
            case REFERENCE -> reference(((ReferenceExpression) expression).getName());
            case BINARY -> binary((BinaryExpression) expression, depth, true);
            case UNARY -> unary((UnaryExpression) expression, depth);
            case CALL -> {
                CallExpression call = (CallExpression) expression;
                yield reference(call.getTarget()) + "(" + arguments(call.getArguments(), depth) + ")";
            }
            case NEW -> {
                NewExpression creation = (NewExpression) expression;
                yield "new " + types.map(creation.getTypeName()) + "(" + arguments(creation.getArguments(), depth) + ")";
            }
            case FIELD_ACCESS -> {
                FieldAccessExpression access = (FieldAccessExpression) expression;
                yield primary(access.getTarget(), depth) + "." + access.getMember();
            }
            case CONDITIONAL -> {
                ConditionalExpression conditional = (ConditionalExpression) expression;
                yield "(" + bare(conditional.getCondition(), depth) + " ? " + bare(conditional.getWhenTrue(), depth)
                        + " : " + bare(conditional.getWhenFalse(), depth) + ")";
            }
            case MATCH -> switchExpression((MatchExpression) expression, depth);
            case AWAIT -> {
                AwaitExpression await = (AwaitExpression) expression;
                String awaited = primary(await.getAwaited(), depth);
                yield await.getConfigureAwait() != null
                        ? "await " + awaited + ".ConfigureAwait(" + await.getConfigureAwait() + ")"
                        : "await " + awaited;
            }
            case LAMBDA -> lambda((LambdaExpression) expression, depth);
            case STRING_OP -> stringOp((StringOpExpression) expression, depth);
            case CHAR_OP -> charOp((CharOpExpression) expression, depth);
            case BUILDER_OP -> builderOp((BuilderOpExpression) expression, depth);
            case OPTION_RESULT -> optionResult((OptionResultExpression) expression, depth);
            case CAST -> {
                CastExpression cast = (CastExpression) expression;
                yield "((" + types.map(cast.getTargetType()) + ")" + primary(cast.getOperand(), depth) + ")";
            }
            case UNCHECKED -> unchecked((UncheckedExpression) expression, depth);
            case UNWRAP -> {
                UnwrapExpression unwrap = (UnwrapExpression) expression;
                String operand = primary(unwrap.getOperand(), depth);
                yield unwrap.getDefaultValue() != null
                        ? operand + ".UnwrapOr(" + bare(unwrap.getDefaultValue(), depth) + ")"
                        : operand + ".Unwrap()";
            }
        };
    }

    /**
     * Expression text for a position that needs no grouping: a statement, an argument, or a
     * condition.
     */
    private String bare(Expression expression, int depth) {
        if (expression instanceof BinaryExpression binary) {
            return binary(binary, depth, false);
        }
        return expression(expression, depth);
    }

    /**
     * Expression text usable as a member-access receiver.
     */
    private String primary(Expression expression, int depth) {
        String text = expression(expression, depth);
        boolean wrap = switch (expression.kind()) {
            case UNARY, AWAIT, LAMBDA, MATCH -> true;
            case LITERAL -> text.startsWith("-");
            default -> false;
        };
        return wrap ? "(" + text + ")" : text;
    }

    private String arguments(List<Expression> arguments, int depth) {
        List<String> parts = new ArrayList<>();
        for (Expression argument : arguments) {
            parts.add(bare(argument, depth));
        }
        return String.join(", ", parts);
    }

    private String reference(String name) {
        if (resultAlias != null && name.equals("result")) {
            return resultAlias;
        }
        if (!inModuleClass && !name.contains(".") && moduleFunctions.contains(name)) {
            return moduleClassName + "." + name;
        }
        return name;
    }

    private String binary(BinaryExpression binary, int depth, boolean grouped) {
        BinaryOperator operator = binary.getOperator();
        if (operator == BinaryOperator.POWER) {
            return "Math.Pow(" + bare(binary.getLeft(), depth) + ", " + bare(binary.getRight(), depth) + ")";
        }

        if (operator.isArithmetic() && overflow == Overflow.DEFAULT && overflowChecked(binary)) {
            overflow = Overflow.CHECKED;
            try {
                return "checked(" + operands(binary, depth) + ")";
            } finally {
                overflow = Overflow.DEFAULT;
            }
        }
        String text = operands(binary, depth);
        return grouped ? "(" + text + ")" : text;
    }

    private String operands(BinaryExpression binary, int depth) {
        String left = expression(binary.getLeft(), depth);
        String right = expression(binary.getRight(), depth);
        return left + " " + binary.getOperator().getHostSymbol() + " " + right;
    }

    /**
     * Integer arithmetic traps overflow. Only operands known to be non-integral skip it.
     */
    private boolean overflowChecked(BinaryExpression binary) {
        CalorType type = context.getModel().typeOf(binary);
        return type == null || type.isUnknown() || type.isIntegral();
    }

    /**
     * An integral counter stepping past the inclusive bound must trap instead of wrapping,
     * otherwise {@code i <= int.MaxValue} never turns false.
     */
    private String loopStep(ForStatement loop, String variable, String delta, String plain) {
        CalorType type = context.getModel().typeOf(loop.getFrom());
        if (type == null || type.isUnknown() || type.isIntegral()) {
            return variable + " = checked(" + variable + " " + delta + ")";
        }
        return plain;
    }

    private String unchecked(UncheckedExpression expression, int depth) {
        Overflow saved = overflow;
        overflow = Overflow.UNCHECKED;
        try {
            return "unchecked(" + bare(expression.getOperand(), depth) + ")";
        } finally {
            overflow = saved;
        }
    }

    private String unary(UnaryExpression unary, int depth) {
        String operand = primary(unary.getOperand(), depth);
        return switch (unary.getOperator()) {
            case NOT -> "!" + operand;
            case NEGATE -> "-" + operand;
            case BITWISE_NOT -> "~" + operand;
            case INCREMENT -> "++" + operand;
            case DECREMENT -> "--" + operand;
            case POST_INCREMENT -> operand + "++";
            case POST_DECREMENT -> operand + "--";
        };
    }

    private String lambda(LambdaExpression lambda, int depth) {
        boolean typed = !lambda.getParameters().isEmpty()
                && lambda.getParameters().stream().allMatch(p -> p.getType() != null && !p.getType().isBlank());
        String params = lambda.getParameters().stream()
                .map(p -> typed ? types.map(p.getType()) + " " + p.getName() : p.getName())
                .collect(Collectors.joining(", ", "(", ")"));
        String head = (lambda.isAsync() ? "async " : "") + params + " =>";

        Overflow savedOverflow = overflow;
        String savedAlias = resultAlias;
        overflow = Overflow.DEFAULT;
        resultAlias = null;
        frames.push(new Frame(lambda.getId(), List.of(), false));
        try {
            if (lambda.getExpressionBody() != null) {
                return head + " " + bare(lambda.getExpressionBody(), depth);
            }
            CodeWriter out = new CodeWriter(context.getIndent());
            out.line(depth, "{");
            statements(lambda.getStatementBody(), depth + 1, out);
            out.line(depth, "}");
            return head + "\n" + out.render();
        } finally {
            frames.pop();
            overflow = savedOverflow;
            resultAlias = savedAlias;
        }
    }

    /**
     * A match lowers to a switch expression when every arm yields a value or throws.
     */
    private static boolean isSwitchExpression(List<MatchCase> cases) {
        for (MatchCase matchCase : cases) {
            if (matchCase.getBody().size() != 1) {
                return false;
            }
            Statement only = matchCase.getBody().get(0);
            boolean valued = only instanceof ReturnStatement ret && ret.getValue() != null;
            if (!valued && only.kind() != StatementKind.THROW) {
                return false;
            }
        }
        return !cases.isEmpty();
    }

    private String switchExpression(MatchExpression match, int depth) {
        if (!isSwitchExpression(match.getCases())) {
            error(DiagnosticCode.UNSUPPORTED_CONSTRUCT, match,
                    "Match expression '" + match.getId() + "' with statement arms can only be lowered in return position");
            return "default";
        }
        CodeWriter out = new CodeWriter(context.getIndent());
        out.line(depth, "{");
        for (MatchCase matchCase : match.getCases()) {
            String guard = matchCase.getGuard() != null ? " when " + bare(matchCase.getGuard(), depth + 1) : "";
            Statement only = matchCase.getBody().get(0);
            String value = only instanceof ReturnStatement ret
                    ? bare(ret.getValue(), depth + 1)
                    : "throw " + bare(((ThrowStatement) only).getException(), depth + 1);
            out.line(depth + 1, pattern(matchCase.getPattern(), depth + 1) + guard + " => " + value + ",");
            if (matchCase.getGuard() == null && matchCase.getPattern().isIrrefutable()) {
                break;
            }
        }
        out.line(depth, "}");
        return primary(match.getTarget(), depth) + " switch\n" + out.render();
    }

    private String stringOp(StringOpExpression op, int depth) {
        List<Expression> args = op.getArguments();
        String mode = "";
        if (op.getComparisonMode() != null) {
            mode = ", " + op.getComparisonMode().getHostConstant();
        }
        return switch (op.getOperation()) {
            case LENGTH -> primary(args.get(0), depth) + ".Length";
            case CONTAINS -> primary(args.get(0), depth) + ".Contains(" + bare(args.get(1), depth) + mode + ")";
            case STARTS_WITH -> primary(args.get(0), depth) + ".StartsWith(" + bare(args.get(1), depth) + mode + ")";
            case ENDS_WITH -> primary(args.get(0), depth) + ".EndsWith(" + bare(args.get(1), depth) + mode + ")";
            case INDEX_OF -> primary(args.get(0), depth) + ".IndexOf(" + bare(args.get(1), depth) + mode + ")";
            case EQUALS -> "string.Equals(" + arguments(args, depth) + mode + ")";
            case IS_EMPTY -> "string.IsNullOrEmpty(" + bare(args.get(0), depth) + ")";
            case IS_BLANK -> "string.IsNullOrWhiteSpace(" + bare(args.get(0), depth) + ")";
            case SUBSTRING -> primary(args.get(0), depth) + ".Substring(" + arguments(args.subList(1, args.size()), depth) + ")";
            case REPLACE -> primary(args.get(0), depth) + ".Replace(" + arguments(args.subList(1, args.size()), depth) + ")";
            case UPPER -> primary(args.get(0), depth) + ".ToUpper()";
            case LOWER -> primary(args.get(0), depth) + ".ToLower()";
            case TRIM -> primary(args.get(0), depth) + ".Trim()";
            case TRIM_START -> primary(args.get(0), depth) + ".TrimStart()";
            case TRIM_END -> primary(args.get(0), depth) + ".TrimEnd()";
            case PAD_LEFT -> primary(args.get(0), depth) + ".PadLeft(" + arguments(args.subList(1, args.size()), depth) + ")";
            case PAD_RIGHT -> primary(args.get(0), depth) + ".PadRight(" + arguments(args.subList(1, args.size()), depth) + ")";
            case JOIN -> "string.Join(" + arguments(args, depth) + ")";
            case FORMAT -> "string.Format(" + arguments(args, depth) + ")";
            case CONCAT -> "string.Concat(" + arguments(args, depth) + ")";
            case SPLIT -> primary(args.get(0), depth) + ".Split(" + bare(args.get(1), depth) + ")";
            case TO_STRING -> primary(args.get(0), depth) + ".ToString()";
            case REGEX_TEST -> {
                usings.addUsing("System.Text.RegularExpressions");
                yield "Regex.IsMatch(" + arguments(args, depth) + ")";
            }
            case REGEX_REPLACE -> {
                usings.addUsing("System.Text.RegularExpressions");
                yield "Regex.Replace(" + arguments(args, depth) + ")";
            }
        };
    }

    private String charOp(CharOpExpression op, int depth) {
        List<Expression> args = op.getArguments();
        return switch (op.getOperation()) {
            case CHAR_AT -> primary(args.get(0), depth) + "[" + bare(args.get(1), depth) + "]";
            case CHAR_CODE -> "((int)" + primary(args.get(0), depth) + ")";
            case CHAR_FROM_CODE -> "((char)" + primary(args.get(0), depth) + ")";
            case IS_LETTER -> "char.IsLetter(" + bare(args.get(0), depth) + ")";
            case IS_DIGIT -> "char.IsDigit(" + bare(args.get(0), depth) + ")";
            case IS_WHITESPACE -> "char.IsWhiteSpace(" + bare(args.get(0), depth) + ")";
            case IS_UPPER -> "char.IsUpper(" + bare(args.get(0), depth) + ")";
            case IS_LOWER -> "char.IsLower(" + bare(args.get(0), depth) + ")";
            case TO_UPPER -> "char.ToUpper(" + bare(args.get(0), depth) + ")";
            case TO_LOWER -> "char.ToLower(" + bare(args.get(0), depth) + ")";
        };
    }

    private String builderOp(BuilderOpExpression op, int depth) {
        usings.addUsing("System.Text");
        List<Expression> args = op.getArguments();
        return switch (op.getOperation()) {
            case NEW -> "new StringBuilder(" + arguments(args, depth) + ")";
            case APPEND -> primary(args.get(0), depth) + ".Append(" + bare(args.get(1), depth) + ")";
            case APPEND_LINE -> primary(args.get(0), depth) + ".AppendLine(" + arguments(args.subList(1, args.size()), depth) + ")";
            case INSERT -> primary(args.get(0), depth) + ".Insert(" + arguments(args.subList(1, args.size()), depth) + ")";
            case REMOVE -> primary(args.get(0), depth) + ".Remove(" + arguments(args.subList(1, args.size()), depth) + ")";
            case CLEAR -> primary(args.get(0), depth) + ".Clear()";
            case TO_STRING -> primary(args.get(0), depth) + ".ToString()";
            case LENGTH -> primary(args.get(0), depth) + ".Length";
        };
    }

    private String optionResult(OptionResultExpression expression, int depth) {
        return switch (expression.getVariant()) {
            case SOME -> expression.getTypeName() != null
                    ? "Calor.Runtime.Option<" + types.map(expression.getTypeName()) + ">.Some(" + bare(expression.getValue(), depth) + ")"
                    : "Calor.Runtime.Option.Some(" + bare(expression.getValue(), depth) + ")";
            case NONE -> expression.getTypeName() != null && !expression.getTypeName().isBlank()
                    ? "Calor.Runtime.Option<" + types.map(expression.getTypeName()) + ">.None"
                    : "default";
            case OK -> "Calor.Runtime.Result.Ok(" + bare(expression.getValue(), depth) + ")";
            case ERR -> "Calor.Runtime.Result.Err(" + bare(expression.getValue(), depth) + ")";
        };
    }

    private String literal(LiteralExpression literal) {
        Object value = literal.getValue();
        return switch (literal.getLiteralKind()) {
            case INT -> {
                long number = ((Number) value).longValue();
                yield number > Integer.MAX_VALUE || number < Integer.MIN_VALUE ? number + "L" : String.valueOf(number);
            }
            case FLOAT -> {
                double number = ((Number) value).doubleValue();
                if (Double.isNaN(number)) {
                    yield "double.NaN";
                }
                if (Double.isInfinite(number)) {
                    yield number > 0 ? "double.PositiveInfinity" : "double.NegativeInfinity";
                }
                String text = BigDecimal.valueOf(number).toPlainString();
                yield text.contains(".") ? text : text + ".0";
            }
            case DECIMAL -> ((BigDecimal) value).toPlainString() + "m";
            case STRING -> literal(String.valueOf(value), '"');
            case CHAR -> literal(String.valueOf(value), '\'');
            case BOOL -> String.valueOf(value);
            case NULL -> "null";
        };
    }

    /**
     * C# quoted literal with the usual escapes.
     */
    private static String literal(String text, char delimiter) {
        StringBuilder out = new StringBuilder().append(delimiter);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\0' -> out.append("\\0");
                default -> {
                    if (c == delimiter) {
                        out.append('\\');
                    }
                    out.append(c);
                }
            }
        }
        return out.append(delimiter).toString();
    }

    private static boolean isLiteral(Expression expression, long expected) {
        return expression instanceof LiteralExpression literal && literal.getLiteralKind() == LiteralKind.INT
                && ((Number) literal.getValue()).longValue() == expected;
    }

    private static boolean isNegative(Expression step) {
        if (step instanceof LiteralExpression literal && literal.getValue() instanceof Number number) {
            return number.doubleValue() < 0;
        }
        return step != null && step.kind() == ExpressionKind.UNARY
                && ((UnaryExpression) step).getOperator() == UnaryOperator.NEGATE;
    }

    // ---------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------

    private String pattern(Pattern pattern, int depth) {
        return switch (pattern.kind()) {
            case WILDCARD -> "_";
            case LITERAL -> literal(((LiteralPattern) pattern).getLiteral());
            case VARIABLE -> "var " + ((VariablePattern) pattern).getName();
            case RELATIONAL -> {
                RelationalPattern relational = (RelationalPattern) pattern;
                yield relational.getOperator().getHostSymbol() + " " + expression(relational.getValue(), depth);
            }
            case OPTION_RESULT -> optionResultPattern((OptionResultPattern) pattern, depth);
            case PROPERTY -> {
                PropertyPattern property = (PropertyPattern) pattern;
                String matches = property.getMatches().stream()
                        .map(m -> m.getProperty() + ": " + pattern(m.getPattern(), depth))
                        .collect(Collectors.joining(", "));
                String type = property.getTypeName() != null ? types.qualify(property.getTypeName()) + " " : "";
                yield matches.isEmpty() ? type + "{ }" : type + "{ " + matches + " }";
            }
            case POSITIONAL -> {
                PositionalPattern positional = (PositionalPattern) pattern;
                String type = positional.getTypeName() != null ? types.qualify(positional.getTypeName()) : "";
                yield type + positional.getElements().stream().map(p -> pattern(p, depth))
                        .collect(Collectors.joining(", ", "(", ")"));
            }
            case LIST -> {
                ListPattern list = (ListPattern) pattern;
                List<String> elements = new ArrayList<>();
                list.getElements().forEach(p -> elements.add(pattern(p, depth)));
                if (list.getRest() != null) {
                    elements.add(list.getRest().equals("_") ? ".." : ".. var " + list.getRest());
                }
                yield "[" + String.join(", ", elements) + "]";
            }
        };
    }

    private String optionResultPattern(OptionResultPattern pattern, int depth) {
        String inner = pattern.getInner() != null && pattern.getInner().kind() != PatternKind.WILDCARD
                ? pattern(pattern.getInner(), depth) : null;
        return switch (pattern.getVariant()) {
            case SOME -> inner != null ? "{ IsSome: true, Value: " + inner + " }" : "{ IsSome: true }";
            case NONE -> "{ IsSome: false }";
            case OK -> inner != null ? "{ IsOk: true, Value: " + inner + " }" : "{ IsOk: true }";
            case ERR -> inner != null ? "{ IsOk: false, Error: " + inner + " }" : "{ IsOk: false }";
        };
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    private void error(DiagnosticCode code, Node node, String message) {
        failed = true;
        context.getDiagnostics().report(code, spanOf(node), message);
    }

    private void warn(DiagnosticCode code, Node node, String message) {
        context.getDiagnostics().add(Diagnostic.builder()
                .severity(Severity.WARNING)
                .code(code)
                .span(spanOf(node))
                .message(message)
                .build());
    }

    private static Span spanOf(Node node) {
        return node.getSpan() != null ? node.getSpan() : Span.EMPTY;
    }
}
