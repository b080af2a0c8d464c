package com.calor.compiler.codegen.calor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calor.compiler.codegen.CodeWriter;
import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.ContractClause;
import com.calor.compiler.model.Parameter;
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
import com.calor.compiler.model.expr.BuilderOpExpression;
import com.calor.compiler.model.expr.CallExpression;
import com.calor.compiler.model.expr.CastExpression;
import com.calor.compiler.model.expr.CharOpExpression;
import com.calor.compiler.model.expr.ConditionalExpression;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.expr.FieldAccessExpression;
import com.calor.compiler.model.expr.LambdaExpression;
import com.calor.compiler.model.expr.LiteralExpression;
import com.calor.compiler.model.expr.MatchCase;
import com.calor.compiler.model.expr.MatchExpression;
import com.calor.compiler.model.expr.NewExpression;
import com.calor.compiler.model.expr.OptionResultExpression;
import com.calor.compiler.model.expr.ReferenceExpression;
import com.calor.compiler.model.expr.StringOpExpression;
import com.calor.compiler.model.expr.UnaryExpression;
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

/**
 * Writes an AST back out as canonical Calor.
 *
 * Output re-parses to a structurally equal tree: IDs are written back verbatim, body forms
 * follow the recorded {@link BodyForm} and visibility is always explicit. Indentation is two
 * spaces per level.
 */
public class CalorEmitter {
    private static final Logger log = LoggerFactory.getLogger(CalorEmitter.class);

    private static final String INDENT = "  ";

    /**
     * Emit a whole module. The result ends with a newline.
     */
    public String emit(ModuleDeclaration module) {
        CalorEmitContext context = new CalorEmitContext();
        CodeWriter out = new CodeWriter(INDENT);
        module(module, 0, out, context);
        log.debug("Emitted Calor for module {}", module.getName());
        return out.render() + "\n";
    }

    /**
     * Canonical inline text of one expression, as used in contract messages.
     */
    public String formatExpression(Expression expression) {
        return expression(expression, 0, new CalorEmitContext());
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private void module(ModuleDeclaration module, int depth, CodeWriter out, CalorEmitContext context) {
        out.line(depth, "§M{" + module.getId() + ":" + module.getName() + "}");
        for (UsingDirective using : module.getUsings()) {
            out.line(depth + 1, using(using));
        }
        for (ContractClause invariant : module.getInvariants()) {
            out.line(depth + 1, contract("§IV", invariant, depth + 1, context));
        }
        for (Declaration member : module.getMembers()) {
            out.blank();
            declaration(member, depth + 1, out, context);
        }
        out.blank();
        out.line(depth, "§/M{" + module.getId() + "}");
    }

    private static String using(UsingDirective using) {
        if (using.isStaticImport()) {
            return "§U{static:" + using.getNamespace() + "}";
        }
        if (using.getAlias() != null) {
            return "§U{" + using.getAlias() + ":" + using.getNamespace() + "}";
        }
        return "§U{" + using.getNamespace() + "}";
    }

    private void declaration(Declaration declaration, int depth, CodeWriter out, CalorEmitContext context) {
        switch (declaration.kind()) {
            case MODULE -> module((ModuleDeclaration) declaration, depth, out, context);
            case FUNCTION -> function((FunctionDeclaration) declaration, depth, out, context);
            case CLASS -> classDeclaration((ClassDeclaration) declaration, depth, out, context);
            case INTERFACE -> {
                InterfaceDeclaration iface = (InterfaceDeclaration) declaration;
                out.line(depth, "§IFACE{" + iface.getId() + ":" + iface.getName() + "}");
                for (FunctionDeclaration method : iface.getMethods()) {
                    function(method, depth + 1, out, context);
                }
                out.line(depth, "§/IFACE{" + iface.getId() + "}");
            }
            case ENUM -> {
                EnumDeclaration enumeration = (EnumDeclaration) declaration;
                String underlying = enumeration.getUnderlyingType() != null
                        ? ":" + enumeration.getUnderlyingType() : "";
                out.line(depth, "§EN{" + enumeration.getId() + ":" + enumeration.getName() + underlying + "}");
                for (EnumMember member : enumeration.getMembers()) {
                    out.line(depth + 1, member.getValue() != null
                            ? member.getName() + " = " + member.getValue() : member.getName());
                }
                out.line(depth, "§/EN{" + enumeration.getId() + "}");
            }
            case ENUM_EXTENSION -> {
                EnumExtensionDeclaration extension = (EnumExtensionDeclaration) declaration;
                out.line(depth, "§EEXT{" + extension.getId() + ":" + extension.getEnumName() + "}");
                for (FunctionDeclaration method : extension.getMethods()) {
                    function(method, depth + 1, out, context);
                }
                out.line(depth, "§/EEXT{" + extension.getId() + "}");
            }
            case RECORD -> {
                RecordDeclaration record = (RecordDeclaration) declaration;
                out.line(depth, "§D{" + record.getId() + ":" + record.getName() + "}");
                for (Parameter field : record.getFields()) {
                    out.line(depth + 1, "§FL{" + nullToEmpty(field.getType()) + ":" + field.getName() + "}");
                }
                out.line(depth, "§/D{" + record.getId() + "}");
            }
            case UNION -> {
                UnionTypeDeclaration union = (UnionTypeDeclaration) declaration;
                out.line(depth, "§T{" + union.getId() + ":" + union.getName() + "}");
                for (UnionCase unionCase : union.getCases()) {
                    out.line(depth + 1, "§V{" + unionCase.getName() + "}");
                    for (Parameter field : unionCase.getFields()) {
                        out.line(depth + 2, "§FL{" + nullToEmpty(field.getType()) + ":" + field.getName() + "}");
                    }
                }
                out.line(depth, "§/T{" + union.getId() + "}");
            }
            case FIELD -> {
                FieldDeclaration field = (FieldDeclaration) declaration;
                String head = "§FLD{" + nullToEmpty(field.getType()) + ":" + field.getName() + ":"
                        + field.getVisibility().getShorthand() + modifiers(field.getModifiers()) + "}";
                out.line(depth, field.getInitializer() != null
                        ? head + " = " + expression(field.getInitializer(), depth, context) : head);
            }
            case PROPERTY -> property((PropertyDeclaration) declaration, depth, out, context);
            case CONSTRUCTOR -> constructor((ConstructorDeclaration) declaration, depth, out, context);
            case DELEGATE -> {
                DelegateDeclaration delegate = (DelegateDeclaration) declaration;
                out.line(depth, "§DEL{" + delegate.getId() + ":" + delegate.getName() + ":"
                        + delegate.getVisibility().getShorthand() + "}");
                parameters(delegate.getParameters(), depth + 1, out);
                if (delegate.getReturnType() != null) {
                    out.line(depth + 1, "§O{" + delegate.getReturnType() + "}");
                }
                if (!delegate.getEffects().isEmpty()) {
                    out.line(depth + 1, "§E{" + String.join(",", delegate.getEffects().getCodes()) + "}");
                }
                out.line(depth, "§/DEL{" + delegate.getId() + "}");
            }
            case EVENT -> {
                EventDeclaration event = (EventDeclaration) declaration;
                out.line(depth, "§EVT{" + event.getId() + ":" + event.getName() + ":"
                        + event.getVisibility().getShorthand() + ":" + event.getDelegateType() + "}");
            }
        }
    }

    private void function(FunctionDeclaration function, int depth, CodeWriter out, CalorEmitContext context) {
        String tag;
        if (function.isMethod()) {
            tag = function.isAsync() ? "AMT" : "MT";
        } else {
            tag = function.isAsync() ? "AF" : "F";
        }

        out.line(depth, "§" + tag + "{" + function.getId() + ":" + function.getName() + ":"
                + function.getVisibility().getShorthand() + modifiers(function.getModifiers()) + "}");
        parameters(function.getParameters(), depth + 1, out);
        if (function.getReturnType() != null) {
            out.line(depth + 1, "§O{" + function.getReturnType() + "}");
        }
        if (!function.getEffects().isEmpty()) {
            out.line(depth + 1, "§E{" + String.join(",", function.getEffects().getCodes()) + "}");
        }
        for (ContractClause clause : function.getPreconditions()) {
            out.line(depth + 1, contract("§Q", clause, depth + 1, context));
        }
        for (ContractClause clause : function.getPostconditions()) {
            out.line(depth + 1, contract("§S", clause, depth + 1, context));
        }
        statements(function.getBody(), depth + 1, out, context);
        out.line(depth, "§/" + tag + "{" + function.getId() + "}");
    }

    private void classDeclaration(ClassDeclaration declaration, int depth, CodeWriter out, CalorEmitContext context) {
        out.line(depth, "§CL{" + declaration.getId() + ":" + declaration.getName()
                + modifiers(declaration.getModifiers()) + "}");
        if (declaration.getBaseClass() != null) {
            out.line(depth + 1, "§EXT{" + declaration.getBaseClass() + "}");
        }
        for (String iface : declaration.getInterfaces()) {
            out.line(depth + 1, "§IMPL{" + iface + "}");
        }
        for (ContractClause invariant : declaration.getInvariants()) {
            out.line(depth + 1, contract("§IV", invariant, depth + 1, context));
        }
        for (Declaration member : declaration.getMembers()) {
            declaration(member, depth + 1, out, context);
        }
        out.line(depth, "§/CL{" + declaration.getId() + "}");
    }

    private void property(PropertyDeclaration property, int depth, CodeWriter out, CalorEmitContext context) {
        out.line(depth, "§PROP{" + property.getId() + ":" + property.getName() + ":" + nullToEmpty(property.getType())
                + ":" + property.getVisibility().getShorthand() + "}");
        for (PropertyAccessor accessor : property.getAccessors()) {
            String tag = accessor.getAccessorKind().name();
            String visibility = accessor.getVisibility() != null
                    ? "{" + accessor.getVisibility().getShorthand() + "}" : "";
            out.line(depth + 1, "§" + tag + visibility);
            if (!accessor.getBody().isEmpty()) {
                statements(accessor.getBody(), depth + 2, out, context);
                out.line(depth + 1, "§/" + tag);
            }
        }
        if (property.getDefaultValue() != null) {
            out.line(depth + 1, "= " + expression(property.getDefaultValue(), depth + 1, context));
        }
        out.line(depth, "§/PROP{" + property.getId() + "}");
    }

    private void constructor(ConstructorDeclaration constructor, int depth, CodeWriter out,
            CalorEmitContext context) {
        out.line(depth, "§CTOR{" + constructor.getId() + ":" + constructor.getVisibility().getShorthand() + "}");
        parameters(constructor.getParameters(), depth + 1, out);
        for (ContractClause clause : constructor.getPreconditions()) {
            out.line(depth + 1, contract("§Q", clause, depth + 1, context));
        }
        if (constructor.getInitializer() != null) {
            String tag = constructor.getInitializer().isBase() ? "BASE" : "THIS";
            out.line(depth + 1, "§" + tag + arguments(constructor.getInitializer().getArguments(), depth + 1, context)
                    + " §/" + tag);
        }
        statements(constructor.getBody(), depth + 1, out, context);
        out.line(depth, "§/CTOR{" + constructor.getId() + "}");
    }

    private static void parameters(List<Parameter> parameters, int depth, CodeWriter out) {
        for (Parameter parameter : parameters) {
            out.line(depth, "§I{" + nullToEmpty(parameter.getType()) + ":" + parameter.getName() + "}");
        }
    }

    private String contract(String tag, ContractClause clause, int depth, CalorEmitContext context) {
        // Contract messages only escape quotes; the attribute reader keeps other backslashes as written
        String message = clause.getMessage() != null
                ? "{\"" + clause.getMessage().replace("\"", "\\\"") + "\"}" : "";
        return tag + message + " " + expression(clause.getCondition(), depth, context);
    }

    private static String modifiers(List<String> modifiers) {
        return modifiers.isEmpty() ? "" : ":" + String.join(",", modifiers);
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    private void statements(List<Statement> statements, int depth, CodeWriter out, CalorEmitContext context) {
        for (Statement statement : statements) {
            out.line(depth, statement(statement, depth, context));
        }
    }

    /**
     * Text of one statement whose first line sits at {@code depth}. The first line carries no
     * indent; any further lines are fully indented.
     */
    private String statement(Statement statement, int depth, CalorEmitContext context) {
        return switch (statement.kind()) {
            case BIND -> {
                BindStatement bind = (BindStatement) statement;
                String type = bind.getType() != null ? ":" + bind.getType() : "";
                yield "§B{" + (bind.isMutable() ? "~" : "") + bind.getName() + type + "} "
                        + expression(bind.getValue(), depth, context);
            }
            case ASSIGN -> {
                AssignStatement assign = (AssignStatement) statement;
                yield "§ASSIGN " + expression(assign.getTarget(), depth, context) + " "
                        + expression(assign.getValue(), depth, context);
            }
            case RETURN -> {
                ReturnStatement ret = (ReturnStatement) statement;
                yield ret.getValue() != null ? "§R " + expression(ret.getValue(), depth, context) : "§R";
            }
            case IF -> ifStatement((IfStatement) statement, depth, context);
            case FOR -> {
                ForStatement loop = (ForStatement) statement;
                String step = loop.getStep() != null ? ":" + expression(loop.getStep(), depth, context) : "";
                String head = "§L{" + loop.getId() + ":" + loop.getVariable() + ":"
                        + expression(loop.getFrom(), depth, context) + ":"
                        + expression(loop.getTo(), depth, context) + step + "}";
                CodeWriter out = new CodeWriter(INDENT);
                clause(out, depth, head, loop.getForm(), loop.getBody(), context);
                out.line(depth, "§/L{" + loop.getId() + "}");
                yield firstLineUnindented(out, depth);
            }
            case WHILE -> {
                WhileStatement loop = (WhileStatement) statement;
                CodeWriter out = new CodeWriter(INDENT);
                clause(out, depth, "§WH{" + loop.getId() + "} " + expression(loop.getCondition(), depth, context),
                        loop.getForm(), loop.getBody(), context);
                out.line(depth, "§/WH{" + loop.getId() + "}");
                yield firstLineUnindented(out, depth);
            }
            case DO_WHILE -> {
                DoWhileStatement loop = (DoWhileStatement) statement;
                CodeWriter out = new CodeWriter(INDENT);
                out.line(depth, "§DO{" + loop.getId() + "}");
                statements(loop.getBody(), depth + 1, out, context);
                out.line(depth, "§/DO{" + loop.getId() + "} " + expression(loop.getCondition(), depth, context));
                yield firstLineUnindented(out, depth);
            }
            case FOREACH -> {
                ForeachStatement loop = (ForeachStatement) statement;
                String type = loop.getVariableType() != null ? ":" + loop.getVariableType() : "";
                String head = "§EACH{" + loop.getId() + ":" + loop.getVariable() + type + "} "
                        + expression(loop.getCollection(), depth, context);
                CodeWriter out = new CodeWriter(INDENT);
                clause(out, depth, head, loop.getForm(), loop.getBody(), context);
                out.line(depth, "§/EACH{" + loop.getId() + "}");
                yield firstLineUnindented(out, depth);
            }
            case TRY -> tryStatement((TryStatement) statement, depth, context);
            case THROW -> "§TH " + expression(((ThrowStatement) statement).getException(), depth, context);
            case RETHROW -> "§RT";
            case BREAK -> "§BK";
            case CONTINUE -> "§CN";
            case PRINT -> {
                PrintStatement print = (PrintStatement) statement;
                yield (print.isNewline() ? "§P " : "§Pf ") + expression(print.getValue(), depth, context);
            }
            case COLLECTION_OP -> {
                CollectionOpStatement op = (CollectionOpStatement) statement;
                StringBuilder text = new StringBuilder("§" + op.getOperation().getTag() + "{" + op.getCollection() + "}");
                for (Expression argument : op.getArguments()) {
                    text.append(' ').append(expression(argument, depth, context));
                }
                yield text.toString();
            }
            case MATCH -> {
                MatchStatement match = (MatchStatement) statement;
                yield match(match.getId(), match.getTarget(), match.getCases(), false, depth, context);
            }
            case EXPRESSION -> expression(((ExpressionStatement) statement).getExpression(), depth, context);
            case USING -> {
                UsingStatement using = (UsingStatement) statement;
                String id = using.getId() == null || using.getId().isBlank()
                        ? context.getIds().next("u") : using.getId();
                String type = using.getVariableType() != null ? ":" + using.getVariableType() : "";
                CodeWriter out = new CodeWriter(INDENT);
                out.line(depth, "§USE{" + id + ":" + using.getVariable() + type + "} "
                        + expression(using.getResource(), depth, context));
                statements(using.getBody(), depth + 1, out, context);
                out.line(depth, "§/USE{" + id + "}");
                yield firstLineUnindented(out, depth);
            }
        };
    }

    private String ifStatement(IfStatement statement, int depth, CalorEmitContext context) {
        CodeWriter out = new CodeWriter(INDENT);
        clause(out, depth, "§IF{" + statement.getId() + "} " + expression(statement.getCondition(), depth, context),
                statement.getForm(), statement.getThenBody(), context);
        for (ElseIfClause elseIf : statement.getElseIfs()) {
            clause(out, depth, "§EI " + expression(elseIf.getCondition(), depth, context), elseIf.getForm(),
                    elseIf.getBody(), context);
        }
        if (statement.getElseBody() != null) {
            BodyForm form = statement.getElseForm() != null ? statement.getElseForm() : BodyForm.BLOCK;
            clause(out, depth, "§EL", form, statement.getElseBody(), context);
        }
        out.line(depth, "§/I{" + statement.getId() + "}");
        return firstLineUnindented(out, depth);
    }

    private String tryStatement(TryStatement statement, int depth, CalorEmitContext context) {
        CodeWriter out = new CodeWriter(INDENT);
        out.line(depth, "§TR{" + statement.getId() + "}");
        statements(statement.getTryBody(), depth + 1, out, context);
        for (CatchClause clause : statement.getCatches()) {
            String head = "§CA" + catchAttributes(clause);
            if (clause.getFilter() != null) {
                head += " §WHEN " + expression(clause.getFilter(), depth, context);
            }
            out.line(depth, head);
            statements(clause.getBody(), depth + 1, out, context);
        }
        if (statement.getFinallyBody() != null) {
            out.line(depth, "§FI");
            statements(statement.getFinallyBody(), depth + 1, out, context);
        }
        out.line(depth, "§/TR{" + statement.getId() + "}");
        return firstLineUnindented(out, depth);
    }

    private static String catchAttributes(CatchClause clause) {
        if (clause.getVariable() != null) {
            return "{" + nullToEmpty(clause.getExceptionType()) + ":" + clause.getVariable() + "}";
        }
        return clause.getExceptionType() != null ? "{" + clause.getExceptionType() + "}" : "";
    }

    /**
     * One {@code head → statement} line for a single-statement arrow body, otherwise the head
     * followed by the indented block.
     */
    private void clause(CodeWriter out, int depth, String head, BodyForm form, List<Statement> body,
            CalorEmitContext context) {
        if (form == BodyForm.ARROW && body.size() == 1) {
            out.line(depth, head + " → " + statement(body.get(0), depth, context));
            return;
        }
        out.line(depth, head);
        statements(body, depth + 1, out, context);
    }

    private String match(String id, Expression target, List<MatchCase> cases, boolean valued, int depth,
            CalorEmitContext context) {
        CodeWriter out = new CodeWriter(INDENT);
        out.line(depth, "§W{" + id + "} " + expression(target, depth, context));
        for (MatchCase matchCase : cases) {
            String head = "§K " + pattern(matchCase.getPattern(), depth + 1, context);
            if (matchCase.getGuard() != null) {
                head += " §WHEN " + expression(matchCase.getGuard(), depth + 1, context);
            }

            List<Statement> body = matchCase.getBody();
            if (matchCase.getForm() == BodyForm.ARROW && body.size() == 1) {
                Statement only = body.get(0);
                String text = valued && only instanceof ReturnStatement ret && ret.getValue() != null
                        ? expression(ret.getValue(), depth + 1, context)
                        : statement(only, depth + 1, context);
                out.line(depth + 1, head + " → " + text);
            } else {
                out.line(depth + 1, head);
                statements(body, depth + 2, out, context);
                out.line(depth + 1, "§/K");
            }
        }
        out.line(depth, "§/W{" + id + "}");
        return firstLineUnindented(out, depth);
    }

    // ---------------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------------

    private String pattern(Pattern pattern, int depth, CalorEmitContext context) {
        return switch (pattern.kind()) {
            case WILDCARD -> "_";
            case LITERAL -> literal(((LiteralPattern) pattern).getLiteral());
            case VARIABLE -> {
                String name = ((VariablePattern) pattern).getName();
                yield isPlainVariableName(name) ? name : "§VAR{" + name + "}";
            }
            case RELATIONAL -> {
                RelationalPattern relational = (RelationalPattern) pattern;
                yield "§PREL{" + relational.getOperator().getKeyword() + "} "
                        + expression(relational.getValue(), depth, context);
            }
            case OPTION_RESULT -> {
                OptionResultPattern variant = (OptionResultPattern) pattern;
                String tag = "§" + variant.getVariant().getTag();
                yield variant.getInner() != null ? tag + " " + pattern(variant.getInner(), depth, context) : tag;
            }
            case PROPERTY -> {
                PropertyPattern property = (PropertyPattern) pattern;
                StringBuilder text = new StringBuilder("§PPROP{" + property.getTypeName() + "}");
                for (PropertyMatch match : property.getMatches()) {
                    text.append(" §PMATCH{").append(match.getProperty()).append("} ")
                            .append(pattern(match.getPattern(), depth, context));
                }
                yield text.toString();
            }
            case POSITIONAL -> {
                PositionalPattern positional = (PositionalPattern) pattern;
                StringBuilder text = new StringBuilder("§PPOS{" + positional.getTypeName() + "}");
                for (Pattern element : positional.getElements()) {
                    text.append(' ').append(pattern(element, depth, context));
                }
                yield text.toString();
            }
            case LIST -> {
                ListPattern list = (ListPattern) pattern;
                StringBuilder text = new StringBuilder("§PLIST");
                for (Pattern element : list.getElements()) {
                    text.append(' ').append(pattern(element, depth, context));
                }
                if (list.getRest() != null) {
                    text.append(" §REST{").append(list.getRest()).append('}');
                }
                yield text.toString();
            }
        };
    }

    /**
     * A bare identifier reads back as a variable unless it is a keyword the pattern grammar
     * gives another meaning.
     */
    private static boolean isPlainVariableName(String name) {
        return !name.equals("_") && RelationalOperator.fromKeyword(name) == null
                && !name.equals("true") && !name.equals("false") && !name.equals("null");
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    private String expression(Expression expression, int depth, CalorEmitContext context) {
        return switch (expression.kind()) {
            case LITERAL -> literal((LiteralExpression) expression);
            case REFERENCE -> ((ReferenceExpression) expression).getName();
            case FIELD_ACCESS -> {
                FieldAccessExpression access = (FieldAccessExpression) expression;
                yield expression(access.getTarget(), depth, context) + "." + access.getMember();
            }
            case BINARY -> {
                BinaryExpression binary = (BinaryExpression) expression;
                yield "(" + binary.getOperator().getSymbol() + " " + expression(binary.getLeft(), depth, context)
                        + " " + expression(binary.getRight(), depth, context) + ")";
            }
            case UNARY -> {
                UnaryExpression unary = (UnaryExpression) expression;
                yield "(" + unary.getOperator().getSymbol() + " " + expression(unary.getOperand(), depth, context) + ")";
            }
            case CALL -> {
                CallExpression call = (CallExpression) expression;
                yield "§C{" + call.getTarget() + (call.isFallible() ? "!" : "") + "}"
                        + arguments(call.getArguments(), depth, context) + " §/C";
            }
            case NEW -> {
                NewExpression creation = (NewExpression) expression;
                yield "§NEW{" + creation.getTypeName() + "}" + arguments(creation.getArguments(), depth, context)
                        + " §/NEW";
            }
            case CONDITIONAL -> {
                ConditionalExpression conditional = (ConditionalExpression) expression;
                yield lispForm("?", List.of(conditional.getCondition(), conditional.getWhenTrue(),
                        conditional.getWhenFalse()), null, depth, context);
            }
            case MATCH -> {
                MatchExpression match = (MatchExpression) expression;
                yield match(match.getId(), match.getTarget(), match.getCases(), true, depth, context);
            }
            case AWAIT -> {
                AwaitExpression await = (AwaitExpression) expression;
                String flag = await.getConfigureAwait() != null ? "{" + await.getConfigureAwait() + "}" : "";
                yield "§AWAIT" + flag + " " + expression(await.getAwaited(), depth, context);
            }
            case LAMBDA -> lambda((LambdaExpression) expression, depth, context);
            case STRING_OP -> {
                StringOpExpression op = (StringOpExpression) expression;
                String mode = op.getComparisonMode() != null ? op.getComparisonMode().getKeyword() : null;
                yield lispForm(op.getOperation().getName(), op.getArguments(), mode, depth, context);
            }
            case CHAR_OP -> {
                CharOpExpression op = (CharOpExpression) expression;
                yield lispForm(op.getOperation().getName(), op.getArguments(), null, depth, context);
            }
            case BUILDER_OP -> {
                BuilderOpExpression op = (BuilderOpExpression) expression;
                yield lispForm(op.getOperation().getName(), op.getArguments(), null, depth, context);
            }
            case OPTION_RESULT -> {
                OptionResultExpression variant = (OptionResultExpression) expression;
                String tag = "§" + variant.getVariant().getTag();
                if (variant.getValue() != null) {
                    yield tag + " " + expression(variant.getValue(), depth, context);
                }
                yield variant.getTypeName() != null ? tag + "{" + variant.getTypeName() + "}" : tag;
            }
            case CAST -> {
                CastExpression cast = (CastExpression) expression;
                yield "(cast " + cast.getTargetType() + " " + expression(cast.getOperand(), depth, context) + ")";
            }
            case UNCHECKED -> lispForm("unchecked", List.of(((UncheckedExpression) expression).getOperand()), null,
                    depth, context);
            case UNWRAP -> {
                UnwrapExpression unwrap = (UnwrapExpression) expression;
                yield unwrap.getDefaultValue() != null
                        ? lispForm("unwrap-or", List.of(unwrap.getOperand(), unwrap.getDefaultValue()), null, depth,
                                context)
                        : lispForm("unwrap", List.of(unwrap.getOperand()), null, depth, context);
            }
        };
    }

    private String lispForm(String head, List<Expression> arguments, String mode, int depth,
            CalorEmitContext context) {
        StringBuilder text = new StringBuilder("(").append(head);
        for (Expression argument : arguments) {
            text.append(' ').append(expression(argument, depth, context));
        }
        if (mode != null) {
            text.append(" :").append(mode);
        }
        return text.append(')').toString();
    }

    private String arguments(List<Expression> arguments, int depth, CalorEmitContext context) {
        StringBuilder text = new StringBuilder();
        for (Expression argument : arguments) {
            text.append(" §A ").append(expression(argument, depth, context));
        }
        return text.toString();
    }

    private String lambda(LambdaExpression lambda, int depth, CalorEmitContext context) {
        List<String> attributes = new ArrayList<>();
        attributes.add(lambda.getId());
        if (lambda.isAsync()) {
            attributes.add("async");
        }
        for (Parameter parameter : lambda.getParameters()) {
            attributes.add(parameter.getName());
            if (parameter.getType() != null) {
                attributes.add(parameter.getType());
            }
        }
        String head = "§LAM{" + String.join(":", attributes) + "}";
        String close = "§/LAM{" + lambda.getId() + "}";

        if (lambda.getExpressionBody() != null) {
            return head + " " + expression(lambda.getExpressionBody(), depth, context) + " " + close;
        }
        CodeWriter out = new CodeWriter(INDENT);
        out.line(depth, head);
        statements(lambda.getStatementBody(), depth + 1, out, context);
        out.line(depth, close);
        return firstLineUnindented(out, depth);
    }

    private static String literal(LiteralExpression literal) {
        Object value = literal.getValue();
        return switch (literal.getLiteralKind()) {
            case INT, BOOL -> String.valueOf(value);
            case FLOAT -> {
                String text = BigDecimal.valueOf(((Number) value).doubleValue()).toPlainString();
                yield text.contains(".") ? text : text + ".0";
            }
            case DECIMAL -> ((BigDecimal) value).toPlainString() + "m";
            case STRING -> quote((String) value, '"');
            case CHAR -> quote(String.valueOf(value), '\'');
            case NULL -> "null";
        };
    }

    private static String quote(String text, char delimiter) {
        StringBuilder out = new StringBuilder().append(delimiter);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\0' -> out.append("\\0");
                case '\\' -> out.append("\\\\");
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

    private static String firstLineUnindented(CodeWriter out, int depth) {
        return out.render().substring(out.indent(depth).length());
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
