package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.stmt.Statement;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §LAM{id:p:type…} body §/LAM{id}}. Exactly one of {@code expressionBody} and a
 * non-empty {@code statementBody} is present.
 */
@Value
public class LambdaExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    boolean async;

    @NonNull
    List<Parameter> parameters;

    Expression expressionBody;

    @NonNull
    List<Statement> statementBody;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LAMBDA;
    }
}
