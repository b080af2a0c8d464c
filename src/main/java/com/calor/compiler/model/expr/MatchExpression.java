package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class MatchExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    Expression target;

    @NonNull
    List<MatchCase> cases;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.MATCH;
    }
}
