package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code target.member}. Dotted source names such as {@code a.b.c} become a
 * root reference wrapped in one access per segment.
 */
@Value
public class FieldAccessExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression target;

    @NonNull
    String member;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.FIELD_ACCESS;
    }
}
