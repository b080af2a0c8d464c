package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.LiteralExpression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class LiteralPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    LiteralExpression literal;

    @Override
    public PatternKind kind() {
        return PatternKind.LITERAL;
    }
}
