package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.Expression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class RelationalPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    RelationalOperator operator;

    @NonNull
    Expression value;

    @Override
    public PatternKind kind() {
        return PatternKind.RELATIONAL;
    }
}
