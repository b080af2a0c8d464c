package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Binds the matched value to {@code name}.
 */
@Value
public class VariablePattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String name;

    @Override
    public PatternKind kind() {
        return PatternKind.VARIABLE;
    }
}
