package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

@Value
public class WildcardPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @Override
    public PatternKind kind() {
        return PatternKind.WILDCARD;
    }
}
