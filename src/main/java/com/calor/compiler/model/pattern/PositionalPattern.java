package com.calor.compiler.model.pattern;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class PositionalPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String typeName;

    @NonNull
    List<Pattern> elements;

    @Override
    public PatternKind kind() {
        return PatternKind.POSITIONAL;
    }
}
