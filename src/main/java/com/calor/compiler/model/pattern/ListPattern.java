package com.calor.compiler.model.pattern;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §PLIST p … §REST{name}}. {@code rest} is null when no slice is captured.
 */
@Value
public class ListPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    List<Pattern> elements;

    String rest;

    @Override
    public PatternKind kind() {
        return PatternKind.LIST;
    }
}
