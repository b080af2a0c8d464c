package com.calor.compiler.model.pattern;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §PPROP{Type} §PMATCH{Prop} p …}; the type name is optional.
 */
@Value
public class PropertyPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    String typeName;

    @NonNull
    List<PropertyMatch> matches;

    @Override
    public PatternKind kind() {
        return PatternKind.PROPERTY;
    }
}
