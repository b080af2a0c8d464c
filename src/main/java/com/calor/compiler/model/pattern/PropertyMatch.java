package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class PropertyMatch implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String property;

    @NonNull
    Pattern pattern;
}
