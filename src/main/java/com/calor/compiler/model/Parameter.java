package com.calor.compiler.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Typed name used for function inputs, record fields and lambda parameters.
 * The type is Calor shorthand text ({@code i32}, {@code ?str}, {@code List<i32>}) and
 * may be null for untyped lambda parameters.
 */
@Value
public class Parameter implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String name;

    String type;
}
