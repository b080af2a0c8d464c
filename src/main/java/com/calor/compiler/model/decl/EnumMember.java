package com.calor.compiler.model.decl;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Enum member with its optional explicit backing value (kept as written).
 */
@Value
public class EnumMember implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String name;

    String value;
}
