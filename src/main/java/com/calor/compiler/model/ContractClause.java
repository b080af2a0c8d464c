package com.calor.compiler.model;

import com.calor.compiler.model.expr.Expression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * A requires, ensures or invariant clause with its condition and optional message.
 */
@Value
public class ContractClause implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    ContractKind kind;

    @NonNull
    Expression condition;

    String message;
}
