package com.calor.compiler.prover;

import java.util.Map;

import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.Expression;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Logical proposition exported by the checker for one contract clause.
 */
@Value
@Builder
public class ContractProposition {

    @NonNull
    String functionId;

    @NonNull
    String functionName;

    @NonNull
    ContractKind kind;

    /** Condition re-emitted in canonical Calor form. */
    @NonNull
    String conditionText;

    @NonNull
    Expression condition;

    /** Parameter name to shorthand type, in declaration order; includes {@code result} for ensures. */
    @Singular
    Map<String, String> parameterTypes;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;
}
