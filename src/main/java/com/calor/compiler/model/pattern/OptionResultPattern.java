package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.OptionResultVariant;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §SM p}, {@code §NN}, {@code §OK p}, {@code §ERR p}. {@code inner} is null for NONE.
 */
@Value
public class OptionResultPattern implements Pattern {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    OptionResultVariant variant;

    Pattern inner;

    @Override
    public PatternKind kind() {
        return PatternKind.OPTION_RESULT;
    }
}
