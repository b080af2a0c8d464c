package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.Expression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §BASE §A … §/BASE} or {@code §THIS §A … §/THIS}.
 */
@Value
public class ConstructorInitializer implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    boolean base;

    @NonNull
    List<Expression> arguments;
}
