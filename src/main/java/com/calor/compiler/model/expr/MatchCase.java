package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.pattern.Pattern;
import com.calor.compiler.model.stmt.Statement;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * One {@code §K} arm of a match statement or expression. An arrow-form arm holds exactly
 * one statement; a bare expression after the arrow is stored as its return.
 */
@Value
public class MatchCase implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Pattern pattern;

    Expression guard;

    @NonNull
    BodyForm form;

    @NonNull
    List<Statement> body;
}
