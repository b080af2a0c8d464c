package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.Expression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class ElseIfClause implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression condition;

    @NonNull
    BodyForm form;

    @NonNull
    List<Statement> body;
}
