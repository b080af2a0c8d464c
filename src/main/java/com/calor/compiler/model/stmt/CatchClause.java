package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.Expression;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §CA{Type:var}}; both type and variable are optional (catch-all).
 */
@Value
public class CatchClause implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    String exceptionType;

    String variable;

    Expression filter;

    @NonNull
    List<Statement> body;
}
