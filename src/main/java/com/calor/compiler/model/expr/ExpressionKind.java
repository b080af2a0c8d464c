package com.calor.compiler.model.expr;

public enum ExpressionKind {
    LITERAL,
    REFERENCE,
    BINARY,
    UNARY,
    CALL,
    NEW,
    FIELD_ACCESS,
    CONDITIONAL,
    MATCH,
    AWAIT,
    LAMBDA,
    STRING_OP,
    CHAR_OP,
    BUILDER_OP,
    OPTION_RESULT,
    CAST,
    UNCHECKED,
    UNWRAP
}
