package com.calor.compiler.model.expr;

public enum LiteralKind {
    INT,
    FLOAT,
    DECIMAL,
    STRING,
    BOOL,
    CHAR,
    NULL
}
