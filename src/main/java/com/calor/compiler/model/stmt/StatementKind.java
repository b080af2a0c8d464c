package com.calor.compiler.model.stmt;

public enum StatementKind {
    BIND,
    ASSIGN,
    RETURN,
    IF,
    FOR,
    WHILE,
    DO_WHILE,
    FOREACH,
    TRY,
    THROW,
    RETHROW,
    BREAK,
    CONTINUE,
    PRINT,
    COLLECTION_OP,
    MATCH,
    EXPRESSION,
    USING
}
