package com.calor.compiler.model.decl;

public enum DeclarationKind {
    MODULE,
    FUNCTION,
    CLASS,
    INTERFACE,
    ENUM,
    ENUM_EXTENSION,
    RECORD,
    UNION,
    FIELD,
    PROPERTY,
    CONSTRUCTOR,
    DELEGATE,
    EVENT
}
