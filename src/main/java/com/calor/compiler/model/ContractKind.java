package com.calor.compiler.model;

public enum ContractKind {
    REQUIRES,
    ENSURES,
    INVARIANT
}
