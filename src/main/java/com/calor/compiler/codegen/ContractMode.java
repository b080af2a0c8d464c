package com.calor.compiler.codegen;

/**
 * How contract clauses are lowered into emitted code.
 */
public enum ContractMode {
    /** No guards at all. */
    OFF,
    /** Guards carry the canonical condition text. */
    DEBUG,
    /** Guards are kept but the condition text is left out of the exception. */
    RELEASE
}
