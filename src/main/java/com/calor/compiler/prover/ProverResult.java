package com.calor.compiler.prover;

/**
 * Verdict for one contract clause.
 */
public enum ProverResult {
    PROVEN,
    DISPROVEN,
    UNPROVEN,
    /** The prover cannot express the clause, or no prover is configured. */
    UNSUPPORTED,
    /** The deadline passed before the prover answered. */
    SKIPPED
}
