package com.calor.compiler.prover;

import java.time.Duration;

/**
 * External verifier for contract propositions. Implementations must honour the timeout.
 */
public interface ContractProver {

    ProverResult prove(ContractProposition proposition, Duration timeout);
}
