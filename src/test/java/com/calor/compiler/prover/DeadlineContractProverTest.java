package com.calor.compiler.prover;

import com.calor.compiler.model.ContractKind;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.expr.LiteralExpression;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DeadlineContractProver.
 */
class DeadlineContractProverTest {

    private static final ContractProposition PROPOSITION = ContractProposition.builder()
            .functionId("f001")
            .functionName("Divide")
            .kind(ContractKind.REQUIRES)
            .conditionText("true")
            .condition(LiteralExpression.ofBool(Span.EMPTY, true))
            .parameterType("b", "i32")
            .build();

    @Test
    void testNoDelegateIsUnsupported() {
        try (DeadlineContractProver prover = new DeadlineContractProver(null)) {
            assertThat(prover.prove(PROPOSITION, Duration.ofSeconds(1))).isEqualTo(ProverResult.UNSUPPORTED);
        }
    }

    @Test
    void testDelegateVerdictIsReturned() {
        try (DeadlineContractProver prover = new DeadlineContractProver((p, timeout) -> ProverResult.PROVEN)) {
            assertThat(prover.prove(PROPOSITION, Duration.ofSeconds(5))).isEqualTo(ProverResult.PROVEN);
        }
    }

    @Test
    void testSlowDelegateIsSkipped() {
        ContractProver slow = (p, timeout) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProverResult.PROVEN;
        };

        try (DeadlineContractProver prover = new DeadlineContractProver(slow)) {
            long start = System.nanoTime();
            ProverResult result = prover.prove(PROPOSITION, Duration.ofMillis(100));
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertThat(result).isEqualTo(ProverResult.SKIPPED);
            assertThat(elapsedMillis).isLessThan(5_000);
        }
    }

    @Test
    void testFailingDelegateIsUnsupported() {
        ContractProver failing = (p, timeout) -> {
            throw new IllegalStateException("solver crashed");
        };

        try (DeadlineContractProver prover = new DeadlineContractProver(failing)) {
            assertThat(prover.prove(PROPOSITION, Duration.ofSeconds(5))).isEqualTo(ProverResult.UNSUPPORTED);
        }
    }

    @Test
    void testNullVerdictIsUnsupported() {
        try (DeadlineContractProver prover = new DeadlineContractProver((p, timeout) -> null)) {
            assertThat(prover.prove(PROPOSITION, Duration.ofSeconds(5))).isEqualTo(ProverResult.UNSUPPORTED);
        }
    }

    @Test
    void testProveAllKeepsOrder() {
        ContractProver byKind = (p, timeout) -> p.getKind() == ContractKind.REQUIRES
                ? ProverResult.PROVEN : ProverResult.DISPROVEN;
        ContractProposition ensures = ContractProposition.builder()
                .functionId("f001")
                .functionName("Divide")
                .kind(ContractKind.ENSURES)
                .conditionText("true")
                .condition(LiteralExpression.ofBool(Span.EMPTY, true))
                .build();

        try (DeadlineContractProver prover = new DeadlineContractProver(byKind)) {
            List<ProverResult> results = prover.proveAll(List.of(PROPOSITION, ensures, PROPOSITION),
                    Duration.ofSeconds(5));

            assertThat(results).containsExactly(ProverResult.PROVEN, ProverResult.DISPROVEN, ProverResult.PROVEN);
        }
    }
}
