package com.calor.compiler.prover;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link ContractProver} on a worker thread and never waits past the deadline.
 *
 * - no delegate: UNSUPPORTED
 * - deadline passed: SKIPPED
 * - delegate threw: UNSUPPORTED, logged
 */
public class DeadlineContractProver implements ContractProver, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeadlineContractProver.class);

    private final ContractProver delegate;
    private final ExecutorService executor;

    public DeadlineContractProver(ContractProver delegate) {
        this.delegate = delegate;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "calor-prover");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ProverResult prove(ContractProposition proposition, Duration timeout) {
        if (delegate == null) {
            return ProverResult.UNSUPPORTED;
        }

        Future<ProverResult> future = executor.submit(() -> delegate.prove(proposition, timeout));
        try {
            ProverResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ProverResult.UNSUPPORTED;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Prover timed out after {} on {} clause of {}", timeout, proposition.getKind(),
                    proposition.getFunctionId());
            return ProverResult.SKIPPED;
        } catch (ExecutionException e) {
            log.warn("Prover failed on {} clause of {}: {}", proposition.getKind(), proposition.getFunctionId(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return ProverResult.UNSUPPORTED;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProverResult.SKIPPED;
        }
    }

    /**
     * Results in the order of {@code propositions}, each with its own deadline.
     */
    public List<ProverResult> proveAll(List<ContractProposition> propositions, Duration timeout) {
        List<ProverResult> results = new ArrayList<>();
        for (ContractProposition proposition : propositions) {
            results.add(prove(proposition, timeout));
        }
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
