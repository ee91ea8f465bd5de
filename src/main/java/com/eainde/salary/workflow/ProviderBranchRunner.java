package com.eainde.salary.workflow;

import com.eainde.salary.model.BranchOutcome;
import com.eainde.salary.model.Observation;
import com.eainde.salary.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one provider call on the worker pool under a deadline and folds
 * every outcome into a {@link BranchOutcome}. The returned future never
 * completes exceptionally. A call that misses the deadline is interrupted
 * and its late result is discarded.
 */
@Slf4j
public class ProviderBranchRunner {

    private final MdcAwareExecutor executor;
    private final Duration timeout;

    public ProviderBranchRunner(MdcAwareExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public CompletableFuture<BranchOutcome> run(String branch, Supplier<List<Observation>> call) {
        CompletableFuture<List<Observation>> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(call.get());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });

        return result
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((observations, error) -> {
                    if (error == null) {
                        BranchOutcome outcome = BranchOutcome.of(branch, observations);
                        log.info("Branch {} finished: {} with {} observations",
                                branch, outcome.status(), outcome.observations().size());
                        return outcome;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        task.cancel(true);
                        log.warn("Branch {} timed out after {} ms, provider call interrupted",
                                branch, timeout.toMillis());
                        return BranchOutcome.timedOut(branch, "timed out after " + timeout.toMillis() + " ms");
                    }
                    log.warn("Branch {} failed: {}", branch, cause.toString());
                    return BranchOutcome.failed(branch, cause.getMessage());
                });
    }

    public Duration getTimeout() {
        return timeout;
    }
}
