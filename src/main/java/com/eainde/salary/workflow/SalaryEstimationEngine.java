package com.eainde.salary.workflow;

import com.eainde.salary.extraction.ProfileExtractionException;
import com.eainde.salary.model.EstimationResult;
import com.eainde.salary.state.SalaryEstimationState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for one salary estimation.
 *
 * <p>Each run gets a fresh UUID, used both as the LangGraph4j thread id and
 * as the {@code runId} MDC entry, so every log line of the run (worker
 * threads included) can be correlated.</p>
 *
 * <h3>Failure contract:</h3>
 * <ul>
 * <li>blank input: {@link IllegalArgumentException}, the graph is not started</li>
 * <li>no usable profile: {@link ProfileExtractionException}, no provider is called</li>
 * <li>anything else: {@link SalaryEstimationException}</li>
 * </ul>
 * Provider failures are not in this list; they only degrade the result.
 */
@Log4j2
@Service
public class SalaryEstimationEngine {

    public static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<SalaryEstimationState> graph;

    public SalaryEstimationEngine(@Qualifier(SalaryWorkflowGraph.BEAN_NAME) CompiledGraph<SalaryEstimationState> graph) {
        this.graph = graph;
    }

    public EstimationResult run(String profileText) {
        if (profileText == null || profileText.isBlank()) {
            throw new IllegalArgumentException("Profile text must not be blank");
        }

        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            log.info("Starting salary estimation ({} chars of profile text)", profileText.length());
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            Optional<SalaryEstimationState> finalState;
            try {
                finalState = graph.invoke(Map.of(SalaryEstimationState.PROFILE_TEXT, profileText), config);
            } catch (Exception e) {
                throw translate(e);
            }

            EstimationResult result = finalState
                    .flatMap(SalaryEstimationState::getResult)
                    .orElseThrow(() -> new SalaryEstimationException("Workflow finished without a result"));
            log.info("Estimation finished: {} data points, confidence {}",
                    result.confidence().dataPoints(), result.confidence().level().label());
            return result;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    /**
     * Graph failures arrive wrapped (CompletionException, ExecutionException,
     * or LangGraph4j's own wrappers); an extraction failure anywhere in the
     * cause chain is surfaced as-is.
     */
    static RuntimeException translate(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ProfileExtractionException extraction) {
                return extraction;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        if (failure instanceof SalaryEstimationException estimation) {
            return estimation;
        }
        log.error("Salary estimation workflow failed", failure);
        return new SalaryEstimationException("Salary estimation failed: " + failure.getMessage(), failure);
    }
}
