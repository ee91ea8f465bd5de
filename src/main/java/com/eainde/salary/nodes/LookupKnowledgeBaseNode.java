package com.eainde.salary.nodes;

import com.eainde.salary.model.Profile;
import com.eainde.salary.provider.KnowledgeStoreObservationProvider;
import com.eainde.salary.state.SalaryEstimationState;
import com.eainde.salary.workflow.ProviderBranchRunner;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 3b: knowledge store branch, runs alongside {@link SearchWebNode}.
 */
@Component
public class LookupKnowledgeBaseNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "lookup_kb";
    public static final String BRANCH = "knowledge store";

    private final KnowledgeStoreObservationProvider provider;
    private final ProviderBranchRunner runner;

    public LookupKnowledgeBaseNode(KnowledgeStoreObservationProvider provider, ProviderBranchRunner runner) {
        this.provider = provider;
        this.runner = runner;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        Profile profile = state.getProfile().orElse(null);
        return runner.run(BRANCH, () -> provider.lookup(profile))
                .thenApply(outcome -> Map.of(SalaryEstimationState.KNOWLEDGE_OUTCOME, outcome));
    }
}
