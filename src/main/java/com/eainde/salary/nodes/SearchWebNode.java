package com.eainde.salary.nodes;

import com.eainde.salary.provider.SearchObservationProvider;
import com.eainde.salary.state.SalaryEstimationState;
import com.eainde.salary.workflow.ProviderBranchRunner;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 3a: web search branch. Never fails the run; problems end up in the
 * branch outcome.
 */
@Component
public class SearchWebNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "search_web";
    public static final String BRANCH = "web search";

    private final SearchObservationProvider provider;
    private final ProviderBranchRunner runner;

    public SearchWebNode(SearchObservationProvider provider, ProviderBranchRunner runner) {
        this.provider = provider;
        this.runner = runner;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        List<String> queries = state.getQueries();
        return runner.run(BRANCH, () -> provider.search(queries))
                .thenApply(outcome -> Map.of(SalaryEstimationState.SEARCH_OUTCOME, outcome));
    }
}
