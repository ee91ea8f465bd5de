package com.eainde.salary.nodes;

import com.eainde.salary.model.Profile;
import com.eainde.salary.query.QueryGenerator;
import com.eainde.salary.state.SalaryEstimationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 2: search queries for the web branch.
 */
@Slf4j
@Component
public class GenerateQueriesNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "generate_queries";

    private final QueryGenerator generator;

    public GenerateQueriesNode(QueryGenerator generator) {
        this.generator = generator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        Profile profile = state.getProfile()
                .orElseThrow(() -> new IllegalStateException("No profile in state"));
        List<String> queries = generator.generate(profile);
        if (queries == null || queries.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Query generator returned no queries"));
        }
        log.info("Generated {} search queries", queries.size());
        log.debug("Queries: {}", queries);
        return CompletableFuture.completedFuture(Map.of(SalaryEstimationState.QUERIES, new ArrayList<>(queries)));
    }
}
