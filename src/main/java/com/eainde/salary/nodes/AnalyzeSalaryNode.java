package com.eainde.salary.nodes;

import com.eainde.salary.aggregation.AggregationOutcome;
import com.eainde.salary.aggregation.SalaryAggregator;
import com.eainde.salary.model.BranchOutcome;
import com.eainde.salary.model.BranchStatus;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.Profile;
import com.eainde.salary.state.SalaryEstimationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 4: joins both branches and aggregates. Degraded branches are named in
 * the reasoning so callers can tell "no data" from "source unavailable".
 */
@Slf4j
@Component
public class AnalyzeSalaryNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "analyze_salary";

    private final SalaryAggregator aggregator;

    public AnalyzeSalaryNode(SalaryAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        Profile profile = state.getProfile()
                .orElseThrow(() -> new IllegalStateException("No profile in state"));
        Optional<BranchOutcome> search = state.getSearchOutcome();
        Optional<BranchOutcome> knowledge = state.getKnowledgeOutcome();

        List<Observation> union = new ArrayList<>();
        search.ifPresent(o -> union.addAll(o.observations()));
        knowledge.ifPresent(o -> union.addAll(o.observations()));
        log.info("Aggregating {} observations (search: {}, knowledge store: {})", union.size(),
                search.map(BranchOutcome::status).orElse(null),
                knowledge.map(BranchOutcome::status).orElse(null));

        AggregationOutcome outcome = aggregator.aggregate(union, profile);
        outcome = outcome.withReasoningNote(degradationNote(search.orElse(null), SearchWebNode.BRANCH));
        outcome = outcome.withReasoningNote(degradationNote(knowledge.orElse(null), LookupKnowledgeBaseNode.BRANCH));
        return CompletableFuture.completedFuture(Map.of(SalaryEstimationState.AGGREGATION, outcome));
    }

    static String degradationNote(BranchOutcome outcome, String branch) {
        String subject = Character.toUpperCase(branch.charAt(0)) + branch.substring(1);
        if (outcome == null) {
            return subject + " did not report and contributed no data.";
        }
        if (outcome.status() == BranchStatus.TIMED_OUT) {
            return subject + " timed out and contributed no data.";
        }
        if (outcome.status() == BranchStatus.FAILED) {
            return subject + " was unavailable and contributed no data.";
        }
        return null;
    }
}
