package com.eainde.salary.nodes;

import com.eainde.salary.aggregation.AggregationOutcome;
import com.eainde.salary.aggregation.AggregationSettings;
import com.eainde.salary.aggregation.SalaryAggregator;
import com.eainde.salary.model.BranchOutcome;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.ObservationOrigin;
import com.eainde.salary.model.Profile;
import com.eainde.salary.state.SalaryEstimationState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyzeSalaryNodeTest {

    private final AnalyzeSalaryNode node = new AnalyzeSalaryNode(new SalaryAggregator(AggregationSettings.defaults()));

    private static final Profile PROFILE = Profile.of("Engineer", "Acme", 3.0, "Denver");

    @Test
    @DisplayName("should union both branches before aggregating")
    void union() {
        SalaryEstimationState state = new SalaryEstimationState(Map.of(
                SalaryEstimationState.PROFILE, PROFILE,
                SalaryEstimationState.SEARCH_OUTCOME, BranchOutcome.of(SearchWebNode.BRANCH, List.of(
                        Observation.single(150_000, "glassdoor.com", ObservationOrigin.WEB_SEARCH, 0.7, null))),
                SalaryEstimationState.KNOWLEDGE_OUTCOME, BranchOutcome.of(LookupKnowledgeBaseNode.BRANCH, List.of(
                        Observation.range(140_000, 170_000, "internal_kb", ObservationOrigin.KNOWLEDGE_STORE, null, null)))));

        AggregationOutcome outcome = aggregation(state);

        assertThat(outcome.confidence().dataPoints()).isEqualTo(2);
        assertThat(outcome.sources()).containsExactly("internal_kb", "glassdoor.com");
    }

    @Test
    @DisplayName("should explain degraded branches in the reasoning")
    void degradation() {
        SalaryEstimationState state = new SalaryEstimationState(Map.of(
                SalaryEstimationState.PROFILE, PROFILE,
                SalaryEstimationState.SEARCH_OUTCOME, BranchOutcome.timedOut(SearchWebNode.BRANCH, "slow"),
                SalaryEstimationState.KNOWLEDGE_OUTCOME, BranchOutcome.failed(LookupKnowledgeBaseNode.BRANCH, "down")));

        AggregationOutcome outcome = aggregation(state);

        assertThat(outcome.hasEstimate()).isFalse();
        assertThat(outcome.reasoning()).endsWith(
                "Web search timed out and contributed no data. "
                        + "Knowledge store was unavailable and contributed no data.");
    }

    @Test
    @DisplayName("should not mention branches that simply found nothing")
    void emptyIsNotDegraded() {
        assertThat(AnalyzeSalaryNode.degradationNote(BranchOutcome.of("web search", List.of()), "web search"))
                .isNull();
    }

    private AggregationOutcome aggregation(SalaryEstimationState state) {
        Map<String, Object> update = node.apply(state).join();
        return (AggregationOutcome) update.get(SalaryEstimationState.AGGREGATION);
    }
}
