package com.eainde.salary.state;

import com.eainde.salary.aggregation.AggregationOutcome;
import com.eainde.salary.model.BranchOutcome;
import com.eainde.salary.model.EstimationResult;
import com.eainde.salary.model.Profile;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one estimation run. Every key is written by exactly one node.
 */
public class SalaryEstimationState extends AgentState {

    public static final String PROFILE_TEXT = "profileText";
    public static final String PROFILE = "profile";
    public static final String QUERIES = "queries";
    public static final String SEARCH_OUTCOME = "searchOutcome";
    public static final String KNOWLEDGE_OUTCOME = "knowledgeOutcome";
    public static final String AGGREGATION = "aggregation";
    public static final String RESULT = "result";

    public SalaryEstimationState(Map<String, Object> initData) {
        super(initData);
    }

    public Optional<String> getProfileText() {
        return value(PROFILE_TEXT);
    }

    public Optional<Profile> getProfile() {
        return value(PROFILE);
    }

    public List<String> getQueries() {
        return this.<List<String>>value(QUERIES).orElse(List.of());
    }

    public Optional<BranchOutcome> getSearchOutcome() {
        return value(SEARCH_OUTCOME);
    }

    public Optional<BranchOutcome> getKnowledgeOutcome() {
        return value(KNOWLEDGE_OUTCOME);
    }

    public Optional<AggregationOutcome> getAggregation() {
        return value(AGGREGATION);
    }

    public Optional<EstimationResult> getResult() {
        return value(RESULT);
    }
}
