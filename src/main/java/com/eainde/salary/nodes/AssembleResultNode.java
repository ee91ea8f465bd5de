package com.eainde.salary.nodes;

import com.eainde.salary.aggregation.AggregationOutcome;
import com.eainde.salary.assembly.ResultAssembler;
import com.eainde.salary.model.Profile;
import com.eainde.salary.state.SalaryEstimationState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 5: packs the final result.
 */
@Component
public class AssembleResultNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "assemble_result";

    private final ResultAssembler assembler;

    public AssembleResultNode(ResultAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        Profile profile = state.getProfile()
                .orElseThrow(() -> new IllegalStateException("No profile in state"));
        AggregationOutcome aggregation = state.getAggregation()
                .orElseThrow(() -> new IllegalStateException("No aggregation in state"));
        return CompletableFuture.completedFuture(
                Map.of(SalaryEstimationState.RESULT, assembler.assemble(profile, aggregation)));
    }
}
