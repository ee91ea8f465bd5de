package com.eainde.salary.assembly;

import com.eainde.salary.aggregation.AggregationOutcome;
import com.eainde.salary.model.EstimationResult;
import com.eainde.salary.model.Profile;
import com.eainde.salary.model.ProfileSummary;
import org.springframework.stereotype.Component;

/**
 * Packs profile and aggregation into the external result shape.
 */
@Component
public class ResultAssembler {

    public EstimationResult assemble(Profile profile, AggregationOutcome aggregation) {
        return new EstimationResult(
                ProfileSummary.from(profile),
                aggregation.estimate(),
                aggregation.confidence(),
                aggregation.reasoning(),
                aggregation.sources(),
                aggregation.adjustments());
    }
}
