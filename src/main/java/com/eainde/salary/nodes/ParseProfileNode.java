package com.eainde.salary.nodes;

import com.eainde.salary.extraction.ProfileExtractionException;
import com.eainde.salary.extraction.ProfileExtractor;
import com.eainde.salary.model.Profile;
import com.eainde.salary.state.SalaryEstimationState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stage 1: profile text to structured {@link Profile}. A failure here fails
 * the whole run, before any provider is called.
 */
@Slf4j
@Component
public class ParseProfileNode implements AsyncNodeAction<SalaryEstimationState> {

    public static final String NAME = "parse_profile";

    private final ProfileExtractor extractor;

    public ParseProfileNode(ProfileExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SalaryEstimationState state) {
        String text = state.getProfileText().orElse(null);
        try {
            Profile profile = extractor.extract(text);
            if (profile == null || !profile.hasUsableIdentity()) {
                throw new ProfileExtractionException(
                        "Could not determine a title, company or years of experience from the profile");
            }
            return CompletableFuture.completedFuture(Map.of(SalaryEstimationState.PROFILE, profile));
        } catch (ProfileExtractionException e) {
            log.warn("Profile extraction failed: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            log.warn("Profile extractor raised {}", e.toString());
            return CompletableFuture.failedFuture(
                    new ProfileExtractionException("Profile extraction failed: " + e.getMessage(), e));
        }
    }
}
