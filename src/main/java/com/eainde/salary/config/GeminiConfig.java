package com.eainde.salary.config;

import com.eainde.salary.extraction.GeminiProfileExtractor;
import com.eainde.salary.extraction.ProfileExtractionAgent;
import com.eainde.salary.extraction.ProfileExtractor;
import com.eainde.salary.query.GeminiQueryGenerator;
import com.eainde.salary.query.QueryGenerator;
import com.eainde.salary.query.SearchQueryAgent;
import com.eainde.salary.query.TemplateQueryGenerator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Gemini chat model and the two LLM-backed services built on it.
 */
@Slf4j
@Configuration
public class GeminiConfig {

    private static final String MISSING_API_KEY = "missing-api-key";

    @Bean
    public ChatModel geminiChatModel(SalaryEstimatorProperties properties) {
        SalaryEstimatorProperties.Gemini gemini = properties.getGemini();
        String apiKey = gemini.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            // the client refuses a blank key at construction time
            log.warn("salary.gemini.api-key is not set; profile extraction calls will fail");
            apiKey = MISSING_API_KEY;
        }
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(gemini.getModelName())
                .temperature(gemini.getTemperature())
                .timeout(gemini.getTimeout())
                .maxRetries(gemini.getMaxRetries())
                .build();
    }

    @Bean
    public ProfileExtractionAgent profileExtractionAgent(ChatModel chatModel) {
        return AiServices.builder(ProfileExtractionAgent.class)
                .chatModel(chatModel)
                .build();
    }

    @Bean
    public SearchQueryAgent searchQueryAgent(ChatModel chatModel) {
        return AiServices.builder(SearchQueryAgent.class)
                .chatModel(chatModel)
                .build();
    }

    @Bean
    public ProfileExtractor profileExtractor(ProfileExtractionAgent agent) {
        return new GeminiProfileExtractor(agent);
    }

    @Bean
    public QueryGenerator queryGenerator(SalaryEstimatorProperties properties, SearchQueryAgent agent, Clock clock) {
        int maxQueries = properties.getQuery().getMaxQueries();
        TemplateQueryGenerator templates = new TemplateQueryGenerator(maxQueries, clock);
        if (!properties.getQuery().isUseLlm()) {
            log.info("LLM query generation disabled, using templates only");
            return templates;
        }
        return new GeminiQueryGenerator(agent, templates, maxQueries, clock);
    }
}
