package com.eainde.salary.config;

import com.eainde.salary.aggregation.SalaryAggregator;
import com.eainde.salary.provider.KnowledgeStoreObservationProvider;
import com.eainde.salary.provider.SearchObservationProvider;
import com.eainde.salary.provider.knowledge.BenchmarkKnowledgeStoreProvider;
import com.eainde.salary.provider.knowledge.SalaryBenchmarkRepository;
import com.eainde.salary.provider.search.GoogleCustomSearchProvider;
import com.eainde.salary.provider.search.SalaryMentionParser;
import com.eainde.salary.provider.search.SearchRelevanceScorer;
import com.eainde.salary.thread.MdcAwareExecutor;
import com.eainde.salary.workflow.ProviderBranchRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Providers, aggregator and the worker pool the parallel branches run on.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor salaryWorkerExecutor() {
        return new MdcAwareExecutor();
    }

    @Bean
    public ProviderBranchRunner providerBranchRunner(MdcAwareExecutor executor, SalaryEstimatorProperties properties) {
        return new ProviderBranchRunner(executor, properties.getPipeline().getBranchTimeout());
    }

    @Bean
    public SalaryAggregator salaryAggregator(SalaryEstimatorProperties properties) {
        return new SalaryAggregator(properties.getAggregation().toSettings(properties.getAdjustments()));
    }

    @Bean
    public HttpClient searchHttpClient(SalaryEstimatorProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getSearch().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public SearchObservationProvider searchObservationProvider(SalaryEstimatorProperties properties,
                                                               HttpClient searchHttpClient,
                                                               ObjectMapper objectMapper,
                                                               Clock clock) {
        return new GoogleCustomSearchProvider(properties.getSearch(), searchHttpClient, objectMapper,
                new SalaryMentionParser(), new SearchRelevanceScorer(clock));
    }

    @Bean
    public SalaryBenchmarkRepository salaryBenchmarkRepository(SalaryEstimatorProperties properties,
                                                               ObjectMapper objectMapper) {
        return SalaryBenchmarkRepository.fromClasspath(objectMapper, properties.getKnowledge().getSeedResource());
    }

    @Bean
    public KnowledgeStoreObservationProvider knowledgeStoreObservationProvider(SalaryEstimatorProperties properties,
                                                                             SalaryBenchmarkRepository repository) {
        SalaryEstimatorProperties.Knowledge knowledge = properties.getKnowledge();
        return new BenchmarkKnowledgeStoreProvider(repository,
                properties.getAdjustments().effectiveLocations(),
                properties.getAdjustments().effectiveCompanies(),
                knowledge.getMaxMatches(),
                knowledge.getExperienceSlack());
    }
}
