package com.eainde.salary.provider.search;

import com.eainde.salary.config.SalaryEstimatorProperties;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.ObservationOrigin;
import com.eainde.salary.provider.ObservationProviderException;
import com.eainde.salary.provider.SearchObservationProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Search provider backed by the Google Custom Search JSON API.
 *
 * <p>Each query is sent once, with a bounded retry on transport errors and
 * HTTP 429/5xx. A query that still fails is skipped; the provider only throws
 * when every query failed, since that means the search backend is unreachable
 * rather than that it had nothing to say.</p>
 */
@Slf4j
public class GoogleCustomSearchProvider implements SearchObservationProvider {

    private static final int DIVERSITY_FREE_RESULTS = 5;
    private static final int RAW_TEXT_LIMIT = 200;

    private final SalaryEstimatorProperties.Search config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SalaryMentionParser mentionParser;
    private final SearchRelevanceScorer relevanceScorer;

    public GoogleCustomSearchProvider(SalaryEstimatorProperties.Search config,
                                      HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      SalaryMentionParser mentionParser,
                                      SearchRelevanceScorer relevanceScorer) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.mentionParser = mentionParser;
        this.relevanceScorer = relevanceScorer;
    }

    public boolean isEnabled() {
        return config.isEnabled()
                && config.getApiKey() != null && !config.getApiKey().isBlank()
                && config.getEngineId() != null && !config.getEngineId().isBlank();
    }

    @Override
    public List<Observation> search(List<String> queries) {
        if (queries == null || queries.isEmpty()) {
            return List.of();
        }
        if (!isEnabled()) {
            log.info("Web search disabled (no API key or engine id), skipping {} queries", queries.size());
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        int failed = 0;
        Exception lastFailure = null;
        for (String query : queries) {
            try {
                hits.addAll(searchOne(query));
            } catch (IOException e) {
                failed++;
                lastFailure = e;
                log.warn("Search failed for '{}': {}", query, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ObservationProviderException("Search interrupted", e);
            }
        }
        if (failed == queries.size()) {
            throw new ObservationProviderException(
                    "All " + failed + " search queries failed", lastFailure);
        }

        List<Observation> observations = new ArrayList<>();
        for (SearchHit hit : selectDiverse(hits)) {
            for (SalaryMention mention : hit.mentions()) {
                observations.add(new Observation(mention.low(), mention.high(), Observation.DEFAULT_CURRENCY,
                        hit.domain(), ObservationOrigin.WEB_SEARCH, hit.relevance(), rawText(hit)));
            }
        }
        log.info("Web search: {} queries, {} hits, {} observations", queries.size(), hits.size(), observations.size());
        return observations;
    }

    private List<SearchHit> searchOne(String query) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getEndpoint()
                        + "?key=" + encode(config.getApiKey())
                        + "&cx=" + encode(config.getEngineId())
                        + "&num=" + config.getResultsPerQuery()
                        + "&q=" + encode(query)))
                .timeout(config.getTimeout())
                .GET()
                .build();

        int attempts = Math.max(1, config.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.debug("Search transport error for '{}', retrying ({}/{}): {}",
                        query, attempt, attempts, e.getMessage());
                Thread.sleep(config.getRetryBackoff().toMillis());
                continue;
            }

            int status = response.statusCode();
            if (status == 200) {
                return parse(query, response.body());
            }
            boolean retryable = status == 429 || status >= 500;
            if (!retryable || attempt >= attempts) {
                throw new IOException("Search API returned HTTP " + status);
            }
            log.debug("Search status {} for '{}', retrying ({}/{})", status, query, attempt, attempts);
            Thread.sleep(config.getRetryBackoff().toMillis());
        }
    }

    List<SearchHit> parse(String query, String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<SearchHit> hits = new ArrayList<>();
        JsonNode items = root.path("items");
        if (!items.isArray()) {
            return hits;
        }
        for (JsonNode item : items) {
            String title = item.path("title").asText("");
            String snippet = item.path("snippet").asText("");
            String domain = domainOf(item.path("link").asText(""));
            if (domain == null) {
                continue;
            }
            List<SalaryMention> mentions = mentionParser.parse(title + " " + snippet);
            double relevance = relevanceScorer.score(domain, title, snippet);
            hits.add(new SearchHit(query, domain, title, snippet, mentions, relevance));
        }
        return hits;
    }

    /**
     * Most relevant first; after the first few hits only domains not seen yet
     * are admitted, up to the configured maximum.
     */
    List<SearchHit> selectDiverse(List<SearchHit> hits) {
        List<SearchHit> ranked = new ArrayList<>(hits);
        ranked.sort(Comparator.comparingDouble(SearchHit::relevance).reversed());

        List<SearchHit> selected = new ArrayList<>();
        Set<String> seenDomains = new HashSet<>();
        for (SearchHit hit : ranked) {
            if (selected.size() >= config.getMaxResults()) {
                break;
            }
            if (!seenDomains.contains(hit.domain()) || selected.size() < DIVERSITY_FREE_RESULTS) {
                selected.add(hit);
                seenDomains.add(hit.domain());
            }
        }
        return selected;
    }

    static String domainOf(String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(link.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unparseable link {}", link);
            return null;
        }
    }

    private static String rawText(SearchHit hit) {
        String text = hit.title() + " - " + hit.snippet();
        return text.length() > RAW_TEXT_LIMIT ? text.substring(0, RAW_TEXT_LIMIT) : text;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
