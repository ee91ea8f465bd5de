package com.eainde.salary.provider.search;

import com.eainde.salary.config.SalaryEstimatorProperties;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.ObservationOrigin;
import com.eainde.salary.provider.ObservationProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoogleCustomSearchProviderTest {

    private static final String LEVELS_BODY = """
            {
              "items": [
                {
                  "title": "Meta Staff Software Engineer Salary | Levels.fyi",
                  "link": "https://www.levels.fyi/companies/meta/salaries/software-engineer/levels/e6",
                  "snippet": "Median total compensation $412,000 in 2025, ranging from $350,000 - $520,000."
                },
                {
                  "title": "Meta careers",
                  "link": "https://www.metacareers.com/jobs",
                  "snippet": "Join our team and build the future."
                }
              ]
            }
            """;

    @Mock
    private HttpClient httpClient;

    private SalaryEstimatorProperties.Search config;
    private GoogleCustomSearchProvider provider;

    @BeforeEach
    void setUp() {
        config = new SalaryEstimatorProperties.Search();
        config.setApiKey("test-key");
        config.setEngineId("test-cx");
        config.setRetryBackoff(Duration.ZERO);
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);
        provider = new GoogleCustomSearchProvider(config, httpClient, new ObjectMapper(),
                new SalaryMentionParser(), new SearchRelevanceScorer(clock));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        if (status == 200) {
            when(response.body()).thenReturn(body);
        }
        return response;
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("should turn salary mentions into weighted web observations")
        void observations() throws Exception {
            HttpResponse<String> ok = response(200, LEVELS_BODY);
            when(httpClient.<String>send(any(), any())).thenReturn(ok);

            List<Observation> observations = provider.search(List.of("meta staff engineer salary"));

            assertThat(observations).hasSize(2);
            assertThat(observations).allSatisfy(o -> {
                assertThat(o.source()).isEqualTo("levels.fyi");
                assertThat(o.origin()).isEqualTo(ObservationOrigin.WEB_SEARCH);
                assertThat(o.currency()).isEqualTo("USD");
                assertThat(o.weightHint()).isEqualTo(1.0);
                assertThat(o.rawText()).startsWith("Meta Staff Software Engineer Salary");
            });
            assertThat(observations).extracting(Observation::low).containsExactly(350_000L, 412_000L);
            assertThat(observations).extracting(Observation::high).containsExactly(520_000L, 412_000L);
        }

        @Test
        @DisplayName("should send key, engine id and query to the endpoint")
        void request() throws Exception {
            HttpResponse<String> ok = response(200, "{}");
            when(httpClient.<String>send(any(), any())).thenReturn(ok);

            provider.search(List.of("staff engineer salary"));

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            assertThat(captor.getValue().uri().toString())
                    .startsWith("https://www.googleapis.com/customsearch/v1?key=test-key&cx=test-cx&num=5")
                    .endsWith("&q=staff+engineer+salary");
        }

        @Test
        @DisplayName("should strip www from domains and ignore broken links")
        void domains() {
            assertThat(GoogleCustomSearchProvider.domainOf("https://www.glassdoor.com/Salary/x.htm"))
                    .isEqualTo("glassdoor.com");
            assertThat(GoogleCustomSearchProvider.domainOf("not a link")).isNull();
            assertThat(GoogleCustomSearchProvider.domainOf("")).isNull();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should return nothing and make no calls when disabled")
        void disabled() {
            config.setApiKey("");

            assertThat(provider.search(List.of("q"))).isEmpty();
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("should retry a 503 once and then succeed")
        void retriesServerError() throws Exception {
            HttpResponse<String> unavailable = response(503, null);
            HttpResponse<String> ok = response(200, LEVELS_BODY);
            when(httpClient.<String>send(any(), any())).thenReturn(unavailable, ok);

            assertThat(provider.search(List.of("q"))).hasSize(2);
            verify(httpClient, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("should not retry a 403 and fail when it was the only query")
        void clientErrorNotRetried() throws Exception {
            HttpResponse<String> forbidden = response(403, null);
            when(httpClient.<String>send(any(), any())).thenReturn(forbidden);

            assertThatThrownBy(() -> provider.search(List.of("q")))
                    .isInstanceOf(ObservationProviderException.class)
                    .hasMessageContaining("All 1 search queries failed");
            verify(httpClient, times(1)).send(any(), any());
        }

        @Test
        @DisplayName("should skip a failing query when another one succeeds")
        void partialFailure() throws Exception {
            HttpResponse<String> ok = response(200, LEVELS_BODY);
            when(httpClient.<String>send(any(), any()))
                    .thenThrow(new IOException("connection reset"))
                    .thenThrow(new IOException("connection reset"))
                    .thenReturn(ok);

            assertThat(provider.search(List.of("first", "second"))).hasSize(2);
        }

        @Test
        @DisplayName("should throw when every query fails at transport level")
        void allFail() throws Exception {
            when(httpClient.<String>send(any(), any())).thenThrow(new IOException("unreachable"));

            assertThatThrownBy(() -> provider.search(List.of("first", "second")))
                    .isInstanceOf(ObservationProviderException.class)
                    .hasCauseInstanceOf(IOException.class);
            verify(httpClient, times(4)).send(any(), any());
        }
    }

    @Test
    @DisplayName("should prefer new domains once the first five hits are taken")
    void diversity() {
        List<SearchHit> hits = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            hits.add(new SearchHit("q", "glassdoor.com", "t" + i, "s", List.of(), 0.9 - i * 0.1));
        }
        hits.add(new SearchHit("q", "levels.fyi", "l1", "s", List.of(), 0.25));
        hits.add(new SearchHit("q", "levels.fyi", "l2", "s", List.of(), 0.2));

        List<SearchHit> selected = provider.selectDiverse(hits);

        assertThat(selected).extracting(SearchHit::title).containsExactly("t0", "t1", "t2", "t3", "t4", "l1");
    }
}
