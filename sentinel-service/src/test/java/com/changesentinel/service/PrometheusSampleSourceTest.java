package com.changesentinel.service;

import com.changesentinel.core.model.DegradationReason;
import com.changesentinel.core.model.MetricSample;
import com.changesentinel.core.source.SourceUnavailableException;
import com.changesentinel.core.source.WindowSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PrometheusSampleSource}.
 */
class PrometheusSampleSourceTest {

    @Test
    @DisplayName("Should sum series per timestamp and order samples by time")
    void shouldSumSeries() throws Exception {
        String body = "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\",\"result\":["
                + "{\"metric\":{\"code\":\"500\"},\"values\":[[1772366460,\"3\"],[1772366400,\"2\"]]},"
                + "{\"metric\":{\"code\":\"503\"},\"values\":[[1772366400,\"5\"]]}"
                + "]}}";

        List<MetricSample> samples = PrometheusSampleSource.parseMatrix("orders-api.http.5xx", body);

        assertThat(samples).extracting(MetricSample::getTimestamp)
                .containsExactly(Instant.ofEpochSecond(1772366400L), Instant.ofEpochSecond(1772366460L));
        assertThat(samples).extracting(MetricSample::getValue).containsExactly(7.0, 3.0);
        assertThat(samples).extracting(MetricSample::getMetricId).containsOnly("orders-api.http.5xx");
    }

    @Test
    @DisplayName("Should skip NaN, infinite and non-numeric points")
    void shouldSkipNonNumeric() throws Exception {
        String body = "{\"status\":\"success\",\"data\":{\"result\":[{\"values\":["
                + "[1772366400,\"NaN\"],[1772366460,\"+Inf\"],[1772366520,\"oops\"],[1772366580,\"4.5\"]"
                + "]}]}}";

        List<MetricSample> samples = PrometheusSampleSource.parseMatrix("rds.cpu", body);

        assertThat(samples).singleElement().satisfies(s -> {
            assertThat(s.getTimestamp()).isEqualTo(Instant.ofEpochSecond(1772366580L));
            assertThat(s.getValue()).isEqualTo(4.5);
        });
    }

    @Test
    @DisplayName("Should return no samples for an empty result")
    void shouldHandleEmptyResult() throws Exception {
        assertThat(PrometheusSampleSource.parseMatrix("rds.cpu",
                "{\"status\":\"success\",\"data\":{\"result\":[]}}")).isEmpty();
    }

    @Test
    @DisplayName("Should fail on an error status or an unreadable body")
    void shouldFailOnErrorResponse() {
        assertThatThrownBy(() -> PrometheusSampleSource.parseMatrix("rds.cpu",
                "{\"status\":\"error\",\"error\":\"bad query\"}"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("error");
        assertThatThrownBy(() -> PrometheusSampleSource.parseMatrix("rds.cpu", "<html>"))
                .isInstanceOfSatisfying(SourceUnavailableException.class,
                        e -> assertThat(e.getReason()).isEqualTo(DegradationReason.ERROR));
    }

    @Test
    @DisplayName("Should encode the query and send the window as epoch seconds")
    void shouldBuildQueryRangeUri() {
        PrometheusSampleSource source = new PrometheusSampleSource("http://vm:8481/api/v1", "60s");
        WindowSpec window = new WindowSpec(Instant.ofEpochSecond(1000), Instant.ofEpochSecond(4600),
                Duration.ofSeconds(5));

        URI uri = source.queryRangeUri("sum(rate(http_requests_total{code=~\"5..\"}[5m]))", window);

        assertThat(uri.getPath()).isEqualTo("/api/v1/query_range");
        assertThat(uri.getQuery()).contains("query=sum(rate(http_requests_total{code=~\"5..\"}[5m]))");
        assertThat(uri.getRawQuery()).contains("&start=1000&end=4600&step=60s");
    }
}
