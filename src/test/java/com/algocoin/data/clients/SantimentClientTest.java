package com.algocoin.data.clients;

import static org.junit.jupiter.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.algocoin.data.metrics.FetchErrorKind;
import com.algocoin.data.metrics.FetchOutcome;
import com.algocoin.data.metrics.Frequency;
import com.algocoin.data.metrics.SeriesPoint;
import com.algocoin.data.metrics.TimeWindow;

public class SantimentClientTest {

    private static final String URL = "https://api.santiment.net/graphql";
    private static final TimeWindow WINDOW = TimeWindow.parse("2025-03-01T00:00:00Z", "2025-03-01T00:10:00Z");

    private MockRestServiceServer server;
    private SantimentClient client;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        ApiBase apiBase = new ApiBase(builder, URL, SantimentClient.authorization("test-key"), 1000);
        client = new SantimentClient(apiBase, "bitcoin", Frequency.ofMinutes(5));
    }

    @Test
    public void queryAliasesEveryMetric() {
        String query = client.buildQuery(List.of("sentiment_positive_reddit", "social_volume_reddit"), WINDOW);

        assertTrue(query.contains("m0: getMetric(metric: \"sentiment_positive_reddit\")"));
        assertTrue(query.contains("m1: getMetric(metric: \"social_volume_reddit\")"));
        assertTrue(query.contains("slug: \"bitcoin\""));
        assertTrue(query.contains("from: \"2025-03-01T00:00:00Z\""));
        assertTrue(query.contains("to: \"2025-03-01T00:10:00Z\""));
        assertTrue(query.contains("interval: \"5m\""));
    }

    @Test
    public void parsesListAndStringPayloads() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Apikey test-key"))
                .andExpect(content().string(containsString("m0: getMetric")))
                .andRespond(withSuccess("{\"data\":{"
                        + "\"m0\":{\"timeseriesDataJson\":["
                        + "{\"datetime\":\"2025-03-01T00:00:00Z\",\"value\":0.5},"
                        + "{\"datetime\":\"2025-03-01T00:05:00Z\",\"value\":null}]},"
                        + "\"m1\":{\"timeseriesDataJson\":"
                        + "\"[{\\\"datetime\\\":\\\"2025-03-01T00:00:00Z\\\",\\\"value\\\":\\\"12\\\"}]\"}"
                        + "}}", MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("sentiment_positive_reddit", "social_volume_reddit"), WINDOW);

        server.verify();
        assertEquals(FetchOutcome.Status.SUCCESS, outcome.getStatus());
        List<SeriesPoint> positive = outcome.getRows().get("sentiment_positive_reddit");
        assertEquals(2, positive.size());
        assertEquals(0.5, positive.get(0).getValue());
        assertNull(positive.get(1).getValue());
        List<SeriesPoint> volume = outcome.getRows().get("social_volume_reddit");
        assertEquals(1, volume.size());
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"), volume.get(0).getTimestamp());
        assertEquals(12.0, volume.get(0).getValue());
    }

    @Test
    public void missingAliasGivesEmptySeries() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"data\":{\"m0\":{\"timeseriesDataJson\":[]}}}", MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("a", "b"), WINDOW);

        assertEquals(Set.of("a", "b"), outcome.getRows().keySet());
        assertTrue(outcome.getRows().get("b").isEmpty());
    }

    @Test
    public void errorListIsClassified() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"data\":{\"m0\":null},\"errors\":[{\"message\":"
                        + "\"The metric 'sentiment_positive_farcaster' is not supported or is mistyped.\"}]}",
                        MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("sentiment_positive_farcaster"), WINDOW);

        assertEquals(FetchErrorKind.UNSUPPORTED_METRIC, outcome.getErrorKind());
        assertEquals(Set.of("sentiment_positive_farcaster"), outcome.getUnsupportedMetrics());
    }

    @Test
    public void textualErrorIsClassified() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"errors\":\"Query is too complex\"}", MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("m"), WINDOW);

        assertTrue(outcome.isFailure());
        assertEquals(FetchErrorKind.QUERY_TOO_COMPLEX, outcome.getErrorKind());
    }

    @Test
    public void emptyBodyIsUnclassifiedFailure() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("m"), WINDOW);

        assertTrue(outcome.isFailure());
        assertEquals(FetchErrorKind.UNCLASSIFIED, outcome.getErrorKind());
    }

    @Test
    public void emptyErrorListIsIgnored() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"data\":{\"m0\":{\"timeseriesDataJson\":[]}},\"errors\":[]}",
                        MediaType.APPLICATION_JSON));

        FetchOutcome outcome = client.fetch(List.of("m"), WINDOW);

        assertFalse(outcome.isFailure());
        assertEquals(Set.of("m"), outcome.getRows().keySet());
    }

    @Test
    public void errorStatusWithGraphQlBodyIsClassified() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"errors\":[{\"message\":\"Operation is too complex\"}]}"));

        FetchOutcome outcome = client.fetch(List.of("a"), WINDOW);

        assertEquals(FetchErrorKind.QUERY_TOO_COMPLEX, outcome.getErrorKind());
    }

    @Test
    public void serverErrorIsTransport() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("upstream down"));

        FetchOutcome outcome = client.fetch(List.of("a"), WINDOW);

        assertEquals(FetchErrorKind.TRANSPORT, outcome.getErrorKind());
        assertTrue(outcome.getMessages().get(0).contains("503"));
    }

    @Test
    public void parsesOffsetTimestamps() {
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"), SantimentClient.parseTimestamp("2025-03-01T02:00:00+02:00"));
        assertNull(SantimentClient.parseTimestamp("yesterday"));
        assertNull(SantimentClient.parseTimestamp(null));
    }
}
