package com.algocoin.data.clients;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.algocoin.data.metrics.FetchErrorKind;
import com.algocoin.data.metrics.FetchOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ProviderErrorClassifierTest {

    private final ProviderErrorClassifier classifier = new ProviderErrorClassifier();

    @Test
    public void extractsUnsupportedMetricNames() {
        FetchOutcome outcome = classifier.classify(List.of(
                "The metric 'sentiment_positive_farcaster' is not supported or is mistyped.",
                "The metric 'social_volume_farcaster' is not supported or is mistyped."));

        assertEquals(FetchErrorKind.UNSUPPORTED_METRIC, outcome.getErrorKind());
        assertEquals(Set.of("sentiment_positive_farcaster", "social_volume_farcaster"),
                outcome.getUnsupportedMetrics());
        assertEquals(2, outcome.getMessages().size());
    }

    @Test
    public void unsupportedWinsOverOtherErrors() {
        FetchOutcome outcome = classifier.classify(List.of(
                "Internal server error",
                "The metric 'x' is not supported"));

        assertEquals(FetchErrorKind.UNSUPPORTED_METRIC, outcome.getErrorKind());
        assertEquals(Set.of("x"), outcome.getUnsupportedMetrics());
    }

    @Test
    public void complexityErrors() {
        assertEquals(FetchErrorKind.QUERY_TOO_COMPLEX,
                classifier.classify(List.of("Operation is too complex: complexity is 5230 and maximum is 5000"))
                        .getErrorKind());
        assertEquals(FetchErrorKind.QUERY_TOO_COMPLEX,
                classifier.classify(List.of("Query Complexity limit exceeded")).getErrorKind());
    }

    @Test
    public void anythingElseIsUnclassified() {
        FetchOutcome outcome = classifier.classify(List.of("API key is invalid"));
        assertEquals(FetchErrorKind.UNCLASSIFIED, outcome.getErrorKind());
        assertTrue(outcome.getUnsupportedMetrics().isEmpty());
    }

    @Test
    public void readsGraphQlErrorObjects() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        FetchOutcome outcome = classifier.classify(mapper.readTree(
                "[{\"message\":\"The metric 'abc' is not supported or is mistyped.\",\"path\":[\"m1\"]}]"));

        assertEquals(Set.of("abc"), outcome.getUnsupportedMetrics());
        assertEquals(List.of("The metric 'abc' is not supported or is mistyped."),
                ProviderErrorClassifier.messagesOf(mapper.readTree(
                        "[{\"message\":\"The metric 'abc' is not supported or is mistyped.\"}]")));
        assertEquals(List.of("rate limited"), ProviderErrorClassifier.messagesOf(mapper.readTree("\"rate limited\"")));
    }
}
