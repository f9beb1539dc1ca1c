package com.algocoin.data.clients;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.algocoin.data.metrics.FetchErrorKind;
import com.algocoin.data.metrics.FetchOutcome;
import com.algocoin.data.metrics.Frequency;
import com.algocoin.data.metrics.RemoteFetcher;
import com.algocoin.data.metrics.SeriesPoint;
import com.algocoin.data.metrics.TimeWindow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fetches metric series for one asset from the Santiment GraphQL API. Every
 * metric of a batch becomes one aliased {@code getMetric} field of a single
 * query, so a batch costs one request.
 */
public class SantimentClient implements RemoteFetcher {

    private static final Logger logger = LoggerFactory.getLogger(SantimentClient.class);

    private final ApiBase apiBase;
    private final ProviderErrorClassifier classifier;
    private final String slug;
    private final Frequency interval;

    public SantimentClient(ApiBase apiBase, String slug, Frequency interval) {
        this.apiBase = apiBase;
        this.classifier = new ProviderErrorClassifier();
        this.slug = slug;
        this.interval = interval;
    }

    public static String authorization(String apiKey) {
        return "Apikey " + apiKey;
    }

    @Override
    public FetchOutcome fetch(List<String> metrics, TimeWindow window) {
        String query = buildQuery(metrics, window);
        logger.debug("Santiment query for {} metrics of {} over {}", metrics.size(), slug, window);

        String responseBody;
        try {
            responseBody = apiBase.postJson("", Map.of("query", query));
        } catch (ApiBase.ApiException e) {
            return fromFailedResponse(e);
        }

        JsonNode root;
        try {
            root = apiBase.parseResponse(responseBody);
        } catch (ApiBase.ApiException e) {
            return FetchOutcome.failure(FetchErrorKind.TRANSPORT, e.getMessage());
        }

        JsonNode errors = root.get("errors");
        if (hasErrors(errors)) {
            FetchOutcome outcome = classifier.classify(errors);
            logger.debug("Santiment returned errors: {}", outcome);
            return outcome;
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            logger.warn("Santiment response carries no data object");
            return FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, "Response carries no data object");
        }
        return FetchOutcome.success(extractSeries(data, metrics));
    }

    /**
     * Any {@code errors} value counts except null and an empty list.
     */
    static boolean hasErrors(JsonNode errors) {
        return errors != null && !errors.isNull() && !errors.isMissingNode()
                && !(errors.isArray() && errors.size() == 0);
    }

    /**
     * A non-2xx response may still carry a GraphQL error list worth classifying.
     */
    private FetchOutcome fromFailedResponse(ApiBase.ApiException e) {
        String body = e.getResponseBody();
        if (body != null && !body.isEmpty()) {
            try {
                JsonNode errors = apiBase.getObjectMapper().readTree(body).get("errors");
                if (hasErrors(errors)) {
                    return classifier.classify(errors);
                }
            } catch (JsonProcessingException parseError) {
                logger.debug("Error body is not JSON: {}", parseError.getMessage());
            }
        }
        logger.warn("Santiment request failed: {}", e.getMessage());
        return FetchOutcome.failure(FetchErrorKind.TRANSPORT, e.getMessage());
    }

    String buildQuery(List<String> metrics, TimeWindow window) {
        StringBuilder query = new StringBuilder("{\n");
        for (int i = 0; i < metrics.size(); i++) {
            query.append("  m").append(i).append(": getMetric(metric: \"").append(escape(metrics.get(i)))
                    .append("\") {\n")
                    .append("    timeseriesDataJson(\n")
                    .append("      selector: { slug: \"").append(escape(slug)).append("\" }\n")
                    .append("      from: \"").append(window.getStart()).append("\"\n")
                    .append("      to: \"").append(window.getEnd()).append("\"\n")
                    .append("      interval: \"").append(interval.toApiInterval()).append("\"\n")
                    .append("    )\n")
                    .append("  }\n");
        }
        return query.append("}").toString();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private Map<String, List<SeriesPoint>> extractSeries(JsonNode data, List<String> metrics) {
        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        for (int i = 0; i < metrics.size(); i++) {
            JsonNode node = data.get("m" + i);
            series.put(metrics.get(i), toPoints(metrics.get(i), nodeRows(node)));
        }
        return series;
    }

    /**
     * {@code timeseriesDataJson} comes back either as an array or as a string
     * holding one; older queries use {@code timeseriesData}.
     */
    private JsonNode nodeRows(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode rows = node.get("timeseriesDataJson");
        if (rows == null || rows.isNull()) {
            rows = node.get("timeseriesData");
        }
        if (rows == null || rows.isNull()) {
            return null;
        }
        if (rows.isTextual()) {
            try {
                return apiBase.getObjectMapper().readTree(rows.asText());
            } catch (JsonProcessingException e) {
                logger.warn("Unreadable series payload: {}", e.getMessage());
                return null;
            }
        }
        return rows;
    }

    private List<SeriesPoint> toPoints(String metric, JsonNode rows) {
        List<SeriesPoint> points = new ArrayList<>();
        if (rows == null || !rows.isArray()) {
            return points;
        }
        int skipped = 0;
        for (Iterator<JsonNode> it = rows.elements(); it.hasNext();) {
            JsonNode row = it.next();
            Instant timestamp = parseTimestamp(row.path("datetime").asText(null));
            if (timestamp == null) {
                skipped++;
                continue;
            }
            JsonNode value = row.get("value");
            Object raw = value == null || value.isNull() ? null
                    : value.isNumber() ? (Object) value.doubleValue() : value.asText();
            points.add(SeriesPoint.coerce(timestamp, raw));
        }
        if (skipped > 0) {
            logger.debug("Skipped {} rows of {} without a readable datetime", skipped, metric);
        }
        return points;
    }

    static Instant parseTimestamp(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    public String getSlug() {
        return slug;
    }
}
