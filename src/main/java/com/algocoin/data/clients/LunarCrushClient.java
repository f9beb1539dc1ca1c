package com.algocoin.data.clients;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.algocoin.data.metrics.FetchErrorKind;
import com.algocoin.data.metrics.FetchOutcome;
import com.algocoin.data.metrics.Frequency;
import com.algocoin.data.metrics.RemoteFetcher;
import com.algocoin.data.metrics.SeriesPoint;
import com.algocoin.data.metrics.TimeWindow;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fetches the coin time series of the LunarCrush REST API. The endpoint
 * returns every field at once, so the requested metrics are picked from the
 * rows client side.
 */
public class LunarCrushClient implements RemoteFetcher {

    private static final Logger logger = LoggerFactory.getLogger(LunarCrushClient.class);

    static final String[] TIME_KEYS = { "time", "timestamp", "datetime", "date" };

    private final ApiBase apiBase;
    private final ProviderErrorClassifier classifier;
    private final String coin;
    private final Frequency interval;

    public LunarCrushClient(ApiBase apiBase, String coin, Frequency interval) {
        this.apiBase = apiBase;
        this.classifier = new ProviderErrorClassifier();
        this.coin = coin;
        this.interval = interval;
    }

    public static String authorization(String apiKey) {
        return "Bearer " + apiKey;
    }

    /**
     * Fetches the requested fields; an empty metric list selects the default
     * sentiment fields (see {@link #defaultMetricSelection}).
     */
    @Override
    public FetchOutcome fetch(List<String> metrics, TimeWindow window) {
        JsonNode rows;
        try {
            rows = fetchRows(window);
        } catch (ApiBase.ApiException e) {
            logger.warn("LunarCrush request failed: {}", e.getMessage());
            return FetchOutcome.failure(FetchErrorKind.TRANSPORT, e.getMessage());
        } catch (ProviderError e) {
            return e.outcome;
        }

        if (rows == null || !rows.isArray() || rows.size() == 0) {
            logger.info("No LunarCrush rows for {} over {}", coin, window);
            return FetchOutcome.success(emptySeries(metrics));
        }

        String timeKey = detectTimeKey(rows.get(0));
        if (timeKey == null) {
            return FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, "No time-like field found in response");
        }

        List<String> selected = metrics.isEmpty()
                ? defaultMetricSelection(fieldNames(rows.get(0)), timeKey, true)
                : metrics;

        Map<String, List<SeriesPoint>> series = emptySeries(selected);
        for (Iterator<JsonNode> it = rows.elements(); it.hasNext();) {
            JsonNode row = it.next();
            Instant timestamp = parseTime(row.get(timeKey));
            if (timestamp == null) {
                continue;
            }
            for (String metric : selected) {
                JsonNode value = row.get(metric);
                if (value == null) {
                    continue;
                }
                Object raw = value.isNull() ? null : value.isNumber() ? (Object) value.doubleValue() : value.asText();
                series.get(metric).add(SeriesPoint.coerce(timestamp, raw));
            }
        }
        logger.debug("LunarCrush {} rows for {} over {}", rows.size(), coin, window);
        return FetchOutcome.success(series);
    }

    /**
     * Field names of the first row over a window, used to decide which metrics to collect.
     */
    public List<String> discoverMetrics(TimeWindow window, boolean includeVolumeAndDominance) {
        JsonNode rows;
        try {
            rows = fetchRows(window);
        } catch (ProviderError e) {
            throw new ApiBase.ApiException("LunarCrush error: " + e.outcome.getMessages());
        }
        if (rows == null || !rows.isArray() || rows.size() == 0) {
            return List.of();
        }
        String timeKey = detectTimeKey(rows.get(0));
        return defaultMetricSelection(fieldNames(rows.get(0)), timeKey, includeVolumeAndDominance);
    }

    private JsonNode fetchRows(TimeWindow window) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("interval", interval.toApiInterval());
        params.put("start", window.getStart().toString());
        params.put("end", window.getEnd().toString());

        logger.debug("Fetching {} {} {} -> {}", coin, params.get("interval"), window.getStart(), window.getEnd());
        JsonNode root = apiBase.parseResponse(apiBase.get("/public/coins/" + coin + "/time-series/v2", params));

        JsonNode error = root.get("error");
        if (error == null) {
            error = root.get("errors");
        }
        if (error != null && !error.isNull() && !(error.isArray() && error.size() == 0)) {
            throw new ProviderError(classifier.classify(error));
        }
        return root.has("data") ? root.get("data") : root;
    }

    static String detectTimeKey(JsonNode sample) {
        for (String key : TIME_KEYS) {
            if (sample.has(key)) {
                return key;
            }
        }
        for (Iterator<String> it = sample.fieldNames(); it.hasNext();) {
            String key = it.next();
            if (key.contains("time")) {
                return key;
            }
        }
        return null;
    }

    /**
     * Numbers (and digit-only strings) are Unix seconds, anything else
     * ISO-8601. Out-of-range values give null.
     */
    static Instant parseTime(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            if (value.isNumber()) {
                return value.canConvertToLong() ? Instant.ofEpochSecond(value.asLong()) : null;
            }
            String text = value.asText();
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochSecond(Long.parseLong(text));
            }
        } catch (NumberFormatException | DateTimeException e) {
            logger.debug("Unreadable time value {}: {}", value, e.getMessage());
            return null;
        }
        return SantimentClient.parseTimestamp(value.asText());
    }

    /**
     * Every field mentioning sentiment, optionally the social volume and
     * dominance fields; all non-time fields when none of those exist.
     */
    public static List<String> defaultMetricSelection(List<String> fields, String timeKey,
            boolean includeVolumeAndDominance) {
        TreeSet<String> keep = new TreeSet<>();
        for (String field : fields) {
            String lower = field.toLowerCase(Locale.ROOT);
            if (lower.contains("sentiment")) {
                keep.add(field);
            }
            if (includeVolumeAndDominance
                    && (lower.startsWith("social_volume") || lower.contains("social_dominance"))) {
                keep.add(field);
            }
        }
        if (keep.isEmpty()) {
            for (String field : fields) {
                if (!field.equals(timeKey)) {
                    keep.add(field);
                }
            }
        }
        return new ArrayList<>(keep);
    }

    private static List<String> fieldNames(JsonNode row) {
        List<String> names = new ArrayList<>();
        row.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static Map<String, List<SeriesPoint>> emptySeries(List<String> metrics) {
        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        for (String metric : metrics) {
            series.put(metric, new ArrayList<>());
        }
        return series;
    }

    public String getCoin() {
        return coin;
    }

    /**
     * Carries a classified provider error out of {@link #fetchRows}.
     */
    private static class ProviderError extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final transient FetchOutcome outcome;

        ProviderError(FetchOutcome outcome) {
            super(String.valueOf(outcome.getMessages()));
            this.outcome = outcome;
        }
    }
}
