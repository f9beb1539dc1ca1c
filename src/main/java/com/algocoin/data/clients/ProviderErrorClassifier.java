package com.algocoin.data.clients;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.algocoin.data.metrics.FetchErrorKind;
import com.algocoin.data.metrics.FetchOutcome;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the error list of a provider response into a classified
 * {@link FetchOutcome} failure. This is the only place that looks at error
 * message text.
 */
public class ProviderErrorClassifier {

    private static final Pattern UNSUPPORTED_METRIC = Pattern.compile("The metric '([^']+)' is not supported");

    /**
     * An unsupported metric anywhere in the list wins over every other error,
     * since filtering it out may be all the batch needs.
     */
    public FetchOutcome classify(List<String> messages) {
        Set<String> unsupported = new LinkedHashSet<>();
        for (String message : messages) {
            Matcher matcher = UNSUPPORTED_METRIC.matcher(message);
            while (matcher.find()) {
                unsupported.add(matcher.group(1));
            }
        }
        if (!unsupported.isEmpty()) {
            return FetchOutcome.unsupported(unsupported, messages);
        }

        for (String message : messages) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("too complex") || lower.contains("complexity")) {
                return FetchOutcome.failure(FetchErrorKind.QUERY_TOO_COMPLEX, messages);
            }
        }
        return FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, messages);
    }

    /**
     * Classifies a GraphQL style {@code errors} array of objects carrying a {@code message}.
     */
    public FetchOutcome classify(JsonNode errors) {
        return classify(messagesOf(errors));
    }

    static List<String> messagesOf(JsonNode errors) {
        List<String> messages = new ArrayList<>();
        if (errors == null || errors.isNull()) {
            return messages;
        }
        if (errors.isArray()) {
            for (JsonNode error : errors) {
                messages.add(messageOf(error));
            }
        } else {
            messages.add(messageOf(errors));
        }
        return messages;
    }

    private static String messageOf(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.get("message");
        return message != null && !message.isNull() ? message.asText() : error.toString();
    }
}
