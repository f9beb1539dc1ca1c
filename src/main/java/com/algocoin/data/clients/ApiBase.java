package com.algocoin.data.clients;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Deque;
import java.util.LinkedList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * HTTP plumbing shared by the provider clients: authorization header,
 * rate limiting, request logging and JSON parsing.
 */
public class ApiBase {

    private static final Logger logger = LoggerFactory.getLogger(ApiBase.class);
    private static final Logger requestLogger = LoggerFactory.getLogger("RequestLogger");

    private static final int RATE_LIMIT_WINDOW_MINUTES = 1;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxRequestsPerMinute;

    // Rate limiting tracking, shared by every thread using this client
    private final Deque<Instant> requestTimestamps = new LinkedList<>();
    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    private int totalRequests = 0;
    private int debugLevel = 0;

    /**
     * @param authorization value of the Authorization header, e.g. {@code "Apikey xyz"}
     */
    public ApiBase(String baseUrl, String authorization, int maxRequestsPerMinute, Duration timeout) {
        this(RestClient.builder().requestFactory(createRequestFactory(timeout)), baseUrl, authorization,
                maxRequestsPerMinute);
    }

    /**
     * Builds the client from a caller supplied builder, which lets tests bind
     * a mock server to it.
     */
    public ApiBase(RestClient.Builder builder, String baseUrl, String authorization, int maxRequestsPerMinute) {
        if (authorization != null) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, authorization);
        }
        this.restClient = builder.build();
        this.objectMapper = new ObjectMapper();
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.maxRequestsPerMinute = maxRequestsPerMinute;

        logger.debug("API base client initialized for {} ({} requests/minute)", this.baseUrl, maxRequestsPerMinute);
    }

    private static HttpComponentsClientHttpRequestFactory createRequestFactory(Duration timeout) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();

        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * POST a JSON body to the base URL (plus optional path) and return the raw response.
     */
    protected String postJson(String path, Object body) {
        String url = baseUrl + path;
        logRequest(url);
        checkRateLimit();
        trackRequest();

        try {
            long startTime = System.currentTimeMillis();
            String response = restClient.post()
                    .uri(URI.create(url))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(body))
                    .retrieve()
                    .body(String.class);
            long endTime = System.currentTimeMillis();

            if (debugLevel >= 2) {
                requestLogger.debug("Response time: {} ms for POST {}", (endTime - startTime), url);
            }
            if (debugLevel >= 3) {
                requestLogger.debug("Response body: {}", response);
            }
            return response;
        } catch (JsonProcessingException e) {
            throw new ApiException("Failed to serialize request body", e);
        } catch (RestClientException e) {
            requestLogger.error("Request failed: POST {} - {}", url, e.getMessage());
            throw wrap(e);
        }
    }

    /**
     * GET {@code baseUrl + path} with the given query parameters and return the raw response.
     */
    protected String get(String path, Map<String, ?> queryParams) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + path);
        queryParams.forEach((name, value) -> uri.queryParam(name, value));
        URI target = uri.build().encode().toUri();

        logRequest(target.toString());
        checkRateLimit();
        trackRequest();

        try {
            long startTime = System.currentTimeMillis();
            String response = restClient.get()
                    .uri(target)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            long endTime = System.currentTimeMillis();

            if (debugLevel >= 2) {
                requestLogger.debug("Response time: {} ms for GET {}", (endTime - startTime), target);
            }
            if (debugLevel >= 3) {
                requestLogger.debug("Response body: {}", response);
            }
            return response;
        } catch (RestClientException e) {
            requestLogger.error("Request failed: GET {} - {}", target, e.getMessage());
            throw wrap(e);
        }
    }

    private ApiException wrap(RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            String body = response.getResponseBodyAsString();
            return new ApiException("API error: " + response.getStatusCode().value() + " - "
                    + abbreviate(body, 300), response.getStatusCode().value(), body, e);
        }
        return new ApiException("Request failed: " + e.getMessage(), e);
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    /**
     * Parse a response body into a JSON tree.
     */
    protected JsonNode parseResponse(String responseBody) {
        try {
            return objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response: {}", e.getMessage());
            throw new ApiException("Failed to parse JSON response", e);
        }
    }

    private synchronized void checkRateLimit() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(RATE_LIMIT_WINDOW_MINUTES, ChronoUnit.MINUTES);

        while (!requestTimestamps.isEmpty() && requestTimestamps.peekFirst().isBefore(cutoff)) {
            requestTimestamps.removeFirst();
        }

        if (requestTimestamps.size() >= maxRequestsPerMinute) {
            try {
                Instant oldestTimestamp = requestTimestamps.peekFirst();
                Instant nextAllowedRequest = oldestTimestamp.plus(RATE_LIMIT_WINDOW_MINUTES, ChronoUnit.MINUTES);
                long waitTimeMs = now.until(nextAllowedRequest, ChronoUnit.MILLIS);

                if (waitTimeMs > 0) {
                    logger.warn("Rate limit reached. Waiting {} ms", waitTimeMs);
                    Thread.sleep(waitTimeMs + 50);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ApiException("Rate limit wait interrupted", e);
            }
            requestTimestamps.removeFirst();
        }

        requestTimestamps.addLast(Instant.now());
    }

    private void logRequest(String url) {
        if (debugLevel <= 0) return;

        String endpoint = extractEndpoint(url);
        AtomicInteger count = endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0));
        int requestNum = count.incrementAndGet();
        String time = LocalDateTime.now().format(timeFormat);

        requestLogger.debug("[{}] Request #{}: {}", time, requestNum, endpoint);
        if (debugLevel >= 2) {
            requestLogger.debug("Full URL: {}", url);
        }
    }

    private String extractEndpoint(String url) {
        String endpoint = url.startsWith(baseUrl) ? url.substring(baseUrl.length()) : url;
        int queryIndex = endpoint.indexOf('?');
        if (queryIndex >= 0) {
            endpoint = endpoint.substring(0, queryIndex);
        }
        return endpoint.isEmpty() ? "/" : endpoint;
    }

    private synchronized void trackRequest() {
        totalRequests++;
        if (totalRequests % 10 == 0) {
            logger.debug("API request stats: {} total, {} in last minute", totalRequests, requestTimestamps.size());
        }
    }

    public void setDebugLevel(int level) {
        this.debugLevel = Math.max(0, Math.min(3, level));
        logger.debug("Debug level set to {}", this.debugLevel);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static class ApiException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final int statusCode;
        private final String responseBody;

        public ApiException(String message) {
            this(message, null);
        }

        public ApiException(String message, Throwable cause) {
            this(message, -1, null, cause);
        }

        public ApiException(String message, int statusCode, String responseBody, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
            this.responseBody = responseBody;
        }

        /**
         * HTTP status of the failed response, -1 when no response was received.
         */
        public int getStatusCode() {
            return statusCode;
        }

        public String getResponseBody() {
            return responseBody;
        }
    }
}
