package com.mk.fx.qa.load.ramp.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * HTTP client used to fire requests at a single target URL. Requests are built once with
 * {@link #prepare(Request)} and may be sent any number of times from any number of threads.
 * Connection and request timeouts are always explicit. This implementation does not include
 * retry logic.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

    /** Default connection timeout in milliseconds. */
    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5_000;

    /** Default request timeout in milliseconds. */
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;

    private static final String CONTENT_TYPE = "Content-Type";

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests, keyed case-insensitively. */
    private final Map<String, String> headers;

    /** Absolute URL every request is sent to. */
    private final URI targetUri;

    /** Timeout duration for requests. */
    private final Duration requestTimeout;

    /**
     * Constructs a client with default timeouts.
     *
     * @param targetUrl absolute http(s) URL all requests go to
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(String targetUrl, Map<String, String> headers) {
        this(targetUrl, DEFAULT_CONNECTION_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS, headers);
    }

    /**
     * Constructs a client with explicit timeouts.
     *
     * @param targetUrl absolute http(s) URL all requests go to
     * @param connTimeoutMs connection timeout in milliseconds
     * @param requestTimeoutMs request timeout in milliseconds, covering the full response
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(
            String targetUrl, int connTimeoutMs, int requestTimeoutMs, Map<String, String> headers) {
        if (connTimeoutMs <= 0 || requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
        this.targetUri = parseTargetUrl(targetUrl);
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connTimeoutMs))
                .build();

        this.headers = caseInsensitive(headers);

        log.info(
                "LoadHttpClient initialised - Target: {}, Connection timeout: {}ms, Request timeout: {}ms",
                targetUri,
                connTimeoutMs,
                requestTimeoutMs);
    }

    /**
     * Builds an immutable HTTP request for the target URL. The body, when present, is serialised
     * to JSON once here rather than on every send.
     *
     * @param request method, headers and body to use
     * @return a request that can be passed to {@link #execute(HttpRequest)} repeatedly
     * @throws IllegalArgumentException if the request has no method or the body is not serialisable
     */
    public HttpRequest prepare(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");
        if (request.getMethod() == null) {
            throw new IllegalArgumentException("Request method is required");
        }

        var requestBuilder = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(requestTimeout);

        // global headers
        headers.forEach(requestBuilder::setHeader);

        // request-specific headers override
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(requestBuilder::setHeader);
        }

        if (request.getBody() != null) {
            String jsonBody;
            try {
                jsonBody = JsonUtil.toJson(request.getBody());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to serialize request body: " + e.getMessage(), e);
            }
            // a Content-Type given in any case, globally or per request, wins over the JSON default
            if (!headers.containsKey(CONTENT_TYPE)
                    && !caseInsensitive(request.getHeaders()).containsKey(CONTENT_TYPE)) {
                requestBuilder.setHeader(CONTENT_TYPE, "application/json");
            }
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
        }

        return requestBuilder.build();
    }

    /**
     * Builds and sends a request in one go.
     *
     * @see #prepare(Request)
     * @see #execute(HttpRequest)
     */
    public RestResponseData execute(Request request) {
        return execute(prepare(request));
    }

    /**
     * Sends a prepared request synchronously. The response body is read in full and discarded
     * before the response time is taken. Any HTTP status, including 4xx and 5xx, is a normal return.
     *
     * @param httpRequest a request built by {@link #prepare(Request)}
     * @return the response data
     * @throws LoadHttpException if no response could be obtained
     */
    public RestResponseData execute(HttpRequest httpRequest) {
        Objects.requireNonNull(httpRequest, "HttpRequest cannot be null");

        var startTime = System.nanoTime();
        try {
            log.debug("Executing {} request to {}", httpRequest.method(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.discarding());
            var duration = elapsedMs(startTime);

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return buildResponseData(response, duration);

        } catch (HttpTimeoutException e) {
            throw new LoadHttpException(
                    "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(),
                    e,
                    elapsedMs(startTime),
                    true);
        } catch (IOException e) {
            throw new LoadHttpException(
                    "Error executing request: " + describe(e), e, elapsedMs(startTime), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadHttpException("Request interrupted", e, elapsedMs(startTime), false);
        }
    }

    /**
     * Builds a RestResponseData object from the HTTP response.
     *
     * @param response the HTTP response
     * @param durationMs the duration of the request in milliseconds
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(HttpResponse<Void> response, long durationMs) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static Map<String, String> caseInsensitive(Map<String, String> source) {
        var result = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            result.putAll(source);
        }
        return result;
    }

    /** JDK connect failures often carry a null message; fall back to the exception type. */
    private static String describe(Throwable t) {
        var message = t.getMessage();
        if (message == null || message.isBlank()) {
            var cause = t.getCause();
            return cause != null ? describe(cause) : t.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Checks that every header may be sent by {@link HttpClient}: a legal name, a legal non-null
     * value and not one of the headers the JDK reserves for itself ({@code Host}, {@code Connection},
     * {@code Content-Length} and the like).
     *
     * @param headers headers to check, may be null
     * @throws IllegalArgumentException naming the first header that cannot be sent
     */
    public static void validateHeaders(Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        var builder = HttpRequest.newBuilder();
        headers.forEach((name, value) -> {
            if (name == null || value == null) {
                throw new IllegalArgumentException("Header " + name + " must have a name and a value");
            }
            try {
                builder.setHeader(name, value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Header " + name + " cannot be sent: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Parses and validates the target URL.
     *
     * @param targetUrl the target URL to validate
     * @return the parsed URI
     * @throws IllegalArgumentException if the URL is empty, malformed or not http(s)
     */
    public static URI parseTargetUrl(String targetUrl) {
        Objects.requireNonNull(targetUrl, "Target URL cannot be null");
        var trimmed = targetUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Target URL cannot be empty");
        }
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Target URL is malformed: " + targetUrl, e);
        }
        var scheme = uri.getScheme();
        if (scheme == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new IllegalArgumentException("Target URL must be an absolute http(s) URL: " + targetUrl);
        }
        return uri;
    }

    @Override
    public void close() {
        // java.net.http.HttpClient on JDK 17 has no explicit close; its pool is released on GC
        log.debug("LoadHttpClient for {} closed", targetUri);
    }
}
