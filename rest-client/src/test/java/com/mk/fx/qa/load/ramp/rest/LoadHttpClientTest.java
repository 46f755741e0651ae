package com.mk.fx.qa.load.ramp.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadHttpClientTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ok", exchange -> {
            lastMethod.set(exchange.getRequestMethod());
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "OK");
        });
        server.createContext("/err", exchange -> respond(exchange, 500, "ERR"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
    }

    @Test
    void execute_returnsStatusAndTiming() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of());

        var response = client.execute(request(HttpMethod.GET, null));

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getResponseTimeMs()).isGreaterThanOrEqualTo(0);
        assertThat(lastMethod.get()).isEqualTo("GET");
    }

    @Test
    void execute_serverError_isReturnedNotThrown() {
        var client = new LoadHttpClient(baseUrl + "/err", Map.of());

        var response = client.execute(request(HttpMethod.GET, null));

        assertThat(response.getStatusCode()).isEqualTo(500);
    }

    @Test
    void prepare_serialisesBodyAsJson_andDefaultsContentType() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of());

        var prepared = client.prepare(request(HttpMethod.POST, Map.of("id", 42)));
        client.execute(prepared);
        client.execute(prepared);

        assertThat(lastMethod.get()).isEqualTo("POST");
        assertThat(lastBody.get()).isEqualTo("{\"id\":42}");
        assertThat(lastContentType.get()).isEqualTo("application/json");
    }

    @Test
    void requestHeaders_overrideGlobalHeaders() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of("Content-Type", "text/plain"));
        var request = request(HttpMethod.POST, "raw");
        request.setHeaders(Map.of("Content-Type", "application/vnd.test+json"));

        client.execute(request);

        assertThat(lastContentType.get()).isEqualTo("application/vnd.test+json");
    }

    @Test
    void globalContentType_winsOverJsonDefault_whenBodyPresent() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of("Content-Type", "text/plain"));

        var prepared = client.prepare(request(HttpMethod.POST, "raw"));
        client.execute(prepared);

        assertThat(prepared.headers().allValues("Content-Type")).containsExactly("text/plain");
        assertThat(lastContentType.get()).isEqualTo("text/plain");
        assertThat(lastBody.get()).isEqualTo("\"raw\"");
    }

    @Test
    void headerNames_areCaseInsensitive() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", "application/json");
        headers.put("content-type", "text/plain");
        var client = new LoadHttpClient(baseUrl + "/ok", headers);

        var withoutBody = client.prepare(request(HttpMethod.GET, null));
        var withBody = client.prepare(request(HttpMethod.POST, Map.of("id", 1)));

        assertThat(withoutBody.headers().allValues("Content-Type")).containsExactly("text/plain");
        assertThat(withBody.headers().allValues("Content-Type")).containsExactly("text/plain");
    }

    @Test
    void lowerCaseRequestContentType_winsOverJsonDefault() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of());
        var request = request(HttpMethod.POST, Map.of("id", 1));
        request.setHeaders(Map.of("content-type", "application/x-ndjson"));

        var prepared = client.prepare(request);

        assertThat(prepared.headers().allValues("Content-Type")).containsExactly("application/x-ndjson");
    }

    @Test
    void validateHeaders_rejectsHeadersTheJdkReserves() {
        assertThatThrownBy(() -> LoadHttpClient.validateHeaders(Map.of("Host", "example.com")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Host");
        assertThatThrownBy(() -> LoadHttpClient.validateHeaders(Map.of("Connection", "close")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Connection");
        assertThatThrownBy(() -> LoadHttpClient.validateHeaders(Map.of("Bad Name", "x")))
                .isInstanceOf(IllegalArgumentException.class);

        LoadHttpClient.validateHeaders(Map.of("X-Trace", "ramp", "Content-Type", "text/plain"));
        LoadHttpClient.validateHeaders(null);
    }

    @Test
    void parseTargetUrl_rejectsMalformedUrl() {
        assertThatThrownBy(() -> LoadHttpClient.parseTargetUrl("http://exa mple.com/x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("malformed");
        assertThat(LoadHttpClient.parseTargetUrl(" http://example.com/x ").getHost())
                .isEqualTo("example.com");
    }

    @Test
    void connectionRefused_throwsLoadHttpExceptionWithElapsedTime() throws IOException {
        int closedPort;
        try (var socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        var client = new LoadHttpClient("http://127.0.0.1:" + closedPort + "/ok", 1_000, 1_000, Map.of());

        assertThatThrownBy(() -> client.execute(request(HttpMethod.GET, null)))
                .isInstanceOf(LoadHttpException.class)
                .satisfies(ex -> {
                    var loadEx = (LoadHttpException) ex;
                    assertThat(loadEx.getElapsedMs()).isGreaterThanOrEqualTo(0);
                    assertThat(loadEx.isTimeout()).isFalse();
                    assertThat(loadEx.getMessage()).startsWith("Error executing request");
                });
    }

    @Test
    void slowResponse_beyondRequestTimeout_isReportedAsTimeout() {
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        var client = new LoadHttpClient(baseUrl + "/slow", 1_000, 100, Map.of());

        assertThatThrownBy(() -> client.execute(request(HttpMethod.GET, null)))
                .isInstanceOf(LoadHttpException.class)
                .satisfies(ex -> assertThat(((LoadHttpException) ex).isTimeout()).isTrue());
    }

    @Test
    void invalidTargetUrls_areRejected() {
        assertThatThrownBy(() -> new LoadHttpClient(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoadHttpClient("ftp://example.com/file", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoadHttpClient("/relative/path", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoadHttpClient(baseUrl, 0, 100, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_withoutMethod_isRejected() {
        var client = new LoadHttpClient(baseUrl + "/ok", Map.of());

        assertThatThrownBy(() -> client.prepare(new Request()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("method");
    }

    @Test
    void httpMethod_fromValue_isCaseInsensitive() {
        assertThat(HttpMethod.fromValue("post")).isEqualTo(HttpMethod.POST);
        assertThat(HttpMethod.fromValue(" Get ")).isEqualTo(HttpMethod.GET);
        assertThatThrownBy(() -> HttpMethod.fromValue("FETCH"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Request request(HttpMethod method, Object body) {
        var request = new Request();
        request.setMethod(method);
        request.setBody(body);
        return request;
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
