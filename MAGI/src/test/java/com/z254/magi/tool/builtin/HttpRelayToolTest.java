package com.z254.magi.tool.builtin;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.tool.ToolResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HttpRelayTool}.
 */
class HttpRelayToolTest {

    private SimpleMeterRegistry meterRegistry;
    private MagiProperties properties;
    private HttpRelayTool tool;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new MagiProperties();
        tool = new HttpRelayTool(properties, meterRegistry);
    }

    private static Map<String, Object> args(String url) {
        Map<String, Object> args = new HashMap<>();
        args.put("url", url);
        return args;
    }

    @Nested
    @DisplayName("Request rules")
    class RuleTests {

        @Test
        @DisplayName("should block local hostnames")
        void blocksLocalNames() {
            assertThatThrownBy(() -> tool.prepare(args("http://localhost/admin")))
                    .isInstanceOf(RelayRejectedException.class)
                    .hasMessage("Local hostnames are not allowed");
            assertThatThrownBy(() -> tool.prepare(args("https://printer.local/")))
                    .isInstanceOf(RelayRejectedException.class);
        }

        @Test
        @DisplayName("should block private and loopback addresses")
        void blocksPrivateAddresses() {
            for (String url : new String[]{"http://10.1.2.3/", "http://172.16.0.1/", "http://172.31.255.1/",
                    "http://192.168.0.10/", "http://127.0.0.1/"}) {
                assertThatThrownBy(() -> tool.prepare(args(url)))
                        .as(url)
                        .hasMessage("Private network IPv4 addresses are blocked");
            }
            assertThatThrownBy(() -> tool.prepare(args("http://[::1]/")))
                    .hasMessage("Private network IPv6 addresses are blocked");
            assertThatThrownBy(() -> tool.prepare(args("http://[fd12:3456::1]/")))
                    .hasMessage("Private network IPv6 addresses are blocked");
        }

        @Test
        @DisplayName("should allow public addresses next to private ranges")
        void allowsPublicAddresses() {
            assertThat(tool.prepare(args("http://172.32.0.1/")).uri().getHost()).isEqualTo("172.32.0.1");
            assertThat(HttpRelayTool.isPrivateIPv4("11.0.0.1")).isFalse();
            assertThat(HttpRelayTool.isPrivateIPv4("192.169.0.1")).isFalse();
        }

        @Test
        @DisplayName("should only allow default ports")
        void defaultPortsOnly() {
            assertThatThrownBy(() -> tool.prepare(args("https://example.com:8443/")))
                    .hasMessage("Only ports 80 and 443 are allowed");
            assertThat(tool.prepare(args("https://example.com:443/")).uri().toString())
                    .isEqualTo("https://example.com/");
        }

        @Test
        @DisplayName("should reject missing or unusable URLs")
        void rejectsBadUrls() {
            assertThatThrownBy(() -> tool.prepare(new HashMap<>()))
                    .hasMessage("Invalid or unsupported URL");
            assertThatThrownBy(() -> tool.prepare(args("not a url")))
                    .hasMessage("Invalid or unsupported URL");
        }

        @Test
        @DisplayName("should default to GET and uppercase methods from the allowlist")
        void methods() {
            Map<String, Object> post = args("https://example.com/api");
            post.put("method", "post");
            Map<String, Object> trace = args("https://example.com/api");
            trace.put("method", "TRACE");

            assertThat(tool.prepare(args("example.com")).method()).isEqualTo("GET");
            assertThat(tool.prepare(post).method()).isEqualTo("POST");
            assertThatThrownBy(() -> tool.prepare(trace)).hasMessage("HTTP method not allowed");
        }

        @Test
        @DisplayName("should cap the request body")
        void capsBody() {
            Map<String, Object> request = args("https://example.com/upload");
            request.put("method", "POST");
            request.put("body", "x".repeat(64 * 1024 + 1));

            assertThatThrownBy(() -> tool.prepare(request)).hasMessage("Request body too large");
        }

        @Test
        @DisplayName("should drop Host, Content-Length and non-string headers")
        void sanitizesHeaders() {
            Map<String, Object> headers = new HashMap<>();
            headers.put("Host", "evil.example");
            headers.put("content-length", "5");
            headers.put("X-Count", 3);
            headers.put("Accept", "application/json");

            assertThat(HttpRelayTool.sanitizeHeaders(headers)).containsOnly(Map.entry("Accept", "application/json"));
            assertThat(HttpRelayTool.sanitizeHeaders("not a map")).isEmpty();
        }

        @Test
        @DisplayName("should report blocked requests through validation")
        void validationReportsBlocks() {
            assertThat(tool.validate(args("http://192.168.1.1/")).valid()).isFalse();
            assertThat(tool.validate(args("https://example.com/")).valid()).isTrue();
            assertThat(meterRegistry.counter("magi.relay.blocked").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        private MockWebServer server;

        @BeforeEach
        void startServer() throws IOException {
            properties.getRelay().setAllowLocalTargets(true);
            server = new MockWebServer();
            server.start();
        }

        @AfterEach
        void stopServer() throws IOException {
            server.shutdown();
        }

        @Test
        @DisplayName("should return status, lowercase headers and the body preview")
        @SuppressWarnings("unchecked")
        void returnsPayload() throws InterruptedException {
            server.enqueue(new MockResponse()
                    .setResponseCode(404)
                    .setHeader("X-Frame-Options", "DENY")
                    .setBody("missing"));
            Map<String, Object> request = args(server.url("/admin").toString());
            request.put("method", "POST");
            request.put("body", "{\"a\":1}");
            request.put("headers", Map.of("Host", "evil.example", "X-Magi-Trace", "magi"));

            StepVerifier.create(tool.execute(request))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        Map<String, Object> payload = (Map<String, Object>) result.getContent();
                        assertThat(payload.get("status")).isEqualTo(404);
                        assertThat(payload.get("statusText")).isEqualTo("Not Found");
                        assertThat((Map<String, String>) payload.get("headers")).containsEntry("x-frame-options", "DENY");
                        assertThat(payload.get("bodyPreview")).isEqualTo("missing");
                        assertThat(payload.get("truncated")).isEqualTo(false);
                        assertThat(payload.get("bytes")).isEqualTo(7);
                    })
                    .verifyComplete();

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded).isNotNull();
            assertThat(recorded.getMethod()).isEqualTo("POST");
            assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"a\":1}");
            assertThat(recorded.getHeader("X-Magi-Trace")).isEqualTo("magi");
            assertThat(recorded.getHeader("Host")).doesNotContain("evil.example");
            assertThat(meterRegistry.counter("magi.relay.calls").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should truncate bodies over the response cap")
        @SuppressWarnings("unchecked")
        void truncatesBody() {
            properties.getRelay().setMaxResponseBytes(10);
            server.enqueue(new MockResponse().setBody("0123456789abcdef"));

            StepVerifier.create(tool.execute(args(server.url("/").toString())))
                    .assertNext(result -> {
                        Map<String, Object> payload = (Map<String, Object>) result.getContent();
                        assertThat(payload.get("bodyPreview")).isEqualTo("0123456789");
                        assertThat(payload.get("truncated")).isEqualTo(true);
                        assertThat(payload.get("bytes")).isEqualTo(10);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return a truncated body without waiting for a slow download to finish")
        @SuppressWarnings("unchecked")
        void stopsReadingSlowBodyAtCap() {
            properties.getRelay().setMaxResponseBytes(1024);
            properties.getRelay().setTimeout(Duration.ofSeconds(3));
            server.enqueue(new MockResponse()
                    .setBody(new Buffer().write(new byte[4 * 1024 * 1024]))
                    .throttleBody(64 * 1024, 1, TimeUnit.SECONDS));

            StepVerifier.create(tool.execute(args(server.url("/large").toString())))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        Map<String, Object> payload = (Map<String, Object>) result.getContent();
                        assertThat(payload.get("truncated")).isEqualTo(true);
                        assertThat(payload.get("bytes")).isEqualTo(1024);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should fail with the rejection when a request is blocked")
        void failsWhenBlocked() {
            Map<String, Object> request = args(server.url("/").toString());
            request.put("method", "CONNECT");

            StepVerifier.create(tool.execute(request))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(RelayRejectedException.class)
                            .hasMessage("HTTP method not allowed"))
                    .verify();
            assertThat(server.getRequestCount()).isZero();
        }
    }

    @Test
    @DisplayName("should wrap results in the payload shape the model sees")
    void payloadShape() {
        assertThat(ToolResult.success(HttpRelayTool.TOOL_NAME, Map.of("status", 200)).toPayload())
                .containsEntry("ok", true)
                .containsEntry("response", Map.of("status", 200));
        assertThat(ToolResult.failure(HttpRelayTool.TOOL_NAME, "QUOTA_EXCEEDED", "limit").toPayload())
                .containsEntry("ok", false)
                .containsEntry("error", "limit");
    }
}
