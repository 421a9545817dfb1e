package com.z254.magi.live;

import com.z254.magi.config.MagiProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WebClientLiveSiteContextBuilder} against a local HTTP server.
 */
class WebClientLiveSiteContextBuilderTest {

    private MockWebServer server;
    private MagiProperties properties;
    private WebClientLiveSiteContextBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new MagiProperties();
        builder = new WebClientLiveSiteContextBuilder(properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("should strip markup and prefix a header block")
        void stripsHtml() throws InterruptedException {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/html; charset=utf-8")
                    .setBody("<html><head><style>p { color: red }</style><script>track()</script></head>"
                            + "<body><h1>Welcome</h1><!-- build 42 --><p>Sign   in</p></body></html>"));
            String url = server.url("/").toString();

            StepVerifier.create(builder.buildLiveUrlContext(url))
                    .assertNext(snapshot -> {
                        assertThat(snapshot).startsWith("Live site snapshot\nURL: " + url + "\nStatus: 200 OK\n");
                        assertThat(snapshot).contains("Content-Type: text/html");
                        assertThat(snapshot).endsWith("\n\nWelcome Sign in");
                        assertThat(snapshot).doesNotContain("track()", "color", "build 42");
                    })
                    .verifyComplete();

            RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request).isNotNull();
            assertThat(request.getHeader("User-Agent")).isEqualTo(WebClientLiveSiteContextBuilder.USER_AGENT);
        }

        @Test
        @DisplayName("should cap the text with an ellipsis")
        void capsText() {
            properties.getContext().getLive().setMaxChars(20);
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/plain")
                    .setBody("a".repeat(100)));

            StepVerifier.create(builder.buildLiveUrlContext(server.url("/").toString()))
                    .assertNext(snapshot -> assertThat(snapshot).endsWith("\n\n" + "a".repeat(19) + "…"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report pages without readable text")
        void emptyPage() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/html")
                    .setBody("<html><body><script>x()</script></body></html>"));
            String url = server.url("/").toString();

            StepVerifier.create(builder.buildLiveUrlContext(url))
                    .assertNext(snapshot -> assertThat(snapshot).isEqualTo("Live URL " + url + " did not return readable text."))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should describe non-success statuses instead of failing")
        void nonSuccessStatus() {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
            String url = server.url("/").toString();

            StepVerifier.create(builder.buildLiveUrlContext(url))
                    .expectNext("Live URL " + url + " responded with HTTP 503")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should describe unreachable hosts instead of failing")
        void unreachable() throws IOException {
            String url = server.url("/").toString();
            server.shutdown();

            StepVerifier.create(builder.buildLiveUrlContext(url))
                    .assertNext(snapshot -> assertThat(snapshot).startsWith("Live URL " + url + " could not be fetched: "))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty for an unusable address")
        void invalidAddress() {
            StepVerifier.create(builder.buildLiveUrlContext("not a url")).verifyComplete();
        }
    }

    @Test
    @DisplayName("should collapse whitespace after stripping tags")
    void stripHelpers() {
        assertThat(WebClientLiveSiteContextBuilder.collapseWhitespace(
                WebClientLiveSiteContextBuilder.stripHtml("<div>\n  One<br/>Two\t</div>")))
                .isEqualTo("One Two");
    }
}
