package com.z254.magi.live;

import com.z254.magi.config.MagiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * {@link LiveSiteContextBuilder} that GETs the page with {@link WebClient}, strips markup and
 * caps the text.
 */
@Slf4j
@Component
public class WebClientLiveSiteContextBuilder implements LiveSiteContextBuilder {

    static final String USER_AGENT = "MAGI/1.0 (+security audit)";

    private static final Pattern SCRIPT = Pattern.compile("<script[\\s\\S]*?>[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile("<style[\\s\\S]*?>[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENT = Pattern.compile("<!--([\\s\\S]*?)-->");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern HTML_TYPE = Pattern.compile("html", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final WebClient webClient;
    private final MagiProperties.ContextProperties.LiveProperties config;

    public WebClientLiveSiteContextBuilder(MagiProperties properties) {
        this.config = properties.getContext().getLive();
        this.webClient = WebClient.builder()
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, "text/html, text/plain;q=0.9, */*;q=0.1")
                .build();
    }

    @Override
    public Mono<String> buildLiveUrlContext(String liveUrl) {
        URI uri = LiveUrlNormalizer.parse(liveUrl).orElse(null);
        if (uri == null) {
            return Mono.empty();
        }
        String normalized = uri.toString();
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> render(normalized, response))
                .timeout(config.getFetchTimeout())
                .onErrorResume(e -> {
                    String reason = e instanceof TimeoutException
                            ? "timed out after " + config.getFetchTimeout().toMillis() + "ms"
                            : (e.getMessage() != null ? e.getMessage() : "unknown error");
                    log.debug("Live snapshot of {} failed: {}", normalized, reason);
                    return Mono.just("Live URL " + normalized + " could not be fetched: " + reason);
                });
    }

    private Mono<String> render(String url, ClientResponse response) {
        int status = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody()
                    .thenReturn("Live URL " + url + " responded with HTTP " + status);
        }
        String contentType = response.headers().contentType()
                .map(Object::toString)
                .orElse("");
        return BoundedBody.read(response.bodyToFlux(DataBuffer.class), config.getMaxFetchBytes())
                .defaultIfEmpty(BoundedBody.EMPTY)
                .map(body -> format(url, status, contentType, body.text()));
    }

    String format(String url, int status, String contentType, String raw) {
        String text = raw;
        if (HTML_TYPE.matcher(contentType).find() || TAG.matcher(text).find()) {
            text = stripHtml(text);
        }
        text = collapseWhitespace(text);
        if (text.isEmpty()) {
            return "Live URL " + url + " did not return readable text.";
        }
        int maxChars = config.getMaxChars();
        if (text.length() > maxChars) {
            text = text.substring(0, Math.max(0, maxChars - 1)) + "…";
        }
        HttpStatus resolved = HttpStatus.resolve(status);
        String statusLine = ("Status: " + status + (resolved != null ? " " + resolved.getReasonPhrase() : "")).trim();
        List<String> header = new ArrayList<>();
        header.add("Live site snapshot");
        header.add("URL: " + url);
        header.add(statusLine);
        if (!contentType.isEmpty()) {
            header.add("Content-Type: " + contentType);
        }
        return String.join("\n", header) + "\n\n" + text;
    }

    static String stripHtml(String html) {
        String text = SCRIPT.matcher(html).replaceAll(" ");
        text = STYLE.matcher(text).replaceAll(" ");
        text = COMMENT.matcher(text).replaceAll(" ");
        return TAG.matcher(text).replaceAll(" ");
    }

    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
