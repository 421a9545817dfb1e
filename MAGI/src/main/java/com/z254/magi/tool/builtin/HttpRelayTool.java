package com.z254.magi.tool.builtin;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.live.BoundedBody;
import com.z254.magi.live.LiveUrlNormalizer;
import com.z254.magi.tool.AgentTool;
import com.z254.magi.tool.ToolResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lets agents inspect the audited site over HTTP(S).
 * Only public hosts on default ports are reachable; bodies are capped in both directions.
 */
@Slf4j
@Component
public class HttpRelayTool implements AgentTool {

    public static final String TOOL_NAME = "http_request";

    static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");
    private static final Set<String> FORBIDDEN_HEADERS = Set.of("host", "content-length");
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final WebClient webClient;
    private final MagiProperties.RelayProperties config;
    private final Counter relayCallCounter;
    private final Counter relayBlockedCounter;

    public HttpRelayTool(MagiProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getRelay();
        this.webClient = WebClient.builder().build();
        this.relayCallCounter = Counter.builder("magi.relay.calls")
                .register(meterRegistry);
        this.relayBlockedCounter = Counter.builder("magi.relay.blocked")
                .register(meterRegistry);
    }

    @Override
    public String getName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Perform an HTTP request against the live site under audit and return the status, "
                + "headers and a preview of the body. Only public http(s) hosts on ports 80 and 443 are allowed.";
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "url", Map.of("type", "string", "description", "Absolute URL to request"),
                        "method", Map.of("type", "string",
                                "enum", List.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS"),
                                "description", "HTTP method, GET by default"),
                        "headers", Map.of("type", "object",
                                "additionalProperties", Map.of("type", "string"),
                                "description", "Extra request headers"),
                        "body", Map.of("type", "string", "description", "Request body for POST, PUT or PATCH")
                ),
                "required", List.of("url")
        );
    }

    @Override
    public ValidationResult validate(Map<String, Object> parameters) {
        try {
            prepare(parameters);
            return ValidationResult.success();
        } catch (RelayRejectedException e) {
            relayBlockedCounter.increment();
            log.warn("Relay request blocked: {}", e.getMessage());
            return ValidationResult.failure(e.getMessage());
        }
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> parameters) {
        return Mono.defer(() -> {
            RelayRequest request;
            try {
                request = prepare(parameters);
            } catch (RelayRejectedException e) {
                relayBlockedCounter.increment();
                log.warn("Relay request blocked: {}", e.getMessage());
                return Mono.error(e);
            }
            relayCallCounter.increment();
            log.debug("Relay {} {}", request.method(), request.uri());

            WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.method()))
                    .uri(request.uri())
                    .headers(headers -> request.headers().forEach(headers::set));
            WebClient.RequestHeadersSpec<?> ready = request.body() != null ? spec.bodyValue(request.body()) : spec;
            return ready.exchangeToMono(response -> readResponse(request.uri(), response))
                    .timeout(config.getTimeout())
                    .map(payload -> ToolResult.success(TOOL_NAME, payload));
        });
    }

    /**
     * Validate and normalize the model-supplied arguments.
     */
    RelayRequest prepare(Map<String, Object> parameters) {
        Object rawUrl = parameters.get("url");
        URI uri = LiveUrlNormalizer.parse(rawUrl instanceof String text ? text : null)
                .orElseThrow(() -> new RelayRejectedException("Invalid or unsupported URL"));
        if (!config.isAllowLocalTargets()) {
            if (uri.getPort() != -1 && uri.getPort() != 80 && uri.getPort() != 443) {
                throw new RelayRejectedException("Only ports 80 and 443 are allowed");
            }
            checkHost(uri.getHost());
        }

        Object rawMethod = parameters.get("method");
        String method = (rawMethod instanceof String text && !text.isBlank() ? text : "GET").toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            throw new RelayRejectedException("HTTP method not allowed");
        }

        String body = null;
        if (parameters.get("body") instanceof String text && !text.isEmpty()) {
            if (text.getBytes(StandardCharsets.UTF_8).length > config.getMaxRequestBodyBytes()) {
                throw new RelayRejectedException("Request body too large");
            }
            body = text;
        }
        return new RelayRequest(uri, method, sanitizeHeaders(parameters.get("headers")), body);
    }

    static void checkHost(String rawHost) {
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.equals("localhost") || host.endsWith(".local")) {
            throw new RelayRejectedException("Local hostnames are not allowed");
        }
        if (IPV4.matcher(host).matches() && isPrivateIPv4(host)) {
            throw new RelayRejectedException("Private network IPv4 addresses are blocked");
        }
        if (host.contains(":") && isPrivateIPv6(host)) {
            throw new RelayRejectedException("Private network IPv6 addresses are blocked");
        }
    }

    static boolean isPrivateIPv4(String host) {
        String[] parts = host.split("\\.");
        int first = Integer.parseInt(parts[0]);
        int second = Integer.parseInt(parts[1]);
        return first == 10
                || (first == 172 && second >= 16 && second <= 31)
                || (first == 192 && second == 168)
                || first == 127;
    }

    static boolean isPrivateIPv6(String host) {
        return host.equals("::1") || host.startsWith("fc") || host.startsWith("fd");
    }

    static Map<String, String> sanitizeHeaders(Object raw) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> headers)) {
            return sanitized;
        }
        headers.forEach((key, value) -> {
            if (key instanceof String name && !name.isEmpty()
                    && value instanceof String text
                    && !FORBIDDEN_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                sanitized.put(name, text);
            }
        });
        return sanitized;
    }

    private Mono<Map<String, Object>> readResponse(URI uri, ClientResponse response) {
        return BoundedBody.read(response.bodyToFlux(DataBuffer.class), config.getMaxResponseBytes())
                .defaultIfEmpty(BoundedBody.EMPTY)
                .map(body -> {
                    int status = response.statusCode().value();
                    HttpStatus resolved = HttpStatus.resolve(status);
                    Map<String, String> headers = new LinkedHashMap<>();
                    HttpHeaders responseHeaders = response.headers().asHttpHeaders();
                    responseHeaders.forEach((name, values) ->
                            headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("url", uri.toString());
                    payload.put("status", status);
                    payload.put("statusText", resolved != null ? resolved.getReasonPhrase() : "");
                    payload.put("headers", headers);
                    payload.put("bodyPreview", body.text());
                    payload.put("truncated", body.truncated());
                    payload.put("bytes", body.length());
                    return payload;
                });
    }

    record RelayRequest(URI uri, String method, Map<String, String> headers, String body) {
    }
}
