package com.z254.magi.api.v1;

import com.z254.magi.api.dto.ApiResponses;
import com.z254.magi.api.dto.PingRequest;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.exception.InvalidRequestException;
import com.z254.magi.llm.ProviderClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Credential checks against provider APIs.
 */
@RestController
@RequestMapping("/api/v1/providers")
@Tag(name = "Providers", description = "Provider credential checks")
@Slf4j
public class ProviderController {

    private final ProviderClient providerClient;

    public ProviderController(ProviderClient providerClient) {
        this.providerClient = providerClient;
    }

    @PostMapping("/ping")
    @Operation(summary = "Ping provider", description = "Check an API key by listing the provider's models")
    @ApiResponse(responseCode = "200", description = "ok reports whether the key works")
    @ApiResponse(responseCode = "400", description = "Missing fields or unknown provider")
    public Mono<ApiResponses.Ping> ping(@Valid @RequestBody PingRequest request) {
        ProviderType provider = ProviderType.fromId(request.getProvider()).orElse(null);
        if (provider == null) {
            return Mono.error(new InvalidRequestException("Unknown provider: " + request.getProvider()));
        }
        return providerClient.ping(provider, request.getApiKey())
                .defaultIfEmpty(false)
                .doOnNext(ok -> log.info("Ping {}: {}", provider.getId(), ok ? "ok" : "failed"))
                .map(ApiResponses.Ping::new);
    }
}
