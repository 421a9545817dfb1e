package com.z254.magi.api.v1;

import com.z254.magi.artifact.ArtifactStatus;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.artifact.impl.InMemoryChunkStore;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.ProviderType;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.llm.ProviderClient;
import com.z254.magi.llm.ProviderException;
import com.z254.magi.llm.ProviderInvocation;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Integration tests for the session, artifact and provider endpoints.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class SessionControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private InMemoryChunkStore chunkStore;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @MockBean
    private ProviderClient providerClient;

    private String sessionId;

    @BeforeEach
    void setUp() {
        sessionId = webTestClient.post()
                .uri("/api/v1/magi/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "user-it", "question", "Does the login page leak tokens?"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody()
                .get("sessionId")
                .toString();
    }

    private WebTestClient.ResponseSpec step(String step) {
        return webTestClient.post()
                .uri("/api/v1/magi/sessions/{id}/step", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("step", step, "credentials", Map.of("openai", "sk", "anthropic", "ak", "grok", "gk")))
                .exchange();
    }

    @Nested
    @DisplayName("POST /api/v1/magi/sessions")
    class CreateTests {

        @Test
        @DisplayName("should reject a missing question")
        void missingQuestion() {
            webTestClient.post()
                    .uri("/api/v1/magi/sessions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("userId", "user-it"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.ok").isEqualTo(false)
                    .jsonPath("$.error").exists();
        }

        @Test
        @DisplayName("should reject an artifact that is still processing")
        void artifactNotReady() {
            chunkStore.register(CodeArtifact.builder()
                    .id("art-processing")
                    .userId("user-it")
                    .status(ArtifactStatus.PROCESSING)
                    .build(), List.of());

            webTestClient.post()
                    .uri("/api/v1/magi/sessions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("userId", "user-it", "question", "Q", "artifactId", "art-processing"))
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Artifact art-processing is not ready");
        }
    }

    @Nested
    @DisplayName("GET /api/v1/magi/sessions")
    class ReadTests {

        @Test
        @DisplayName("should list the user's sessions")
        void list() {
            webTestClient.get()
                    .uri("/api/v1/magi/sessions?userId=user-it")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.ok").isEqualTo(true)
                    .jsonPath("$.sessions[?(@.id == '" + sessionId + "')].status").isEqualTo("running");
        }

        @Test
        @DisplayName("should require a user when listing")
        void listWithoutUser() {
            webTestClient.get()
                    .uri("/api/v1/magi/sessions")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("userId is required");
        }

        @Test
        @DisplayName("should return the transcript and the agent roster")
        void detail() {
            webTestClient.get()
                    .uri("/api/v1/magi/sessions/{id}", sessionId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.session.id").isEqualTo(sessionId)
                    .jsonPath("$.messages[0].role").isEqualTo("user")
                    .jsonPath("$.agents.length()").isEqualTo(3);
        }

        @Test
        @DisplayName("should return 404 for unknown sessions")
        void unknown() {
            webTestClient.get()
                    .uri("/api/v1/magi/sessions/{id}", "does-not-exist")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Session not found: does-not-exist");
        }
    }

    @Nested
    @DisplayName("POST /api/v1/magi/sessions/{id}/step")
    class StepTests {

        @Test
        @DisplayName("should run propose, vote and consensus in order")
        void fullWorkflow() {
            when(providerClient.invoke(any(), any(), any(), any())).thenAnswer(invocation -> {
                Agent agent = invocation.getArgument(0);
                List<LLMRequest.Message> conversation = invocation.getArgument(2);
                String reply = conversation.get(0).getContent().contains("Reply ONLY with a JSON object")
                        ? "{\"score\": 70, \"reason\": \"fine\"}"
                        : "Proposal from " + agent.getName();
                return Mono.just(new ProviderInvocation(reply, agent.getProvider(), 0));
            });

            step("propose").expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.ok").isEqualTo(true)
                    .jsonPath("$.next").isEqualTo("vote")
                    .jsonPath("$.proposals.length()").isEqualTo(3);

            step("vote").expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.next").isEqualTo("consensus")
                    .jsonPath("$.votes.length()").isEqualTo(6);

            step("consensus").expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("consensus")
                    .jsonPath("$.finalMessage.content").isEqualTo("Proposal from BALTHASAR")
                    .jsonPath("$.diagnostics.winningScore").isEqualTo(140);
        }

        @Test
        @DisplayName("should return 500 with diagnostics when a proposal fails")
        void proposeFailure() {
            when(providerClient.invoke(any(), any(), any(), any()))
                    .thenReturn(Mono.error(new ProviderException(ProviderType.OPENAI, 429)));

            step("propose").expectStatus().is5xxServerError()
                    .expectBody()
                    .jsonPath("$.ok").isEqualTo(false)
                    .jsonPath("$.error").value(error -> assertThat(error.toString())
                            .contains("proposal failed: openai error 429"))
                    .jsonPath("$.diagnostics.step").isEqualTo("propose");
        }

        @Test
        @DisplayName("should reject unknown steps")
        void unknownStep() {
            step("critique").expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Unknown step: critique");
        }
    }

    @Nested
    @DisplayName("Other endpoints")
    class OtherEndpointTests {

        @Test
        @DisplayName("should hide artifacts from other users")
        void artifactOwnership() {
            chunkStore.register(CodeArtifact.builder()
                    .id("art-owned")
                    .userId("owner")
                    .status(ArtifactStatus.READY)
                    .build(), List.of());

            webTestClient.get()
                    .uri("/api/v1/artifacts/art-owned?userId=owner")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.artifact.status").isEqualTo("ready");
            webTestClient.get()
                    .uri("/api/v1/artifacts/art-owned?userId=someone-else")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should ping known providers and reject unknown ones")
        void ping() {
            when(providerClient.ping(eq(ProviderType.ANTHROPIC), any())).thenReturn(Mono.just(true));

            webTestClient.post()
                    .uri("/api/v1/providers/ping")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("provider", "anthropic", "apiKey", "ak"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.ok").isEqualTo(true);

            webTestClient.post()
                    .uri("/api/v1/providers/ping")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("provider", "mistral", "apiKey", "k"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("Provider circuit breakers")
    class CircuitBreakerTests {

        @Test
        @DisplayName("should ignore caller faults and record server errors for every provider")
        void ignoresCallerFaults() {
            for (ProviderType provider : ProviderType.values()) {
                CircuitBreakerConfig config = circuitBreakerRegistry.circuitBreaker(provider.getId())
                        .getCircuitBreakerConfig();

                assertThat(config.getIgnoreExceptionPredicate().test(new ProviderException(provider, 401))).isTrue();
                assertThat(config.getIgnoreExceptionPredicate().test(new ProviderException(provider, 500))).isFalse();
            }
        }
    }
}
