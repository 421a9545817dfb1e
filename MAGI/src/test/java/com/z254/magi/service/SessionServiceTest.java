package com.z254.magi.service;

import com.z254.magi.artifact.ArtifactStatus;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.artifact.impl.InMemoryChunkStore;
import com.z254.magi.config.MagiProperties;
import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.MessageRole;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.repository.impl.InMemorySessionRepository;
import com.z254.magi.exception.DependencyNotReadyException;
import com.z254.magi.exception.InvalidRequestException;
import com.z254.magi.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionServiceTest {

    private InMemorySessionRepository repository;
    private InMemoryChunkStore chunkStore;
    private SessionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepository(new MagiProperties());
        chunkStore = new InMemoryChunkStore();
        service = new SessionService(repository, chunkStore);
    }

    private void artifact(String id, String owner, ArtifactStatus status) {
        chunkStore.register(CodeArtifact.builder().id(id).userId(owner).status(status).build(), List.of());
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("should store the question as the first message and mark the session running")
        void creates() {
            StepVerifier.create(service.createSession("u1", "  Is it safe?  ", null, "Example.COM"))
                    .assertNext(session -> {
                        assertThat(session.getStatus()).isEqualTo(SessionStatus.RUNNING);
                        assertThat(session.getQuestion()).isEqualTo("Is it safe?");
                        assertThat(session.getLiveUrl()).isEqualTo("https://example.com/");
                        assertThat(repository.getSessionFull(session.getId()).block().messagesWithRole(MessageRole.USER))
                                .singleElement()
                                .satisfies(m -> assertThat(m.getContent()).isEqualTo("Is it safe?"));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should require user and question")
        void requiresFields() {
            StepVerifier.create(service.createSession("u1", " ", null, null))
                    .expectErrorMessage("userId and question are required")
                    .verify();
            StepVerifier.create(service.createSession(null, "Q", null, null))
                    .expectError(InvalidRequestException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject malformed live URLs")
        void rejectsLiveUrl() {
            StepVerifier.create(service.createSession("u1", "Q", null, "http://exa mple.com"))
                    .expectErrorMessage("Invalid live URL")
                    .verify();
        }

        @Test
        @DisplayName("should require a ready artifact owned by the user")
        void artifactChecks() {
            artifact("art-ready", "u1", ArtifactStatus.READY);
            artifact("art-busy", "u1", ArtifactStatus.PROCESSING);

            StepVerifier.create(service.createSession("u1", "Q", "art-ready", null))
                    .assertNext(session -> assertThat(session.getArtifactId()).isEqualTo("art-ready"))
                    .verifyComplete();
            StepVerifier.create(service.createSession("u1", "Q", "art-busy", null))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(DependencyNotReadyException.class)
                            .hasMessage("Artifact art-busy is not ready"))
                    .verify();
            StepVerifier.create(service.createSession("u2", "Q", "art-ready", null))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("should list sessions with their consensus pointer")
        void listsWithConsensus() {
            String id = service.createSession("u1", "Q", null, null).block().getId();
            repository.upsertConsensus(Consensus.builder().sessionId(id).finalMessageId(9L).build()).block();
            service.createSession("u2", "Other", null, null).block();

            StepVerifier.create(service.listSessions("u1"))
                    .assertNext(summary -> {
                        assertThat(summary.getId()).isEqualTo(id);
                        assertThat(summary.getFinalMessageId()).isEqualTo(9L);
                    })
                    .verifyComplete();
            StepVerifier.create(service.listSessions(""))
                    .expectError(InvalidRequestException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report unknown sessions")
        void unknownSession() {
            StepVerifier.create(service.getSession("missing"))
                    .expectErrorMessage("Session not found: missing")
                    .verify();
        }
    }
}
