package com.z254.magi.service;

import com.z254.magi.api.dto.SessionSummary;
import com.z254.magi.artifact.ChunkStore;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.MessageRole;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionSnapshot;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.repository.SessionRepository;
import com.z254.magi.exception.DependencyNotReadyException;
import com.z254.magi.exception.InvalidRequestException;
import com.z254.magi.exception.ResourceNotFoundException;
import com.z254.magi.live.LiveUrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Session lifecycle outside the workflow steps: creation, listing and reads.
 */
@Slf4j
@Service
public class SessionService {

    private final SessionRepository sessionRepository;
    private final ChunkStore chunkStore;

    public SessionService(SessionRepository sessionRepository, ChunkStore chunkStore) {
        this.sessionRepository = sessionRepository;
        this.chunkStore = chunkStore;
    }

    /**
     * Create a session, record the question as the first transcript message and mark it running.
     *
     * @return the created session
     */
    public Mono<Session> createSession(String userId, String question, String artifactId, String liveUrl) {
        if (isBlank(userId) || isBlank(question)) {
            return Mono.error(new InvalidRequestException("userId and question are required"));
        }
        String normalizedUrl = null;
        if (!isBlank(liveUrl)) {
            normalizedUrl = LiveUrlNormalizer.normalize(liveUrl).orElse(null);
            if (normalizedUrl == null) {
                return Mono.error(new InvalidRequestException("Invalid live URL"));
            }
        }
        String attached = isBlank(artifactId) ? null : artifactId.trim();
        String url = normalizedUrl;

        Mono<Void> artifactCheck = attached == null ? Mono.empty() : requireReadyArtifact(attached, userId).then();
        return artifactCheck
                .then(Mono.defer(() -> sessionRepository.createSession(Session.builder()
                        .userId(userId)
                        .question(question.trim())
                        .artifactId(attached)
                        .liveUrl(url)
                        .status(SessionStatus.PENDING)
                        .build())))
                .flatMap(session -> sessionRepository.addMessage(Message.builder()
                                .sessionId(session.getId())
                                .role(MessageRole.USER)
                                .content(session.getQuestion())
                                .build())
                        .then(sessionRepository.setSessionStatus(session.getId(), SessionStatus.RUNNING, null)))
                .doOnNext(session -> log.info("Created session {} for user {} (artifact={}, liveUrl={})",
                        session.getId(), userId, attached, url));
    }

    /**
     * Sessions of a user, newest first, with their consensus pointers.
     */
    public Flux<SessionSummary> listSessions(String userId) {
        if (isBlank(userId)) {
            return Flux.error(new InvalidRequestException("userId is required"));
        }
        return sessionRepository.listSessionsForUser(userId)
                .concatMap(session -> sessionRepository.findConsensus(session.getId())
                        .map(consensus -> SessionSummary.of(session, consensus))
                        .defaultIfEmpty(SessionSummary.of(session, null)));
    }

    public Mono<SessionSnapshot> getSession(String sessionId) {
        return sessionRepository.getSessionFull(sessionId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException.session(sessionId)));
    }

    /**
     * An artifact visible to the user; other owners' artifacts read as missing.
     */
    public Mono<CodeArtifact> getArtifact(String artifactId, String userId) {
        if (isBlank(userId)) {
            return Mono.error(new InvalidRequestException("userId is required"));
        }
        return chunkStore.getArtifactById(artifactId)
                .filter(artifact -> Objects.equals(artifact.getUserId(), userId))
                .switchIfEmpty(Mono.error(ResourceNotFoundException.artifact(artifactId)));
    }

    private Mono<CodeArtifact> requireReadyArtifact(String artifactId, String userId) {
        return getArtifact(artifactId, userId)
                .flatMap(artifact -> artifact.isReady()
                        ? Mono.just(artifact)
                        : Mono.error(new DependencyNotReadyException("Artifact " + artifactId + " is not ready")));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
