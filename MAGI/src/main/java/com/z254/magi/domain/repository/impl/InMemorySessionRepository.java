package com.z254.magi.domain.repository.impl;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionSnapshot;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.model.Vote;
import com.z254.magi.domain.repository.SessionRepository;
import com.z254.magi.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link SessionRepository} implementation for local development and tests.
 */
@Slf4j
@Repository
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<Message>> messages = new ConcurrentHashMap<>();
    private final Map<String, List<Vote>> votes = new ConcurrentHashMap<>();
    private final Map<String, Consensus> consensus = new ConcurrentHashMap<>();
    private final Map<String, Agent> agentsBySlug = new ConcurrentHashMap<>();
    private final AtomicLong messageIds = new AtomicLong();
    private final AtomicLong voteIds = new AtomicLong();
    private final MagiProperties properties;

    public InMemorySessionRepository(MagiProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<Session> createSession(Session session) {
        Instant now = Instant.now();
        Session stored = session.toBuilder()
                .id(UUID.randomUUID().toString())
                .status(session.getStatus() != null ? session.getStatus() : SessionStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessions.put(stored.getId(), stored);
        messages.put(stored.getId(), new CopyOnWriteArrayList<>());
        votes.put(stored.getId(), new CopyOnWriteArrayList<>());
        return Mono.just(stored);
    }

    @Override
    public Mono<Message> addMessage(Message message) {
        return Mono.fromCallable(() -> {
            List<Message> transcript = requireList(messages, message.getSessionId());
            // id assignment and append happen together so ids stay ordered in the transcript
            synchronized (transcript) {
                Message stored = message.toBuilder()
                        .id(messageIds.incrementAndGet())
                        .meta(message.getMeta() != null ? new HashMap<>(message.getMeta()) : new HashMap<>())
                        .createdAt(Instant.now())
                        .build();
                transcript.add(stored);
                return stored;
            }
        });
    }

    @Override
    public Mono<Vote> addVote(Vote vote) {
        return Mono.fromCallable(() -> {
            List<Vote> sessionVotes = requireList(votes, vote.getSessionId());
            Vote stored = Vote.builder()
                    .id(voteIds.incrementAndGet())
                    .sessionId(vote.getSessionId())
                    .agentId(vote.getAgentId())
                    .targetMessageId(vote.getTargetMessageId())
                    .score(vote.getScore())
                    .rationale(vote.getRationale())
                    .createdAt(Instant.now())
                    .build();
            sessionVotes.add(stored);
            return stored;
        });
    }

    @Override
    public Mono<Session> setSessionStatus(String sessionId, SessionStatus status, String error) {
        return Mono.fromCallable(() -> {
            Session updated = sessions.computeIfPresent(sessionId, (id, current) -> current.toBuilder()
                    .status(status)
                    .error(error)
                    .updatedAt(Instant.now())
                    .build());
            if (updated == null) {
                throw new StorageException("Session not found: " + sessionId);
            }
            return updated;
        });
    }

    @Override
    public Mono<Consensus> upsertConsensus(Consensus record) {
        return Mono.fromCallable(() -> {
            if (!sessions.containsKey(record.getSessionId())) {
                throw new StorageException("Session not found: " + record.getSessionId());
            }
            Consensus stored = Consensus.builder()
                    .sessionId(record.getSessionId())
                    .finalMessageId(record.getFinalMessageId())
                    .summary(record.getSummary())
                    .createdAt(Instant.now())
                    .build();
            consensus.put(stored.getSessionId(), stored);
            return stored;
        });
    }

    @Override
    public Mono<SessionSnapshot> getSessionFull(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Mono.empty();
        }
        return listAgents().collectList()
                .map(agents -> SessionSnapshot.builder()
                        .session(session)
                        .messages(List.copyOf(messages.getOrDefault(sessionId, List.of())))
                        .votes(List.copyOf(votes.getOrDefault(sessionId, List.of())))
                        .consensus(consensus.get(sessionId))
                        .agents(agents)
                        .build());
    }

    @Override
    public Flux<Agent> listAgents() {
        for (MagiProperties.AgentSeed seed : properties.getAgents()) {
            agentsBySlug.computeIfAbsent(seed.getSlug(), slug -> {
                log.debug("Seeding agent {}", slug);
                return Agent.builder()
                        .id(UUID.randomUUID().toString())
                        .slug(slug)
                        .name(seed.getName())
                        .provider(seed.getProvider())
                        .model(seed.getModel())
                        .color(seed.getColor())
                        .createdAt(Instant.now())
                        .build();
            });
        }
        List<Agent> ordered = new ArrayList<>(agentsBySlug.values());
        ordered.sort(Comparator.comparing(Agent::getSlug));
        return Flux.fromIterable(ordered);
    }

    @Override
    public Flux<Session> listSessionsForUser(String userId) {
        return Flux.fromStream(sessions.values().stream()
                .filter(session -> Objects.equals(session.getUserId(), userId))
                .sorted(Comparator.comparing(Session::getCreatedAt).reversed()));
    }

    @Override
    public Mono<Consensus> findConsensus(String sessionId) {
        return Mono.justOrEmpty(consensus.get(sessionId));
    }

    private static <T> List<T> requireList(Map<String, List<T>> store, String sessionId) {
        List<T> list = sessionId == null ? null : store.get(sessionId);
        if (list == null) {
            throw new StorageException("Session not found: " + sessionId);
        }
        return list;
    }
}
