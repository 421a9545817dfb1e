package com.z254.magi.domain.repository;

import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionSnapshot;
import com.z254.magi.domain.model.SessionStatus;
import com.z254.magi.domain.model.Vote;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for sessions and everything recorded against them.
 * Implementations assign ids and timestamps and report failures as
 * {@link com.z254.magi.exception.StorageException}.
 */
public interface SessionRepository {

    /**
     * Create a session.
     *
     * @param session the session to create, id left blank
     * @return the stored session with id and timestamps
     */
    Mono<Session> createSession(Session session);

    /**
     * Append a message to a session transcript.
     *
     * @param message the message, id left blank
     * @return the stored message with its id
     */
    Mono<Message> addMessage(Message message);

    /**
     * Record a vote.
     *
     * @param vote the vote, id left blank
     * @return the stored vote
     */
    Mono<Vote> addVote(Vote vote);

    /**
     * Update the advisory session status.
     *
     * @param sessionId the session id
     * @param status the new status
     * @param error failure reason, or null to clear it
     * @return the updated session
     */
    Mono<Session> setSessionStatus(String sessionId, SessionStatus status, String error);

    /**
     * Insert or replace the consensus record of a session.
     *
     * @param consensus the consensus record
     * @return the stored record
     */
    Mono<Consensus> upsertConsensus(Consensus consensus);

    /**
     * Read a session with its transcript, votes, consensus and the agent roster.
     *
     * @param sessionId the session id
     * @return the snapshot, or empty when the session does not exist
     */
    Mono<SessionSnapshot> getSessionFull(String sessionId);

    /**
     * List agents, seeding any missing defaults first.
     *
     * @return agents ordered by slug
     */
    Flux<Agent> listAgents();

    /**
     * List a user's sessions, newest first.
     *
     * @param userId the owning user
     * @return sessions for the user
     */
    Flux<Session> listSessionsForUser(String userId);

    /**
     * Find the consensus record of a session.
     *
     * @param sessionId the session id
     * @return the consensus, or empty
     */
    Mono<Consensus> findConsensus(String sessionId);
}
