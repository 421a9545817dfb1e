package com.z254.magi.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.diagnostics.StepDiagnostics;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Consensus;
import com.z254.magi.domain.model.Message;
import com.z254.magi.domain.model.Session;
import com.z254.magi.domain.model.SessionSnapshot;
import com.z254.magi.domain.model.Vote;

import java.util.List;

/**
 * Response envelopes. Every body carries {@code ok}.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public record SessionCreated(boolean ok, String sessionId) {
        public SessionCreated(String sessionId) {
            this(true, sessionId);
        }
    }

    public record SessionList(boolean ok, List<SessionSummary> sessions) {
        public SessionList(List<SessionSummary> sessions) {
            this(true, sessions);
        }
    }

    public record SessionDetail(boolean ok, Session session, List<Message> messages, List<Vote> votes,
                                Consensus consensus, List<Agent> agents) {
        public static SessionDetail of(SessionSnapshot snapshot) {
            return new SessionDetail(true, snapshot.getSession(), snapshot.getMessages(), snapshot.getVotes(),
                    snapshot.getConsensus(), snapshot.getAgents());
        }
    }

    public record ArtifactDetail(boolean ok, CodeArtifact artifact) {
        public ArtifactDetail(CodeArtifact artifact) {
            this(true, artifact);
        }
    }

    public record Ping(boolean ok) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failure(boolean ok, String error, StepDiagnostics diagnostics) {
        public Failure(String error) {
            this(false, error, null);
        }

        public Failure(String error, StepDiagnostics diagnostics) {
            this(false, error, diagnostics);
        }
    }
}
