package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Fully materialized session read: the session with its transcript, votes, consensus and
 * the agent roster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshot {

    private Session session;

    @Builder.Default
    private List<Message> messages = List.of();

    @Builder.Default
    private List<Vote> votes = List.of();

    private Consensus consensus;

    @Builder.Default
    private List<Agent> agents = List.of();

    public List<Message> messagesWithRole(MessageRole role) {
        return messages.stream()
                .filter(m -> m.hasRole(role))
                .toList();
    }

    public Optional<Message> findMessage(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return messages.stream()
                .filter(m -> id.equals(m.getId()))
                .findFirst();
    }

    /**
     * The user's question as stored in the transcript, falling back to the session record.
     */
    public String question() {
        return messages.stream()
                .filter(m -> m.hasRole(MessageRole.USER))
                .map(Message::getContent)
                .findFirst()
                .orElse(session != null && session.getQuestion() != null ? session.getQuestion() : "");
    }
}
