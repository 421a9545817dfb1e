package com.z254.magi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One of the three deliberating agents.
 * Seeded once per slug and never modified afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    /**
     * Unique identifier for this agent.
     */
    private String id;

    /**
     * Stable slug: casper, balthasar or melchior.
     */
    private String slug;

    /**
     * Display name, e.g. CASPER.
     */
    private String name;

    /**
     * Provider backing this agent.
     */
    private ProviderType provider;

    /**
     * Requested model identifier. Blank means the provider default.
     */
    private String model;

    /**
     * UI color hint.
     */
    private String color;

    private Instant createdAt;
}
