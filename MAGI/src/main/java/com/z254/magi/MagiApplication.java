package com.z254.magi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MAGI - three-agent deliberation engine.
 *
 * <p>MAGI provides:
 * <ul>
 *   <li>Workflow Engine - propose, vote and consensus steps over a session</li>
 *   <li>Provider Client - one call contract over OpenAI, Anthropic and xAI chat APIs,
 *       including the HTTP-relay tool loop</li>
 *   <li>Vote Scoring - JSON extraction from free-form model output with heuristic fallback</li>
 *   <li>Context Assembly - ranked code chunks and a live-site snapshot under a character budget</li>
 *   <li>Diagnostics - per-step report of proposals, votes and fallbacks</li>
 * </ul>
 *
 * <p>The agents:
 * <ul>
 *   <li>CASPER - OpenAI</li>
 *   <li>BALTHASAR - Anthropic</li>
 *   <li>MELCHIOR - xAI Grok</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MagiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MagiApplication.class, args);
    }
}
