package com.z254.magi.context;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.live.LiveSiteContextBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Combines repository context and the live-site snapshot under one character budget.
 */
@Slf4j
@Component
public class ContextAssembler {

    static final String ELLIPSIS = "…";

    private final ArtifactContextBuilder artifactContextBuilder;
    private final LiveSiteContextBuilder liveSiteContextBuilder;
    private final MagiProperties.ContextProperties config;

    public ContextAssembler(ArtifactContextBuilder artifactContextBuilder,
                            LiveSiteContextBuilder liveSiteContextBuilder,
                            MagiProperties properties) {
        this.artifactContextBuilder = artifactContextBuilder;
        this.liveSiteContextBuilder = liveSiteContextBuilder;
        this.config = properties.getContext();
    }

    /**
     * Assemble context for a session.
     *
     * @param artifactId attached artifact, may be null
     * @param liveUrl attached live URL, may be null
     * @param question the session question
     * @return the assembled context, never empty
     */
    public Mono<AssembledContext> assemble(String artifactId, String liveUrl, String question) {
        int budget = config.getCharBudget();
        Mono<ArtifactContext> artifact = isBlank(artifactId)
                ? Mono.just(new ArtifactContext("", 0, 0, 0, false))
                : artifactContextBuilder.build(artifactId, question, budget)
                        .defaultIfEmpty(new ArtifactContext("", 0, 0, 0, false));
        Mono<String> live = isBlank(liveUrl)
                ? Mono.just("")
                : liveSiteContextBuilder.buildLiveUrlContext(liveUrl).defaultIfEmpty("");

        return Mono.zip(artifact, live)
                .map(both -> rebalance(both.getT1(), both.getT2(), budget))
                .doOnNext(context -> log.debug(
                        "Assembled context: artifact={} chars, live={} chars, budget={}, trimmed={}/{}",
                        context.getArtifactText().length(), context.getLiveText().length(), budget,
                        context.isArtifactTrimmed(), context.isLiveTrimmed()));
    }

    AssembledContext rebalance(ArtifactContext artifact, String liveText, int budget) {
        String artifactText = artifact.text() == null ? "" : artifact.text();
        String live = liveText == null ? "" : liveText;
        String trimmedArtifact = artifactText;
        String trimmedLive = live;

        if (!artifactText.isEmpty() && !live.isEmpty()) {
            if (artifactText.length() + live.length() > budget) {
                int artifactShare = Math.max(config.getArtifactFloor(),
                        (int) Math.round(config.getArtifactShare() * budget));
                int liveShare = Math.max(config.getLiveFloor(), budget - artifactShare);
                if (artifactShare + liveShare > budget) {
                    artifactShare = (int) Math.round(config.getArtifactShare() * budget);
                    liveShare = budget - artifactShare;
                }
                trimmedArtifact = trim(artifactText, artifactShare);
                trimmedLive = trim(live, liveShare);
            }
        } else if (!artifactText.isEmpty()) {
            trimmedArtifact = trim(artifactText, budget);
        } else if (!live.isEmpty()) {
            trimmedLive = trim(live, budget);
        }

        return AssembledContext.builder()
                .artifactText(trimmedArtifact)
                .liveText(trimmedLive)
                .approxTokens(artifact.approxTokens() + ChunkRanker.estimateTokens(trimmedLive))
                .chunkCount(artifact.chunkCount())
                .fileCount(artifact.fileCount())
                .artifactTruncated(artifact.truncated())
                .artifactTrimmed(!trimmedArtifact.equals(artifactText))
                .liveTrimmed(!trimmedLive.equals(live))
                .build();
    }

    static String trim(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        if (limit <= 0) {
            return "";
        }
        return text.substring(0, limit - 1) + ELLIPSIS;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
