package com.z254.magi.context;

import com.z254.magi.config.MagiProperties;
import com.z254.magi.live.LiveSiteContextBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ContextAssembler}.
 */
@ExtendWith(MockitoExtension.class)
class ContextAssemblerTest {

    @Mock
    private ArtifactContextBuilder artifactContextBuilder;

    @Mock
    private LiveSiteContextBuilder liveSiteContextBuilder;

    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ContextAssembler(artifactContextBuilder, liveSiteContextBuilder, new MagiProperties());
    }

    private static ArtifactContext artifactOf(int length) {
        return new ArtifactContext("a".repeat(length), 100, 7, 3, false);
    }

    @Nested
    @DisplayName("Sources")
    class SourceTests {

        @Test
        @DisplayName("should skip both sources when nothing is attached")
        void nothingAttached() {
            StepVerifier.create(assembler.assemble(null, " ", "q"))
                    .assertNext(context -> {
                        assertThat(context.hasArtifact()).isFalse();
                        assertThat(context.hasLive()).isFalse();
                        assertThat(context.getApproxTokens()).isZero();
                    })
                    .verifyComplete();

            verify(artifactContextBuilder, never()).build(anyString(), anyString(), anyInt());
            verify(liveSiteContextBuilder, never()).buildLiveUrlContext(anyString());
        }

        @Test
        @DisplayName("should treat an empty artifact build as no artifact")
        void emptyArtifact() {
            when(artifactContextBuilder.build(eq("art-1"), anyString(), anyInt())).thenReturn(Mono.empty());

            StepVerifier.create(assembler.assemble("art-1", null, "q"))
                    .assertNext(context -> assertThat(context.hasArtifact()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should add the live estimate to the artifact tokens")
        void combinesTokens() {
            when(artifactContextBuilder.build(eq("art-1"), anyString(), anyInt())).thenReturn(Mono.just(artifactOf(1000)));
            when(liveSiteContextBuilder.buildLiveUrlContext("https://example.com/"))
                    .thenReturn(Mono.just("l".repeat(401)));

            StepVerifier.create(assembler.assemble("art-1", "https://example.com/", "q"))
                    .assertNext(context -> {
                        assertThat(context.getApproxTokens()).isEqualTo(201);
                        assertThat(context.getChunkCount()).isEqualTo(7);
                        assertThat(context.getFileCount()).isEqualTo(3);
                        assertThat(context.length()).isEqualTo(1401);
                        assertThat(context.isArtifactTrimmed()).isFalse();
                        assertThat(context.isLiveTrimmed()).isFalse();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Budget")
    class BudgetTests {

        @Test
        @DisplayName("should split an over-budget pair by share and floors")
        void splitsOverBudget() {
            AssembledContext context = assembler.rebalance(artifactOf(20_000), "l".repeat(12_000), 26_000);

            assertThat(context.getArtifactText()).hasSize(16_900).endsWith("…");
            assertThat(context.getLiveText()).hasSize(9_100).endsWith("…");
            assertThat(context.isArtifactTrimmed()).isTrue();
            assertThat(context.isLiveTrimmed()).isTrue();
            assertThat(context.length()).isLessThanOrEqualTo(26_000);
        }

        @Test
        @DisplayName("should leave a pair within budget untouched")
        void withinBudget() {
            AssembledContext context = assembler.rebalance(artifactOf(10_000), "l".repeat(10_000), 26_000);

            assertThat(context.length()).isEqualTo(20_000);
            assertThat(context.isArtifactTrimmed()).isFalse();
        }

        @Test
        @DisplayName("should fall back to the plain share when floors exceed a small budget")
        void smallBudget() {
            AssembledContext context = assembler.rebalance(artifactOf(10_000), "l".repeat(10_000), 10_000);

            assertThat(context.getArtifactText()).hasSize(6_500);
            assertThat(context.getLiveText()).hasSize(3_500);
        }

        @Test
        @DisplayName("should give a lone source the whole budget")
        void loneSource() {
            AssembledContext artifactOnly = assembler.rebalance(artifactOf(30_000), "", 26_000);
            AssembledContext liveOnly = assembler.rebalance(new ArtifactContext("", 0, 0, 0, false),
                    "l".repeat(30_000), 26_000);

            assertThat(artifactOnly.getArtifactText()).hasSize(26_000);
            assertThat(liveOnly.getLiveText()).hasSize(26_000);
            assertThat(liveOnly.isLiveTrimmed()).isTrue();
        }

        @Test
        @DisplayName("should trim with a trailing ellipsis")
        void trims() {
            assertThat(ContextAssembler.trim("abcdef", 4)).isEqualTo("abc…");
            assertThat(ContextAssembler.trim("abc", 4)).isEqualTo("abc");
            assertThat(ContextAssembler.trim("abc", 0)).isEmpty();
        }
    }
}
