package com.z254.magi.context;

import com.z254.magi.artifact.ArtifactManifest;
import com.z254.magi.artifact.ChunkStore;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.artifact.CodeChunk;
import com.z254.magi.config.MagiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders an artifact's manifest summary and its best-ranked chunks into prompt text.
 */
@Slf4j
@Component
public class ArtifactContextBuilder {

    static final List<String> PRIORITY_LANGUAGES = List.of("html", "php");
    private static final int SUMMARY_ENTRIES = 5;

    private final ChunkStore chunkStore;
    private final MagiProperties.ContextProperties config;
    private final ChunkRanker ranker;

    public ArtifactContextBuilder(ChunkStore chunkStore, MagiProperties properties) {
        this.chunkStore = chunkStore;
        this.config = properties.getContext();
        this.ranker = new ChunkRanker(config.getMaxChunks());
    }

    /**
     * Build the context text for an artifact.
     *
     * @param artifactId the artifact id
     * @param question the session question, used for keyword boosts
     * @param maxChars character budget
     * @return the context, or empty when the artifact or its manifest is missing
     */
    public Mono<ArtifactContext> build(String artifactId, String question, int maxChars) {
        return chunkStore.getArtifactById(artifactId)
                .filter(artifact -> artifact.getManifest() != null)
                .flatMap(artifact -> loadCandidates(artifactId)
                        .map(chunks -> render(artifact, chunks, question, maxChars)));
    }

    private Mono<List<CodeChunk>> loadCandidates(String artifactId) {
        Mono<List<CodeChunk>> priority = chunkStore
                .listArtifactChunks(artifactId, config.getPriorityChunkLimit(), PRIORITY_LANGUAGES)
                .collectList();
        Mono<List<CodeChunk>> general = chunkStore
                .listArtifactChunks(artifactId, config.getGeneralChunkLimit())
                .collectList();
        return Mono.zip(priority, general).map(both -> {
            Set<Long> seen = new HashSet<>();
            List<CodeChunk> combined = new ArrayList<>();
            Stream.concat(both.getT1().stream(), both.getT2().stream())
                    .filter(chunk -> seen.add(chunk.getId()))
                    .forEach(combined::add);
            return combined;
        });
    }

    ArtifactContext render(CodeArtifact artifact, List<CodeChunk> chunks, String question, int maxChars) {
        String manifestText = String.join("\n", manifestSummaryLines(artifact));
        if (chunks.isEmpty()) {
            return new ArtifactContext(manifestText, 0, 0, 0, false);
        }
        ChunkRanker.ChunkSelection selection = ranker.select(
                chunks, artifact.getManifest(), question, maxChars, manifestText.length());
        String chunkSection = String.join("\n\n", selection.snippets());
        String text = Stream.of(manifestText, chunkSection)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("\n\n"));
        log.debug("Artifact {} context: {} chunks from {} files, truncated={}",
                artifact.getId(), selection.chunkCount(), selection.fileCount(), selection.truncated());
        return new ArtifactContext(text, selection.approxTokens(), selection.chunkCount(),
                selection.fileCount(), selection.truncated());
    }

    static List<String> manifestSummaryLines(CodeArtifact artifact) {
        ArtifactManifest manifest = artifact.getManifest();
        List<String> lines = new ArrayList<>();
        lines.add("Uploaded bundle: " + artifact.getOriginalFilename());
        if (manifest.getTotalFiles() != null) {
            int processed = manifest.getProcessedFiles() != null ? manifest.getProcessedFiles() : manifest.getTotalFiles();
            int skipped = manifest.getSkippedFiles() != null ? manifest.getSkippedFiles() : 0;
            lines.add("Files processed: " + processed + " (skipped " + skipped + ")");
        }
        if (manifest.getLanguages() != null && !manifest.getLanguages().isEmpty()) {
            String languages = manifest.getLanguages().entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                    .limit(SUMMARY_ENTRIES)
                    .map(entry -> entry.getKey() + "(" + entry.getValue() + ")")
                    .collect(Collectors.joining(", "));
            lines.add("Languages: " + languages);
        }
        if (manifest.getTopFiles() != null && !manifest.getTopFiles().isEmpty()) {
            String files = manifest.getTopFiles().stream()
                    .limit(SUMMARY_ENTRIES)
                    .map(file -> file.getPath() + " (" + (file.getLanguage() != null ? file.getLanguage() : "text") + ")")
                    .collect(Collectors.joining("; "));
            lines.add("Key files: " + files);
        }
        return lines;
    }
}
