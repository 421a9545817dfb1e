package com.z254.magi.artifact.impl;

import com.z254.magi.artifact.ChunkStore;
import com.z254.magi.artifact.CodeArtifact;
import com.z254.magi.artifact.CodeChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link ChunkStore}. Bundles are registered already processed; extraction is
 * handled elsewhere.
 */
@Slf4j
@Repository
public class InMemoryChunkStore implements ChunkStore {

    private final Map<String, CodeArtifact> artifacts = new ConcurrentHashMap<>();
    private final Map<String, List<CodeChunk>> chunks = new ConcurrentHashMap<>();
    private final AtomicLong chunkIds = new AtomicLong();

    /**
     * Register an artifact and replace its chunks. Chunk ids are assigned here.
     */
    public CodeArtifact register(CodeArtifact artifact, List<CodeChunk> artifactChunks) {
        if (artifact.getCreatedAt() == null) {
            artifact.setCreatedAt(Instant.now());
        }
        artifacts.put(artifact.getId(), artifact);
        List<CodeChunk> stored = artifactChunks.stream()
                .map(chunk -> CodeChunk.builder()
                        .id(chunkIds.incrementAndGet())
                        .artifactId(artifact.getId())
                        .filePath(chunk.getFilePath())
                        .chunkIndex(chunk.getChunkIndex())
                        .language(chunk.getLanguage())
                        .content(chunk.getContent())
                        .tokenEstimate(chunk.getTokenEstimate())
                        .build())
                .toList();
        chunks.put(artifact.getId(), stored);
        log.debug("Registered artifact {} with {} chunks", artifact.getId(), stored.size());
        return artifact;
    }

    @Override
    public Mono<CodeArtifact> getArtifactById(String artifactId) {
        return Mono.justOrEmpty(artifactId == null ? null : artifacts.get(artifactId));
    }

    @Override
    public Flux<CodeChunk> listArtifactChunks(String artifactId, int limit, Collection<String> languages) {
        List<CodeChunk> stored = artifactId == null ? null : chunks.get(artifactId);
        if (stored == null) {
            return Flux.empty();
        }
        boolean filtered = languages != null && !languages.isEmpty();
        return Flux.fromStream(stored.stream()
                .filter(chunk -> !filtered || languages.contains(chunk.getLanguage()))
                .sorted(Comparator.comparingInt(CodeChunk::getChunkIndex))
                .limit(Math.max(0, limit)));
    }
}
