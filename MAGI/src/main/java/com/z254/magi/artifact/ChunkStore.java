package com.z254.magi.artifact;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Lookup interface over processed code bundles.
 */
public interface ChunkStore {

    /**
     * Find an artifact by id.
     *
     * @param artifactId the artifact id
     * @return the artifact, or empty
     */
    Mono<CodeArtifact> getArtifactById(String artifactId);

    /**
     * List chunks of an artifact ordered by ascending chunk index.
     *
     * @param artifactId the artifact id
     * @param limit maximum number of chunks
     * @param languages language filter, null or empty for all languages
     * @return at most {@code limit} chunks
     */
    Flux<CodeChunk> listArtifactChunks(String artifactId, int limit, Collection<String> languages);

    default Flux<CodeChunk> listArtifactChunks(String artifactId, int limit) {
        return listArtifactChunks(artifactId, limit, null);
    }
}
