package com.z254.magi.artifact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A slice of one file of an artifact, ordered by chunk index within the file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeChunk {

    private long id;

    private String artifactId;

    private String filePath;

    /**
     * Zero-based position within the file.
     */
    private int chunkIndex;

    private String language;

    private String content;

    /**
     * Stored token estimate, null when not computed.
     */
    private Integer tokenEstimate;
}
