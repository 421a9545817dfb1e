package com.z254.magi.artifact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An uploaded code bundle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeArtifact {

    private String id;

    private String userId;

    private String originalFilename;

    private long byteLength;

    private ArtifactStatus status;

    private Instant readyAt;

    /**
     * Present once processing completed.
     */
    private ArtifactManifest manifest;

    private Instant createdAt;

    public boolean isReady() {
        return status == ArtifactStatus.READY;
    }
}
