package com.z254.magi.artifact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary written when a bundle finished processing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactManifest {

    /**
     * Entries in the archive, or null when unknown.
     */
    private Integer totalFiles;

    private Integer processedFiles;

    private Integer skippedFiles;

    /**
     * Processed file count per detected language.
     */
    @Builder.Default
    private Map<String, Integer> languages = new LinkedHashMap<>();

    /**
     * Largest files first.
     */
    @Builder.Default
    private List<TopFile> topFiles = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopFile {
        private String path;
        private String language;
        private long bytes;
        private int chunks;
    }
}
