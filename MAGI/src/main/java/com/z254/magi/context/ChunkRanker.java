package com.z254.magi.context;

import com.z254.magi.artifact.ArtifactManifest;
import com.z254.magi.artifact.CodeChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores code chunks against the manifest and question, then selects greedily under a
 * character budget and a chunk ceiling.
 */
public class ChunkRanker {

    static final List<String> PRIORITY_SUFFIXES = List.of(".html", ".htm", ".php", ".phtml", ".blade.php", ".ctp");
    static final int SEPARATOR_CHARS = 4;
    static final int SECTION_SEPARATOR_CHARS = "\n\n".length();

    private static final Pattern KEYWORD = Pattern.compile("[a-z0-9_]{4,}");
    private static final Pattern TEST_PATH = Pattern.compile("test|spec|fixture|mock|story", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOC_PATH = Pattern.compile("readme|docs|changelog", Pattern.CASE_INSENSITIVE);
    private static final int MAX_KEYWORDS = 32;
    private static final int TOP_LANGUAGES = 4;
    private static final int PER_FILE_CEILING = 12;

    private final int maxChunks;

    public ChunkRanker(int maxChunks) {
        this.maxChunks = maxChunks;
    }

    /**
     * Rank and select chunks.
     *
     * @param chunks de-duplicated candidates
     * @param manifest artifact manifest, may be null
     * @param question the session question, may be null
     * @param maxChars character budget shared with already-written text
     * @param initialChars characters already spent (manifest summary); when positive, the
     *        blank line between it and the chunks is charged as well
     */
    public ChunkSelection select(List<CodeChunk> chunks, ArtifactManifest manifest, String question,
                                 int maxChars, int initialChars) {
        if (chunks.isEmpty()) {
            return new ChunkSelection(List.of(), 0, 0, 0, false, 0);
        }
        Set<String> topFiles = topFiles(manifest);
        Set<String> topLanguages = topLanguages(manifest);
        List<String> keywords = extractKeywords(question);

        List<Candidate> candidates = chunks.stream()
                .map(chunk -> score(chunk, topFiles, topLanguages, keywords))
                .sorted(Comparator.comparingInt(Candidate::score).reversed()
                        .thenComparingInt(c -> c.chunk().getChunkIndex()))
                .toList();

        Map<String, Integer> perFile = new HashMap<>();
        Set<String> selectedFiles = new HashSet<>();
        List<String> snippets = new ArrayList<>();
        int totalChars = initialChars > 0 ? initialChars + SECTION_SEPARATOR_CHARS : 0;
        int approxTokens = 0;
        boolean truncated = false;

        for (Candidate candidate : candidates) {
            if (snippets.size() >= maxChunks) {
                truncated = true;
                break;
            }
            CodeChunk chunk = candidate.chunk();
            String lowerPath = chunk.getFilePath().toLowerCase(Locale.ROOT);
            int used = perFile.getOrDefault(lowerPath, 0);
            if (used >= candidate.perFileLimit()) {
                truncated = true;
                continue;
            }
            String body = chunk.getContent() == null ? "" : chunk.getContent().trim();
            if (body.isEmpty()) {
                continue;
            }
            String snippet = "File: " + chunk.getFilePath() + " [chunk " + (chunk.getChunkIndex() + 1) + "]\n" + body;
            if (totalChars + snippet.length() > maxChars) {
                truncated = true;
                break;
            }
            snippets.add(snippet);
            perFile.put(lowerPath, used + 1);
            totalChars += snippet.length() + SEPARATOR_CHARS;
            approxTokens += chunk.getTokenEstimate() != null
                    ? chunk.getTokenEstimate()
                    : estimateTokens(chunk.getContent());
            selectedFiles.add(lowerPath);
        }
        return new ChunkSelection(List.copyOf(snippets), approxTokens, snippets.size(),
                selectedFiles.size(), truncated, candidates.size());
    }

    Candidate score(CodeChunk chunk, Set<String> topFiles, Set<String> topLanguages, List<String> keywords) {
        String lowerPath = chunk.getFilePath().toLowerCase(Locale.ROOT);
        boolean keywordHit = keywords.stream().anyMatch(lowerPath::contains);
        boolean priority = isPriorityPath(lowerPath);
        boolean topFile = topFiles.contains(lowerPath);
        boolean languageBoost = chunk.getLanguage() != null && topLanguages.contains(chunk.getLanguage());

        int score = 1;
        if (priority) score += 4;
        if (topFile) score += 3;
        if (languageBoost) score += 2;
        if (keywordHit) score += 3;
        if (chunk.getChunkIndex() == 0) {
            score += 2;
        } else if (chunk.getChunkIndex() <= 2) {
            score += 1;
        }
        if (TEST_PATH.matcher(lowerPath).find()) score -= 2;
        if (DOC_PATH.matcher(lowerPath).find()) score -= 1;

        int limit = Math.min(PER_FILE_CEILING,
                (priority ? 6 : 3) + (keywordHit ? 3 : 0) + (topFile ? 2 : 0));
        return new Candidate(chunk, score, limit);
    }

    static boolean isPriorityPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return PRIORITY_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    static List<String> extractKeywords(String question) {
        if (question == null || question.isBlank()) {
            return List.of();
        }
        Matcher matcher = KEYWORD.matcher(question.toLowerCase(Locale.ROOT));
        Set<String> unique = new LinkedHashSet<>();
        while (matcher.find() && unique.size() < MAX_KEYWORDS) {
            unique.add(matcher.group());
        }
        return List.copyOf(unique);
    }

    static int estimateTokens(String text) {
        return text == null ? 0 : (int) Math.ceil(text.length() / 4.0);
    }

    private static Set<String> topFiles(ArtifactManifest manifest) {
        if (manifest == null || manifest.getTopFiles() == null) {
            return Set.of();
        }
        return manifest.getTopFiles().stream()
                .map(ArtifactManifest.TopFile::getPath)
                .filter(path -> path != null && !path.isEmpty())
                .map(path -> path.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static Set<String> topLanguages(ArtifactManifest manifest) {
        if (manifest == null || manifest.getLanguages() == null) {
            return Set.of();
        }
        return manifest.getLanguages().entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_LANGUAGES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    record Candidate(CodeChunk chunk, int score, int perFileLimit) {
    }

    /**
     * Outcome of a selection pass.
     *
     * @param snippets formatted snippets in selection order
     * @param approxTokens summed token estimate of the selected chunks
     * @param chunkCount number of snippets
     * @param fileCount distinct files among the snippets
     * @param truncated whether any candidate was left out by a cap or the budget
     * @param totalCandidates number of candidates considered
     */
    public record ChunkSelection(List<String> snippets, int approxTokens, int chunkCount, int fileCount,
                                 boolean truncated, int totalCandidates) {
    }
}
