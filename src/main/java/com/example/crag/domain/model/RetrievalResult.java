package com.example.crag.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One scored candidate handed in by a search backend.
 *
 * <p>{@code id}, {@code score}, {@code finalScore} and {@code rerankScore} are optional;
 * score resolution lives in {@code ScoreExtractor}. {@code sources}, {@code hybrid} and
 * {@code originalScores} are filled by rank fusion.</p>
 */
@Builder(toBuilder = true)
public record RetrievalResult(String id,
                              String text,
                              Double score,
                              Double finalScore,
                              Double rerankScore,
                              Map<String, Object> metadata,
                              List<String> sources,
                              boolean hybrid,
                              Map<String, Double> originalScores) {

    public RetrievalResult {
        text = text == null ? "" : text;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        sources = sources == null
                ? List.of()
                : sources.stream().filter(Objects::nonNull).toList();
        originalScores = originalScores == null || originalScores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(originalScores));
    }

    public static RetrievalResult of(String id, String text, double score) {
        return RetrievalResult.builder().id(id).text(text).score(score).build();
    }

    /** Number of fused sources that contributed this result. */
    public int fusionCount() {
        return sources.size();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        if (id != null) {
            m.put("id", id);
        }
        m.put("text", text);
        putIfPresent(m, "score", score);
        putIfPresent(m, "finalScore", finalScore);
        putIfPresent(m, "rerankScore", rerankScore);
        if (!metadata.isEmpty()) {
            m.put("metadata", metadata);
        }
        if (!sources.isEmpty()) {
            m.put("sources", sources);
            m.put("fusionCount", sources.size());
            m.put("hybrid", hybrid);
        }
        if (!originalScores.isEmpty()) {
            m.put("originalScores", originalScores);
        }
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, Double value) {
        if (value != null) {
            m.put(key, value);
        }
    }
}
