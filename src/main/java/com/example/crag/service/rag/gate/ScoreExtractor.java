package com.example.crag.service.rag.gate;

import com.example.crag.domain.model.RetrievalResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves the numeric relevance score of a result.
 *
 * <p>Lookup order: {@code finalScore}, {@code score}, {@code rerankScore} typed fields, then the
 * metadata keys {@code final_score}, {@code score}, {@code rerank_score}. The first finite value
 * wins; missing, non-finite or unparsable candidates are skipped. Nothing found resolves to 0.</p>
 */
public final class ScoreExtractor {

    static final String[] METADATA_KEYS = {"final_score", "score", "rerank_score"};

    private ScoreExtractor() {
    }

    public static double extract(RetrievalResult result) {
        if (result == null) {
            return 0.0;
        }
        Double typed = firstFinite(result.finalScore(), result.score(), result.rerankScore());
        if (typed != null) {
            return typed;
        }
        Map<String, Object> md = result.metadata();
        for (String key : METADATA_KEYS) {
            Double v = parseLenient(md.get(key));
            if (v != null) {
                return v;
            }
        }
        return 0.0;
    }

    public static List<Double> extractAll(List<RetrievalResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<Double> out = new ArrayList<>(results.size());
        for (RetrievalResult r : results) {
            out.add(extract(r));
        }
        return out;
    }

    /**
     * Numbers and numeric strings; anything else (or a non-finite value) yields null.
     */
    public static Double parseLenient(Object raw) {
        if (raw == null) {
            return null;
        }
        double v;
        if (raw instanceof Number n) {
            v = n.doubleValue();
        } else {
            String s = raw.toString().trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                v = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(v) ? v : null;
    }

    private static Double firstFinite(Double... candidates) {
        for (Double c : candidates) {
            if (c != null && Double.isFinite(c)) {
                return c;
            }
        }
        return null;
    }
}
