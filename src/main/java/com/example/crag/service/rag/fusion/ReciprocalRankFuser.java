package com.example.crag.service.rag.fusion;

import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.service.rag.gate.ScoreExtractor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Weighted Reciprocal Rank Fusion. A document's fused score is the sum of
 * {@code weight / (k + rank)} over every list it appears in (rank is 1-based).
 *
 * <p>Pure functions. Ties keep first-seen order, so equal inputs give equal outputs.
 * Fused results carry the fused value as {@code finalScore}.</p>
 */
public class ReciprocalRankFuser {

    public static final int DEFAULT_K = 60;

    public static final String LEXICAL = "lexical";
    public static final String VECTOR = "vector";
    public static final String RRF_SCORE_KEY = "rrfScore";
    static final String ENGINE_KEY = "engine";

    private final int defaultK;

    public ReciprocalRankFuser() {
        this(DEFAULT_K);
    }

    public ReciprocalRankFuser(int defaultK) {
        if (defaultK < 0) {
            throw new IllegalArgumentException("rrf k must be >= 0 but was " + defaultK);
        }
        this.defaultK = defaultK;
    }

    public int defaultK() {
        return defaultK;
    }

    public static double rrfScore(int rank, int k) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank is 1-based but was " + rank);
        }
        return 1.0 / (k + rank);
    }

    public List<RetrievalResult> mergeResultsRRF(List<List<RetrievalResult>> lists, int topK) {
        return mergeResultsRRF(lists, topK, defaultK);
    }

    /**
     * Fuses any number of ranked lists with equal weight. A single list is returned in its
     * own order, truncated, with its native scores as {@code finalScore}.
     */
    public List<RetrievalResult> mergeResultsRRF(List<List<RetrievalResult>> lists, int topK, int k) {
        if (lists == null || lists.isEmpty() || topK <= 0) {
            return List.of();
        }
        if (lists.size() == 1) {
            return passThrough(lists.get(0), topK, "query_0");
        }

        Map<String, Accumulator> acc = new LinkedHashMap<>();
        for (int listIdx = 0; listIdx < lists.size(); listIdx++) {
            List<RetrievalResult> list = lists.get(listIdx);
            if (list == null) {
                continue;
            }
            String label = "query_" + listIdx;
            int rank = 0;
            for (RetrievalResult item : list) {
                rank++;
                String key = DocumentKeyNormalizer.keyOf(item);
                if (key == null) {
                    continue;
                }
                Accumulator a = acc.computeIfAbsent(key, kk -> new Accumulator(kk, item));
                a.score += rrfScore(rank, k);
                a.sources.add(label);
                Object engine = item.metadata().get(ENGINE_KEY);
                if (engine instanceof String e && !e.isBlank()) {
                    a.sources.add(e);
                }
                a.originalScores.putIfAbsent(label, ScoreExtractor.extract(item));
            }
        }
        return rank(acc, topK, false);
    }

    public List<RetrievalResult> mergeLexicalVectorRRF(List<RetrievalResult> lexical,
                                                       List<RetrievalResult> vector,
                                                       int topK) {
        return mergeLexicalVectorRRF(lexical, vector, topK, defaultK, 0.5, 0.5);
    }

    /**
     * Hybrid fusion where each side's RRF contribution is scaled by its weight. When one
     * side is empty the other is returned in native order.
     */
    public List<RetrievalResult> mergeLexicalVectorRRF(List<RetrievalResult> lexical,
                                                       List<RetrievalResult> vector,
                                                       int topK, int k,
                                                       double wLex, double wVec) {
        boolean noLex = lexical == null || lexical.isEmpty();
        boolean noVec = vector == null || vector.isEmpty();
        if ((noLex && noVec) || topK <= 0) {
            return List.of();
        }
        if (noLex) {
            return passThrough(vector, topK, VECTOR);
        }
        if (noVec) {
            return passThrough(lexical, topK, LEXICAL);
        }

        Map<String, Accumulator> acc = new LinkedHashMap<>();
        accumulate(acc, lexical, LEXICAL, wLex, k);
        accumulate(acc, vector, VECTOR, wVec, k);
        return rank(acc, topK, true);
    }

    private static void accumulate(Map<String, Accumulator> acc, List<RetrievalResult> list,
                                   String label, double weight, int k) {
        int rank = 0;
        for (RetrievalResult item : list) {
            rank++;
            String key = DocumentKeyNormalizer.keyOf(item);
            if (key == null) {
                continue;
            }
            Accumulator a = acc.computeIfAbsent(key, kk -> new Accumulator(kk, item));
            a.score += weight * rrfScore(rank, k);
            a.sources.add(label);
            a.originalScores.putIfAbsent(label, ScoreExtractor.extract(item));
        }
    }

    /**
     * Keeps the fused order but swaps each fused {@code finalScore} for the best native score
     * recorded in {@code originalScores}, so the list can be judged against raw-score thresholds.
     * The fused value moves to metadata under {@value #RRF_SCORE_KEY}. Results without
     * {@code originalScores} (single-list pass-through) are returned as they are.
     */
    public static List<RetrievalResult> withNativeScores(List<RetrievalResult> fused) {
        if (fused == null || fused.isEmpty()) {
            return List.of();
        }
        List<RetrievalResult> out = new ArrayList<>(fused.size());
        for (RetrievalResult r : fused) {
            if (r == null) {
                continue;
            }
            if (r.originalScores().isEmpty()) {
                out.add(r);
                continue;
            }
            double best = Double.NEGATIVE_INFINITY;
            for (Double v : r.originalScores().values()) {
                if (v != null && v > best) {
                    best = v;
                }
            }
            Map<String, Object> metadata = new LinkedHashMap<>(r.metadata());
            if (r.finalScore() != null) {
                metadata.put(RRF_SCORE_KEY, r.finalScore());
            }
            out.add(r.toBuilder()
                    .finalScore(best == Double.NEGATIVE_INFINITY ? 0.0 : best)
                    .metadata(metadata)
                    .build());
        }
        return out;
    }

    private static List<RetrievalResult> passThrough(List<RetrievalResult> list, int topK, String label) {
        if (list == null) {
            return List.of();
        }
        List<RetrievalResult> out = new ArrayList<>(Math.min(list.size(), topK));
        for (RetrievalResult item : list) {
            if (out.size() >= topK) {
                break;
            }
            if (item == null) {
                continue;
            }
            out.add(item.toBuilder()
                    .finalScore(ScoreExtractor.extract(item))
                    .sources(List.of(label))
                    .build());
        }
        return out;
    }

    private static List<RetrievalResult> rank(Map<String, Accumulator> acc, int topK, boolean flagHybrid) {
        List<Accumulator> ordered = new ArrayList<>(acc.values());
        // List.sort is stable: equal scores keep insertion order
        ordered.sort(Comparator.comparingDouble((Accumulator a) -> a.score).reversed());

        List<RetrievalResult> out = new ArrayList<>(Math.min(ordered.size(), topK));
        for (Accumulator a : ordered) {
            if (out.size() >= topK) {
                break;
            }
            out.add(a.first.toBuilder()
                    .id(a.key)
                    .finalScore(a.score)
                    .sources(new ArrayList<>(a.sources))
                    .hybrid(flagHybrid && a.sources.contains(LEXICAL) && a.sources.contains(VECTOR))
                    .originalScores(a.originalScores)
                    .build());
        }
        return out;
    }

    private static final class Accumulator {
        final String key;
        final RetrievalResult first;
        final TreeSet<String> sources = new TreeSet<>();
        final Map<String, Double> originalScores = new LinkedHashMap<>();
        double score;

        Accumulator(String key, RetrievalResult first) {
            this.key = key;
            this.first = first;
        }
    }
}
