package com.example.crag.adapters.langchain4j;

import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.service.rag.gate.ScoreExtractor;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Converts between LangChain4j {@link Content} and {@link RetrievalResult}.
 *
 * <p>Id comes from {@code id}, {@code chunk_uid} or {@code embedding_id}; the raw score from
 * {@code score}, the rerank score from {@code reranked_score} or {@code rerank_score},
 * the final score from {@code final_score}. Both segment metadata and content metadata are read.</p>
 */
public final class ContentMapper {

    private static final String[] ID_KEYS = {"id", "chunk_uid", "embedding_id"};
    private static final String[] RERANK_KEYS = {"reranked_score", "rerank_score"};

    private ContentMapper() {
    }

    public static RetrievalResult toResult(Content content) {
        if (content == null) {
            return null;
        }
        TextSegment segment = content.textSegment();
        Map<String, Object> md = new LinkedHashMap<>();
        String text = "";
        if (segment != null) {
            text = segment.text() == null ? "" : segment.text();
            if (segment.metadata() != null) {
                md.putAll(segment.metadata().toMap());
            }
        }
        if (content.metadata() != null) {
            content.metadata().forEach((k, v) -> {
                if (k != null && v != null) {
                    md.putIfAbsent(k.name().toLowerCase(Locale.ROOT), v);
                }
            });
        }

        return RetrievalResult.builder()
                .id(firstString(md, ID_KEYS))
                .text(text)
                .score(ScoreExtractor.parseLenient(md.get("score")))
                .finalScore(ScoreExtractor.parseLenient(md.get("final_score")))
                .rerankScore(firstNumber(md, RERANK_KEYS))
                .metadata(md)
                .build();
    }

    /**
     * Segment metadata only keeps values LangChain4j accepts (strings, UUIDs and numbers);
     * scores and the id are written as metadata keys.
     */
    public static Content toContent(RetrievalResult result) {
        Map<String, Object> meta = new LinkedHashMap<>();
        result.metadata().forEach((k, v) -> {
            Object safe = supported(v);
            if (k != null && safe != null) {
                meta.put(k, safe);
            }
        });
        if (result.id() != null) {
            meta.put("id", result.id());
        }
        if (result.score() != null) {
            meta.put("score", result.score());
        }
        if (result.finalScore() != null) {
            meta.put("final_score", result.finalScore());
        }
        if (result.rerankScore() != null) {
            meta.put("rerank_score", result.rerankScore());
        }
        return Content.from(TextSegment.from(result.text(), Metadata.from(meta)));
    }

    private static Object supported(Object v) {
        if (v instanceof String || v instanceof UUID || v instanceof Integer
                || v instanceof Long || v instanceof Float || v instanceof Double) {
            return v;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }

    private static String firstString(Map<String, Object> md, String[] keys) {
        for (String key : keys) {
            Object v = md.get(key);
            if (v != null && !v.toString().isBlank()) {
                return v.toString();
            }
        }
        return null;
    }

    private static Double firstNumber(Map<String, Object> md, String[] keys) {
        for (String key : keys) {
            Double v = ScoreExtractor.parseLenient(md.get(key));
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
