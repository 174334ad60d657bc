package com.example.crag.service.rag.fusion;

import com.example.crag.domain.model.RetrievalResult;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Stable dedup key for fusion: the explicit id when present, else a short content hash.
 */
public final class DocumentKeyNormalizer {

    /** Leading text characters that feed the content hash. */
    public static final int HASH_PREFIX_CHARS = 200;

    private static final int KEY_LENGTH = 16;

    private DocumentKeyNormalizer() {
    }

    /** Null when the result has neither an id nor any text. */
    public static String keyOf(RetrievalResult result) {
        if (result == null) {
            return null;
        }
        String id = result.id();
        if (id != null && !id.isBlank()) {
            return id.trim();
        }
        String text = result.text();
        if (text == null || text.isBlank()) {
            return null;
        }
        return contentHash(text);
    }

    static String contentHash(String text) {
        String prefix = text.length() > HASH_PREFIX_CHARS ? text.substring(0, HASH_PREFIX_CHARS) : text;
        return DigestUtils.md5DigestAsHex(prefix.getBytes(StandardCharsets.UTF_8)).substring(0, KEY_LENGTH);
    }
}
