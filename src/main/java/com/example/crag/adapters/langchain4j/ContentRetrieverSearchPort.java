package com.example.crag.adapters.langchain4j;

import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.SearchRequest;
import com.example.crag.domain.ports.SearchPort;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Exposes a LangChain4j {@link ContentRetriever} as a {@link SearchPort}.
 *
 * <p>The retriever owns its own ranking, so the lexical/semantic weights of the request are
 * not forwarded; only {@code topK} is applied, as a cap on the returned list.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ContentRetrieverSearchPort implements SearchPort {

    private final ContentRetriever retriever;

    @Override
    public Mono<List<RetrievalResult>> search(SearchRequest request) {
        return Mono.fromCallable(() -> retrieve(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<RetrievalResult> retrieve(SearchRequest request) {
        List<Content> contents = retriever.retrieve(Query.from(request.query()));
        if (contents == null || contents.isEmpty()) {
            return List.of();
        }
        int limit = request.topK() > 0 ? request.topK() : contents.size();
        List<RetrievalResult> out = new ArrayList<>(Math.min(limit, contents.size()));
        for (Content c : contents) {
            if (out.size() >= limit) {
                break;
            }
            RetrievalResult r = ContentMapper.toResult(c);
            if (r != null) {
                out.add(r);
            }
        }
        log.debug("[CRAG] retriever returned {} of {} contents topK={}", out.size(), contents.size(), request.topK());
        return out;
    }
}
