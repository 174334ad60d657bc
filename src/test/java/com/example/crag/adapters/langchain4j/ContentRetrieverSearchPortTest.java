package com.example.crag.adapters.langchain4j;

import com.example.crag.domain.model.RetrievalResult;
import com.example.crag.domain.model.SearchRequest;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContentRetrieverSearchPortTest {

    private static Content content(String id, double score) {
        return Content.from(TextSegment.from("text " + id, Metadata.from(Map.of("id", id, "score", score))));
    }

    @Test
    void capsResultsAtTopK() {
        ContentRetriever retriever = mock(ContentRetriever.class);
        when(retriever.retrieve(any(Query.class)))
                .thenReturn(List.of(content("a", 0.9), content("b", 0.8), content("c", 0.7)));
        ContentRetrieverSearchPort port = new ContentRetrieverSearchPort(retriever);

        StepVerifier.create(port.search(new SearchRequest("capital of france", 2, 0.5, 0.5, null)))
                .assertNext(results -> assertThat(results).extracting(RetrievalResult::id).containsExactly("a", "b"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(retriever).retrieve(captor.capture());
        assertThat(captor.getValue().text()).isEqualTo("capital of france");
    }

    @Test
    void emptyRetrievalIsEmptyList() {
        ContentRetriever retriever = mock(ContentRetriever.class);
        when(retriever.retrieve(any(Query.class))).thenReturn(List.of());

        StepVerifier.create(new ContentRetrieverSearchPort(retriever)
                        .search(new SearchRequest("q", 5, 0.5, 0.5, Map.of())))
                .assertNext(results -> assertThat(results).isEmpty())
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void retrieverErrorsPropagate() {
        ContentRetriever retriever = mock(ContentRetriever.class);
        when(retriever.retrieve(any(Query.class))).thenThrow(new IllegalStateException("vector store down"));

        StepVerifier.create(new ContentRetrieverSearchPort(retriever)
                        .search(new SearchRequest("q", 5, 0.5, 0.5, Map.of())))
                .expectErrorMessage("vector store down")
                .verify(Duration.ofSeconds(5));
    }
}
