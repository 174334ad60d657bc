package com.example.crag.service.rag.fusion;

import com.example.crag.domain.model.RetrievalResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ReciprocalRankFuserTest {

    private final ReciprocalRankFuser fuser = new ReciprocalRankFuser();

    private static RetrievalResult doc(String id, double score) {
        return RetrievalResult.of(id, "text of " + id, score);
    }

    private static List<RetrievalResult> docs(String prefix, int n) {
        List<RetrievalResult> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(doc(prefix + i, 0.9 - i * 0.1));
        }
        return out;
    }

    @Test
    void rrfScoreDecreasesWithRank() {
        assertThat(ReciprocalRankFuser.rrfScore(1, 60)).isCloseTo(1.0 / 61, within(1e-12));
        for (int rank = 1; rank < 100; rank++) {
            assertThat(ReciprocalRankFuser.rrfScore(rank, 60))
                    .isGreaterThan(ReciprocalRankFuser.rrfScore(rank + 1, 60));
        }
        assertThatThrownBy(() -> ReciprocalRankFuser.rrfScore(0, 60))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void singleListPassesThroughInOrder() {
        List<RetrievalResult> input = List.of(doc("a", 0.9), doc("b", 0.4), doc("c", 0.7));

        List<RetrievalResult> out = fuser.mergeResultsRRF(List.of(input), 2);

        assertThat(out).extracting(RetrievalResult::id).containsExactly("a", "b");
        assertThat(out).extracting(RetrievalResult::finalScore).containsExactly(0.9, 0.4);
        assertThat(out.get(0).sources()).containsExactly("query_0");
    }

    @Test
    void mergingASingleFusedListIsIdempotent() {
        List<RetrievalResult> once = fuser.mergeResultsRRF(List.of(docs("d", 6)), 4);
        List<RetrievalResult> twice = fuser.mergeResultsRRF(List.of(once), 4);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void sharedDocumentAccumulatesAcrossLists() {
        List<RetrievalResult> q0 = List.of(doc("x", 0.2), doc("shared", 0.9));
        List<RetrievalResult> q1 = List.of(doc("shared", 0.8), doc("y", 0.3));

        List<RetrievalResult> out = fuser.mergeResultsRRF(List.of(q0, q1), 10);

        assertThat(out).extracting(RetrievalResult::id).containsExactly("shared", "x", "y");
        RetrievalResult shared = out.get(0);
        assertThat(shared.finalScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
        assertThat(shared.sources()).containsExactly("query_0", "query_1");
        assertThat(shared.originalScores()).containsEntry("query_0", 0.9).containsEntry("query_1", 0.8);
        assertThat(shared.fusionCount()).isEqualTo(2);
    }

    @Test
    void tiesKeepFirstSeenOrder() {
        List<RetrievalResult> q0 = List.of(doc("a0", 0.5), doc("a1", 0.5));
        List<RetrievalResult> q1 = List.of(doc("b0", 0.5), doc("b1", 0.5));
        List<RetrievalResult> q2 = List.of(doc("c0", 0.5), doc("c1", 0.5));

        List<RetrievalResult> out = fuser.mergeResultsRRF(List.of(q0, q1, q2), 10);

        assertThat(out).extracting(RetrievalResult::id)
                .containsExactly("a0", "b0", "c0", "a1", "b1", "c1");
        assertThat(fuser.mergeResultsRRF(List.of(q0, q1, q2), 10)).isEqualTo(out);
    }

    @Test
    void deduplicatesByTextWhenIdIsMissing() {
        RetrievalResult first = RetrievalResult.builder().text("same passage").score(0.3).build();
        RetrievalResult second = RetrievalResult.builder().text("same passage").score(0.6).build();

        List<RetrievalResult> out = fuser.mergeResultsRRF(List.of(List.of(first), List.of(second)), 10);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).id()).hasSize(16);
        assertThat(out.get(0).finalScore()).isCloseTo(2.0 / 61, within(1e-12));
    }

    @Test
    void engineMetadataIsAddedToSources() {
        RetrievalResult web = RetrievalResult.builder().id("w").text("w").score(0.5)
                .metadata(Map.of("engine", "web")).build();

        List<RetrievalResult> out = fuser.mergeResultsRRF(List.of(List.of(web), List.of(doc("v", 0.1))), 10);

        assertThat(out.get(0).sources()).containsExactly("query_0", "web");
    }

    @Test
    void nonPositiveTopKYieldsNothing() {
        assertThat(fuser.mergeResultsRRF(List.of(docs("d", 3), docs("e", 3)), 0)).isEmpty();
        assertThat(fuser.mergeLexicalVectorRRF(docs("l", 3), docs("v", 3), -1)).isEmpty();
        assertThat(fuser.mergeResultsRRF(List.of(), 5)).isEmpty();
    }

    @Test
    void disjointLexicalAndVectorListsInterleave() {
        List<RetrievalResult> out = fuser.mergeLexicalVectorRRF(docs("lex", 5), docs("vec", 5), 10);

        assertThat(out).hasSize(10);
        assertThat(out).noneMatch(RetrievalResult::hybrid);
        assertThat(out).extracting(RetrievalResult::id).startsWith("lex0", "vec0", "lex1", "vec1");
    }

    @Test
    void sharedHybridDocumentCombinesWeightedScores() {
        List<RetrievalResult> lexical = List.of(doc("shared", 0.4), doc("l1", 0.3));
        List<RetrievalResult> vector = List.of(doc("shared", 0.8), doc("v1", 0.7));

        List<RetrievalResult> out = fuser.mergeLexicalVectorRRF(lexical, vector, 10);

        RetrievalResult shared = out.get(0);
        assertThat(shared.id()).isEqualTo("shared");
        assertThat(shared.hybrid()).isTrue();
        assertThat(shared.finalScore()).isCloseTo(0.5 / 61 + 0.5 / 61, within(1e-12));
        assertThat(shared.sources()).containsExactly("lexical", "vector");
        assertThat(shared.originalScores())
                .containsEntry(ReciprocalRankFuser.LEXICAL, 0.4)
                .containsEntry(ReciprocalRankFuser.VECTOR, 0.8);
        assertThat(out.subList(1, out.size())).noneMatch(RetrievalResult::hybrid);
    }

    @Test
    void weightsShiftTheRanking() {
        List<RetrievalResult> lexical = List.of(doc("l0", 0.9));
        List<RetrievalResult> vector = List.of(doc("v0", 0.9));

        List<RetrievalResult> out = fuser.mergeLexicalVectorRRF(lexical, vector, 10, 60, 0.2, 0.8);

        assertThat(out).extracting(RetrievalResult::id).containsExactly("v0", "l0");
    }

    @Test
    void oneEmptySideReturnsTheOtherUnchanged() {
        List<RetrievalResult> out = fuser.mergeLexicalVectorRRF(List.of(), docs("vec", 3), 2);

        assertThat(out).extracting(RetrievalResult::id).containsExactly("vec0", "vec1");
        assertThat(out.get(0).sources()).containsExactly("vector");
        assertThat(out.get(0).finalScore()).isEqualTo(0.9);
        assertThat(out).noneMatch(RetrievalResult::hybrid);
    }

    @Test
    void nativeScoresReplaceFusedScoresWithoutReordering() {
        List<RetrievalResult> q0 = List.of(doc("a", 0.3), doc("b", 0.95));
        List<RetrievalResult> q1 = List.of(doc("a", 0.6), doc("c", 0.7));

        List<RetrievalResult> fused = fuser.mergeResultsRRF(List.of(q0, q1), 10);
        List<RetrievalResult> rescored = ReciprocalRankFuser.withNativeScores(fused);

        assertThat(rescored).extracting(RetrievalResult::id).containsExactly("a", "b", "c");
        assertThat(rescored).extracting(RetrievalResult::finalScore).containsExactly(0.6, 0.95, 0.7);
        assertThat(rescored.get(0).metadata())
                .containsEntry(ReciprocalRankFuser.RRF_SCORE_KEY, 2.0 / 61);
    }

    @Test
    void nativeScoresLeavePassThroughResultsAlone() {
        List<RetrievalResult> single = fuser.mergeResultsRRF(List.of(docs("d", 2)), 5);

        assertThat(ReciprocalRankFuser.withNativeScores(single)).isEqualTo(single);
        assertThat(ReciprocalRankFuser.withNativeScores(null)).isEmpty();
    }
}
