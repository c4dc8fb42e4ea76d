package com.ora.personalization.ranking;

import com.ora.personalization.ranking.RankingModels.InterestScore;
import com.ora.personalization.ranking.RankingModels.RankablePost;
import com.ora.personalization.ranking.RankingModels.ScoreBreakdown;
import com.ora.personalization.ranking.RankingModels.ScoredPost;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiversityRerankerTest {
    private final DiversityReranker reranker = new DiversityReranker(3);

    @Test
    void repeatedInterestIsDeferredPastWindow() {
        List<ScoredPost> input = List.of(post("1", "a"), post("2", "a"), post("3", "b"), post("4", "c"), post("5", "d"), post("6", "a"));

        List<String> ids = ids(reranker.rerank(input));

        assertEquals(List.of("1", "3", "4", "5", "6", "2"), ids);
    }

    @Test
    void postsWithoutPrimaryInterestAreEmittedInPlace() {
        List<ScoredPost> input = List.of(post("1", "a"), post("2", null), post("3", "a"), post("4", null));

        assertEquals(List.of("1", "2", "4", "3"), ids(reranker.rerank(input)));
    }

    @Test
    void deferredPostsKeepOriginalOrder() {
        List<ScoredPost> input = List.of(post("1", "a"), post("2", "a"), post("3", "a"), post("4", "a"));

        assertEquals(List.of("1", "2", "3", "4"), ids(reranker.rerank(input)));
    }

    @Test
    void primaryPassKeepsSameInterestMoreThanWindowApart() {
        List<ScoredPost> input = List.of(post("1", "a"), post("2", "a"), post("3", "b"), post("4", "c"),
                post("5", "d"), post("6", "a"), post("7", "b"), post("8", "b"));

        List<ScoredPost> out = reranker.rerank(input);

        assertEquals(List.of("1", "3", "4", "5", "6", "7", "2", "8"), ids(out));
        List<ScoredPost> primaryPass = out.subList(0, 6);
        for (int i = 0; i < primaryPass.size(); i++) {
            for (int j = i + 1; j < primaryPass.size() && j - i <= 3; j++) {
                assertNotEquals(primaryPass.get(i).post().primaryInterestId(), primaryPass.get(j).post().primaryInterestId());
            }
        }
    }

    @Test
    void windowOfZeroKeepsOrder() {
        List<ScoredPost> input = List.of(post("1", "a"), post("2", "a"));
        assertEquals(List.of("1", "2"), ids(new DiversityReranker(0).rerank(input)));
    }

    private static ScoredPost post(String id, String primary) {
        List<InterestScore> classes = primary == null ? List.of() : List.of(new InterestScore(primary, 0.9));
        RankablePost p = new RankablePost(id, Instant.EPOCH, 0, 0, 0, 0, 0, null, null, classes);
        return new ScoredPost(p, new ScoreBreakdown(0, 0, 0, 0, 0));
    }

    private static List<String> ids(List<ScoredPost> posts) {
        return posts.stream().map(s -> s.post().id()).toList();
    }
}
