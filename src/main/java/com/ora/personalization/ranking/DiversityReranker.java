package com.ora.personalization.ranking;

import com.ora.personalization.ranking.RankingModels.ScoredPost;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Spaces out posts sharing a primary interest. A post whose primary interest is among the last
 * {@code window} distinct interests emitted is held back; held posts follow the main pass in their
 * original order. Posts without a primary interest never wait and never enter the window.
 */
public class DiversityReranker {
    private final int window;

    public DiversityReranker(int window) {
        if (window < 0) throw new IllegalArgumentException("window must be >= 0");
        this.window = window;
    }

    public List<ScoredPost> rerank(List<ScoredPost> sorted) {
        if (window == 0) return List.copyOf(sorted);
        List<ScoredPost> out = new ArrayList<>(sorted.size());
        List<ScoredPost> deferred = new ArrayList<>();
        Deque<String> recent = new ArrayDeque<>(window);

        for (ScoredPost post : sorted) {
            String primary = post.post().primaryInterestId();
            if (primary == null) {
                out.add(post);
            } else if (recent.contains(primary)) {
                deferred.add(post);
            } else {
                out.add(post);
                recent.addLast(primary);
                if (recent.size() > window) recent.removeFirst();
            }
        }
        out.addAll(deferred);
        return out;
    }
}
