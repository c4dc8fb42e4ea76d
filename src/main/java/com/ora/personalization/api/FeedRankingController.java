package com.ora.personalization.api;

import com.ora.personalization.ranking.FeedRankingService;
import com.ora.personalization.ranking.RankingModels.RankRequest;
import com.ora.personalization.ranking.RankingModels.RankStoredRequest;
import com.ora.personalization.ranking.RankingModels.RankedFeed;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/feed")
public class FeedRankingController {
    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final FeedRankingService rankingService;

    public FeedRankingController(FeedRankingService rankingService) {
        this.rankingService = rankingService;
    }

    @PostMapping("/rank")
    public ResponseEntity<RankedFeed> rank(@RequestBody RankRequest request) {
        if (request.posts() == null) throw new IllegalArgumentException("posts is required");
        validateUser(request.userId());
        return ResponseEntity.ok(rankingService.rank(request.posts(), request.userId(), request.asOf()));
    }

    @PostMapping("/rank-stored")
    public ResponseEntity<RankedFeed> rankStored(@RequestBody RankStoredRequest request) {
        if (request.postIds() == null) throw new IllegalArgumentException("postIds is required");
        validateUser(request.userId());
        Duration timeout = request.timeoutMs() == null ? null : Duration.ofMillis(request.timeoutMs());
        return ResponseEntity.ok(rankingService.rankStoredPosts(request.userId(), request.postIds(), timeout));
    }

    /** An absent user is allowed and ranks by recency; a present one must be well formed. */
    private void validateUser(String userId) {
        if (userId != null && !USER_ID.matcher(userId).matches()) {
            throw new IllegalArgumentException("userId must match " + USER_ID.pattern());
        }
    }
}
