package com.ora.personalization.ranking;

import com.ora.personalization.classification.ClassificationModels.PostInterestClassification;
import com.ora.personalization.config.PersonalizationProperties.RankingSettings;
import com.ora.personalization.config.PersonalizationProperties.TasteGraphSettings;
import com.ora.personalization.domain.DomainModels.PostRecord;
import com.ora.personalization.ranking.RankingModels.*;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.repository.PostJdbcRepository;
import com.ora.personalization.tastegraph.TasteGraphModels.ScoredAffinity;
import com.ora.personalization.tastegraph.TasteGraphModels.TasteGraph;
import com.ora.personalization.tastegraph.TasteGraphService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

@Service
public class FeedRankingService {
    private static final Logger log = LoggerFactory.getLogger(FeedRankingService.class);

    /** createdAt desc, then id asc; posts without a timestamp sink to the end. */
    static final Comparator<RankablePost> RECENCY = Comparator
            .comparing(RankablePost::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(RankablePost::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<ScoredPost> BY_SCORE = Comparator
            .comparingDouble((ScoredPost s) -> s.score().composite()).reversed()
            .thenComparing(ScoredPost::post, RECENCY);

    private final TasteGraphService tasteGraphService;
    private final PostJdbcRepository posts;
    private final ClassificationJdbcRepository classifications;
    private final RankingSettings settings;
    private final TasteGraphSettings tasteGraphSettings;
    private final Clock clock;
    private final ExecutorService rankingExecutor;
    private final Executor ioExecutor;
    private final PostScorer scorer;
    private final DiversityReranker reranker;

    public FeedRankingService(TasteGraphService tasteGraphService,
                              PostJdbcRepository posts,
                              ClassificationJdbcRepository classifications,
                              RankingSettings settings,
                              TasteGraphSettings tasteGraphSettings,
                              Clock clock,
                              @Qualifier("rankingExecutor") ExecutorService rankingExecutor,
                              @Qualifier("personalizationIoExecutor") Executor ioExecutor) {
        this.tasteGraphService = tasteGraphService;
        this.posts = posts;
        this.classifications = classifications;
        this.settings = settings;
        this.tasteGraphSettings = tasteGraphSettings;
        this.clock = clock;
        this.rankingExecutor = rankingExecutor;
        this.ioExecutor = ioExecutor;
        this.scorer = new PostScorer(settings);
        this.reranker = new DiversityReranker(settings.diversityWindow());
    }

    public RankedFeed rank(List<RankablePost> candidates, String userId) {
        return rank(candidates, userId, clock.instant());
    }

    /**
     * Orders {@code candidates} for {@code userId}. Never fails on personalization problems: an
     * unknown user, an empty candidate set, or an unreachable taste graph all produce recency order.
     */
    public RankedFeed rank(List<RankablePost> candidates, String userId, Instant asOf) {
        List<RankablePost> input = candidates == null ? List.of() : candidates;
        if (input.isEmpty()) return recency(input, FallbackReason.NO_CANDIDATES);
        if (userId == null || userId.isBlank()) return recency(input, FallbackReason.NO_USER);

        Instant at = asOf == null ? clock.instant() : asOf;
        Optional<TasteGraph> graph = fetchTasteGraph(userId);
        if (graph.isEmpty()) return recency(input, FallbackReason.TASTE_GRAPH_UNAVAILABLE);

        Map<String, Double> affinities = new HashMap<>();
        for (ScoredAffinity a : graph.get().topInterests(tasteGraphSettings.topInterestCount(), at)) {
            affinities.put(a.interestId(), a.decayedScore());
        }

        List<ScoredPost> scored = new ArrayList<>(scoreAll(input, affinities, at));
        scored.sort(BY_SCORE);
        List<ScoredPost> ordered = reranker.rerank(scored);

        Map<String, ScoreBreakdown> scores = new LinkedHashMap<>();
        ordered.forEach(s -> scores.put(s.post().id(), s.score()));
        return new RankedFeed(ordered.stream().map(ScoredPost::post).toList(), scores, true, null);
    }

    /**
     * Loads {@code postIds} from the post store and ranks them. Classifications are read
     * asynchronously; if they do not arrive within {@code timeout} the posts are ranked by recency.
     */
    public RankedFeed rankStoredPosts(String userId, List<String> postIds, Duration timeout) {
        List<String> ids = postIds == null ? List.of() : postIds.stream().filter(Objects::nonNull).distinct().toList();
        List<PostRecord> records = posts.findByIds(ids);
        if (records.size() < ids.size()) {
            log.debug("{} of {} requested posts are unknown", ids.size() - records.size(), ids.size());
        }

        Duration wait = timeout == null ? settings.tasteGraphTimeout() : timeout;
        Map<String, PostInterestClassification> byPost;
        try {
            byPost = CompletableFuture.supplyAsync(() -> classifications.findAll(ids), ioExecutor)
                    .get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return recency(toRankable(records, Map.of()), FallbackReason.CLASSIFICATIONS_UNAVAILABLE);
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("Classifications unavailable for {} posts, ranking by recency: {}", ids.size(), e.toString());
            return recency(toRankable(records, Map.of()), FallbackReason.CLASSIFICATIONS_UNAVAILABLE);
        }
        return rank(toRankable(records, byPost), userId);
    }

    private Optional<TasteGraph> fetchTasteGraph(String userId) {
        try {
            return Optional.of(tasteGraphService.fetchTasteGraphAsync(userId)
                    .get(settings.tasteGraphTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted fetching taste graph for {}, falling back to recency", userId);
            return Optional.empty();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Taste graph unavailable for {}, falling back to recency: {}", userId, e.toString());
            return Optional.empty();
        }
    }

    private List<ScoredPost> scoreAll(List<RankablePost> input, Map<String, Double> affinities, Instant asOf) {
        if (input.size() < settings.parallelThreshold()) {
            return scoreChunk(input, affinities, asOf);
        }
        int chunkSize = Math.max(1, settings.chunkSize());
        List<CompletableFuture<List<ScoredPost>>> futures = new ArrayList<>();
        for (int from = 0; from < input.size(); from += chunkSize) {
            List<RankablePost> chunk = input.subList(from, Math.min(input.size(), from + chunkSize));
            futures.add(CompletableFuture.supplyAsync(() -> scoreChunk(chunk, affinities, asOf), rankingExecutor));
        }
        List<ScoredPost> out = new ArrayList<>(input.size());
        futures.forEach(f -> out.addAll(f.join()));
        return out;
    }

    private List<ScoredPost> scoreChunk(List<RankablePost> chunk, Map<String, Double> affinities, Instant asOf) {
        List<ScoredPost> out = new ArrayList<>(chunk.size());
        for (RankablePost post : chunk) {
            ScoreBreakdown score = scorer.score(post, affinities, asOf);
            log.debug("Scored post {}: {}", post.id(), score);
            out.add(new ScoredPost(post, score));
        }
        return out;
    }

    private RankedFeed recency(List<RankablePost> input, FallbackReason reason) {
        List<RankablePost> ordered = new ArrayList<>(input);
        ordered.sort(RECENCY);
        return RankedFeed.recency(ordered, reason);
    }

    private static List<RankablePost> toRankable(List<PostRecord> records, Map<String, PostInterestClassification> byPost) {
        return records.stream().map(p -> {
            PostInterestClassification c = byPost.get(p.id());
            List<InterestScore> scores = c == null ? List.of() : c.classifications().stream()
                    .map(x -> new InterestScore(x.interestId(), x.confidence()))
                    .toList();
            return new RankablePost(p.id(), p.createdAt(), p.likeCount(), p.commentCount(), p.saveCount(), p.shareCount(),
                    p.viewCount(), p.username(), p.profilePhotoUrl(), scores);
        }).toList();
    }
}
