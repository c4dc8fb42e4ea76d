package com.ora.personalization.api;

import com.ora.personalization.tastegraph.TasteGraphModels.*;
import com.ora.personalization.tastegraph.TasteGraphService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/taste-graphs/{userId}")
public class TasteGraphController {
    private final TasteGraphService tasteGraphService;

    public TasteGraphController(TasteGraphService tasteGraphService) {
        this.tasteGraphService = tasteGraphService;
    }

    @GetMapping
    public ResponseEntity<TasteGraph> get(@PathVariable String userId) {
        return ResponseEntity.ok(tasteGraphService.getTasteGraph(userId));
    }

    @GetMapping("/top")
    public ResponseEntity<List<ScoredAffinity>> top(@PathVariable String userId,
                                                    @RequestParam(defaultValue = "20") int count,
                                                    @RequestParam(required = false) Instant asOf) {
        return ResponseEntity.ok(tasteGraphService.topInterests(userId, count, asOf));
    }

    @PostMapping("/engagements")
    public ResponseEntity<InterestAffinity> engage(@PathVariable String userId, @RequestBody EngagementRequest request) {
        double weight = request.weight() == null ? 1.0 : request.weight();
        return ResponseEntity.ok(tasteGraphService.recordEngagement(userId, request.interestId(), request.source(), weight));
    }

    @PostMapping("/follows/{interestId}")
    public ResponseEntity<InterestAffinity> follow(@PathVariable String userId, @PathVariable String interestId) {
        return ResponseEntity.ok(tasteGraphService.recordFollow(userId, interestId));
    }

    @PostMapping("/searches/{interestId}")
    public ResponseEntity<InterestAffinity> search(@PathVariable String userId, @PathVariable String interestId) {
        return ResponseEntity.ok(tasteGraphService.recordSearch(userId, interestId));
    }

    @PostMapping("/saves/{postId}")
    public ResponseEntity<Integer> save(@PathVariable String userId, @PathVariable String postId) {
        return ResponseEntity.ok(tasteGraphService.recordSave(userId, postId));
    }

    @PostMapping("/views/{postId}")
    public ResponseEntity<Integer> view(@PathVariable String userId, @PathVariable String postId, @RequestParam long durationMs) {
        return ResponseEntity.ok(tasteGraphService.recordView(userId, postId, Duration.ofMillis(durationMs)));
    }

    @PostMapping("/creates/{postId}")
    public ResponseEntity<Integer> create(@PathVariable String userId, @PathVariable String postId) {
        return ResponseEntity.ok(tasteGraphService.recordCreate(userId, postId));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<List<InterestSuggestion>> suggestions(@PathVariable String userId,
                                                                @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(tasteGraphService.suggestedInterests(userId, limit));
    }
}
