package com.ora.personalization.api;

import com.ora.personalization.taxonomy.TaxonomyModels.*;
import com.ora.personalization.taxonomy.TaxonomySeedService;
import com.ora.personalization.taxonomy.TaxonomyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/interests")
public class InterestAdminController {
    private final TaxonomyService taxonomyService;
    private final TaxonomySeedService seedService;

    public InterestAdminController(TaxonomyService taxonomyService, TaxonomySeedService seedService) {
        this.taxonomyService = taxonomyService;
        this.seedService = seedService;
    }

    @PostMapping
    public ResponseEntity<Interest> create(@RequestBody CreateInterestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taxonomyService.createInterest(request));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Interest> update(@PathVariable String id, @RequestBody InterestUpdate update) {
        return ResponseEntity.ok(taxonomyService.update(id, update));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<Void> deactivate(@PathVariable String id) {
        taxonomyService.deactivate(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/tree")
    public ResponseEntity<List<InterestTreeNode>> tree(@RequestParam(defaultValue = "FULL") TreeScope scope) {
        return ResponseEntity.ok(taxonomyService.getTree(scope));
    }

    @GetMapping("/search")
    public ResponseEntity<List<Interest>> search(@RequestParam String q, @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(taxonomyService.searchInterests(q, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Interest> get(@PathVariable String id) {
        return ResponseEntity.ok(taxonomyService.getInterest(id));
    }

    @GetMapping("/{id}/children")
    public ResponseEntity<List<Interest>> children(@PathVariable String id) {
        return ResponseEntity.ok(taxonomyService.getChildren(id));
    }

    @GetMapping("/{id}/path")
    public ResponseEntity<List<Interest>> path(@PathVariable String id) {
        return ResponseEntity.ok(taxonomyService.getInterestPath(id));
    }

    @GetMapping("/{id}/related")
    public ResponseEntity<List<Interest>> related(@PathVariable String id, @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(taxonomyService.getRelatedInterests(id, limit));
    }

    @PostMapping("/{id}/recalculate-stats")
    public ResponseEntity<StatsRecount> recalculate(@PathVariable String id) {
        return ResponseEntity.ok(taxonomyService.recalculateStats(id));
    }

    @PostMapping("/recalculate-stats")
    public ResponseEntity<List<StatsRecount>> recalculateAll() {
        return ResponseEntity.ok(taxonomyService.recalculateAllStats());
    }

    @PostMapping("/seed")
    public ResponseEntity<SeedResult> seed() {
        return ResponseEntity.ok(seedService.seedBaseTaxonomy());
    }
}
