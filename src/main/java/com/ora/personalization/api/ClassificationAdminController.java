package com.ora.personalization.api;

import com.ora.personalization.classification.ClassificationModels.*;
import com.ora.personalization.classification.PostClassificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/classifications")
public class ClassificationAdminController {
    private final PostClassificationService classificationService;

    public ClassificationAdminController(PostClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @PostMapping("/{postId}/reclassify")
    public ResponseEntity<ClassificationOutcome> reclassify(@PathVariable String postId) {
        return ResponseEntity.ok(classificationService.reclassify(postId));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchResult> batch(@RequestBody BatchRequest request) {
        return ResponseEntity.ok(classificationService.classifyBatch(request));
    }

    @GetMapping("/{postId}")
    public ResponseEntity<PostInterestClassification> get(@PathVariable String postId) {
        return ResponseEntity.ok(classificationService.getClassification(postId));
    }

    @PostMapping("/suggest")
    public ResponseEntity<List<Classification>> suggest(@RequestBody SuggestRequest request) {
        return ResponseEntity.ok(classificationService.suggestInterests(request.caption(), request.tags(), request.boardName()));
    }
}
