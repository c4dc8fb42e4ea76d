package com.ora.personalization.api;

import com.ora.personalization.analytics.AnalyticsModels.ClassificationOverview;
import com.ora.personalization.analytics.ClassificationAnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/analytics")
public class AnalyticsController {
    private final ClassificationAnalyticsService analyticsService;

    public AnalyticsController(ClassificationAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/classifications")
    public ResponseEntity<ClassificationOverview> classifications(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(analyticsService.overview(limit));
    }
}
