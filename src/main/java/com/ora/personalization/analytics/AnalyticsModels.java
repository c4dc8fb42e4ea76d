package com.ora.personalization.analytics;

import java.util.List;
import java.util.Map;

public class AnalyticsModels {
    public record ConfidenceBucket(double lowerBound, double upperBound, long count) {}

    public record InterestVolume(String interestId, String interestName, long postCount, double averageConfidence) {}

    public record ClassificationOverview(long classifiedPosts,
                                         long totalClassifications,
                                         double averageClassificationsPerPost,
                                         List<ConfidenceBucket> confidenceHistogram,
                                         Map<String, Long> signalDistribution,
                                         List<InterestVolume> topInterests) {}
}
