package com.ora.personalization.analytics;

import com.ora.personalization.analytics.AnalyticsModels.*;
import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.repository.ClassificationJdbcRepository.ItemRow;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class ClassificationAnalyticsService {
    private static final int BUCKETS = 10;

    private final ClassificationJdbcRepository repository;

    public ClassificationAnalyticsService(ClassificationJdbcRepository repository) {
        this.repository = repository;
    }

    public ClassificationOverview overview(int topLimit) {
        long posts = repository.countClassifiedPosts();
        List<ItemRow> items = repository.loadAllItems();

        long[] counts = new long[BUCKETS];
        for (ItemRow item : items) {
            int bucket = Math.min(BUCKETS - 1, (int) Math.floor(item.confidence() * BUCKETS));
            counts[Math.max(0, bucket)]++;
        }
        List<ConfidenceBucket> histogram = new ArrayList<>();
        for (int i = 0; i < BUCKETS; i++) {
            histogram.add(new ConfidenceBucket(round(i / (double) BUCKETS), round((i + 1) / (double) BUCKETS), counts[i]));
        }

        Map<String, Long> signals = new LinkedHashMap<>();
        for (ClassificationSignal signal : ClassificationSignal.values()) signals.put(signal.wireName(), 0L);
        items.forEach(item -> item.signals().forEach(s -> signals.merge(s.wireName(), 1L, Long::sum)));

        List<InterestVolume> top = items.stream()
                .collect(Collectors.groupingBy(ItemRow::interestId))
                .values().stream()
                .map(rows -> new InterestVolume(rows.get(0).interestId(), rows.get(0).interestName(),
                        rows.stream().map(ItemRow::postId).distinct().count(),
                        rows.stream().mapToDouble(ItemRow::confidence).average().orElse(0.0)))
                .sorted(Comparator.comparingLong(InterestVolume::postCount).reversed().thenComparing(InterestVolume::interestId))
                .limit(Math.max(0, topLimit))
                .toList();

        double average = posts == 0 ? 0.0 : (double) items.size() / posts;
        return new ClassificationOverview(posts, items.size(), average, histogram, signals, top);
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
