package com.ora.personalization.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ora.personalization.classification.ClassificationModels.Classification;
import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.PostInterestClassification;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Repository
public class ClassificationJdbcRepository {
    private static final TypeReference<List<ClassificationSignal>> SIGNALS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public ClassificationJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    /** Replaces every stored classification of the post; readers see either the old set or the new one. */
    @Transactional
    public void replace(PostInterestClassification classification) {
        String postId = classification.postId();
        String classifiedAt = classification.classifiedAt().toString();
        jdbcTemplate.update("DELETE FROM post_classification_items WHERE post_id=?", postId);
        jdbcTemplate.update("MERGE INTO post_classifications(post_id, classifier_version, classified_at) KEY(post_id) VALUES (?,?,?)",
                postId, classification.version(), classifiedAt);
        List<Classification> items = classification.classifications();
        for (int i = 0; i < items.size(); i++) {
            Classification c = items.get(i);
            jdbcTemplate.update("INSERT INTO post_classification_items(post_id, interest_id, interest_name, interest_level, confidence, " +
                            "signals_json, item_order, classified_at) VALUES (?,?,?,?,?,?,?,?)",
                    postId, c.interestId(), c.interestName(), c.interestLevel(), c.confidence(), json.write(c.signals()), i, classifiedAt);
        }
    }

    @Transactional(readOnly = true)
    public Optional<PostInterestClassification> find(String postId) {
        List<HeaderRow> headers = jdbcTemplate.query(
                "SELECT post_id, classifier_version, classified_at FROM post_classifications WHERE post_id=?",
                (rs, n) -> new HeaderRow(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                postId);
        if (headers.isEmpty()) return Optional.empty();
        HeaderRow header = headers.get(0);
        return Optional.of(new PostInterestClassification(postId, loadItems(List.of(postId)).getOrDefault(postId, List.of()),
                header.classifiedAt(), header.version()));
    }

    /** Classifications for many posts at once; posts without one are absent from the map. */
    @Transactional(readOnly = true)
    public Map<String, PostInterestClassification> findAll(Collection<String> postIds) {
        if (postIds.isEmpty()) return Map.of();
        String placeholders = String.join(",", Collections.nCopies(postIds.size(), "?"));
        List<HeaderRow> headers = jdbcTemplate.query(
                "SELECT post_id, classifier_version, classified_at FROM post_classifications WHERE post_id IN (" + placeholders + ")",
                (rs, n) -> new HeaderRow(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                postIds.toArray());
        Map<String, List<Classification>> items = loadItems(postIds);
        Map<String, PostInterestClassification> out = new HashMap<>();
        for (HeaderRow h : headers) {
            out.put(h.postId(), new PostInterestClassification(h.postId(), items.getOrDefault(h.postId(), List.of()), h.classifiedAt(), h.version()));
        }
        return out;
    }

    public List<ItemRow> loadAllItems() {
        return jdbcTemplate.query(
                "SELECT post_id, interest_id, interest_name, confidence, signals_json FROM post_classification_items",
                (rs, n) -> new ItemRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4), json.read(rs.getString(5), SIGNALS)));
    }

    public long countClassifiedPosts() {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM post_classifications", Long.class);
        return value == null ? 0 : value;
    }

    private Map<String, List<Classification>> loadItems(Collection<String> postIds) {
        String placeholders = String.join(",", Collections.nCopies(postIds.size(), "?"));
        Map<String, List<Classification>> out = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT post_id, interest_id, interest_name, interest_level, confidence, signals_json FROM post_classification_items " +
                        "WHERE post_id IN (" + placeholders + ") ORDER BY post_id, item_order",
                (RowCallbackHandler) rs -> {
                    out.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(new Classification(
                            rs.getString(2), rs.getString(3), rs.getInt(4), rs.getDouble(5), json.read(rs.getString(6), SIGNALS)));
                },
                postIds.toArray());
        return out;
    }

    public record HeaderRow(String postId, String version, Instant classifiedAt) {}
    public record ItemRow(String postId, String interestId, String interestName, double confidence, List<ClassificationSignal> signals) {}
}
