package com.ora.personalization.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ora.personalization.classification.ClassificationModels.BatchFilter;
import com.ora.personalization.domain.DomainModels.MetadataValue;
import com.ora.personalization.domain.DomainModels.PostEngagement;
import com.ora.personalization.domain.DomainModels.PostRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class PostJdbcRepository {
    private static final TypeReference<Map<String, MetadataValue>> METADATA = new TypeReference<>() {};
    private static final String COLUMNS = "p.id, p.user_id, p.caption, p.tags_json, p.board_names_json, p.selected_interest_ids_json, " +
            "p.metadata_json, p.username, p.profile_photo_url, p.created_at, p.like_count, p.comment_count, p.save_count, " +
            "p.share_count, p.view_count";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<PostRecord> mapper;

    public PostJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new PostRecord(
                rs.getString(1), rs.getString(2), rs.getString(3),
                json.readStrings(rs.getString(4)), json.readStrings(rs.getString(5)), json.readStrings(rs.getString(6)),
                readMetadata(rs.getString(7)), rs.getString(8), rs.getString(9), Instant.parse(rs.getString(10)),
                rs.getLong(11), rs.getLong(12), rs.getLong(13), rs.getLong(14), rs.getLong(15));
    }

    public void save(PostRecord p) {
        jdbcTemplate.update("MERGE INTO posts(id, user_id, caption, tags_json, board_names_json, selected_interest_ids_json, " +
                        "metadata_json, username, profile_photo_url, created_at, like_count, comment_count, save_count, share_count, view_count) " +
                        "KEY(id) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                p.id(), p.userId(), p.caption(), json.write(p.tags()), json.write(p.boardNames()), json.write(p.selectedInterestIds()),
                json.write(p.metadata()), p.username(), p.profilePhotoUrl(), p.createdAt().toString(),
                p.likeCount(), p.commentCount(), p.saveCount(), p.shareCount(), p.viewCount());
    }

    public void saveEngagement(PostEngagement e) {
        jdbcTemplate.update("MERGE INTO post_engagements(post_id, user_id, kind, ts) KEY(post_id, user_id, kind) VALUES (?,?,?,?)",
                e.postId(), e.userId(), e.kind(), e.ts().toString());
    }

    public Optional<PostRecord> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM posts p WHERE p.id=?", mapper, id).stream().findFirst();
    }

    public List<PostRecord> findByIds(Collection<String> ids) {
        if (ids.isEmpty()) return List.of();
        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM posts p WHERE p.id IN (" + placeholders + ")", mapper, ids.toArray());
    }

    /** Ids after {@code afterPostId} in id order, the cursor a batch run resumes from. */
    public List<String> findIdsForBatch(String afterPostId, BatchFilter filter, int limit) {
        String cursor = afterPostId == null ? "" : afterPostId;
        if (filter == BatchFilter.UNCLASSIFIED_ONLY) {
            return jdbcTemplate.queryForList(
                    "SELECT p.id FROM posts p LEFT JOIN post_classifications c ON c.post_id = p.id " +
                            "WHERE c.post_id IS NULL AND p.id > ? ORDER BY p.id LIMIT ?",
                    String.class, cursor, limit);
        }
        return jdbcTemplate.queryForList("SELECT p.id FROM posts p WHERE p.id > ? ORDER BY p.id LIMIT ?", String.class, cursor, limit);
    }

    /** Most recently created posts that already carry a classification. */
    public List<PostRecord> findRecentClassified(int limit, String excludePostId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM posts p JOIN post_classifications c ON c.post_id = p.id " +
                        "WHERE p.id <> ? ORDER BY p.created_at DESC, p.id LIMIT ?",
                mapper, excludePostId == null ? "" : excludePostId, limit);
    }

    private Map<String, MetadataValue> readMetadata(String value) {
        if (value == null || value.isBlank()) return Map.of();
        return json.read(value, METADATA);
    }
}
