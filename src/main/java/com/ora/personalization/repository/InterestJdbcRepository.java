package com.ora.personalization.repository;

import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class InterestJdbcRepository {
    private static final String COLUMNS = "id, name, display_name, parent_id, depth_level, path_json, description, is_active, " +
            "post_count, follower_count, weekly_growth, monthly_growth, keywords_json, synonyms_json, related_ids_json, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Interest> mapper;

    public InterestJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new Interest(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getInt(5),
                json.readStrings(rs.getString(6)), rs.getString(7), rs.getBoolean(8),
                rs.getInt(9), rs.getInt(10), rs.getDouble(11), rs.getDouble(12),
                json.readStrings(rs.getString(13)), json.readStrings(rs.getString(14)), json.readStrings(rs.getString(15)),
                Instant.parse(rs.getString(16)), Instant.parse(rs.getString(17)));
    }

    public void insert(Interest i) {
        jdbcTemplate.update("INSERT INTO interests(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                i.id(), i.name(), i.displayName(), i.parentId(), i.level(), json.write(i.path()), i.description(), i.active(),
                i.postCount(), i.followerCount(), i.weeklyGrowth(), i.monthlyGrowth(),
                json.write(i.keywords()), json.write(i.synonyms()), json.write(i.relatedInterestIds()),
                i.createdAt().toString(), i.updatedAt().toString());
    }

    /** Rewrites everything except the aggregate counters, which belong to stat recalculation. */
    public void update(Interest i) {
        jdbcTemplate.update("UPDATE interests SET name=?, display_name=?, parent_id=?, depth_level=?, path_json=?, description=?, is_active=?, " +
                        "keywords_json=?, synonyms_json=?, related_ids_json=?, updated_at=? WHERE id=?",
                i.name(), i.displayName(), i.parentId(), i.level(), json.write(i.path()), i.description(), i.active(),
                json.write(i.keywords()), json.write(i.synonyms()), json.write(i.relatedInterestIds()),
                i.updatedAt().toString(), i.id());
    }

    /**
     * Writes the moved node in full and, for its descendants, only name, parent, level and path,
     * so details edited on a descendant in the meantime are kept.
     */
    @Transactional
    public void relocate(Interest moved, List<Interest> descendants) {
        update(moved);
        for (Interest i : descendants) {
            jdbcTemplate.update("UPDATE interests SET name=?, parent_id=?, depth_level=?, path_json=?, updated_at=? WHERE id=?",
                    i.name(), i.parentId(), i.level(), json.write(i.path()), i.updatedAt().toString(), i.id());
        }
    }

    public void updateStats(String id, int postCount, int followerCount, double weeklyGrowth, double monthlyGrowth, Instant updatedAt) {
        jdbcTemplate.update("UPDATE interests SET post_count=?, follower_count=?, weekly_growth=?, monthly_growth=?, updated_at=? WHERE id=?",
                postCount, followerCount, weeklyGrowth, monthlyGrowth, updatedAt.toString(), id);
    }

    public Optional<Interest> findById(String id) {
        List<Interest> rows = jdbcTemplate.query("SELECT " + COLUMNS + " FROM interests WHERE id=?", mapper, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Interest> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM interests", mapper);
    }

    public List<Interest> findActive() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM interests WHERE is_active = TRUE", mapper);
    }

    public List<Interest> findSiblings(String parentId) {
        if (parentId == null) {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM interests WHERE parent_id IS NULL", mapper);
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM interests WHERE parent_id=?", mapper, parentId);
    }

    public List<String> findAllIds() {
        return jdbcTemplate.query("SELECT id FROM interests ORDER BY id", (rs, n) -> rs.getString(1));
    }

    public List<Instant> loadClassificationTimes(String interestId) {
        return jdbcTemplate.query("SELECT classified_at FROM post_classification_items WHERE interest_id=?",
                (rs, n) -> Instant.parse(rs.getString(1)), interestId);
    }

    public int countExplicitFollowers(String interestId) {
        Integer value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM taste_graph_affinities WHERE interest_id=? AND affinity_source=?",
                Integer.class, interestId, "explicitFollow");
        return value == null ? 0 : value;
    }
}
