package com.ora.personalization.repository;

import com.ora.personalization.tastegraph.TasteGraphModels.AffinitySource;
import com.ora.personalization.tastegraph.TasteGraphModels.InterestAffinity;
import com.ora.personalization.tastegraph.TasteGraphModels.TasteGraph;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TasteGraphJdbcRepository {
    private static final RowMapper<InterestAffinity> AFFINITY = (rs, n) -> new InterestAffinity(
            rs.getString(1), rs.getDouble(2), AffinitySource.fromWire(rs.getString(3)), rs.getInt(4),
            Instant.parse(rs.getString(5)), Instant.parse(rs.getString(6)), rs.getDouble(7));

    private final JdbcTemplate jdbcTemplate;

    public TasteGraphJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<TasteGraph> load(String userId) {
        List<GraphHeaderRow> headers = jdbcTemplate.query(
                "SELECT schema_version, last_updated FROM taste_graphs WHERE user_id=?",
                (rs, n) -> new GraphHeaderRow(rs.getInt(1), Instant.parse(rs.getString(2))),
                userId);
        if (headers.isEmpty()) return Optional.empty();
        GraphHeaderRow header = headers.get(0);
        return Optional.of(TasteGraph.of(userId, loadAffinities(userId), header.lastUpdated(), header.schemaVersion()));
    }

    public List<InterestAffinity> loadAffinities(String userId) {
        return jdbcTemplate.query(
                "SELECT interest_id, score, affinity_source, engagement_count, first_engagement, last_engagement, decay_factor " +
                        "FROM taste_graph_affinities WHERE user_id=?",
                AFFINITY, userId);
    }

    /** Graphs of every user who engaged with {@code postId}. */
    public List<TasteGraph> loadEngagerGraphs(String postId) {
        List<String> users = jdbcTemplate.queryForList(
                "SELECT DISTINCT user_id FROM post_engagements WHERE post_id=? ORDER BY user_id", String.class, postId);
        return users.stream().map(this::load).flatMap(Optional::stream).toList();
    }

    @Transactional
    public void upsert(String userId, InterestAffinity affinity, int schemaVersion, Instant lastUpdated) {
        jdbcTemplate.update("MERGE INTO taste_graphs(user_id, schema_version, last_updated) KEY(user_id) VALUES (?,?,?)",
                userId, schemaVersion, lastUpdated.toString());
        jdbcTemplate.update("MERGE INTO taste_graph_affinities(user_id, interest_id, score, affinity_source, engagement_count, " +
                        "first_engagement, last_engagement, decay_factor) KEY(user_id, interest_id) VALUES (?,?,?,?,?,?,?,?)",
                userId, affinity.interestId(), affinity.score(), affinity.source().wireName(), affinity.engagementCount(),
                affinity.firstEngagement().toString(), affinity.lastEngagement().toString(), affinity.decayFactor());
    }

    public record GraphHeaderRow(int schemaVersion, Instant lastUpdated) {}
}
