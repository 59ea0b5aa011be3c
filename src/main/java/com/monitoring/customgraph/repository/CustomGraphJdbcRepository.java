package com.monitoring.customgraph.repository;

import com.monitoring.customgraph.domain.DomainModels.GraphDefinition;
import com.monitoring.customgraph.domain.DomainModels.GraphSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;

@Repository
public class CustomGraphJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CustomGraphJdbcRepository.class);

    private static final RowMapper<GraphDefinition> GRAPH_MAPPER = (rs, n) -> new GraphDefinition(
            rs.getInt("graph_id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("owner_user_id"),
            rs.getInt("group_id"),
            rs.getBoolean("is_private"));

    private static final RowMapper<GraphSource> SOURCE_MAPPER = (rs, n) -> new GraphSource(
            rs.getInt("source_id"),
            rs.getInt("graph_id"),
            rs.getInt("module_id"),
            rs.getDouble("weight"));

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public CustomGraphJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * Lists every graph definition ordered by name.
     *
     * @return the catalog, or an empty Optional when the store cannot be read. An empty list means
     * the catalog holds no graphs.
     */
    public Optional<List<GraphDefinition>> findAllGraphsOrderedByName() {
        try {
            return Optional.of(jdbcTemplate.query(
                    "SELECT graph_id, name, description, owner_user_id, group_id, is_private FROM custom_graph ORDER BY name, graph_id",
                    GRAPH_MAPPER));
        } catch (DataAccessException e) {
            log.warn("Custom graph catalog unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public List<GraphSource> findSources(int graphId) {
        return jdbcTemplate.query(
                "SELECT source_id, graph_id, module_id, weight FROM custom_graph_source WHERE graph_id = ? ORDER BY source_id",
                SOURCE_MAPPER,
                graphId);
    }

    public int countSources(int graphId) {
        Integer value = jdbcTemplate.queryForObject(
                "SELECT COUNT(source_id) FROM custom_graph_source WHERE graph_id = ?",
                Integer.class,
                graphId);
        return value == null ? 0 : value;
    }

    public Map<Integer, Integer> countSourcesByGraph(Collection<Integer> graphIds) {
        if (graphIds.isEmpty()) return Map.of();

        Map<Integer, Integer> counts = new HashMap<>();
        namedJdbcTemplate.query(
                "SELECT graph_id, COUNT(source_id) FROM custom_graph_source WHERE graph_id IN (:ids) GROUP BY graph_id",
                new MapSqlParameterSource("ids", graphIds),
                rs -> {
                    counts.put(rs.getInt(1), rs.getInt(2));
                });
        return counts;
    }
}
