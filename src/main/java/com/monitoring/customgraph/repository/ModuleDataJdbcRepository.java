package com.monitoring.customgraph.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class ModuleDataJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public ModuleDataJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    public List<ModuleSample> loadSamples(int moduleId, long fromEpochSecond, long toEpochSecond) {
        return jdbcTemplate.query(
                "SELECT module_id, utimestamp, data_value FROM module_data WHERE module_id = ? AND utimestamp >= ? AND utimestamp <= ? ORDER BY utimestamp",
                (rs, n) -> new ModuleSample(rs.getInt(1), rs.getLong(2), rs.getDouble(3)),
                moduleId, fromEpochSecond, toEpochSecond);
    }

    public Map<Integer, String> loadModuleNames(Collection<Integer> moduleIds) {
        if (moduleIds.isEmpty()) return Map.of();

        Map<Integer, String> names = new HashMap<>();
        namedJdbcTemplate.query(
                "SELECT module_id, name FROM agent_module WHERE module_id IN (:ids)",
                new MapSqlParameterSource("ids", moduleIds),
                rs -> {
                    names.put(rs.getInt(1), rs.getString(2));
                });
        return names;
    }

    public record ModuleSample(int moduleId, long timestamp, double value) {}
}
