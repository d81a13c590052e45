package com.pricewatch.tracker.harvest.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.tracker.harvest.model.RunState;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Repository
public class RunStateRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public RunStateRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcDialects.isPostgres(jdbc);
    }

    public RunState find(LocalDate runDate) {
        List<String> documents;
        try {
            documents = jdbc.query(
                "SELECT document FROM run_states WHERE run_date = :runDate",
                new MapSqlParameterSource().addValue("runDate", Date.valueOf(runDate)),
                (rs, rowNum) -> rs.getString("document")
            );
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to load run state for " + runDate, e);
        }
        if (documents.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(documents.get(0), RunState.class);
        } catch (JsonProcessingException e) {
            throw new RecordPersistenceException("Unreadable run state for " + runDate, e);
        }
    }

    public void save(RunState state) {
        String document;
        try {
            document = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new RecordPersistenceException("Failed to serialize run state for " + state.runDate(), e);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runDate", Date.valueOf(state.runDate()))
            .addValue("runId", state.runId())
            .addValue("completed", state.completed())
            .addValue("document", document)
            .addValue("updatedAt", Timestamp.from(Instant.now()));
        try {
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO run_states (run_date, run_id, completed, document, updated_at)
                        VALUES (:runDate, :runId, :completed, :document, :updatedAt)
                        ON CONFLICT (run_date)
                        DO UPDATE SET
                            run_id = EXCLUDED.run_id,
                            completed = EXCLUDED.completed,
                            document = EXCLUDED.document,
                            updated_at = EXCLUDED.updated_at
                        """,
                    params
                );
                return;
            }
            jdbc.update(
                """
                    MERGE INTO run_states (run_date, run_id, completed, document, updated_at)
                    KEY(run_date)
                    VALUES (:runDate, :runId, :completed, :document, :updatedAt)
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to save run state for " + state.runDate(), e);
        }
    }
}
