package com.pricewatch.tracker.harvest.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Repository
public class ProductRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(ProductRecordRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public ProductRecordRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcDialects.isPostgres(jdbc);
    }

    public ProductRecord find(String identifier) {
        List<String> documents;
        try {
            documents = jdbc.query(
                "SELECT document FROM product_records WHERE identifier = :identifier",
                new MapSqlParameterSource().addValue("identifier", identifier),
                (rs, rowNum) -> rs.getString("document")
            );
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to load product " + identifier, e);
        }
        if (documents.isEmpty()) {
            return null;
        }
        return readDocument(identifier, documents.get(0));
    }

    public boolean exists(String identifier) {
        try {
            Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM product_records WHERE identifier = :identifier",
                new MapSqlParameterSource().addValue("identifier", identifier),
                Integer.class
            );
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to check product " + identifier, e);
        }
    }

    public void save(ProductRecord record) {
        String document;
        try {
            document = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordPersistenceException("Failed to serialize product " + record.identifier(), e);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("identifier", record.identifier())
            .addValue("name", truncate(record.name(), 512))
            .addValue("schemaVersion", record.schemaVersion())
            .addValue("document", document)
            .addValue("lastPriceCheck", toTimestamp(record.lastPriceCheck()))
            .addValue("updatedAt", toTimestamp(Instant.now()));
        try {
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO product_records (
                            identifier, name, schema_version, document, last_price_check, updated_at
                        )
                        VALUES (:identifier, :name, :schemaVersion, :document, :lastPriceCheck, :updatedAt)
                        ON CONFLICT (identifier)
                        DO UPDATE SET
                            name = EXCLUDED.name,
                            schema_version = EXCLUDED.schema_version,
                            document = EXCLUDED.document,
                            last_price_check = EXCLUDED.last_price_check,
                            updated_at = EXCLUDED.updated_at
                        """,
                    params
                );
                return;
            }
            jdbc.update(
                """
                    MERGE INTO product_records (
                        identifier, name, schema_version, document, last_price_check, updated_at
                    )
                    KEY(identifier)
                    VALUES (:identifier, :name, :schemaVersion, :document, :lastPriceCheck, :updatedAt)
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to save product " + record.identifier(), e);
        }
    }

    public List<ProductRecord> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int safeLimit = Math.max(1, Math.min(limit, 100));
        String pattern = "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        List<String[]> rows;
        try {
            rows = jdbc.query(
                """
                    SELECT identifier, document
                    FROM product_records
                    WHERE LOWER(name) LIKE :pattern
                       OR LOWER(identifier) LIKE :pattern
                    ORDER BY name, identifier
                    LIMIT :limit
                    """,
                new MapSqlParameterSource()
                    .addValue("pattern", pattern)
                    .addValue("limit", safeLimit),
                (rs, rowNum) -> new String[] {rs.getString("identifier"), rs.getString("document")}
            );
        } catch (DataAccessException e) {
            throw new RecordPersistenceException("Failed to search products for '" + query + "'", e);
        }
        List<ProductRecord> results = new ArrayList<>();
        for (String[] row : rows) {
            try {
                results.add(readDocument(row[0], row[1]));
            } catch (RecordPersistenceException e) {
                log.warn("Skipping unreadable product document {}", row[0], e);
            }
        }
        return results;
    }

    private ProductRecord readDocument(String identifier, String document) {
        try {
            return objectMapper.readValue(document, ProductRecord.class);
        } catch (JsonProcessingException e) {
            throw new RecordPersistenceException("Unreadable product document " + identifier, e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
