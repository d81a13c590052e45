package com.pricewatch.tracker.harvest.persistence;

import com.pricewatch.tracker.config.HarvestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductRecordRepositoryFailureTest {

    @Mock
    private DataSource dataSource;

    private ProductRecordRepository repository;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
        repository = new ProductRecordRepository(
            new NamedParameterJdbcTemplate(new JdbcTemplate(dataSource)),
            HarvestConfig.buildObjectMapper()
        );
    }

    @Test
    void searchWrapsDatabaseFailures() {
        RecordPersistenceException failure = assertThrows(
            RecordPersistenceException.class,
            () -> repository.search("tej", 20)
        );

        assertThat(failure).hasCauseInstanceOf(DataAccessException.class);
    }

    @Test
    void findWrapsDatabaseFailures() {
        assertThrows(RecordPersistenceException.class, () -> repository.find("2004120000009"));
    }
}
