package com.pricewatch.tracker.harvest.api;

import com.pricewatch.tracker.harvest.model.ProductRecord;
import com.pricewatch.tracker.harvest.persistence.ProductRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ProductControllerTest {

    @Autowired
    private ProductController controller;

    @Autowired
    private ProductRecordRepository repository;

    @Test
    void searchIsCappedAtTwenty() {
        String marker = "Kenyer" + UUID.randomUUID().toString().substring(0, 6);
        for (int i = 0; i < 25; i++) {
            repository.save(ProductRecord.newRecord("K" + marker + i)
                .withStatic(marker + " " + i, "db", null, null, null, Instant.now()));
        }

        List<ProductRecord> results = controller.search(marker);

        assertEquals(20, results.size());
        assertTrue(controller.search("").isEmpty());
    }

    @Test
    void detailReturnsRecordOr404() {
        String identifier = "D" + UUID.randomUUID().toString().substring(0, 8);
        repository.save(ProductRecord.newRecord(identifier).withStatic("Vaj", "kg", null, null, null, Instant.now()));

        assertEquals("Vaj", controller.product(identifier).name());
        ResponseStatusException missing = assertThrows(
            ResponseStatusException.class,
            () -> controller.product("missing-" + identifier)
        );
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }
}
