package com.pricewatch.tracker.harvest.api;

import com.pricewatch.tracker.harvest.history.PeriodStore;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import com.pricewatch.tracker.harvest.persistence.ProductRecordRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/products")
public class ProductController {
    private static final int SEARCH_LIMIT = 20;

    private final ProductRecordRepository repository;
    private final PeriodStore periodStore;

    public ProductController(ProductRecordRepository repository, PeriodStore periodStore) {
        this.repository = repository;
        this.periodStore = periodStore;
    }

    @GetMapping
    public List<ProductRecord> search(@RequestParam(name = "q", required = false, defaultValue = "") String query) {
        return repository.search(query, SEARCH_LIMIT);
    }

    @GetMapping("/{identifier}")
    public ProductRecord product(@PathVariable("identifier") String identifier) {
        ProductRecord record = periodStore.load(identifier);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown product " + identifier);
        }
        return record;
    }
}
