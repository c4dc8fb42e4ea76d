package com.ora.personalization.taxonomy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ora.personalization.repository.InterestJdbcRepository;
import com.ora.personalization.taxonomy.TaxonomyModels.CreateInterestRequest;
import com.ora.personalization.taxonomy.TaxonomyModels.SeedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Loads the base interest taxonomy shipped on the classpath. Re-running it only creates
 * the nodes that are still missing.
 */
@Service
public class TaxonomySeedService {
    private static final Logger log = LoggerFactory.getLogger(TaxonomySeedService.class);
    static final String SEED_LOCATION = "seed/interest-taxonomy.json";

    private final TaxonomyService taxonomyService;
    private final InterestJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public TaxonomySeedService(TaxonomyService taxonomyService, InterestJdbcRepository repository, ObjectMapper objectMapper) {
        this.taxonomyService = taxonomyService;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public SeedResult seedBaseTaxonomy() {
        return seed(loadSeed());
    }

    SeedResult seed(List<CreateInterestRequest> entries) {
        int created = 0;
        int skipped = 0;
        for (CreateInterestRequest entry : parentsFirst(entries)) {
            if (entry.id() != null && repository.findById(entry.id()).isPresent()) {
                skipped++;
                continue;
            }
            if (taxonomyService.findSibling(entry.parentId(), entry.name()).isPresent()) {
                skipped++;
                continue;
            }
            taxonomyService.createInterest(entry);
            created++;
        }
        log.info("Seeded base taxonomy: {} created, {} skipped", created, skipped);
        return new SeedResult(created, skipped);
    }

    private List<CreateInterestRequest> loadSeed() {
        try (InputStream in = new ClassPathResource(SEED_LOCATION).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<CreateInterestRequest>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SEED_LOCATION, e);
        }
    }

    private List<CreateInterestRequest> parentsFirst(List<CreateInterestRequest> entries) {
        Map<String, CreateInterestRequest> byId = new LinkedHashMap<>();
        entries.forEach(e -> byId.put(e.id(), e));
        List<CreateInterestRequest> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        for (CreateInterestRequest entry : entries) {
            place(entry, byId, placed, ordered, 0);
        }
        return ordered;
    }

    private void place(CreateInterestRequest entry, Map<String, CreateInterestRequest> byId, Set<String> placed,
                       List<CreateInterestRequest> ordered, int depth) {
        if (placed.contains(entry.id()) || depth > byId.size()) return;
        CreateInterestRequest parent = entry.parentId() == null ? null : byId.get(entry.parentId());
        if (parent != null) place(parent, byId, placed, ordered, depth + 1);
        placed.add(entry.id());
        ordered.add(entry);
    }
}
