package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vet.intake.domain.CatalogRef;
import com.vet.intake.exception.CatalogResolutionException;
import com.vet.intake.integration.SchedulingBackendClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Species and breed pick lists. An empty or unreadable list is an error naming the form
 * field that cannot be filled, never an empty list the requester has to guess around.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    public static final String SPECIES_FIELD = "species";
    public static final String BREED_FIELD = "breed";

    private final SchedulingBackendClient backend;
    private final long practiceId;

    public CatalogService(SchedulingBackendClient backend, @Value("${intake.practice-id:1}") long practiceId) {
        this.backend = backend;
        this.practiceId = practiceId;
    }

    public List<CatalogRef> listSpecies() {
        JsonNode raw;
        try {
            raw = backend.listSpecies(practiceId);
        } catch (RestClientException e) {
            throw new CatalogResolutionException(SPECIES_FIELD, "We couldn't load the species list. Please try again.", e);
        }
        return parse(raw, SPECIES_FIELD, "species");
    }

    /** Breeds only make sense once a species has been picked. */
    public List<CatalogRef> listBreeds(String speciesId) {
        if (StringUtils.isBlank(speciesId)) {
            throw new IllegalArgumentException("Please choose a species before choosing a breed");
        }
        JsonNode raw;
        try {
            raw = backend.listBreeds(practiceId, speciesId);
        } catch (RestClientException e) {
            throw new CatalogResolutionException(BREED_FIELD, "We couldn't load breeds for that species. Please try again.", e);
        }
        return parse(raw, BREED_FIELD, "breeds");
    }

    private List<CatalogRef> parse(JsonNode raw, String field, String wrapper) {
        JsonNode list = raw != null && raw.isArray() ? raw : raw == null ? null : raw.get(wrapper);
        if (list == null || !list.isArray() || list.isEmpty()) {
            log.warn("Empty or malformed {} catalog", field);
            throw new CatalogResolutionException(field, "No " + field + " options are available right now.");
        }
        List<CatalogRef> refs = new ArrayList<>();
        for (JsonNode entry : list) {
            String id = entry.path("id").asText(null);
            String name = entry.path("name").asText(null);
            if (StringUtils.isAnyBlank(id, name)) {
                log.warn("Skipping {} catalog entry without id or name: {}", field, entry);
                continue;
            }
            refs.add(new CatalogRef(id, name.trim()));
        }
        if (refs.isEmpty()) {
            throw new CatalogResolutionException(field, "No " + field + " options are available right now.");
        }
        return refs;
    }
}
