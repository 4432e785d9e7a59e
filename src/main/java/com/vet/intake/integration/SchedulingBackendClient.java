package com.vet.intake.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vet.intake.config.IntakeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * The scheduling backend's public appointment API. Every remote call the engine makes
 * goes through here; callers decide how each {@code RestClientException} is handled.
 */
@Component
public class SchedulingBackendClient {

    private static final Logger log = LoggerFactory.getLogger(SchedulingBackendClient.class);

    private final RestTemplate restTemplate;

    public SchedulingBackendClient(RestTemplateBuilder builder, IntakeProperties properties) {
        IntakeProperties.Backend backend = properties.getBackend();
        this.restTemplate = builder
                .rootUri(backend.getBaseUrl())
                .setConnectTimeout(backend.getConnectTimeout())
                .setReadTimeout(backend.getReadTimeout())
                .build();
    }

    public JsonNode listSpecies(long practiceId) {
        return restTemplate.getForObject("/public/species-breeds?practiceId={practiceId}", JsonNode.class, practiceId);
    }

    public JsonNode listBreeds(long practiceId, String speciesId) {
        return restTemplate.getForObject("/public/species-breeds?practiceId={practiceId}&speciesId={speciesId}",
                JsonNode.class, practiceId, speciesId);
    }

    /** 404 surfaces as {@code HttpClientErrorException.NotFound}: the address is outside every zone. */
    public ResponseEntity<JsonNode> findZone(String address) {
        return restTemplate.getForEntity("/public/appointments/find-zone-by-address?address={address}",
                JsonNode.class, address);
    }

    public JsonNode listVeterinarians(long practiceId, String address) {
        if (address == null) {
            return restTemplate.getForObject("/public/appointments/veterinarians?practiceId={practiceId}",
                    JsonNode.class, practiceId);
        }
        return restTemplate.getForObject("/public/appointments/veterinarians?practiceId={practiceId}&address={address}",
                JsonNode.class, practiceId, address);
    }

    public JsonNode searchAvailability(AvailabilitySearch search) {
        log.info("Searching availability from {} for {} days, {} min", search.startDate(), search.numDays(),
                search.serviceMinutes());
        return restTemplate.postForObject("/public/appointments/availability", json(search), JsonNode.class);
    }

    public JsonNode listAppointmentTypes(long practiceId, boolean authenticated) {
        String path = authenticated ? "/appointment-types?practiceId={practiceId}"
                : "/public/appointment-types?practiceId={practiceId}";
        return restTemplate.getForObject(path, JsonNode.class, practiceId);
    }

    public JsonNode submitForm(ObjectNode payload) {
        return restTemplate.postForObject("/public/appointments/form", json(payload), JsonNode.class);
    }

    private static <T> HttpEntity<T> json(T body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }
}
