package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.Provider;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.integration.SchedulingBackendClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Veterinarians serving an address.
 *
 * <p>New requesters only see providers taking new patients in their zone. A provider
 * whose listing carries no new-patient or zone information is kept.
 */
@Service
public class ProviderDirectory {

    private static final Logger log = LoggerFactory.getLogger(ProviderDirectory.class);

    private final SchedulingBackendClient backend;
    private final IntakeProperties properties;

    public ProviderDirectory(SchedulingBackendClient backend, IntakeProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    public List<Provider> listFor(Requester requester, ZoneCheckResult zone) {
        String address = requester.physicalAddress() != null && requester.physicalAddress().isComplete()
                ? requester.physicalAddress().toSingleLine() : null;
        JsonNode raw = backend.listVeterinarians(properties.getPracticeId(), address);

        List<Provider> providers = new ArrayList<>();
        for (JsonNode entry : entries(raw)) {
            if (!requester.isExisting() && !acceptsNewPatients(entry, zone)) {
                log.debug("Provider {} not taking new patients here", entry.path("id").asText());
                continue;
            }
            providers.add(toProvider(entry));
        }
        log.info("{} providers available for {} requester", providers.size(), requester.accountStatus().wire());
        return providers;
    }

    /**
     * Finds the provider the requester named, by id or display name. Empty when the
     * requester has no preference or the named provider is not in {@code providers}.
     */
    public static Optional<Provider> resolvePreferred(String preferredDoctor, List<Provider> providers) {
        if (isNoPreference(preferredDoctor)) {
            return Optional.empty();
        }
        String wanted = preferredDoctor.trim();
        return providers.stream()
                .filter(p -> wanted.equals(p.id()) || wanted.equalsIgnoreCase(p.name()))
                .findFirst();
    }

    public static boolean isNoPreference(String preferredDoctor) {
        return StringUtils.isBlank(preferredDoctor) || Provider.NO_PREFERENCE.equalsIgnoreCase(preferredDoctor.trim());
    }

    private static List<JsonNode> entries(JsonNode raw) {
        List<JsonNode> entries = new ArrayList<>();
        if (raw == null) return entries;
        JsonNode list = raw.isArray() ? raw : raw.has("items") ? raw.get("items") : raw.path("veterinarians");
        if (list.isArray()) {
            list.forEach(entries::add);
        }
        return entries;
    }

    private static boolean acceptsNewPatients(JsonNode entry, ZoneCheckResult zone) {
        JsonNode zones = entry.path("zones");
        String zoneId = zone == null ? null : zone.zoneId();
        if (zoneId != null && zones.isArray() && zones.size() > 0) {
            for (JsonNode z : zones) {
                if (zoneId.equals(z.path("zoneId").asText())) {
                    return z.path("acceptingNewPatients").asBoolean(true);
                }
            }
            return false;
        }
        JsonNode flag = entry.get("acceptingNewPatients");
        return flag == null || flag.isNull() || flag.asBoolean();
    }

    static Provider toProvider(JsonNode v) {
        String id = firstText(v, "id", "pimsId", "employeeId");
        List<String> parts = new ArrayList<>();
        for (String field : new String[]{"title", "firstName", "lastName", "designation"}) {
            String part = firstText(v, field);
            if (part != null) parts.add(part);
        }
        String name = parts.isEmpty()
                ? StringUtils.defaultIfBlank(firstText(v, "name"), "Veterinarian " + StringUtils.defaultString(id)).trim()
                : String.join(" ", parts);
        return new Provider(id, name, firstText(v, "email"));
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && StringUtils.isNotBlank(value.asText())) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
