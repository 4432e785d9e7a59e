package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.AppointmentCategory;
import com.vet.intake.integration.SchedulingBackendClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AppointmentCategoryService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentCategoryService.class);

    private final SchedulingBackendClient backend;
    private final IntakeProperties properties;

    public AppointmentCategoryService(SchedulingBackendClient backend, IntakeProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    /**
     * Categories shown on the request form: active, not deleted, flagged for the form,
     * and for new clients only those open to new patients.
     */
    public List<AppointmentCategory> listForForm(boolean authenticated, boolean newClient) {
        JsonNode raw = backend.listAppointmentTypes(properties.getPracticeId(), authenticated);
        JsonNode list = raw != null && raw.isArray() ? raw : raw == null ? null : raw.get("items");
        List<AppointmentCategory> categories = new ArrayList<>();
        if (list == null || !list.isArray()) {
            log.warn("Appointment types response was not a list");
            return categories;
        }
        for (JsonNode t : list) {
            if (!t.path("showInApptRequestForm").asBoolean(false)) continue;
            if (!t.path("isActive").asBoolean(true) || t.path("isDeleted").asBoolean(false)) continue;
            boolean newPatientAllowed = t.path("newPatientAllowed").asBoolean(false);
            if (newClient && !newPatientAllowed) continue;
            String id = t.path("id").asText(null);
            String name = t.path("name").asText(null);
            if (StringUtils.isBlank(id)) continue;
            categories.add(new AppointmentCategory(id, name, StringUtils.trimToNull(t.path("prettyName").asText(null)),
                    newPatientAllowed));
        }
        return categories;
    }
}
