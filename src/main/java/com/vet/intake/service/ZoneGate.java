package com.vet.intake.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.ZoneCheckResult;
import com.vet.intake.integration.SchedulingBackendClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

/**
 * Checks an address against the practice's service zones.
 *
 * <p>Only a 404 from the zone lookup means "not serviced". Every other failure is
 * inconclusive and lets the flow continue; a requester is never turned away because
 * the lookup itself broke.
 */
@Service
public class ZoneGate {

    private static final Logger log = LoggerFactory.getLogger(ZoneGate.class);

    private final SchedulingBackendClient backend;

    public ZoneGate(SchedulingBackendClient backend) {
        this.backend = backend;
    }

    /**
     * New requesters are always checked. Existing holders are checked only when they
     * entered a new address; the one on file was validated at onboarding.
     */
    public boolean requiresCheck(Requester requester) {
        return !requester.keepsAddressOnFile();
    }

    public ZoneCheckResult check(PostalAddress address) {
        if (address == null || !address.isComplete()) {
            log.debug("Zone check skipped: address incomplete");
            return ZoneCheckResult.inconclusive();
        }
        String line = address.toSingleLine();
        try {
            ResponseEntity<JsonNode> response = backend.findZone(line);
            JsonNode body = response.getBody();
            String zoneId = text(body, "zoneId", "id");
            String zoneName = text(body, "zoneName", "name");
            log.info("Address serviced, zone={}", StringUtils.defaultString(zoneName, zoneId));
            return ZoneCheckResult.serviced(zoneId, zoneName);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Address outside service zones");
            return ZoneCheckResult.notServiced();
        } catch (RestClientException e) {
            log.warn("Zone lookup failed, continuing without a zone: {}", e.getMessage());
            return ZoneCheckResult.inconclusive();
        }
    }

    private static String text(JsonNode body, String... fields) {
        if (body == null || !body.isObject()) return null;
        for (String field : fields) {
            JsonNode node = body.get(field);
            if (node != null && !node.isNull() && StringUtils.isNotBlank(node.asText())) {
                return node.asText();
            }
        }
        return null;
    }
}
