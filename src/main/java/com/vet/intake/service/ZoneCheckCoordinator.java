package com.vet.intake.service;

import com.vet.intake.component.DebouncedLookup;
import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.PostalAddress;
import com.vet.intake.domain.Requester;
import com.vet.intake.domain.ZoneCheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides when an address edit turns into a zone lookup.
 *
 * <p>Lookups are debounced per session, so a requester typing an address produces one
 * lookup for the address they settled on. A definitive result is cached in the session
 * and the same address is never looked up twice.
 */
@Service
public class ZoneCheckCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ZoneCheckCoordinator.class);

    public enum Trigger {
        NOT_REQUIRED,
        INCOMPLETE,
        CACHED,
        SCHEDULED
    }

    private final ZoneGate zoneGate;
    private final IntakeSessionService sessions;
    private final DebouncedLookup lookup;
    private final IntakeProperties properties;

    public ZoneCheckCoordinator(ZoneGate zoneGate, IntakeSessionService sessions,
                                DebouncedLookup lookup, IntakeProperties properties) {
        this.zoneGate = zoneGate;
        this.sessions = sessions;
        this.lookup = lookup;
        this.properties = properties;
    }

    public Trigger onAddressEdited(String sessionId, Requester requester) {
        sessions.get(sessionId);
        String key = key(sessionId);
        if (!zoneGate.requiresCheck(requester)) {
            lookup.cancel(key);
            return Trigger.NOT_REQUIRED;
        }
        PostalAddress address = requester.physicalAddress();
        if (address == null || !address.isComplete()) {
            lookup.cancel(key);
            return Trigger.INCOMPLETE;
        }
        if (sessions.findZoneResult(sessionId, address).isPresent()) {
            lookup.cancel(key);
            return Trigger.CACHED;
        }
        lookup.submit(key, properties.getZone().getQuietPeriod(),
                () -> zoneGate.check(address),
                result -> sessions.recordZoneResult(sessionId, address, result));
        log.debug("[{}] Zone check scheduled", sessionId);
        return Trigger.SCHEDULED;
    }

    /**
     * The zone result to search with, looked up now if nothing usable is cached. A pending
     * debounced lookup is superseded by this one.
     */
    public ZoneCheckResult resolveNow(String sessionId, Requester requester) {
        if (!zoneGate.requiresCheck(requester)) {
            return ZoneCheckResult.onFile();
        }
        PostalAddress address = requester.physicalAddress();
        Optional<ZoneCheckResult> cached = sessions.findZoneResult(sessionId, address);
        if (cached.isPresent()) {
            return cached.get();
        }
        lookup.cancel(key(sessionId));
        ZoneCheckResult result = zoneGate.check(address);
        sessions.recordZoneResult(sessionId, address, result);
        return result;
    }

    static String key(String sessionId) {
        return "zone:" + sessionId;
    }
}
