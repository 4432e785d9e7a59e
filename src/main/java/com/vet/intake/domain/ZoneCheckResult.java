package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of checking one address against the practice's service zones.
 * {@code zoneId} and {@code zoneName} are only known for serviced addresses, and only
 * when the backend reported them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ZoneCheckResult(ZoneStatus status, String zoneId, String zoneName) {

    public ZoneCheckResult {
        if (status == null) throw new IllegalArgumentException("zone status is required");
        if (status != ZoneStatus.SERVICED) {
            zoneId = null;
            zoneName = null;
        }
    }

    public static ZoneCheckResult serviced(String zoneId, String zoneName) {
        return new ZoneCheckResult(ZoneStatus.SERVICED, zoneId, zoneName);
    }

    public static ZoneCheckResult notServiced() {
        return new ZoneCheckResult(ZoneStatus.NOT_SERVICED, null, null);
    }

    public static ZoneCheckResult inconclusive() {
        return new ZoneCheckResult(ZoneStatus.INCONCLUSIVE, null, null);
    }

    /** Address on file for an existing holder; validated when the account was opened. */
    public static ZoneCheckResult onFile() {
        return new ZoneCheckResult(ZoneStatus.SERVICED, null, null);
    }

    public boolean blocksSearch() {
        return status.blocksSearch();
    }
}
