package com.vet.intake.domain;

/**
 * The answers a slot search was run with. An offer only belongs to a submission whose
 * answers produce the same inputs.
 *
 * <p>{@code addressKey} is {@link PostalAddress#key()}; {@code preferredDoctor} is null
 * when any doctor will do.
 */
public record SearchInputs(int windowStartDays, int windowEndDays, int serviceMinutes,
                           String addressKey, String preferredDoctor) {

    public SearchInputs {
        if (serviceMinutes <= 0) throw new IllegalArgumentException("service minutes must be positive");
    }
}
