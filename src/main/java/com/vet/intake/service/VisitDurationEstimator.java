package com.vet.intake.service;

import com.vet.intake.config.IntakeProperties;
import com.vet.intake.domain.Household;
import org.springframework.stereotype.Component;

/**
 * Visit length requested from the slot search: the base visit for the first selected
 * animal plus a fixed increment for each additional one.
 */
@Component
public class VisitDurationEstimator {

    private final IntakeProperties properties;

    public VisitDurationEstimator(IntakeProperties properties) {
        this.properties = properties;
    }

    public int estimateMinutes(Household household) {
        return estimateMinutes(household == null ? 0 : household.selectedAnimals().size());
    }

    public int estimateMinutes(int selectedAnimals) {
        IntakeProperties.Visit visit = properties.getVisit();
        if (selectedAnimals <= 1) {
            return visit.getBaseMinutes();
        }
        return visit.getBaseMinutes() + (selectedAnimals - 1) * visit.getPerAdditionalAnimalMinutes();
    }
}
