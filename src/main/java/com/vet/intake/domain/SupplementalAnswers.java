package com.vet.intake.domain;

import org.apache.commons.lang3.StringUtils;

public record SupplementalAnswers(
        String previousVeterinaryPractices,
        String okayToContactPreviousVets,
        String otherPersonsOnAccount,
        String condoApartmentInfo,
        String howDidYouHearAboutUs,
        String anythingElse
) {

    public SupplementalAnswers {
        previousVeterinaryPractices = StringUtils.trimToNull(previousVeterinaryPractices);
        okayToContactPreviousVets = StringUtils.trimToNull(okayToContactPreviousVets);
        otherPersonsOnAccount = StringUtils.trimToNull(otherPersonsOnAccount);
        condoApartmentInfo = StringUtils.trimToNull(condoApartmentInfo);
        howDidYouHearAboutUs = StringUtils.trimToNull(howDidYouHearAboutUs);
        anythingElse = StringUtils.trimToNull(anythingElse);
    }

    public static SupplementalAnswers empty() {
        return new SupplementalAnswers(null, null, null, null, null, null);
    }
}
