package com.vet.intake.domain;

import org.apache.commons.lang3.StringUtils;

/**
 * One animal's reason for this visit. The end-of-life questionnaire is carried by, and
 * only by, {@link NeedCategory#END_OF_LIFE} needs.
 */
public record Need(NeedCategory category, String details, EndOfLifeQuestionnaire endOfLife) {

    public Need {
        if (category == null) throw new IllegalArgumentException("need category is required");
        details = StringUtils.trimToNull(details);
        if (category.detailsRequired() && details == null) {
            throw new IllegalArgumentException("'" + category.label() + "' needs a short description");
        }
        if (category == NeedCategory.END_OF_LIFE && endOfLife == null) {
            throw new IllegalArgumentException("end-of-life care requires the end-of-life questionnaire");
        }
        if (category != NeedCategory.END_OF_LIFE && endOfLife != null) {
            throw new IllegalArgumentException("end-of-life answers given for '" + category.label() + "'");
        }
    }

    public static Need of(NeedCategory category, String details) {
        return new Need(category, details, null);
    }

    public static Need endOfLife(EndOfLifeQuestionnaire questionnaire) {
        return new Need(NeedCategory.END_OF_LIFE, null, questionnaire);
    }

    public boolean concernsEndOfLife() {
        return category == NeedCategory.END_OF_LIFE;
    }
}
