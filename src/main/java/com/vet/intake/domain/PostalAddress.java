package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A postal address as entered on the intake form.
 */
public record PostalAddress(String line1, String line2, String city, String state, String zip, String country) {

    private static final String DEFAULT_COUNTRY = "US";

    public PostalAddress {
        line1 = StringUtils.trimToEmpty(line1);
        line2 = StringUtils.trimToNull(line2);
        city = StringUtils.trimToEmpty(city);
        state = StringUtils.trimToEmpty(state);
        zip = StringUtils.trimToEmpty(zip);
        country = StringUtils.defaultIfBlank(StringUtils.trim(country), DEFAULT_COUNTRY);
    }

    public static PostalAddress of(String line1, String city, String state, String zip) {
        return new PostalAddress(line1, null, city, state, zip, null);
    }

    /** Street, city, state and zip are all filled in. */
    @JsonIgnore
    public boolean isComplete() {
        return StringUtils.isNoneBlank(line1, city, state, zip);
    }

    /** "24 Orchard Ln, Durham, ME, 04111" - the form sent to geocoding and slot search. */
    public String toSingleLine() {
        return Stream.of(line1, city, state, zip)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.joining(", "));
    }

    /** Case and whitespace insensitive identity used to cache zone results. */
    public String key() {
        return Stream.of(line1, line2, city, state, zip, country)
                .map(StringUtils::normalizeSpace)
                .map(s -> StringUtils.defaultString(s).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("|"));
    }
}
