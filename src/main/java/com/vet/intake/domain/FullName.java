package com.vet.intake.domain;

import org.apache.commons.lang3.StringUtils;

public record FullName(String first, String last, String middle, String prefix, String suffix) {

    public FullName {
        first = StringUtils.trimToEmpty(first);
        last = StringUtils.trimToEmpty(last);
        middle = StringUtils.trimToNull(middle);
        prefix = StringUtils.trimToNull(prefix);
        suffix = StringUtils.trimToNull(suffix);
    }

    public static FullName of(String first, String last) {
        return new FullName(first, last, null, null, null);
    }
}
