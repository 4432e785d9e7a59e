package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A veterinarian the requester can ask for. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provider(String id, String name, String email) {

    public static final String NO_PREFERENCE = "I have no preference";
}
