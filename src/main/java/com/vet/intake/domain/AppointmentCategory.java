package com.vet.intake.domain;

/** An appointment type the practice lets requesters pick on the form. */
public record AppointmentCategory(String id, String name, String prettyName, boolean newPatientAllowed) {

    public String displayName() {
        return prettyName != null ? prettyName : name;
    }
}
