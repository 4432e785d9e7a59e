package com.vet.intake.exception;

/**
 * A species or breed list could not be loaded or was unusable. {@code field} names the
 * form field the requester could not fill in.
 */
public class CatalogResolutionException extends RuntimeException {

    private final String field;

    public CatalogResolutionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public CatalogResolutionException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
