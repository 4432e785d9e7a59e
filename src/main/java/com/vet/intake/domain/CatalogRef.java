package com.vet.intake.domain;

/** Species or breed reference: catalog id plus display name. */
public record CatalogRef(String id, String name) {
}
