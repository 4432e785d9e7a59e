package com.vet.intake.controller;

import com.vet.intake.domain.AppointmentCategory;
import com.vet.intake.domain.CatalogRef;
import com.vet.intake.service.AppointmentCategoryService;
import com.vet.intake.service.CatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/intake/catalog")
public class CatalogController {

    private final CatalogService catalog;
    private final AppointmentCategoryService categories;

    public CatalogController(CatalogService catalog, AppointmentCategoryService categories) {
        this.catalog = catalog;
        this.categories = categories;
    }

    @GetMapping("/species")
    public List<CatalogRef> species() {
        return catalog.listSpecies();
    }

    @GetMapping("/breeds")
    public List<CatalogRef> breeds(@RequestParam(name = "speciesId", required = false) String speciesId) {
        return catalog.listBreeds(speciesId);
    }

    @GetMapping("/appointment-categories")
    public List<AppointmentCategory> appointmentCategories(
            @RequestParam(name = "authenticated", defaultValue = "false") boolean authenticated,
            @RequestParam(name = "newClient", defaultValue = "false") boolean newClient) {
        return categories.listForForm(authenticated, newClient);
    }
}
