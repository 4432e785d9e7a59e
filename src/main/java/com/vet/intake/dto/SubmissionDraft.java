package com.vet.intake.dto;

import com.vet.intake.domain.SlotSelection;
import com.vet.intake.domain.SupplementalAnswers;

public record SubmissionDraft(IntakeDraft intake, SlotSelection selection, SupplementalAnswers supplemental) {

    public SubmissionDraft {
        if (intake == null) throw new IllegalArgumentException("intake answers are required");
        if (selection == null) selection = SlotSelection.none();
        if (supplemental == null) supplemental = SupplementalAnswers.empty();
    }
}
