package com.vedant.salesanalyst.model;

import java.util.List;

/**
 * Outcome of checking one draft against the column whitelist.
 * Errors make the draft unacceptable; notes are references that could not be checked.
 */
public record ValidationResult(List<String> errors, List<String> notes) {

    public ValidationResult {
        errors = List.copyOf(errors);
        notes = List.copyOf(notes);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
