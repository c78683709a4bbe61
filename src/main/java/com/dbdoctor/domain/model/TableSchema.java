package com.dbdoctor.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the structural fields of one table, resolved from the schema catalog.
 */
public record TableSchema(
    String name,
    Optional<String> softDeleteField,
    Optional<String> timestampField,
    Optional<String> creatorField,
    Optional<String> typeField,
    Optional<List<String>> labelFields,
    Optional<String> languageField,
    Optional<String> translationParentField,
    Optional<String> translationSourceField,
    Optional<String> workspaceField
) {

    public boolean isWorkspaceEnabled() {
        return workspaceField.isPresent();
    }

    public boolean isLanguageAware() {
        return languageField.isPresent() && translationParentField.isPresent();
    }
}
