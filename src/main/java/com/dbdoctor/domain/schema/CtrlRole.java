package com.dbdoctor.domain.schema;

/**
 * Structural roles a table can declare in the "ctrl" section of its catalog entry.
 * Callers ask for a role, never for a raw ctrl key.
 */
public enum CtrlRole {
    SOFT_DELETE("delete"),
    TIMESTAMP("tstamp"),
    CREATOR("cruser_id"),
    LANGUAGE("languageField"),
    TRANSLATION_PARENT("transOrigPointerField"),
    TRANSLATION_SOURCE("translationSource"),
    WORKSPACE("versioningWS"),
    TYPE("type"),
    LABEL("label"),
    LABEL_ALT("label_alt");

    private final String ctrlKey;

    CtrlRole(String ctrlKey) {
        this.ctrlKey = ctrlKey;
    }

    public String ctrlKey() {
        return ctrlKey;
    }
}
