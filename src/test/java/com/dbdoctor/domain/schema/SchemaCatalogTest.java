package com.dbdoctor.domain.schema;

import com.dbdoctor.domain.model.TableSchema;
import com.dbdoctor.infrastructure.exception.SchemaIncompleteException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaCatalog")
class SchemaCatalogTest {

    private static SchemaCatalog catalogOf(Object... tablesAndCtrls) {
        Map<String, Map<String, Object>> tables = new LinkedHashMap<>();
        for (int i = 0; i < tablesAndCtrls.length; i += 2) {
            @SuppressWarnings("unchecked")
            Map<String, Object> ctrl = (Map<String, Object>) tablesAndCtrls[i + 1];
            tables.put((String) tablesAndCtrls[i], ctrl);
        }
        return new SchemaCatalog(tables);
    }

    @Nested
    @DisplayName("table enumeration")
    class EnumerationTests {

        @Test
        @DisplayName("Should return workspace enabled tables in declaration order")
        void shouldReturnWorkspaceEnabledTables() {
            // Given
            SchemaCatalog catalog = catalogOf(
                    "workspaceEnabled1", Map.of("versioningWS", true),
                    "workspaceEnabled2", Map.of("versioningWS", 1),
                    "noWorkspace1", Map.of("versioningWS", false),
                    "noWorkspace2", Map.of("versioningWS", 0),
                    "noWorkspace3", Map.of(),
                    "noWorkspace4", Map.of("versioningWS", "0"),
                    "workspaceEnabled3", Map.of("versioningWS", true)
            );

            // When / Then
            assertEquals(List.of("workspaceEnabled1", "workspaceEnabled2", "workspaceEnabled3"),
                    catalog.workspaceEnabledTables().toList());
        }

        @Test
        @DisplayName("Should be restartable")
        void shouldBeRestartable() {
            // Given
            SchemaCatalog catalog = catalogOf("pages", Map.of("versioningWS", true));

            // When / Then
            assertEquals(catalog.workspaceEnabledTables().toList(), catalog.workspaceEnabledTables().toList());
        }

        @Test
        @DisplayName("Should return tables with language and translation parent fields")
        void shouldReturnLanguageAwareTables() {
            // Given
            SchemaCatalog catalog = catalogOf(
                    "languageAware1", Map.of("languageField", "sys_language_uid", "transOrigPointerField", "l18n_parent"),
                    "notAware1", Map.of(),
                    "notAware2", Map.of("languageField", "sys_language_uid"),
                    "notAware3", Map.of("transOrigPointerField", "l18n_parent"),
                    "languageAware2", Map.of("languageField", "sys_language_uid", "transOrigPointerField", "l18n_parent")
            );

            // When / Then
            assertEquals(List.of("languageAware1", "languageAware2"), catalog.languageAwareTables().toList());
        }
    }

    @Nested
    @DisplayName("field lookup")
    class FieldLookupTests {

        @Test
        @DisplayName("Should return the configured field name")
        void shouldReturnFieldName() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("delete", "deletedField"));

            assertEquals(Optional.of("deletedField"), catalog.roleField("foo", CtrlRole.SOFT_DELETE));
            assertEquals("deletedField", catalog.requireField("foo", CtrlRole.SOFT_DELETE));
        }

        @Test
        @DisplayName("Should return empty for unknown tables and unset roles")
        void shouldReturnEmptyWhenNotConfigured() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("delete", ""));

            assertTrue(catalog.roleField("foo", CtrlRole.SOFT_DELETE).isEmpty());
            assertTrue(catalog.roleField("foo", CtrlRole.TIMESTAMP).isEmpty());
            assertTrue(catalog.roleField("bar", CtrlRole.SOFT_DELETE).isEmpty());
        }

        @Test
        @DisplayName("Should fail with the table and role when a required field is missing")
        void shouldFailForMissingRequiredField() {
            SchemaCatalog catalog = catalogOf("foo", Map.of());

            SchemaIncompleteException e = assertThrows(SchemaIncompleteException.class,
                    () -> catalog.requireField("foo", CtrlRole.LANGUAGE));

            assertEquals("foo", e.getError().table());
            assertEquals(CtrlRole.LANGUAGE, e.getError().role());
            assertEquals("Table \"foo\" has no \"languageField\" configured in the schema catalog", e.getMessage());
        }

        @Test
        @DisplayName("Should resolve the workspace field to the workspace id column")
        void shouldResolveWorkspaceField() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("versioningWS", true), "bar", Map.of());

            assertEquals(Optional.of(SchemaCatalog.WORKSPACE_ID_FIELD), catalog.roleField("foo", CtrlRole.WORKSPACE));
            assertTrue(catalog.roleField("bar", CtrlRole.WORKSPACE).isEmpty());
        }
    }

    @Nested
    @DisplayName("labelFields")
    class LabelFieldsTests {

        @Test
        @DisplayName("Should return label followed by alternative labels")
        void shouldReturnLabelAndAlternatives() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("label", "title", "label_alt", "subtitle, nav_title,"));

            assertEquals(Optional.of(List.of("title", "subtitle", "nav_title")), catalog.labelFields("foo"));
        }

        @Test
        @DisplayName("Should return only the label without alternatives")
        void shouldReturnOnlyLabel() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("label", "title"));

            assertEquals(Optional.of(List.of("title")), catalog.labelFields("foo"));
        }

        @Test
        @DisplayName("Should return only alternatives without label")
        void shouldReturnOnlyAlternatives() {
            SchemaCatalog catalog = catalogOf("foo", Map.of("label_alt", "header"));

            assertEquals(Optional.of(List.of("header")), catalog.labelFields("foo"));
        }

        @Test
        @DisplayName("Should distinguish unconfigured labels from configured empty labels")
        void shouldDistinguishUnconfiguredFromEmpty() {
            Map<String, Object> empty = new HashMap<>();
            empty.put("label", "");
            SchemaCatalog catalog = catalogOf("foo", Map.of(), "bar", empty);

            assertTrue(catalog.labelFields("foo").isEmpty());
            assertEquals(Optional.of(List.of()), catalog.labelFields("bar"));
        }
    }

    @Test
    @DisplayName("Should resolve a full table schema")
    void shouldResolveTableSchema() {
        // Given
        SchemaCatalog catalog = catalogOf("tt_content", Map.of(
                "label", "header",
                "delete", "deleted",
                "tstamp", "tstamp",
                "languageField", "sys_language_uid",
                "transOrigPointerField", "l18n_parent",
                "versioningWS", true
        ));

        // When
        TableSchema schema = catalog.tableSchema("tt_content");

        // Then
        assertEquals("tt_content", schema.name());
        assertEquals(Optional.of("deleted"), schema.softDeleteField());
        assertEquals(Optional.of("t3ver_wsid"), schema.workspaceField());
        assertTrue(schema.translationSourceField().isEmpty());
        assertTrue(schema.isWorkspaceEnabled());
        assertTrue(schema.isLanguageAware());
    }

    @Test
    @DisplayName("Should treat false, zero, empty and null as not set")
    void shouldEvaluateTruthiness() {
        assertFalse(SchemaCatalog.isTruthy(null));
        assertFalse(SchemaCatalog.isTruthy(false));
        assertFalse(SchemaCatalog.isTruthy(0));
        assertFalse(SchemaCatalog.isTruthy(0.0));
        assertFalse(SchemaCatalog.isTruthy(""));
        assertFalse(SchemaCatalog.isTruthy("0"));
        assertTrue(SchemaCatalog.isTruthy(true));
        assertTrue(SchemaCatalog.isTruthy(1));
        assertTrue(SchemaCatalog.isTruthy("deleted"));
    }
}
