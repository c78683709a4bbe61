package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.schema.SchemaCatalog;
import com.dbdoctor.infrastructure.exception.SchemaIncompleteException;
import com.dbdoctor.integration.base.EmbeddedDatabaseTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DanglingWorkspaceRecords")
class DanglingWorkspaceRecordsTest extends EmbeddedDatabaseTestBase {

    private DanglingWorkspaceRecords check;

    @BeforeEach
    void setUp() {
        loadFixture("DanglingWorkspaceRecords");
        check = new DanglingWorkspaceRecords(support, catalog, properties);
    }

    @Nested
    @DisplayName("detect")
    class DetectTests {

        @Test
        @DisplayName("Should find records of deleted and unknown workspaces, deleted rows included")
        void shouldFindDanglingRecords() {
            // When
            FindingSet findings = check.detect();

            // Then
            assertEquals(Set.of("pages", "tt_content"), findings.tables());
            assertEquals(List.of(3, 4), findings.uids("pages"));
            assertEquals(List.of(12), findings.uids("tt_content"));
        }

        @Test
        @DisplayName("Should treat every overlay as dangling when the workspace table does not exist")
        void shouldTreatAllOverlaysAsDanglingWithoutWorkspaceTable() {
            // Given
            jdbcTemplate.execute("DROP TABLE sys_workspace");

            // When
            FindingSet findings = check.detect();

            // Then
            assertEquals(List.of(2, 3, 4), findings.uids("pages"));
            assertEquals(List.of(11, 12), findings.uids("tt_content"));
        }

        @Test
        @DisplayName("Should fail when the workspace table has no soft-delete field configured")
        void shouldFailWithoutSoftDeleteField() {
            // Given
            Map<String, Map<String, Object>> tables = new LinkedHashMap<>();
            tables.put("pages", Map.of("versioningWS", true));
            tables.put("sys_workspace", Map.of("label", "title"));
            SchemaCatalog incomplete = new SchemaCatalog(tables);
            DanglingWorkspaceRecords incompleteCheck =
                    new DanglingWorkspaceRecords(supportFor(incomplete), incomplete, properties);

            // When
            SchemaIncompleteException e = assertThrows(SchemaIncompleteException.class, incompleteCheck::detect);

            // Then
            assertEquals("SCHEMA_INCOMPLETE", e.getErrorCode());
            assertTrue(e.getMessage().contains("sys_workspace"));
        }

        @Test
        @DisplayName("Should report nothing on a consistent database")
        void shouldReportNothingWhenConsistent() {
            // Given
            jdbcTemplate.update("DELETE FROM pages WHERE uid IN (3, 4)");
            jdbcTemplate.update("DELETE FROM tt_content WHERE uid = 12");

            // When / Then
            assertTrue(check.detect().isEmpty());
            assertEquals(CheckResult.OK, check.handle(CheckMode.INTERACTIVE, ""));
            assertTrue(console.questions().isEmpty());
        }
    }

    @Nested
    @DisplayName("handle")
    class HandleTests {

        @Test
        @DisplayName("Should remove dangling records in execute mode and pass on the next run")
        void shouldRepairInExecuteMode() {
            // When
            CheckResult result = check.handle(CheckMode.EXECUTE, "");

            // Then
            assertEquals(CheckResult.OK, result);
            assertEquals(List.of(1, 2), uids("pages"));
            assertEquals(List.of(10, 11), uids("tt_content"));
            assertEquals(List.of(20), uids("sys_category"));
            assertTrue(console.printed("Deleted 2 records in \"pages\""));
            assertTrue(console.printed("Deleted 1 records in \"tt_content\""));
            assertEquals(3.0, metrics.repairedRecords(check.name()));

            assertEquals(CheckResult.OK, check.handle(CheckMode.EXECUTE, ""));
            assertTrue(check.detect().isEmpty());
        }

        @Test
        @DisplayName("Should leave data untouched when the operator reviews and aborts")
        void shouldLeaveDataUntouchedOnAbort() {
            // Given
            console.answer("p", "d", "a");

            // When
            CheckResult result = check.handle(CheckMode.INTERACTIVE, "");

            // Then
            assertEquals(CheckResult.ABORTED, result);
            assertEquals(List.of(1, 2, 3, 4), uids("pages"));
            assertEquals(List.of(10, 11, 12), uids("tt_content"));
            assertEquals(3, console.questions().size());
            assertEquals("Remove records [y,a,r,p,d,?]?", console.questions().get(0));
            assertTrue(console.printed("[note] Found records per page:"));
            assertTrue(console.printed("[note] Table \"pages\":"));
            assertTrue(console.printed("[note] Table \"tt_content\":"));
        }

        @Test
        @DisplayName("Should show help for unknown input and repair on y")
        void shouldRepairAfterHelp() {
            // Given
            console.answer("h", "y");

            // When
            CheckResult result = check.handle(CheckMode.INTERACTIVE, "");

            // Then
            assertEquals(CheckResult.OK, result);
            assertTrue(console.printed("a - abort now"));
            assertTrue(console.printed("[ok] No workspace records from deleted workspaces"));
            assertEquals(List.of(1, 2), uids("pages"));
        }

        @Test
        @DisplayName("Should only report in check mode")
        void shouldOnlyReportInCheckMode() {
            // When
            CheckResult result = check.handle(CheckMode.CHECK, "");

            // Then
            assertEquals(CheckResult.ABORTED, result);
            assertTrue(console.printed("[warning] Found workspace records from deleted workspaces in 2 tables:"));
            assertEquals(List.of(1, 2, 3, 4), uids("pages"));
        }

        @Test
        @DisplayName("Should fail when operator input ends")
        void shouldFailWhenInputEnds() {
            // When / Then
            assertThrows(UncheckedIOException.class, () -> check.handle(CheckMode.INTERACTIVE, ""));
            assertEquals(List.of(1, 2, 3, 4), uids("pages"));
        }
    }
}
