package com.dbdoctor.application.service;

import com.dbdoctor.application.healthcheck.HealthCheck;
import com.dbdoctor.application.healthcheck.HealthCheckRegistry;
import com.dbdoctor.application.port.in.RunHealthChecksUseCase.CheckOutcome;
import com.dbdoctor.application.port.in.RunHealthChecksUseCase.RunReport;
import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.application.port.out.MetricsPort;
import com.dbdoctor.domain.error.CheckError;
import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.infrastructure.exception.SchemaIncompleteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HealthCheckService.
 * Checks are mocked, only the orchestration is under test.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("HealthCheckService")
class HealthCheckServiceTest {

    @Mock
    private HealthCheck workspaces;

    @Mock
    private HealthCheck pageTree;

    @Mock
    private HealthCheck languageParent;

    @Mock
    private ConsolePort console;

    @Mock
    private MetricsPort metrics;

    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        lenient().when(workspaces.name()).thenReturn("DanglingWorkspaceRecords");
        lenient().when(pageTree.name()).thenReturn("PagesBrokenTree");
        lenient().when(languageParent.name()).thenReturn("TcaTablesLanguageLessThanOneHasZeroLanguageParent");
        HealthCheckRegistry registry = new HealthCheckRegistry(List.of(workspaces, pageTree, languageParent));
        service = new HealthCheckService(registry, console, metrics);
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("Should run every check in order and exit with 0 when all pass")
        void shouldRunAllChecksInOrder() {
            // Given
            when(workspaces.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);
            when(pageTree.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);
            when(languageParent.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);

            // When
            RunReport report = service.run(CheckMode.EXECUTE, null);

            // Then
            InOrder inOrder = inOrder(workspaces, pageTree, languageParent);
            inOrder.verify(workspaces).header();
            inOrder.verify(workspaces).handle(CheckMode.EXECUTE, "");
            inOrder.verify(pageTree).header();
            inOrder.verify(pageTree).handle(CheckMode.EXECUTE, "");
            inOrder.verify(languageParent).header();
            inOrder.verify(languageParent).handle(CheckMode.EXECUTE, "");
            assertTrue(report.allOk());
            assertEquals(0, report.exitCode());
            verify(console).success("All checks passed");
        }

        @Test
        @DisplayName("Should continue after an aborted check and exit with 1")
        void shouldNotShortCircuitOnAbort() {
            // Given
            when(workspaces.handle(CheckMode.INTERACTIVE, "")).thenReturn(CheckResult.ABORTED);
            when(pageTree.handle(CheckMode.INTERACTIVE, "")).thenReturn(CheckResult.OK);
            when(languageParent.handle(CheckMode.INTERACTIVE, "")).thenReturn(CheckResult.OK);

            // When
            RunReport report = service.run(CheckMode.INTERACTIVE, "");

            // Then
            assertEquals(3, report.outcomes().size());
            assertFalse(report.outcomes().get(0).isOk());
            assertEquals("ABORTED", report.outcomes().get(0).describe());
            assertEquals(1, report.exitCode());
            verify(languageParent).handle(CheckMode.INTERACTIVE, "");
        }

        @Test
        @DisplayName("Should resume from the named check and pass the token on")
        void shouldResumeFromNamedCheck() {
            // Given
            when(pageTree.handle(CheckMode.EXECUTE, "PagesBrokenTree")).thenReturn(CheckResult.OK);
            when(languageParent.handle(CheckMode.EXECUTE, "PagesBrokenTree")).thenReturn(CheckResult.OK);

            // When
            RunReport report = service.run(CheckMode.EXECUTE, " PagesBrokenTree ");

            // Then
            verify(workspaces, never()).header();
            verify(workspaces, never()).handle(any(), any());
            assertEquals(List.of("PagesBrokenTree", "TcaTablesLanguageLessThanOneHasZeroLanguageParent"),
                    report.outcomes().stream().map(CheckOutcome::check).toList());
        }

        @Test
        @DisplayName("Should reject an unknown resume name before running anything")
        void shouldRejectUnknownResumeName() {
            // When / Then
            assertThrows(IllegalArgumentException.class, () -> service.run(CheckMode.EXECUTE, "NoSuchCheck"));
            verify(workspaces, never()).handle(any(), any());
        }

        @Test
        @DisplayName("Should report a check with an incomplete schema and continue")
        void shouldContinueAfterIncompleteSchema() {
            // Given
            when(workspaces.handle(CheckMode.EXECUTE, ""))
                    .thenThrow(new SchemaIncompleteException("sys_workspace", CtrlRole.SOFT_DELETE));
            when(pageTree.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);
            when(languageParent.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);

            // When
            RunReport report = service.run(CheckMode.EXECUTE, "");

            // Then
            CheckOutcome failed = report.outcomes().get(0);
            assertTrue(failed.result().isFailure());
            assertInstanceOf(CheckError.SchemaIncomplete.class, failed.result().errorOrNull());
            assertEquals("FAILED (SCHEMA_INCOMPLETE)", failed.describe());
            assertEquals(1, report.exitCode());
            verify(console).error(contains("sys_workspace"));
            verify(metrics).recordCheckResult("DanglingWorkspaceRecords", CheckResult.ABORTED);
            verify(languageParent).handle(CheckMode.EXECUTE, "");
        }

        @Test
        @DisplayName("Should let storage failures end the run")
        void shouldPropagateStorageFailures() {
            // Given
            when(workspaces.handle(CheckMode.EXECUTE, ""))
                    .thenThrow(new DataAccessResourceFailureException("connection lost"));

            // When / Then
            assertThrows(DataAccessResourceFailureException.class, () -> service.run(CheckMode.EXECUTE, ""));
            verify(pageTree, never()).handle(any(), any());
            verify(console, never()).section("Summary");
        }

        @Test
        @DisplayName("Should print a summary table with repaired record counts")
        void shouldPrintSummaryTable() {
            // Given
            when(workspaces.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);
            when(pageTree.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.OK);
            when(languageParent.handle(CheckMode.EXECUTE, "")).thenReturn(CheckResult.ABORTED);
            when(metrics.repairedRecords("DanglingWorkspaceRecords")).thenReturn(0.0, 3.0);

            // When
            service.run(CheckMode.EXECUTE, "");

            // Then
            verify(console).table(List.of("Check", "Result", "Repaired records"), List.of(
                    List.of("DanglingWorkspaceRecords", "OK", "3"),
                    List.of("PagesBrokenTree", "OK", "0"),
                    List.of("TcaTablesLanguageLessThanOneHasZeroLanguageParent", "ABORTED", "0")
            ));
            verify(console).warning(anyList());
        }

        @Test
        @DisplayName("Should count only the records repaired by the current run")
        void shouldReportRepairsOfCurrentRunOnly() {
            // Given
            when(workspaces.handle(any(), eq(""))).thenReturn(CheckResult.OK);
            when(pageTree.handle(any(), eq(""))).thenReturn(CheckResult.OK);
            when(languageParent.handle(any(), eq(""))).thenReturn(CheckResult.OK);
            when(metrics.repairedRecords("DanglingWorkspaceRecords")).thenReturn(0.0, 1.0, 1.0, 1.0);

            // When
            RunReport first = service.run(CheckMode.EXECUTE, "");
            RunReport second = service.run(CheckMode.CHECK, "");

            // Then
            assertEquals(1, first.outcomes().get(0).repairedRecords());
            assertEquals(0, second.outcomes().get(0).repairedRecords());
            verify(console).table(List.of("Check", "Result", "Repaired records"), List.of(
                    List.of("DanglingWorkspaceRecords", "OK", "0"),
                    List.of("PagesBrokenTree", "OK", "0"),
                    List.of("TcaTablesLanguageLessThanOneHasZeroLanguageParent", "OK", "0")
            ));
        }
    }
}
