package com.dbdoctor.application.port.in;

import com.dbdoctor.domain.error.CheckError;
import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.Result;

import java.util.List;

public interface RunHealthChecksUseCase {

    /**
     * Runs the registered checks in order.
     *
     * @param resumeToken name of the check to start from, blank to run all
     */
    RunReport run(CheckMode mode, String resumeToken);

    /**
     * @param repairedRecords records deleted or updated by this check during this run
     */
    record CheckOutcome(String check, Result<CheckResult, CheckError> result, long repairedRecords) {

        public boolean isOk() {
            return result.isSuccess() && result.getOrThrow() == CheckResult.OK;
        }

        public String describe() {
            return result.isSuccess()
                ? result.getOrThrow().name()
                : "FAILED (" + result.errorOrNull().code() + ")";
        }
    }

    record RunReport(CheckMode mode, List<CheckOutcome> outcomes) {

        public RunReport {
            outcomes = List.copyOf(outcomes);
        }

        public boolean allOk() {
            return outcomes.stream().allMatch(CheckOutcome::isOk);
        }

        /**
         * 0 when every check ended OK, 1 otherwise.
         */
        public int exitCode() {
            return allOk() ? 0 : 1;
        }
    }
}
