package com.z254.magi.exception;

import com.z254.magi.diagnostics.StepDiagnostics;
import lombok.Getter;

/**
 * A workflow step aborted. Carries the diagnostics snapshot taken after the failure was recorded.
 */
@Getter
public class StepFailedException extends RuntimeException {

    private final String step;
    private final transient StepDiagnostics diagnostics;

    public StepFailedException(String step, String message, StepDiagnostics diagnostics, Throwable cause) {
        super(message, cause);
        this.step = step;
        this.diagnostics = diagnostics;
    }
}
