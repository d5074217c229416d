package io.slobengine.application.service;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a graceful shutdown.
 *
 * @param overrunSteps steps abandoned because they exceeded their time budget
 * @param failedSteps  steps that threw
 */
public record ShutdownReport(
    List<String> completedSteps,
    List<String> overrunSteps,
    List<String> failedSteps,
    Duration elapsed
) {
    public boolean isClean() {
        return overrunSteps.isEmpty() && failedSteps.isEmpty();
    }
}
