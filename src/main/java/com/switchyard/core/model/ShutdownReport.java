package com.switchyard.core.model;

import java.util.List;

/**
 * Outcome of the explicit teardown run on process exit.
 */
public record ShutdownReport(List<String> closedTerminals, List<String> failures) {

    public boolean clean() {
        return failures.isEmpty();
    }
}
