package com.tengen.core.load;

/**
 * Tells the user that a load attempt failed. Called at most once per attempt.
 */
@FunctionalInterface
public interface LoadFailureReporter {

    void report(String title, String message);
}
