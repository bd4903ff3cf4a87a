package com.tengen.core.load;

/**
 * Receives load progress. Fractions never decrease and end at 1.0.
 */
@FunctionalInterface
public interface LoadProgressListener {

    LoadProgressListener NONE = (fraction, label) -> { };

    void progress(double fraction, String label);
}
