package io.github.yok.clickload.core;

/**
 * Categories of run failure.
 *
 * @author Yasuharu.Okawauchi
 */
public enum FailureKind {

    // Missing required parameter or invalid strategy; detected before any external call
    CONFIGURATION,

    // Empty listing or no date-parseable candidate
    SOURCE_RESOLUTION,

    // Reconciliation matched no column
    STRUCTURAL_MISMATCH,

    // Source without a header or without data rows
    EMPTY_SOURCE,

    // Store unreachable, download error, insert rejected
    EXTERNAL_IO
}
