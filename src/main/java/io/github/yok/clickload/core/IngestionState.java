package io.github.yok.clickload.core;

/**
 * States of one ingestion run.
 *
 * <pre>
 * INIT → TABLE_READY → SOURCES_RESOLVED
 *      → (PARSED → RECONCILED → COERCED → INSERTED) per source
 *      → VERIFIED → DONE
 * </pre>
 *
 * <p>
 * {@link #FAILED} is absorbing and reachable from every other state. Sources the store reads by
 * itself go straight from {@code SOURCES_RESOLVED} (or the previous {@code INSERTED}) to
 * {@code INSERTED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum IngestionState {
    INIT,
    TABLE_READY,
    SOURCES_RESOLVED,
    PARSED,
    RECONCILED,
    COERCED,
    INSERTED,
    VERIFIED,
    DONE,
    FAILED
}
