/**
 * Core ingestion package for clickload.
 *
 * <p>
 * Provides the engine shared by every source family: source selection, schema reconciliation,
 * value coercion and the orchestrator that sequences a run and reports its outcome.
 * </p>
 *
 * <p>
 * Classes in this package depend on the store and source abstractions only, never on a concrete
 * client library.
 * </p>
 */
package io.github.yok.clickload.core;
