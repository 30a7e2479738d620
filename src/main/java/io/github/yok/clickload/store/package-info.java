/**
 * Destination store package for clickload.
 *
 * <p>
 * Provides the JDBC-backed ClickHouse store, its connection factory and the introspection queries
 * (describe, count, existence) used around an ingestion run.
 * </p>
 */
package io.github.yok.clickload.store;
