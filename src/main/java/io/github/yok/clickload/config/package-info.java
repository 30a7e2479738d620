/**
 * Configuration package for clickload.
 *
 * <p>
 * Holds the {@code application.yml} bindings for the ClickHouse connection, the object store, the
 * remote download service and the ingestion run, together with the enumerations parsed from them.
 * </p>
 */
package io.github.yok.clickload.config;
