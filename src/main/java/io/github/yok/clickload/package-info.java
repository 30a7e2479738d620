/**
 * Root package of clickload.
 *
 * <p>
 * Contains the Spring Boot entry point and the ingestion service that wires configuration, source
 * clients and the destination store into one run.
 * </p>
 */
package io.github.yok.clickload;
