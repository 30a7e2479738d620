/**
 * Source family adapters.
 *
 * <p>
 * Each {@link io.github.yok.clickload.ingest.Ingestor} validates its own settings, resolves its
 * sources and fetches each one as a payload for the orchestrator.
 * </p>
 */
package io.github.yok.clickload.ingest;
