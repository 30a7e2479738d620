/**
 * Source access package for clickload.
 *
 * <p>
 * Wraps the object store (S3-compatible) and the remote download service (Google Drive) behind
 * small interfaces so the ingestion core can be tested without either client.
 * </p>
 */
package io.github.yok.clickload.source;
