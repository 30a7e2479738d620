/**
 * SQL file handling package for clickload.
 *
 * <p>
 * Loads SQL files, expands {@code {{NAME}}} template variables, builds insert statements and runs
 * SQL files in order for query mode.
 * </p>
 */
package io.github.yok.clickload.sql;
