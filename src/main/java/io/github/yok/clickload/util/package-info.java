/**
 * Utility package for clickload.
 *
 * <p>
 * Provides the diagnostics sink, fatal error reporting and period (date) helpers.
 * </p>
 */
package io.github.yok.clickload.util;
