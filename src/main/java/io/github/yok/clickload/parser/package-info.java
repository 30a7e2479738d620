/**
 * Delimited text parsing and data format detection.
 */
package io.github.yok.clickload.parser;
