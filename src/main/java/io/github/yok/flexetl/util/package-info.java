/**
 * Utility package for FlexETL.
 *
 * <p>
 * Provides the retry policy used around connection opening, the error types of the run, CLI error
 * reporting, JDBC driver loading, and stateless helpers for date/time, numeric and SQL text
 * handling.
 * </p>
 */
package io.github.yok.flexetl.util;
