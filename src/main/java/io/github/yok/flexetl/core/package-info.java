/**
 * Core ETL workflow package.
 *
 * <p>
 * Extracts source tables in bounded batches, runs each batch through the transform pipeline and
 * appends the result to the sink table, skipping tables whose tag is already present. Also holds
 * the raw data staging utility that feeds CSV files into the source schema.
 * </p>
 *
 * <p>
 * Connection handling and retries are delegated to {@code db}; helpers live in {@code util}.
 * </p>
 */
package io.github.yok.flexetl.core;
