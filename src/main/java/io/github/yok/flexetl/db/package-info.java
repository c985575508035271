/**
 * Database access package.
 *
 * <p>
 * Opens the JDBC connections to the source and sink stores under a retry policy.
 * </p>
 */
package io.github.yok.flexetl.db;
