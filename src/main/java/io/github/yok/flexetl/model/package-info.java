/**
 * Data model of the ETL run: extracted batches, the records written to the sink and per-table
 * outcomes.
 */
package io.github.yok.flexetl.model;
