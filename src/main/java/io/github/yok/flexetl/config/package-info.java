/**
 * Configuration package.
 *
 * <p>
 * Holds the Spring Boot {@code @ConfigurationProperties} beans bound from {@code application.yml}:
 * source and sink connection settings, pipeline tuning (batch size, retry policy, field mapping)
 * and raw data staging settings.
 * </p>
 */
package io.github.yok.flexetl.config;
