/**
 * Configuration model package for FlexDBSync.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} and the environment:
 * the primary/secondary connection settings, the list of tables to synchronize, and DBUnit
 * settings.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}
 * and {@code db}.
 * </p>
 */
package io.github.yok.flexdbsync.config;
