/**
 * FlexDBSync: copies tables from a primary database to a secondary database by full delete and
 * reinsert.
 *
 * <p>
 * {@link io.github.yok.flexdbsync.Main} is the Spring Boot command-line entry point.
 * </p>
 */
package io.github.yok.flexdbsync;
