/**
 * Synchronization engine.
 *
 * <p>
 * {@link io.github.yok.flexdbsync.core.BootstrapController} drives a run:
 * {@link io.github.yok.flexdbsync.core.SchemaIntrospector} verifies the requested tables,
 * {@link io.github.yok.flexdbsync.core.SyncTrackingStore} prepares the tracking table and
 * {@link io.github.yok.flexdbsync.core.TableSynchronizer} mirrors and copies the tables in one
 * destination transaction. Failures are reported through
 * {@link io.github.yok.flexdbsync.core.SyncException} subclasses carried by result objects.
 * </p>
 */
package io.github.yok.flexdbsync.core;
