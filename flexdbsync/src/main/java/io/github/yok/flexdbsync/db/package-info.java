/**
 * Database dialect package.
 *
 * <p>
 * Dialect handlers encapsulate what differs between database products: identifier quoting, schema
 * resolution, session preparation, native DDL types for recreated tables and the tracking table,
 * and the DBUnit data type factory used to read and write rows.
 * </p>
 */
package io.github.yok.flexdbsync.db;
