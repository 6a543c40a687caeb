package io.github.yok.flexdbsync.config;

/**
 * Enumerates the database products a connection entry can be resolved to.
 *
 * <p>
 * Each constant selects a dialect handler and the DBUnit data type factory it uses.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // PostgreSQL (default for the shipped configuration)
    POSTGRESQL,
    // MySQL / MariaDB via the MySQL driver
    MYSQL,
    // Oracle Database 12c or later
    ORACLE,
    // Microsoft SQL Server
    SQLSERVER,
    // H2 (embedded and test databases)
    H2
}
