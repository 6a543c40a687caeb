package io.github.yok.flexdbsync.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * This interface composes focused contracts to keep responsibilities separated: connection/session
 * control, metadata access, and SQL/DDL grammar.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations,
        DbDialectMetadataOperations, DbDialectSqlOperations {
}
