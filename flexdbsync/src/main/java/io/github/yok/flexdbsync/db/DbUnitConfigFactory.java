package io.github.yok.flexdbsync.db;

import io.github.yok.flexdbsync.config.DbUnitConfigProperties;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * Both the source connection (reading rows) and the destination connection (deleting and
 * inserting rows) are configured here, so the two sides agree on type conversion and identifier
 * escaping.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates a factory with default {@link DbUnitConfigProperties} for use outside the Spring
     * container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dataTypeFactory vendor-specific {@link IDataTypeFactory} implementation
     * @param escapePattern identifier escape pattern, {@code ?} standing for the identifier
     * @param tableTypes table types DBUnit lists as user tables
     */
    public void configure(DatabaseConfig cfg, IDataTypeFactory dataTypeFactory,
            String escapePattern, String[] tableTypes) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escapePattern);
        log.debug("DBUnit: escape pattern = {}", escapePattern);

        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE, tableTypes);
        log.debug("DBUnit: table types = {}", Arrays.toString(tableTypes));

        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());
    }
}
