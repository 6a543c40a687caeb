package io.github.yok.flexdbsync;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.config.DbUnitConfigProperties;
import io.github.yok.flexdbsync.config.SyncConfig;
import io.github.yok.flexdbsync.core.BootstrapController;
import io.github.yok.flexdbsync.core.BootstrapResult;
import io.github.yok.flexdbsync.core.SyncContext;
import io.github.yok.flexdbsync.db.DbDialectHandlerFactory;
import io.github.yok.flexdbsync.util.ErrorHandler;
import io.github.yok.flexdbsync.util.MaskingLogUtil;
import java.time.Clock;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Takes no command-line options; unknown arguments are logged and ignored. Settings are read from
 * {@code application.yml} and the environment ({@code PRIMARY_DB_URL}, {@code SECONDARY_DB_URL},
 * ...). Each start performs one full synchronization through {@link BootstrapController}.
 * </p>
 *
 * <p>
 * Exit codes:
 * </p>
 * <ul>
 * <li>{@code 0}: every requested table was synchronized</li>
 * <li>{@code 1}: the run failed</li>
 * <li>{@code 2}: the batch committed, but some requested tables were missing or skipped</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see SyncConfig
 * @see DbDialectHandlerFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, SyncConfig.class,
        DbUnitConfigProperties.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConnectionConfig connectionConfig;
    private final SyncConfig syncConfig;
    private final DbDialectHandlerFactory dialectFactory;

    // Exit code of the last run
    private int exitCode = BootstrapResult.EXIT_OK;

    /**
     * Bootstraps the application and exits with the code of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        for (String arg : args) {
            log.warn("Unknown argument ignored: {}", arg);
        }

        ConnectionConfig.Entry primary = connectionConfig.getPrimary();
        ConnectionConfig.Entry secondary = connectionConfig.getSecondary();
        warnIfPlaceholder(primary);
        warnIfPlaceholder(secondary);
        log.info("Source: {}", MaskingLogUtil.describe(primary));
        log.info("Destination: {}", MaskingLogUtil.describe(secondary));

        try {
            SyncContext context = SyncContext.builder().source(primary).destination(secondary)
                    .sourceDialect(dialectFactory.create(primary))
                    .destinationDialect(dialectFactory.create(secondary))
                    .trackingTable(syncConfig.getTrackingTable()).clock(Clock.systemUTC())
                    .build();
            BootstrapResult result = new BootstrapController(context).run(syncConfig.getTables());
            exitCode = result.getExitCode();
            log.info("Synchronization finished: state={}, exitCode={}", result.getState(),
                    exitCode);
        } catch (RuntimeException e) {
            exitCode = BootstrapResult.EXIT_FAILED;
            ErrorHandler.fatal("Synchronization aborted", e);
        }
    }

    /**
     * Returns the exit code of the last run.
     *
     * @return exit code
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void warnIfPlaceholder(ConnectionConfig.Entry entry) {
        if (entry.hasPlaceholderCredentials()) {
            log.warn("[{}] Placeholder credentials are in use. Set the database user and password "
                    + "through the environment before running against a real database.",
                    entry.getId());
        }
    }
}
