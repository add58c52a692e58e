package org.iceforge.pruner.cli;

import org.iceforge.pruner.PruneException;
import org.iceforge.pruner.catalog.BackupCatalog;
import org.iceforge.pruner.config.PrunerProperties;
import org.iceforge.pruner.config.StorageAdapterFactory;
import org.iceforge.pruner.run.DeletionConfirmation;
import org.iceforge.pruner.run.PruneReport;
import org.iceforge.pruner.run.PruneRunner;
import org.iceforge.pruner.run.RetryPolicy;
import org.iceforge.pruner.storage.StorageAdapter;
import org.iceforge.pruner.strategy.RetentionStrategies;
import org.iceforge.pruner.strategy.RetentionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Runs one prune of the configured bucket/prefix and turns the outcome into the process exit code.
 * <ul>
 *   <li>0: done, including dry runs and declined confirmations</li>
 *   <li>1: some deletes failed</li>
 *   <li>2: the run failed before or while deciding</li>
 *   <li>64: bad command line</li>
 * </ul>
 */
@Component
public class PruneCommand implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(PruneCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_DELETE_FAILURES = 1;
    public static final int EXIT_RUN_FAILED = 2;
    public static final int EXIT_USAGE = 64;

    private final PrunerProperties props;
    private final StorageAdapterFactory stores;
    private final BackupCatalog backupCatalog;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ZoneId zone;
    private final DeletionConfirmation confirmation;

    private volatile int exitCode = EXIT_OK;

    public PruneCommand(PrunerProperties props,
                        StorageAdapterFactory stores,
                        BackupCatalog backupCatalog,
                        RetryPolicy retryPolicy,
                        Clock clock,
                        ZoneId prunerZone,
                        DeletionConfirmation confirmation) {
        this.props = props;
        this.stores = stores;
        this.backupCatalog = backupCatalog;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.zone = prunerZone;
        this.confirmation = confirmation;
    }

    @Override
    public void run(ApplicationArguments args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args, props);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid command line: {}", e.getMessage());
            System.err.println(CliOptions.usage());
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            RetentionStrategy strategy = RetentionStrategies.byName(options.strategy(), zone);
            PruneRunner runner = PruneRunner.builder(strategy, backupCatalog)
                    .retryPolicy(retryPolicy)
                    .deleteConcurrency(props.getDeleteConcurrency())
                    .clock(clock)
                    .confirmation(options.skipConfirmation() ? DeletionConfirmation.always() : confirmation)
                    .build();

            logger.info("Pruning bucket={} prefix='{}' strategy={} params={}{}", options.bucket(), options.prefix(),
                    strategy.name(), options.params(), options.dryRun() ? " (dry run)" : "");

            StorageAdapter store = stores.open(options.bucket(), options.region());
            PruneReport report = runner.run(store, options.prefix(), options.params(), options.dryRun());

            logReport(report);
            exitCode = report.hasFailures() ? EXIT_DELETE_FAILURES : EXIT_OK;
        } catch (PruneException e) {
            logger.error("Prune failed: {}", e.getMessage(), e);
            exitCode = EXIT_RUN_FAILED;
        } catch (RuntimeException e) {
            logger.error("Prune failed unexpectedly: {}", e.toString(), e);
            exitCode = EXIT_RUN_FAILED;
        }
    }

    private static void logReport(PruneReport report) {
        logger.info("Result: {}", report.summary());
        report.failed().forEach((key, error) -> logger.warn("Not deleted: {} ({})", key, error));
        if (!report.skipped().isEmpty()) {
            logger.info("{} backup(s) marked for deletion were left in place", report.skipped().size());
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Kept: {}", report.kept());
            logger.debug("Deleted: {}", report.deleted());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
