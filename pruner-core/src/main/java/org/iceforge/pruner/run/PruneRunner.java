package org.iceforge.pruner.run;

import org.iceforge.pruner.PruneException;
import org.iceforge.pruner.catalog.BackupCatalog;
import org.iceforge.pruner.catalog.Catalog;
import org.iceforge.pruner.storage.DeleteStatus;
import org.iceforge.pruner.storage.ListPage;
import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StorageAdapter;
import org.iceforge.pruner.storage.StoredObject;
import org.iceforge.pruner.storage.TransientStorageException;
import org.iceforge.pruner.strategy.PolicyParams;
import org.iceforge.pruner.strategy.RetentionDecision;
import org.iceforge.pruner.strategy.RetentionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lists a prefix, decides what to keep and deletes the rest.
 * <p>
 * Listing is sequential and must complete before anything is decided. Deletes fan out over a bounded pool;
 * a failing key is retried on its own and, if it still fails, reported without aborting the others.
 * Nothing is persisted between runs: a run that is interrupted leaves a subset of its deletes applied, and
 * the next run starts again from a fresh listing.
 * <p>
 * A runner may be reused for several runs, but runs against the same prefix must not overlap.
 */
public final class PruneRunner {
    private static final Logger logger = LoggerFactory.getLogger(PruneRunner.class);

    private final RetentionStrategy strategy;
    private final BackupCatalog catalog;
    private final RetryPolicy retryPolicy;
    private final int deleteConcurrency;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DeletionConfirmation confirmation;

    private volatile RunState lastState = RunState.IDLE;

    private PruneRunner(Builder b) {
        this.strategy = Objects.requireNonNull(b.strategy, "strategy");
        this.catalog = Objects.requireNonNull(b.catalog, "catalog");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.sleeper = Objects.requireNonNull(b.sleeper, "sleeper");
        this.confirmation = Objects.requireNonNull(b.confirmation, "confirmation");
        if (b.deleteConcurrency < 1) {
            throw new IllegalArgumentException("deleteConcurrency must be >= 1");
        }
        this.deleteConcurrency = b.deleteConcurrency;
    }

    public static Builder builder(RetentionStrategy strategy, BackupCatalog catalog) {
        return new Builder(strategy, catalog);
    }

    /** State reached by the most recent run. */
    public RunState lastState() {
        return lastState;
    }

    /**
     * Runs one prune cycle.
     *
     * @param adapter store to list and delete from
     * @param prefix  key prefix defining the scope, {@code null} or empty for the whole bucket
     * @param params  policy parameters for the configured strategy
     * @param dryRun  decide and report without issuing deletes
     * @throws PruneException if the run fails before deleting (invalid policy, malformed entries,
     *                        incomplete listing); per-key delete failures are reported, not thrown
     */
    public PruneReport run(StorageAdapter adapter, String prefix, PolicyParams params, boolean dryRun) {
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(params, "params");
        String scope = prefix == null ? "" : prefix;
        Instant startedAt = clock.instant();

        try {
            strategy.decide(Catalog.empty(), startedAt, params);
        } catch (RuntimeException e) {
            lastState = RunState.FAILED;
            logger.error("Prune run for prefix='{}' rejected before listing: {}", scope, e.getMessage());
            throw e;
        }

        RunState state = RunState.LISTING;
        try {
            enter(state, "Listing {} prefix='{}'", adapter.describe(), scope);
            List<StoredObject> listed = listAll(adapter, scope);

            state = RunState.DECIDING;
            enter(state, "Deciding over {} listed objects with strategy={}", listed.size(), strategy.name());
            Catalog current = catalog.build(listed);
            RetentionDecision decision = strategy.decide(current, clock.instant(), params).checkPartitionOf(current);
            logger.info("Decision for prefix='{}': keep={} delete={}", scope, decision.keep().size(),
                    decision.delete().size());
            if (logger.isDebugEnabled()) {
                decision.delete().forEach(key -> logger.debug("Marked for deletion: {}", key));
            }

            state = RunState.DELETING;
            DeleteOutcome outcome = deleteAll(adapter, scope, decision, dryRun);

            PruneReport report = new PruneReport(scope, dryRun, listed.size(), decision.keep(), outcome.deleted,
                    outcome.failed, outcome.skipped, startedAt, clock.instant());
            state = RunState.DONE;
            enter(state, "Prune finished: {}", report.summary());
            return report;
        } catch (RuntimeException e) {
            lastState = RunState.FAILED;
            logger.error("Prune run for prefix='{}' failed while {}: {}", scope, state, e.getMessage());
            throw e;
        }
    }

    private void enter(RunState state, String message, Object... args) {
        lastState = state;
        logger.info("[{}] " + message, prepend(state, args));
    }

    private static Object[] prepend(Object first, Object[] rest) {
        Object[] out = new Object[rest.length + 1];
        out[0] = first;
        System.arraycopy(rest, 0, out, 1, rest.length);
        return out;
    }

    // --------------------------------------------------------------------------------------------
    // Listing
    // --------------------------------------------------------------------------------------------

    private List<StoredObject> listAll(StorageAdapter adapter, String prefix) {
        List<StoredObject> all = new ArrayList<>();
        Set<String> seenTokens = new HashSet<>();
        String token = null;
        int pages = 0;
        do {
            ListPage page = listPage(adapter, prefix, token, pages + 1);
            all.addAll(page.objects());
            pages++;
            token = page.nextContinuationToken();
            if (token != null && !seenTokens.add(token)) {
                throw new ListingUnavailableException(prefix, "store repeated continuation token " + token, null);
            }
        } while (token != null);

        logger.debug("Listed {} objects in {} page(s) under prefix='{}'", all.size(), pages, prefix);
        return all;
    }

    private ListPage listPage(StorageAdapter adapter, String prefix, String token, int pageNumber) {
        for (int attempt = 1; ; attempt++) {
            try {
                return adapter.list(prefix, token);
            } catch (PermanentStorageException e) {
                throw new ListingUnavailableException(prefix, "page " + pageNumber + " failed permanently", e);
            } catch (TransientStorageException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw new ListingUnavailableException(prefix,
                            "page " + pageNumber + " still failing after " + attempt + " attempts", e);
                }
                Duration wait = retryPolicy.backoff(attempt);
                logger.warn("Listing page {} of prefix='{}' failed (attempt {}/{}), retrying in {} ms: {}",
                        pageNumber, prefix, attempt, retryPolicy.maxAttempts(), wait.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ListingUnavailableException(prefix, "interrupted while retrying", ie);
                }
            }
        }
    }

    // --------------------------------------------------------------------------------------------
    // Deleting
    // --------------------------------------------------------------------------------------------

    private DeleteOutcome deleteAll(StorageAdapter adapter, String prefix, RetentionDecision decision,
                                    boolean dryRun) {
        DeleteOutcome outcome = new DeleteOutcome();
        Set<String> keys = decision.delete();

        if (keys.isEmpty()) {
            enter(RunState.DELETING, "Nothing to delete under prefix='{}'", prefix);
            return outcome;
        }
        if (dryRun) {
            enter(RunState.DELETING, "Dry run, skipping {} delete(s)", keys.size());
            outcome.skipped.addAll(keys);
            return outcome;
        }
        if (!confirmation.confirm(prefix, decision)) {
            enter(RunState.DELETING, "Deletion of {} backup(s) not confirmed, skipping", keys.size());
            outcome.skipped.addAll(keys);
            return outcome;
        }

        int threads = Math.min(deleteConcurrency, keys.size());
        enter(RunState.DELETING, "Deleting {} backup(s) with {} worker(s)", keys.size(), threads);

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "pruner-delete-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        Map<String, Future<KeyOutcome>> pending = new LinkedHashMap<>();
        boolean interrupted = false;
        try {
            for (String key : keys) {
                pending.put(key, pool.submit(() -> deleteOne(adapter, key)));
            }
            for (Map.Entry<String, Future<KeyOutcome>> e : pending.entrySet()) {
                if (interrupted) {
                    collectIfDone(e.getKey(), e.getValue(), outcome);
                    continue;
                }
                try {
                    outcome.record(e.getValue().get());
                } catch (InterruptedException ie) {
                    interrupted = true;
                    pool.shutdownNow();
                    logger.warn("Interrupted while deleting under prefix='{}'; remaining keys are skipped", prefix);
                    collectIfDone(e.getKey(), e.getValue(), outcome);
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                    outcome.failed.put(e.getKey(), String.valueOf(cause.getMessage()));
                }
            }
        } finally {
            pool.shutdownNow();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return outcome;
    }

    private static void collectIfDone(String key, Future<KeyOutcome> future, DeleteOutcome outcome) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                outcome.record(future.get());
                return;
            } catch (InterruptedException | ExecutionException ignoredBecauseDone) {
                // a completed future does not block; fall through and report the key as skipped
            }
        }
        future.cancel(true);
        outcome.skipped.add(key);
    }

    private KeyOutcome deleteOne(StorageAdapter adapter, String key) {
        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return KeyOutcome.skipped(key);
            }
            try {
                DeleteStatus status = adapter.delete(key);
                if (status == DeleteStatus.NOT_FOUND) {
                    logger.debug("Backup {} was already gone", key);
                }
                return KeyOutcome.deleted(key);
            } catch (PermanentStorageException e) {
                logger.error("Delete of {} failed permanently: {}", key, e.getMessage());
                return KeyOutcome.failed(key, e.getMessage());
            } catch (TransientStorageException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    logger.error("Delete of {} still failing after {} attempts: {}", key, attempt, e.getMessage());
                    return KeyOutcome.failed(key, "gave up after " + attempt + " attempts: " + e.getMessage());
                }
                Duration wait = retryPolicy.backoff(attempt);
                logger.warn("Delete of {} failed (attempt {}/{}), retrying in {} ms: {}",
                        key, attempt, retryPolicy.maxAttempts(), wait.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return KeyOutcome.skipped(key);
                }
            } catch (RuntimeException e) {
                logger.error("Delete of {} failed unexpectedly", key, e);
                return KeyOutcome.failed(key, e.toString());
            }
        }
    }

    private enum KeyResult { DELETED, FAILED, SKIPPED }

    private record KeyOutcome(String key, KeyResult result, String error) {
        static KeyOutcome deleted(String key) { return new KeyOutcome(key, KeyResult.DELETED, null); }
        static KeyOutcome failed(String key, String error) { return new KeyOutcome(key, KeyResult.FAILED, error); }
        static KeyOutcome skipped(String key) { return new KeyOutcome(key, KeyResult.SKIPPED, null); }
    }

    private static final class DeleteOutcome {
        final Set<String> deleted = new LinkedHashSet<>();
        final Map<String, String> failed = new LinkedHashMap<>();
        final Set<String> skipped = new LinkedHashSet<>();

        void record(KeyOutcome o) {
            switch (o.result()) {
                case DELETED -> deleted.add(o.key());
                case FAILED -> failed.put(o.key(), o.error() == null ? "unknown error" : o.error());
                case SKIPPED -> skipped.add(o.key());
            }
        }
    }

    public static final class Builder {
        private final RetentionStrategy strategy;
        private final BackupCatalog catalog;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int deleteConcurrency = 8;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.system();
        private DeletionConfirmation confirmation = DeletionConfirmation.always();

        private Builder(RetentionStrategy strategy, BackupCatalog catalog) {
            this.strategy = strategy;
            this.catalog = catalog;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }
        public Builder deleteConcurrency(int deleteConcurrency) { this.deleteConcurrency = deleteConcurrency; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
        public Builder confirmation(DeletionConfirmation confirmation) { this.confirmation = confirmation; return this; }

        public PruneRunner build() {
            return new PruneRunner(this);
        }
    }
}
