package org.iceforge.pruner.run;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a completed run.
 *
 * @param prefix     scope of the run
 * @param dryRun     whether deletes were suppressed
 * @param listed     number of objects listed under the prefix
 * @param kept       keys the strategy kept
 * @param deleted    keys confirmed gone (deleted now or already missing)
 * @param failed     keys whose delete failed permanently or ran out of retries, with the last error
 * @param skipped    keys the strategy marked for deletion but no delete was issued for
 *                   (dry run, declined confirmation, interruption)
 * @param startedAt  start of the run
 * @param finishedAt end of the run
 */
public record PruneReport(
        String prefix,
        boolean dryRun,
        int listed,
        Set<String> kept,
        Set<String> deleted,
        Map<String, String> failed,
        Set<String> skipped,
        Instant startedAt,
        Instant finishedAt
) {
    public PruneReport {
        kept = ordered(kept);
        deleted = ordered(deleted);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        skipped = ordered(skipped);
    }

    private static Set<String> ordered(Set<String> keys) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public String summary() {
        return "prefix='" + prefix + "'"
                + (dryRun ? " (dry run)" : "")
                + " listed=" + listed
                + " kept=" + kept.size()
                + " deleted=" + deleted.size()
                + " failed=" + failed.size()
                + " skipped=" + skipped.size()
                + " in " + elapsed().toMillis() + " ms";
    }
}
