package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the backup timestamp of a listed object.
 * <br>
 * Rules must be deterministic: the same object always yields the same answer. An empty result means
 * this rule cannot date the object; {@link BackupCatalog} turns that into a {@link MalformedEntryException}.
 */
@FunctionalInterface
public interface TimestampRule {

    Optional<Instant> timestampOf(StoredObject object);

    /** Short label used in error messages. */
    default String describe() {
        return getClass().getSimpleName();
    }

    static TimestampRule lastModified() {
        return new LastModifiedTimestampRule();
    }

    /**
     * Tries each rule in order and takes the first timestamp found.
     */
    static TimestampRule firstOf(TimestampRule... rules) {
        List<TimestampRule> chain = List.of(rules);
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("At least one timestamp rule is required");
        }
        return new TimestampRule() {
            @Override
            public Optional<Instant> timestampOf(StoredObject object) {
                for (TimestampRule rule : chain) {
                    Optional<Instant> ts = rule.timestampOf(object);
                    if (ts.isPresent()) {
                        return ts;
                    }
                }
                return Optional.empty();
            }

            @Override
            public String describe() {
                List<String> names = new ArrayList<>();
                for (TimestampRule rule : chain) {
                    names.add(Objects.requireNonNull(rule, "rule").describe());
                }
                return String.join(" or ", names);
            }
        };
    }
}
