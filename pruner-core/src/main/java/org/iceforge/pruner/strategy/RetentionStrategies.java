package org.iceforge.pruner.strategy;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Looks strategies up by their configuration name.
 */
public final class RetentionStrategies {

    public static final String DEFAULT = OlderThanButKeepOnePerMonth.NAME;

    private RetentionStrategies() {}

    public static List<String> names() {
        return List.of(
                OlderThanButKeepOnePerMonth.NAME,
                RetainExpiredThinning.NAME,
                OlderThan.NAME,
                KeepOnePerMonth.NAME,
                KeepLastN.NAME,
                KeepAll.NAME
        );
    }

    public static RetentionStrategy byName(String name) {
        return byName(name, ZoneOffset.UTC);
    }

    /**
     * @param zone calendar used by the month-based strategies
     * @throws InvalidPolicyException for unknown names
     */
    public static RetentionStrategy byName(String name, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        String normalized = name == null || name.isBlank()
                ? DEFAULT
                : name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case OlderThanButKeepOnePerMonth.NAME -> new OlderThanButKeepOnePerMonth(zone);
            case RetainExpiredThinning.NAME -> new RetainExpiredThinning(zone);
            case OlderThan.NAME -> new OlderThan();
            case KeepOnePerMonth.NAME -> new KeepOnePerMonth(zone);
            case KeepLastN.NAME -> new KeepLastN();
            case KeepAll.NAME -> new KeepAll();
            default -> throw new InvalidPolicyException("Unknown retention strategy '" + name
                    + "'. Available: " + names());
        };
    }
}
