package org.iceforge.pruner.strategy;

import java.time.Duration;

/**
 * Parameters of a retention policy. Each strategy reads the fields it needs and validates them.
 *
 * @param keepAllWithin        backups younger than this are always kept
 * @param onePerMonthWithin    backups younger than this (and not kept above) are thinned to one per month
 * @param onePerMonthTolerance how far from the 1st of a month a backup may be to represent that month
 *                             ({@link KeepOnePerMonth} only)
 * @param keepLast             number of newest backups to keep ({@link KeepLastN} only)
 */
public record PolicyParams(
        Duration keepAllWithin,
        Duration onePerMonthWithin,
        Duration onePerMonthTolerance,
        int keepLast
) {
    public static final Duration DEFAULT_TOLERANCE = Duration.ofDays(15);

    public static PolicyParams ofDays(long keepAllWithinDays, long onePerMonthWithinDays) {
        return new PolicyParams(Duration.ofDays(keepAllWithinDays), Duration.ofDays(onePerMonthWithinDays),
                DEFAULT_TOLERANCE, 0);
    }

    public static PolicyParams keepLast(int count) {
        return new PolicyParams(null, null, DEFAULT_TOLERANCE, count);
    }

    public PolicyParams withTolerance(Duration tolerance) {
        return new PolicyParams(keepAllWithin, onePerMonthWithin, tolerance, keepLast);
    }

    public PolicyParams withKeepAllWithin(Duration duration) {
        return new PolicyParams(duration, onePerMonthWithin, onePerMonthTolerance, keepLast);
    }

    Duration requireKeepAllWithin() {
        return requireNonNegative("keepAllWithin", keepAllWithin);
    }

    Duration requireOnePerMonthWithin() {
        return requireNonNegative("onePerMonthWithin", onePerMonthWithin);
    }

    Duration requireTolerance() {
        return requireNonNegative("onePerMonthTolerance", onePerMonthTolerance);
    }

    /**
     * Both band limits present, non-negative and ordered.
     */
    void requireOrderedBands() {
        Duration keepAll = requireKeepAllWithin();
        Duration onePerMonth = requireOnePerMonthWithin();
        if (onePerMonth.compareTo(keepAll) < 0) {
            throw new InvalidPolicyException("onePerMonthWithin (" + onePerMonth
                    + ") must not be shorter than keepAllWithin (" + keepAll + ")");
        }
    }

    private static Duration requireNonNegative(String name, Duration value) {
        if (value == null) {
            throw new InvalidPolicyException(name + " is required");
        }
        if (value.isNegative()) {
            throw new InvalidPolicyException(name + " must be non-negative, was " + value);
        }
        return value;
    }
}
