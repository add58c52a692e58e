package org.iceforge.pruner.cli;

import org.iceforge.pruner.config.PrunerProperties;
import org.iceforge.pruner.strategy.PolicyParams;
import org.springframework.boot.ApplicationArguments;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Command-line flags of one prune invocation, resolved against the configured defaults.
 * <p>
 * Durations on the command line are whole days. Option names containing a dot are Spring property
 * overrides ({@code --pruner.page-size=500}) and are left to Spring.
 *
 * @param bucket           bucket holding the backups
 * @param region           region override, {@code null} for the configured one
 * @param prefix           key prefix of the backups, empty for the whole bucket
 * @param strategy         retention strategy name
 * @param params           policy parameters
 * @param dryRun           decide and report only
 * @param skipConfirmation do not ask before deleting
 */
public record CliOptions(
        String bucket,
        String region,
        String prefix,
        String strategy,
        PolicyParams params,
        boolean dryRun,
        boolean skipConfirmation
) {
    static final String REGION = "region";
    static final String BUCKET = "bucket";
    static final String PREFIX = "prefix";
    static final String STRATEGY = "strategy";
    static final String KEEP_ALL_WITHIN = "keep_all_within";
    static final String ONE_PER_MONTH_WITHIN = "one_per_month_within";
    static final String ONE_PER_MONTH_TOLERANCE = "one_per_month_tolerance";
    static final String KEEP_LAST = "keep_last";
    static final String DRY_RUN = "dry_run";
    static final String SKIP_CONFIRMATION = "skip_confirmation";

    private static final Set<String> KNOWN = Set.of(REGION, BUCKET, PREFIX, STRATEGY, KEEP_ALL_WITHIN,
            ONE_PER_MONTH_WITHIN, ONE_PER_MONTH_TOLERANCE, KEEP_LAST, DRY_RUN, SKIP_CONFIRMATION);

    /**
     * @throws IllegalArgumentException on unknown flags, missing or malformed values, or a missing bucket
     */
    public static CliOptions parse(ApplicationArguments args, PrunerProperties defaults) {
        for (String name : args.getOptionNames()) {
            if (!KNOWN.contains(name) && !name.contains(".")) {
                throw new IllegalArgumentException("Unknown option --" + name);
            }
        }
        boolean yes = false;
        for (String arg : args.getNonOptionArgs()) {
            if (!"-y".equals(arg)) {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "'");
            }
            yes = true;
        }

        String bucket = text(args, BUCKET, defaults.getBucket());
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("--" + BUCKET + " is required");
        }

        PolicyParams params = new PolicyParams(
                days(args, KEEP_ALL_WITHIN, defaults.getKeepAllWithin()),
                days(args, ONE_PER_MONTH_WITHIN, defaults.getOnePerMonthWithin()),
                days(args, ONE_PER_MONTH_TOLERANCE, defaults.getOnePerMonthTolerance()),
                count(args, KEEP_LAST, defaults.getKeepLast()));

        String prefix = text(args, PREFIX, defaults.getPrefix());
        return new CliOptions(
                bucket,
                text(args, REGION, null),
                prefix == null ? "" : prefix,
                text(args, STRATEGY, defaults.getStrategy()),
                params,
                flag(args, DRY_RUN),
                yes || flag(args, SKIP_CONFIRMATION));
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: pruner --bucket=<name> [--region=<region>] [--prefix=<prefix>]",
                "              [--strategy=<name>] [--keep_all_within=<days>] [--one_per_month_within=<days>]",
                "              [--one_per_month_tolerance=<days>] [--keep_last=<n>]",
                "              [--dry_run] [--skip_confirmation | -y] [--pruner.<property>=<value> ...]");
    }

    private static String single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + name + " needs a value");
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0).trim();
    }

    private static String text(ApplicationArguments args, String name, String fallback) {
        String v = single(args, name);
        return v == null ? fallback : v;
    }

    private static Duration days(ApplicationArguments args, String name, Duration fallback) {
        String v = single(args, name);
        if (v == null) {
            return fallback;
        }
        long days = parseNonNegative(name, v);
        return Duration.ofDays(days);
    }

    private static int count(ApplicationArguments args, String name, int fallback) {
        String v = single(args, name);
        if (v == null) {
            return fallback;
        }
        long n = parseNonNegative(name, v);
        if (n > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("--" + name + " is too large: " + v);
        }
        return (int) n;
    }

    private static long parseNonNegative(String name, String v) {
        long n;
        try {
            n = Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a whole number, was '" + v + "'", e);
        }
        if (n < 0) {
            throw new IllegalArgumentException("--" + name + " must not be negative, was " + v);
        }
        return n;
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String v = values.get(values.size() - 1).trim();
        if ("true".equalsIgnoreCase(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        throw new IllegalArgumentException("--" + name + " takes no value or true/false, was '" + v + "'");
    }
}
