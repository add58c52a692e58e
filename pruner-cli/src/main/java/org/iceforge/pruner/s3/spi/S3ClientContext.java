package org.iceforge.pruner.s3.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Connection settings for the bucket holding the backups.
 * <br>
 * {@code tags} are opaque to the pruner and only used by providers to pick themselves, for example
 * {@code backup-account=archive} to route to a role in the account that owns the backup bucket.
 */
public record S3ClientContext(
        Optional<String> region,          // empty: SDK region chain
        Optional<URI> endpointOverride,   // MinIO, Ceph, VPC endpoints
        boolean pathStyleAccess,
        Map<String, String> tags,
        Optional<Duration> apiTimeout
) {}
