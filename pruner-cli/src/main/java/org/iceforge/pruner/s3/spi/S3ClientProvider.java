package org.iceforge.pruner.s3.spi;

import software.amazon.awssdk.services.s3.S3Client;

/**
 * Creates the {@link S3Client} used to list and delete backups.
 * <br>
 * Deployments that reach their backup bucket through an assumed role, a proxy or a non-AWS endpoint plug in
 * their own provider; {@link DefaultAwsS3ClientProvider} covers the plain credential chain.
 * <br>
 * Implementations are found as Spring beans or through {@link java.util.ServiceLoader}
 * ({@code META-INF/services/org.iceforge.pruner.s3.spi.S3ClientProvider}).
 */
public interface S3ClientProvider {

    /** Id matched against {@code pruner.s3.provider}, e.g. "default" or "backup-vault-role". */
    String id();

    /** Whether this provider can reach the bucket described by {@code context}. */
    boolean supports(S3ClientContext context);

    /** New client per opened bucket; closed by the caller when the run ends. */
    S3Client s3Client(S3ClientContext context);
}
