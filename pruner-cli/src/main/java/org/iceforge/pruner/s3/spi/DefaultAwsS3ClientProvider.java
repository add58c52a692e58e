package org.iceforge.pruner.s3.spi;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

/** Default provider (ships with the pruner)
 * <br>
 * Uses standard AWS SDK credential resolution (environment, profile, EC2/ECS roles, etc).
 */
public final class DefaultAwsS3ClientProvider implements S3ClientProvider {

    public static final String ID = "default";

    @Override public String id() { return ID; }

    /**
     * Supports everything. {@link S3ClientFactory} only falls back to it when no other provider claims the context.
     */
    @Override
    public boolean supports(S3ClientContext context) {
        return true;
    }

    @Override
    public S3Client s3Client(S3ClientContext ctx) {
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(ctx.pathStyleAccess())
                        .build());
        ctx.region().ifPresent(r -> b.region(Region.of(r)));
        ctx.endpointOverride().ifPresent(b::endpointOverride);
        ctx.apiTimeout().ifPresent(t -> b.overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(t)
                .build()));
        return b.build();
    }
}
