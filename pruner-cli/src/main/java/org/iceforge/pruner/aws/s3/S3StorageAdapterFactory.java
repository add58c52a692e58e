package org.iceforge.pruner.aws.s3;

import org.iceforge.pruner.PruneException;
import org.iceforge.pruner.config.StorageAdapterFactory;
import org.iceforge.pruner.s3.spi.S3ClientFactory;
import org.iceforge.pruner.s3.spi.S3ProviderConfig;
import org.iceforge.pruner.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Resolves an S3 client through the provider SPI for every bucket opened and closes them on shutdown.
 */
public class S3StorageAdapterFactory implements StorageAdapterFactory, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(S3StorageAdapterFactory.class);

    private final S3ClientFactory clients;
    private final S3ProviderConfig config;
    private final int pageSize;
    private final List<S3Client> opened = new CopyOnWriteArrayList<>();

    public S3StorageAdapterFactory(S3ClientFactory clients, S3ProviderConfig config, int pageSize) {
        this.clients = clients;
        this.config = config;
        this.pageSize = pageSize;
    }

    @Override
    public StorageAdapter open(String bucket, String region) {
        S3ProviderConfig effective = region == null || region.isBlank() ? config : config.withRegion(region);
        S3ClientFactory.ResolvedS3 resolved;
        try {
            resolved = clients.resolve(effective);
        } catch (IllegalStateException | SdkException e) {
            throw new PruneException("Cannot create S3 client for bucket " + bucket + ": " + e.getMessage(), e);
        }
        opened.add(resolved.s3());
        logger.info("Opened s3://{} via provider '{}'", bucket, resolved.providerId());
        return new S3StorageAdapter(resolved.s3(), bucket, pageSize);
    }

    @Override
    public void close() {
        for (S3Client client : opened) {
            client.close();
        }
        opened.clear();
    }
}
