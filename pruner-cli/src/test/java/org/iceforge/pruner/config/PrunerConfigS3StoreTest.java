package org.iceforge.pruner.config;

import org.iceforge.pruner.aws.s3.S3StorageAdapter;
import org.iceforge.pruner.aws.s3.S3StorageAdapterFactory;
import org.iceforge.pruner.s3.spi.S3ProviderConfig;
import org.iceforge.pruner.storage.StorageAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = PrunerConfig.class,
        properties = {
                "pruner.s3.region=us-east-1",
                "pruner.s3.endpoint-override=http://localhost:9000",
                "pruner.s3.path-style-access=true",
                "pruner.s3.api-timeout=30s",
                "pruner.s3.tags.env=test"
        })
class PrunerConfigS3StoreTest {

    @Autowired StorageAdapterFactory stores;
    @Autowired S3ProviderConfig s3Config;

    @Test
    void s3IsTheDefaultStore() {
        assertInstanceOf(S3StorageAdapterFactory.class, stores);
    }

    @Test
    void bindsS3ProviderConfig() {
        assertEquals("us-east-1", s3Config.getRegion());
        assertEquals(URI.create("http://localhost:9000"), s3Config.getEndpointOverride());
        assertTrue(s3Config.isPathStyleAccess());
        assertEquals(Duration.ofSeconds(30), s3Config.getApiTimeout());
        assertEquals("test", s3Config.getTags().get("env"));
    }

    @Test
    void opensBucketThroughDefaultProvider() {
        // building the client does not touch the network
        StorageAdapter adapter = stores.open("backups", "eu-west-1");

        assertInstanceOf(S3StorageAdapter.class, adapter);
        assertEquals("s3://backups", adapter.describe());
    }
}
