package org.iceforge.pruner.config;

import org.iceforge.pruner.aws.s3.S3StorageAdapterFactory;
import org.iceforge.pruner.catalog.BackupCatalog;
import org.iceforge.pruner.catalog.KeyPatternTimestampRule;
import org.iceforge.pruner.catalog.TimestampRule;
import org.iceforge.pruner.cli.ConsoleConfirmation;
import org.iceforge.pruner.local.LocalFsStorageAdapter;
import org.iceforge.pruner.run.DeletionConfirmation;
import org.iceforge.pruner.run.RetryPolicy;
import org.iceforge.pruner.s3.spi.DefaultAwsS3ClientProvider;
import org.iceforge.pruner.s3.spi.S3ClientFactory;
import org.iceforge.pruner.s3.spi.S3ClientProvider;
import org.iceforge.pruner.s3.spi.S3ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties({PrunerProperties.class, S3ProviderConfig.class})
public class PrunerConfig {
    private static final Logger logger = LoggerFactory.getLogger(PrunerConfig.class);

    @Bean
    public ZoneId prunerZone(PrunerProperties props) {
        return ZoneId.of(props.getZone());
    }

    @Bean
    public TimestampRule timestampRule(PrunerProperties props, ZoneId prunerZone) {
        PrunerProperties.Timestamp ts = props.getTimestamp();
        TimestampRule rule = switch (ts.getSource()) {
            case LAST_MODIFIED -> TimestampRule.lastModified();
            case KEY_PATTERN -> new KeyPatternTimestampRule(ts.getKeyPattern(), ts.getKeyFormat(), prunerZone);
            case KEY_PATTERN_OR_LAST_MODIFIED -> TimestampRule.firstOf(
                    new KeyPatternTimestampRule(ts.getKeyPattern(), ts.getKeyFormat(), prunerZone),
                    TimestampRule.lastModified());
        };
        logger.info("Backup timestamps taken from {}", rule.describe());
        return rule;
    }

    @Bean
    public BackupCatalog backupCatalog(TimestampRule timestampRule) {
        return new BackupCatalog(timestampRule);
    }

    @Bean
    public RetryPolicy retryPolicy(PrunerProperties props) {
        PrunerProperties.Retry r = props.getRetry();
        return new RetryPolicy(r.getMaxAttempts(), r.getInitialBackoff(), r.getMultiplier(), r.getMaxBackoff());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeletionConfirmation consoleConfirmation() {
        return new ConsoleConfirmation();
    }

    @Bean
    @ConditionalOnProperty(prefix = "pruner", name = "store", havingValue = "s3", matchIfMissing = true)
    public S3ClientProvider defaultAwsS3ClientProvider() {
        return new DefaultAwsS3ClientProvider();
    }

    @Bean
    @ConditionalOnProperty(prefix = "pruner", name = "store", havingValue = "s3", matchIfMissing = true)
    public S3ClientFactory s3ClientFactory(ObjectProvider<S3ClientProvider> providers) {
        return new S3ClientFactory(providers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pruner", name = "store", havingValue = "s3", matchIfMissing = true)
    public StorageAdapterFactory s3StorageAdapterFactory(S3ClientFactory s3ClientFactory, S3ProviderConfig s3Config,
                                                         PrunerProperties props) {
        return new S3StorageAdapterFactory(s3ClientFactory, s3Config, props.getPageSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pruner", name = "store", havingValue = "local")
    public StorageAdapterFactory localStorageAdapterFactory(PrunerProperties props) {
        Path baseDir = Path.of(props.getLocalBaseDir());
        // the local store has no regions
        return (bucket, region) -> new LocalFsStorageAdapter(baseDir, bucket, props.getPageSize());
    }
}
