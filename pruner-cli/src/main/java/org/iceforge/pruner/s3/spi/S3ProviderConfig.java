package org.iceforge.pruner.s3.spi;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "pruner.s3")
public class S3ProviderConfig {
    /**
     * Forces the provider with this id, e.g. "backup-vault-role"; resolving fails if no such provider exists.
     */
    private String provider;

    private String region;
    private URI endpointOverride;

    /** Needed by most S3-compatible stores (MinIO, Ceph) behind an endpoint override. */
    private boolean pathStyleAccess;

    private Duration apiTimeout;

    /** Passed to providers untouched, e.g. backup-account=archive. */
    private Map<String, String> tags = new HashMap<>();

    /** Copy of this config with another region, used when the region is given on the command line. */
    public S3ProviderConfig withRegion(String region) {
        S3ProviderConfig copy = new S3ProviderConfig();
        copy.setProvider(provider);
        copy.setRegion(region);
        copy.setEndpointOverride(endpointOverride);
        copy.setPathStyleAccess(pathStyleAccess);
        copy.setApiTimeout(apiTimeout);
        copy.setTags(tags == null ? new HashMap<>() : new HashMap<>(tags));
        return copy;
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public URI getEndpointOverride() { return endpointOverride; }
    public void setEndpointOverride(URI endpointOverride) { this.endpointOverride = endpointOverride; }

    public boolean isPathStyleAccess() { return pathStyleAccess; }
    public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

    public Duration getApiTimeout() { return apiTimeout; }
    public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }

    public Map<String, String> getTags() { return tags; }
    public void setTags(Map<String, String> tags) { this.tags = tags; }
}
