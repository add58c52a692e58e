package org.iceforge.pruner.s3.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.*;

public final class S3ClientFactory {
    private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

    private final List<S3ClientProvider> providers;

    public S3ClientFactory(Collection<S3ClientProvider> springProviders) {
        this(springProviders, ServiceLoader.load(S3ClientProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList());
    }

    S3ClientFactory(Collection<S3ClientProvider> springProviders, Collection<S3ClientProvider> serviceLoaderProviders) {
        List<S3ClientProvider> fromSpring = springProviders == null ? List.of() : List.copyOf(springProviders);

        // Merge by id, Spring wins if same id
        Map<String, S3ClientProvider> merged = new LinkedHashMap<>();
        for (S3ClientProvider p : serviceLoaderProviders) merged.put(p.id(), p);
        for (S3ClientProvider p : fromSpring) merged.put(p.id(), p);

        this.providers = List.copyOf(merged.values());

        log.info("Discovered S3ClientProviders: {}", ids());
    }

    public ResolvedS3 resolve(S3ProviderConfig cfg) {
        S3ClientContext ctx = new S3ClientContext(
                Optional.ofNullable(cfg.getRegion()).filter(r -> !r.isBlank()),
                Optional.ofNullable(cfg.getEndpointOverride()),
                cfg.isPathStyleAccess(),
                cfg.getTags() == null ? Map.of() : Map.copyOf(cfg.getTags()),
                Optional.ofNullable(cfg.getApiTimeout())
        );

        String forced = cfg.getProvider();
        if (forced != null && !forced.isBlank()) {
            S3ClientProvider p = providers.stream()
                    .filter(x -> forced.equals(x.id()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Forced S3 provider '" + forced + "' not found. Available: " + ids()));

            log.info("Using forced S3 provider id='{}' with ctx={}", p.id(), safeCtx(ctx));
            return new ResolvedS3(p.id(), p.s3Client(ctx));
        }

        List<S3ClientProvider> matching = providers.stream()
                .filter(p -> p.supports(ctx))
                .toList();

        if (matching.isEmpty()) {
            throw new IllegalStateException("No S3ClientProvider supports ctx=" + safeCtx(ctx) + " providers=" + ids());
        }

        // Deterministic tie-break: specific providers before the default one, then lexicographically by id.
        S3ClientProvider chosen = matching.stream()
                .sorted(Comparator.comparing((S3ClientProvider p) -> DefaultAwsS3ClientProvider.ID.equals(p.id()))
                        .thenComparing(S3ClientProvider::id))
                .findFirst()
                .orElseThrow();

        log.info("Using S3 provider id='{}' (matched {}) with ctx={}",
                chosen.id(), matching.stream().map(S3ClientProvider::id).toList(), safeCtx(ctx));

        return new ResolvedS3(chosen.id(), chosen.s3Client(ctx));
    }

    private List<String> ids() {
        return providers.stream().map(S3ClientProvider::id).sorted().toList();
    }

    private static String safeCtx(S3ClientContext ctx) {
        // no credentials in the context, only connection settings
        return "region=" + ctx.region().orElse("<default>")
                + ", endpointOverride=" + ctx.endpointOverride().map(Object::toString).orElse("<none>")
                + ", pathStyle=" + ctx.pathStyleAccess()
                + ", tags=" + ctx.tags();
    }

    public record ResolvedS3(String providerId, S3Client s3) {}
}
