package org.iceforge.pruner.local;

import org.iceforge.pruner.storage.DeleteStatus;
import org.iceforge.pruner.storage.ListPage;
import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StorageAdapter;
import org.iceforge.pruner.storage.StoredObject;
import org.iceforge.pruner.storage.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StorageAdapter}.
 *
 * <p>This is intended for dev / integration-test mode so the pruner can run without any
 * S3 dependency. Paths are mapped as:
 * <pre>
 *   {localBaseDir}/{bucket}/{key}
 * </pre>
 * Listings are in key order; the continuation token is the last key of the previous page.
 */
public class LocalFsStorageAdapter implements StorageAdapter {
    private static final Logger log = LoggerFactory.getLogger(LocalFsStorageAdapter.class);

    private final Path base;
    private final Path bucketRoot;
    private final String bucket;
    private final int pageSize;

    public LocalFsStorageAdapter(Path localBaseDir, String bucket, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.base = localBaseDir.toAbsolutePath().normalize();
        this.bucketRoot = base.resolve(bucket).normalize();
        if (!bucketRoot.startsWith(base) || bucketRoot.equals(base)) {
            throw new IllegalArgumentException("Illegal bucket name: " + bucket);
        }
        this.bucket = bucket;
        this.pageSize = pageSize;
        log.info("Using LOCAL object store: baseDir={} bucket={}", base, bucket);
    }

    private Path pathFor(String key) {
        // Prevent path traversal by normalizing and verifying the bucket prefix.
        Path p = bucketRoot.resolve(key).normalize();
        if (!p.startsWith(bucketRoot) || p.equals(bucketRoot)) {
            throw new PermanentStorageException("Illegal key (path traversal): bucket=" + bucket + " key=" + key);
        }
        return p;
    }

    @Override
    public ListPage list(String prefix, String continuationToken) {
        String p = prefix == null ? "" : prefix;
        if (!bucketRoot.resolve(p).normalize().startsWith(bucketRoot)) {
            throw new PermanentStorageException("Illegal list prefix: " + p);
        }
        if (!Files.isDirectory(bucketRoot)) {
            return ListPage.last(List.of());
        }

        List<Path> files;
        try (Stream<Path> stream = Files.walk(bucketRoot)) {
            files = stream.filter(Files::isRegularFile).toList();
        } catch (IOException | UncheckedIOException e) {
            throw new TransientStorageException("Local list failed bucket=" + bucket + " prefix=" + p, e);
        }

        List<String> keys = files.stream()
                .map(f -> bucketRoot.relativize(f).toString().replace('\\', '/'))
                .filter(k -> k.startsWith(p))
                .filter(k -> continuationToken == null || k.compareTo(continuationToken) > 0)
                .sorted()
                .toList();

        List<StoredObject> page = new ArrayList<>();
        for (String key : keys.subList(0, Math.min(pageSize, keys.size()))) {
            Path f = bucketRoot.resolve(key);
            try {
                page.add(new StoredObject(key, Files.getLastModifiedTime(f).toInstant(), Files.size(f), null));
            } catch (IOException e) {
                throw new TransientStorageException("Local stat failed for " + bucket + "/" + key, e);
            }
        }
        if (keys.size() > pageSize) {
            return new ListPage(page, page.get(page.size() - 1).key());
        }
        return ListPage.last(page);
    }

    @Override
    public DeleteStatus delete(String key) {
        Path p = pathFor(key);
        try {
            return Files.deleteIfExists(p) ? DeleteStatus.DELETED : DeleteStatus.NOT_FOUND;
        } catch (AccessDeniedException e) {
            throw new PermanentStorageException("Local delete denied for " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new TransientStorageException("Local delete failed for " + bucket + "/" + key, e);
        }
    }

    @Override
    public String describe() {
        return "file://" + bucketRoot;
    }
}
