package org.iceforge.pruner.testutil;

import org.iceforge.pruner.storage.DeleteStatus;
import org.iceforge.pruner.storage.ListPage;
import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StorageAdapter;
import org.iceforge.pruner.storage.StoredObject;
import org.iceforge.pruner.storage.TransientStorageException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Key-ordered in-memory store with page-sized listings and scriptable failures.
 */
public final class InMemoryStorageAdapter implements StorageAdapter {

    private final NavigableMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();
    private final int pageSize;

    private final AtomicInteger listCalls = new AtomicInteger();
    private final AtomicInteger transientListFailures = new AtomicInteger();
    private volatile boolean permanentListFailure;

    private final Map<String, AtomicInteger> deleteCalls = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> transientDeleteFailures = new ConcurrentHashMap<>();
    private final Set<String> permanentDeleteFailures = ConcurrentHashMap.newKeySet();

    public InMemoryStorageAdapter(int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
        this.pageSize = pageSize;
    }

    public InMemoryStorageAdapter put(String key, Instant lastModified) {
        objects.put(key, StoredObject.of(key, lastModified));
        return this;
    }

    public InMemoryStorageAdapter put(StoredObject object) {
        objects.put(object.key(), object);
        return this;
    }

    /** The next {@code times} list calls fail with a transient error. */
    public void failListing(int times) {
        transientListFailures.set(times);
    }

    public void failListingPermanently() {
        permanentListFailure = true;
    }

    /** The next {@code times} delete calls for {@code key} fail with a transient error. */
    public void failDelete(String key, int times) {
        transientDeleteFailures.put(key, new AtomicInteger(times));
    }

    public void failDeletePermanently(String key) {
        permanentDeleteFailures.add(key);
    }

    public Set<String> keys() {
        return Set.copyOf(objects.keySet());
    }

    public int listCalls() {
        return listCalls.get();
    }

    public int deleteCalls(String key) {
        AtomicInteger n = deleteCalls.get(key);
        return n == null ? 0 : n.get();
    }

    public int totalDeleteCalls() {
        return deleteCalls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    @Override
    public ListPage list(String prefix, String continuationToken) {
        listCalls.incrementAndGet();
        if (permanentListFailure) {
            throw new PermanentStorageException("access denied");
        }
        if (transientListFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientStorageException("slow down");
        }

        NavigableMap<String, StoredObject> view = continuationToken == null
                ? objects
                : objects.tailMap(continuationToken, false);
        List<StoredObject> page = new ArrayList<>();
        String last = null;
        for (StoredObject o : view.values()) {
            if (!o.key().startsWith(prefix)) {
                continue;
            }
            if (page.size() == pageSize) {
                return new ListPage(page, last);
            }
            page.add(o);
            last = o.key();
        }
        return ListPage.last(page);
    }

    @Override
    public DeleteStatus delete(String key) {
        deleteCalls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        if (permanentDeleteFailures.contains(key)) {
            throw new PermanentStorageException("access denied for " + key);
        }
        AtomicInteger remaining = transientDeleteFailures.get(key);
        if (remaining != null && remaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientStorageException("internal error deleting " + key);
        }
        return objects.remove(key) == null ? DeleteStatus.NOT_FOUND : DeleteStatus.DELETED;
    }

    @Override
    public String describe() {
        return "memory://test";
    }
}
