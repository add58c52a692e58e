package org.iceforge.pruner.storage;

import java.util.List;
import java.util.Optional;

/**
 * One page of a prefix listing.
 *
 * @param objects               entries of this page, in the order the store returned them
 * @param nextContinuationToken token for the following page, {@code null} on the last page
 */
public record ListPage(List<StoredObject> objects, String nextContinuationToken) {

    public ListPage {
        objects = objects == null ? List.of() : List.copyOf(objects);
        if (nextContinuationToken != null && nextContinuationToken.isEmpty()) {
            nextContinuationToken = null;
        }
    }

    public static ListPage last(List<StoredObject> objects) {
        return new ListPage(objects, null);
    }

    public Optional<String> continuationToken() {
        return Optional.ofNullable(nextContinuationToken);
    }

    public boolean isLast() {
        return nextContinuationToken == null;
    }
}
