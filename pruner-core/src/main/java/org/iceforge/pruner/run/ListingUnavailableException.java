package org.iceforge.pruner.run;

import org.iceforge.pruner.PruneException;

/**
 * The prefix could not be listed completely. No decision is made on a partial listing.
 */
public class ListingUnavailableException extends PruneException {
    public ListingUnavailableException(String prefix, String reason, Throwable cause) {
        super("Listing unavailable for prefix '" + prefix + "': " + reason, cause);
    }
}
