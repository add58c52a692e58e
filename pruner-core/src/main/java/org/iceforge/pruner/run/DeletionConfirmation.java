package org.iceforge.pruner.run;

import org.iceforge.pruner.strategy.RetentionDecision;

/**
 * Last gate before deletes are issued. Not consulted on dry runs or when nothing is to be deleted.
 */
@FunctionalInterface
public interface DeletionConfirmation {

    /**
     * @param prefix   scope of the run
     * @param decision what is about to be kept and deleted
     * @return {@code true} to proceed with the deletes
     */
    boolean confirm(String prefix, RetentionDecision decision);

    static DeletionConfirmation always() {
        return (prefix, decision) -> true;
    }
}
