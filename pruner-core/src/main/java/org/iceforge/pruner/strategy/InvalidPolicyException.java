package org.iceforge.pruner.strategy;

import org.iceforge.pruner.PruneException;

/**
 * Policy parameters are contradictory or missing. Raised before any backup is evaluated.
 */
public class InvalidPolicyException extends PruneException {
    public InvalidPolicyException(String message) { super(message); }
}
