package org.iceforge.pruner;

/**
 * Root of the failures a prune run can raise. Anything extending this type and escaping
 * {@link org.iceforge.pruner.run.PruneRunner#run} means the run ended in the FAILED state.
 */
public class PruneException extends RuntimeException {
    public PruneException(String message, Throwable cause) { super(message, cause); }
    public PruneException(String message) { super(message); }
}
