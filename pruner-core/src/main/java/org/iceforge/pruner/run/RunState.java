package org.iceforge.pruner.run;

/**
 * Phases of one prune run: LISTING → DECIDING → DELETING → DONE, with FAILED reachable from any of them.
 */
public enum RunState {
    IDLE,
    LISTING,
    DECIDING,
    DELETING,
    DONE,
    FAILED
}
