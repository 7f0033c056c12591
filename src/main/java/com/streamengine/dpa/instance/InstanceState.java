package com.streamengine.dpa.instance;

/**
 * Lifecycle of a parameter instance within one request.
 *
 * Function instances move {@code UNRESOLVED -> READY -> COMPUTED} or end in
 * {@code FAILED}. Data instances move {@code UNRESOLVED -> POPULATED} once
 * samples are fetched, or end in {@code FAILED} when the fetch or alignment
 * rejects them.
 */
public enum InstanceState {
    UNRESOLVED,
    READY,
    COMPUTED,
    POPULATED,
    FAILED;

    /** True for the terminal states that carry usable data. */
    public boolean hasValue() {
        return this == COMPUTED || this == POPULATED;
    }
}
