package com.streamengine.dpa.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link DpaExecutor#executeAll(StreamRequest)} run.
 *
 * @param passes   fixed-point passes run, including the final one that made
 *                 no progress
 * @param computed ids computed during the run, in completion order
 * @param failed   failed ids with their reasons, in failure order
 */
public record ExecutionReport(int passes, List<Integer> computed, Map<Integer, String> failed) {

    public ExecutionReport {
        computed = List.copyOf(computed);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
