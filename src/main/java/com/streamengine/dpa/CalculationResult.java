package com.streamengine.dpa;

import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.engine.ExecutionReport;
import com.streamengine.dpa.io.EncodedArray;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link DataProductEngine#calculate} call.
 *
 * @param key         the request's stream context
 * @param gridSize    number of points on the common time grid, 0 if no data
 *                    was found
 * @param outputs     encoded requested outputs keyed by parameter id text;
 *                    failed outputs are absent
 * @param report      what the executor computed and failed
 * @param diagnostics every failed instance, data or function, with its reason
 */
public record CalculationResult(StreamKey key, int gridSize, Map<String, EncodedArray> outputs,
        ExecutionReport report, Map<Integer, String> diagnostics) {

    public CalculationResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public boolean isComplete() {
        return diagnostics.isEmpty();
    }
}
