package com.streamengine.dpa.api;

/**
 * Observability hooks for DPA execution.
 *
 * Implementations can be registered with the executor to receive callbacks
 * while a request's function instances are evaluated. This is the primary
 * mechanism for:
 *
 * - Diagnostics: recording which outputs failed and why.
 * - Profiling: timing individual transformation functions.
 * - Metrics: counting computed and failed products per request.
 *
 * Callbacks run on the request thread, inside the fixed-point loop; keep them
 * cheap.
 */
public interface ExecutionListener {

    /**
     * Called before the first pass.
     *
     * @param key     the request's stream context
     * @param pending number of function instances still to compute
     */
    void onExecutionStart(StreamKey key, int pending);

    /**
     * Called after a function instance was computed.
     *
     * @param pass          1-based pass number of the fixed-point loop
     * @param parameterId   catalog id
     * @param name          parameter name
     * @param durationNanos wall time spent in the transformation function
     */
    void onParameterComputed(int pass, int parameterId, String name, long durationNanos);

    /**
     * Called when a function instance is marked failed.
     *
     * @param pass        pass number, or the final pass for instances whose inputs
     *                    never became available
     * @param parameterId catalog id
     * @param name        parameter name
     * @param reason      human-readable reason, also stored on the instance
     * @param error       the underlying exception, or null
     */
    void onParameterFailed(int pass, int parameterId, String name, String reason, Throwable error);

    /**
     * Called when no further progress is possible.
     *
     * @param key      the request's stream context
     * @param passes   number of passes run
     * @param computed instances computed during this run
     * @param failed   instances failed during this run
     */
    void onExecutionEnd(StreamKey key, int passes, int computed, int failed);
}
