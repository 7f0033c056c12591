package com.streamengine.dpa.instance;

import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.catalog.Parameter;

import java.util.Objects;

/**
 * A catalog parameter bound into one request's working set.
 *
 * There are exactly two variants, {@link DataParameterInstance} and
 * {@link FunctionParameterInstance}; engine code dispatches on them with
 * {@code instanceof} rather than through virtual methods.
 *
 * Instances are mutated by a single thread per request and are not
 * thread-safe.
 */
public abstract class ParameterInstance {
    private final Parameter parameter;
    private final StreamKey streamKey;

    protected NdArray data;
    protected InstanceState state = InstanceState.UNRESOLVED;
    private String failureReason;

    ParameterInstance(Parameter parameter, StreamKey streamKey) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
    }

    public static ParameterInstance create(Parameter parameter, StreamKey streamKey) {
        return parameter.isData()
                ? new DataParameterInstance(parameter, streamKey)
                : new FunctionParameterInstance(parameter, streamKey);
    }

    public Parameter parameter() {
        return parameter;
    }

    public int id() {
        return parameter.id();
    }

    public String name() {
        return parameter.name();
    }

    /** The stream context this instance was registered under. */
    public StreamKey streamKey() {
        return streamKey;
    }

    /** Current values, or null while unresolved or after a failure. */
    public NdArray data() {
        return data;
    }

    public boolean hasData() {
        return data != null;
    }

    public InstanceState state() {
        return state;
    }

    /** Why this instance failed, or null. */
    public String failureReason() {
        return failureReason;
    }

    /** Drops any data and records the failure. Terminal. */
    public void markFailed(String reason) {
        this.data = null;
        this.state = InstanceState.FAILED;
        this.failureReason = reason;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + " " + name() + " " + state + "]";
    }
}
