package com.streamengine.dpa.instance;

import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.catalog.Parameter;

import java.util.Objects;

/**
 * A derived parameter. Holds no data until its transformation function has
 * run; its time axis is the request's common grid.
 */
public final class FunctionParameterInstance extends ParameterInstance {

    public FunctionParameterInstance(Parameter parameter, StreamKey streamKey) {
        super(parameter, streamKey);
        if (!parameter.isFunction())
            throw new IllegalArgumentException(parameter + " is not a function parameter");
    }

    /** Name of the transformation function to invoke. */
    public String function() {
        return parameter().function();
    }

    public boolean isComputed() {
        return state == InstanceState.COMPUTED;
    }

    public boolean isPending() {
        return state == InstanceState.UNRESOLVED || state == InstanceState.READY;
    }

    /** Arguments bound; about to execute. */
    public void markReady() {
        if (!isPending())
            throw new IllegalStateException(this + " cannot become READY from " + state);
        this.state = InstanceState.READY;
    }

    /**
     * Stores the function output. An instance is computed at most once per
     * request.
     */
    public void complete(NdArray result) {
        if (state == InstanceState.COMPUTED)
            throw new IllegalStateException(this + " is already computed");
        if (state == InstanceState.FAILED)
            throw new IllegalStateException(this + " already failed: " + failureReason());
        this.data = Objects.requireNonNull(result, "result");
        this.state = InstanceState.COMPUTED;
    }
}
