package com.streamengine.dpa.instance;

import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.catalog.Parameter;

/**
 * An observed parameter: values plus one timestamp per leading-axis row.
 *
 * {@code times.length == data.length()} is expected whenever both are set;
 * this class stores whatever it is given and leaves the check to the time
 * aligner so that a bad series fails on its own without aborting the fetch.
 */
public final class DataParameterInstance extends ParameterInstance {
    private double[] times;

    public DataParameterInstance(Parameter parameter, StreamKey streamKey) {
        super(parameter, streamKey);
        if (!parameter.isData())
            throw new IllegalArgumentException(parameter + " is not a data parameter");
    }

    /** A copy of the time axis, or null while unpopulated. */
    public double[] times() {
        return times == null ? null : times.clone();
    }

    /**
     * Sets raw samples. A null or empty series leaves the instance
     * unresolved, since nothing can be interpolated out of it.
     */
    public void populate(double[] times, NdArray data) {
        if (state == InstanceState.FAILED)
            throw new IllegalStateException(this + " already failed: " + failureReason());
        if (data == null || data.length() == 0 || times == null || times.length == 0) {
            this.times = null;
            this.data = null;
            this.state = InstanceState.UNRESOLVED;
            return;
        }
        this.times = times.clone();
        this.data = data;
        this.state = InstanceState.POPULATED;
    }

    /** Replaces the series after resampling onto the common grid. */
    public void resampled(double[] grid, NdArray values) {
        this.times = grid.clone();
        this.data = values;
        this.state = InstanceState.POPULATED;
    }

    @Override
    public void markFailed(String reason) {
        super.markFailed(reason);
        this.times = null;
    }
}
