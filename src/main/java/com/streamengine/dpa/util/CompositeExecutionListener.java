package com.streamengine.dpa.util;

import com.streamengine.dpa.api.ExecutionListener;
import com.streamengine.dpa.api.StreamKey;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link ExecutionListener} instances.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private ExecutionListener[] listeners = new ExecutionListener[0];

    public void addForComposite(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onExecutionStart(StreamKey key, int pending) {
        for (ExecutionListener l : listeners)
            l.onExecutionStart(key, pending);
    }

    @Override
    public void onParameterComputed(int pass, int parameterId, String name, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onParameterComputed(pass, parameterId, name, durationNanos);
    }

    @Override
    public void onParameterFailed(int pass, int parameterId, String name, String reason, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onParameterFailed(pass, parameterId, name, reason, error);
    }

    @Override
    public void onExecutionEnd(StreamKey key, int passes, int computed, int failed) {
        for (ExecutionListener l : listeners)
            l.onExecutionEnd(key, passes, computed, failed);
    }
}
