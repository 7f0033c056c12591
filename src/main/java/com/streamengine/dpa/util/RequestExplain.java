package com.streamengine.dpa.util;

import com.streamengine.dpa.engine.StreamRequest;
import com.streamengine.dpa.instance.DataParameterInstance;
import com.streamengine.dpa.instance.InstanceState;
import com.streamengine.dpa.instance.ParameterInstance;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic utility for inspecting the working set of a request.
 *
 * <p>
 * Generates human-readable dumps of instance state, so a log line can show
 * which outputs failed and why.
 *
 * <p>
 * <b>Usage:</b> debugging and error logging. Allocates strings; keep it off
 * loops over large requests.
 */
public final class RequestExplain {
    private final StreamRequest request;

    public RequestExplain(StreamRequest request) {
        this.request = request;
    }

    /**
     * Dumps detailed state of a single instance.
     */
    public String explainParameter(int id) {
        ParameterInstance pi = request.instance(id);
        if (pi == null)
            return "Parameter " + id + ": not in working set\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Parameter: ").append(pi.id()).append(' ').append(pi.name()).append('\n')
                .append("  Kind: ").append(pi.parameter().kind()).append('\n')
                .append("  Stream: ").append(pi.streamKey()).append('\n')
                .append("  State: ").append(pi.state()).append('\n')
                .append("  Shape: ").append(shape(pi)).append('\n');
        if (pi.hasData())
            sb.append("  Dtype: ").append(pi.data().dtypeTag()).append('\n');
        if (pi instanceof DataParameterInstance dp && dp.times() != null)
            sb.append("  Samples: ").append(dp.times().length).append('\n');
        if (pi.parameter().isFunction()) {
            sb.append("  Function: ").append(pi.parameter().function()).append('\n')
                    .append("  Inputs: ").append(pi.parameter().inputs()).append('\n');
            if (!pi.parameter().coefficients().isEmpty())
                sb.append("  Coefficients: ").append(pi.parameter().coefficients()).append('\n');
        }
        if (pi.failureReason() != null)
            sb.append("  Reason: ").append(pi.failureReason()).append('\n');
        return sb.toString();
    }

    /**
     * One line per instance, in working-set order.
     */
    public String dumpRequest() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Request ").append(request.key()).append(" (")
                .append(request.dataMap().size()).append(" instances, requested ")
                .append(request.requested()).append("):\n");
        for (ParameterInstance pi : request.dataMap().values()) {
            sb.append("  [").append(pi.id()).append("] ").append(pi.name())
                    .append(pi.parameter().isData() ? " (DATA) " : " (FN) ")
                    .append(pi.state()).append(' ').append(shape(pi));
            if (pi.failureReason() != null)
                sb.append(" - ").append(pi.failureReason());
            sb.append('\n');
        }
        if (!request.missingCoefficients().isEmpty())
            sb.append("  Missing coefficients: ").append(request.missingCoefficients()).append('\n');
        return sb.toString();
    }

    /** Failed instances with their reasons, in working-set order. */
    public Map<Integer, String> failures() {
        Map<Integer, String> out = new LinkedHashMap<>();
        for (ParameterInstance pi : request.dataMap().values()) {
            if (pi.state() == InstanceState.FAILED)
                out.put(pi.id(), pi.failureReason());
        }
        return out;
    }

    /**
     * Generates a Mermaid JS diagram of the working set, edges running from
     * input to consumer, each instance labelled with its state.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");
        for (ParameterInstance pi : request.dataMap().values()) {
            sb.append("  p").append(pi.id()).append("[\"").append(pi.name())
                    .append("<br/>").append(pi.state()).append("\"]");
            if (pi.state() == InstanceState.FAILED)
                sb.append(":::failed");
            sb.append(";\n");
        }
        for (ParameterInstance pi : request.dataMap().values()) {
            var inputs = pi.parameter().inputs();
            for (int i = 0; i < inputs.size(); i++) {
                sb.append("  p").append(inputs.get(i)).append(" -- \"p").append(i).append("\" --> p")
                        .append(pi.id()).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String shape(ParameterInstance pi) {
        return pi.hasData() ? Arrays.toString(pi.data().shape()) : "-";
    }
}
