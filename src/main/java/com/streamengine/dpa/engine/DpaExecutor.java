package com.streamengine.dpa.engine;

import com.streamengine.dpa.api.DataProductFunction;
import com.streamengine.dpa.api.ExecutionListener;
import com.streamengine.dpa.api.FunctionArguments;
import com.streamengine.dpa.api.MissingCoefficientException;
import com.streamengine.dpa.api.TransformationException;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.fn.FunctionRegistry;
import com.streamengine.dpa.instance.FunctionParameterInstance;
import com.streamengine.dpa.instance.InstanceState;
import com.streamengine.dpa.instance.ParameterInstance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the function instances of a request.
 *
 * Algorithm Details:
 * The executor runs a fixed-point loop over the request's function instances
 * in working-set order:
 *
 * 1. Pass: every pending instance is offered to the binder. If all of its
 * inputs carry data it is executed immediately, so a later instance in the
 * same pass can already consume its output.
 *
 * 2. Contain: a missing coefficient or a failing transformation marks only
 * that instance FAILED. Siblings that do not depend on it still compute.
 *
 * 3. Repeat: passes continue while at least one instance was computed or
 * failed.
 *
 * 4. Settle: when a pass makes no progress, every instance still pending is
 * marked FAILED with the list of inputs that never got data.
 *
 * A COMPUTED instance is never evaluated again, so calling
 * {@link #executeAll(StreamRequest)} twice on the same request is harmless.
 * Because the closure lists inputs before their consumers, an acyclic
 * request normally settles in one productive pass plus one empty one.
 */
public final class DpaExecutor {
    private static final Logger log = LogManager.getLogger(DpaExecutor.class);

    private final FunctionRegistry functions;
    private final ArgumentBinder binder;
    private ExecutionListener listener;

    public DpaExecutor(FunctionRegistry functions) {
        this(functions, new ArgumentBinder());
    }

    public DpaExecutor(FunctionRegistry functions, ArgumentBinder binder) {
        this.functions = functions;
        this.binder = binder;
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    /**
     * Executes one bound instance and stores its result.
     *
     * @throws TransformationException if the function is unknown, throws, or
     *                                 returns an array whose leading length
     *                                 does not match its inputs
     */
    public void executeOne(FunctionParameterInstance fp, FunctionArguments args) {
        String name = fp.function();
        DataProductFunction fn = functions.lookup(name);
        if (fn == null)
            throw new TransformationException(name, "no such function registered");

        if (fp.state() != InstanceState.READY)
            fp.markReady();

        NdArray result;
        try {
            result = fn.apply(args);
        } catch (TransformationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformationException(name, String.valueOf(e.getMessage()), e);
        }

        if (result == null)
            throw new TransformationException(name, "returned no result");
        if (args.positionalCount() > 0) {
            int expected = args.array(0).length();
            if (result.length() != expected)
                throw new TransformationException(name,
                        "returned " + result.length() + " rows for " + expected + " input rows");
        }
        fp.complete(result);
    }

    /**
     * Runs the fixed-point loop to completion.
     *
     * @return what was computed and what failed during this call
     */
    public ExecutionReport executeAll(StreamRequest request) {
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;

        List<FunctionParameterInstance> pending = new ArrayList<>();
        for (FunctionParameterInstance fp : request.functionInstances())
            if (fp.isPending())
                pending.add(fp);

        if (hasListener)
            l.onExecutionStart(request.key(), pending.size());

        List<Integer> computed = new ArrayList<>();
        Map<Integer, String> failed = new LinkedHashMap<>();
        Map<Integer, ParameterInstance> instances = request.dataMap();
        int pass = 0;
        boolean progress = true;

        while (progress && !pending.isEmpty()) {
            pass++;
            progress = false;
            List<FunctionParameterInstance> next = new ArrayList<>(pending.size());

            for (FunctionParameterInstance fp : pending) {
                long start = hasListener ? System.nanoTime() : 0;
                try {
                    var args = binder.buildFuncMap(fp, instances, request.coefficients());
                    if (args.isEmpty()) {
                        next.add(fp);
                        continue;
                    }
                    executeOne(fp, args.get());
                    computed.add(fp.id());
                    progress = true;
                    if (hasListener)
                        l.onParameterComputed(pass, fp.id(), fp.name(), System.nanoTime() - start);
                } catch (MissingCoefficientException | TransformationException e) {
                    fail(fp, e.getMessage(), e, pass, failed);
                    progress = true;
                }
            }
            pending = next;
            log.debug("Pass {} for {}: {} computed so far, {} pending", pass, request.key(),
                    computed.size(), pending.size());
        }

        if (!pending.isEmpty()) {
            for (FunctionParameterInstance fp : pending)
                fail(fp, "unsatisfied inputs " + unsatisfiedInputs(fp, instances), null, pass, failed);
        }

        if (hasListener)
            l.onExecutionEnd(request.key(), pass, computed.size(), failed.size());

        if (!failed.isEmpty())
            log.info("Executed {}: {} computed, {} failed {}", request.key(), computed.size(), failed.size(),
                    failed.keySet());
        return new ExecutionReport(pass, computed, failed);
    }

    private void fail(FunctionParameterInstance fp, String reason, Throwable error, int pass,
            Map<Integer, String> failed) {
        log.warn("Failed to compute {} ({}): {}", fp.id(), fp.name(), reason);
        fp.markFailed(reason);
        failed.put(fp.id(), reason);
        if (listener != null)
            listener.onParameterFailed(pass, fp.id(), fp.name(), reason, error);
    }

    private static List<Integer> unsatisfiedInputs(FunctionParameterInstance fp,
            Map<Integer, ParameterInstance> instances) {
        List<Integer> missing = new ArrayList<>();
        for (int id : fp.parameter().inputs()) {
            ParameterInstance input = instances.get(id);
            if (input == null || !input.hasData())
                missing.add(id);
        }
        return missing;
    }
}
