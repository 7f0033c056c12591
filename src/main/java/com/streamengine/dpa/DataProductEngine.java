package com.streamengine.dpa;

import com.streamengine.dpa.api.ExecutionListener;
import com.streamengine.dpa.api.ParameterCatalog;
import com.streamengine.dpa.api.RawDataStore;
import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.catalog.Stream;
import com.streamengine.dpa.engine.DataFetcher;
import com.streamengine.dpa.engine.DependencyResolver;
import com.streamengine.dpa.engine.DpaExecutor;
import com.streamengine.dpa.engine.ExecutionReport;
import com.streamengine.dpa.engine.StreamRequest;
import com.streamengine.dpa.engine.TimeAligner;
import com.streamengine.dpa.fn.FunctionRegistry;
import com.streamengine.dpa.instance.CalibrationCoefficient;
import com.streamengine.dpa.io.CalculationRequest;
import com.streamengine.dpa.io.EncodedArray;
import com.streamengine.dpa.io.EngineConfig;
import com.streamengine.dpa.io.JsonCatalogLoader;
import com.streamengine.dpa.io.ResultSerializer;
import com.streamengine.dpa.util.CompositeExecutionListener;
import com.streamengine.dpa.util.RequestExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the data product core.
 * <p>
 * One call to {@link #calculate} runs the full pipeline for a request:
 * <ul>
 * <li>resolving the requested parameters into a working set with
 * {@link DependencyResolver}</li>
 * <li>binding the supplied calibration coefficients</li>
 * <li>fetching raw samples concurrently with {@link DataFetcher}</li>
 * <li>putting every series on one clock with {@link TimeAligner}</li>
 * <li>running the transformation chain with {@link DpaExecutor}</li>
 * <li>encoding the requested outputs with {@link ResultSerializer}</li>
 * </ul>
 * A catalog cycle aborts the request. Every other problem fails only the
 * parameters it touches, which are then missing from the result.
 * <p>
 * The engine itself is safe to share: each request gets its own working set,
 * and the catalog, resolver cache and function registry are only read.
 * Listeners are the exception, they must be registered before requests start.
 */
public class DataProductEngine {
    private static final Logger log = LogManager.getLogger(DataProductEngine.class);

    private final ParameterCatalog catalog;
    private final DependencyResolver resolver;
    private final DataFetcher fetcher;
    private final TimeAligner aligner = new TimeAligner();
    private final DpaExecutor executor;
    private final ResultSerializer serializer = new ResultSerializer();
    private final CompositeExecutionListener compositeListener = new CompositeExecutionListener();

    public DataProductEngine(ParameterCatalog catalog, RawDataStore store) {
        this(catalog, store, new FunctionRegistry(), EngineConfig.load());
    }

    public DataProductEngine(ParameterCatalog catalog, RawDataStore store, FunctionRegistry functions,
            EngineConfig config) {
        this.catalog = catalog;
        this.resolver = new DependencyResolver(catalog);
        this.fetcher = new DataFetcher(store, config.getFetchTimeoutMillis());
        this.executor = new DpaExecutor(functions);
        this.executor.setListener(compositeListener);
    }

    /**
     * Creates an engine over the catalog named by the configuration.
     *
     * @param config engine settings; {@code catalogResource} must name a
     *               classpath catalog document
     */
    public static DataProductEngine fromConfig(EngineConfig config, RawDataStore store) {
        ParameterCatalog catalog = new JsonCatalogLoader().loadResource(config.getCatalogResource());
        return new DataProductEngine(catalog, store, new FunctionRegistry(), config);
    }

    /**
     * Registers a listener for execution events. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(ExecutionListener listener) {
        compositeListener.addForComposite(listener);
    }

    public ParameterCatalog getCatalog() {
        return catalog;
    }

    public DependencyResolver getResolver() {
        return resolver;
    }

    public DpaExecutor getExecutor() {
        return executor;
    }

    public ResultSerializer getSerializer() {
        return serializer;
    }

    /**
     * Builds the working set for a request: every parameter the outputs
     * depend on, plus the supplied coefficients. Nothing is fetched yet.
     *
     * @throws IllegalArgumentException if the stream or a parameter id is
     *                                  unknown
     * @throws com.streamengine.dpa.api.CatalogCycleException if a requested
     *                                  parameter depends on itself
     */
    public StreamRequest prepare(CalculationRequest request, Map<String, Object> coefficients) {
        StreamKey key = request.streamKey();
        Stream stream = catalog.lookupStream(key.stream());
        List<Integer> ids = request.getParameters() == null || request.getParameters().isEmpty()
                ? stream.parameterIds()
                : request.getParameters();

        List<Parameter> targets = new ArrayList<>(ids.size());
        for (int id : ids)
            targets.add(catalog.lookup(id));

        StreamRequest working = new StreamRequest(key);
        resolver.populate(working, targets);
        if (coefficients != null) {
            for (Map.Entry<String, Object> e : coefficients.entrySet()) {
                working.addCoefficient(CalibrationCoefficient.of(key.subsite(), key.node(), key.sensor(),
                        e.getKey(), e.getValue()));
            }
        }
        if (!working.missingCoefficients().isEmpty())
            log.warn("Request {} lacks coefficients {}", key, working.missingCoefficients());
        return working;
    }

    /**
     * Runs the pipeline over an already prepared working set, for example one
     * that merged several streams.
     */
    public CalculationResult calculate(StreamRequest working, double start, double end) {
        fetcher.fetch(working, start, end);
        double[] grid = aligner.align(working);
        ExecutionReport report = executor.executeAll(working);
        Map<String, EncodedArray> outputs = serializer.serialize(working);

        RequestExplain explain = new RequestExplain(working);
        Map<Integer, String> failures = explain.failures();
        if (!failures.isEmpty() && log.isDebugEnabled())
            log.debug(explain.dumpRequest());
        log.info("Calculated {} over [{}, {}]: {} of {} outputs, {} failures", working.key(), start, end,
                outputs.size(), working.requested().size(), failures.size());
        return new CalculationResult(working.key(), grid == null ? 0 : grid.length, outputs, report, failures);
    }

    /**
     * Computes the requested parameters over {@code [start, end]}.
     *
     * @param request      stream context and output ids
     * @param start        window start, seconds, inclusive
     * @param end          window end, seconds, inclusive
     * @param coefficients coefficient name to number or list of numbers
     */
    public CalculationResult calculate(CalculationRequest request, double start, double end,
            Map<String, Object> coefficients) {
        return calculate(prepare(request, coefficients), start, end);
    }

    /**
     * Same as {@link #calculate(CalculationRequest, double, double, Map)},
     * returning the JSON document a client receives: parameter id text to
     * {@code {dtype, shape, data}}.
     */
    public String calculateJson(CalculationRequest request, double start, double end,
            Map<String, Object> coefficients) {
        return serializer.toJson(calculate(request, start, end, coefficients).outputs());
    }
}
