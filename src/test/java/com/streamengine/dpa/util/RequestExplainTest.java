package com.streamengine.dpa.util;

import com.streamengine.dpa.TestCatalogs;
import com.streamengine.dpa.api.ExecutionListener;
import com.streamengine.dpa.api.StreamKey;
import com.streamengine.dpa.engine.DependencyResolver;
import com.streamengine.dpa.engine.StreamRequest;
import com.streamengine.dpa.array.NdArray;
import com.streamengine.dpa.instance.DataParameterInstance;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RequestExplainTest {

    private StreamRequest request() {
        StreamRequest request = new StreamRequest(TestCatalogs.key("ctdpf_ckl_wfp_instrument_recovered"));
        new DependencyResolver(TestCatalogs.standard()).populate(request,
                List.of(TestCatalogs.standard().lookup(1962)));
        ((DataParameterInstance) request.instance(195)).populate(new double[] { 1, 2 }, NdArray.ofLongs(1003, 1004));
        request.instance(194).markFailed("no column 'conductivity' in fetched rows");
        return request;
    }

    @Test
    public void testFailuresListReasons() {
        assertEquals(Map.of(194, "no column 'conductivity' in fetched rows"), new RequestExplain(request()).failures());
    }

    @Test
    public void testExplainParameter() {
        RequestExplain explain = new RequestExplain(request());

        String pressure = explain.explainParameter(195);
        assertTrue(pressure.contains("POPULATED"));
        assertTrue(pressure.contains("[2]"));

        String salinity = explain.explainParameter(1962);
        assertTrue(salinity.contains("ctd_pracsal"));
        assertTrue(salinity.contains("[1961, 1960, 1959]"));

        assertTrue(explain.explainParameter(1).contains("not in working set"));
    }

    @Test
    public void testDumpAndMermaid() {
        RequestExplain explain = new RequestExplain(request());

        String dump = explain.dumpRequest();
        assertTrue(dump.contains("[194] conductivity (DATA) FAILED"));
        assertEquals(8, dump.split("\n").length);

        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("p1961 -- \"p0\" --> p1962;"));
        assertTrue(mermaid.contains(":::failed"));
    }

    @Test
    public void testCompositeListenerFansOut() {
        List<String> seen = new ArrayList<>();
        CompositeExecutionListener composite = new CompositeExecutionListener();
        for (String tag : List.of("a", "b")) {
            composite.addForComposite(new ExecutionListener() {
                @Override
                public void onExecutionStart(StreamKey key, int pending) {
                    seen.add(tag + ":start");
                }

                @Override
                public void onParameterComputed(int pass, int parameterId, String name, long durationNanos) {
                    seen.add(tag + ":" + parameterId);
                }

                @Override
                public void onParameterFailed(int pass, int parameterId, String name, String reason,
                        Throwable error) {
                    seen.add(tag + ":!" + parameterId);
                }

                @Override
                public void onExecutionEnd(StreamKey key, int passes, int computed, int failed) {
                    seen.add(tag + ":end");
                }
            });
        }

        composite.onExecutionStart(TestCatalogs.key("s"), 1);
        composite.onParameterComputed(1, 7, "time", 10);
        composite.onParameterFailed(1, 8, "x", "r", null);
        composite.onExecutionEnd(TestCatalogs.key("s"), 1, 1, 1);

        assertEquals(List.of("a:start", "b:start", "a:7", "b:7", "a:!8", "b:!8", "a:end", "b:end"), seen);
    }
}
