package com.streamengine.dpa.engine;

import com.streamengine.dpa.TestCatalogs;
import com.streamengine.dpa.api.CatalogCycleException;
import com.streamengine.dpa.catalog.InMemoryParameterCatalog;
import com.streamengine.dpa.catalog.Parameter;
import com.streamengine.dpa.catalog.ValueEncoding;
import com.streamengine.dpa.instance.DataParameterInstance;
import com.streamengine.dpa.instance.FunctionParameterInstance;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.*;

public class DependencyResolverTest {

    private DependencyResolver resolver;

    @Before
    public void setUp() {
        resolver = new DependencyResolver(TestCatalogs.standard());
    }

    private static List<Integer> ids(List<Parameter> params) {
        List<Integer> out = new ArrayList<>();
        for (Parameter p : params)
            out.add(p.id());
        return out;
    }

    @Test
    public void testDensityClosure() {
        List<Integer> needs = ids(resolver.needs(1963));
        List<Integer> sorted = new ArrayList<>(needs);
        Collections.sort(sorted);

        assertEquals(List.of(193, 194, 195, 1959, 1960, 1961, 1962, 1963), sorted);
        assertEquals(Integer.valueOf(1963), needs.get(needs.size() - 1));
    }

    @Test
    public void testInputsPrecedeConsumers() {
        List<Parameter> needs = resolver.needs(3651);
        List<Integer> order = ids(needs);
        for (Parameter p : needs) {
            for (int input : p.inputs())
                assertTrue(input + " should precede " + p.id(), order.indexOf(input) < order.indexOf(p.id()));
        }
    }

    @Test
    public void testDataParameterNeedsOnlyItself() {
        assertEquals(List.of(195), ids(resolver.needs(195)));
        assertTrue(resolver.needsCoefficients(TestCatalogs.standard().lookup(195)).isEmpty());
    }

    @Test
    public void testSharedAncestorsAppearOnce() {
        // 3647 and 3648 feed both salinity and density
        List<Integer> needs = ids(resolver.needs(3651));
        assertEquals(needs.size(), new HashSet<>(needs).size());
        assertEquals(8, needs.size());
        assertFalse("time is not an input of density", needs.contains(7));
    }

    @Test
    public void testCoefficientClosure() {
        List<String> cc = new ArrayList<>(resolver.needsCoefficients(TestCatalogs.standard().lookup(1963)));
        Collections.sort(cc);
        assertEquals(List.of("CC_latitude", "CC_longitude"), cc);

        List<String> ctdbp = new ArrayList<>(resolver.needsCoefficients(TestCatalogs.standard().lookup(3651)));
        assertEquals(6, ctdbp.size());
        assertTrue(ctdbp.containsAll(List.of("CC_a0", "CC_a1", "CC_a2", "CC_a3", "CC_lat", "CC_lon")));
    }

    @Test
    public void testClosureIsMemoized() {
        assertSame(resolver.needs(1963), resolver.needs(1963));
    }

    @Test
    public void testCycleIsDetected() {
        InMemoryParameterCatalog cyclic = InMemoryParameterCatalog.builder()
                .addParameter(Parameter.data(1, "raw", ValueEncoding.FLOAT64))
                .addParameter(Parameter.function(10, "a", ValueEncoding.FLOAT64, "difference", List.of(1, 11),
                        List.of()))
                .addParameter(Parameter.function(11, "b", ValueEncoding.FLOAT64, "difference", List.of(1, 12),
                        List.of()))
                .addParameter(Parameter.function(12, "c", ValueEncoding.FLOAT64, "polyval", List.of(10),
                        List.of("CC_x")))
                .build();
        DependencyResolver r = new DependencyResolver(cyclic);
        try {
            r.needs(10);
            fail("Expected CatalogCycleException");
        } catch (CatalogCycleException e) {
            assertEquals(List.of(10, 11, 12, 10), e.cycle());
        }
    }

    @Test(expected = CatalogCycleException.class)
    public void testSelfLoopIsDetected() {
        InMemoryParameterCatalog cyclic = InMemoryParameterCatalog.builder()
                .addParameter(Parameter.function(5, "self", ValueEncoding.FLOAT64, "polyval", List.of(5),
                        List.of()))
                .build();
        new DependencyResolver(cyclic).needs(5);
    }

    @Test
    public void testPopulateIsIdempotent() {
        StreamRequest request = new StreamRequest(TestCatalogs.key("ctdpf_ckl_wfp_instrument_recovered"));
        List<Parameter> targets = List.of(TestCatalogs.standard().lookup(1963), TestCatalogs.standard().lookup(1962));

        resolver.populate(request, targets);
        int size = request.dataMap().size();
        resolver.populate(request, targets);

        assertEquals(8, size);
        assertEquals(size, request.dataMap().size());
        assertEquals(List.of(1963, 1962), new ArrayList<>(request.requested()));
        assertEquals(3, request.dataInstances().size());
        assertEquals(5, request.functionInstances().size());
        assertTrue(request.instance(195) instanceof DataParameterInstance);
        assertTrue(request.instance(1963) instanceof FunctionParameterInstance);
        assertEquals(2, request.missingCoefficients().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInputRejectedAtBuild() {
        InMemoryParameterCatalog.builder()
                .addParameter(Parameter.function(3, "orphan", ValueEncoding.FLOAT64, "polyval", List.of(99),
                        List.of()))
                .build();
    }
}
