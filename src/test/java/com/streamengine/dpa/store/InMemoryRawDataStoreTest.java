package com.streamengine.dpa.store;

import com.streamengine.dpa.TestCatalogs;
import com.streamengine.dpa.api.FetchException;
import com.streamengine.dpa.api.StreamKey;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.Assert.*;

public class InMemoryRawDataStoreTest {

    private InMemoryRawDataStore store;
    private StreamKey key;

    @Before
    public void setUp() {
        store = new InMemoryRawDataStore();
        key = TestCatalogs.key("ctdbp_no_sample");
        for (int t = 9; t >= 1; t--)
            store.insert(key, Map.of("time", (double) t, "pressure", 1000 + t));
    }

    @After
    public void tearDown() {
        store.close();
    }

    @Test
    public void testFetchReturnsInclusiveRangeInTimeOrder() {
        List<Map<String, Object>> rows = store.fetch(key, 2, 4).join();

        assertEquals(3, rows.size());
        assertEquals(2.0, rows.get(0).get("time"));
        assertEquals(4.0, rows.get(2).get("time"));
        assertEquals(1003, rows.get(1).get("pressure"));
    }

    @Test
    public void testFetchAll() {
        assertEquals(9, store.fetch(key, 1, 9).join().size());
        assertEquals(9, store.rowCount(key));
    }

    @Test
    public void testOtherStreamIsEmpty() {
        assertTrue(store.fetch(key.withStream("other"), 0, 100).join().isEmpty());
    }

    @Test
    public void testFailureSurfacesThroughFuture() {
        store.failFetches(key, "node offline");
        try {
            store.fetch(key, 1, 9).join();
            fail("Expected fetch to fail");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof FetchException);
            assertTrue(e.getCause().getMessage().contains("node offline"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRowWithoutTimeRejected() {
        store.insert(key, Map.of("pressure", 1));
    }
}
