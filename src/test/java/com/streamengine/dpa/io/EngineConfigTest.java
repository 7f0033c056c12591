package com.streamengine.dpa.io;

import org.junit.Test;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testLoadsTestResource() {
        EngineConfig config = EngineConfig.load();
        assertEquals(5000, config.getFetchTimeoutMillis());
        assertEquals(2, config.getFetchThreads());
        assertEquals("catalog/catalog.json", config.getCatalogResource());
    }

    @Test
    public void testMissingResourceGivesDefaults() {
        EngineConfig config = EngineConfig.load("no-such-config.json");
        assertEquals(new EngineConfig(), config);
        assertEquals(30_000, config.getFetchTimeoutMillis());
    }
}
