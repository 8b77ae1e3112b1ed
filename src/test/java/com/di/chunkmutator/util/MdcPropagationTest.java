package com.di.chunkmutator.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should carry the caller's MDC into a worker thread and clear it afterwards")
    void testWrapCallable() throws Exception {
        MDC.put("runId", "r-1");
        MDC.put("migration", "m");
        Callable<String> task = MdcPropagation.wrapCallable(() -> MDC.get("runId") + "/" + MDC.get("migration"));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            assertEquals("r-1/m", pool.submit(task).get());
            assertNull(pool.submit(() -> MDC.get("runId")).get());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("Should set one key for the duration of a call")
    void testCallWithKey() throws Exception {
        assertEquals("seg", MdcPropagation.callWithKey("segment", "seg", () -> MDC.get("segment")));
        assertNull(MDC.get("segment"));
    }

    @Test
    @DisplayName("Should return an empty map when nothing is set")
    void testCopyMdcEmpty() {
        MDC.clear();
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
