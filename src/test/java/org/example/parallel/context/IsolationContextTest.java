package org.example.parallel.context;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IsolationContextTest {

    @AfterEach
    void cleanup() {
        IsolationContext.clear();
    }

    @Test
    void isActive_FalseWhenNothingApplied() {
        assertFalse(IsolationContext.isActive());
        assertTrue(IsolationContext.current().isEmpty());
    }

    @Test
    void getWorkerId_ThrowsWhenNotActive() {
        assertThrows(IllegalStateException.class, IsolationContext::getWorkerId);
    }

    @Test
    void apply_MakesValuesVisible() {
        IsolationContext.apply(Map.of("TEST_WORKER_ID", "w1", "TEST_ISOLATION_MODE", "true"));

        assertTrue(IsolationContext.isActive());
        assertEquals("w1", IsolationContext.getWorkerId());
        assertEquals("true", IsolationContext.get("TEST_ISOLATION_MODE"));
    }

    @Test
    void restore_ReturnsToPreviousSnapshot() {
        IsolationContext.apply(Map.of("TEST_WORKER_ID", "outer"));
        Map<String, String> previous = IsolationContext.apply(Map.of("TEST_WORKER_ID", "inner", "EXTRA", "x"));

        assertEquals("inner", IsolationContext.getWorkerId());

        IsolationContext.restore(previous);

        assertEquals("outer", IsolationContext.getWorkerId());
        assertNull(IsolationContext.current().get("EXTRA"));
    }

    @Test
    void restore_NullClearsContext() {
        Map<String, String> previous = IsolationContext.apply(Map.of("TEST_WORKER_ID", "w1"));

        IsolationContext.restore(previous);

        assertFalse(IsolationContext.isActive());
    }

    @Test
    void apply_IsThreadIsolated() throws Exception {
        IsolationContext.apply(Map.of("TEST_WORKER_ID", "main"));
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> otherThreadValue = new AtomicReference<>();

        Thread other = new Thread(() -> {
            IsolationContext.clear();
            IsolationContext.apply(Map.of("TEST_WORKER_ID", "other"));
            otherThreadValue.set(IsolationContext.getWorkerId());
            latch.countDown();
        });
        other.start();
        latch.await();

        assertEquals("other", otherThreadValue.get());
        assertEquals("main", IsolationContext.getWorkerId());
    }

    @Test
    void apply_ChildThreadInheritsValues() throws Exception {
        IsolationContext.apply(Map.of("TEST_WORKER_ID", "parent"));
        AtomicReference<String> childValue = new AtomicReference<>();

        Thread child = new Thread(() -> childValue.set(IsolationContext.get("TEST_WORKER_ID")));
        child.start();
        child.join();

        assertEquals("parent", childValue.get());
    }
}
