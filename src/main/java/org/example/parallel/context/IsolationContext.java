package org.example.parallel.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thread-scoped environment variables of the isolated environment the current
 * test runs in.
 * Each worker thread sees only its own values.
 * Uses InheritableThreadLocal so threads started by a test body (drivers, pollers)
 * inherit the values.
 */
public final class IsolationContext {

    private IsolationContext() {}

    private static final InheritableThreadLocal<Map<String, String>> VARIABLES = new InheritableThreadLocal<>();

    /**
     * Overlays {@code variables} on the current values and returns the previous
     * snapshot, which must be handed back to {@link #restore(Map)}.
     */
    public static Map<String, String> apply(Map<String, String> variables) {
        Map<String, String> previous = VARIABLES.get();
        Map<String, String> merged = new LinkedHashMap<>();
        if (previous != null) {
            merged.putAll(previous);
        }
        if (variables != null) {
            merged.putAll(variables);
        }
        VARIABLES.set(Collections.unmodifiableMap(merged));
        return previous;
    }

    /**
     * Restores a snapshot returned by {@link #apply(Map)}; {@code null} clears the context.
     */
    public static void restore(Map<String, String> previous) {
        if (previous == null) {
            VARIABLES.remove();
        } else {
            VARIABLES.set(previous);
        }
    }

    public static void clear() {
        VARIABLES.remove();
    }

    public static boolean isActive() {
        return VARIABLES.get() != null;
    }

    /**
     * Resolves {@code key} from the isolated values first, then from the process environment.
     */
    public static String get(String key) {
        Map<String, String> current = VARIABLES.get();
        if (current != null && current.containsKey(key)) {
            return current.get(key);
        }
        return System.getenv(key);
    }

    public static Map<String, String> current() {
        Map<String, String> current = VARIABLES.get();
        return current != null ? current : Map.of();
    }

    public static String getWorkerId() {
        String workerId = get("TEST_WORKER_ID");
        if (workerId == null) {
            throw new IllegalStateException("IsolationContext not active -- no TEST_WORKER_ID for this thread");
        }
        return workerId;
    }
}
