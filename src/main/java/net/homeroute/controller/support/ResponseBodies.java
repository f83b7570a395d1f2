package net.homeroute.controller.support;

import net.homeroute.service.ConvergenceState;
import net.homeroute.service.SyncReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@code {success, ...}} bodies the dashboard frontend expects.
 */
public final class ResponseBodies {

    private ResponseBodies() {
        // Utility class
    }

    public static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }

    public static Map<String, Object> success(String key, Object value) {
        Map<String, Object> body = success();
        body.put(key, value);
        return body;
    }

    public static Map<String, Object> failure(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return body;
    }

    /**
     * Body of a persisted mutation. {@code applied:false} with {@code applyError}
     * is the "saved but not applied" state.
     */
    public static Map<String, Object> mutation(String key, Object value, SyncReport sync) {
        Map<String, Object> body = success(key, value);
        appendSync(body, sync);
        return body;
    }

    public static Map<String, Object> appendSync(Map<String, Object> body, SyncReport sync) {
        body.put("applied", sync.applied());
        if (!sync.applied()) {
            body.put("applyError", sync.error());
        } else if (sync.convergence() != ConvergenceState.SKIPPED) {
            body.put("converged", sync.isConverged());
        }
        return body;
    }
}
