package net.homeroute.service;

import jakarta.annotation.Nullable;
import net.homeroute.domain.routing.TlsStrategy;

/**
 * What happened when a registry state was compiled and pushed.
 *
 * @param applied whether the proxy accepted the configuration
 * @param error push failure reported to the dashboard; the registry change stays saved
 * @param convergence read-back result after an accepted push
 * @param routeCount number of compiled routes
 * @param tlsStrategy issuance strategy of the pushed configuration
 */
public record SyncReport(
    boolean applied,
    @Nullable String error,
    ConvergenceState convergence,
    int routeCount,
    TlsStrategy tlsStrategy
) {

    public static SyncReport applied(PushOutcome outcome, int routeCount, TlsStrategy tlsStrategy) {
        return new SyncReport(true, null, outcome.convergence(), routeCount, tlsStrategy);
    }

    public static SyncReport failed(String error, int routeCount, TlsStrategy tlsStrategy) {
        return new SyncReport(false, error, ConvergenceState.SKIPPED, routeCount, tlsStrategy);
    }

    public boolean isConverged() {
        return convergence == ConvergenceState.CONFIRMED;
    }
}
