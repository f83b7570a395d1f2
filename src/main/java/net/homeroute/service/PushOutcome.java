package net.homeroute.service;

import java.util.List;

/**
 * Successful push, plus what the optional read-back found.
 *
 * @param convergence read-back result
 * @param missingRouteIds route ids absent from the active configuration
 */
public record PushOutcome(ConvergenceState convergence, List<String> missingRouteIds) {

    public PushOutcome {
        missingRouteIds = List.copyOf(missingRouteIds);
    }

    public static PushOutcome unconfirmed() {
        return new PushOutcome(ConvergenceState.SKIPPED, List.of());
    }
}
