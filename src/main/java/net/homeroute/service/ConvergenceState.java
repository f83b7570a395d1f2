package net.homeroute.service;

/**
 * Result of reading the proxy configuration back after a push.
 */
public enum ConvergenceState {
    /** Every compiled route id is active on the proxy. */
    CONFIRMED,
    /** The read-back failed or some route ids are missing. */
    NOT_CONFIRMED,
    /** Read-back disabled by configuration, or nothing was pushed. */
    SKIPPED
}
