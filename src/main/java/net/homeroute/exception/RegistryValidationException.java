package net.homeroute.exception;

/**
 * A requested registry change was rejected before anything was written:
 * malformed domain, subdomain or slug, out-of-range port, duplicate domain,
 * missing endpoint, unknown entity or invalid provider credential state.
 * The message is reported verbatim to the dashboard.
 */
public class RegistryValidationException extends RuntimeException {

    public RegistryValidationException(String message) {
        super(message);
    }
}
