package net.homeroute.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.annotation.Nullable;

/**
 * Reachability of the proxy's admin API.
 *
 * @param running whether the admin API answered
 * @param configLoaded whether it reports an active configuration
 * @param error transport or HTTP error, when not running
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProxyStatus(boolean running, boolean configLoaded, @Nullable String error) {

    public static ProxyStatus unreachable(String error) {
        return new ProxyStatus(false, false, error);
    }
}
