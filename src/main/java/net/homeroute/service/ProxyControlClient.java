package net.homeroute.service;

import net.homeroute.config.ReverseProxyProperties;
import net.homeroute.exception.ProxyPushException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Client for the proxy's admin API.
 *
 * <p>{@link #push} replaces the whole active configuration with a single
 * {@code POST /load}. The call is bounded by {@code reverseproxy.push-timeout}
 * and never retried here.</p>
 */
@Service
public class ProxyControlClient {

    private static final Logger log = LoggerFactory.getLogger(ProxyControlClient.class);

    static final String LOAD_PATH = "/load";
    static final String CONFIG_PATH = "/config/";
    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final boolean confirmConvergence;

    public ProxyControlClient(WebClient.Builder webClientBuilder,
                              ObjectMapper objectMapper,
                              ReverseProxyProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getAdminUrl()).build();
        this.objectMapper = objectMapper;
        this.timeout = properties.getPushTimeout();
        this.confirmConvergence = properties.isConfirmConvergence();
    }

    /**
     * Loads {@code document} into the proxy.
     *
     * @param document full proxy configuration
     * @param expectedRouteIds route ids the read-back must find when convergence checks are on
     * @return read-back outcome of the accepted push
     * @throws ProxyPushException when the proxy is unreachable, times out or answers non-2xx
     */
    public PushOutcome push(ObjectNode document, List<String> expectedRouteIds) {
        String body = objectMapper.writeValueAsString(document);
        try {
            webClient.post()
                .uri(LOAD_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .block(timeout);
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            throw new ProxyPushException("Proxy rejected configuration (HTTP " + status + ")"
                + describeBody(ex.getResponseBodyAsString()), status, ex);
        } catch (WebClientException ex) {
            throw new ProxyPushException("Proxy admin API unreachable: " + summarize(ex), null, ex);
        } catch (IllegalStateException ex) {
            // block(Duration) signals its timeout this way
            throw new ProxyPushException("Proxy admin API did not answer within " + timeout.toSeconds() + "s", null, ex);
        }

        if (!confirmConvergence) {
            return PushOutcome.unconfirmed();
        }
        return confirm(expectedRouteIds);
    }

    /**
     * Lightweight reachability check used by the dashboard and the health indicator.
     */
    public ProxyStatus status() {
        try {
            JsonNode config = readActiveConfig();
            return new ProxyStatus(true, config != null && config.isObject(), null);
        } catch (WebClientResponseException ex) {
            return ProxyStatus.unreachable("HTTP " + ex.getStatusCode().value());
        } catch (WebClientException | IllegalStateException | JacksonException ex) {
            log.debug("Proxy admin API status check failed", ex);
            return ProxyStatus.unreachable(summarize(ex));
        }
    }

    private PushOutcome confirm(List<String> expectedRouteIds) {
        JsonNode active;
        try {
            active = readActiveConfig();
        } catch (WebClientException | IllegalStateException | JacksonException ex) {
            log.warn("Could not read proxy configuration back after push: {}", summarize(ex));
            return new PushOutcome(ConvergenceState.NOT_CONFIRMED, expectedRouteIds);
        }

        Set<String> activeIds = new HashSet<>();
        collectRouteIds(active, activeIds);
        List<String> missing = new ArrayList<>();
        for (String id : expectedRouteIds) {
            if (!activeIds.contains(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Proxy configuration is missing {} of {} route(s) after push: {}",
                missing.size(), expectedRouteIds.size(), missing);
            return new PushOutcome(ConvergenceState.NOT_CONFIRMED, missing);
        }
        return new PushOutcome(ConvergenceState.CONFIRMED, List.of());
    }

    private JsonNode readActiveConfig() {
        String body = webClient.get()
            .uri(CONFIG_PATH)
            .retrieve()
            .bodyToMono(String.class)
            .block(timeout);
        if (!StringUtils.hasText(body)) {
            return null;
        }
        return objectMapper.readTree(body);
    }

    private static void collectRouteIds(JsonNode node, Set<String> ids) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            JsonNode id = node.get("@id");
            if (id != null && id.isString()) {
                ids.add(id.asString());
            }
        }
        if (node.isObject() || node.isArray()) {
            for (JsonNode child : node) {
                collectRouteIds(child, ids);
            }
        }
    }

    private static String describeBody(String body) {
        if (!StringUtils.hasText(body)) {
            return "";
        }
        String trimmed = body.trim();
        return ": " + (trimmed.length() > MAX_ERROR_BODY_LENGTH ? trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : trimmed);
    }

    private static String summarize(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return StringUtils.hasText(message) ? message : root.getClass().getSimpleName();
    }
}
