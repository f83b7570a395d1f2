package net.homeroute.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import net.homeroute.config.ReverseProxyProperties;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.routing.CompiledProxyConfig;
import net.homeroute.domain.routing.CompiledRoute;
import net.homeroute.domain.routing.RouteCompiler;
import net.homeroute.domain.routing.TlsPolicy;
import net.homeroute.domain.routing.TlsPolicyBuilder;
import net.homeroute.exception.ProxyPushException;
import net.homeroute.support.proxy.CaddyConfigRenderer;
import org.springframework.stereotype.Service;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Compile, TLS policy, render and push, in that order, for one registry state.
 */
@Slf4j
@Service
public class RouteSyncService {

    private final RouteCompiler routeCompiler;
    private final CaddyConfigRenderer renderer;
    private final ProxyControlClient proxyControlClient;
    private final ReverseProxyProperties properties;
    private final Counter pushSuccesses;
    private final Counter pushFailures;
    private final Timer pushDuration;

    public RouteSyncService(RouteCompiler routeCompiler,
                            CaddyConfigRenderer renderer,
                            ProxyControlClient proxyControlClient,
                            ReverseProxyProperties properties,
                            MeterRegistry meterRegistry) {
        this.routeCompiler = routeCompiler;
        this.renderer = renderer;
        this.proxyControlClient = proxyControlClient;
        this.properties = properties;
        this.pushSuccesses = meterRegistry.counter("reverseproxy.push.success");
        this.pushFailures = meterRegistry.counter("reverseproxy.push.failure");
        this.pushDuration = meterRegistry.timer("reverseproxy.push.duration");
    }

    public CompiledProxyConfig compile(Registry registry) {
        List<CompiledRoute> routes = routeCompiler.compile(registry);
        TlsPolicy tls = TlsPolicyBuilder.build(registry, routes, properties.hasCloudflareApiToken());
        return new CompiledProxyConfig(routes, tls);
    }

    /**
     * Renders the document that {@link #sync} would push, without pushing it.
     */
    public ObjectNode preview(Registry registry) {
        return renderer.render(compile(registry), properties.adminListenAddress());
    }

    /**
     * Pushes the compiled registry. A failed push is reported, never thrown:
     * the registry change that triggered it is already persisted.
     */
    public SyncReport sync(Registry registry) {
        CompiledProxyConfig config = compile(registry);
        ObjectNode document = renderer.render(config, properties.adminListenAddress());
        int routeCount = config.routes().size();
        Timer.Sample sample = Timer.start();
        try {
            PushOutcome outcome = proxyControlClient.push(document, config.routeIds());
            pushSuccesses.increment();
            log.info("Pushed {} route(s) to proxy at revision {} (tls={}, convergence={})",
                routeCount, registry.revision(), config.tls().strategy(), outcome.convergence());
            return SyncReport.applied(outcome, routeCount, config.tls().strategy());
        } catch (ProxyPushException ex) {
            pushFailures.increment();
            log.warn("Registry revision {} saved but not applied: {}", registry.revision(), ex.getMessage());
            return SyncReport.failed(ex.getMessage(), routeCount, config.tls().strategy());
        } finally {
            sample.stop(pushDuration);
        }
    }
}
