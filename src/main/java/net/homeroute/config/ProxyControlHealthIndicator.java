package net.homeroute.config;

import net.homeroute.service.ProxyControlClient;
import net.homeroute.service.ProxyStatus;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reports whether the proxy's admin API answers and holds a configuration.
 */
@Component("proxyControlPlaneHealthIndicator")
public class ProxyControlHealthIndicator implements ReactiveHealthIndicator {

    private final ProxyControlClient proxyControlClient;
    private final String adminUrl;

    public ProxyControlHealthIndicator(ProxyControlClient proxyControlClient, ReverseProxyProperties properties) {
        this.proxyControlClient = proxyControlClient;
        this.adminUrl = properties.getAdminUrl();
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(proxyControlClient::status)
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toHealth)
                .onErrorResume(Throwable.class, ex -> Mono.just(Health.down()
                        .withDetail("proxy_status", "unexpected_error")
                        .withDetail("admin_url", adminUrl)
                        .withDetail("error", ex.getClass().getName())
                        .withDetail("message", String.valueOf(ex.getMessage()))
                        .build()));
    }

    private Health toHealth(ProxyStatus status) {
        if (!status.running()) {
            return Health.down()
                    .withDetail("proxy_status", "unreachable")
                    .withDetail("admin_url", adminUrl)
                    .withDetail("error", String.valueOf(status.error()))
                    .build();
        }
        return Health.up()
                .withDetail("proxy_status", status.configLoaded() ? "config_loaded" : "no_config")
                .withDetail("admin_url", adminUrl)
                .build();
    }
}
