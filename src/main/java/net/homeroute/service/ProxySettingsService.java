package net.homeroute.service;

import lombok.extern.slf4j.Slf4j;
import net.homeroute.config.ReverseProxyProperties;
import net.homeroute.domain.registry.CloudflareSettings;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.registry.RegistryChange;
import net.homeroute.domain.routing.DomainNameDeriver;
import net.homeroute.domain.routing.TlsPolicyBuilder;
import net.homeroute.dto.CloudflareView;
import net.homeroute.dto.SystemRouteView;
import net.homeroute.exception.RegistryValidationException;
import net.homeroute.util.HostnameRules;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Registry-wide settings: base domain, wildcard certificate provider and the
 * dashboard's own system route.
 */
@Slf4j
@Service
public class ProxySettingsService {

    private final RegistryStore registryStore;
    private final ReverseProxyProperties properties;

    public ProxySettingsService(RegistryStore registryStore, ReverseProxyProperties properties) {
        this.registryStore = registryStore;
        this.properties = properties;
    }

    public String baseDomain() {
        return registryStore.load().baseDomain();
    }

    public MutationResult<String> updateBaseDomain(String requested) {
        if (!StringUtils.hasText(requested)) {
            throw new RegistryValidationException("Invalid base domain");
        }
        String baseDomain = HostnameRules.normalize(requested);
        if (!HostnameRules.isValidDomain(baseDomain)) {
            throw new RegistryValidationException("Invalid domain format");
        }
        MutationResult<String> result = registryStore.mutate(registry ->
            RegistryChange.of(registry.withBaseDomain(baseDomain), baseDomain));
        log.info("Base domain set to {}", baseDomain);
        return result;
    }

    public CloudflareView cloudflare() {
        return toView(registryStore.load().cloudflare());
    }

    /**
     * Enabling requires the API token in the server environment; the derived
     * wildcard patterns are recomputed by the store on every save.
     */
    public MutationResult<CloudflareView> updateCloudflare(boolean enabled) {
        if (enabled && !properties.hasCloudflareApiToken()) {
            throw new RegistryValidationException("Cloudflare API token is not configured (CF_API_TOKEN)");
        }
        MutationResult<CloudflareSettings> saved = registryStore.mutate(registry -> {
            CloudflareSettings settings = new CloudflareSettings(enabled,
                enabled ? TlsPolicyBuilder.deriveWildcardDomains(registry) : List.of());
            return RegistryChange.of(registry.withCloudflare(settings), settings);
        });
        log.info("Wildcard certificates via Cloudflare {}", enabled ? "enabled" : "disabled");
        return new MutationResult<>(toView(saved.registry().cloudflare()), saved.registry(), saved.sync());
    }

    public SystemRouteView systemRoute() {
        Registry registry = registryStore.load();
        if (!registry.hasBaseDomain()) {
            return new SystemRouteView(false, null, properties.getDashboardPort());
        }
        return new SystemRouteView(true,
            DomainNameDeriver.systemDomain(DomainNameDeriver.DASHBOARD_LABEL, registry.baseDomain()),
            properties.getDashboardPort());
    }

    private CloudflareView toView(CloudflareSettings settings) {
        return new CloudflareView(settings.enabled(), properties.hasCloudflareApiToken(), settings.wildcardDomains());
    }
}
