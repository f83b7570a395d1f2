package net.homeroute.controller;

import net.homeroute.controller.support.ResponseBodies;
import net.homeroute.dto.BaseDomainRequest;
import net.homeroute.dto.CloudflareRequest;
import net.homeroute.dto.CloudflareView;
import net.homeroute.dto.SystemRouteView;
import net.homeroute.service.CertificateMonitor;
import net.homeroute.service.MutationResult;
import net.homeroute.service.ProxyControlClient;
import net.homeroute.service.ProxySettingsService;
import net.homeroute.service.RegistryStore;
import net.homeroute.service.RouteSyncService;
import net.homeroute.service.SyncReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Registry-wide settings, proxy status and certificate endpoints.
 */
@RestController
@RequestMapping("/api/reverseproxy")
public class ReverseProxyController {

    private final ProxySettingsService settingsService;
    private final RegistryStore registryStore;
    private final RouteSyncService routeSyncService;
    private final ProxyControlClient proxyControlClient;
    private final CertificateMonitor certificateMonitor;

    public ReverseProxyController(ProxySettingsService settingsService,
                                  RegistryStore registryStore,
                                  RouteSyncService routeSyncService,
                                  ProxyControlClient proxyControlClient,
                                  CertificateMonitor certificateMonitor) {
        this.settingsService = settingsService;
        this.registryStore = registryStore;
        this.routeSyncService = routeSyncService;
        this.proxyControlClient = proxyControlClient;
        this.certificateMonitor = certificateMonitor;
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        return ResponseBodies.success("config", Map.of("baseDomain", settingsService.baseDomain()));
    }

    @PutMapping("/config/domain")
    public Map<String, Object> updateDomain(@RequestBody BaseDomainRequest request) {
        MutationResult<String> result = settingsService.updateBaseDomain(request.baseDomain());
        Map<String, Object> body = ResponseBodies.success("baseDomain", result.value());
        body.put("message", "Base domain updated");
        return ResponseBodies.appendSync(body, result.sync());
    }

    @GetMapping("/cloudflare")
    public Map<String, Object> cloudflare() {
        CloudflareView view = settingsService.cloudflare();
        return cloudflareBody(view);
    }

    @PutMapping("/cloudflare")
    public Map<String, Object> updateCloudflare(@RequestBody CloudflareRequest request) {
        MutationResult<CloudflareView> result = settingsService.updateCloudflare(Boolean.TRUE.equals(request.enabled()));
        return ResponseBodies.appendSync(cloudflareBody(result.value()), result.sync());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return ResponseBodies.success("proxy", proxyControlClient.status());
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        return syncBody("Proxy configuration reloaded", registryStore.resync());
    }

    @PostMapping("/certificates/renew")
    public Map<String, Object> renewCertificates() {
        return syncBody("Certificate renewal triggered", registryStore.resync());
    }

    @GetMapping("/certificates/status")
    public Map<String, Object> certificates() {
        return ResponseBodies.success("certificates", certificateMonitor.checkAll(registryStore.load()));
    }

    @GetMapping("/system-route")
    public Map<String, Object> systemRoute() {
        SystemRouteView view = settingsService.systemRoute();
        Map<String, Object> body = ResponseBodies.success("configured", view.configured());
        body.put("domain", view.domain());
        body.put("port", view.port());
        return body;
    }

    @GetMapping("/compiled")
    public Map<String, Object> compiled() {
        return ResponseBodies.success("config", routeSyncService.preview(registryStore.load()));
    }

    private static Map<String, Object> cloudflareBody(CloudflareView view) {
        Map<String, Object> body = ResponseBodies.success("enabled", view.enabled());
        body.put("hasToken", view.hasToken());
        body.put("wildcardDomains", view.wildcardDomains());
        return body;
    }

    private static Map<String, Object> syncBody(String message, SyncReport report) {
        Map<String, Object> body = report.applied() ? ResponseBodies.success() : ResponseBodies.failure(report.error());
        if (report.applied()) {
            body.put("message", message);
        }
        body.put("routeCount", report.routeCount());
        return ResponseBodies.appendSync(body, report);
    }
}
