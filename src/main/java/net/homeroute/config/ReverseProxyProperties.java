package net.homeroute.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;

/**
 * Strongly typed configuration for the reverse-proxy compiler.
 */
@Component
@ConfigurationProperties(prefix = "reverseproxy")
public class ReverseProxyProperties {

    /**
     * Location of the persisted registry document.
     */
    private String registryFile = "/var/lib/server-dashboard/reverseproxy-config.json";

    /**
     * Port of this dashboard; system routes and forward-auth calls target {@code localhost:<port>}.
     */
    private int dashboardPort = 4000;

    /**
     * Base URL of the proxy's admin API.
     */
    private String adminUrl = "http://localhost:2019";

    /**
     * Upper bound for one configuration push.
     */
    private Duration pushTimeout = Duration.ofSeconds(10);

    /**
     * Whether a push is followed by a read-back that checks every route id is active.
     */
    private boolean confirmConvergence = true;

    /**
     * Connect and handshake timeout of a single certificate probe.
     */
    private Duration probeTimeout = Duration.ofSeconds(5);

    /**
     * TLS port probed by the certificate monitor.
     */
    private int probePort = 443;

    /**
     * Maximum number of certificate probes in flight.
     */
    private int probeConcurrency = 8;

    /**
     * Path of the forward-auth endpoint served by the dashboard.
     */
    private String forwardAuthPath = "/api/authz/forward-auth";

    /**
     * Cloudflare API token for DNS-01 wildcard issuance. Only its presence is
     * used here; the proxy reads the value from its own environment.
     */
    private String cloudflareApiToken = "";

    @PostConstruct
    void validate() {
        Assert.hasText(registryFile, "reverseproxy.registry-file must be set");
        Assert.isTrue(dashboardPort >= 1 && dashboardPort <= 65535, "reverseproxy.dashboard-port must be a valid port");
        Assert.isTrue(probePort >= 1 && probePort <= 65535, "reverseproxy.probe-port must be a valid port");
        Assert.hasText(adminUrl, "reverseproxy.admin-url must be set");
        Assert.notNull(URI.create(adminUrl).getHost(), "reverseproxy.admin-url must include a host");
        Assert.isTrue(!pushTimeout.isNegative() && !pushTimeout.isZero(), "reverseproxy.push-timeout must be positive");
        Assert.isTrue(!probeTimeout.isNegative() && !probeTimeout.isZero(), "reverseproxy.probe-timeout must be positive");
        Assert.isTrue(probeConcurrency > 0, "reverseproxy.probe-concurrency must be positive");
        Assert.isTrue(forwardAuthPath != null && forwardAuthPath.startsWith("/"),
            "reverseproxy.forward-auth-path must start with /");
    }

    public boolean hasCloudflareApiToken() {
        return StringUtils.hasText(cloudflareApiToken);
    }

    /**
     * Admin listen address derived from {@link #adminUrl}, for example {@code localhost:2019}.
     */
    public String adminListenAddress() {
        URI uri = URI.create(adminUrl);
        int port = uri.getPort() > 0 ? uri.getPort() : 2019;
        return uri.getHost() + ":" + port;
    }

    public String getRegistryFile() {
        return registryFile;
    }

    public void setRegistryFile(String registryFile) {
        this.registryFile = registryFile;
    }

    public int getDashboardPort() {
        return dashboardPort;
    }

    public void setDashboardPort(int dashboardPort) {
        this.dashboardPort = dashboardPort;
    }

    public String getAdminUrl() {
        return adminUrl;
    }

    public void setAdminUrl(String adminUrl) {
        this.adminUrl = adminUrl;
    }

    public Duration getPushTimeout() {
        return pushTimeout;
    }

    public void setPushTimeout(Duration pushTimeout) {
        this.pushTimeout = pushTimeout;
    }

    public boolean isConfirmConvergence() {
        return confirmConvergence;
    }

    public void setConfirmConvergence(boolean confirmConvergence) {
        this.confirmConvergence = confirmConvergence;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public int getProbePort() {
        return probePort;
    }

    public void setProbePort(int probePort) {
        this.probePort = probePort;
    }

    public int getProbeConcurrency() {
        return probeConcurrency;
    }

    public void setProbeConcurrency(int probeConcurrency) {
        this.probeConcurrency = probeConcurrency;
    }

    public String getForwardAuthPath() {
        return forwardAuthPath;
    }

    public void setForwardAuthPath(String forwardAuthPath) {
        this.forwardAuthPath = forwardAuthPath;
    }

    public String getCloudflareApiToken() {
        return cloudflareApiToken;
    }

    public void setCloudflareApiToken(String cloudflareApiToken) {
        this.cloudflareApiToken = cloudflareApiToken;
    }
}
