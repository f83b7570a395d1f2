package net.homeroute.service;

import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import net.homeroute.config.ReverseProxyProperties;
import net.homeroute.domain.registry.Registry;
import net.homeroute.domain.routing.CompiledRoute;
import net.homeroute.domain.routing.DomainNameDeriver;
import net.homeroute.domain.routing.PublishedEndpoint;
import net.homeroute.domain.routing.RouteCompiler;
import net.homeroute.domain.routing.RouteIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSocket;
import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Probes the certificates the proxy serves.
 *
 * <p>The handshake trusts every chain: validity is judged from the leaf
 * certificate's own {@code notAfter}, not from chain verification, so
 * self-signed and locally issued certificates report their real expiry.</p>
 */
@Service
public class CertificateMonitor {

    private static final Logger log = LoggerFactory.getLogger(CertificateMonitor.class);

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9.]+$|:");
    static final String HOST_DISABLED = "Host disabled";

    private final RouteCompiler routeCompiler;
    private final int timeoutMillis;
    private final int defaultPort;
    private final int concurrency;
    private final SSLContext sslContext;

    public CertificateMonitor(RouteCompiler routeCompiler, ReverseProxyProperties properties) {
        this.routeCompiler = routeCompiler;
        this.timeoutMillis = (int) properties.getProbeTimeout().toMillis();
        this.defaultPort = properties.getProbePort();
        this.concurrency = properties.getProbeConcurrency();
        this.sslContext = trustAllContext();
    }

    public CertificateStatus probe(String hostname) {
        return probe(hostname, defaultPort);
    }

    /**
     * Opens a TLS connection with SNI set to {@code hostname} and evaluates the leaf certificate.
     * Failures are returned as {@code valid:false} results, never thrown.
     */
    public CertificateStatus probe(String hostname, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(hostname, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            try (SSLSocket tls = (SSLSocket) sslContext.getSocketFactory().createSocket(socket, hostname, port, true)) {
                if (!IP_LITERAL.matcher(hostname).find()) {
                    SSLParameters parameters = tls.getSSLParameters();
                    parameters.setServerNames(List.of(new SNIHostName(hostname)));
                    tls.setSSLParameters(parameters);
                }
                tls.startHandshake();
                Certificate[] chain = tls.getSession().getPeerCertificates();
                if (chain.length == 0 || !(chain[0] instanceof X509Certificate)) {
                    return CertificateStatus.failure("No certificate found");
                }
                return evaluate((X509Certificate) chain[0], hostname, Instant.now());
            }
        } catch (SocketTimeoutException ex) {
            return CertificateStatus.failure("Timeout");
        } catch (ConnectException ex) {
            return CertificateStatus.failure("Connection refused");
        } catch (UnknownHostException ex) {
            return CertificateStatus.failure("Unknown host " + hostname);
        } catch (SSLPeerUnverifiedException ex) {
            return CertificateStatus.failure("No certificate found");
        } catch (IOException | IllegalArgumentException ex) {
            log.debug("Certificate probe for {}:{} failed", hostname, port, ex);
            return CertificateStatus.failure(StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : "Connection failed");
        }
    }

    /**
     * Validity of {@code certificate} at {@code now}. Days are whole days rounded down,
     * so a certificate expiring later today has zero days left and is invalid.
     */
    public static CertificateStatus evaluate(X509Certificate certificate, String hostname, Instant now) {
        Instant expiresAt = certificate.getNotAfter().toInstant();
        long daysRemaining = Math.floorDiv(expiresAt.toEpochMilli() - now.toEpochMilli(), MILLIS_PER_DAY);
        return new CertificateStatus(
            daysRemaining > 0,
            expiresAt.toString(),
            daysRemaining,
            attribute(certificate.getIssuerX500Principal(), "O").orElse("Unknown"),
            attribute(certificate.getSubjectX500Principal(), "CN").orElse(hostname),
            null
        );
    }

    /**
     * Probes every compiled route except the auth portal, plus disabled hosts
     * which are reported without a connection attempt. Keys are route ids.
     */
    public Map<String, CertificateStatus> checkAll(Registry registry) {
        List<CompiledRoute> targets = new ArrayList<>();
        for (CompiledRoute route : routeCompiler.compile(registry)) {
            if (!RouteIds.SYSTEM_AUTH.equals(route.id())) {
                targets.add(route);
            }
        }

        long started = System.nanoTime();
        Map<String, CertificateStatus> results = new LinkedHashMap<>();
        List<Map.Entry<String, CertificateStatus>> probed = Flux.fromIterable(targets)
            .flatMapSequential(route -> Mono.fromCallable(() -> Map.entry(route.id(), probe(route.host())))
                .subscribeOn(Schedulers.boundedElastic()), concurrency)
            .collectList()
            .block();
        if (probed != null) {
            probed.forEach(entry -> results.put(entry.getKey(), entry.getValue()));
        }

        for (PublishedEndpoint published : DomainNameDeriver.publish(registry)) {
            if (published.environment() == null && !published.enabled()) {
                results.put(published.routeId(), CertificateStatus.failure(HOST_DISABLED));
            }
        }

        long invalid = results.values().stream().filter(status -> !status.valid()).count();
        log.info("Checked {} certificate(s) in {} ms, {} not valid",
            results.size(), Duration.ofNanos(System.nanoTime() - started).toMillis(), invalid);
        return results;
    }

    private static Optional<String> attribute(X500Principal principal, String type) {
        try {
            LdapName name = new LdapName(principal.getName(X500Principal.RFC2253));
            for (Rdn rdn : name.getRdns()) {
                if (rdn.getType().equalsIgnoreCase(type)) {
                    return Optional.of(String.valueOf(rdn.getValue()));
                }
            }
        } catch (InvalidNameException ex) {
            log.debug("Unparseable certificate name {}", principal, ex);
        }
        return Optional.empty();
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, InsecureTrustManagerFactory.INSTANCE.getTrustManagers(), null);
            return context;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("TLS is not available in this JVM", ex);
        }
    }
}
