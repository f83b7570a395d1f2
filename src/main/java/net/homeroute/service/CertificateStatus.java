package net.homeroute.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.annotation.Nullable;

/**
 * Certificate state of one probed hostname. Failed probes carry only
 * {@code valid = false} and {@code error}.
 *
 * @param valid whether the certificate has more than zero whole days left
 * @param expiresAt ISO-8601 {@code notAfter}
 * @param daysRemaining whole days until expiry, zero or negative once expired
 * @param issuer issuer organization ({@code O}), {@code Unknown} when absent
 * @param subject subject common name ({@code CN}), the probed hostname when absent
 * @param error reason the probe failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CertificateStatus(
    boolean valid,
    @Nullable String expiresAt,
    @Nullable Long daysRemaining,
    @Nullable String issuer,
    @Nullable String subject,
    @Nullable String error
) {

    public static CertificateStatus failure(String error) {
        return new CertificateStatus(false, null, null, null, null, error);
    }
}
