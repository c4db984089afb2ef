package com.phillippitts.uptimemonitor.service.probe.http;

import java.time.Duration;
import java.time.Instant;

/**
 * Leaf certificate facts read during a TLS handshake.
 *
 * @param subject  subject distinguished name
 * @param issuer   issuer distinguished name
 * @param notAfter expiry instant
 */
public record CertificateInfo(String subject, String issuer, Instant notAfter) {

    /**
     * Whole days until expiry, negative once expired.
     */
    public long daysRemaining(Instant now) {
        return Duration.between(now, notAfter).toDays();
    }

    public boolean isExpired(Instant now) {
        return !notAfter.isAfter(now);
    }
}
