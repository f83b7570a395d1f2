package net.homeroute.domain.routing;

public enum TlsStrategy {
    /** One DNS-01 policy covering the registry's wildcard patterns. */
    WILDCARD_DNS,
    /** Automatic issuance for every exact route hostname. */
    PER_HOST
}
