package net.homeroute.util;

import jakarta.annotation.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Format rules for the names that end up in proxy host matchers: base and
 * custom domains, subdomain labels, application slugs and environment prefixes.
 */
public final class HostnameRules {

    private static final Pattern DOMAIN = Pattern.compile("^([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,}$");
    private static final Pattern LABEL = Pattern.compile("^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?$");
    private static final Pattern NON_ID_CHARS = Pattern.compile("[^a-z0-9]");
    private static final Pattern NON_API_SLUG_CHARS = Pattern.compile("[^a-z0-9-]");

    public static final int MIN_PORT = 1;
    public static final int MAX_PORT = 65535;

    private HostnameRules() {
    }

    /**
     * Lower-cases and trims a user supplied name; {@code null} stays {@code null}.
     */
    @Nullable
    public static String normalize(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValidDomain(@Nullable String value) {
        return value != null && DOMAIN.matcher(value).matches();
    }

    public static boolean isValidLabel(@Nullable String value) {
        return value != null && LABEL.matcher(value).matches();
    }

    /**
     * Environment prefixes are zero or more dot separated labels, for example
     * {@code ""}, {@code "dev"} or {@code "api.dev"}.
     */
    public static boolean isValidPrefix(@Nullable String value, boolean allowEmpty) {
        if (value == null) {
            return false;
        }
        if (value.isEmpty()) {
            return allowEmpty;
        }
        for (String label : value.split("\\.", -1)) {
            if (!isValidLabel(label)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isValidPort(@Nullable Integer port) {
        return port != null && port >= MIN_PORT && port <= MAX_PORT;
    }

    /**
     * Derives an environment id from its display name: {@code "Staging EU"} becomes {@code "staging-eu"}.
     */
    public static String environmentIdFor(String name) {
        return NON_ID_CHARS.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }

    /**
     * API disambiguators keep only lower-case letters, digits and dashes.
     */
    public static String normalizeApiSlug(@Nullable String slug) {
        if (slug == null) {
            return "";
        }
        return NON_API_SLUG_CHARS.matcher(slug.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
