package com.dmarcradar.classification;

import java.util.Locale;
import java.util.Set;

/**
 * Registrable-domain approximation without a public-suffix list: last two labels, or last three when the
 * second-to-last label is a common second-level marker (example.co.uk, example.com.au).
 */
public final class BaseDomains {

    private static final Set<String> SECOND_LEVEL_MARKERS = Set.of("co", "com", "org", "net", "ac", "gov");

    private BaseDomains() {
    }

    public static String of(String domain) {
        if (domain == null) {
            return "";
        }
        String clean = domain.strip().toLowerCase(Locale.ROOT);
        String[] parts = clean.split("\\.");
        if (parts.length < 2) {
            return clean;
        }
        if (parts.length >= 3 && SECOND_LEVEL_MARKERS.contains(parts[parts.length - 2])) {
            return String.join(".", parts[parts.length - 3], parts[parts.length - 2], parts[parts.length - 1]);
        }
        return parts[parts.length - 2] + "." + parts[parts.length - 1];
    }
}
