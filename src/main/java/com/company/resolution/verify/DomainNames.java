package com.company.resolution.verify;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Host name helpers for website candidates.
 */
public final class DomainNames {

    // second-level labels used under country code domains, as in example.co.uk
    private static final Set<String> SECOND_LEVEL_LABELS = Set.of(
            "co", "com", "org", "net", "ac", "gov", "edu", "ltd", "plc", "ne", "or");

    private DomainNames() {
    }

    /**
     * Returns the lower-cased host of a URL without a leading {@code www.}, or an empty string.
     */
    public static String host(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String host;
        try {
            host = new URI(url.strip()).getHost();
        } catch (URISyntaxException e) {
            return "";
        }
        if (host == null) {
            return "";
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    /**
     * Returns the label that names the site: {@code acme} for {@code shop.acme.co.uk}.
     */
    public static String registrableLabel(String host) {
        String[] labels = host.split("\\.");
        if (labels.length == 1) {
            return labels[0];
        }
        int tld = labels.length - 1;
        if (labels.length >= 3 && labels[tld].length() == 2 && SECOND_LEVEL_LABELS.contains(labels[tld - 1])) {
            return labels[tld - 2];
        }
        return labels[tld - 1];
    }

    /**
     * Checks whether the host is a denylisted domain or one of its subdomains.
     */
    public static boolean isDenylisted(String host, Collection<String> denylist) {
        if (host.isEmpty()) {
            return false;
        }
        for (String domain : denylist) {
            String d = domain.toLowerCase(Locale.ROOT);
            if (host.equals(d) || host.endsWith("." + d)) {
                return true;
            }
        }
        return false;
    }
}
