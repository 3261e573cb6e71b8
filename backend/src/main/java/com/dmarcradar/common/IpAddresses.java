package com.dmarcradar.common;

import java.util.Locale;

/**
 * IP literal checks. Only dotted-quad IPv4 and IPv6 literals are accepted; host names are rejected, so no DNS
 * resolution is ever performed downstream.
 */
public final class IpAddresses {

    private IpAddresses() {
    }

    /**
     * Returns false for anything that is not an IP literal, and for private, loopback, link-local, CGNAT,
     * unspecified and discard-prefix addresses, which geolocation services cannot resolve.
     */
    public static boolean isPublic(String ip) {
        if (!isIpLiteral(ip)) {
            return false;
        }
        String value = ip.strip().toLowerCase(Locale.ROOT);
        return value.contains(":") ? isPublicIpv6(value) : isPublicIpv4(value);
    }

    public static boolean isIpLiteral(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        String value = ip.strip().toLowerCase(Locale.ROOT);
        return value.contains(":") ? isIpv6(value) : isIpv4(value);
    }

    static boolean isIpv4(String ip) {
        String[] parts = ip.split("\\.", -1);
        if (parts.length != 4) {
            return false;
        }
        for (String part : parts) {
            if (octet(part) < 0) {
                return false;
            }
        }
        return true;
    }

    static boolean isIpv6(String ip) {
        int gap = ip.indexOf("::");
        if (gap >= 0 && ip.indexOf("::", gap + 1) >= 0) {
            return false;
        }
        int groups;
        if (gap < 0) {
            groups = groups(ip, true);
            return groups == 8;
        }
        int head = gap == 0 ? 0 : groups(ip.substring(0, gap), false);
        String tailPart = ip.substring(gap + 2);
        int tail = tailPart.isEmpty() ? 0 : groups(tailPart, true);
        return head >= 0 && tail >= 0 && head + tail <= 7;
    }

    /** Number of 16-bit groups in a colon-separated run, or -1 when malformed. An IPv4 tail counts as two. */
    private static int groups(String run, boolean mayEndWithIpv4) {
        String[] parts = run.split(":", -1);
        int count = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (mayEndWithIpv4 && i == parts.length - 1 && part.contains(".")) {
                if (!isIpv4(part)) {
                    return -1;
                }
                count += 2;
            } else if (isHexGroup(part)) {
                count++;
            } else {
                return -1;
            }
        }
        return count;
    }

    private static boolean isHexGroup(String part) {
        if (part.isEmpty() || part.length() > 4) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            if (Character.digit(part.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPublicIpv6(String ip) {
        if (ip.equals("::1") || ip.equals("::")) {
            return false;
        }
        if (ip.startsWith("::ffff:") && ip.contains(".")) {
            return isPublicIpv4(ip.substring("::ffff:".length()));
        }
        int first = ip.startsWith(":") ? 0 : Integer.parseInt(ip.substring(0, ip.indexOf(':')), 16);
        if ((first & 0xfe00) == 0xfc00) {
            return false;
        }
        if ((first & 0xffc0) == 0xfe80) {
            return false;
        }
        return !ip.startsWith("100::");
    }

    private static boolean isPublicIpv4(String ip) {
        String[] parts = ip.split("\\.");
        int first = octet(parts[0]);
        int second = octet(parts[1]);
        if (first == 127 || first == 10 || first == 0) {
            return false;
        }
        if (first == 172 && second >= 16 && second <= 31) {
            return false;
        }
        if (first == 192 && second == 168) {
            return false;
        }
        if (first == 100 && second >= 64 && second <= 127) {
            return false;
        }
        return !(first == 169 && second == 254);
    }

    /** Decimal octet 0-255 of at most three digits, or -1. */
    private static int octet(String part) {
        if (part.isEmpty() || part.length() > 3) {
            return -1;
        }
        for (int i = 0; i < part.length(); i++) {
            if (part.charAt(i) < '0' || part.charAt(i) > '9') {
                return -1;
            }
        }
        int value = Integer.parseInt(part);
        return value <= 255 ? value : -1;
    }
}
