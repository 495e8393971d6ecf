package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.Locale;

/**
 * Textual loopback detection. Never resolves names: only the literal {@code localhost} is accepted.
 */
public final class LoopbackAddresses {

    private static final String IPV4_MAPPED_PREFIX = "::ffff:";

    private LoopbackAddresses() {}

    public static boolean isLoopback(String address) {
        if (address == null) return false;
        String a = address.trim().toLowerCase(Locale.ROOT);
        if (a.startsWith("[") && a.endsWith("]")) {
            a = a.substring(1, a.length() - 1);
        }
        if (a.isEmpty()) return false;

        if (a.equals("localhost") || a.equals("::1") || a.equals("0:0:0:0:0:0:0:1")) {
            return true;
        }
        if (a.startsWith(IPV4_MAPPED_PREFIX)) {
            a = a.substring(IPV4_MAPPED_PREFIX.length());
        } else if (a.startsWith("0:0:0:0:0:ffff:")) {
            a = a.substring("0:0:0:0:0:ffff:".length());
        }
        return isIpv4Loopback(a);
    }

    private static boolean isIpv4Loopback(String a) {
        String[] parts = a.split("\\.", -1);
        if (parts.length != 4 || !parts[0].equals("127")) return false;
        for (String p : parts) {
            if (p.isEmpty() || p.length() > 3) return false;
            for (int i = 0; i < p.length(); i++) {
                if (!Character.isDigit(p.charAt(i))) return false;
            }
            if (Integer.parseInt(p) > 255) return false;
        }
        return true;
    }
}
