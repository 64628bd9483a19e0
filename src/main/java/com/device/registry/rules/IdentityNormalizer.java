package com.device.registry.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms for the identity fields used to match observations against the registry.
 * Two observations of the same hardware must produce equal values regardless of how the
 * vendor API formats them.
 */
public final class IdentityNormalizer {

    private static final Pattern MAC_SEPARATORS = Pattern.compile("[:\\-.\\s]");
    private static final Pattern MAC_HEX = Pattern.compile("[0-9A-F]{12}");

    private IdentityNormalizer() {
    }

    /**
     * Trims a serial number. Blank values are treated as absent.
     *
     * @return the trimmed serial, or null when absent
     */
    public static String normalizeSerial(String serialNumber) {
        return blankToNull(serialNumber);
    }

    /**
     * Normalizes a MAC address to upper-case, colon-separated octets
     * ({@code 00:1B:2C:3D:4E:5F}). Accepts colon, dash, dot (Cisco) and bare forms.
     *
     * @return the canonical MAC, or null when absent or not a 48-bit address
     */
    public static String normalizeMac(String macAddress) {
        String trimmed = blankToNull(macAddress);
        if (trimmed == null) {
            return null;
        }
        String hex = MAC_SEPARATORS.matcher(trimmed).replaceAll("").toUpperCase(Locale.ROOT);
        if (!MAC_HEX.matcher(hex).matches() || "000000000000".equals(hex)) {
            return null;
        }
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(hex, i, i + 2);
        }
        return sb.toString();
    }

    /**
     * Trims an IP address. Blank values are treated as absent.
     */
    public static String normalizeIp(String ip) {
        return blankToNull(ip);
    }

    /**
     * Returns true if both values are present and differ.
     * Absent values never disagree with anything.
     */
    public static boolean disagree(String a, String b) {
        return a != null && b != null && !a.equals(b);
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
