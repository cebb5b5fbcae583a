package io.github.hotbrkm.outreach.dispatcher.domain;

import java.net.IDN;
import java.util.Locale;

public final class EmailAddressUtil {
    /**
     * Label used when an address has no usable destination domain
     */
    public static final String INVALID = "INVALID";

    private static final String FORBIDDEN_DOMAIN_CHARS = ",\"'<>\\/ :";

    private EmailAddressUtil() {}

    /**
     * Extracts the lower-cased ASCII destination domain, accepting {@code Name <addr>} forms.
     */
    public static String extractDomain(String email) {
        String addr = normalizeAddress(email);
        if (addr == null) {
            return INVALID;
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String domain = addr.substring(at + 1).trim();
        if (domain.isEmpty() || domain.charAt(0) == '[') {
            return INVALID;
        }
        if (domain.endsWith(".")) {
            domain = domain.substring(0, domain.length() - 1);
        }

        String asciiDomain;
        try {
            asciiDomain = IDN.toASCII(domain);
        } catch (IllegalArgumentException e) {
            return INVALID;
        }
        for (int i = 0; i < asciiDomain.length(); i++) {
            if (FORBIDDEN_DOMAIN_CHARS.indexOf(asciiDomain.charAt(i)) >= 0) {
                return INVALID;
            }
        }
        if (asciiDomain.length() <= 2 || asciiDomain.indexOf('.') < 0) {
            return INVALID;
        }
        return asciiDomain.toLowerCase(Locale.ROOT);
    }

    public static boolean isDeliverable(String email) {
        return !INVALID.equals(extractDomain(email));
    }

    /**
     * Canonical form used as the key for per-recipient bookkeeping.
     */
    public static String normalizeKey(String email) {
        String addr = normalizeAddress(email);
        return addr == null ? "" : addr.toLowerCase(Locale.ROOT);
    }

    private static String normalizeAddress(String email) {
        if (email == null) {
            return null;
        }
        String addr = email.trim();
        if (addr.isEmpty()) {
            return null;
        }
        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        if (addr.length() >= 2 && addr.startsWith("\"") && addr.endsWith("\"")) {
            addr = addr.substring(1, addr.length() - 1).trim();
        }
        return addr.isEmpty() ? null : addr;
    }
}
