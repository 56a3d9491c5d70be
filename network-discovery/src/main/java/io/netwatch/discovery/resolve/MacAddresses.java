package io.netwatch.discovery.resolve;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MacAddresses {

    public static final String ZERO = "00:00:00:00:00:00";

    private static final Pattern IN_TEXT = Pattern.compile("([0-9a-f]{2}[:-]){5}[0-9a-f]{2}", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile("[0-9a-f]{12}");

    private MacAddresses() {
    }

    /**
     * Accepts {@code aa:bb:cc:dd:ee:ff}, {@code AA-BB-CC-DD-EE-FF} and {@code aabbccddeeff}.
     * The all-zero address, which incomplete neighbour entries carry, is rejected.
     */
    public static Optional<String> normalize(String mac) {
        if (mac == null) {
            return Optional.empty();
        }
        String cleaned = mac.trim().replace(":", "").replace("-", "").toLowerCase(Locale.ROOT);
        if (!BARE.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        StringBuilder out = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) {
                out.append(':');
            }
            out.append(cleaned, i, i + 2);
        }
        String normalized = out.toString();
        return ZERO.equals(normalized) ? Optional.empty() : Optional.of(normalized);
    }

    /** First usable MAC address appearing anywhere in command output. */
    public static Optional<String> findIn(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = IN_TEXT.matcher(text);
        while (matcher.find()) {
            Optional<String> mac = normalize(matcher.group());
            if (mac.isPresent()) {
                return mac;
            }
        }
        return Optional.empty();
    }

    /** Vendor prefix in {@code aa:bb:cc} form. */
    public static Optional<String> oui(String mac) {
        return normalize(mac).map(m -> m.substring(0, 8));
    }
}
