package io.netwatch.discovery.range;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a user supplied target into the ordered list of addresses to probe.
 * <ul>
 *   <li>{@code 192.168.1.0/24}: hosts .1 to .254</li>
 *   <li>{@code 10.0.4.0/23} (any /16 to /23): every address of the masked network except last
 *       octets .0 and .255; at most 1000 addresses</li>
 *   <li>{@code 192.168.1.10-20}: last octet range, inclusive, never beyond .254</li>
 *   <li>{@code 192.168.1.7}: that address alone</li>
 * </ul>
 * Only private address space is accepted. Anything else fails with {@link InvalidRangeException}
 * rather than being truncated.
 */
public final class RangeParser {

    static final int MAX_ADDRESSES = 1000;

    private RangeParser() {
    }

    public static List<String> parse(String range) {
        if (range == null || range.isBlank()) {
            throw new InvalidRangeException("Empty IP range");
        }
        String trimmed = range.trim();

        List<String> addresses;
        if (trimmed.contains("/")) {
            addresses = parseCidr(trimmed);
        } else if (trimmed.contains("-")) {
            addresses = parseDashRange(trimmed);
        } else {
            addresses = new ArrayList<>();
            addresses.add(Ipv4.format(requirePrivate(trimmed)));
        }

        if (addresses.isEmpty()) {
            throw new InvalidRangeException("IP range contains no scannable address: " + trimmed);
        }
        return addresses;
    }

    private static List<String> parseCidr(String range) {
        String[] parts = range.split("/", -1);
        if (parts.length != 2) {
            throw new InvalidRangeException("Invalid CIDR notation: " + range);
        }
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new InvalidRangeException("Invalid CIDR prefix: " + parts[1]);
        }
        if (prefix < 0 || prefix > 32) {
            throw new InvalidRangeException("Invalid CIDR prefix: " + prefix);
        }

        long address = requirePrivate(parts[0].trim());
        long mask = prefix == 0 ? 0 : (0xffffffffL << (32 - prefix)) & 0xffffffffL;
        long network = address & mask;
        List<String> addresses = new ArrayList<>();

        if (prefix == 24) {
            for (int host = 1; host <= 254; host++) {
                addresses.add(Ipv4.format(network + host));
            }
            return addresses;
        }

        if (prefix >= 16 && prefix < 24) {
            long hostCount = 1L << (32 - prefix);
            if (hostCount > MAX_ADDRESSES) {
                throw new InvalidRangeException("CIDR /" + prefix + " would scan " + hostCount
                    + " IPs, which is too large. Maximum " + MAX_ADDRESSES + " IPs allowed.");
            }
            for (long offset = 0; offset < hostCount; offset++) {
                long candidate = network + offset;
                long lastOctet = candidate & 0xff;
                if (lastOctet != 0 && lastOctet != 255) {
                    addresses.add(Ipv4.format(candidate));
                }
            }
            return addresses;
        }

        throw new InvalidRangeException("CIDR /" + prefix + " not supported. Only /16 to /24 are supported.");
    }

    private static List<String> parseDashRange(String range) {
        String[] parts = range.split("-", -1);
        if (parts.length != 2) {
            throw new InvalidRangeException("Invalid range notation: " + range);
        }
        long start = requirePrivate(parts[0].trim());

        String endText = parts[1].trim();
        int end;
        try {
            end = Integer.parseInt(endText);
        } catch (NumberFormatException e) {
            throw new InvalidRangeException("Invalid end number: " + endText);
        }
        if (end < 1 || end > 255) {
            throw new InvalidRangeException("Invalid end number: " + endText);
        }

        int startOctet = (int) (start & 0xff);
        if (end < startOctet) {
            throw new InvalidRangeException("End number (" + end + ") must not be lower than start number (" + startOctet + ")");
        }

        long base = start & 0xffffff00L;
        List<String> addresses = new ArrayList<>();
        for (int octet = startOctet; octet <= Math.min(end, 254); octet++) {
            addresses.add(Ipv4.format(base + octet));
        }
        return addresses;
    }

    private static long requirePrivate(String address) {
        long value = Ipv4.parse(address);
        if (!Ipv4.isPrivate(value)) {
            throw new InvalidRangeException(
                "Only private IP ranges are allowed (10.0.0.0/8, 172.16.0.0/12, 192.168.0.0/16): " + address);
        }
        return value;
    }
}
