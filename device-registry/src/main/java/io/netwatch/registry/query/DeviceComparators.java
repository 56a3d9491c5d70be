package io.netwatch.registry.query;

import io.netwatch.registry.model.DeviceRecord;

import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;

public final class DeviceComparators {

    /** Placeholder some sources write instead of leaving a field empty. */
    static final String PLACEHOLDER = "--";

    private DeviceComparators() {
    }

    public static Comparator<DeviceRecord> forField(SortField field, SortOrder order) {
        switch (field) {
            case IP:
                return byIp(order);
            case HOSTNAME:
                return emptyLast(DeviceRecord::getHostname, order);
            case MAC:
                return emptyLast(DeviceRecord::getMac, order);
            case VENDOR:
                return emptyLast(DeviceRecord::getVendor, order);
            default:
                throw new IllegalArgumentException("No in-memory ordering for " + field);
        }
    }

    /**
     * Orders by the 32-bit value of the address. Unparseable addresses sort as 0.
     */
    public static Comparator<DeviceRecord> byIp(SortOrder order) {
        Comparator<DeviceRecord> asc = Comparator.comparingLong(r -> ipv4ToLong(r.getIp()));
        return order == SortOrder.DESC ? asc.reversed() : asc;
    }

    public static <T> Comparator<T> emptyLast(Function<T, String> extractor, SortOrder order) {
        Comparator<String> values = emptyLastStrings(order);
        return (a, b) -> values.compare(extractor.apply(a), extractor.apply(b));
    }

    /**
     * Case-insensitive text order where null, blank and "--" always come after every populated
     * value, whichever the direction. Empty values compare equal so a stable sort keeps their
     * relative order.
     */
    public static Comparator<String> emptyLastStrings(SortOrder order) {
        return (a, b) -> {
            boolean aEmpty = isEmpty(a);
            boolean bEmpty = isEmpty(b);
            if (aEmpty || bEmpty) {
                return Boolean.compare(aEmpty, bEmpty);
            }
            int cmp = a.trim().toLowerCase(Locale.ROOT).compareTo(b.trim().toLowerCase(Locale.ROOT));
            return order == SortOrder.DESC ? -cmp : cmp;
        };
    }

    static boolean isEmpty(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() || PLACEHOLDER.equals(trimmed);
    }

    public static long ipv4ToLong(String ip) {
        if (ip == null) {
            return 0L;
        }
        String[] parts = ip.trim().split("\\.");
        if (parts.length != 4) {
            return 0L;
        }
        long value = 0L;
        for (String part : parts) {
            int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return 0L;
            }
            if (octet < 0 || octet > 255) {
                return 0L;
            }
            value = (value << 8) | octet;
        }
        return value;
    }
}
