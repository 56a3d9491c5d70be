package io.netwatch.discovery.range;

public final class Ipv4 {

    private Ipv4() {
    }

    public static boolean isValid(String address) {
        try {
            parse(address);
            return true;
        } catch (InvalidRangeException e) {
            return false;
        }
    }

    public static long parse(String address) {
        if (address == null) {
            throw new InvalidRangeException("Invalid IP address: null");
        }
        String[] parts = address.trim().split("\\.", -1);
        if (parts.length != 4) {
            throw new InvalidRangeException("Invalid IP address: " + address);
        }
        long value = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                throw new InvalidRangeException("Invalid IP address: " + address);
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                throw new InvalidRangeException("Invalid IP address: " + address);
            }
            value = (value << 8) | octet;
        }
        return value;
    }

    public static String format(long value) {
        return ((value >> 24) & 0xff) + "." + ((value >> 16) & 0xff) + "." + ((value >> 8) & 0xff) + "." + (value & 0xff);
    }

    /** 10/8, 172.16/12 or 192.168/16. */
    public static boolean isPrivate(long value) {
        long first = (value >> 24) & 0xff;
        long second = (value >> 16) & 0xff;
        return first == 10
            || (first == 172 && second >= 16 && second <= 31)
            || (first == 192 && second == 168);
    }
}
