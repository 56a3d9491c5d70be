package io.netwatch.discovery.probe;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PingOutputParser {

    // Windows: "Reply from 192.168.1.1: bytes=32 time<1ms TTL=64"
    private static final Pattern WINDOWS_TIME = Pattern.compile("time[<=](\\d+)ms", Pattern.CASE_INSENSITIVE);
    // Linux/macOS: "64 bytes from 192.168.1.1: icmp_seq=1 ttl=64 time=0.123 ms"
    private static final Pattern UNIX_TIME = Pattern.compile("time=([\\d.]+)\\s*ms", Pattern.CASE_INSENSITIVE);

    private PingOutputParser() {
    }

    /**
     * @return latency in whole milliseconds, or {@code null} when the output holds no reply
     */
    public static Integer parseLatency(String output) {
        if (output == null || output.isEmpty()) {
            return null;
        }

        Matcher windows = WINDOWS_TIME.matcher(output);
        if (windows.find()) {
            return Integer.parseInt(windows.group(1));
        }

        Matcher unix = UNIX_TIME.matcher(output);
        if (unix.find()) {
            try {
                return (int) Math.round(Double.parseDouble(unix.group(1)));
            } catch (NumberFormatException e) {
                return null;
            }
        }

        return null;
    }
}
