package io.netwatch.registry.model;

/**
 * Probe outcome for one address, plus whatever enrichment produced a value.
 * Enrichment fields left {@code null} mean "nothing new", never "clear it".
 */
public class ScanObservation {
    private final String ip;
    private final boolean reachable;
    private final Integer pingLatencyMs;
    private String mac;
    private String hostname;
    private String vendor;
    private String hostnameSource;
    private String vendorSource;

    private ScanObservation(String ip, boolean reachable, Integer pingLatencyMs) {
        this.ip = ip;
        this.reachable = reachable;
        this.pingLatencyMs = pingLatencyMs;
    }

    public static ScanObservation online(String ip, Integer pingLatencyMs) {
        return new ScanObservation(ip, true, pingLatencyMs);
    }

    public static ScanObservation offline(String ip) {
        return new ScanObservation(ip, false, null);
    }

    public ScanObservation withMac(String mac) {
        this.mac = mac;
        return this;
    }

    public ScanObservation withHostname(String hostname, String source) {
        this.hostname = hostname;
        this.hostnameSource = source;
        return this;
    }

    public ScanObservation withVendor(String vendor, String source) {
        this.vendor = vendor;
        this.vendorSource = source;
        return this;
    }

    public String getIp() { return ip; }
    public boolean isReachable() { return reachable; }
    public Integer getPingLatencyMs() { return pingLatencyMs; }
    public String getMac() { return mac; }
    public String getHostname() { return hostname; }
    public String getVendor() { return vendor; }
    public String getHostnameSource() { return hostnameSource; }
    public String getVendorSource() { return vendorSource; }
}
