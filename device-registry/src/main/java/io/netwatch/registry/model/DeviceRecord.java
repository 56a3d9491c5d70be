package io.netwatch.registry.model;

import org.json.JSONObject;

import java.time.LocalDateTime;

public class DeviceRecord {
    private Long id;
    private String ip;
    private String mac;
    private String hostname;
    private String vendor;
    private String hostnameSource;
    private String vendorSource;
    private DeviceStatus status = DeviceStatus.UNKNOWN;
    private Integer pingLatencyMs;
    private LocalDateTime firstSeen;
    private LocalDateTime lastSeen;
    private int scanCount;
    private String extraInfo;
    
    public DeviceRecord() {}
    
    public DeviceRecord(String ip) {
        this.ip = ip;
    }
    
    public DeviceRecord copy() {
        DeviceRecord copy = new DeviceRecord(ip);
        copy.id = id;
        copy.mac = mac;
        copy.hostname = hostname;
        copy.vendor = vendor;
        copy.hostnameSource = hostnameSource;
        copy.vendorSource = vendorSource;
        copy.status = status;
        copy.pingLatencyMs = pingLatencyMs;
        copy.firstSeen = firstSeen;
        copy.lastSeen = lastSeen;
        copy.scanCount = scanCount;
        copy.extraInfo = extraInfo;
        return copy;
    }
    
    /** Parsed view of {@link #getExtraInfo()}; empty object when nothing is stored. */
    public JSONObject extraInfoJson() {
        if (extraInfo == null || extraInfo.isBlank()) {
            return new JSONObject();
        }
        return new JSONObject(extraInfo);
    }
    
    // Getters and setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    
    public String getIp() { return ip; }
    public void setIp(String ip) { this.ip = ip; }
    
    public String getMac() { return mac; }
    public void setMac(String mac) { this.mac = mac; }
    
    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = hostname; }
    
    public String getVendor() { return vendor; }
    public void setVendor(String vendor) { this.vendor = vendor; }
    
    public String getHostnameSource() { return hostnameSource; }
    public void setHostnameSource(String hostnameSource) { this.hostnameSource = hostnameSource; }
    
    public String getVendorSource() { return vendorSource; }
    public void setVendorSource(String vendorSource) { this.vendorSource = vendorSource; }
    
    public DeviceStatus getStatus() { return status; }
    public void setStatus(DeviceStatus status) { this.status = status; }
    
    public Integer getPingLatencyMs() { return pingLatencyMs; }
    public void setPingLatencyMs(Integer pingLatencyMs) { this.pingLatencyMs = pingLatencyMs; }
    
    public LocalDateTime getFirstSeen() { return firstSeen; }
    public void setFirstSeen(LocalDateTime firstSeen) { this.firstSeen = firstSeen; }
    
    public LocalDateTime getLastSeen() { return lastSeen; }
    public void setLastSeen(LocalDateTime lastSeen) { this.lastSeen = lastSeen; }
    
    public int getScanCount() { return scanCount; }
    public void setScanCount(int scanCount) { this.scanCount = scanCount; }
    
    public String getExtraInfo() { return extraInfo; }
    public void setExtraInfo(String extraInfo) { this.extraInfo = extraInfo; }
    
    @Override
    public String toString() {
        return "DeviceRecord{ip=" + ip + ", status=" + status.value() + ", mac=" + mac
            + ", hostname=" + hostname + ", vendor=" + vendor + ", scanCount=" + scanCount + "}";
    }
}
