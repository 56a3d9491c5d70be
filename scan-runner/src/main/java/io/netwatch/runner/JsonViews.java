package io.netwatch.runner;

import io.netwatch.discovery.scan.ScanSummary;
import io.netwatch.registry.model.DatabaseStats;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStats;
import io.netwatch.registry.model.HistoryBucket;
import io.netwatch.registry.model.HistoryEntry;
import io.netwatch.registry.model.LatencyStatistics;
import io.netwatch.registry.model.PurgeResult;
import org.json.JSONObject;

import java.time.LocalDateTime;

/**
 * JSON renderings of the registry types printed by the command line.
 */
final class JsonViews {

    private JsonViews() {
    }

    static JSONObject device(DeviceRecord device) {
        return new JSONObject()
            .put("ip", device.getIp())
            .put("mac", nullable(device.getMac()))
            .put("hostname", nullable(device.getHostname()))
            .put("vendor", nullable(device.getVendor()))
            .put("hostnameSource", nullable(device.getHostnameSource()))
            .put("vendorSource", nullable(device.getVendorSource()))
            .put("status", device.getStatus().value())
            .put("pingLatency", nullable(device.getPingLatencyMs()))
            .put("firstSeen", time(device.getFirstSeen()))
            .put("lastSeen", time(device.getLastSeen()))
            .put("scanCount", device.getScanCount())
            .put("additionalInfo", device.extraInfoJson());
    }

    static JSONObject summary(ScanSummary summary) {
        return new JSONObject()
            .put("scanned", summary.getScanned())
            .put("found", summary.getFound())
            .put("updated", summary.getUpdated())
            .put("online", summary.getOnline())
            .put("offline", summary.getOffline())
            .put("failed", summary.getFailed())
            .put("duration", summary.getDurationMs());
    }

    static JSONObject stats(DeviceStats stats) {
        return new JSONObject()
            .put("total", stats.getTotal())
            .put("online", stats.getOnline())
            .put("offline", stats.getOffline())
            .put("unknown", stats.getUnknown())
            .put("lastScan", time(stats.getLastScan()));
    }

    static JSONObject bucket(HistoryBucket bucket) {
        return new JSONObject()
            .put("time", time(bucket.getStart()))
            .put("total", bucket.getTotal())
            .put("online", bucket.getOnline())
            .put("offline", bucket.getOffline());
    }

    static JSONObject history(HistoryEntry entry) {
        return new JSONObject()
            .put("ip", entry.getIp())
            .put("status", entry.getStatus().value())
            .put("pingLatency", nullable(entry.getPingLatencyMs()))
            .put("timestamp", time(entry.getObservedAt()));
    }

    static JSONObject purge(PurgeResult result) {
        return new JSONObject()
            .put("historyDeleted", result.getHistoryDeleted())
            .put("offlineDeleted", result.getOfflineDeleted())
            .put("scansDeleted", result.getScansDeleted())
            .put("latencyMeasurementsDeleted", result.getLatencyDeleted())
            .put("totalDeleted", result.getTotalDeleted());
    }

    static JSONObject database(DatabaseStats stats) {
        return new JSONObject()
            .put("devices", stats.getDevicesCount())
            .put("history", stats.getHistoryCount())
            .put("latencyMeasurements", stats.getLatencyCount())
            .put("oldestDevice", time(stats.getOldestDevice()))
            .put("oldestHistory", time(stats.getOldestHistory()))
            .put("approximateSizeBytes", stats.getApproximateSizeBytes());
    }

    static JSONObject latency(String ip, LatencyStatistics stats) {
        return new JSONObject()
            .put("ip", ip)
            .put("avg1h", nullable(stats.getAvg1h()))
            .put("avg24h", nullable(stats.getAvg24h()))
            .put("min", nullable(stats.getMin()))
            .put("max", nullable(stats.getMax()))
            .put("packetLoss", stats.getPacketLossPercent())
            .put("totalMeasurements", stats.getTotalMeasurements());
    }

    private static Object time(LocalDateTime time) {
        return time == null ? JSONObject.NULL : time.toString();
    }

    private static Object nullable(Object value) {
        return value == null ? JSONObject.NULL : value;
    }
}
