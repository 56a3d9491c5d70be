package io.netwatch.registry.query;

import io.netwatch.registry.model.DeviceStatus;

import java.time.LocalDateTime;

public class DeviceQuery {
    private DeviceStatus status;
    private String ipPrefix;
    private String search;
    private LocalDateTime lastSeenFrom;
    private LocalDateTime lastSeenTo;
    private SortField sortBy = SortField.LAST_SEEN;
    private SortOrder sortOrder = SortOrder.DESC;
    private Integer limit;
    private Integer offset;

    public static DeviceQuery all() {
        return new DeviceQuery();
    }

    public DeviceQuery status(DeviceStatus status) {
        this.status = status;
        return this;
    }

    /** Matches addresses starting with the given text, e.g. "192.168.1". */
    public DeviceQuery ipPrefix(String ipPrefix) {
        this.ipPrefix = ipPrefix;
        return this;
    }

    /** Case-insensitive substring over ip, mac, hostname, vendor and the values nested in extra info. */
    public DeviceQuery search(String search) {
        this.search = search;
        return this;
    }

    public DeviceQuery lastSeenBetween(LocalDateTime from, LocalDateTime to) {
        this.lastSeenFrom = from;
        this.lastSeenTo = to;
        return this;
    }

    public DeviceQuery sortBy(SortField sortBy, SortOrder sortOrder) {
        this.sortBy = sortBy != null ? sortBy : SortField.LAST_SEEN;
        this.sortOrder = sortOrder != null ? sortOrder : SortOrder.DESC;
        return this;
    }

    public DeviceQuery page(Integer limit, Integer offset) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        this.limit = limit;
        this.offset = offset;
        return this;
    }

    public DeviceStatus getStatus() { return status; }
    public String getIpPrefix() { return ipPrefix; }
    public String getSearch() { return search; }
    public LocalDateTime getLastSeenFrom() { return lastSeenFrom; }
    public LocalDateTime getLastSeenTo() { return lastSeenTo; }
    public SortField getSortBy() { return sortBy; }
    public SortOrder getSortOrder() { return sortOrder; }
    public Integer getLimit() { return limit; }
    public Integer getOffset() { return offset; }
}
