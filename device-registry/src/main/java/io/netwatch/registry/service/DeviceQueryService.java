package io.netwatch.registry.service;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStats;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.HistoryBucket;
import io.netwatch.registry.model.HistoryEntry;
import io.netwatch.registry.query.DeviceComparators;
import io.netwatch.registry.query.DeviceQuery;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.repository.HistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Read side of the registry.
 * <p>
 * Sorting on a native column is pushed to the database together with the page bounds. IP, hostname,
 * MAC and vendor orderings cannot be expressed in SQL (numeric IPv4 order, empty values last in
 * both directions), so for those every filtered row is fetched, sorted here and only then sliced.
 * Paginating before that sort would return the wrong rows.
 */
public class DeviceQueryService {
    
    private static final Logger logger = LoggerFactory.getLogger(DeviceQueryService.class);
    
    static final int BUCKET_MINUTES = 15;
    static final int MAX_BUCKETS = 48;
    
    private final DeviceRepository deviceRepository;
    private final HistoryRepository historyRepository;
    private final Clock clock;
    
    public DeviceQueryService(DatabaseManager dbManager) {
        this(dbManager, Clock.systemDefaultZone());
    }
    
    public DeviceQueryService(DatabaseManager dbManager, Clock clock) {
        this.deviceRepository = new DeviceRepository(dbManager);
        this.historyRepository = new HistoryRepository(dbManager);
        this.clock = clock;
    }
    
    public List<DeviceRecord> find(DeviceQuery query) {
        if (!query.getSortBy().isDerived()) {
            return deviceRepository.findPage(query);
        }
        
        List<DeviceRecord> all = deviceRepository.findMatching(query);
        // List.sort is stable, rows that compare equal keep insertion order
        all.sort(DeviceComparators.forField(query.getSortBy(), query.getSortOrder()));
        logger.debug("Sorted {} devices in memory by {} {}", all.size(), query.getSortBy(), query.getSortOrder());
        return slice(all, query.getOffset(), query.getLimit());
    }
    
    static <T> List<T> slice(List<T> sorted, Integer offset, Integer limit) {
        int from = Math.min(offset != null ? offset : 0, sorted.size());
        int to = limit != null ? from + Math.min(limit, sorted.size() - from) : sorted.size();
        return new ArrayList<>(sorted.subList(from, to));
    }
    
    public int count(DeviceQuery query) {
        return deviceRepository.count(query);
    }
    
    public Optional<DeviceRecord> findByIp(String ip) {
        return deviceRepository.findByIp(ip);
    }
    
    public DeviceStats getStats() {
        Map<DeviceStatus, Integer> counts = deviceRepository.countByStatus();
        int online = counts.get(DeviceStatus.ONLINE);
        int offline = counts.get(DeviceStatus.OFFLINE);
        int unknown = counts.get(DeviceStatus.UNKNOWN);
        LocalDateTime lastScan = deviceRepository.findLatestLastSeen().orElse(null);
        return new DeviceStats(online + offline + unknown, online, offline, unknown, lastScan);
    }
    
    /**
     * History of the last {@code hours} hours grouped into 15 minute slots, oldest first. Each slot
     * counts distinct addresses; only the latest 48 slots are returned.
     */
    public List<HistoryBucket> getHistoricalStats(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be > 0, got " + hours);
        }
        LocalDateTime since = LocalDateTime.now(clock).minusHours(hours);
        
        Map<LocalDateTime, Set<String>> all = new TreeMap<>();
        Map<LocalDateTime, Set<String>> online = new HashMap<>();
        Map<LocalDateTime, Set<String>> offline = new HashMap<>();
        
        for (HistoryEntry entry : historyRepository.findSince(since)) {
            LocalDateTime bucket = bucketStart(entry.getObservedAt());
            all.computeIfAbsent(bucket, b -> new HashSet<>()).add(entry.getIp());
            if (entry.getStatus() == DeviceStatus.ONLINE) {
                online.computeIfAbsent(bucket, b -> new HashSet<>()).add(entry.getIp());
            } else if (entry.getStatus() == DeviceStatus.OFFLINE) {
                offline.computeIfAbsent(bucket, b -> new HashSet<>()).add(entry.getIp());
            }
        }
        
        List<HistoryBucket> buckets = new ArrayList<>();
        for (Map.Entry<LocalDateTime, Set<String>> slot : all.entrySet()) {
            LocalDateTime start = slot.getKey();
            buckets.add(new HistoryBucket(start, slot.getValue().size(),
                online.getOrDefault(start, Collections.emptySet()).size(),
                offline.getOrDefault(start, Collections.emptySet()).size()));
        }
        
        if (buckets.size() > MAX_BUCKETS) {
            return new ArrayList<>(buckets.subList(buckets.size() - MAX_BUCKETS, buckets.size()));
        }
        return buckets;
    }
    
    static LocalDateTime bucketStart(LocalDateTime observedAt) {
        LocalDateTime hour = observedAt.truncatedTo(ChronoUnit.HOURS);
        return hour.plusMinutes((observedAt.getMinute() / BUCKET_MINUTES) * BUCKET_MINUTES);
    }
    
    /** Newest first. */
    public List<HistoryEntry> getHistory(String ip, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got " + limit);
        }
        return historyRepository.findByIp(ip, limit);
    }
}
