package io.netwatch.registry.service;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.MutableClock;
import io.netwatch.registry.TestDatabases;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStats;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.HistoryBucket;
import io.netwatch.registry.model.ScanObservation;
import io.netwatch.registry.query.DeviceQuery;
import io.netwatch.registry.query.SortField;
import io.netwatch.registry.query.SortOrder;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DeviceQueryServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 12, 0, 0);

    private MutableClock clock;
    private DeviceReconciler reconciler;
    private DeviceQueryService queries;

    @BeforeEach
    void setUp() {
        DatabaseManager db = TestDatabases.newDatabase();
        clock = new MutableClock(T0);
        reconciler = new DeviceReconciler(db, clock);
        queries = new DeviceQueryService(db, clock);
    }

    private static List<String> ips(List<DeviceRecord> records) {
        return records.stream().map(DeviceRecord::getIp).collect(Collectors.toList());
    }

    @Test
    void ipSortIsNumericNotLexicographic() {
        for (String ip : Arrays.asList("192.168.1.2", "192.168.1.100", "192.168.1.10")) {
            reconciler.reconcile(ScanObservation.online(ip, 1));
        }

        List<DeviceRecord> asc = queries.find(DeviceQuery.all().sortBy(SortField.IP, SortOrder.ASC));
        assertEquals(Arrays.asList("192.168.1.2", "192.168.1.10", "192.168.1.100"), ips(asc));

        List<DeviceRecord> desc = queries.find(DeviceQuery.all().sortBy(SortField.IP, SortOrder.DESC));
        assertEquals(Arrays.asList("192.168.1.100", "192.168.1.10", "192.168.1.2"), ips(desc));
    }

    @Test
    void paginationIsAppliedAfterDerivedSort() {
        // inserted in an order unrelated to numeric order
        int[] lastOctets = {50, 3, 200, 7, 120, 1, 99, 12, 250, 30};
        for (int octet : lastOctets) {
            reconciler.reconcile(ScanObservation.online("10.0.0." + octet, 1));
        }

        List<DeviceRecord> page = queries.find(DeviceQuery.all()
            .sortBy(SortField.IP, SortOrder.ASC)
            .page(2, 2));

        assertEquals(Arrays.asList("10.0.0.7", "10.0.0.12"), ips(page));
        assertEquals(10, queries.count(DeviceQuery.all().page(2, 2)));
    }

    @Test
    void derivedSortWithHugeLimitReturnsTheRest() {
        for (String ip : Arrays.asList("10.0.0.3", "10.0.0.1", "10.0.0.2")) {
            reconciler.reconcile(ScanObservation.online(ip, 1));
        }

        List<DeviceRecord> rest = queries.find(DeviceQuery.all()
            .sortBy(SortField.IP, SortOrder.ASC)
            .page(Integer.MAX_VALUE, 1));

        assertEquals(Arrays.asList("10.0.0.2", "10.0.0.3"), ips(rest));
        assertEquals(Arrays.asList("b", "c"), DeviceQueryService.slice(Arrays.asList("a", "b", "c"), 1, Integer.MAX_VALUE));
        assertTrue(DeviceQueryService.slice(Arrays.asList("a", "b"), 5, Integer.MAX_VALUE).isEmpty());
    }

    @Test
    void hostnameSortPutsMissingNamesLastInBothDirections() {
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        reconciler.reconcile(ScanObservation.online("10.0.0.2", 1).withHostname("beta", "scanner"));
        reconciler.reconcile(ScanObservation.online("10.0.0.3", 1).withHostname("--", "scanner"));
        reconciler.reconcile(ScanObservation.online("10.0.0.4", 1).withHostname("Alpha", "scanner"));

        List<DeviceRecord> asc = queries.find(DeviceQuery.all().sortBy(SortField.HOSTNAME, SortOrder.ASC));
        assertEquals(Arrays.asList("10.0.0.4", "10.0.0.2", "10.0.0.1", "10.0.0.3"), ips(asc));

        List<DeviceRecord> desc = queries.find(DeviceQuery.all().sortBy(SortField.HOSTNAME, SortOrder.DESC));
        assertEquals(Arrays.asList("10.0.0.2", "10.0.0.4", "10.0.0.1", "10.0.0.3"), ips(desc));
    }

    @Test
    void nativeSortIsPagedByTheDatabase() {
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        for (int i = 0; i < 3; i++) {
            reconciler.reconcile(ScanObservation.online("10.0.0.2", 1));
        }
        for (int i = 0; i < 2; i++) {
            reconciler.reconcile(ScanObservation.online("10.0.0.3", 1));
        }

        List<DeviceRecord> top = queries.find(DeviceQuery.all()
            .sortBy(SortField.SCAN_COUNT, SortOrder.DESC)
            .page(2, 0));
        assertEquals(Arrays.asList("10.0.0.2", "10.0.0.3"), ips(top));

        List<DeviceRecord> rest = queries.find(DeviceQuery.all()
            .sortBy(SortField.SCAN_COUNT, SortOrder.DESC)
            .page(null, 2));
        assertEquals(Arrays.asList("10.0.0.1"), ips(rest));
    }

    @Test
    void searchReachesNestedExtraInfo() {
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1).withHostname("web", "scanner"));
        reconciler.reconcile(ScanObservation.online("10.0.0.2", 1).withVendor("Raspberry Pi", "scanner"));
        JSONArray ports = new JSONArray().put(new JSONObject().put("port", 8443).put("protocol", "tcp"));
        reconciler.mergeExtraInfo("10.0.0.1", new JSONObject().put("openPorts", ports));

        assertEquals(Arrays.asList("10.0.0.1"), ips(queries.find(DeviceQuery.all().search("8443"))));
        assertEquals(Arrays.asList("10.0.0.2"), ips(queries.find(DeviceQuery.all().search("raspberry"))));
        assertEquals(0, queries.count(DeviceQuery.all().search("100%")));
    }

    @Test
    void statusPrefixAndTimeWindowFilters() {
        reconciler.reconcile(ScanObservation.online("192.168.1.5", 1));
        reconciler.reconcile(ScanObservation.online("192.168.2.5", 1));
        clock.advance(Duration.ofHours(1));
        reconciler.reconcile(ScanObservation.offline("192.168.2.5"));

        assertEquals(Arrays.asList("192.168.2.5"),
            ips(queries.find(DeviceQuery.all().status(DeviceStatus.OFFLINE))));
        assertEquals(Arrays.asList("192.168.1.5"),
            ips(queries.find(DeviceQuery.all().ipPrefix("192.168.1."))));
        assertEquals(Arrays.asList("192.168.2.5"),
            ips(queries.find(DeviceQuery.all().lastSeenBetween(T0.plusMinutes(30), null))));
    }

    @Test
    void statsCountByStatus() {
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        reconciler.reconcile(ScanObservation.online("10.0.0.2", 1));
        clock.advance(Duration.ofMinutes(10));
        reconciler.reconcile(ScanObservation.offline("10.0.0.2"));

        DeviceStats stats = queries.getStats();
        assertEquals(2, stats.getTotal());
        assertEquals(1, stats.getOnline());
        assertEquals(1, stats.getOffline());
        assertEquals(0, stats.getUnknown());
        assertEquals(T0.plusMinutes(10), stats.getLastScan());
    }

    @Test
    void historyIsBucketedByQuarterHour() {
        clock.set(T0.plusMinutes(1));
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        reconciler.reconcile(ScanObservation.online("10.0.0.2", 1));
        clock.set(T0.plusMinutes(14));
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        clock.set(T0.plusMinutes(16));
        reconciler.reconcile(ScanObservation.offline("10.0.0.2"));

        clock.set(T0.plusHours(1));
        List<HistoryBucket> buckets = queries.getHistoricalStats(2);

        assertEquals(2, buckets.size());
        assertEquals(T0, buckets.get(0).getStart());
        assertEquals(2, buckets.get(0).getTotal());
        assertEquals(2, buckets.get(0).getOnline());
        assertEquals(0, buckets.get(0).getOffline());
        assertEquals(T0.plusMinutes(15), buckets.get(1).getStart());
        assertEquals(1, buckets.get(1).getTotal());
        assertEquals(1, buckets.get(1).getOffline());
    }

    @Test
    void onlyTheLatestFortyEightBucketsAreReturned() {
        for (int i = 0; i < 60; i++) {
            clock.set(T0.plusMinutes(15L * i));
            reconciler.reconcile(ScanObservation.online("10.0.0.1", 1));
        }

        List<HistoryBucket> buckets = queries.getHistoricalStats(24);
        assertEquals(48, buckets.size());
        assertEquals(T0.plusMinutes(15L * 59), buckets.get(47).getStart());
    }

    @Test
    void bucketStartTruncatesToQuarterHour() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 9, 45),
            DeviceQueryService.bucketStart(LocalDateTime.of(2024, 1, 1, 9, 59, 59)));
        assertEquals(LocalDateTime.of(2024, 1, 1, 9, 0),
            DeviceQueryService.bucketStart(LocalDateTime.of(2024, 1, 1, 9, 0)));
    }

    @Test
    void historyForOneDeviceIsNewestFirst() {
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 5));
        clock.advance(Duration.ofMinutes(1));
        reconciler.reconcile(ScanObservation.offline("10.0.0.1"));
        clock.advance(Duration.ofMinutes(1));
        reconciler.reconcile(ScanObservation.online("10.0.0.1", 6));

        assertEquals(2, queries.getHistory("10.0.0.1", 2).size());
        assertEquals(DeviceStatus.ONLINE, queries.getHistory("10.0.0.1", 2).get(0).getStatus());
        assertThrows(IllegalArgumentException.class, () -> queries.getHistory("10.0.0.1", 0));
    }
}
