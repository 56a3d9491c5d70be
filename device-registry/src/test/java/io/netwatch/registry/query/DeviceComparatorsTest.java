package io.netwatch.registry.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceComparatorsTest {

    @Test
    void emptyValuesSortLastAndKeepTheirOrder() {
        List<String> hostnames = new ArrayList<>(Arrays.asList(null, "alpha", "", "--", "beta", "  "));

        List<String> asc = new ArrayList<>(hostnames);
        asc.sort(DeviceComparators.emptyLastStrings(SortOrder.ASC));
        assertEquals(Arrays.asList("alpha", "beta", null, "", "--", "  "), asc);

        List<String> desc = new ArrayList<>(hostnames);
        desc.sort(DeviceComparators.emptyLastStrings(SortOrder.DESC));
        assertEquals(Arrays.asList("beta", "alpha", null, "", "--", "  "), desc);
    }

    @Test
    void textOrderIgnoresCase() {
        List<String> values = new ArrayList<>(Arrays.asList("b", "A", "c"));
        values.sort(DeviceComparators.emptyLastStrings(SortOrder.ASC));
        assertEquals(Arrays.asList("A", "b", "c"), values);
    }

    @Test
    void ipv4ToLong() {
        assertEquals(3232235778L, DeviceComparators.ipv4ToLong("192.168.1.2"));
        assertTrue(DeviceComparators.ipv4ToLong("192.168.1.10") < DeviceComparators.ipv4ToLong("192.168.1.100"));
        assertEquals(0L, DeviceComparators.ipv4ToLong("not-an-ip"));
        assertEquals(0L, DeviceComparators.ipv4ToLong("1.2.3.256"));
        assertEquals(0L, DeviceComparators.ipv4ToLong(null));
    }

    @Test
    void nativeFieldsHaveNoInMemoryOrdering() {
        assertThrows(IllegalArgumentException.class,
            () -> DeviceComparators.forField(SortField.LAST_SEEN, SortOrder.ASC));
    }

    @Test
    void sortFieldParsing() {
        assertEquals(SortField.LAST_SEEN, SortField.fromValue(null));
        assertEquals(SortField.PING_LATENCY, SortField.fromValue("ping_latency"));
        assertEquals(SortField.IP, SortField.fromValue("IP"));
        assertThrows(IllegalArgumentException.class, () -> SortField.fromValue("password"));
    }
}
