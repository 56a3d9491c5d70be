package io.netwatch.registry.repository;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRepositoryTest {

    @Test
    void searchableTextFlattensNestedValues() {
        String json = "{\"openPorts\":[{\"port\":22,\"protocol\":\"TCP\"}],\"os\":{\"name\":\"Linux\"}}";
        String text = DeviceRepository.searchableText(json);
        assertTrue(text.contains("22"));
        assertTrue(text.contains("tcp"));
        assertTrue(text.contains("linux"));
        assertFalse(text.contains("openports"), "keys are not searchable");
    }

    @Test
    void emptyExtraInfoHasNoSearchText() {
        assertNull(DeviceRepository.searchableText(null));
        assertNull(DeviceRepository.searchableText("{}"));
    }

    @Test
    void likeWildcardsAreEscaped() {
        assertEquals("100\\%\\_a", DeviceRepository.escapeLike("100%_a"));
    }
}
