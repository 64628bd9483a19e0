package com.device.registry.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceAdapterRegistryTest {

    @Test
    @DisplayName("Should look up adapters by source id in registration order")
    void testLookup() {
        StubSourceAdapter shure = new StubSourceAdapter("shure");
        StubSourceAdapter sennheiser = new StubSourceAdapter("sennheiser");

        SourceAdapterRegistry adapters = SourceAdapterRegistry.builder()
                .register(shure)
                .register(sennheiser)
                .build();

        assertSame(shure, adapters.get("shure"));
        assertTrue(adapters.contains("sennheiser"));
        assertFalse(adapters.contains("audio-technica"));
        assertEquals(List.of("shure", "sennheiser"), List.copyOf(adapters.sourceIds()));
    }

    @Test
    @DisplayName("Should reject a second adapter for the same source")
    void testDuplicateSource() {
        SourceAdapterRegistry.Builder builder = SourceAdapterRegistry.builder().register(new StubSourceAdapter("shure"));
        assertThrows(IllegalArgumentException.class, () -> builder.register(new StubSourceAdapter("shure")));
    }

    @Test
    @DisplayName("Should reject an unknown source")
    void testUnknownSource() {
        SourceAdapterRegistry adapters = SourceAdapterRegistry.builder().build();
        assertThrows(IllegalArgumentException.class, () -> adapters.get("shure"));
    }
}
