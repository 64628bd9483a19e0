package com.device.registry.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageTest {

    @Test
    @DisplayName("Should slice a list by page")
    void testSlice() {
        List<Integer> all = List.of(1, 2, 3, 4, 5);

        Page<Integer> page = Page.of(all, PageRequest.of(1, 2));

        assertEquals(List.of(3, 4), page.content());
        assertEquals(5, page.totalElements());
        assertEquals(1, page.pageNumber());
        assertEquals(3, page.totalPages());
        assertTrue(page.hasNext());
    }

    @Test
    @DisplayName("A page past the end is empty")
    void testPastEnd() {
        Page<Integer> page = Page.of(List.of(1, 2), PageRequest.of(5, 2));

        assertTrue(page.content().isEmpty());
        assertFalse(page.hasNext());
    }

    @Test
    @DisplayName("Should validate the request")
    void testRequestValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 1001));
        assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        assertEquals(3, PageRequest.of(3, 20).pageNumber());
    }
}
