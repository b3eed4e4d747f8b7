package com.jdc.catalog_manager.domain.dto.common;

import com.jdc.catalog_manager.util.PageWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PageResponseDtoTest {

    private static final String PATH = "/api/v1/catalog-items";

    @Test
    @DisplayName("first page of several has a next link only")
    void firstPage() {
        PageResponseDto<String> page = PageResponseDto.of(List.of("a", "b"), 5, new PageWindow(0, 2), PATH, Map.of());

        assertEquals(5, page.getTotal());
        assertEquals(1, page.getPage());
        assertEquals(2, page.getSize());
        assertTrue(page.isHasNext());
        assertFalse(page.isHasPrev());
        assertEquals(PATH + "?limit=2&offset=2", page.getLinks().getNext());
        assertNull(page.getLinks().getPrev());
    }

    @Test
    @DisplayName("last page has a prev link only, clamped at offset 0")
    void lastPage() {
        PageResponseDto<String> page = PageResponseDto.of(List.of("e"), 5, new PageWindow(4, 10), PATH, Map.of());

        assertFalse(page.isHasNext());
        assertTrue(page.isHasPrev());
        assertNull(page.getLinks().getNext());
        assertEquals(PATH + "?limit=10&offset=0", page.getLinks().getPrev());
    }

    @Test
    @DisplayName("filter parameters are carried on links and blank ones are dropped")
    void carriesFilters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "jaj");
        params.put("status", "");
        params.put("category_id", null);

        PageResponseDto<String> page = PageResponseDto.of(List.of("x", "y"), 6, new PageWindow(2, 2),
                PATH + "/search", params);

        assertEquals(PATH + "/search?name=jaj&limit=2&offset=4", page.getLinks().getNext());
        assertEquals(PATH + "/search?name=jaj&limit=2&offset=0", page.getLinks().getPrev());
    }

    @Test
    @DisplayName("an empty result has neither link")
    void emptyResult() {
        PageResponseDto<String> page = PageResponseDto.of(List.of(), 0, new PageWindow(0, 20), PATH, Map.of());

        assertTrue(page.getItems().isEmpty());
        assertFalse(page.isHasNext());
        assertFalse(page.isHasPrev());
        assertNull(page.getLinks().getNext());
        assertNull(page.getLinks().getPrev());
    }
}
