package com.jdc.catalog_manager.util;

import com.jdc.catalog_manager.config.PaginationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PageWindowResolver {

    private final PaginationProperties properties;

    /**
     * Clamps the requested window: limit into [1, max-limit], offset to at least 0.
     * Missing values fall back to the configured default limit and offset 0.
     */
    public PageWindow resolve(Integer limit, Long offset) {
        int max = Math.max(1, properties.getMaxLimit());
        int requested = limit != null ? limit : properties.getDefaultLimit();
        int clampedLimit = Math.min(Math.max(requested, 1), max);
        long clampedOffset = offset != null ? Math.max(0L, offset) : 0L;
        return new PageWindow(clampedOffset, clampedLimit);
    }
}
