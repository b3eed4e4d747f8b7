package com.jdc.catalog_manager.domain.dto.common;

import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * Paginated list envelope shared by every list endpoint.
 */
@Getter
@Builder
@AllArgsConstructor
public class PageResponseDto<T> {

    private final List<T> items;
    private final long total;
    private final int page;
    private final int size;
    private final boolean hasNext;
    private final boolean hasPrev;
    private final PageLinksDto links;

    public static <T> PageResponseDto<T> of(PageSlice<T> slice, String path, Map<String, ?> params) {
        return of(slice.items(), slice.total(), slice.window(), path, params);
    }

    /**
     * @param path   request path the navigation links point back to
     * @param params filter parameters repeated on every link, null or blank values are skipped
     */
    public static <T> PageResponseDto<T> of(List<T> items, long total, PageWindow window,
                                            String path, Map<String, ?> params) {
        boolean hasNext = window.offset() + items.size() < total;
        boolean hasPrev = window.offset() > 0;

        String next = hasNext ? link(path, params, window.limit(), window.nextOffset()) : null;
        String prev = hasPrev ? link(path, params, window.limit(), window.prevOffset()) : null;

        return PageResponseDto.<T>builder()
                .items(items)
                .total(total)
                .page(window.page())
                .size(window.limit())
                .hasNext(hasNext)
                .hasPrev(hasPrev)
                .links(new PageLinksDto(next, prev))
                .build();
    }

    private static String link(String path, Map<String, ?> params, int limit, long offset) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromPath(path);
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null && !value.toString().isBlank()) {
                    builder.queryParam(key, value);
                }
            });
        }
        return builder
                .queryParam("limit", limit)
                .queryParam("offset", offset)
                .encode()
                .build()
                .toUriString();
    }
}
