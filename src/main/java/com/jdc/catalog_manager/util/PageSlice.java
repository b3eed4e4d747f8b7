package com.jdc.catalog_manager.util;

import java.util.List;
import java.util.function.Function;

/**
 * One window of a sorted result together with the unfiltered-by-window total.
 */
public record PageSlice<T>(List<T> items, long total, PageWindow window) {

    public <R> PageSlice<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageSlice<>(mapped, total, window);
    }
}
