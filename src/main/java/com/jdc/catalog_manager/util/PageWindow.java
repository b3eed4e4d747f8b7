package com.jdc.catalog_manager.util;

/**
 * Resolved limit/offset pair after clamping.
 */
public record PageWindow(long offset, int limit) {

    /**
     * One-based page number, saturating at {@link Integer#MAX_VALUE} for offsets far past any real data.
     */
    public int page() {
        return (int) Math.min(Integer.MAX_VALUE, offset / limit + 1);
    }

    public long nextOffset() {
        return offset > Long.MAX_VALUE - limit ? Long.MAX_VALUE : offset + limit;
    }

    public long prevOffset() {
        return Math.max(0, offset - limit);
    }
}
