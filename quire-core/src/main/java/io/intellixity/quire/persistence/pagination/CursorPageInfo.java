package io.intellixity.quire.persistence.pagination;

/** Cursors are null when there is nothing further in that direction. */
public record CursorPageInfo(int limit, boolean hasNext, boolean hasPrev, String nextCursor, String prevCursor) {}
