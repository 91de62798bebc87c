package com.rulesync.rulesync.api;

import java.util.List;

/**
 * One page of a paginated listing. {@code next} is the cursor for the following page
 * (a page token or a full link), absent on the last page.
 */
public record Page<T>(List<T> items, String next) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
