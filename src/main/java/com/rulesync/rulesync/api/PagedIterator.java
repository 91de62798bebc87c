package com.rulesync.rulesync.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily walks a paginated listing, loading the next page only when the current one is
 * drained. Single use: once exhausted (or failed) it stays exhausted.
 */
public class PagedIterator<T> implements Iterator<T> {

    private static final Logger log = LoggerFactory.getLogger(PagedIterator.class);

    /**
     * Loads one page. The first call receives a {@code null} cursor.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        ApiResult<Page<T>> fetch(String cursor);
    }

    private final String listingName;
    private final PageFetcher<T> fetcher;

    private Iterator<T> current = Collections.emptyIterator();
    private String cursor;
    private boolean lastPageSeen;
    private int pagesFetched;

    public PagedIterator(String listingName, PageFetcher<T> fetcher) {
        this.listingName = listingName;
        this.fetcher = fetcher;
    }

    /**
     * @throws PageFetchException when the next page is needed but cannot be loaded
     */
    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (lastPageSeen) {
                return false;
            }
            loadNextPage();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items in " + listingName);
        }
        return current.next();
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    private void loadNextPage() {
        int pageNumber = pagesFetched + 1;
        log.debug("Fetching page {} of {}", pageNumber, listingName);
        ApiResult<Page<T>> result = fetcher.fetch(cursor);
        if (!result.hasBody()) {
            lastPageSeen = true;
            String reason = result.isSuccess() ? "empty response" : result.error();
            throw new PageFetchException(pageNumber,
                    "Failed to fetch page %d of %s: %s".formatted(pageNumber, listingName, reason));
        }

        Page<T> page = result.body();
        pagesFetched = pageNumber;
        current = page.items().iterator();
        if (page.hasNext()) {
            cursor = page.next();
        } else {
            lastPageSeen = true;
        }
    }
}
