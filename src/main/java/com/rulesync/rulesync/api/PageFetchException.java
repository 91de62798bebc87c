package com.rulesync.rulesync.api;

/**
 * Raised by {@link PagedIterator} when a page cannot be loaded.
 */
public class PageFetchException extends RuntimeException {

    private final int pageNumber;

    public PageFetchException(int pageNumber, String message) {
        super(message);
        this.pageNumber = pageNumber;
    }

    /**
     * 1-based number of the page that failed.
     */
    public int getPageNumber() {
        return pageNumber;
    }

    public boolean isFirstPage() {
        return pageNumber == 1;
    }
}
