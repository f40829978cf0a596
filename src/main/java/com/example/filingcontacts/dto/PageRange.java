package com.example.filingcontacts.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Inclusive, 1-based page range.
 */
@Getter
@EqualsAndHashCode
public class PageRange {
    private final int startPage;
    private final int endPage;

    public PageRange(int startPage, int endPage) {
        if (startPage < 1 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid page range " + startPage + "-" + endPage);
        }
        this.startPage = startPage;
        this.endPage = endPage;
    }

    public int getPageCount() {
        return endPage - startPage + 1;
    }

    @Override
    public String toString() {
        return startPage + "-" + endPage;
    }
}
