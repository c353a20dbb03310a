package com.abcft.pdfedit.core;

import java.io.IOException;

/**
 * Signals that a page of the document could not be read.
 */
public class MalformedDocumentException extends IOException {

    private final int pageIndex;

    public MalformedDocumentException(String message) {
        this(message, -1, null);
    }

    public MalformedDocumentException(String message, int pageIndex, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
    }

    /**
     * Index (zero-based) of the failing page, or -1 if the failure is not bound to a page.
     */
    public int getPageIndex() {
        return pageIndex;
    }

}
