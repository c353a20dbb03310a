package com.abcft.pdfedit.core.validation;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.List;

/**
 * Read access to the document being validated.
 */
public interface DocumentContext {

    int getPageCount();

    boolean isPageAccessible(int pageIndex);

    /**
     * Fonts referenced by the pages, one entry per page and font.
     */
    List<FontReference> getFonts();

    String getPageText(int pageIndex) throws IOException;

    /**
     * @param area the area in top-left page coordinates.
     */
    String getTextInArea(int pageIndex, Rectangle2D area) throws IOException;

    /**
     * Number of entries in the cross-reference table.
     */
    int getObjectCount() throws IOException;

    /**
     * Loads the object at position {@code objectIndex} of the cross-reference table.
     *
     * @throws IOException if the object cannot be read.
     */
    Object dereference(int objectIndex) throws IOException;

    boolean hasSignatures() throws IOException;

}
