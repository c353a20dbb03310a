package com.abcft.pdfedit.core.validation;

import com.abcft.pdfedit.core.MalformedDocumentException;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory document for rule tests.
 */
class FakeDocumentContext implements DocumentContext {

    int pageCount;
    final List<FontReference> fonts = new ArrayList<>();
    final Map<Integer, String> texts = new HashMap<>();
    final Set<Integer> unreadablePages = new HashSet<>();
    final Set<Integer> inaccessiblePages = new HashSet<>();
    int objectCount = 20;
    boolean brokenObjects;
    boolean brokenXref;

    FakeDocumentContext(int pageCount) {
        this.pageCount = pageCount;
    }

    FakeDocumentContext font(String name, int page, boolean embedded) {
        fonts.add(new FontReference(name, page, embedded, false));
        return this;
    }

    @Override
    public int getPageCount() {
        return pageCount;
    }

    @Override
    public boolean isPageAccessible(int pageIndex) {
        return !inaccessiblePages.contains(pageIndex);
    }

    @Override
    public List<FontReference> getFonts() {
        return fonts;
    }

    @Override
    public String getPageText(int pageIndex) throws IOException {
        if (unreadablePages.contains(pageIndex)) {
            throw new MalformedDocumentException("bad stream", pageIndex, null);
        }
        return texts.getOrDefault(pageIndex, "");
    }

    @Override
    public String getTextInArea(int pageIndex, Rectangle2D area) throws IOException {
        return getPageText(pageIndex);
    }

    @Override
    public int getObjectCount() throws IOException {
        if (brokenXref) {
            throw new IOException("no trailer");
        }
        return objectCount;
    }

    @Override
    public Object dereference(int objectIndex) throws IOException {
        if (brokenObjects) {
            throw new IOException("object " + objectIndex + " missing");
        }
        return objectIndex;
    }

    @Override
    public boolean hasSignatures() {
        return false;
    }
}
