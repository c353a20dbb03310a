package com.abcft.pdfedit.core.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pending change to a document, checked before the document is saved.
 */
public class ModificationRecord {

    private final String type;
    private final int page;
    private final String originalContent;
    private final String newContent;
    private final long timestamp;
    private boolean validated;
    private final List<String> errors = new ArrayList<>();

    public ModificationRecord(String type, int page, String originalContent, String newContent) {
        this.type = type;
        this.page = page;
        this.originalContent = originalContent;
        this.newContent = newContent;
        this.timestamp = System.currentTimeMillis();
    }

    public String getType() {
        return type;
    }

    /**
     * Target page (0-based).
     */
    public int getPage() {
        return page;
    }

    public String getOriginalContent() {
        return originalContent;
    }

    public String getNewContent() {
        return newContent;
    }

    /**
     * Creation time in epoch millis.
     */
    public long getTimestamp() {
        return timestamp;
    }

    public boolean isValidated() {
        return validated;
    }

    void markValidated() {
        this.validated = true;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    void addError(String error) {
        errors.add(error);
    }

    @Override
    public String toString() {
        return String.format("%s@%d[%s -> %s]", type, page, originalContent, newContent);
    }
}
