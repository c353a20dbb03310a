package com.abcft.pdfedit.core.validation;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * State shared by the rules of one validation run.
 */
public class ValidationSession {

    private final ValidateParameters params;
    private final List<ModificationRecord> modifications;
    private final int onlyPage;

    ValidationSession(ValidateParameters params, List<ModificationRecord> modifications, int onlyPage) {
        this.params = params;
        this.modifications = ImmutableList.copyOf(modifications);
        this.onlyPage = onlyPage;
    }

    public ValidateParameters getParams() {
        return params;
    }

    /**
     * Pending modifications, validated ones included.
     */
    public List<ModificationRecord> getModifications() {
        return modifications;
    }

    /**
     * Whether the run is restricted to a single page.
     */
    public boolean isPageRun() {
        return onlyPage >= 0;
    }

    public boolean includesPage(int pageIndex) {
        if (isPageRun()) {
            return pageIndex == onlyPage;
        }
        return params.containsPage(pageIndex);
    }

    /**
     * Indices (0-based) of the pages the rules should look at.
     */
    public List<Integer> pagesToCheck(DocumentContext context) {
        List<Integer> pages = new ArrayList<>();
        int count = context.getPageCount();
        for (int i = 0; i < count; ++i) {
            if (includesPage(i)) {
                pages.add(i);
            }
        }
        return pages;
    }
}
