package com.abcft.pdfedit.core.validation;

import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A problem found by a validation rule.
 */
public final class ValidationIssue {

    public static final class Builder {

        private final ValidationSeverity severity;
        private final ValidationCategory category;
        private final String code;
        private final String message;
        private int page = -1;
        private String location;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private String suggestion;
        private String autoFixAction;

        public Builder(ValidationSeverity severity, ValidationCategory category, String code, String message) {
            this.severity = Preconditions.checkNotNull(severity, "severity");
            this.category = Preconditions.checkNotNull(category, "category");
            this.code = Preconditions.checkNotNull(code, "code");
            this.message = message;
        }

        /**
         * @param page the page index (0-based) the issue belongs to, -1 for the whole document.
         */
        public Builder setPage(int page) {
            this.page = page;
            return this;
        }

        public Builder setLocation(String location) {
            this.location = location;
            return this;
        }

        public Builder addDetail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder setSuggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder setAutoFixAction(String autoFixAction) {
            this.autoFixAction = autoFixAction;
            return this;
        }

        public ValidationIssue build() {
            return new ValidationIssue(this);
        }
    }

    private final ValidationSeverity severity;
    private final ValidationCategory category;
    private final String code;
    private final String message;
    private final int page;
    private final String location;
    private final Map<String, Object> details;
    private final String suggestion;
    private final boolean canAutoFix;
    private final String autoFixAction;

    private ValidationIssue(Builder builder) {
        this.severity = builder.severity;
        this.category = builder.category;
        this.code = builder.code;
        this.message = builder.message;
        this.page = builder.page;
        this.location = builder.location;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
        this.suggestion = builder.suggestion;
        this.autoFixAction = builder.autoFixAction;
        this.canAutoFix = builder.autoFixAction != null;
    }

    public ValidationSeverity getSeverity() {
        return severity;
    }

    public ValidationCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Page index (0-based), -1 if the issue is not bound to a page.
     */
    public int getPage() {
        return page;
    }

    public String getLocation() {
        return location;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public boolean canAutoFix() {
        return canAutoFix;
    }

    public String getAutoFixAction() {
        return autoFixAction;
    }

    public boolean isBlocking() {
        return severity.isBlocking();
    }

    /**
     * Returns this issue bound to {@code page}, unless it is already bound to one.
     */
    ValidationIssue onPage(int page) {
        if (this.page >= 0) {
            return this;
        }
        Builder builder = new Builder(severity, category, code, message)
                .setPage(page)
                .setLocation(location)
                .setSuggestion(suggestion)
                .setAutoFixAction(autoFixAction);
        builder.details.putAll(details);
        return builder.build();
    }

    @Override
    public String toString() {
        String where = page >= 0 ? String.format(" (page #%d)", page + 1) : "";
        return String.format("[%s] %s: %s%s", severity, code, message, where);
    }
}
