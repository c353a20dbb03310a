package com.abcft.pdfedit.core.validation;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;

/**
 * A named check with a default severity.
 */
public class ValidationRule {

    private static final Logger LOGGER = LogManager.getLogger();

    private final String code;
    private final String name;
    private final String description;
    private final ValidationCategory category;
    private final ValidationSeverity severity;
    private final RuleCheck check;
    private boolean enabled = true;

    public ValidationRule(String code, String name, String description, ValidationCategory category,
                          ValidationSeverity severity, RuleCheck check) {
        this.code = Preconditions.checkNotNull(code, "code");
        this.name = name;
        this.description = description;
        this.category = Preconditions.checkNotNull(category, "category");
        this.severity = Preconditions.checkNotNull(severity, "severity");
        this.check = Preconditions.checkNotNull(check, "check");
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ValidationCategory getCategory() {
        return category;
    }

    public ValidationSeverity getSeverity() {
        return severity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Starts an issue with this rule's severity, category and code.
     */
    public ValidationIssue.Builder issue(String message) {
        return new ValidationIssue.Builder(severity, category, code, message);
    }

    /**
     * Runs the check. A check that throws never escapes: it is reported as {@link RuleOutcome.Status#ERRORED}.
     */
    public RuleOutcome evaluate(DocumentContext context, ValidationSession session) {
        try {
            List<ValidationIssue> issues = check.check(context, this, session);
            if (null == issues || issues.isEmpty()) {
                return RuleOutcome.passed(this);
            }
            return RuleOutcome.failed(this, issues);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Rule {} failed to run", code, e);
            return RuleOutcome.errored(this, e);
        }
    }

    @Override
    public String toString() {
        return String.format("%s[%s, %s, %s%s]", code, name, category, severity, enabled ? "" : ", disabled");
    }
}
