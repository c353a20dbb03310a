package com.abcft.pdfedit.core.validation;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of evaluating one rule.
 */
public final class RuleOutcome {

    public enum Status {
        PASSED,
        FAILED,
        ERRORED
    }

    private final ValidationRule rule;
    private final Status status;
    private final List<ValidationIssue> issues;
    private final Throwable cause;

    private RuleOutcome(ValidationRule rule, Status status, List<ValidationIssue> issues, Throwable cause) {
        this.rule = rule;
        this.status = status;
        this.issues = ImmutableList.copyOf(issues);
        this.cause = cause;
    }

    static RuleOutcome passed(ValidationRule rule) {
        return new RuleOutcome(rule, Status.PASSED, ImmutableList.of(), null);
    }

    static RuleOutcome failed(ValidationRule rule, List<ValidationIssue> issues) {
        return new RuleOutcome(rule, Status.FAILED, issues, null);
    }

    /**
     * The check threw; reported as a single WARNING issue.
     */
    static RuleOutcome errored(ValidationRule rule, Throwable cause) {
        ValidationIssue issue = new ValidationIssue.Builder(ValidationSeverity.WARNING, rule.getCategory(),
                rule.getCode() + "_CHECK_ERROR",
                String.format("Rule %s (%s) could not run: %s", rule.getCode(), rule.getName(), cause.getMessage()))
                .addDetail("exception", cause.toString())
                .build();
        return new RuleOutcome(rule, Status.ERRORED, ImmutableList.of(issue), cause);
    }

    /**
     * Binds the issues that are not tied to a page to {@code pageIndex}.
     */
    RuleOutcome onPage(int pageIndex) {
        List<ValidationIssue> bound = new ArrayList<>(issues.size());
        for (ValidationIssue issue : issues) {
            bound.add(issue.onPage(pageIndex));
        }
        return new RuleOutcome(rule, status, bound, cause);
    }

    /**
     * Keeps the first {@code maxIssues} issues.
     */
    RuleOutcome limit(int maxIssues) {
        if (issues.size() <= maxIssues) {
            return this;
        }
        return new RuleOutcome(rule, status, issues.subList(0, Math.max(0, maxIssues)), cause);
    }

    public ValidationRule getRule() {
        return rule;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public boolean hasBlockingIssue() {
        return issues.stream().anyMatch(ValidationIssue::isBlocking);
    }

    public Throwable getCause() {
        return cause;
    }
}
