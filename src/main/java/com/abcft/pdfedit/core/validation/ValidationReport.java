package com.abcft.pdfedit.core.validation;

import com.abcft.pdfedit.core.gson.GsonUtil;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Issues collected by one validation run, and the verdict derived from them.
 */
public class ValidationReport {

    private final List<ValidationIssue> issues = new ArrayList<>();
    private ValidationResult result = ValidationResult.UNKNOWN;
    private int rulesRun;
    private int rulesPassed;
    private int rulesFailed;
    private int pagesChecked;
    private int fontsChecked;
    private int objectsChecked;
    private long elapsedMillis;

    public void addIssue(ValidationIssue issue) {
        issues.add(issue);
        if (result != ValidationResult.UNKNOWN) {
            result = computeResult();
        }
    }

    void record(RuleOutcome outcome) {
        ++rulesRun;
        if (outcome.isPassed()) {
            ++rulesPassed;
        } else {
            ++rulesFailed;
        }
        for (ValidationIssue issue : outcome.getIssues()) {
            addIssue(issue);
        }
    }

    void setStatistics(int pagesChecked, int fontsChecked, int objectsChecked) {
        this.pagesChecked = pagesChecked;
        this.fontsChecked = fontsChecked;
        this.objectsChecked = objectsChecked;
    }

    void complete(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
        this.result = computeResult();
    }

    private ValidationResult computeResult() {
        if (issues.isEmpty()) {
            return ValidationResult.VALID;
        }
        if (issues.stream().anyMatch(ValidationIssue::isBlocking)) {
            return ValidationResult.INVALID;
        }
        return ValidationResult.VALID_WITH_WARNINGS;
    }

    public ValidationResult getResult() {
        return result;
    }

    /**
     * Whether the document may be saved.
     */
    public boolean isValid() {
        return result.isValid();
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public int getIssueCount() {
        return issues.size();
    }

    public List<ValidationIssue> getBlockingIssues() {
        return filter(ValidationIssue::isBlocking);
    }

    public List<ValidationIssue> getWarnings() {
        return filter(issue -> issue.getSeverity() == ValidationSeverity.WARNING);
    }

    /**
     * ERROR and CRITICAL issues.
     */
    public List<ValidationIssue> getErrors() {
        return filter(issue -> issue.getSeverity().isBlocking());
    }

    public List<ValidationIssue> getFixableIssues() {
        return filter(ValidationIssue::canAutoFix);
    }

    public List<ValidationIssue> getIssuesByCategory(ValidationCategory category) {
        return filter(issue -> issue.getCategory() == category);
    }

    public List<ValidationIssue> getIssuesByPage(int page) {
        return filter(issue -> issue.getPage() == page);
    }

    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    private List<ValidationIssue> filter(Predicate<ValidationIssue> predicate) {
        return issues.stream().filter(predicate).collect(Collectors.toList());
    }

    public int getRulesRun() {
        return rulesRun;
    }

    public int getRulesPassed() {
        return rulesPassed;
    }

    public int getRulesFailed() {
        return rulesFailed;
    }

    public int getPagesChecked() {
        return pagesChecked;
    }

    public int getFontsChecked() {
        return fontsChecked;
    }

    public int getObjectsChecked() {
        return objectsChecked;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public String summary() {
        return String.join("\n",
                "Result: " + result,
                "Total issues: " + issues.size(),
                "  - Errors: " + getErrors().size(),
                "  - Warnings: " + getWarnings().size(),
                String.format("Rules: %d run, %d passed, %d failed", rulesRun, rulesPassed, rulesFailed),
                "Pages checked: " + pagesChecked,
                "Time: " + elapsedMillis + "ms");
    }

    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("result", result.name());
        json.addProperty("valid", isValid());
        json.addProperty("totalIssues", issues.size());
        json.addProperty("blockingIssues", getBlockingIssues().size());
        json.addProperty("errors", getErrors().size());
        json.addProperty("warnings", getWarnings().size());
        json.add("issues", GsonUtil.DEFAULT.toJsonTree(issues));
        json.addProperty("rulesRun", rulesRun);
        json.addProperty("rulesPassed", rulesPassed);
        json.addProperty("rulesFailed", rulesFailed);
        json.addProperty("pagesChecked", pagesChecked);
        json.addProperty("fontsChecked", fontsChecked);
        json.addProperty("objectsChecked", objectsChecked);
        json.addProperty("elapsedMillis", elapsedMillis);
        return GsonUtil.DEFAULT.toJson(json);
    }

    @Override
    public String toString() {
        return String.format("ValidationReport[%s, %d issues]", result, issues.size());
    }
}
