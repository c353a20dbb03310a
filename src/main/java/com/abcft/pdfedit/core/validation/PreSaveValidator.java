package com.abcft.pdfedit.core.validation;

import com.abcft.pdfedit.core.model.FontUtils;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks a document and its pending modifications before it is saved.
 *
 * <p>Rules run category by category. A rule that throws is reported as a warning and never stops
 * the run. Not thread safe.</p>
 */
public class PreSaveValidator {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final String MAX_ISSUES_REACHED = "MAX_ISSUES_REACHED";
    public static final String VALIDATION_TIMEOUT = "VALIDATION_TIMEOUT";
    public static final String PAGE_VALIDATION_ERROR = "PAGE_VALIDATION_ERROR";

    static final int XREF_SAMPLE_SIZE = 10;
    static final int MAX_LISTED_FONTS = 5;
    static final int MAX_MODIFICATION_LENGTH = 100000;
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private static final Set<ValidationCategory> PAGE_CATEGORIES = Sets.immutableEnumSet(
            ValidationCategory.CONTENT, ValidationCategory.FONTS,
            ValidationCategory.RESOURCES, ValidationCategory.ANNOTATIONS);

    private final ValidateParameters params;
    private final Random random;
    private final List<ValidationRule> rules = new ArrayList<>();
    private final List<ValidationRule> customChecks = new ArrayList<>();
    private final List<ModificationRecord> modifications = new ArrayList<>();

    public PreSaveValidator() {
        this(ValidateParameters.DEFAULT);
    }

    public PreSaveValidator(ValidateParameters params) {
        this(params, new Random());
    }

    /**
     * @param random source of the object sample of the cross-reference check.
     */
    public PreSaveValidator(ValidateParameters params, Random random) {
        this.params = Preconditions.checkNotNull(params, "params");
        this.random = Preconditions.checkNotNull(random, "random");
        registerDefaultRules();
    }

    public ValidateParameters getParams() {
        return params;
    }

    private void registerDefaultRules() {
        rules.add(new ValidationRule("STRUCT_001", "valid_page_tree", "The page tree must be readable",
                ValidationCategory.STRUCTURE, ValidationSeverity.CRITICAL, this::checkPageTree));
        rules.add(new ValidationRule("STRUCT_002", "valid_xref", "The cross-reference table must be consistent",
                ValidationCategory.STRUCTURE, ValidationSeverity.ERROR, this::checkXrefTable));
        rules.add(new ValidationRule("STRUCT_003", "no_circular_refs", "Objects must not reference themselves",
                ValidationCategory.STRUCTURE, ValidationSeverity.ERROR, PreSaveValidator::passThrough));

        rules.add(new ValidationRule("FONT_001", "fonts_available", "Referenced fonts must be available",
                ValidationCategory.FONTS, ValidationSeverity.ERROR, this::checkFontsAvailable));
        rules.add(new ValidationRule("FONT_002", "font_encoding", "Font encodings must be valid",
                ValidationCategory.FONTS, ValidationSeverity.WARNING, PreSaveValidator::passThrough));
        rules.add(new ValidationRule("FONT_003", "subset_complete", "Font subsets must hold every glyph used",
                ValidationCategory.FONTS, ValidationSeverity.WARNING, PreSaveValidator::passThrough));

        rules.add(new ValidationRule("CONTENT_001", "valid_content_streams", "Content streams must be readable",
                ValidationCategory.CONTENT, ValidationSeverity.ERROR, this::checkContentStreams));
        rules.add(new ValidationRule("CONTENT_002", "text_encoding", "Text must not hold control characters",
                ValidationCategory.CONTENT, ValidationSeverity.WARNING, this::checkTextEncoding));
        rules.add(new ValidationRule("CONTENT_003", "no_empty_text", "Text operators should not be empty",
                ValidationCategory.CONTENT, ValidationSeverity.INFO, PreSaveValidator::passThrough));

        rules.add(new ValidationRule("MOD_001", "modifications_valid", "Pending modifications must be valid",
                ValidationCategory.MODIFICATIONS, ValidationSeverity.ERROR, this::checkModifications));
        rules.add(new ValidationRule("MOD_002", "overlays_consistent", "Overlays must be consistent",
                ValidationCategory.MODIFICATIONS, ValidationSeverity.WARNING, PreSaveValidator::passThrough));
    }

    // ---- validation ----

    public ValidationReport validate(DocumentContext context) {
        Preconditions.checkNotNull(context, "context");
        Stopwatch stopwatch = Stopwatch.createStarted();
        ValidationReport report = new ValidationReport();
        ValidationSession session = newSession(-1);

        boolean underLimit = true;
        for (ValidationCategory category : ValidationCategory.values()) {
            if (params.isChecked(category)) {
                underLimit = validateCategory(category, context, session, report);
                if (!underLimit) {
                    break;
                }
            }
        }
        for (ValidationRule check : customChecks) {
            if (!underLimit) {
                break;
            }
            if (check.isEnabled()) {
                underLimit = record(report, check.evaluate(context, session), check.getCategory(), -1);
            }
        }

        report.setStatistics(session.pagesToCheck(context).size(), context.getFonts().size(), countObjects(context));
        finish(report, stopwatch);
        LOGGER.debug("{}", report);
        return report;
    }

    /**
     * @return {@code false} once the issue limit is reached.
     */
    private boolean validateCategory(ValidationCategory category, DocumentContext context,
                                     ValidationSession session, ValidationReport report) {
        for (ValidationRule rule : rules) {
            if (rule.getCategory() != category || !rule.isEnabled()) {
                continue;
            }
            if (report.getIssueCount() >= params.maxIssues) {
                addLimitIssue(report, category, -1);
                return false;
            }
            if (!record(report, rule.evaluate(context, session), category, -1)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Records an outcome, dropping the issues over the limit.
     *
     * @return {@code false} if issues were dropped.
     */
    private boolean record(ValidationReport report, RuleOutcome outcome, ValidationCategory category, int pageIndex) {
        int remaining = params.maxIssues - report.getIssueCount();
        if (outcome.getIssues().size() <= remaining) {
            report.record(outcome);
            return true;
        }
        report.record(outcome.limit(remaining));
        addLimitIssue(report, category, pageIndex);
        return false;
    }

    private void addLimitIssue(ValidationReport report, ValidationCategory category, int pageIndex) {
        LOGGER.warn("Issue limit {} reached in {}, remaining rules skipped", params.maxIssues, category);
        ValidationIssue.Builder builder = new ValidationIssue.Builder(ValidationSeverity.WARNING,
                ValidationCategory.STRUCTURE, MAX_ISSUES_REACHED,
                String.format("Issue limit of %d reached", params.maxIssues))
                .addDetail("category", category.name());
        if (pageIndex >= 0) {
            builder.setPage(pageIndex);
        }
        report.addIssue(builder.build());
    }

    /**
     * Runs the page related rules (content, fonts, resources, annotations) for one page.
     */
    public ValidationReport validatePage(DocumentContext context, int pageIndex) {
        Preconditions.checkNotNull(context, "context");
        Stopwatch stopwatch = Stopwatch.createStarted();
        ValidationReport report = new ValidationReport();
        if (pageIndex < 0 || pageIndex >= context.getPageCount() || !context.isPageAccessible(pageIndex)) {
            LOGGER.warn("Page #{}: cannot be validated", pageIndex + 1);
            report.addIssue(new ValidationIssue.Builder(ValidationSeverity.ERROR, ValidationCategory.STRUCTURE,
                    PAGE_VALIDATION_ERROR, String.format("Page #%d cannot be read", pageIndex + 1))
                    .setPage(pageIndex)
                    .build());
            finish(report, stopwatch);
            return report;
        }

        ValidationSession session = newSession(pageIndex);
        for (ValidationRule rule : rules) {
            if (!rule.isEnabled() || !PAGE_CATEGORIES.contains(rule.getCategory())) {
                continue;
            }
            if (report.getIssueCount() >= params.maxIssues) {
                addLimitIssue(report, rule.getCategory(), pageIndex);
                break;
            }
            if (!record(report, rule.evaluate(context, session).onPage(pageIndex), rule.getCategory(), pageIndex)) {
                break;
            }
        }
        report.setStatistics(1, (int) context.getFonts().stream()
                .filter(font -> font.getPageIndex() == pageIndex).count(), 0);
        finish(report, stopwatch);
        return report;
    }

    /**
     * Runs only the CRITICAL rules.
     *
     * @return {@code true} if none of them reported a blocking issue.
     */
    public boolean quickValidate(DocumentContext context) {
        Preconditions.checkNotNull(context, "context");
        ValidationSession session = newSession(-1);
        for (ValidationRule rule : rules) {
            if (rule.isEnabled() && rule.getSeverity() == ValidationSeverity.CRITICAL
                    && rule.evaluate(context, session).hasBlockingIssue()) {
                return false;
            }
        }
        return true;
    }

    private ValidationSession newSession(int onlyPage) {
        return new ValidationSession(params, modifications, onlyPage);
    }

    private void finish(ValidationReport report, Stopwatch stopwatch) {
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        if (elapsed > params.timeoutMillis) {
            LOGGER.warn("Validation took {}ms, over the {}ms limit", elapsed, params.timeoutMillis);
            report.addIssue(new ValidationIssue.Builder(ValidationSeverity.INFO, ValidationCategory.STRUCTURE,
                    VALIDATION_TIMEOUT, String.format("Validation took %dms (limit %dms)", elapsed, params.timeoutMillis))
                    .build());
        }
        report.complete(elapsed);
    }

    private static int countObjects(DocumentContext context) {
        try {
            return context.getObjectCount();
        } catch (IOException e) {
            LOGGER.debug("Object count not available", e);
            return 0;
        }
    }

    // ---- rule management ----

    public void addRule(ValidationRule rule) {
        Preconditions.checkNotNull(rule, "rule");
        rules.add(rule);
    }

    public boolean removeRule(String code) {
        return rules.removeIf(rule -> rule.getCode().equals(code));
    }

    public boolean enableRule(String code) {
        return findRule(code).map(rule -> {
            rule.setEnabled(true);
            return true;
        }).orElse(false);
    }

    public boolean disableRule(String code) {
        return findRule(code).map(rule -> {
            rule.setEnabled(false);
            return true;
        }).orElse(false);
    }

    public Optional<ValidationRule> findRule(String code) {
        return rules.stream().filter(rule -> rule.getCode().equals(code)).findFirst();
    }

    public List<ValidationRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Adds a check run after the built-in rules, whatever the category flags say.
     */
    public void addCustomCheck(ValidationRule check) {
        Preconditions.checkNotNull(check, "check");
        customChecks.add(check);
    }

    public List<ValidationRule> getCustomChecks() {
        return Collections.unmodifiableList(customChecks);
    }

    // ---- modifications ----

    public void addModification(ModificationRecord modification) {
        Preconditions.checkNotNull(modification, "modification");
        modifications.add(modification);
    }

    public List<ModificationRecord> getModifications() {
        return Collections.unmodifiableList(modifications);
    }

    public void clearModifications() {
        modifications.clear();
    }

    // ---- built-in checks ----

    static List<ValidationIssue> passThrough(DocumentContext context, ValidationRule rule, ValidationSession session) {
        return Collections.emptyList();
    }

    List<ValidationIssue> checkPageTree(DocumentContext context, ValidationRule rule, ValidationSession session) {
        int pageCount = context.getPageCount();
        if (pageCount <= 0) {
            return ImmutableList.of(rule.issue("Document has no pages (empty page tree)")
                    .setSuggestion("The document is empty or corrupted")
                    .build());
        }
        for (int i = 0; i < pageCount; ++i) {
            if (!context.isPageAccessible(i)) {
                return ImmutableList.of(rule.issue(String.format("Page #%d is not accessible", i + 1))
                        .setPage(i)
                        .build());
            }
        }
        return Collections.emptyList();
    }

    List<ValidationIssue> checkXrefTable(DocumentContext context, ValidationRule rule, ValidationSession session) {
        int objectCount;
        try {
            objectCount = context.getObjectCount();
        } catch (IOException e) {
            LOGGER.warn("Cross-reference table could not be read", e);
            return ImmutableList.of(new ValidationIssue.Builder(ValidationSeverity.WARNING, rule.getCategory(),
                    rule.getCode(), "Cross-reference table could not be checked: " + e.getMessage())
                    .build());
        }
        if (objectCount <= 0) {
            return ImmutableList.of(rule.issue("Cross-reference table is empty or invalid").build());
        }
        int samples = Math.min(XREF_SAMPLE_SIZE, objectCount);
        for (int i = 0; i < samples; ++i) {
            int objectIndex = random.nextInt(objectCount);
            try {
                context.dereference(objectIndex);
            } catch (IOException e) {
                LOGGER.debug("Object {} cannot be read", objectIndex, e);
                return ImmutableList.of(rule.issue(String.format("Object %d cannot be read", objectIndex))
                        .addDetail("objectIndex", objectIndex)
                        .addDetail("error", e.getMessage())
                        .build());
            }
        }
        return Collections.emptyList();
    }

    List<ValidationIssue> checkFontsAvailable(DocumentContext context, ValidationRule rule, ValidationSession session) {
        Set<String> missing = new LinkedHashSet<>();
        for (FontReference font : context.getFonts()) {
            if (session.includesPage(font.getPageIndex()) && !isFontAvailable(font)) {
                missing.add(font.getName());
            }
        }
        if (missing.isEmpty()) {
            return Collections.emptyList();
        }
        String listed = missing.stream().limit(MAX_LISTED_FONTS).collect(Collectors.joining(", "));
        ValidationIssue.Builder issue;
        if (params.allowMissingFonts) {
            issue = new ValidationIssue.Builder(ValidationSeverity.WARNING, rule.getCategory(), rule.getCode(),
                    "Fonts not available: " + listed);
        } else {
            issue = rule.issue("Required fonts not available: " + listed)
                    .setSuggestion("Embed the fonts or use standard fonts");
        }
        return ImmutableList.of(issue.addDetail("missingFonts", new ArrayList<>(missing)).build());
    }

    boolean isFontAvailable(FontReference font) {
        String name = font.getName();
        return FontUtils.isStandard14(name)
                || (params.allowSubsetFonts && FontUtils.hasSubsetPrefix(name))
                || font.isEmbedded();
    }

    List<ValidationIssue> checkContentStreams(DocumentContext context, ValidationRule rule, ValidationSession session) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (int page : session.pagesToCheck(context)) {
            try {
                context.getPageText(page);
            } catch (IOException e) {
                LOGGER.warn("Page #{}: content stream cannot be read", page + 1, e);
                issues.add(rule.issue(String.format("Content stream of page #%d cannot be read", page + 1))
                        .setPage(page)
                        .addDetail("error", e.getMessage())
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkTextEncoding(DocumentContext context, ValidationRule rule, ValidationSession session) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (int page : session.pagesToCheck(context)) {
            String text;
            try {
                text = context.getPageText(page);
            } catch (IOException e) {
                // reported by the content stream check
                LOGGER.debug("Page #{}: no text to check", page + 1, e);
                continue;
            }
            if (text != null && CONTROL_CHARS.matcher(text).find()) {
                issues.add(rule.issue(String.format("Invalid control characters on page #%d", page + 1))
                        .setPage(page)
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkModifications(DocumentContext context, ValidationRule rule, ValidationSession session) {
        List<Map<String, Object>> invalid = new ArrayList<>();
        for (ModificationRecord modification : session.getModifications()) {
            if (modification.isValidated()) {
                continue;
            }
            List<String> errors = validateModification(modification, context.getPageCount());
            if (errors.isEmpty()) {
                modification.markValidated();
            } else {
                errors.forEach(modification::addError);
                invalid.add(ImmutableMap.<String, Object>of(
                        "type", String.valueOf(modification.getType()),
                        "page", modification.getPage(),
                        "errors", errors));
            }
        }
        if (invalid.isEmpty()) {
            return Collections.emptyList();
        }
        return ImmutableList.of(rule.issue(String.format("%d invalid modifications", invalid.size()))
                .addDetail("invalidCount", invalid.size())
                .addDetail("modifications", invalid)
                .build());
    }

    static List<String> validateModification(ModificationRecord modification, int pageCount) {
        List<String> errors = new ArrayList<>();
        if (modification.getPage() < 0 || modification.getPage() >= pageCount) {
            errors.add(String.format("Page #%d does not exist", modification.getPage() + 1));
        }
        String content = modification.getNewContent();
        if (content != null) {
            if (content.length() > MAX_MODIFICATION_LENGTH) {
                errors.add(String.format("New content too large (%d characters)", content.length()));
            }
            CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder();
            if (!encoder.canEncode(content)) {
                errors.add("New content is not valid Unicode");
            }
        }
        return errors;
    }

    @Override
    public String toString() {
        return String.format("PreSaveValidator[%d rules, %d custom checks, %d modifications, categories=%s]",
                rules.size(), customChecks.size(), modifications.size(), params.checkedCategories);
    }
}
