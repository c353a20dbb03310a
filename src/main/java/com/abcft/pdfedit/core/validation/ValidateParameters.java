package com.abcft.pdfedit.core.validation;

import com.abcft.pdfedit.core.EditParameters;
import com.abcft.pdfedit.core.util.MapUtils;
import com.google.common.collect.Sets;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Parameters of the {@link PreSaveValidator}. The inherited page range selects the pages to check.
 */
public final class ValidateParameters extends EditParameters {

    public static final ValidateParameters DEFAULT = new Builder().build();

    public static final class Builder extends EditParameters.Builder<ValidateParameters> {

        final EnumSet<ValidationCategory> checkedCategories = EnumSet.allOf(ValidationCategory.class);
        boolean allowMissingFonts = false;
        boolean allowSubsetFonts = true;
        int maxIssues = 100;
        long timeoutMillis = 30000;

        public Builder() {
        }

        /**
         * Reads {@code validate.checkStructure}, {@code validate.checkFonts} and so on for every category,
         * plus {@code validate.allowMissingFonts}, {@code validate.allowSubsetFonts},
         * {@code validate.maxIssues} and {@code validate.timeout}.
         */
        public Builder(Map<String, String> params) {
            super(params);
            for (ValidationCategory category : ValidationCategory.values()) {
                String key = "validate.check" + StringUtils.capitalize(StringUtils.lowerCase(category.name()));
                setCheck(category, MapUtils.getBoolean(params, key, true));
            }
            this.allowMissingFonts = MapUtils.getBoolean(params, "validate.allowMissingFonts", allowMissingFonts);
            this.allowSubsetFonts = MapUtils.getBoolean(params, "validate.allowSubsetFonts", allowSubsetFonts);
            this.maxIssues = MapUtils.getInt(params, "validate.maxIssues", maxIssues);
            this.timeoutMillis = MapUtils.getInt(params, "validate.timeout", (int) timeoutMillis);
        }

        public Builder setCheck(ValidationCategory category, boolean check) {
            if (check) {
                checkedCategories.add(category);
            } else {
                checkedCategories.remove(category);
            }
            return this;
        }

        public Builder setCheckedCategories(Set<ValidationCategory> categories) {
            checkedCategories.clear();
            checkedCategories.addAll(categories);
            return this;
        }

        public Builder setAllowMissingFonts(boolean allowMissingFonts) {
            this.allowMissingFonts = allowMissingFonts;
            return this;
        }

        public Builder setAllowSubsetFonts(boolean allowSubsetFonts) {
            this.allowSubsetFonts = allowSubsetFonts;
            return this;
        }

        public Builder setMaxIssues(int maxIssues) {
            this.maxIssues = maxIssues;
            return this;
        }

        public Builder setTimeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        @Override
        public ValidateParameters build() {
            return new ValidateParameters(this);
        }
    }

    private ValidateParameters(Builder builder) {
        super(builder);
        this.checkedCategories = Sets.immutableEnumSet(builder.checkedCategories);
        this.allowMissingFonts = builder.allowMissingFonts;
        this.allowSubsetFonts = builder.allowSubsetFonts;
        this.maxIssues = builder.maxIssues;
        this.timeoutMillis = builder.timeoutMillis;
    }

    @Override
    public ValidateParameters.Builder buildUpon() {
        return buildUpon(new ValidateParameters.Builder())
                .setCheckedCategories(checkedCategories)
                .setAllowMissingFonts(allowMissingFonts)
                .setAllowSubsetFonts(allowSubsetFonts)
                .setMaxIssues(maxIssues)
                .setTimeoutMillis(timeoutMillis);
    }

    public boolean isChecked(ValidationCategory category) {
        return checkedCategories.contains(category);
    }

    public final Set<ValidationCategory> checkedCategories;
    /**
     * Report missing fonts as warnings instead of errors.
     */
    public final boolean allowMissingFonts;
    /**
     * Treat fonts with a subset tag as embedded.
     */
    public final boolean allowSubsetFonts;
    /**
     * Stop running rules once this many issues were reported.
     */
    public final int maxIssues;
    /**
     * Advisory: runs taking longer are logged and get an INFO issue, they are not interrupted.
     */
    public final long timeoutMillis;

}
