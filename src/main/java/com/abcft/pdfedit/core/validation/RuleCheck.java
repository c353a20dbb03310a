package com.abcft.pdfedit.core.validation;

import java.io.IOException;
import java.util.List;

/**
 * The body of a {@link ValidationRule}.
 */
@FunctionalInterface
public interface RuleCheck {

    /**
     * @return the issues found, empty if the check passed.
     * @throws IOException if the document could not be read; the rule is then reported as errored.
     */
    List<ValidationIssue> check(DocumentContext context, ValidationRule rule, ValidationSession session)
            throws IOException;

}
