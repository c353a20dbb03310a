package com.abcft.pdfedit.core.validation;

/**
 * Rule categories, in the order {@link PreSaveValidator#validate(DocumentContext)} runs them.
 */
public enum ValidationCategory {
    STRUCTURE,
    FONTS,
    CONTENT,
    RESOURCES,
    ANNOTATIONS,
    METADATA,
    SECURITY,
    MODIFICATIONS
}
