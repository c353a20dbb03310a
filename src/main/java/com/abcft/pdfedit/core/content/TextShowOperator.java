package com.abcft.pdfedit.core.content;

import com.abcft.pdfedit.core.model.PDFOperator;

/**
 * The four text showing operators.
 */
public enum TextShowOperator {
    SHOW_TEXT(PDFOperator.SHOW_TEXT),
    SHOW_TEXT_ARRAY(PDFOperator.SHOW_TEXT_ADJUSTED),
    NEXT_LINE_SHOW(PDFOperator.SHOW_TEXT_LINE),
    SPACING_NEXT_LINE_SHOW(PDFOperator.SHOW_TEXT_LINE_AND_SPACE);

    private final String operator;

    TextShowOperator(String operator) {
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }

    public static TextShowOperator fromOperator(String operator) {
        for (TextShowOperator value : values()) {
            if (value.operator.equals(operator)) {
                return value;
            }
        }
        return null;
    }
}
