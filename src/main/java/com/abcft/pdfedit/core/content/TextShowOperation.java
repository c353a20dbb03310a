package com.abcft.pdfedit.core.content;

import com.google.common.collect.ImmutableList;

import java.awt.geom.Point2D;
import java.util.List;

/**
 * One executed text showing operator together with the state it ran under.
 */
public final class TextShowOperation {

    private final TextShowOperator operator;
    private final String text;
    private final TextState state;
    private final List<GlyphAdjustment> adjustments;
    private final Point2D origin;
    private final int tokenIndex;
    private final int firstOperandIndex;
    private double advance;

    TextShowOperation(TextShowOperator operator, String text, TextState state, List<GlyphAdjustment> adjustments,
                      int tokenIndex, int firstOperandIndex) {
        this.operator = operator;
        this.text = text;
        this.state = state;
        this.adjustments = ImmutableList.copyOf(adjustments);
        this.origin = state.getTextMatrix().multiply(state.getCtm()).transformPoint(0, 0);
        this.tokenIndex = tokenIndex;
        this.firstOperandIndex = firstOperandIndex;
    }

    public TextShowOperator getOperator() {
        return operator;
    }

    public String getText() {
        return text;
    }

    /**
     * Snapshot of the text state at the moment the text was shown.
     */
    public TextState getState() {
        return state;
    }

    public String getFontName() {
        return state.getFontName();
    }

    public double getFontSize() {
        return state.getFontSize();
    }

    /**
     * TJ adjustments; empty for other operators.
     */
    public List<GlyphAdjustment> getAdjustments() {
        return adjustments;
    }

    /**
     * Start of the text in page space (PDF coordinates, y upward).
     */
    public Point2D getOrigin() {
        return origin;
    }

    /**
     * Index of the operator in the token list the stream was parsed from.
     */
    public int getTokenIndex() {
        return tokenIndex;
    }

    /**
     * Index of the first operand of the operator in the token list.
     */
    public int getFirstOperandIndex() {
        return firstOperandIndex;
    }

    /**
     * Horizontal advance in text space, or 0 if the stream was parsed without font metrics.
     */
    public double getAdvance() {
        return advance;
    }

    void setAdvance(double advance) {
        this.advance = advance;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) @ (%.2f, %.2f) [%s %.1f]", operator.getOperator(), text,
                origin.getX(), origin.getY(), getFontName(), getFontSize());
    }
}
