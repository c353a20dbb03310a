package com.abcft.pdfedit.core.width;

/**
 * Answer of {@link GlyphWidthPreserver#validateFit}.
 */
public final class FitCheck {

    private final boolean fits;
    private final FitStrategy strategy;
    private final String message;

    FitCheck(boolean fits, FitStrategy strategy, String message) {
        this.fits = fits;
        this.strategy = strategy;
        this.message = message;
    }

    public boolean fits() {
        return fits;
    }

    /**
     * @return the strategy that made the text fit, or {@code null} if none did.
     */
    public FitStrategy getStrategy() {
        return strategy;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return (fits ? "fits: " : "does not fit: ") + message;
    }
}
