package com.abcft.pdfedit.core.width;

import com.abcft.pdfedit.core.util.FloatUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Keeps replacement text inside the footprint of the text it replaces.
 *
 * <p>Widths come from the {@link FontMetricsProvider} when one is set and knows the font,
 * otherwise from {@link FallbackWidthTables}. Looked-up widths are cached per font and page
 * until the provider changes or {@link #clearCache()} is called.</p>
 *
 * <p>Not thread safe.</p>
 */
public class GlyphWidthPreserver {

    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * Largest per-gap adjustment emitted in a TJ array, in 1/1000 em.
     */
    public static final double MAX_TJ_ADJUSTMENT = 200;

    private static final double MIN_TJ_ADJUSTMENT = 0.1;

    private static final double WORD_SPACING_SHARE = 0.6;

    private final FitParameters params;
    private FontMetricsProvider metricsProvider;
    private final Map<FontKey, Map<Integer, Double>> widthCache = new HashMap<>();

    public GlyphWidthPreserver() {
        this(FitParameters.DEFAULT, null);
    }

    public GlyphWidthPreserver(FitParameters params) {
        this(params, null);
    }

    public GlyphWidthPreserver(FitParameters params, FontMetricsProvider metricsProvider) {
        this.params = params != null ? params : FitParameters.DEFAULT;
        this.metricsProvider = metricsProvider;
    }

    public FitParameters getParams() {
        return params;
    }

    public FontMetricsProvider getFontMetricsProvider() {
        return metricsProvider;
    }

    /**
     * Replaces the metrics source and drops every cached width.
     */
    public void setFontMetricsProvider(FontMetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;
        clearCache();
    }

    public void clearCache() {
        widthCache.clear();
    }

    // ---- measuring ----

    /**
     * Width of a character in 1/1000 em.
     */
    public double getCharWidthFontUnits(int codePoint, String fontName, int pageIndex) {
        FontKey key = new FontKey(StringUtils.defaultString(fontName), pageIndex);
        Map<Integer, Double> widths = widthCache.computeIfAbsent(key, k -> new HashMap<>());
        Double cached = widths.get(codePoint);
        if (cached != null) {
            return cached;
        }
        double width = lookupWidth(codePoint, key.getFontName(), pageIndex);
        widths.put(codePoint, width);
        return width;
    }

    private double lookupWidth(int codePoint, String fontName, int pageIndex) {
        if (metricsProvider != null) {
            try {
                OptionalDouble width = metricsProvider.getGlyphWidth(fontName, codePoint, pageIndex);
                if (width.isPresent()) {
                    return width.getAsDouble();
                }
            } catch (RuntimeException e) {
                LOGGER.warn("Page #{}: metrics lookup failed for {}, using fallback widths",
                        pageIndex + 1, fontName, e);
            }
        }
        return FallbackWidthTables.widthOf(codePoint, fontName);
    }

    /**
     * Width of a character in points.
     */
    public double charWidth(int codePoint, String fontName, double fontSize, int pageIndex) {
        return getCharWidthFontUnits(codePoint, fontName, pageIndex) / 1000.0 * fontSize;
    }

    public TextWidthInfo measureText(String text, String fontName, double fontSize, int pageIndex) {
        String value = StringUtils.defaultString(text);
        List<GlyphWidth> glyphs = new ArrayList<>(value.length());
        value.codePoints().forEach(cp -> {
            double units = getCharWidthFontUnits(cp, fontName, pageIndex);
            glyphs.add(new GlyphWidth(cp, units, units / 1000.0 * fontSize));
        });
        return new TextWidthInfo(value, fontName, fontSize, glyphs);
    }

    public double measureWidth(String text, String fontName, double fontSize, int pageIndex) {
        return measureText(text, fontName, fontSize, pageIndex).getTotalWidthPoints();
    }

    // ---- fitting ----

    public FitAnalysis analyzeFit(String originalText, String newText, String fontName, double fontSize) {
        return analyzeFit(originalText, newText, fontName, fontSize, 0, null, null);
    }

    /**
     * Works out how {@code newText} can occupy the width of {@code originalText}.
     *
     * @param strategy the strategy, or {@code null} for the configured default.
     * @param targetWidth the width to fill in points, or {@code null} for the width of the original text.
     * @return the analysis; never {@code null}.
     */
    public FitAnalysis analyzeFit(String originalText, String newText, String fontName, double fontSize,
                                  int pageIndex, FitStrategy strategy, Double targetWidth) {
        FitStrategy effective = strategy != null ? strategy : params.defaultStrategy;
        TextWidthInfo original = measureText(originalText, fontName, fontSize, pageIndex);
        TextWidthInfo replacement = measureText(newText, fontName, fontSize, pageIndex);
        double target = targetWidth != null ? targetWidth : original.getTotalWidthPoints();

        FitAnalysis.Builder analysis = new FitAnalysis.Builder(StringUtils.defaultString(originalText),
                replacement.getText(), original.getTotalWidthPoints(), replacement.getTotalWidthPoints(),
                target, effective);

        if (FastMath.abs(analysis.widthDifference()) <= params.widthTolerance) {
            return analysis.result(FitResult.SUCCESS)
                    .finalWidth(replacement.getTotalWidthPoints())
                    .build();
        }

        switch (effective) {
            case EXACT:
                applyExactFit(analysis, replacement);
                break;
            case COMPRESS:
                if (analysis.widthDifference() > params.widthTolerance) {
                    applyExactFit(analysis, replacement);
                } else {
                    unchanged(analysis, replacement);
                }
                break;
            case EXPAND:
                if (analysis.widthDifference() < 0) {
                    applyExactFit(analysis, replacement);
                } else {
                    unchanged(analysis, replacement);
                }
                break;
            case TRUNCATE:
                applyTruncateFit(analysis, replacement, fontName, fontSize, pageIndex);
                break;
            case ELLIPSIS:
                applyEllipsisFit(analysis, replacement, fontName, fontSize, pageIndex);
                break;
            case SCALE:
                applyScaleFit(analysis);
                break;
            case ALLOW_OVERFLOW:
                analysis.result(FitResult.OVERFLOW)
                        .finalWidth(replacement.getTotalWidthPoints())
                        .overflowAmount(FastMath.max(0, analysis.widthDifference()));
                break;
            default:
                throw new IllegalArgumentException("Unknown strategy " + effective);
        }
        FitAnalysis result = analysis.build();
        LOGGER.debug("{}", result);
        return result;
    }

    private static void unchanged(FitAnalysis.Builder analysis, TextWidthInfo replacement) {
        analysis.result(FitResult.SUCCESS).finalWidth(replacement.getTotalWidthPoints());
    }

    private void applyExactFit(FitAnalysis.Builder analysis, TextWidthInfo replacement) {
        double diff = analysis.widthDifference();
        int charCount = replacement.getCharCount();
        int spaceCount = replacement.getSpaceCount();
        int nonSpaceCount = replacement.getNonSpaceCount();
        FitResult direction = diff > 0 ? FitResult.COMPRESSED : FitResult.EXPANDED;

        if (params.preferWordSpacing && spaceCount > 0) {
            double wordSpacing = -diff / spaceCount;
            if (FloatUtils.within(wordSpacing, params.minWordSpacing, params.maxWordSpacing)) {
                analysis.adjustment(SpacingAdjustment.builder(AdjustmentType.WORD_SPACING)
                                .wordSpacing(wordSpacing)
                                .totalAdjustment(-diff)
                                .build())
                        .result(direction)
                        .finalWidth(analysis.targetWidth());
                return;
            }
        }

        if (nonSpaceCount > 1) {
            double tracking = -diff / (charCount - 1);
            if (FloatUtils.within(tracking, params.minTracking, params.maxTracking)) {
                analysis.adjustment(SpacingAdjustment.builder(AdjustmentType.TRACKING)
                                .tracking(tracking)
                                .totalAdjustment(-diff)
                                .build())
                        .result(direction)
                        .finalWidth(analysis.targetWidth());
                return;
            }
        }

        if (spaceCount > 0 && nonSpaceCount > 1) {
            double wordSpacing = -diff * WORD_SPACING_SHARE / spaceCount;
            double tracking = -diff * (1 - WORD_SPACING_SHARE) / (charCount - 1);
            if (FloatUtils.within(wordSpacing, params.minWordSpacing, params.maxWordSpacing)
                    && FloatUtils.within(tracking, params.minTracking, params.maxTracking)) {
                analysis.adjustment(SpacingAdjustment.builder(AdjustmentType.COMBINED)
                                .wordSpacing(wordSpacing)
                                .tracking(tracking)
                                .totalAdjustment(-diff)
                                .build())
                        .result(direction)
                        .finalWidth(analysis.targetWidth());
                return;
            }
        }

        applyScaleFit(analysis);
    }

    private void applyScaleFit(FitAnalysis.Builder analysis) {
        double natural = analysis.naturalWidth();
        if (natural <= 0) {
            analysis.result(FitResult.FAILED);
            return;
        }
        double scale = analysis.targetWidth() / natural * 100;
        if (scale < params.minHorizontalScale || scale > params.maxHorizontalScale) {
            analysis.result(FitResult.FAILED)
                    .finalWidth(natural)
                    .overflowAmount(FastMath.max(0, analysis.widthDifference()));
            return;
        }
        analysis.adjustment(SpacingAdjustment.builder(AdjustmentType.HORIZONTAL_SCALE)
                        .horizontalScale(scale)
                        .totalAdjustment(analysis.targetWidth() - natural)
                        .build())
                .result(FitResult.SCALED)
                .finalWidth(analysis.targetWidth())
                .compressionPercent(FastMath.abs(100 - scale));
    }

    private void applyTruncateFit(FitAnalysis.Builder analysis, TextWidthInfo replacement,
                                  String fontName, double fontSize, int pageIndex) {
        if (analysis.widthDifference() <= params.widthTolerance) {
            unchanged(analysis, replacement);
            return;
        }
        String text = truncateToWidth(analysis.newText(), analysis.targetWidth(), fontName, fontSize, pageIndex);
        analysis.finalText(text)
                .finalWidth(measureWidth(text, fontName, fontSize, pageIndex))
                .result(FitResult.TRUNCATED);
    }

    private void applyEllipsisFit(FitAnalysis.Builder analysis, TextWidthInfo replacement,
                                  String fontName, double fontSize, int pageIndex) {
        if (analysis.widthDifference() <= params.widthTolerance) {
            unchanged(analysis, replacement);
            return;
        }
        String ellipsis = StringUtils.defaultString(params.ellipsis);
        double available = analysis.targetWidth() - measureWidth(ellipsis, fontName, fontSize, pageIndex);
        String finalText;
        if (available <= 0) {
            // not even the terminator fits, keep its first character
            finalText = ellipsis.isEmpty() ? "" : ellipsis.substring(0, ellipsis.offsetByCodePoints(0, 1));
        } else {
            String text = truncateToWidth(analysis.newText(), available, fontName, fontSize, pageIndex);
            finalText = StringUtils.stripEnd(text, null) + ellipsis;
        }
        analysis.finalText(finalText)
                .finalWidth(measureWidth(finalText, fontName, fontSize, pageIndex))
                .result(FitResult.TRUNCATED);
    }

    private String truncateToWidth(String text, double width, String fontName, double fontSize, int pageIndex) {
        String result = text;
        while (!result.isEmpty() && measureWidth(result, fontName, fontSize, pageIndex) > width) {
            int lastSpace = params.truncateAtWord ? result.lastIndexOf(' ') : -1;
            if (lastSpace > 0) {
                result = result.substring(0, lastSpace);
            } else {
                result = result.substring(0, result.offsetByCodePoints(result.length(), -1));
            }
        }
        return result;
    }

    // ---- TJ output ----

    /**
     * Splits {@code text} into a TJ array whose gaps absorb the difference to {@code targetWidth}.
     */
    public List<TJArrayEntry> generateTjArray(String text, String fontName, double fontSize,
                                              double targetWidth, int pageIndex) {
        if (StringUtils.isEmpty(text)) {
            return Collections.emptyList();
        }
        double diff = measureWidth(text, fontName, fontSize, pageIndex) - targetWidth;
        int[] codePoints = text.codePoints().toArray();
        if (FastMath.abs(diff) <= params.widthTolerance || codePoints.length <= 1 || fontSize <= 0) {
            return Collections.singletonList(TJArrayEntry.text(text));
        }

        double perGap = diff / (codePoints.length - 1) * (1000.0 / fontSize);
        perGap = FloatUtils.clamp(perGap, -MAX_TJ_ADJUSTMENT, MAX_TJ_ADJUSTMENT);

        List<TJArrayEntry> entries = new ArrayList<>(codePoints.length * 2);
        for (int i = 0; i < codePoints.length; ++i) {
            entries.add(TJArrayEntry.text(new String(Character.toChars(codePoints[i]))));
            if (i < codePoints.length - 1 && FastMath.abs(perGap) > MIN_TJ_ADJUSTMENT) {
                entries.add(TJArrayEntry.adjustment(perGap));
            }
        }
        return entries;
    }

    public static String tjArrayToPdf(List<TJArrayEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return "[] TJ";
        }
        return entries.stream().map(TJArrayEntry::toPdf).collect(Collectors.joining(" ", "[", "] TJ"));
    }

    // ---- checks ----

    /**
     * Tells whether {@code newText} can replace {@code originalText} without overflowing.
     */
    public FitCheck validateFit(String originalText, String newText, String fontName,
                                double fontSize, int pageIndex) {
        FitAnalysis exact = analyzeFit(originalText, newText, fontName, fontSize, pageIndex, FitStrategy.EXACT, null);
        if (exact.isSuccess()) {
            SpacingAdjustment adjustment = exact.getAdjustment();
            if (adjustment != null && adjustment.hasAdjustment()) {
                return new FitCheck(true, FitStrategy.EXACT, "Adjustment required: " + adjustment.getType());
            }
            return new FitCheck(true, FitStrategy.EXACT, "Text fits without changes");
        }
        for (FitStrategy alternative : new FitStrategy[] { FitStrategy.SCALE, FitStrategy.COMPRESS }) {
            FitAnalysis analysis = analyzeFit(originalText, newText, fontName, fontSize, pageIndex, alternative, null);
            if (analysis.isSuccess()) {
                return new FitCheck(true, alternative, "Possible with strategy " + alternative);
            }
        }
        double overflow = FastMath.max(0, exact.getWidthDifference());
        return new FitCheck(false, null, String.format(Locale.ROOT, "Text too long (overflows %.2fpt)", overflow));
    }

    /**
     * Rough number of characters that fit in {@code targetWidth}, based on the width of 'x'.
     */
    public int maxTextLength(double targetWidth, String fontName, double fontSize, int pageIndex) {
        double width = charWidth('x', fontName, fontSize, pageIndex);
        if (width <= 0) {
            return 0;
        }
        return (int) (targetWidth / width);
    }

}
