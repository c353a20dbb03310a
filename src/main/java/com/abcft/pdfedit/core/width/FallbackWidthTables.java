package com.abcft.pdfedit.core.width;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Approximate advance widths (1/1000 em) for the three standard families.
 *
 * <p>These are rough values used only when no {@link FontMetricsProvider} knows the font.
 * They are not metrics of any actual font program and must not be treated as such.</p>
 */
public final class FallbackWidthTables {

    public enum Family {
        HELVETICA(556, ImmutableMap.<Character, Integer>builder()
                .put(' ', 278).put('i', 278).put('l', 222).put('I', 278).put('!', 278)
                .put('m', 889).put('w', 778).put('M', 833).put('W', 1000)
                .build()),
        TIMES(500, ImmutableMap.<Character, Integer>builder()
                .put(' ', 250).put('i', 278).put('l', 278).put('I', 333)
                .put('m', 778).put('w', 722).put('M', 889).put('W', 1000)
                .build()),
        COURIER(600, ImmutableMap.of());

        private final int defaultWidth;
        private final Map<Character, Integer> widths;

        Family(int defaultWidth, Map<Character, Integer> widths) {
            this.defaultWidth = defaultWidth;
            this.widths = widths;
        }

        public int widthOf(char ch) {
            return widths.getOrDefault(ch, defaultWidth);
        }

        public int getDefaultWidth() {
            return defaultWidth;
        }
    }

    private FallbackWidthTables() {}

    public static Family familyOf(String fontName) {
        String name = StringUtils.lowerCase(StringUtils.defaultString(fontName));
        if (name.contains("courier") || name.contains("mono")) {
            return Family.COURIER;
        }
        if (name.contains("times") || name.contains("serif")) {
            return Family.TIMES;
        }
        return Family.HELVETICA;
    }

    /**
     * Approximate width in 1/1000 em.
     */
    public static int widthOf(int codePoint, String fontName) {
        Family family = familyOf(fontName);
        if (Character.isBmpCodePoint(codePoint)) {
            return family.widthOf((char) codePoint);
        }
        return family.getDefaultWidth();
    }

}
