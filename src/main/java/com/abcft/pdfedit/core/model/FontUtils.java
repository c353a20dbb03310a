package com.abcft.pdfedit.core.model;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Font name helpers.
 */
public final class FontUtils {

    public static final Set<String> STANDARD_14_FONTS = ImmutableSet.of(
            "Courier", "Courier-Bold", "Courier-BoldOblique", "Courier-Oblique",
            "Helvetica", "Helvetica-Bold", "Helvetica-BoldOblique", "Helvetica-Oblique",
            "Times-Roman", "Times-Bold", "Times-BoldItalic", "Times-Italic",
            "Symbol", "ZapfDingbats");

    // ABCDEF+FontName
    private static final Pattern SUBSET_PREFIX = Pattern.compile("^[A-Z]{6}\\+.+");

    private FontUtils() {}

    /**
     * Removes a subset tag such as {@code ABCDEF+} from a font name.
     */
    public static String stripSubsetPrefix(String fontName) {
        if (StringUtils.contains(fontName, '+')) {
            return StringUtils.substringAfterLast(fontName, "+");
        }
        return fontName;
    }

    public static boolean hasSubsetPrefix(String fontName) {
        return StringUtils.contains(fontName, '+');
    }

    /**
     * Whether the name carries a well-formed subset tag (six capitals and a plus sign).
     */
    public static boolean isStrictSubsetName(String fontName) {
        return fontName != null && SUBSET_PREFIX.matcher(fontName).matches();
    }

    public static boolean isStandard14(String fontName) {
        return STANDARD_14_FONTS.contains(stripSubsetPrefix(fontName));
    }

    public static String getFontName(PDFont font) {
        if (null == font) {
            return null;
        }
        return font.getName();
    }

    /**
     * Resolves one of the standard 14 fonts, falling back to Helvetica for anything else.
     */
    public static PDType1Font standardFont(String fontName) {
        String name = stripSubsetPrefix(StringUtils.defaultString(fontName));
        switch (name) {
            case "Courier": return PDType1Font.COURIER;
            case "Courier-Bold": return PDType1Font.COURIER_BOLD;
            case "Courier-BoldOblique": return PDType1Font.COURIER_BOLD_OBLIQUE;
            case "Courier-Oblique": return PDType1Font.COURIER_OBLIQUE;
            case "Helvetica-Bold": return PDType1Font.HELVETICA_BOLD;
            case "Helvetica-BoldOblique": return PDType1Font.HELVETICA_BOLD_OBLIQUE;
            case "Helvetica-Oblique": return PDType1Font.HELVETICA_OBLIQUE;
            case "Times-Roman": return PDType1Font.TIMES_ROMAN;
            case "Times-Bold": return PDType1Font.TIMES_BOLD;
            case "Times-BoldItalic": return PDType1Font.TIMES_BOLD_ITALIC;
            case "Times-Italic": return PDType1Font.TIMES_ITALIC;
            case "Symbol": return PDType1Font.SYMBOL;
            case "ZapfDingbats": return PDType1Font.ZAPF_DINGBATS;
            default: return PDType1Font.HELVETICA;
        }
    }

}
