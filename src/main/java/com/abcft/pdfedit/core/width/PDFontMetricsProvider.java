package com.abcft.pdfedit.core.width;

import com.abcft.pdfedit.core.model.FontUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Glyph widths read from PDFBox fonts.
 *
 * <p>Fonts are registered under both their resource name ({@code F1}) and their base name
 * ({@code ABCDEF+Arial}), so either form can be used for lookups.</p>
 */
public class PDFontMetricsProvider implements FontMetricsProvider {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Map<FontKey, PDFont> fonts = new HashMap<>();

    public PDFontMetricsProvider() {
    }

    /**
     * Registers the fonts of every page of the document.
     */
    public static PDFontMetricsProvider forDocument(PDDocument document) {
        PDFontMetricsProvider provider = new PDFontMetricsProvider();
        int pageIndex = 0;
        for (PDPage page : document.getPages()) {
            provider.registerPage(page, pageIndex++);
        }
        return provider;
    }

    public void register(String fontName, int pageIndex, PDFont font) {
        fonts.put(new FontKey(fontName, pageIndex), font);
    }

    /**
     * Registers a font for lookups on any page.
     */
    public void register(String fontName, PDFont font) {
        register(fontName, FontKey.ANY_PAGE, font);
    }

    public void registerPage(PDPage page, int pageIndex) {
        PDResources resources = page.getResources();
        if (null == resources) {
            return;
        }
        for (COSName name : resources.getFontNames()) {
            try {
                PDFont font = resources.getFont(name);
                if (null == font) {
                    continue;
                }
                register(name.getName(), pageIndex, font);
                register(FontUtils.getFontName(font), pageIndex, font);
            } catch (IOException e) {
                LOGGER.warn("Page #{}: failed to load font {}", pageIndex + 1, name.getName(), e);
            }
        }
    }

    PDFont findFont(String fontName, int pageIndex) {
        PDFont font = fonts.get(new FontKey(fontName, pageIndex));
        if (null == font) {
            font = fonts.get(new FontKey(fontName, FontKey.ANY_PAGE));
        }
        return font;
    }

    @Override
    public OptionalDouble getGlyphWidth(String fontName, int codePoint, int pageIndex) {
        if (null == fontName) {
            return OptionalDouble.empty();
        }
        PDFont font = findFont(fontName, pageIndex);
        if (null == font) {
            return OptionalDouble.empty();
        }
        String text = new String(Character.toChars(codePoint));
        try {
            return OptionalDouble.of(font.getStringWidth(text));
        } catch (IllegalArgumentException e) {
            // no glyph for this character in the font's encoding
            LOGGER.debug("Font {} cannot encode U+{}", fontName, Integer.toHexString(codePoint));
            return OptionalDouble.empty();
        } catch (IOException e) {
            LOGGER.warn("Failed to read width of U+{} from {}", Integer.toHexString(codePoint), fontName, e);
            return OptionalDouble.empty();
        }
    }

}
