package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.FontUtils;
import com.abcft.pdfedit.core.model.Rectangle;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.List;

/**
 * Draws overlay layers on the pages of a {@link PDDocument}.
 *
 * <p>Layer coordinates have their origin at the top-left of the media box; they are flipped into
 * PDF user space before drawing. Everything is appended after the existing page content.</p>
 */
public class PdfBoxLayerRenderer implements LayerRenderer {

    private static final Logger LOGGER = LogManager.getLogger();

    private final PDDocument document;
    private final TextRedactor redactor;

    public PdfBoxLayerRenderer(PDDocument document) {
        this.document = document;
        this.redactor = new TextRedactor(document);
    }

    private PDPage getPage(OverlayLayer layer) {
        int pageIndex = layer.getPage();
        if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
            throw new IllegalArgumentException(String.format("Page #%d out of range, document has %d pages",
                    pageIndex + 1, document.getNumberOfPages()));
        }
        return document.getPage(pageIndex);
    }

    /**
     * Converts a top-left based box into PDF user space.
     */
    static Rectangle2D toPdfSpace(PDRectangle mediaBox, Rectangle2D bbox) {
        double x = mediaBox.getLowerLeftX() + bbox.getMinX();
        double y = mediaBox.getLowerLeftY() + mediaBox.getHeight() - bbox.getMaxY();
        return new Rectangle(x, y, bbox.getWidth(), bbox.getHeight());
    }

    static Point2D toPdfSpace(PDRectangle mediaBox, Point2D point) {
        return new Point2D.Double(mediaBox.getLowerLeftX() + point.getX(),
                mediaBox.getLowerLeftY() + mediaBox.getHeight() - point.getY());
    }

    private PDPageContentStream openStream(PDPage page) throws IOException {
        return new PDPageContentStream(document, page, PDPageContentStream.AppendMode.APPEND, true, true);
    }

    @Override
    public void check(OverlayLayer layer) throws IOException {
        getPage(layer);
        if (layer.getType() != OverlayType.TEXT || StringUtils.isEmpty(layer.getContent())) {
            return;
        }
        PDType1Font font = FontUtils.standardFont(layer.getFontName());
        try {
            font.encode(layer.getContent());
        } catch (IllegalArgumentException e) {
            throw new IOException(String.format("\"%s\" cannot be encoded with %s",
                    layer.getContent(), font.getName()), e);
        }
    }

    @Override
    public void renderRedaction(OverlayLayer layer, List<String> warnings) throws IOException {
        PDPage page = getPage(layer);
        Rectangle2D area = toPdfSpace(page.getMediaBox(), layer.getBBox());
        int removed = redactor.redact(page, layer.getPage(), area);
        LOGGER.debug("Page #{}: redaction {} removed {} text operators", layer.getPage() + 1, layer.getId(), removed);
        if (layer.hasFill()) {
            fill(page, area, layer.getFillColor(), 1.0f);
        }
    }

    @Override
    public void renderFill(OverlayLayer layer, List<String> warnings) throws IOException {
        if (!layer.hasFill()) {
            return;
        }
        PDPage page = getPage(layer);
        fill(page, toPdfSpace(page.getMediaBox(), layer.getBBox()), layer.getFillColor(), layer.getFillOpacity());
    }

    private void fill(PDPage page, Rectangle2D area, Color color, float opacity) throws IOException {
        try (PDPageContentStream stream = openStream(page)) {
            if (opacity < 1.0f) {
                PDExtendedGraphicsState state = new PDExtendedGraphicsState();
                state.setNonStrokingAlphaConstant(opacity);
                stream.setGraphicsStateParameters(state);
            }
            stream.setNonStrokingColor(color);
            stream.addRect((float) area.getX(), (float) area.getY(), (float) area.getWidth(), (float) area.getHeight());
            stream.fill();
        }
    }

    @Override
    public void renderText(OverlayLayer layer, List<String> warnings) throws IOException {
        if (StringUtils.isEmpty(layer.getContent())) {
            return;
        }
        PDPage page = getPage(layer);
        if (!FontUtils.isStandard14(layer.getFontName())) {
            String warning = String.format("Font %s is not available, drawn with Helvetica", layer.getFontName());
            LOGGER.warn("Page #{}: {}", layer.getPage() + 1, warning);
            warnings.add(warning);
        }
        PDType1Font font = FontUtils.standardFont(layer.getFontName());
        Point2D origin = layer.getOrigin() != null
                ? layer.getOrigin()
                : new Point2D.Double(layer.getBBox().getMinX(), layer.getBBox().getMaxY());
        Point2D start = toPdfSpace(page.getMediaBox(), origin);

        try (PDPageContentStream stream = openStream(page)) {
            stream.beginText();
            stream.setFont(font, layer.getFontSize());
            stream.setNonStrokingColor(layer.getColor());
            if (layer.getCharSpacing() != 0) {
                stream.setCharacterSpacing(layer.getCharSpacing());
            }
            if (layer.getWordSpacing() != 0) {
                stream.setWordSpacing(layer.getWordSpacing());
            }
            if (layer.getHorizontalScale() != 100) {
                stream.setHorizontalScaling(layer.getHorizontalScale());
            }
            stream.newLineAtOffset((float) start.getX(), (float) start.getY());
            stream.showText(layer.getContent());
            stream.endText();
        }
    }
}
