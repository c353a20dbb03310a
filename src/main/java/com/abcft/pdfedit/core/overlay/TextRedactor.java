package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.content.ContentStreamParser;
import com.abcft.pdfedit.core.content.ParseResult;
import com.abcft.pdfedit.core.content.TextShowOperation;
import com.abcft.pdfedit.core.model.PDFOperator;
import com.abcft.pdfedit.core.model.Rectangle;
import com.abcft.pdfedit.core.util.FloatUtils;
import com.abcft.pdfedit.core.width.PDFontMetricsProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDStream;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes text-showing operators from a page's content stream.
 *
 * <p>An operator is removed when the origin of its text, in PDF user space, lies inside the area.
 * Line moves done by {@code '} and {@code "} are kept, and the advance of the removed text is replayed
 * as an empty {@code TJ}, so the text that follows does not shift.</p>
 */
public class TextRedactor {

    private static final Logger LOGGER = LogManager.getLogger();

    private final PDDocument document;

    public TextRedactor(PDDocument document) {
        this.document = document;
    }

    /**
     * Removes the text of a page that starts inside an area.
     *
     * @param page the page to rewrite.
     * @param pageIndex index of the page (0-based), used for font lookups and logging.
     * @param area the area in PDF user space.
     * @return number of text-showing operators removed.
     * @throws IOException if the new content stream cannot be written.
     */
    public int redact(PDPage page, int pageIndex, Rectangle2D area) throws IOException {
        PDFontMetricsProvider metrics = new PDFontMetricsProvider();
        metrics.registerPage(page, pageIndex);
        ParseResult result = new ContentStreamParser(null, metrics).parse(page, pageIndex);

        List<Object> newTokens = new ArrayList<>();
        int removed = redactTokens(result, area, newTokens);
        if (0 == removed) {
            LOGGER.debug("Page #{}: no text found in {}", pageIndex + 1, area);
            return 0;
        }

        // Ensure compress the content stream, otherwise the size of PDF might grow...
        PDStream newContents = new PDStream(document);
        try (OutputStream os = newContents.createOutputStream(COSName.FLATE_DECODE)) {
            ContentStreamWriter writer = new ContentStreamWriter(os);
            writer.writeTokens(newTokens);
        }
        page.setContents(newContents);
        LOGGER.debug("Page #{}: removed {} text operators in {}", pageIndex + 1, removed, area);
        return removed;
    }

    /**
     * Copies the parsed tokens into {@code newTokens}, leaving out the text shown inside the area.
     *
     * @return number of text-showing operators removed.
     */
    static int redactTokens(ParseResult result, Rectangle2D area, List<Object> newTokens) {
        Map<Integer, TextShowOperation> hits = new HashMap<>();
        for (TextShowOperation operation : result.getOperations()) {
            if (Rectangle.nearlyContains(area, operation.getOrigin().getX(), operation.getOrigin().getY(), 0)) {
                hits.put(operation.getTokenIndex(), operation);
            }
        }
        if (hits.isEmpty()) {
            return 0;
        }

        List<Object> tokens = result.getTokens();
        boolean[] skipped = new boolean[tokens.size()];
        for (TextShowOperation operation : hits.values()) {
            for (int i = operation.getFirstOperandIndex(); i < operation.getTokenIndex(); ++i) {
                skipped[i] = true;
            }
        }

        for (int i = 0; i < tokens.size(); ++i) {
            TextShowOperation hit = hits.get(i);
            if (hit != null) {
                String opName = ((Operator) tokens.get(i)).getName();
                if (PDFOperator.SHOW_TEXT_LINE.equals(opName)) {
                    newTokens.add(Operator.getOperator(PDFOperator.NEXT_LINE));
                } else if (PDFOperator.SHOW_TEXT_LINE_AND_SPACE.equals(opName)) {
                    // aw ac string "  ->  aw Tw ac Tc T*
                    int first = hit.getFirstOperandIndex();
                    newTokens.add(tokens.get(first));
                    newTokens.add(Operator.getOperator(PDFOperator.SET_WORD_SPACING));
                    newTokens.add(tokens.get(first + 1));
                    newTokens.add(Operator.getOperator(PDFOperator.SET_CHAR_SPACING));
                    newTokens.add(Operator.getOperator(PDFOperator.NEXT_LINE));
                }
                addAdvance(hit, newTokens);
                continue;
            }
            if (skipped[i]) {
                continue;
            }
            newTokens.add(tokens.get(i));
        }
        return hits.size();
    }

    /**
     * Moves the text matrix, and only the text matrix, past the removed text: {@code [-w] TJ}.
     */
    private static void addAdvance(TextShowOperation operation, List<Object> newTokens) {
        double advance = operation.getAdvance();
        double fontSize = operation.getState().getFontSize();
        double scale = operation.getState().getHorizontalScale() / 100.0;
        if (FloatUtils.isZero(advance)) {
            return;
        }
        if (FloatUtils.isZero(fontSize) || FloatUtils.isZero(scale)) {
            LOGGER.warn("Advance {} of \"{}\" cannot be kept with font size {} and scale {}",
                    advance, operation.getText(), fontSize, scale * 100);
            return;
        }
        COSArray move = new COSArray();
        move.add(new COSFloat((float) (-advance * 1000 / (fontSize * scale))));
        newTokens.add(move);
        newTokens.add(Operator.getOperator(PDFOperator.SHOW_TEXT_ADJUSTED));
    }
}
