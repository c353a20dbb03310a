package com.abcft.pdfedit.core.content;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

public class ContentStreamParserTest {

    private final ContentStreamParser parser = new ContentStreamParser();

    private ParseResult parse(String content) {
        return parser.parse(content.getBytes(StandardCharsets.US_ASCII));
    }

    private static void assertPoint(double x, double y, Point2D point) {
        assertEquals(x, point.getX(), 1e-4);
        assertEquals(y, point.getY(), 1e-4);
    }

    @Test
    public void readsSimpleText() {
        ParseResult result = parse("BT /F1 12 Tf 100 700 Td (Hello) Tj ET");
        assertEquals(1, result.getOperations().size());
        TextShowOperation op = result.getOperations().get(0);
        assertEquals(TextShowOperator.SHOW_TEXT, op.getOperator());
        assertEquals("Hello", op.getText());
        assertEquals("F1", op.getFontName());
        assertEquals(12, op.getFontSize(), 1e-9);
        assertPoint(100, 700, op.getOrigin());
        assertEquals(1, result.getBlocks().size());
        assertFalse(result.hasAnomalies());
    }

    @Test
    public void recordsTokenIndices() {
        ParseResult result = parse("BT (a) Tj ET");
        TextShowOperation op = result.getOperations().get(0);
        assertEquals(2, op.getTokenIndex());
        assertEquals(1, op.getFirstOperandIndex());
        assertEquals(4, result.getTokens().size());
        ParsedTextBlock block = result.getBlocks().get(0);
        assertEquals(0, block.getBeginTokenIndex());
        assertEquals(3, block.getEndTokenIndex());
    }

    @Test
    public void appliesCtm() {
        assertPoint(60, 70, parse("1 0 0 1 50 50 cm BT 10 20 Td (A) Tj ET").getOperations().get(0).getOrigin());
        assertPoint(20, 40, parse("2 0 0 2 0 0 cm BT 10 20 Td (A) Tj ET").getOperations().get(0).getOrigin());
    }

    @Test
    public void restoresGraphicsState() {
        ParseResult result = parse("q 1 0 0 1 50 50 cm Q BT (A) Tj ET");
        assertPoint(0, 0, result.getOperations().get(0).getOrigin());
        assertFalse(result.hasAnomalies());
    }

    @Test
    public void textStateSurvivesOutsideTextObject() {
        ParseResult result = parse("/F2 9 Tf 2 Tc 80 Tz BT (a) Tj ET");
        TextState state = result.getOperations().get(0).getState();
        assertEquals("F2", state.getFontName());
        assertEquals(2, state.getCharSpacing(), 1e-9);
        assertEquals(80, state.getHorizontalScale(), 1e-9);
        assertTrue(state.hasCharSpacing());
        assertFalse(result.hasAnomalies());
    }

    @Test
    public void moveTextIsRelativeToTextMatrix() {
        ParseResult result = parse("BT 2 0 0 2 100 100 Tm 10 0 Td (a) Tj ET");
        assertPoint(120, 100, result.getOperations().get(0).getOrigin());
    }

    @Test
    public void collectsTjArrayAdjustments() {
        ParseResult result = parse("BT /F1 10 Tf [(He) -120 (llo)] TJ ET");
        TextShowOperation op = result.getOperations().get(0);
        assertEquals(TextShowOperator.SHOW_TEXT_ARRAY, op.getOperator());
        assertEquals("Hello", op.getText());
        List<GlyphAdjustment> adjustments = op.getAdjustments();
        assertEquals(1, adjustments.size());
        assertEquals(2, adjustments.get(0).getCharIndex());
        assertEquals(1.2, adjustments.get(0).toPoints(10), 1e-6);
    }

    @Test
    public void quoteMovesToNextLine() {
        ParseResult result = parse("BT 14 TL 0 100 Td (a) Tj (b) ' ET");
        TextShowOperation op = result.getOperations().get(1);
        assertEquals(TextShowOperator.NEXT_LINE_SHOW, op.getOperator());
        assertPoint(0, 86, op.getOrigin());
    }

    @Test
    public void doubleQuoteSetsSpacing() {
        ParseResult result = parse("BT 10 TL (x) Tj 2 1 (y) \" ET");
        TextShowOperation op = result.getOperations().get(1);
        assertEquals(TextShowOperator.SPACING_NEXT_LINE_SHOW, op.getOperator());
        assertEquals(2, op.getState().getWordSpacing(), 1e-9);
        assertEquals(1, op.getState().getCharSpacing(), 1e-9);
        assertPoint(0, -10, op.getOrigin());
    }

    @Test
    public void moveTextSetLeading() {
        ParseResult result = parse("BT 5 -12 TD T* (a) Tj ET");
        TextShowOperation op = result.getOperations().get(0);
        assertEquals(12, op.getState().getLeading(), 1e-9);
        assertPoint(5, -24, op.getOrigin());
    }

    @Test
    public void detectsTextStateFlags() {
        TextState state = parse("BT 3 Tr 2 Ts (a) Tj ET").getOperations().get(0).getState();
        assertTrue(state.isInvisible());
        assertTrue(state.isSuperscript());
        assertFalse(state.isSubscript());
    }

    @Test
    public void countsUnbalancedOperators() {
        ParseResult result = parse("Q ET BT (a) Tj");
        assertEquals(3, result.getAnomalyCount());
        assertEquals("a", result.getText());
        assertEquals(-1, result.getBlocks().get(0).getEndTokenIndex());
    }

    @Test
    public void recoversTextOutsideTextObject() {
        ParseResult result = parse("10 10 Td (a) Tj");
        assertEquals("a", result.getText());
        assertTrue(result.getBlocks().get(0).isRecovered());
        // Td skipped, show outside BT, block never closed
        assertEquals(3, result.getAnomalyCount());
    }

    @Test
    public void skipsMalformedOperands() {
        ParseResult result = parse("BT /F1 Tf 1 2 Td (a) Tj (b) 5 Td ET");
        assertEquals(2, result.getAnomalyCount());
        assertEquals(1, result.getOperations().size());
        assertPoint(1, 2, result.getOperations().get(0).getOrigin());
    }

    @Test
    public void reportsUnrestoredState() {
        assertEquals(1, parse("q q Q").getAnomalyCount());
    }

    @Test
    public void nestedTextObjectClosesPrevious() {
        ParseResult result = parse("BT (a) Tj BT (b) Tj ET");
        assertEquals(2, result.getBlocks().size());
        assertEquals(1, result.getAnomalyCount());
    }

    @Test
    public void emptyContent() {
        ParseResult result = parser.parse(new byte[0]);
        assertTrue(result.getOperations().isEmpty());
        assertFalse(result.hasAnomalies());
    }

    @Test
    public void resolvesFontNames() {
        ContentStreamParser named = new ContentStreamParser(Collections.singletonMap("F1", "Helvetica"));
        ParseResult result = named.parse("BT /F1 10 Tf (a) Tj ET".getBytes(StandardCharsets.US_ASCII));
        TextState state = result.getOperations().get(0).getState();
        assertEquals("Helvetica", state.getFontName());
        assertEquals("F1", state.getFontResourceName());
    }

    @Test
    public void advancesWithMetrics() {
        ContentStreamParser measuring = new ContentStreamParser(null, (font, cp, page) -> OptionalDouble.of(500));
        ParseResult result = measuring.parse("BT /F1 10 Tf 1 Tc (ab) Tj (c) Tj ET".getBytes(StandardCharsets.US_ASCII));
        assertEquals(12, result.getOperations().get(0).getAdvance(), 1e-6);
        assertPoint(12, 0, result.getOperations().get(1).getOrigin());
    }

    @Test
    public void tjAdjustmentsReduceAdvance() {
        ContentStreamParser measuring = new ContentStreamParser(null, (font, cp, page) -> OptionalDouble.of(500));
        ParseResult result = measuring.parse("BT /F1 10 Tf [(a) 1000 (b)] TJ ET".getBytes(StandardCharsets.US_ASCII));
        assertEquals(0, result.getOperations().get(0).getAdvance(), 1e-6);
    }

    @Test
    public void staysAtOriginWithoutMetrics() {
        ParseResult result = parse("BT (ab) Tj (c) Tj ET");
        assertPoint(0, 0, result.getOperations().get(1).getOrigin());
    }

    @Test
    public void parsesPdfBoxPage() throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(PDType1Font.HELVETICA, 12);
                stream.newLineAtOffset(72, 700);
                stream.showText("Hello");
                stream.endText();
            }
            ParseResult result = parser.parse(page, 0);
            assertEquals(1, result.getOperations().size());
            TextShowOperation op = result.getOperations().get(0);
            assertEquals("Hello", op.getText());
            assertEquals("Helvetica", op.getFontName());
            assertNotNull(op.getState().getFont());
            assertPoint(72, 700, op.getOrigin());
        }
    }
}
