package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.content.ContentStreamParser;
import com.abcft.pdfedit.core.content.ParseResult;
import com.abcft.pdfedit.core.content.TextShowOperation;
import com.abcft.pdfedit.core.model.Rectangle;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TextRedactorTest {

    private static List<String> redact(String content, Rectangle area, int expectedRemoved) {
        ParseResult result = new ContentStreamParser().parse(content.getBytes(StandardCharsets.US_ASCII));
        List<Object> tokens = new ArrayList<>();
        assertEquals(expectedRemoved, TextRedactor.redactTokens(result, area, tokens));
        return tokens.stream()
                .filter(token -> token instanceof Operator)
                .map(token -> ((Operator) token).getName())
                .collect(Collectors.toList());
    }

    @Test
    public void removesTextInsideArea() {
        List<String> ops = redact("BT 100 100 Td [(a) -50 (b)] TJ ET", new Rectangle(90, 90, 20, 20), 1);
        assertEquals(Arrays.asList("BT", "Td", "ET"), ops);
    }

    @Test
    public void keepsTextOutsideArea() {
        List<String> ops = redact("BT 100 100 Td (a) Tj ET", new Rectangle(0, 0, 20, 20), 0);
        assertTrue(ops.isEmpty());
    }

    @Test
    public void quoteKeepsLineMove() {
        List<String> ops = redact("BT 14 TL 0 100 Td (a) Tj (b) ' ET", new Rectangle(-1, 80, 10, 10), 1);
        assertEquals(Arrays.asList("BT", "TL", "Td", "Tj", "T*", "ET"), ops);
    }

    @Test
    public void doubleQuoteKeepsSpacingAndLineMove() {
        ParseResult result = new ContentStreamParser()
                .parse("BT 10 TL (x) Tj 2 1 (y) \" ET".getBytes(StandardCharsets.US_ASCII));
        List<Object> tokens = new ArrayList<>();
        assertEquals(1, TextRedactor.redactTokens(result, new Rectangle(-1, -15, 5, 10), tokens));
        List<String> ops = tokens.stream()
                .filter(token -> token instanceof Operator)
                .map(token -> ((Operator) token).getName())
                .collect(Collectors.toList());
        assertEquals(Arrays.asList("BT", "TL", "Tj", "Tw", "Tc", "T*", "ET"), ops);
        // BT 10 TL (x) Tj 2 Tw 1 Tc T* ET
        assertEquals(11, tokens.size());
    }

    // every glyph 500/1000 em wide
    private static final ContentStreamParser MEASURING =
            new ContentStreamParser(null, (font, cp, page) -> OptionalDouble.of(500));

    private static List<TextShowOperation> redactAndReparse(String content, Rectangle area) throws IOException {
        ParseResult result = MEASURING.parse(content.getBytes(StandardCharsets.US_ASCII));
        List<Object> tokens = new ArrayList<>();
        assertEquals(1, TextRedactor.redactTokens(result, area, tokens));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ContentStreamWriter(out).writeTokens(tokens);
        return MEASURING.parse(out.toByteArray()).getOperations();
    }

    @Test
    public void followingTextKeepsItsPosition() throws IOException {
        List<TextShowOperation> ops = redactAndReparse("BT /F1 10 Tf 72 700 Td (Hello ) Tj (World) Tj ET",
                new Rectangle(70, 695, 10, 10));
        assertEquals(1, ops.size());
        assertEquals("World", ops.get(0).getText());
        assertEquals(102, ops.get(0).getOrigin().getX(), 1e-3);
        assertEquals(700, ops.get(0).getOrigin().getY(), 1e-3);
    }

    @Test
    public void advanceHonoursSpacingAndScale() throws IOException {
        List<TextShowOperation> ops = redactAndReparse("BT /F1 10 Tf 1 Tc 50 Tz 0 0 Td (ab) Tj (c) Tj ET",
                new Rectangle(-1, -1, 2, 2));
        // (5 + 1) * 2 * 0.5
        assertEquals(6, ops.get(0).getOrigin().getX(), 1e-3);
    }

    @Test
    public void nextLineIsNotShifted() throws IOException {
        List<TextShowOperation> ops = redactAndReparse("BT /F1 10 Tf 14 TL 72 700 Td (Hello) Tj T* (Next) Tj ET",
                new Rectangle(70, 695, 10, 10));
        assertEquals("Next", ops.get(0).getText());
        assertEquals(72, ops.get(0).getOrigin().getX(), 1e-3);
        assertEquals(686, ops.get(0).getOrigin().getY(), 1e-3);
    }
}
