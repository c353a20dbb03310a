package com.abcft.pdfedit.core.content;

import com.abcft.pdfedit.core.model.FontUtils;
import com.abcft.pdfedit.core.model.PDFOperator;
import com.abcft.pdfedit.core.model.TransformMatrix;
import com.abcft.pdfedit.core.width.FallbackWidthTables;
import com.abcft.pdfedit.core.width.FontMetricsProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Interprets the text operators of a content stream and reports every text show with its position.
 *
 * <p>Only the graphics state stack, the CTM and the text state are tracked; painting operators are
 * ignored. Malformed content never raises: bad operators are skipped and counted as anomalies.</p>
 *
 * <p>A parser holds no per-stream state and can be reused, but is not meant to be shared between threads
 * when a {@link FontMetricsProvider} that caches is attached.</p>
 */
public class ContentStreamParser {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Map<String, String> fontNames;
    private final FontMetricsProvider metricsProvider;

    public ContentStreamParser() {
        this(null, null);
    }

    /**
     * @param fontNames maps font resource names ({@code F1}) to font names; may be {@code null}.
     */
    public ContentStreamParser(Map<String, String> fontNames) {
        this(fontNames, null);
    }

    /**
     * @param fontNames maps font resource names ({@code F1}) to font names; may be {@code null}.
     * @param metricsProvider when set, the text matrix is advanced past every shown string.
     */
    public ContentStreamParser(Map<String, String> fontNames, FontMetricsProvider metricsProvider) {
        this.fontNames = fontNames != null ? new HashMap<>(fontNames) : Collections.emptyMap();
        this.metricsProvider = metricsProvider;
    }

    /**
     * Splits raw content bytes into operands and operators.
     *
     * <p>A tokenizer error ends the list; everything read before it is kept.</p>
     */
    public static List<Object> tokenize(byte[] content) {
        List<Object> tokens = new ArrayList<>();
        if (content == null || content.length == 0) {
            return tokens;
        }
        try {
            readTokens(new PDFStreamParser(content), tokens);
        } catch (IOException e) {
            LOGGER.warn("Content stream truncated after {} tokens: {}", tokens.size(), e.getMessage());
        }
        return tokens;
    }

    public static List<Object> tokenize(PDPage page) {
        List<Object> tokens = new ArrayList<>();
        try {
            readTokens(new PDFStreamParser(page), tokens);
        } catch (IOException e) {
            LOGGER.warn("Page content truncated after {} tokens: {}", tokens.size(), e.getMessage());
        }
        return tokens;
    }

    private static void readTokens(PDFStreamParser parser, List<Object> tokens) throws IOException {
        Object token;
        while ((token = parser.parseNextToken()) != null) {
            tokens.add(token);
        }
    }

    public ParseResult parse(byte[] content) {
        return parse(content, -1);
    }

    public ParseResult parse(byte[] content, int pageIndex) {
        return parse(tokenize(content), Collections.emptyMap(), pageIndex);
    }

    public ParseResult parse(PDPage page) {
        return parse(page, -1);
    }

    /**
     * Parses a page, resolving {@code Tf} names and decoding strings through the page's fonts.
     */
    public ParseResult parse(PDPage page, int pageIndex) {
        return parse(tokenize(page), loadFonts(page.getResources(), pageIndex), pageIndex);
    }

    public ParseResult parse(List<Object> tokens) {
        return parse(tokens, -1);
    }

    public ParseResult parse(List<Object> tokens, int pageIndex) {
        return parse(tokens, Collections.emptyMap(), pageIndex);
    }

    private ParseResult parse(List<Object> tokens, Map<String, PDFont> fonts, int pageIndex) {
        Session session = new Session(tokens, fonts, pageIndex);
        session.run();
        ParseResult result = session.result;
        if (result.hasAnomalies()) {
            LOGGER.warn("Page #{}: {} anomalies in content stream", pageIndex + 1, result.getAnomalyCount());
        }
        return result;
    }

    private static Map<String, PDFont> loadFonts(PDResources resources, int pageIndex) {
        if (null == resources) {
            return Collections.emptyMap();
        }
        Map<String, PDFont> fonts = new HashMap<>();
        for (COSName name : resources.getFontNames()) {
            try {
                PDFont font = resources.getFont(name);
                if (font != null) {
                    fonts.put(name.getName(), font);
                }
            } catch (IOException e) {
                LOGGER.warn("Page #{}: failed to load font {}", pageIndex + 1, name.getName(), e);
            }
        }
        return fonts;
    }

    private final class Session {

        final List<Object> tokens;
        final Map<String, PDFont> fonts;
        final int pageIndex;
        final ParseResult result;

        final Deque<TextState> stack = new ArrayDeque<>();
        final List<COSBase> operands = new ArrayList<>();
        TextState state = new TextState();
        ParsedTextBlock block;
        int firstOperandIndex = -1;

        Session(List<Object> tokens, Map<String, PDFont> fonts, int pageIndex) {
            this.tokens = tokens;
            this.fonts = fonts;
            this.pageIndex = pageIndex;
            this.result = new ParseResult(tokens);
        }

        void run() {
            for (int i = 0; i < tokens.size(); ++i) {
                Object token = tokens.get(i);
                if (token instanceof Operator) {
                    processOperator(((Operator) token).getName(), i);
                    operands.clear();
                    firstOperandIndex = -1;
                } else if (token instanceof COSBase) {
                    if (operands.isEmpty()) {
                        firstOperandIndex = i;
                    }
                    operands.add((COSBase) token);
                }
            }
            if (block != null) {
                anomaly(tokens.size(), PDFOperator.END_TEXT_OBJECT, "text object not terminated");
                endBlock(-1);
            }
            if (!stack.isEmpty()) {
                anomaly(tokens.size(), PDFOperator.RESTORE_GRAPHICS_STATE,
                        stack.size() + " graphics state(s) not restored");
            }
        }

        boolean inText() {
            return block != null;
        }

        void processOperator(String op, int index) {
            switch (op) {
                case PDFOperator.SAVE_GRAPHICS_STATE:
                    stack.push(state.copy());
                    break;
                case PDFOperator.RESTORE_GRAPHICS_STATE:
                    restoreState(index);
                    break;
                case PDFOperator.CONCAT_MATRIX: {
                    double[] m = numbers(op, 6, index);
                    if (m != null) {
                        state.setCtm(TransformMatrix.of(m[0], m[1], m[2], m[3], m[4], m[5]).multiply(state.getCtm()));
                    }
                    break;
                }
                case PDFOperator.BEGIN_TEXT_OBJECT:
                    if (inText()) {
                        anomaly(index, op, "nested text object");
                        endBlock(-1);
                    }
                    state.setTextMatrix(TransformMatrix.identity());
                    state.setTextLineMatrix(TransformMatrix.identity());
                    beginBlock(index, false);
                    break;
                case PDFOperator.END_TEXT_OBJECT:
                    if (!inText()) {
                        anomaly(index, op, "no open text object");
                    } else {
                        endBlock(index);
                    }
                    break;
                case PDFOperator.SET_FONT_AND_SIZE:
                    setFont(op, index);
                    break;
                case PDFOperator.SET_CHAR_SPACING:
                case PDFOperator.SET_WORD_SPACING:
                case PDFOperator.SET_HORIZONTAL_SCALING:
                case PDFOperator.SET_TEXT_LEADING:
                case PDFOperator.SET_TEXT_RENDERING_MODE:
                case PDFOperator.SET_TEXT_RISE:
                    setTextState(op, index);
                    break;
                case PDFOperator.MOVE_TEXT:
                case PDFOperator.MOVE_TEXT_SET_LEADING:
                case PDFOperator.SET_TEXT_MATRIX:
                case PDFOperator.NEXT_LINE:
                    if (!inText()) {
                        anomaly(index, op, "text positioning outside text object");
                        break;
                    }
                    positionText(op, index);
                    break;
                case PDFOperator.SHOW_TEXT:
                case PDFOperator.SHOW_TEXT_ADJUSTED:
                case PDFOperator.SHOW_TEXT_LINE:
                case PDFOperator.SHOW_TEXT_LINE_AND_SPACE:
                    showText(op, index);
                    break;
                default:
                    break;
            }
        }

        void restoreState(int index) {
            if (stack.isEmpty()) {
                anomaly(index, PDFOperator.RESTORE_GRAPHICS_STATE, "graphics state stack is empty");
                return;
            }
            TextState restored = stack.pop();
            // the text matrices are not part of the graphics state
            restored.setTextMatrix(state.getTextMatrix());
            restored.setTextLineMatrix(state.getTextLineMatrix());
            state = restored;
        }

        void setFont(String op, int index) {
            if (operands.size() != 2 || !(operands.get(0) instanceof COSName)
                    || !(operands.get(1) instanceof COSNumber)) {
                anomaly(index, op, "expects a name and a size, got " + operands);
                return;
            }
            String resourceName = ((COSName) operands.get(0)).getName();
            PDFont font = fonts.get(resourceName);
            String fontName = fontNames.get(resourceName);
            if (null == fontName) {
                fontName = font != null ? FontUtils.getFontName(font) : resourceName;
            }
            state.setFontResourceName(resourceName);
            state.setFontName(fontName);
            state.setFont(font);
            state.setFontSize(((COSNumber) operands.get(1)).floatValue());
        }

        void setTextState(String op, int index) {
            double[] v = numbers(op, 1, index);
            if (null == v) {
                return;
            }
            switch (op) {
                case PDFOperator.SET_CHAR_SPACING:
                    state.setCharSpacing(v[0]);
                    break;
                case PDFOperator.SET_WORD_SPACING:
                    state.setWordSpacing(v[0]);
                    break;
                case PDFOperator.SET_HORIZONTAL_SCALING:
                    state.setHorizontalScale(v[0]);
                    break;
                case PDFOperator.SET_TEXT_LEADING:
                    state.setLeading(v[0]);
                    break;
                case PDFOperator.SET_TEXT_RENDERING_MODE:
                    state.setRenderMode((int) v[0]);
                    break;
                case PDFOperator.SET_TEXT_RISE:
                    state.setRise(v[0]);
                    break;
                default:
                    break;
            }
        }

        void positionText(String op, int index) {
            switch (op) {
                case PDFOperator.MOVE_TEXT: {
                    double[] t = numbers(op, 2, index);
                    if (t != null) {
                        moveText(t[0], t[1]);
                    }
                    break;
                }
                case PDFOperator.MOVE_TEXT_SET_LEADING: {
                    double[] t = numbers(op, 2, index);
                    if (t != null) {
                        state.setLeading(-t[1]);
                        moveText(t[0], t[1]);
                    }
                    break;
                }
                case PDFOperator.SET_TEXT_MATRIX: {
                    double[] m = numbers(op, 6, index);
                    if (m != null) {
                        TransformMatrix matrix = TransformMatrix.of(m[0], m[1], m[2], m[3], m[4], m[5]);
                        state.setTextMatrix(matrix);
                        state.setTextLineMatrix(matrix);
                    }
                    break;
                }
                case PDFOperator.NEXT_LINE:
                    nextLine();
                    break;
                default:
                    break;
            }
        }

        void moveText(double tx, double ty) {
            TransformMatrix lineMatrix = TransformMatrix.translation(tx, ty).multiply(state.getTextLineMatrix());
            state.setTextLineMatrix(lineMatrix);
            state.setTextMatrix(lineMatrix);
        }

        void nextLine() {
            moveText(0, -state.getLeading());
        }

        void showText(String op, int index) {
            TextShowOperator operator = TextShowOperator.fromOperator(op);
            List<GlyphAdjustment> adjustments = new ArrayList<>();
            String text;
            switch (operator) {
                case SHOW_TEXT:
                case NEXT_LINE_SHOW:
                    if (operands.size() != 1 || !(operands.get(0) instanceof COSString)) {
                        anomaly(index, op, "expects one string, got " + operands);
                        return;
                    }
                    text = decode((COSString) operands.get(0));
                    break;
                case SPACING_NEXT_LINE_SHOW:
                    if (operands.size() != 3 || !(operands.get(0) instanceof COSNumber)
                            || !(operands.get(1) instanceof COSNumber) || !(operands.get(2) instanceof COSString)) {
                        anomaly(index, op, "expects two numbers and a string, got " + operands);
                        return;
                    }
                    text = decode((COSString) operands.get(2));
                    break;
                case SHOW_TEXT_ARRAY:
                    if (operands.size() != 1 || !(operands.get(0) instanceof COSArray)) {
                        anomaly(index, op, "expects one array, got " + operands);
                        return;
                    }
                    text = decodeArray((COSArray) operands.get(0), adjustments, index);
                    break;
                default:
                    return;
            }

            if (!inText()) {
                anomaly(index, op, "text shown outside text object");
                beginBlock(index, true);
            }
            if (operator == TextShowOperator.SPACING_NEXT_LINE_SHOW) {
                state.setWordSpacing(((COSNumber) operands.get(0)).floatValue());
                state.setCharSpacing(((COSNumber) operands.get(1)).floatValue());
            }
            if (operator == TextShowOperator.NEXT_LINE_SHOW || operator == TextShowOperator.SPACING_NEXT_LINE_SHOW) {
                nextLine();
            }

            TextShowOperation operation = new TextShowOperation(operator, text, state.copy(), adjustments,
                    index, firstOperandIndex);
            block.add(operation);
            result.addOperation(operation);
            LOGGER.trace("{}", operation);

            if (metricsProvider != null) {
                double advance = computeAdvance(text, adjustments);
                operation.setAdvance(advance);
                state.setTextMatrix(TransformMatrix.translation(advance, 0).multiply(state.getTextMatrix()));
            }
        }

        String decodeArray(COSArray array, List<GlyphAdjustment> adjustments, int index) {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < array.size(); ++i) {
                COSBase item = array.getObject(i);
                if (item instanceof COSString) {
                    text.append(decode((COSString) item));
                } else if (item instanceof COSNumber) {
                    adjustments.add(new GlyphAdjustment(text.length(), ((COSNumber) item).floatValue()));
                } else {
                    anomaly(index, PDFOperator.SHOW_TEXT_ADJUSTED, "unexpected array element " + item);
                }
            }
            return text.toString();
        }

        String decode(COSString string) {
            PDFont font = state.getFont();
            if (null == font) {
                return string.getString();
            }
            StringBuilder text = new StringBuilder();
            ByteArrayInputStream in = new ByteArrayInputStream(string.getBytes());
            try {
                while (in.available() > 0) {
                    int code = font.readCode(in);
                    String unicode = font.toUnicode(code);
                    if (unicode != null) {
                        text.append(unicode);
                    }
                }
            } catch (IOException e) {
                LOGGER.debug("Page #{}: failed to decode string with {}", pageIndex + 1, state.getFontName(), e);
                return string.getString();
            }
            return text.toString();
        }

        double computeAdvance(String text, List<GlyphAdjustment> adjustments) {
            double fontSize = state.getFontSize();
            double width = text.codePoints()
                    .mapToDouble(cp -> glyphWidth(cp) / 1000.0 * fontSize + state.getCharSpacing()
                            + (cp == ' ' ? state.getWordSpacing() : 0))
                    .sum();
            for (GlyphAdjustment adjustment : adjustments) {
                width += adjustment.toPoints(fontSize);
            }
            return width * state.getHorizontalScale() / 100.0;
        }

        double glyphWidth(int codePoint) {
            String fontName = state.getFontName();
            try {
                OptionalDouble width = metricsProvider.getGlyphWidth(fontName, codePoint, pageIndex);
                if (width.isPresent()) {
                    return width.getAsDouble();
                }
            } catch (RuntimeException e) {
                LOGGER.debug("Page #{}: metrics lookup failed for {}", pageIndex + 1, fontName, e);
            }
            return FallbackWidthTables.widthOf(codePoint, fontName);
        }

        void beginBlock(int index, boolean recovered) {
            block = new ParsedTextBlock(result.getBlocks().size(), index, recovered);
            result.addBlock(block);
        }

        void endBlock(int index) {
            block.close(index);
            block = null;
        }

        double[] numbers(String op, int count, int index) {
            if (operands.size() != count) {
                anomaly(index, op, "expects " + count + " operand(s), got " + operands.size());
                return null;
            }
            double[] values = new double[count];
            for (int i = 0; i < count; ++i) {
                COSBase operand = operands.get(i);
                if (!(operand instanceof COSNumber)) {
                    anomaly(index, op, "non-numeric operand " + operand);
                    return null;
                }
                values[i] = ((COSNumber) operand).floatValue();
            }
            return values;
        }

        void anomaly(int index, String op, String message) {
            String anomaly = String.format("#%d %s: %s", index, op, message);
            result.addAnomaly(anomaly);
            LOGGER.debug("Page #{}: {}", pageIndex + 1, anomaly);
        }
    }

}
