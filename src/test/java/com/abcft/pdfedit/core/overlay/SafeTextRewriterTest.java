package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.Rectangle;
import com.abcft.pdfedit.core.validation.ModificationRecord;
import com.abcft.pdfedit.core.width.FitParameters;
import com.abcft.pdfedit.core.width.FitResult;
import com.abcft.pdfedit.core.width.FitStrategy;
import com.abcft.pdfedit.core.width.GlyphWidthPreserver;
import com.abcft.pdfedit.core.zorder.LayerInfo;
import com.abcft.pdfedit.core.zorder.LayerLevel;
import com.abcft.pdfedit.core.zorder.ZOrderManager;
import com.abcft.pdfedit.core.zorder.ZOrderParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SafeTextRewriterTest {

    private static final Rectangle BBOX = Rectangle.fromLTRB(100, 200, 250, 220);

    private ZOrderManager zOrderManager;
    private SafeTextRewriter rewriter;
    private RecordingRenderer renderer;

    /**
     * Records the layers it is asked to draw.
     */
    static class RecordingRenderer implements LayerRenderer {
        final List<OverlayLayer> drawn = new ArrayList<>();
        String warning;
        boolean failOnText;
        boolean rejectText;

        @Override
        public void check(OverlayLayer layer) throws IOException {
            if (rejectText && layer.getType() == OverlayType.TEXT) {
                throw new IOException("no glyphs");
            }
        }

        @Override
        public void renderRedaction(OverlayLayer layer, List<String> warnings) {
            drawn.add(layer);
        }

        @Override
        public void renderFill(OverlayLayer layer, List<String> warnings) {
            drawn.add(layer);
        }

        @Override
        public void renderText(OverlayLayer layer, List<String> warnings) throws IOException {
            if (failOnText) {
                throw new IOException("disk full");
            }
            if (warning != null) {
                warnings.add(warning);
            }
            drawn.add(layer);
        }
    }

    @BeforeEach
    public void setUp() {
        zOrderManager = new ZOrderManager();
        // every glyph is half an em wide
        GlyphWidthPreserver preserver = new GlyphWidthPreserver(FitParameters.DEFAULT,
                (font, cp, page) -> OptionalDouble.of(500));
        rewriter = new SafeTextRewriter(RewriteParameters.DEFAULT, zOrderManager, preserver);
        renderer = new RecordingRenderer();
    }

    private TextOverlayInfo prepare(OverlayStrategy strategy) {
        return rewriter.prepareRewrite(new RewriteRequest.Builder(0, "Hello", BBOX, "World")
                .setFont("Helvetica", 12)
                .setStrategy(strategy)
                .build());
    }

    @Nested
    public class Preparing {

        @Test
        public void redactThenInsertPutsRedactionBelowText() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            List<OverlayLayer> layers = overlay.getLayers();
            assertEquals(2, layers.size());
            OverlayLayer redaction = layers.get(0);
            OverlayLayer text = layers.get(1);
            assertEquals(OverlayType.REDACTION, redaction.getType());
            assertEquals(OverlayType.TEXT, text.getType());
            assertTrue(redaction.getZOrder() < text.getZOrder());
            assertTrue(Rectangle.nearlyEquals(Rectangle.fromLTRB(99, 199, 251, 221), redaction.getBBox(), 1e-4));
            assertEquals(Color.WHITE, redaction.getFillColor());
            assertEquals("World", text.getContent());
            assertEquals(100, text.getOrigin().getX(), 1e-6);
            assertEquals(220, text.getOrigin().getY(), 1e-6);
            assertEquals(OverlayState.PREPARED, overlay.getState());
        }

        @Test
        public void registersLayersWithZOrderManager() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            assertEquals(2, zOrderManager.getPageLayers(0).size());
            assertEquals(LayerLevel.REDACTION,
                    zOrderManager.getLayer(overlay.getLayers().get(0).getId()).get().getLevel());
            assertEquals(LayerLevel.TEXT,
                    zOrderManager.getLayer(overlay.getLayers().get(1).getId()).get().getLevel());
        }

        @Test
        public void whiteBackgroundUsesBackgroundLayer() {
            OverlayLayer background = prepare(OverlayStrategy.WHITE_BACKGROUND).getLayers().get(0);
            assertEquals(OverlayType.BACKGROUND, background.getType());
            assertEquals(Color.WHITE, background.getFillColor());
            assertEquals(1.0f, background.getFillOpacity());
            assertEquals(LayerLevel.TEXT_BACKGROUND, zOrderManager.getLayer(background.getId()).get().getLevel());
        }

        @Test
        public void backgroundsStayBelowText() {
            for (int i = 0; i < 3; ++i) {
                prepare(OverlayStrategy.WHITE_BACKGROUND);
            }
            List<LayerInfo> stack = zOrderManager.getPageLayers(0);
            int highestBackground = stack.stream()
                    .filter(layer -> layer.getLevel() == LayerLevel.TEXT_BACKGROUND)
                    .mapToInt(LayerInfo::getZOrder)
                    .max().getAsInt();
            int lowestText = stack.stream()
                    .filter(layer -> layer.getLevel() == LayerLevel.TEXT)
                    .mapToInt(LayerInfo::getZOrder)
                    .min().getAsInt();
            assertTrue(highestBackground < lowestText);
            List<LayerLevel> levels = stack.stream().map(LayerInfo::getLevel).collect(Collectors.toList());
            assertEquals(levels.stream().sorted().collect(Collectors.toList()), levels);
        }

        @Test
        public void transparentEraseHasNoFill() {
            OverlayLayer redaction = prepare(OverlayStrategy.TRANSPARENT_ERASE).getLayers().get(0);
            assertEquals(OverlayType.REDACTION, redaction.getType());
            assertNull(redaction.getFillColor());
            assertFalse(redaction.hasFill());
        }

        @Test
        public void directOverlayOnlyDrawsText() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.DIRECT_OVERLAY);
            assertEquals(1, overlay.getLayers().size());
            assertEquals(OverlayType.TEXT, overlay.getLayers().get(0).getType());
        }

        @Test
        public void refusesContentStreamEdits() {
            assertThrows(IllegalArgumentException.class, () -> prepare(OverlayStrategy.CONTENT_STREAM_EDIT));
            assertTrue(zOrderManager.getAllLayers().isEmpty());
            assertTrue(rewriter.getOverlays().isEmpty());
        }

        @Test
        public void usesDefaultStrategy() {
            TextOverlayInfo overlay = rewriter.prepareRewrite(0, "Hello", BBOX, "World", "Helvetica", 12, Color.RED);
            assertEquals(OverlayStrategy.REDACT_THEN_INSERT, overlay.getStrategy());
            assertEquals(RewriteMode.PRESERVE_POSITION, overlay.getMode());
            assertEquals(Color.RED, overlay.getLayers().get(1).getColor());
        }

        @Test
        public void centersInBox() {
            TextOverlayInfo overlay = rewriter.prepareRewrite(new RewriteRequest.Builder(0, "Hello", BBOX, "World")
                    .setMode(RewriteMode.CENTER_IN_BBOX)
                    .setPositionOffset(2, -1)
                    .build());
            OverlayLayer text = overlay.getLayers().get(1);
            assertEquals(177, text.getOrigin().getX(), 1e-6);
            assertEquals(209, text.getOrigin().getY(), 1e-6);
        }

        @Test
        public void adjustToFitCarriesSpacing() {
            // "Hellos" is 30pt at size 10, the box is 25pt wide
            TextOverlayInfo overlay = rewriter.prepareRewrite(
                    new RewriteRequest.Builder(0, "Hello", new Rectangle(0, 0, 25, 12), "Hellos")
                            .setFont("Helvetica", 10)
                            .setMode(RewriteMode.ADJUST_TO_FIT)
                            .build());
            assertNotNull(overlay.getFitAnalysis());
            assertEquals(FitResult.COMPRESSED, overlay.getFitAnalysis().getResult());
            assertEquals(-1, overlay.getCharSpacingDelta(), 1e-4);
            assertEquals(1, overlay.getScaleFactor(), 1e-6);
            OverlayLayer text = overlay.getLayers().get(1);
            assertEquals(-1, text.getCharSpacing(), 1e-4);
            assertEquals("Hellos", text.getContent());
        }

        @Test
        public void layerLimitRollsBackRegistration() {
            ZOrderManager small = new ZOrderManager(new ZOrderParameters.Builder()
                    .setMaxLayersPerPage(1)
                    .build());
            SafeTextRewriter limited = new SafeTextRewriter(RewriteParameters.DEFAULT, small, new GlyphWidthPreserver());
            assertThrows(IllegalStateException.class,
                    () -> limited.prepareRewrite(0, "Hello", BBOX, "World", "Helvetica", 12, Color.BLACK));
            assertTrue(small.getAllLayers().isEmpty());
        }
    }

    @Nested
    public class Applying {

        @Test
        public void drawsLayersBackToFront() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            RewriteResult result = rewriter.applyOverlay(overlay, renderer);
            assertEquals(RewriteStatus.SUCCESS, result.getStatus());
            assertEquals("Overlay applied (2 layers)", result.getMessage());
            assertEquals(OverlayType.REDACTION, renderer.drawn.get(0).getType());
            assertEquals(OverlayType.TEXT, renderer.drawn.get(1).getType());
            assertEquals(OverlayState.APPLIED, overlay.getState());
            assertTrue(overlay.isPendingWrite());
        }

        @Test
        public void readsCurrentZOrder() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            String textId = overlay.getLayers().get(1).getId();
            assertTrue(zOrderManager.swapLayers(overlay.getLayers().get(0).getId(), textId));

            rewriter.applyOverlay(overlay, renderer);
            assertEquals(textId, renderer.drawn.get(0).getId());
        }

        @Test
        public void rendererWarningsGivePartialSuccess() {
            renderer.warning = "Font Foo is not available, drawn with Helvetica";
            RewriteResult result = rewriter.applyOverlay(prepare(OverlayStrategy.DIRECT_OVERLAY), renderer);
            assertEquals(RewriteStatus.PARTIAL_SUCCESS, result.getStatus());
            assertEquals(1, result.getWarnings().size());
            assertTrue(result.isSuccess());
        }

        @Test
        public void rendererFailureKeepsOverlayPrepared() {
            renderer.failOnText = true;
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            RewriteResult result = rewriter.applyOverlay(overlay, renderer);
            assertEquals(RewriteStatus.FAILED, result.getStatus());
            assertFalse(result.getErrors().isEmpty());
            assertEquals(OverlayState.PREPARED, overlay.getState());
        }

        @Test
        public void rejectedLayerStopsBeforeDrawing() {
            renderer.rejectText = true;
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            RewriteResult result = rewriter.applyOverlay(overlay, renderer);
            assertEquals(RewriteStatus.FAILED, result.getStatus());
            assertTrue(renderer.drawn.isEmpty());
            assertEquals(OverlayState.PREPARED, overlay.getState());
        }

        @Test
        public void cannotApplyTwice() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.DIRECT_OVERLAY);
            rewriter.applyOverlay(overlay, renderer);
            assertTrue(rewriter.commit(overlay.getId()));
            assertEquals(RewriteStatus.FAILED, rewriter.applyOverlay(overlay, renderer).getStatus());
            assertEquals(1, renderer.drawn.size());
        }

        @Test
        public void reportsTruncation() {
            SafeTextRewriter truncating = new SafeTextRewriter(new RewriteParameters.Builder()
                    .setFitStrategy(FitStrategy.TRUNCATE)
                    .build(), zOrderManager, rewriter.getWidthPreserver());
            RewriteResult result = truncating.rewriteText(
                    new RewriteRequest.Builder(0, "Hello", new Rectangle(0, 0, 25, 12), "Hello World")
                            .setFont("Helvetica", 10)
                            .setMode(RewriteMode.ADJUST_TO_FIT)
                            .build(), renderer);
            assertEquals(RewriteStatus.TEXT_TRUNCATED, result.getStatus());
            assertEquals("Hello", result.getOverlay().getFinalText());
            assertEquals("Hello", renderer.drawn.get(1).getContent());
        }

        @Test
        public void reportsOverflow() {
            SafeTextRewriter overflowing = new SafeTextRewriter(new RewriteParameters.Builder()
                    .setFitStrategy(FitStrategy.ALLOW_OVERFLOW)
                    .build(), zOrderManager, rewriter.getWidthPreserver());
            RewriteResult result = overflowing.rewriteText(
                    new RewriteRequest.Builder(0, "Hi", new Rectangle(0, 0, 10, 12), "Hello")
                            .setFont("Helvetica", 10)
                            .setMode(RewriteMode.ADJUST_TO_FIT)
                            .build(), renderer);
            assertEquals(RewriteStatus.PARTIAL_SUCCESS, result.getStatus());
            assertEquals("Text overflows its box by 15.00pt", result.getWarnings().get(0));
        }
    }

    @Nested
    public class Lifecycle {

        @Test
        public void commitNeedsAppliedOverlay() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            assertFalse(rewriter.commit(overlay.getId()));
            rewriter.applyOverlay(overlay, renderer);
            assertTrue(rewriter.commit(overlay.getId()));
            assertTrue(overlay.isCommitted());
            assertFalse(overlay.isPendingWrite());
            assertFalse(rewriter.commit(overlay.getId()));
            assertFalse(rewriter.commit("missing"));
        }

        @Test
        public void discardUnregistersLayers() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.REDACT_THEN_INSERT);
            assertTrue(rewriter.discard(overlay.getId()));
            assertEquals(OverlayState.DISCARDED, overlay.getState());
            assertTrue(zOrderManager.getAllLayers().isEmpty());
            assertFalse(rewriter.discard(overlay.getId()));
            assertEquals(RewriteStatus.FAILED, rewriter.applyOverlay(overlay, renderer).getStatus());
        }

        @Test
        public void committedOverlayCannotBeDiscarded() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.DIRECT_OVERLAY);
            rewriter.applyOverlay(overlay, renderer);
            rewriter.commit(overlay.getId());
            assertFalse(rewriter.discard(overlay.getId()));
        }

        @Test
        public void removeForgetsOverlay() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.WHITE_BACKGROUND);
            assertTrue(rewriter.removeOverlay(overlay.getId()));
            assertFalse(rewriter.getOverlay(overlay.getId()).isPresent());
            assertTrue(zOrderManager.getAllLayers().isEmpty());
            assertFalse(rewriter.removeOverlay(overlay.getId()));
        }

        @Test
        public void listsPendingAndPageOverlays() {
            TextOverlayInfo first = prepare(OverlayStrategy.DIRECT_OVERLAY);
            TextOverlayInfo second = rewriter.prepareRewrite(1, "a", BBOX, "b", "Helvetica", 12, Color.BLACK);
            rewriter.applyOverlay(first, renderer);
            assertEquals(1, rewriter.getPendingOverlays().size());
            assertSame(first, rewriter.getPendingOverlays().get(0));
            assertEquals(1, rewriter.getPageOverlays(1).size());
            assertSame(second, rewriter.getPageOverlays(1).get(0));
        }

        @Test
        public void countsStatistics() {
            TextOverlayInfo first = prepare(OverlayStrategy.DIRECT_OVERLAY);
            prepare(OverlayStrategy.WHITE_BACKGROUND);
            rewriter.applyOverlay(first, renderer);
            rewriter.commit(first.getId());
            OverlayStatistics statistics = rewriter.getStatistics();
            assertEquals(2, statistics.getTotal());
            assertEquals(1, statistics.getApplied());
            assertEquals(1, statistics.getCommitted());
            assertEquals(Integer.valueOf(1), statistics.getByStrategy().get(OverlayStrategy.WHITE_BACKGROUND));
            assertEquals(Integer.valueOf(2), statistics.getByPage().get(0));
        }

        @Test
        public void convertsToModificationRecord() {
            TextOverlayInfo overlay = prepare(OverlayStrategy.DIRECT_OVERLAY);
            ModificationRecord record = overlay.toModificationRecord();
            assertEquals(0, record.getPage());
            assertEquals("Hello", record.getOriginalContent());
            assertEquals("World", record.getNewContent());
            assertFalse(record.isValidated());
        }
    }

    @Test
    public void recommendsStrategy() {
        assertEquals(OverlayStrategy.DIRECT_OVERLAY, SafeTextRewriter.recommendStrategy(true, "a", "b", false));
        assertEquals(OverlayStrategy.TRANSPARENT_ERASE, SafeTextRewriter.recommendStrategy(false, "Hello", "Help", false));
        assertEquals(OverlayStrategy.REDACT_THEN_INSERT, SafeTextRewriter.recommendStrategy(false, "Hello", "Help", true));
        assertEquals(OverlayStrategy.WHITE_BACKGROUND,
                SafeTextRewriter.recommendStrategy(false, "Hi", "Hello brave new world", false));
        assertEquals(OverlayStrategy.REDACT_THEN_INSERT,
                SafeTextRewriter.recommendStrategy(false, "Hello", "Hello there", false));
    }

    @Test
    public void overlayStatesOnlyMoveForward() {
        assertTrue(OverlayState.PREPARED.canTransitionTo(OverlayState.APPLIED));
        assertTrue(OverlayState.APPLIED.canTransitionTo(OverlayState.DISCARDED));
        assertFalse(OverlayState.COMMITTED.canTransitionTo(OverlayState.DISCARDED));
        assertFalse(OverlayState.PREPARED.canTransitionTo(OverlayState.COMMITTED));
        assertTrue(OverlayStrategy.DIRECT_OVERLAY.preservesOriginal());
        assertFalse(OverlayStrategy.CONTENT_STREAM_EDIT.isSafe());
    }
}
