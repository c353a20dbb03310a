package com.abcft.pdfedit.core.overlay;

import com.abcft.pdfedit.core.model.Rectangle;
import com.abcft.pdfedit.core.width.FitAnalysis;
import com.abcft.pdfedit.core.width.FitResult;
import com.abcft.pdfedit.core.width.GlyphWidthPreserver;
import com.abcft.pdfedit.core.width.SpacingAdjustment;
import com.abcft.pdfedit.core.zorder.LayerInfo;
import com.abcft.pdfedit.core.zorder.ZOrderManager;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Replaces text by drawing layers over it instead of editing the original text operators.
 *
 * <p>An overlay is prepared first: its layers are registered with the {@link ZOrderManager} so that
 * redactions and backgrounds always sit below the new text. Applying the overlay draws the layers
 * with a {@link LayerRenderer}; committing it marks the change as final.</p>
 *
 * <p>Not thread safe; callers sharing an instance must synchronize.</p>
 */
public class SafeTextRewriter {

    private static final Logger LOGGER = LogManager.getLogger();

    private final RewriteParameters params;
    private final ZOrderManager zOrderManager;
    private final GlyphWidthPreserver widthPreserver;
    private final Map<String, TextOverlayInfo> overlays = new LinkedHashMap<>();

    public SafeTextRewriter() {
        this(RewriteParameters.DEFAULT);
    }

    public SafeTextRewriter(RewriteParameters params) {
        this(params, new ZOrderManager(), new GlyphWidthPreserver());
    }

    public SafeTextRewriter(RewriteParameters params, ZOrderManager zOrderManager, GlyphWidthPreserver widthPreserver) {
        this.params = Preconditions.checkNotNull(params, "params");
        this.zOrderManager = Preconditions.checkNotNull(zOrderManager, "zOrderManager");
        this.widthPreserver = Preconditions.checkNotNull(widthPreserver, "widthPreserver");
    }

    public RewriteParameters getParams() {
        return params;
    }

    public ZOrderManager getZOrderManager() {
        return zOrderManager;
    }

    public GlyphWidthPreserver getWidthPreserver() {
        return widthPreserver;
    }

    // ---- preparation ----

    public TextOverlayInfo prepareRewrite(int page, String originalText, Rectangle2D originalBBox, String newText,
                                          String fontName, float fontSize, Color color) {
        return prepareRewrite(new RewriteRequest.Builder(page, originalText, originalBBox, newText)
                .setFont(fontName, fontSize)
                .setColor(color)
                .build());
    }

    /**
     * Builds the layers of an overlay and registers them with the z-order manager.
     * Nothing is drawn until the overlay is applied.
     *
     * @throws IllegalArgumentException if the requested strategy edits the content stream in place.
     * @throws IllegalStateException if the page has no room for more layers.
     */
    public TextOverlayInfo prepareRewrite(RewriteRequest request) {
        Preconditions.checkNotNull(request, "request");
        OverlayStrategy strategy = request.strategy != null ? request.strategy : params.defaultStrategy;
        RewriteMode mode = request.mode != null ? request.mode : params.defaultMode;
        if (!strategy.isSafe()) {
            LOGGER.warn("Page #{}: strategy {} is unsafe, rewrite of \"{}\" refused",
                    request.page + 1, strategy, request.originalText);
            throw new IllegalArgumentException("Unsafe overlay strategy: " + strategy);
        }

        String overlayId = newId();
        Rectangle bbox = request.originalBBox;

        String finalText = request.newText;
        float charSpacing = 0;
        float wordSpacing = 0;
        float horizontalScale = 100;
        FitAnalysis analysis = null;
        if (mode == RewriteMode.ADJUST_TO_FIT) {
            analysis = widthPreserver.analyzeFit(request.originalText, request.newText, request.fontName,
                    request.fontSize, request.page, params.fitStrategy, bbox.getWidth());
            SpacingAdjustment adjustment = analysis.getAdjustment() != null
                    ? analysis.getAdjustment() : SpacingAdjustment.NONE;
            charSpacing = (float) adjustment.getTracking();
            wordSpacing = (float) adjustment.getWordSpacing();
            horizontalScale = (float) adjustment.getHorizontalScale();
            finalText = analysis.getFinalText();
            LOGGER.debug("Page #{}: fit of overlay {}: {}", request.page + 1, overlayId, analysis);
        }

        List<OverlayLayer> layers = new ArrayList<>();
        try {
            Rectangle coverBox = bbox.expandedBy(params.redactMargin);
            switch (strategy) {
                case REDACT_THEN_INSERT:
                    registerLayer(layers, overlayId, OverlayType.REDACTION, request.page, coverBox)
                            .setFillColor(params.redactionFill)
                            .setFillOpacity(1.0f);
                    break;
                case WHITE_BACKGROUND:
                    registerLayer(layers, overlayId, OverlayType.BACKGROUND, request.page, coverBox)
                            .setFillColor(Color.WHITE)
                            .setFillOpacity(1.0f);
                    break;
                case TRANSPARENT_ERASE:
                    registerLayer(layers, overlayId, OverlayType.REDACTION, request.page, coverBox)
                            .setFillColor(null)
                            .setFillOpacity(0);
                    break;
                default:
                    break;
            }
            registerLayer(layers, overlayId, OverlayType.TEXT, request.page, bbox)
                    .setOrigin(textOrigin(mode, bbox, request.offsetX, request.offsetY))
                    .setContent(finalText)
                    .setFontName(request.fontName)
                    .setFontSize(request.fontSize)
                    .setColor(request.color)
                    .setCharSpacing(charSpacing)
                    .setWordSpacing(wordSpacing)
                    .setHorizontalScale(horizontalScale)
                    .setSourceSpanId(request.spanId);
        } catch (RuntimeException e) {
            for (OverlayLayer layer : layers) {
                zOrderManager.removeLayer(layer.getId());
            }
            throw e;
        }

        TextOverlayInfo overlay = new TextOverlayInfo(overlayId, request, strategy, mode,
                charSpacing, horizontalScale / 100, layers, analysis);
        overlays.put(overlayId, overlay);
        LOGGER.debug("Page #{}: prepared {}", request.page + 1, overlay);
        return overlay;
    }

    private OverlayLayer registerLayer(List<OverlayLayer> layers, String overlayId, OverlayType type,
                                       int page, Rectangle bbox) {
        LayerInfo info = zOrderManager.addLayer(page, bbox, type.getLayerLevel(),
                String.format("%s:%s", overlayId, StringUtils.lowerCase(type.name())),
                type.name(), overlayId);
        OverlayLayer layer = new OverlayLayer(info.getId(), type, page, info.getZOrder(), bbox);
        layers.add(layer);
        return layer;
    }

    static Point2D textOrigin(RewriteMode mode, Rectangle bbox, float offsetX, float offsetY) {
        if (mode == RewriteMode.CENTER_IN_BBOX) {
            Point2D center = bbox.getCenter();
            return new Point2D.Double(center.getX() + offsetX, center.getY() + offsetY);
        }
        return new Point2D.Double(bbox.getMinX() + offsetX, bbox.getMaxY() + offsetY);
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (overlays.containsKey(id));
        return id;
    }

    // ---- application ----

    /**
     * Draws the layers of an overlay from back to front.
     *
     * <p>The z-order is read from the manager at this point, so reorders done after preparation
     * are honoured. Every layer is checked by the renderer before anything is drawn, so an overlay that cannot
     * be drawn leaves the page untouched. On failure the overlay stays prepared; layers drawn before a failure
     * while drawing are not undone.</p>
     */
    public RewriteResult applyOverlay(TextOverlayInfo overlay, LayerRenderer renderer) {
        Preconditions.checkNotNull(overlay, "overlay");
        Preconditions.checkNotNull(renderer, "renderer");
        if (overlay.getState() != OverlayState.PREPARED) {
            String message = String.format("Overlay %s is %s", overlay.getId(), overlay.getState());
            LOGGER.warn("Page #{}: {}, not applied", overlay.getPage() + 1, message);
            return RewriteResult.failed(message, overlay);
        }

        List<OverlayLayer> ordered = orderByStack(overlay);
        try {
            for (OverlayLayer layer : ordered) {
                renderer.check(layer);
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Page #{}: overlay {} cannot be drawn", overlay.getPage() + 1, overlay.getId(), e);
            return RewriteResult.failed(
                    String.format("Overlay %s cannot be drawn: %s", overlay.getId(), e.getMessage()), overlay);
        }

        List<String> warnings = new ArrayList<>();
        try {
            for (OverlayLayer layer : ordered) {
                switch (layer.getType()) {
                    case REDACTION:
                        renderer.renderRedaction(layer, warnings);
                        break;
                    case BACKGROUND:
                    case SHAPE:
                        renderer.renderFill(layer, warnings);
                        break;
                    case TEXT:
                        renderer.renderText(layer, warnings);
                        break;
                    default:
                        warnings.add(String.format("Layer %s: %s layers are not drawn", layer.getId(), layer.getType()));
                        break;
                }
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Page #{}: failed to apply overlay {}", overlay.getPage() + 1, overlay.getId(), e);
            RewriteResult result = RewriteResult.failed(
                    String.format("Failed to apply overlay %s: %s", overlay.getId(), e.getMessage()), overlay);
            for (String warning : warnings) {
                result.addWarning(warning);
            }
            return result;
        }

        overlay.transitionTo(OverlayState.APPLIED);
        RewriteResult result = new RewriteResult(RewriteStatus.SUCCESS,
                String.format("Overlay applied (%d layers)", ordered.size()), overlay);
        FitAnalysis analysis = overlay.getFitAnalysis();
        if (analysis != null && analysis.getResult() == FitResult.TRUNCATED) {
            result.setStatus(RewriteStatus.TEXT_TRUNCATED);
        } else if (analysis != null && !analysis.isSuccess()) {
            result.addWarning(String.format("Text overflows its box by %.2fpt", analysis.getOverflowAmount()));
        }
        for (String warning : warnings) {
            result.addWarning(warning);
        }
        LOGGER.debug("Page #{}: {}", overlay.getPage() + 1, result);
        return result;
    }

    private List<OverlayLayer> orderByStack(TextOverlayInfo overlay) {
        Map<String, Integer> positions = new HashMap<>();
        List<LayerInfo> stack = zOrderManager.getPageLayers(overlay.getPage());
        for (int i = 0; i < stack.size(); ++i) {
            positions.put(stack.get(i).getId(), i);
        }
        Comparator<OverlayLayer> byZ = Comparator.comparingInt(layer -> zOrderManager.getLayer(layer.getId())
                .map(LayerInfo::getZOrder)
                .orElse(layer.getZOrder()));
        Comparator<OverlayLayer> byPosition = Comparator.comparingInt(
                layer -> positions.getOrDefault(layer.getId(), Integer.MAX_VALUE));
        return overlay.getLayers().stream()
                .sorted(byZ.thenComparing(byPosition))
                .collect(Collectors.toList());
    }

    /**
     * Prepares an overlay and applies it right away.
     */
    public RewriteResult rewriteText(RewriteRequest request, LayerRenderer renderer) {
        return applyOverlay(prepareRewrite(request), renderer);
    }

    public RewriteResult rewriteText(int page, String originalText, Rectangle2D originalBBox, String newText,
                                     String fontName, float fontSize, Color color, LayerRenderer renderer) {
        return applyOverlay(prepareRewrite(page, originalText, originalBBox, newText, fontName, fontSize, color),
                renderer);
    }

    // ---- lifecycle ----

    public boolean commit(String overlayId) {
        TextOverlayInfo overlay = overlays.get(overlayId);
        if (null == overlay || !overlay.getState().canTransitionTo(OverlayState.COMMITTED)) {
            return false;
        }
        overlay.transitionTo(OverlayState.COMMITTED);
        return true;
    }

    /**
     * Drops a prepared or applied overlay and unregisters its layers. Content already drawn stays on the page.
     */
    public boolean discard(String overlayId) {
        TextOverlayInfo overlay = overlays.get(overlayId);
        if (null == overlay || !overlay.getState().canTransitionTo(OverlayState.DISCARDED)) {
            return false;
        }
        overlay.transitionTo(OverlayState.DISCARDED);
        unregisterLayers(overlay);
        return true;
    }

    public boolean removeOverlay(String overlayId) {
        TextOverlayInfo overlay = overlays.remove(overlayId);
        if (null == overlay) {
            return false;
        }
        unregisterLayers(overlay);
        return true;
    }

    private void unregisterLayers(TextOverlayInfo overlay) {
        for (OverlayLayer layer : overlay.getLayers()) {
            zOrderManager.removeLayer(layer.getId());
        }
    }

    // ---- queries ----

    public Optional<TextOverlayInfo> getOverlay(String overlayId) {
        return Optional.ofNullable(overlays.get(overlayId));
    }

    public List<TextOverlayInfo> getPageOverlays(int page) {
        return overlays.values().stream()
                .filter(overlay -> overlay.getPage() == page)
                .collect(Collectors.toList());
    }

    /**
     * Overlays drawn but not committed yet.
     */
    public List<TextOverlayInfo> getPendingOverlays() {
        return overlays.values().stream()
                .filter(TextOverlayInfo::isPendingWrite)
                .collect(Collectors.toList());
    }

    public List<TextOverlayInfo> getOverlays() {
        return new ArrayList<>(overlays.values());
    }

    public OverlayStatistics getStatistics() {
        int applied = 0;
        int committed = 0;
        Map<OverlayStrategy, Integer> byStrategy = new EnumMap<>(OverlayStrategy.class);
        Map<Integer, Integer> byPage = new TreeMap<>();
        for (TextOverlayInfo overlay : overlays.values()) {
            if (overlay.isApplied()) {
                ++applied;
            }
            if (overlay.isCommitted()) {
                ++committed;
            }
            byStrategy.merge(overlay.getStrategy(), 1, Integer::sum);
            byPage.merge(overlay.getPage(), 1, Integer::sum);
        }
        return new OverlayStatistics(overlays.size(), applied, committed, byStrategy, byPage);
    }

    /**
     * Picks a strategy for replacing {@code originalText} with {@code newText}.
     *
     * <p>Signed documents only get overlays on top of the original, small same-font edits are erased
     * without a fill, and much longer text gets an opaque background.</p>
     */
    public static OverlayStrategy recommendStrategy(boolean hasSignatures, String originalText, String newText,
                                                    boolean fontChanged) {
        if (hasSignatures) {
            return OverlayStrategy.DIRECT_OVERLAY;
        }
        int delta = StringUtils.length(newText) - StringUtils.length(originalText);
        if (Math.abs(delta) <= 3 && !fontChanged) {
            return OverlayStrategy.TRANSPARENT_ERASE;
        }
        if (delta > 10) {
            return OverlayStrategy.WHITE_BACKGROUND;
        }
        return OverlayStrategy.REDACT_THEN_INSERT;
    }
}
