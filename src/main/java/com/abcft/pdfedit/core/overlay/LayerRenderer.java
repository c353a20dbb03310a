package com.abcft.pdfedit.core.overlay;

import java.io.IOException;
import java.util.List;

/**
 * Draws overlay layers onto a document. Implementations append non-fatal problems to {@code warnings}.
 */
public interface LayerRenderer {

    /**
     * Checks that a layer can be drawn. Every layer of an overlay is checked before the first one is drawn.
     *
     * @throws IOException if drawing the layer would fail.
     */
    void check(OverlayLayer layer) throws IOException;

    /**
     * Removes the text under the layer's box, then paints the layer's fill if it has one.
     */
    void renderRedaction(OverlayLayer layer, List<String> warnings) throws IOException;

    void renderFill(OverlayLayer layer, List<String> warnings) throws IOException;

    void renderText(OverlayLayer layer, List<String> warnings) throws IOException;

}
