package com.abcft.pdfedit.core.util;

import com.abcft.pdfedit.core.overlay.OverlayStrategy;
import com.abcft.pdfedit.core.overlay.RewriteParameters;
import com.abcft.pdfedit.core.validation.ValidateParameters;
import com.abcft.pdfedit.core.validation.ValidationCategory;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MapUtilsTest {

    private static final Map<String, String> PARAMS = ImmutableMap.<String, String>builder()
            .put("size", " 12 ")
            .put("ratio", "0.5")
            .put("flag", "yes")
            .put("strategy", "white_background")
            .put("broken", "abc")
            .put("blank", "  ")
            .build();

    @Test
    public void readsValues() {
        assertEquals("12", MapUtils.getString(PARAMS, "size", null));
        assertEquals(12, MapUtils.getInt(PARAMS, "size", 0));
        assertEquals(0.5f, MapUtils.getFloat(PARAMS, "ratio", 0), 1e-6);
        assertTrue(MapUtils.getBoolean(PARAMS, "flag", false));
        assertEquals(OverlayStrategy.WHITE_BACKGROUND,
                MapUtils.getEnum(PARAMS, "strategy", OverlayStrategy.class, OverlayStrategy.DIRECT_OVERLAY));
    }

    @Test
    public void fallsBackToDefaults() {
        assertEquals("x", MapUtils.getString(PARAMS, "blank", "x"));
        assertEquals(3, MapUtils.getInt(PARAMS, "broken", 3));
        assertEquals(1.5f, MapUtils.getFloat(PARAMS, "broken", 1.5f), 1e-6);
        assertTrue(MapUtils.getBoolean(PARAMS, "broken", true));
        assertEquals(OverlayStrategy.DIRECT_OVERLAY,
                MapUtils.getEnum(PARAMS, "broken", OverlayStrategy.class, OverlayStrategy.DIRECT_OVERLAY));
        assertEquals(7, MapUtils.getInt(null, "size", 7));
    }

    @Test
    public void configuresRewriting() {
        RewriteParameters params = new RewriteParameters.Builder(ImmutableMap.of(
                "rewrite.redactMargin", "2.5",
                "rewrite.strategy", "TRANSPARENT_ERASE",
                "rewrite.redactionFill", "#ff0000"))
                .build();
        assertEquals(2.5f, params.redactMargin, 1e-6);
        assertEquals(OverlayStrategy.TRANSPARENT_ERASE, params.defaultStrategy);
        assertEquals(Color.RED, params.redactionFill);
    }

    @Test
    public void configuresValidation() {
        ValidateParameters params = new ValidateParameters.Builder(ImmutableMap.of(
                "validate.checkFonts", "false",
                "validate.maxIssues", "5",
                "startPage", "2",
                "endPage", "3"))
                .build();
        assertFalse(params.isChecked(ValidationCategory.FONTS));
        assertTrue(params.isChecked(ValidationCategory.STRUCTURE));
        assertEquals(5, params.maxIssues);
        assertFalse(params.containsPage(0));
        assertTrue(params.containsPage(1));
        assertTrue(params.containsPage(2));
        assertFalse(params.containsPage(3));

        ValidateParameters copy = params.buildUpon().setAllowMissingFonts(true).build();
        assertTrue(copy.allowMissingFonts);
        assertEquals(5, copy.maxIssues);
        assertFalse(copy.isChecked(ValidationCategory.FONTS));
    }
}
