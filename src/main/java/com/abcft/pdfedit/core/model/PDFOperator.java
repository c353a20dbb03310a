package com.abcft.pdfedit.core.model;

/**
 * Content stream operators interpreted by the text engine.
 */
public class PDFOperator {
    public static final String SAVE_GRAPHICS_STATE = "q";
    public static final String RESTORE_GRAPHICS_STATE = "Q";
    public static final String CONCAT_MATRIX = "cm";

    public static final String BEGIN_TEXT_OBJECT = "BT";
    public static final String END_TEXT_OBJECT = "ET";

    public static final String SET_CHAR_SPACING = "Tc";
    public static final String SET_WORD_SPACING = "Tw";
    public static final String SET_HORIZONTAL_SCALING = "Tz";
    public static final String SET_TEXT_LEADING = "TL";
    public static final String SET_FONT_AND_SIZE = "Tf";
    public static final String SET_TEXT_RENDERING_MODE = "Tr";
    public static final String SET_TEXT_RISE = "Ts";

    public static final String MOVE_TEXT = "Td";
    public static final String MOVE_TEXT_SET_LEADING = "TD";
    public static final String SET_TEXT_MATRIX = "Tm";
    public static final String NEXT_LINE = "T*";

    public static final String SHOW_TEXT = "Tj";
    public static final String SHOW_TEXT_ADJUSTED = "TJ";
    public static final String SHOW_TEXT_LINE = "'";
    public static final String SHOW_TEXT_LINE_AND_SPACE = "\"";

}
