package com.abcft.pdfedit.core.gson;

import com.abcft.pdfedit.core.model.Rectangle;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.*;

public class GsonUtilTest {

    @Test
    public void convertsColors() {
        assertEquals("#ff8000", GsonUtil.color2String(new Color(255, 128, 0)));
        assertEquals(new Color(255, 128, 0), GsonUtil.string2Color("#ff8000"));
        assertNull(GsonUtil.color2String(null));
        assertNull(GsonUtil.string2Color(" "));
    }

    @Test
    public void serializesRectangles() {
        JsonObject json = GsonUtil.DEFAULT.toJsonTree(new Rectangle(1, 2, 3, 4)).getAsJsonObject();
        assertEquals(3, json.get("w").getAsDouble(), 1e-9);
        Rectangle rect = GsonUtil.DEFAULT.fromJson("{\"x\":1,\"y\":2,\"w\":3}", Rectangle.class);
        assertEquals(3, rect.getWidth(), 1e-9);
        assertEquals(0, rect.getHeight(), 1e-9);
    }

    @Test
    public void serializesColors() {
        assertEquals("\"#000000\"", GsonUtil.DEFAULT.toJson(Color.BLACK));
    }
}
