package com.abcft.pdfedit.core.gson;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.abcft.pdfedit.core.model.Rectangle;
import org.apache.commons.lang3.StringUtils;

import java.awt.Color;
import java.awt.geom.Rectangle2D;
import java.lang.reflect.Type;

/**
 * Shared Gson instances and adapters for geometry and colors.
 */
public class GsonUtil {

    private GsonUtil() {}

    public static String color2String(Color color) {
        if (color == null) {
            return null;
        }
        return String.format("#%02x%02x%02x",
                color.getRed(), color.getGreen(), color.getBlue());
    }

    public static Color string2Color(String color) {
        if (StringUtils.isBlank(color)) {
            return null;
        }
        int value = Integer.parseInt(color.replace("#", ""), 16);
        return new Color(value);
    }

    public static JsonObject toJsonObject(Rectangle2D rect) {
        JsonObject object = new JsonObject();
        object.addProperty("x", rect.getX());
        object.addProperty("y", rect.getY());
        object.addProperty("w", rect.getWidth());
        object.addProperty("h", rect.getHeight());
        return object;
    }

    public static Rectangle fromJsonObject(JsonObject object) {
        double x = object.has("x") ? object.get("x").getAsDouble() : .0;
        double y = object.has("y") ? object.get("y").getAsDouble() : .0;
        double w = object.has("w") ? object.get("w").getAsDouble() : .0;
        double h = object.has("h") ? object.get("h").getAsDouble() : .0;
        return new Rectangle(x, y, w, h);
    }

    private static class ColorTypeAdapter implements JsonSerializer<Color>, JsonDeserializer<Color> {

        @Override
        public JsonElement serialize(Color color, Type type, JsonSerializationContext jsonSerializationContext) {
            return new JsonPrimitive(color2String(color));
        }

        @Override
        public Color deserialize(JsonElement jsonElement, Type type, JsonDeserializationContext jsonDeserializationContext) throws JsonParseException {
            return string2Color(jsonElement.getAsString());
        }
    }

    private static class Rect2DTypeAdapter implements JsonSerializer<Rectangle2D>, JsonDeserializer<Rectangle2D> {

        @Override
        public JsonElement serialize(Rectangle2D rectangle2D, Type type, JsonSerializationContext jsonSerializationContext) {
            return toJsonObject(rectangle2D);
        }

        @Override
        public Rectangle2D deserialize(JsonElement jsonElement, Type type, JsonDeserializationContext jsonDeserializationContext) throws JsonParseException {
            return fromJsonObject(jsonElement.getAsJsonObject());
        }

    }

    public static final Gson DEFAULT = new GsonBuilder()
            .registerTypeAdapter(Color.class, new ColorTypeAdapter())
            .registerTypeAdapter(Rectangle2D.class, new Rect2DTypeAdapter())
            .registerTypeAdapter(Rectangle.class, new Rect2DTypeAdapter())
            .serializeSpecialFloatingPointValues()
            .create();

    public static final Gson PRETTY = DEFAULT.newBuilder()
            .setPrettyPrinting()
            .create();

}
