package com.abcft.pdfedit.core.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Typed lookups over string parameter maps.
 */
public final class MapUtils {

    private static final Logger LOGGER = LogManager.getLogger();

    private MapUtils() {}

    public static String getString(Map<String, String> params, String key, String defaultValue) {
        if (null == params) {
            return defaultValue;
        }
        String value = params.get(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public static int getInt(Map<String, String> params, String key, int defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid int value for {}: {}", key, value);
            return defaultValue;
        }
    }

    public static float getFloat(Map<String, String> params, String key, float defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid float value for {}: {}", key, value);
            return defaultValue;
        }
    }

    public static boolean getBoolean(Map<String, String> params, String key, boolean defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        if (StringUtils.equalsAnyIgnoreCase(value, "true", "1", "yes", "on")) {
            return true;
        }
        if (StringUtils.equalsAnyIgnoreCase(value, "false", "0", "no", "off")) {
            return false;
        }
        LOGGER.warn("Invalid boolean value for {}: {}", key, value);
        return defaultValue;
    }

    public static <E extends Enum<E>> E getEnum(Map<String, String> params, String key, Class<E> type, E defaultValue) {
        String value = getString(params, key, null);
        if (null == value) {
            return defaultValue;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        LOGGER.warn("Invalid {} value for {}: {}", type.getSimpleName(), key, value);
        return defaultValue;
    }

}
