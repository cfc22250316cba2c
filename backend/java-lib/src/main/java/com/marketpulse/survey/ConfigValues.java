package com.marketpulse.survey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Parsing helpers for configuration read from {@link Properties}
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    /**
     * Resolve an enum constant by name, ignoring case and treating '-' like '_'
     *
     * @param type    the enum class
     * @param name    the configured name
     * @param setting the setting the name came from, used in the error message
     * @return the matching constant
     * @throws InvalidConfigurationException if the name matches no constant
     */
    public static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String setting) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException(
                    String.format("Missing value for '%s'; expected one of %s", setting,
                            Arrays.toString(type.getEnumConstants())));
        }
        String normalized = name.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        throw new InvalidConfigurationException(
                String.format("Unknown value '%s' for '%s'; expected one of %s", name, setting,
                        Arrays.toString(type.getEnumConstants())));
    }

    public static int getInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    String.format("Setting '%s' must be an integer but was '%s'", key, raw), e);
        }
    }

    public static double getDouble(Properties properties, String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.strip());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    String.format("Setting '%s' must be a number but was '%s'", key, raw), e);
        }
    }

    public static boolean getBoolean(Properties properties, String key, boolean defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String value = raw.strip().toLowerCase(Locale.ROOT);
        if (value.equals("true")) {
            return true;
        }
        if (value.equals("false")) {
            return false;
        }
        throw new InvalidConfigurationException(
                String.format("Setting '%s' must be true or false but was '%s'", key, raw));
    }

    /**
     * Split a delimited list, trimming entries and skipping blanks
     * Returns null when the key is absent so callers can keep their defaults.
     */
    public static List<String> getList(Properties properties, String key, String delimiterRegex) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (String part : raw.split(delimiterRegex)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }
}
