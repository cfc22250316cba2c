package com.marketpulse.survey.extractor;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.RawGrid;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives value-column names from the anchor row of a bilingual sheet
 * Quintile headers become q5..q1, total headers become "total", the Latin part of a bilingual
 * header becomes snake_case and anything else falls back to col_n.
 */
public class HeaderResolver {

    private static final Pattern LATIN_WORDS = Pattern.compile("[A-Za-z][A-Za-z0-9&/.'\\- ]*");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private final NormalizerConfig config;

    public HeaderResolver(NormalizerConfig config) {
        this.config = config;
    }

    /**
     * Names for the value columns of a table
     *
     * @param headerRow  the anchor row, or null when the sheet has none
     * @param valueCount number of value columns (all columns except the label column)
     * @return one unique name per value column
     * @throws InvalidConfigurationException if configured names do not fit the table width
     */
    public List<String> resolve(Object[] headerRow, int valueCount) {
        if (!config.getColumnNames().isEmpty()) {
            if (config.getColumnNames().size() != valueCount) {
                throw new InvalidConfigurationException(String.format(
                        "Configured %d column names but the table has %d value columns",
                        config.getColumnNames().size(), valueCount));
            }
            return config.getColumnNames();
        }

        Set<String> used = new HashSet<>();
        used.add(config.getLabelColumnName());
        List<String> names = new ArrayList<>(valueCount);
        int valueIndex = 0;
        int width = headerRow != null ? headerRow.length : 0;
        for (int c = 0; valueIndex < valueCount; c++) {
            if (c == config.getLabelColumnIndex()) {
                continue;
            }
            Object header = c < width ? headerRow[c] : null;
            String name = nameFor(header, valueIndex);
            names.add(unique(name, used));
            valueIndex++;
        }
        return names;
    }

    private static String nameFor(Object header, int valueIndex) {
        String fallback = "col_" + (valueIndex + 1);
        if (RawGrid.isEmptyCell(header)) {
            return fallback;
        }
        String quintile = quintileName(header);
        if (quintile != null) {
            return quintile;
        }
        String text = header.toString().strip();
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("total") || text.contains("סך הכל")) {
            return "total";
        }

        StringBuilder latin = new StringBuilder();
        Matcher matcher = LATIN_WORDS.matcher(text);
        while (matcher.find()) {
            latin.append(' ').append(matcher.group());
        }
        String snake = NON_ALNUM.matcher(latin.toString().toLowerCase(Locale.ROOT)).replaceAll("_");
        snake = snake.replaceAll("^_+|_+$", "");
        return snake.isEmpty() ? fallback : snake;
    }

    private static String quintileName(Object header) {
        String text;
        if (header instanceof Number) {
            double value = ((Number) header).doubleValue();
            if (value != Math.rint(value)) {
                return null;
            }
            text = BigDecimal.valueOf(value).toBigInteger().toString();
        } else {
            text = header.toString().strip();
        }
        return text.matches("[1-5]") ? "q" + text : null;
    }

    private static String unique(String name, Set<String> used) {
        String candidate = name;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = name + "_" + suffix++;
        }
        return candidate;
    }
}
