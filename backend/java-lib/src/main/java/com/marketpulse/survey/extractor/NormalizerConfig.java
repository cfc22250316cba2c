package com.marketpulse.survey.extractor;

import com.marketpulse.survey.ConfigValues;
import com.marketpulse.survey.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matching policy and thresholds for anchor detection, cell parsing, row classification and
 * assembly
 * Defaults are tuned to the household-expenditure export tables; every vocabulary can be replaced.
 */
public final class NormalizerConfig {

    /** Total cell is the last data column */
    public static final int LAST_COLUMN = -1;
    /** Table has no total column; the empty-total rule and checksums are off */
    public static final int NO_TOTAL_COLUMN = -2;

    public static final List<String> DEFAULT_SECTION_KEYWORDS = List.of(
            "consumption", "expenditure", "food", "housing", "dwelling",
            "furniture", "household equipment", "clothing", "footwear",
            "health", "education", "culture", "entertainment",
            "transport", "communications", "miscellaneous");

    public static final List<String> DEFAULT_SECTION_QUALIFIERS = List.of("excl.", "total");

    public static final List<String> DEFAULT_GARBAGE_KEYWORDS = List.of(
            "expenditure", "consumption", "total consumption", "total", "sum", "סך הכל");

    public static final List<String> DEFAULT_TITLE_PATTERNS = List.of(
            "(?i)^\\s*table\\s+\\d+(\\.\\d+)*\\b.*",
            "(?i)^\\s*לוח\\s+\\d+(\\.\\d+)*\\b.*");

    // Source notes such as "From a supermarket chain survey"
    public static final List<String> DEFAULT_FOOTNOTE_PATTERNS = List.of("(?i)from\\s.*chain.*");

    public static final List<String> DEFAULT_SUPPRESSED_MARKERS = List.of("..", "-");

    public static final String ERROR_MARGIN_MARKER = "±";

    private final int anchorMaxScanRows;
    private final int defaultAnchorRow;
    private final int minHeaderCells;
    private final Set<String> sectionKeywords;
    private final Set<String> sectionQualifiers;
    private final int sectionMaxWords;
    private final int detailMinWords;
    private final Set<String> garbageKeywords;
    private final List<Pattern> titlePatterns;
    private final List<Pattern> footnotePatterns;
    private final Set<String> suppressedMarkers;
    private final int labelColumnIndex;
    private final String labelColumnName;
    private final int totalColumn;
    private final ChecksumMode checksumMode;
    private final double checksumTolerance;
    private final List<String> columnNames;
    private final boolean parallel;

    private NormalizerConfig(Builder builder) {
        this.anchorMaxScanRows = builder.anchorMaxScanRows;
        this.defaultAnchorRow = builder.defaultAnchorRow;
        this.minHeaderCells = builder.minHeaderCells;
        this.sectionKeywords = lowerCased(builder.sectionKeywords);
        this.sectionQualifiers = lowerCased(builder.sectionQualifiers);
        this.sectionMaxWords = builder.sectionMaxWords;
        this.detailMinWords = builder.detailMinWords;
        this.garbageKeywords = lowerCased(builder.garbageKeywords);
        this.titlePatterns = compile(builder.titlePatterns);
        this.footnotePatterns = compile(builder.footnotePatterns);
        this.suppressedMarkers = Set.copyOf(builder.suppressedMarkers);
        this.labelColumnIndex = builder.labelColumnIndex;
        this.labelColumnName = builder.labelColumnName;
        this.totalColumn = builder.totalColumn;
        this.checksumMode = builder.checksumMode;
        this.checksumTolerance = builder.checksumTolerance;
        this.columnNames = List.copyOf(builder.columnNames);
        this.parallel = builder.parallel;
    }

    public static NormalizerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read settings from properties, keeping defaults for absent keys
     *
     * @param properties the settings, e.g. loaded from survey-pipeline.properties
     * @return the validated configuration
     * @throws InvalidConfigurationException if a value cannot be parsed or is out of range
     */
    public static NormalizerConfig fromProperties(Properties properties) {
        Builder builder = builder()
                .anchorMaxScanRows(ConfigValues.getInt(properties, "anchor.maxScanRows", 20))
                .defaultAnchorRow(ConfigValues.getInt(properties, "anchor.defaultRow", 7))
                .minHeaderCells(ConfigValues.getInt(properties, "anchor.minHeaderCells", 5))
                .sectionMaxWords(ConfigValues.getInt(properties, "classifier.sectionMaxWords", 3))
                .detailMinWords(ConfigValues.getInt(properties, "classifier.detailMinWords", 7))
                .checksumTolerance(ConfigValues.getDouble(properties, "checksum.tolerance", 2.0))
                .parallel(ConfigValues.getBoolean(properties, "extract.parallel", false));

        List<String> sections = ConfigValues.getList(properties, "classifier.sectionKeywords", ",");
        if (sections != null) {
            builder.sectionKeywords(sections);
        }
        List<String> qualifiers = ConfigValues.getList(properties, "classifier.sectionQualifiers", ",");
        if (qualifiers != null) {
            builder.sectionQualifiers(qualifiers);
        }
        List<String> garbage = ConfigValues.getList(properties, "classifier.garbageKeywords", ",");
        if (garbage != null) {
            builder.garbageKeywords(garbage);
        }
        List<String> titles = ConfigValues.getList(properties, "classifier.titlePatterns", ";");
        if (titles != null) {
            builder.titlePatterns(titles);
        }
        List<String> footnotes = ConfigValues.getList(properties, "classifier.footnotePatterns", ";");
        if (footnotes != null) {
            builder.footnotePatterns(footnotes);
        }
        List<String> suppressed = ConfigValues.getList(properties, "cell.suppressedMarkers", "\\s+");
        if (suppressed != null) {
            builder.suppressedMarkers(suppressed);
        }
        List<String> names = ConfigValues.getList(properties, "table.columnNames", ",");
        if (names != null) {
            builder.columnNames(names);
        }
        String labelName = properties.getProperty("table.labelColumnName");
        if (labelName != null && !labelName.isBlank()) {
            builder.labelColumnName(labelName.strip());
        }
        builder.labelColumnIndex(ConfigValues.getInt(properties, "table.labelColumn", 0));

        String total = properties.getProperty("table.totalColumn");
        if (total != null && !total.isBlank()) {
            String value = total.strip().toLowerCase(Locale.ROOT);
            if (value.equals("last")) {
                builder.totalColumn(LAST_COLUMN);
            } else if (value.equals("none")) {
                builder.totalColumn(NO_TOTAL_COLUMN);
            } else {
                builder.totalColumn(ConfigValues.getInt(properties, "table.totalColumn", LAST_COLUMN));
            }
        }
        String mode = properties.getProperty("checksum.mode");
        if (mode != null) {
            builder.checksumMode(ConfigValues.parseEnum(ChecksumMode.class, mode, "checksum.mode"));
        }
        return builder.build();
    }

    private static Set<String> lowerCased(List<String> values) {
        Set<String> set = new LinkedHashSet<>();
        for (String value : values) {
            set.add(value.strip().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(set);
    }

    private static List<Pattern> compile(List<String> regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new InvalidConfigurationException("Invalid label pattern: " + regex, e);
            }
        }
        return List.copyOf(patterns);
    }

    public int getAnchorMaxScanRows() {
        return anchorMaxScanRows;
    }

    public int getDefaultAnchorRow() {
        return defaultAnchorRow;
    }

    public int getMinHeaderCells() {
        return minHeaderCells;
    }

    public Set<String> getSectionKeywords() {
        return sectionKeywords;
    }

    public Set<String> getSectionQualifiers() {
        return sectionQualifiers;
    }

    public int getSectionMaxWords() {
        return sectionMaxWords;
    }

    public int getDetailMinWords() {
        return detailMinWords;
    }

    public Set<String> getGarbageKeywords() {
        return garbageKeywords;
    }

    public List<Pattern> getTitlePatterns() {
        return titlePatterns;
    }

    public List<Pattern> getFootnotePatterns() {
        return footnotePatterns;
    }

    public Set<String> getSuppressedMarkers() {
        return suppressedMarkers;
    }

    public int getLabelColumnIndex() {
        return labelColumnIndex;
    }

    public String getLabelColumnName() {
        return labelColumnName;
    }

    /**
     * Index of the total cell among a row's value cells, {@link #LAST_COLUMN} or
     * {@link #NO_TOTAL_COLUMN}
     */
    public int getTotalColumn() {
        return totalColumn;
    }

    public boolean hasTotalColumn() {
        return totalColumn != NO_TOTAL_COLUMN;
    }

    /**
     * Resolve the total cell position for rows with the given number of value cells
     *
     * @return the index, or -1 when the table has no total column or the row is too short
     */
    public int resolveTotalIndex(int valueCellCount) {
        if (totalColumn == NO_TOTAL_COLUMN || valueCellCount == 0) {
            return -1;
        }
        if (totalColumn == LAST_COLUMN) {
            return valueCellCount - 1;
        }
        return totalColumn < valueCellCount ? totalColumn : -1;
    }

    public ChecksumMode getChecksumMode() {
        return checksumMode;
    }

    public double getChecksumTolerance() {
        return checksumTolerance;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public boolean isParallel() {
        return parallel;
    }

    @Override
    public String toString() {
        return String.format(
                "NormalizerConfig{scanRows=%d, defaultAnchor=%d, totalColumn=%d, checksum=%s, tolerance=%.2f}",
                anchorMaxScanRows, defaultAnchorRow, totalColumn, checksumMode, checksumTolerance);
    }

    public static final class Builder {
        private int anchorMaxScanRows = 20;
        private int defaultAnchorRow = 7;
        private int minHeaderCells = 5;
        private List<String> sectionKeywords = DEFAULT_SECTION_KEYWORDS;
        private List<String> sectionQualifiers = DEFAULT_SECTION_QUALIFIERS;
        private int sectionMaxWords = 3;
        private int detailMinWords = 7;
        private List<String> garbageKeywords = DEFAULT_GARBAGE_KEYWORDS;
        private List<String> titlePatterns = DEFAULT_TITLE_PATTERNS;
        private List<String> footnotePatterns = DEFAULT_FOOTNOTE_PATTERNS;
        private List<String> suppressedMarkers = DEFAULT_SUPPRESSED_MARKERS;
        private int labelColumnIndex = 0;
        private String labelColumnName = "category";
        private int totalColumn = LAST_COLUMN;
        private ChecksumMode checksumMode = ChecksumMode.NONE;
        private double checksumTolerance = 2.0;
        private List<String> columnNames = List.of();
        private boolean parallel;

        private Builder() {
        }

        public Builder anchorMaxScanRows(int anchorMaxScanRows) {
            this.anchorMaxScanRows = anchorMaxScanRows;
            return this;
        }

        public Builder defaultAnchorRow(int defaultAnchorRow) {
            this.defaultAnchorRow = defaultAnchorRow;
            return this;
        }

        public Builder minHeaderCells(int minHeaderCells) {
            this.minHeaderCells = minHeaderCells;
            return this;
        }

        public Builder sectionKeywords(List<String> sectionKeywords) {
            this.sectionKeywords = List.copyOf(sectionKeywords);
            return this;
        }

        public Builder sectionQualifiers(List<String> sectionQualifiers) {
            this.sectionQualifiers = List.copyOf(sectionQualifiers);
            return this;
        }

        public Builder sectionMaxWords(int sectionMaxWords) {
            this.sectionMaxWords = sectionMaxWords;
            return this;
        }

        public Builder detailMinWords(int detailMinWords) {
            this.detailMinWords = detailMinWords;
            return this;
        }

        public Builder garbageKeywords(List<String> garbageKeywords) {
            this.garbageKeywords = List.copyOf(garbageKeywords);
            return this;
        }

        public Builder titlePatterns(List<String> titlePatterns) {
            this.titlePatterns = List.copyOf(titlePatterns);
            return this;
        }

        public Builder footnotePatterns(List<String> footnotePatterns) {
            this.footnotePatterns = List.copyOf(footnotePatterns);
            return this;
        }

        public Builder suppressedMarkers(List<String> suppressedMarkers) {
            this.suppressedMarkers = List.copyOf(suppressedMarkers);
            return this;
        }

        public Builder labelColumnIndex(int labelColumnIndex) {
            this.labelColumnIndex = labelColumnIndex;
            return this;
        }

        public Builder labelColumnName(String labelColumnName) {
            this.labelColumnName = labelColumnName;
            return this;
        }

        public Builder totalColumn(int totalColumn) {
            this.totalColumn = totalColumn;
            return this;
        }

        public Builder checksumMode(ChecksumMode checksumMode) {
            this.checksumMode = checksumMode;
            return this;
        }

        public Builder checksumTolerance(double checksumTolerance) {
            this.checksumTolerance = checksumTolerance;
            return this;
        }

        public Builder columnNames(List<String> columnNames) {
            this.columnNames = List.copyOf(columnNames);
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * @throws InvalidConfigurationException if a threshold is out of range
         */
        public NormalizerConfig build() {
            if (anchorMaxScanRows <= 0) {
                throw new InvalidConfigurationException("anchorMaxScanRows must be positive: " + anchorMaxScanRows);
            }
            if (defaultAnchorRow < 0) {
                throw new InvalidConfigurationException("defaultAnchorRow must not be negative: " + defaultAnchorRow);
            }
            if (minHeaderCells <= 0) {
                throw new InvalidConfigurationException("minHeaderCells must be positive: " + minHeaderCells);
            }
            if (sectionMaxWords <= 0 || detailMinWords <= 0) {
                throw new InvalidConfigurationException("Word-count thresholds must be positive");
            }
            if (labelColumnIndex < 0) {
                throw new InvalidConfigurationException("labelColumnIndex must not be negative: " + labelColumnIndex);
            }
            if (labelColumnName == null || labelColumnName.isBlank()) {
                throw new InvalidConfigurationException("labelColumnName must not be blank");
            }
            if (totalColumn < NO_TOTAL_COLUMN) {
                throw new InvalidConfigurationException("Invalid totalColumn: " + totalColumn);
            }
            if (checksumMode == null) {
                throw new InvalidConfigurationException("checksumMode must not be null");
            }
            if (checksumMode != ChecksumMode.NONE && totalColumn == NO_TOTAL_COLUMN) {
                throw new InvalidConfigurationException("Checksum mode " + checksumMode + " needs a total column");
            }
            if (!Double.isFinite(checksumTolerance) || checksumTolerance < 0) {
                throw new InvalidConfigurationException("checksumTolerance must be a non-negative number: "
                        + checksumTolerance);
            }
            return new NormalizerConfig(this);
        }
    }
}
