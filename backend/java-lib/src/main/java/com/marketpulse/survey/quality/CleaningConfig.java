package com.marketpulse.survey.quality;

import com.marketpulse.survey.ConfigValues;
import com.marketpulse.survey.InvalidConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Policy for quality analysis and the cleaning stages
 */
public final class CleaningConfig {
    private static final String DEFAULT_PREFIX = "cleaning.default.";

    private final MissingStrategy missingStrategy;
    private final Map<String, Object> fillDefaults;
    private final List<String> requiredColumns;
    private final List<String> duplicateKeyColumns;
    private final KeepPolicy keepPolicy;
    private final OutlierMethod outlierMethod;
    private final List<String> outlierColumns;
    private final double outlierMultiplier;
    private final boolean handleMissing;
    private final boolean removeDuplicates;
    private final boolean handleOutliers;

    private CleaningConfig(Builder builder) {
        this.missingStrategy = builder.missingStrategy;
        this.fillDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fillDefaults));
        this.requiredColumns = List.copyOf(builder.requiredColumns);
        this.duplicateKeyColumns = List.copyOf(builder.duplicateKeyColumns);
        this.keepPolicy = builder.keepPolicy;
        this.outlierMethod = builder.outlierMethod;
        this.outlierColumns = List.copyOf(builder.outlierColumns);
        this.outlierMultiplier = builder.outlierMultiplier;
        this.handleMissing = builder.handleMissing;
        this.removeDuplicates = builder.removeDuplicates;
        this.handleOutliers = builder.handleOutliers;
    }

    public static CleaningConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read settings from properties, keeping defaults for absent keys
     * Per-column fill defaults are given as cleaning.default.&lt;column&gt;=value.
     *
     * @throws InvalidConfigurationException for unknown strategy, method or keep names and
     *                                       out-of-range numbers
     */
    public static CleaningConfig fromProperties(Properties properties) {
        Builder builder = builder()
                .outlierMultiplier(ConfigValues.getDouble(properties, "cleaning.outlierMultiplier", 1.5))
                .handleMissing(ConfigValues.getBoolean(properties, "cleaning.stages.missing", true))
                .removeDuplicates(ConfigValues.getBoolean(properties, "cleaning.stages.duplicates", true))
                .handleOutliers(ConfigValues.getBoolean(properties, "cleaning.stages.outliers", true));

        String strategy = properties.getProperty("cleaning.missingStrategy");
        if (strategy != null) {
            builder.missingStrategy(MissingStrategy.fromName(strategy));
        }
        String keep = properties.getProperty("cleaning.keep");
        if (keep != null) {
            builder.keepPolicy(KeepPolicy.fromName(keep));
        }
        String method = properties.getProperty("cleaning.outlierMethod");
        if (method != null) {
            builder.outlierMethod(OutlierMethod.fromName(method));
        }
        List<String> keys = ConfigValues.getList(properties, "cleaning.duplicateKeyColumns", ",");
        if (keys != null) {
            builder.duplicateKeyColumns(keys);
        }
        List<String> outlierColumns = ConfigValues.getList(properties, "cleaning.outlierColumns", ",");
        if (outlierColumns != null) {
            builder.outlierColumns(outlierColumns);
        }
        List<String> required = ConfigValues.getList(properties, "cleaning.requiredColumns", ",");
        if (required != null) {
            builder.requiredColumns(required);
        }

        Map<String, Object> defaults = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(DEFAULT_PREFIX) && key.length() > DEFAULT_PREFIX.length()) {
                defaults.put(key.substring(DEFAULT_PREFIX.length()), properties.getProperty(key));
            }
        }
        if (!defaults.isEmpty()) {
            builder.fillDefaults(defaults);
        }
        return builder.build();
    }

    public MissingStrategy getMissingStrategy() {
        return missingStrategy;
    }

    public Map<String, Object> getFillDefaults() {
        return fillDefaults;
    }

    public List<String> getRequiredColumns() {
        return requiredColumns;
    }

    public List<String> getDuplicateKeyColumns() {
        return duplicateKeyColumns;
    }

    public KeepPolicy getKeepPolicy() {
        return keepPolicy;
    }

    public OutlierMethod getOutlierMethod() {
        return outlierMethod;
    }

    public List<String> getOutlierColumns() {
        return outlierColumns;
    }

    public double getOutlierMultiplier() {
        return outlierMultiplier;
    }

    public boolean isHandleMissing() {
        return handleMissing;
    }

    public boolean isRemoveDuplicates() {
        return removeDuplicates;
    }

    public boolean isHandleOutliers() {
        return handleOutliers;
    }

    @Override
    public String toString() {
        return String.format("CleaningConfig{missing=%s, keep=%s, outliers=%s, multiplier=%.2f, keys=%s}",
                missingStrategy, keepPolicy, outlierMethod, outlierMultiplier, duplicateKeyColumns);
    }

    public static final class Builder {
        private MissingStrategy missingStrategy = MissingStrategy.SMART;
        private Map<String, Object> fillDefaults = Map.of();
        private List<String> requiredColumns = List.of();
        private List<String> duplicateKeyColumns = List.of();
        private KeepPolicy keepPolicy = KeepPolicy.FIRST;
        private OutlierMethod outlierMethod = OutlierMethod.CAP;
        private List<String> outlierColumns = List.of();
        private double outlierMultiplier = 1.5;
        private boolean handleMissing = true;
        private boolean removeDuplicates = true;
        private boolean handleOutliers = true;

        private Builder() {
        }

        public Builder missingStrategy(MissingStrategy missingStrategy) {
            this.missingStrategy = missingStrategy;
            return this;
        }

        public Builder fillDefaults(Map<String, Object> fillDefaults) {
            this.fillDefaults = new LinkedHashMap<>(fillDefaults);
            return this;
        }

        public Builder requiredColumns(List<String> requiredColumns) {
            this.requiredColumns = List.copyOf(requiredColumns);
            return this;
        }

        public Builder duplicateKeyColumns(List<String> duplicateKeyColumns) {
            this.duplicateKeyColumns = List.copyOf(duplicateKeyColumns);
            return this;
        }

        public Builder keepPolicy(KeepPolicy keepPolicy) {
            this.keepPolicy = keepPolicy;
            return this;
        }

        public Builder outlierMethod(OutlierMethod outlierMethod) {
            this.outlierMethod = outlierMethod;
            return this;
        }

        public Builder outlierColumns(List<String> outlierColumns) {
            this.outlierColumns = List.copyOf(outlierColumns);
            return this;
        }

        public Builder outlierMultiplier(double outlierMultiplier) {
            this.outlierMultiplier = outlierMultiplier;
            return this;
        }

        public Builder handleMissing(boolean handleMissing) {
            this.handleMissing = handleMissing;
            return this;
        }

        public Builder removeDuplicates(boolean removeDuplicates) {
            this.removeDuplicates = removeDuplicates;
            return this;
        }

        public Builder handleOutliers(boolean handleOutliers) {
            this.handleOutliers = handleOutliers;
            return this;
        }

        /**
         * @throws InvalidConfigurationException if a policy is missing or out of range
         */
        public CleaningConfig build() {
            if (missingStrategy == null || keepPolicy == null || outlierMethod == null) {
                throw new InvalidConfigurationException("Missing strategy, keep policy and outlier method are required");
            }
            OutlierBounds.requireValidMultiplier(outlierMultiplier);
            if (handleMissing && missingStrategy == MissingStrategy.FILL_DEFAULT && fillDefaults.isEmpty()) {
                throw new InvalidConfigurationException("FILL_DEFAULT needs at least one per-column default");
            }
            return new CleaningConfig(this);
        }
    }
}
