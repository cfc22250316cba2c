package com.marketpulse.survey.quality;

import com.marketpulse.survey.model.NormalizedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Analyze, clean with every enabled stage, then analyze the result again
 */
public class QualityPipeline {
    private static final Logger logger = LoggerFactory.getLogger(QualityPipeline.class);

    private final CleaningConfig config;
    private final QualityAnalyzer analyzer;
    private final QualityCleaner cleaner;

    public QualityPipeline(CleaningConfig config) {
        this.config = config != null ? config : CleaningConfig.defaults();
        this.analyzer = new QualityAnalyzer(this.config);
        this.cleaner = new QualityCleaner();
    }

    public QualityPipeline() {
        this(null);
    }

    public static QualityReport run(NormalizedTable table, CleaningConfig config) {
        return new QualityPipeline(config).run(table);
    }

    public QualityReport run(NormalizedTable table) {
        QualityAssessment before = analyzer.analyze(table);
        CleaningResult cleaned = cleaner.clean(table, config);
        QualityAssessment after = analyzer.analyze(cleaned.getTable());
        QualityReport report = new QualityReport(before, after, cleaned);
        logger.info("Quality pipeline for table '{}': score {} -> {}, rows {} -> {}", table.getName(),
                String.format(Locale.ROOT, "%.2f", before.getScore().getOverall()),
                String.format(Locale.ROOT, "%.2f", after.getScore().getOverall()),
                before.getRowCount(), after.getRowCount());
        return report;
    }

    public CleaningConfig getConfig() {
        return config;
    }
}
