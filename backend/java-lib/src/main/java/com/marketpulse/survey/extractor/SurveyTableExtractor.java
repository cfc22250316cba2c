package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.ClassifiedRow;
import com.marketpulse.survey.model.NormalizedCell;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.RawGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Normalizes household-survey export sheets into flat, leveled tables
 * Runs anchor detection, cell normalization, row classification and assembly. Every
 * condition short of a configuration error degrades to an annotated or dropped row.
 */
public class SurveyTableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SurveyTableExtractor.class);

    private final NormalizerConfig config;
    private final TableLocator locator;
    private final CellNormalizer cellNormalizer;
    private final RowClassifier classifier;
    private final HeaderResolver headerResolver;
    private final TableAssembler assembler;

    public SurveyTableExtractor(NormalizerConfig config) {
        this.config = config;
        this.locator = new TableLocator(config);
        this.cellNormalizer = new CellNormalizer(config);
        this.classifier = new RowClassifier(config);
        this.headerResolver = new HeaderResolver(config);
        this.assembler = new TableAssembler(config);
    }

    public SurveyTableExtractor() {
        this(NormalizerConfig.defaults());
    }

    /**
     * Normalize one sheet
     *
     * @param grid the raw sheet
     * @return anchor, classified rows and the assembled table
     */
    public ExtractionResult extract(RawGrid grid) {
        Anchor anchor = locator.detectAnchorRow(grid);
        int anchorRow = anchor.getRowIndex();
        int labelIndex = config.getLabelColumnIndex();
        int valueCount = grid.getColumnCount() - (labelIndex < grid.getColumnCount() ? 1 : 0);

        Object[] header = anchorRow < grid.getRowCount() ? grid.getRow(anchorRow) : null;
        List<String> columnNames = headerResolver.resolve(header, valueCount);

        IntStream dataRows = IntStream.range(Math.min(anchorRow + 1, grid.getRowCount()), grid.getRowCount());
        if (config.isParallel()) {
            dataRows = dataRows.parallel();
        }
        List<ClassifiedRow> classified = dataRows
                .mapToObj(r -> classify(grid, r))
                .collect(Collectors.toList());

        NormalizedTable table = assembler.assemble(classified, columnNames, grid.getSheetName());
        ExtractionResult result = new ExtractionResult(anchor, table, classified);
        logger.info("Extracted sheet '{}': {}", grid.getSheetName(), result);
        return result;
    }

    /**
     * Normalize every sheet of a workbook
     *
     * @param workbook the xls/xlsx/ods content
     * @param fileName the original file name, used for format detection
     * @return one result per sheet, in workbook order
     * @throws IOException if the workbook cannot be read
     */
    public List<ExtractionResult> extractWorkbook(byte[] workbook, String fileName) throws IOException {
        List<ExtractionResult> results = new ArrayList<>();
        for (RawGrid grid : new SpreadsheetGridReader().read(workbook, fileName)) {
            results.add(extract(grid));
        }
        return results;
    }

    private ClassifiedRow classify(RawGrid grid, int row) {
        Object labelCell = grid.getCell(row, config.getLabelColumnIndex());
        String label = RawGrid.isEmptyCell(labelCell) ? "" : labelCell.toString();
        List<NormalizedCell> cells = cellNormalizer.normalizeValues(grid.getRow(row), config.getLabelColumnIndex());
        return classifier.classifyRow(row, label, cells);
    }
}
