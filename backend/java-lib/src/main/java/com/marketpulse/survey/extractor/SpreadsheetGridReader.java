package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.RawGrid;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.ToHTMLContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads spreadsheet workbooks into raw grids using Apache Tika
 * Tika renders each sheet as an HTML table preceded by the sheet name; every table becomes
 * one {@link RawGrid}. Cell text is kept as rendered, number parsing is left to
 * {@link CellNormalizer}.
 */
public class SpreadsheetGridReader {
    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetGridReader.class);

    private static final Pattern SHEET_OR_TABLE = Pattern.compile(
            "<h1[^>]*>(.*?)</h1>|<table(?:\\s[^>]*)?>(.*?)</table>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern ROW = Pattern.compile(
            "<tr(?:\\s[^>]*)?>(.*?)</tr>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL = Pattern.compile(
            "<t[hd](?:\\s[^>]*?)?/>|<t[hd](?:\\s[^>]*)?>(.*?)</t[hd]>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(?:[xX]([0-9a-fA-F]{1,6})|([0-9]{1,7}));");

    private final Parser parser;

    public SpreadsheetGridReader() {
        this.parser = new AutoDetectParser();
    }

    /**
     * Read every sheet of a workbook
     *
     * @param content  the workbook content as byte array
     * @param fileName the original filename, used for type detection
     * @return one grid per sheet, in workbook order
     * @throws IOException if the workbook is empty, corrupted or in an unsupported format
     */
    public List<RawGrid> read(byte[] content, String fileName) throws IOException {
        if (content == null || content.length == 0) {
            throw new IOException("Spreadsheet processing failed: content is null or empty for file: " + fileName);
        }

        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
        ParseContext parseContext = new ParseContext();
        parseContext.set(Parser.class, parser);
        ToHTMLContentHandler htmlHandler = new ToHTMLContentHandler();

        try (InputStream inputStream = new ByteArrayInputStream(content)) {
            parser.parse(inputStream, htmlHandler, metadata, parseContext);
        } catch (SAXException | TikaException e) {
            throw new IOException(
                    String.format("Spreadsheet processing failed for file '%s': %s. "
                            + "The workbook may be corrupted, password-protected, or in an unsupported format.",
                            fileName, e.getMessage()),
                    e);
        }

        List<RawGrid> grids = parseHtmlTables(htmlHandler.toString());
        logger.info("Read {} sheets from '{}' (content type {})", grids.size(), fileName,
                metadata.get(Metadata.CONTENT_TYPE));
        return grids;
    }

    /**
     * Turn Tika's HTML rendering into grids, naming each after the heading that precedes it
     */
    static List<RawGrid> parseHtmlTables(String html) {
        List<RawGrid> grids = new ArrayList<>();
        String sheetName = null;

        Matcher matcher = SHEET_OR_TABLE.matcher(html);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                sheetName = cellText(matcher.group(1));
                continue;
            }
            Object[][] cells = parseRows(matcher.group(2));
            if (cells.length == 0) {
                continue;
            }
            String name = sheetName != null ? sheetName : "Sheet " + (grids.size() + 1);
            grids.add(new RawGrid(cells, name));
            sheetName = null;
        }
        return grids;
    }

    private static Object[][] parseRows(String tableHtml) {
        List<Object[]> rows = new ArrayList<>();
        Matcher rowMatcher = ROW.matcher(tableHtml);
        while (rowMatcher.find()) {
            List<Object> cells = new ArrayList<>();
            Matcher cellMatcher = CELL.matcher(rowMatcher.group(1));
            while (cellMatcher.find()) {
                String content = cellMatcher.group(1);
                String text = content != null ? cellText(content) : "";
                cells.add(text.isEmpty() ? null : text);
            }
            rows.add(cells.toArray());
        }
        return rows.toArray(new Object[0][]);
    }

    private static String cellText(String html) {
        String text = TAG.matcher(html).replaceAll(" ");
        return decodeEntities(text).replaceAll("\\s+", " ").strip();
    }

    private static String decodeEntities(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuilder decoded = new StringBuilder();
        while (matcher.find()) {
            int codePoint = matcher.group(1) != null
                    ? Integer.parseInt(matcher.group(1), 16)
                    : Integer.parseInt(matcher.group(2));
            String replacement = Character.isValidCodePoint(codePoint)
                    ? new String(Character.toChars(codePoint))
                    : matcher.group();
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(decoded);
        return decoded.toString()
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
    }
}
