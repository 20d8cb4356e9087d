package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Excel text extraction for XLS and XLSX. Each sheet is rendered as its name followed by one
 * tab-separated line per non-empty row, using the cell's displayed value.
 */
@Component
public class SpreadsheetDocumentParser implements BinaryDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetDocumentParser.class);

    @Override
    public boolean supports(ContentClass contentClass) {
        return contentClass == ContentClass.XLSX || contentClass == ContentClass.XLS;
    }

    @Override
    public ParsedDocument parse(byte[] content, ContentClass contentClass) throws DocumentParseException {
        if (!supports(contentClass)) {
            throw new DocumentParseException("Unsupported document class: " + contentClass);
        }
        if (content == null || content.length == 0) {
            throw new DocumentParseException("Empty " + contentClass + " document");
        }

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            DataFormatter formatter = new DataFormatter();
            StringBuilder text = new StringBuilder();

            for (Sheet sheet : workbook) {
                text.append(sheet.getSheetName()).append('\n');
                for (Row row : sheet) {
                    String line = renderRow(row, formatter);
                    if (!line.isBlank()) {
                        text.append(line).append('\n');
                    }
                }
                text.append('\n');
            }

            logger.debug("Parsed {}: {} sheets, {} chars", contentClass, workbook.getNumberOfSheets(), text.length());
            return new ParsedDocument(text.toString().trim(), workbook.getNumberOfSheets(), false);

        } catch (IOException | RuntimeException e) {
            // POI reports malformed files through both checked and unchecked exceptions
            throw new DocumentParseException(contentClass + " extraction failed: " + e.getMessage(), e);
        }
    }

    private static String renderRow(Row row, DataFormatter formatter) {
        List<String> cells = new ArrayList<>();
        for (Cell cell : row) {
            String value = formatter.formatCellValue(cell).trim();
            if (!value.isEmpty()) {
                cells.add(value);
            }
        }
        return String.join("\t", cells);
    }
}
