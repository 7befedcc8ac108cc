package io.github.yok.tablemailer.core;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Renders a {@link TabularDocument} as an XLSX workbook with a single sheet named
 * {@value #SHEET_NAME}.
 *
 * <p>
 * Column {@code c} and document row {@code r} (1-based, header = row 1) land in the A1-style cell
 * at column {@code c}, row {@code r}. Every cell is a string cell.
 * </p>
 *
 * <p>
 * Output is byte-for-byte reproducible: the creation timestamp in the package properties is pinned
 * to the epoch, and the ZIP package is re-streamed with every entry stamped with the same fixed
 * modification time. Writing an unchanged document twice yields identical bytes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class WorkbookWriter {

    /**
     * Name of the only worksheet.
     */
    public static final String SHEET_NAME = "Sheet1";

    /**
     * MIME type of the produced file.
     */
    public static final String XLSX_MIME_TYPE =
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private static final Date FIXED_CREATED = new Date(0L);

    // Earliest instant a ZIP (DOS) header can store
    private static final long FIXED_ENTRY_TIME =
            LocalDateTime.of(1980, 1, 1, 0, 0).atZone(ZoneId.systemDefault()).toInstant()
                    .toEpochMilli();

    /**
     * Writes the document to XLSX bytes.
     *
     * @param document document to render
     * @return XLSX bytes
     * @throws TableExportException if the workbook cannot be written
     */
    public byte[] write(TabularDocument document) throws TableExportException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
                ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSSFSheet sheet = workbook.createSheet(SHEET_NAME);

            // Header: spreadsheet row 1
            writeRow(sheet, 0, document.getColumns());

            // Data: spreadsheet rows 2..n+1
            int rowIndex = 1;
            for (List<String> row : document.getRows()) {
                writeRow(sheet, rowIndex++, row);
            }

            workbook.setActiveSheet(0);
            workbook.getProperties().getCoreProperties().setCreated(Optional.of(FIXED_CREATED));
            workbook.write(out);

            byte[] bytes = normalizeEntryTimes(out.toByteArray());
            log.debug("Table[{}] Workbook written. bytes={}", document.getRelationName(),
                    bytes.length);
            return bytes;
        } catch (IOException e) {
            log.error("Table[{}] Failed to write workbook: {}", document.getRelationName(),
                    e.getMessage());
            throw new TableExportException(document.getRelationName(),
                    "Failed to write workbook for table " + document.getRelationName(), e);
        }
    }

    private void writeRow(XSSFSheet sheet, int rowIndex, List<String> cells) {
        XSSFRow row = sheet.createRow(rowIndex);
        for (int col = 0; col < cells.size(); col++) {
            row.createCell(col).setCellValue(cells.get(col));
        }
    }

    /**
     * Rewrites the ZIP package so that every entry carries the same fixed modification time. Entry order,
     * names and contents are preserved.
     *
     * @param packageBytes ZIP package written by POI
     * @return the same package with normalized entry timestamps
     * @throws IOException if the package cannot be read or written
     */
    static byte[] normalizeEntryTimes(byte[] packageBytes) throws IOException {
        ByteArrayOutputStream normalized = new ByteArrayOutputStream(packageBytes.length);
        try (ZipArchiveInputStream in =
                new ZipArchiveInputStream(new ByteArrayInputStream(packageBytes));
                ZipArchiveOutputStream zip = new ZipArchiveOutputStream(normalized)) {
            ZipArchiveEntry source;
            while ((source = in.getNextZipEntry()) != null) {
                ZipArchiveEntry entry = new ZipArchiveEntry(source.getName());
                entry.setTime(FIXED_ENTRY_TIME);
                zip.putArchiveEntry(entry);
                in.transferTo(zip);
                zip.closeArchiveEntry();
            }
            zip.finish();
        }
        return normalized.toByteArray();
    }
}
