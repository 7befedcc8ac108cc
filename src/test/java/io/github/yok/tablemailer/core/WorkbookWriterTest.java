package io.github.yok.tablemailer.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class WorkbookWriterTest {

    private final WorkbookWriter target = new WorkbookWriter();

    @Test
    void write_正常ケース_複数行の文書を指定する_Sheet1の1行目にヘッダが書かれること() throws Exception {
        TabularDocument doc = TabularDocument.builder("TEST_01", List.of("ID", "NAME"))
                .addRow(List.of("1", "alpha")).addRow(List.of("2", "NULL")).build();

        byte[] bytes = target.write(doc);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertEquals(1, workbook.getNumberOfSheets());
            assertEquals(WorkbookWriter.SHEET_NAME, workbook.getSheetName(0));
            assertEquals(0, workbook.getActiveSheetIndex());
            XSSFSheet sheet = workbook.getSheetAt(0);
            XSSFRow header = sheet.getRow(0);
            assertEquals("ID", header.getCell(0).getStringCellValue());
            assertEquals("NAME", header.getCell(1).getStringCellValue());
            assertEquals("alpha", sheet.getRow(1).getCell(1).getStringCellValue());
            assertEquals("NULL", sheet.getRow(2).getCell(1).getStringCellValue());
            assertEquals(2, sheet.getLastRowNum());
        }
    }

    @Test
    void write_正常ケース_数値文字列を指定する_文字列セルとして書かれること() throws Exception {
        TabularDocument doc = TabularDocument.builder("T", List.of("AMOUNT"))
                .addRow(List.of("00123")).build();

        byte[] bytes = target.write(doc);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            XSSFSheet sheet = workbook.getSheet(WorkbookWriter.SHEET_NAME);
            assertEquals(CellType.STRING, sheet.getRow(1).getCell(0).getCellType());
            assertEquals("00123", sheet.getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void write_正常ケース_0行の文書を指定する_ヘッダ行のみが書かれること() throws Exception {
        TabularDocument doc = TabularDocument.builder("EMPTY", List.of("A", "B")).build();

        byte[] bytes = target.write(doc);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertNotNull(sheet.getRow(0));
            assertEquals("B", sheet.getRow(0).getCell(1).getStringCellValue());
            assertNull(sheet.getRow(1));
        }
    }

    @Test
    void write_正常ケース_同じ文書を2回書く_作成日時が固定されていること() throws Exception {
        TabularDocument doc = TabularDocument.builder("T", List.of("A")).addRow(List.of("x"))
                .build();

        try (XSSFWorkbook first = new XSSFWorkbook(new ByteArrayInputStream(target.write(doc)));
                XSSFWorkbook second =
                        new XSSFWorkbook(new ByteArrayInputStream(target.write(doc)))) {
            assertEquals(0L, first.getProperties().getCoreProperties().getCreated().getTime());
            assertEquals(first.getProperties().getCoreProperties().getCreated(),
                    second.getProperties().getCoreProperties().getCreated());
            assertEquals(first.getSheetAt(0).getRow(1).getCell(0).getStringCellValue(),
                    second.getSheetAt(0).getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void write_正常ケース_同じ文書を2秒以上空けて2回書く_バイト列が一致すること() throws Exception {
        TabularDocument doc = TabularDocument.builder("TEST_01", List.of("ID", "NAME"))
                .addRow(List.of("1", "alpha")).addRow(List.of("2", "NULL")).build();

        byte[] first = target.write(doc);
        // ZIP headers store time with 2-second resolution
        Thread.sleep(2100L);
        byte[] second = target.write(doc);

        assertArrayEquals(first, second);
    }

    @Test
    void write_正常ケース_ZIPエントリを確認する_全エントリの更新日時が同じ固定値であること() throws Exception {
        TabularDocument doc = TabularDocument.builder("T", List.of("A")).addRow(List.of("x"))
                .build();

        List<String> names = new ArrayList<>();
        List<Long> times = new ArrayList<>();
        try (ZipArchiveInputStream in =
                new ZipArchiveInputStream(new ByteArrayInputStream(target.write(doc)))) {
            ZipArchiveEntry entry;
            while ((entry = in.getNextZipEntry()) != null) {
                names.add(entry.getName());
                times.add(entry.getTime());
            }
        }

        assertTrue(names.contains("xl/worksheets/sheet1.xml"));
        assertTrue(names.contains("[Content_Types].xml"));
        assertEquals(1L, times.stream().distinct().count());
    }
}
