package io.github.yok.tablemailer.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.io.ByteArrayInputStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class TabularExporterTest {

    @Test
    void export_正常ケース_複数行を指定する_ヘッダと行が列順に出力されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM TEST_01")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(3);
        when(md.getColumnLabel(1)).thenReturn("ID");
        when(md.getColumnLabel(2)).thenReturn("NAME");
        when(md.getColumnLabel(3)).thenReturn("CREATED");
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getString(1)).thenReturn("1", "2");
        when(rs.getString(2)).thenReturn("alpha", "beta");
        when(rs.getString(3)).thenReturn("2024-01-01 00:00:00", "2024-02-01 12:30:00");

        TabularDocument doc = new TabularExporter().export(conn, "TEST_01");

        assertEquals("TEST_01", doc.getRelationName());
        assertEquals(List.of("ID", "NAME", "CREATED"), doc.getColumns());
        assertEquals(2, doc.getRowCount());
        assertEquals(List.of("1", "alpha", "2024-01-01 00:00:00"), doc.getRows().get(0));
        assertEquals(List.of("2", "beta", "2024-02-01 12:30:00"), doc.getRows().get(1));
    }

    @Test
    void export_正常ケース_NULL列を指定する_NULL文字列が出力されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM T_NULL")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(2);
        when(md.getColumnLabel(1)).thenReturn("A");
        when(md.getColumnLabel(2)).thenReturn("B");
        when(rs.next()).thenReturn(true, false);
        when(rs.getString(1)).thenReturn(null);
        when(rs.getString(2)).thenReturn("");

        TabularDocument doc = new TabularExporter().export(conn, "T_NULL");

        assertEquals(List.of("NULL", ""), doc.getRows().get(0));
    }

    @Test
    void export_正常ケース_0行のテーブルを指定する_ヘッダのみの文書が返ること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM EMPTY_VIEW")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(1);
        when(md.getColumnLabel(1)).thenReturn("COL");
        when(rs.next()).thenReturn(false);

        TabularDocument doc = new TabularExporter().export(conn, "EMPTY_VIEW");

        assertEquals(List.of("COL"), doc.getColumns());
        assertEquals(0, doc.getRowCount());
    }

    @Test
    void export_異常ケース_クエリが失敗する_TableExportExceptionが送出され接続は閉じられないこと()
            throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        when(conn.createStatement()).thenReturn(stmt);
        SQLException cause = new SQLException("table or view does not exist");
        when(stmt.executeQuery(any())).thenThrow(cause);

        TableExportException ex = assertThrows(TableExportException.class,
                () -> new TabularExporter().export(conn, "MISSING"));

        assertEquals("MISSING", ex.getRelationName());
        assertSame(cause, ex.getCause());
        verify(stmt).close();
        verify(conn, never()).close();
    }

    @Test
    void export_異常ケース_行の読み取りが途中で失敗する_部分結果は返らず例外が送出されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM T_BROKEN")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(1);
        when(md.getColumnLabel(1)).thenReturn("A");
        when(rs.next()).thenReturn(true).thenThrow(new SQLException("connection reset"));
        when(rs.getString(1)).thenReturn("x");

        TableExportException ex = assertThrows(TableExportException.class,
                () -> new TabularExporter().export(conn, "T_BROKEN"));

        assertTrue(ex.getMessage().contains("T_BROKEN"));
        verify(rs).close();
    }

    @Test
    void export_異常ケース_メタデータ取得が失敗する_TableExportExceptionが送出されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM T_META")).thenReturn(rs);
        when(rs.getMetaData()).thenThrow(new SQLException("metadata unavailable"));

        assertThrows(TableExportException.class,
                () -> new TabularExporter().export(conn, "T_META"));
    }

    @Test
    void export_異常ケース_テーブル名が空白である_IllegalArgumentExceptionが送出されること() {
        Connection conn = mock(Connection.class);
        assertThrows(IllegalArgumentException.class,
                () -> new TabularExporter().export(conn, "  "));
    }

    @Test
    void exportToWorkbook_正常ケース_WorkbookWriterへ文書が渡されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.executeQuery("SELECT * FROM T1")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(1);
        when(md.getColumnLabel(1)).thenReturn("A");
        when(rs.next()).thenReturn(false);

        WorkbookWriter writer = mock(WorkbookWriter.class);
        byte[] expected = new byte[] {1, 2, 3};
        when(writer.write(any())).thenReturn(expected);

        byte[] actual = new TabularExporter(writer).exportToWorkbook(conn, "T1");

        assertArrayEquals(expected, actual);
    }

    @Test
    void exportToWorkbook_正常ケース_H2のテーブルを出力する_Sheet1に内容が書かれること() throws Exception {
        try (Connection conn =
                DriverManager.getConnection("jdbc:h2:mem:exporter_h2;DB_CLOSE_DELAY=-1", "sa", "")) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE TEST_01 (ID INT, NAME VARCHAR(20), AMOUNT DECIMAL(10,2))");
                stmt.execute("INSERT INTO TEST_01 VALUES (1, 'alpha', 10.50)");
                stmt.execute("INSERT INTO TEST_01 VALUES (2, NULL, 3.00)");
            }

            TabularExporter exporter = new TabularExporter();
            byte[] xlsx = exporter.exportToWorkbook(conn, "TEST_01");

            try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
                assertEquals(1, workbook.getNumberOfSheets());
                XSSFSheet sheet = workbook.getSheet("Sheet1");
                DataFormatter fmt = new DataFormatter();
                assertEquals("ID", fmt.formatCellValue(sheet.getRow(0).getCell(0)));
                assertEquals("NAME", fmt.formatCellValue(sheet.getRow(0).getCell(1)));
                assertEquals("AMOUNT", fmt.formatCellValue(sheet.getRow(0).getCell(2)));
                assertEquals("1", fmt.formatCellValue(sheet.getRow(1).getCell(0)));
                assertEquals("alpha", fmt.formatCellValue(sheet.getRow(1).getCell(1)));
                assertEquals("10.50", fmt.formatCellValue(sheet.getRow(1).getCell(2)));
                assertEquals("NULL", fmt.formatCellValue(sheet.getRow(2).getCell(1)));
                assertEquals(2, sheet.getLastRowNum());
            }

            // Unchanged data exports to the same document
            assertEquals(exporter.export(conn, "TEST_01"), exporter.export(conn, "TEST_01"));
            assertTrue(!conn.isClosed());
        }
    }
}
