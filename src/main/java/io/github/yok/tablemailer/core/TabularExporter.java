package io.github.yok.tablemailer.core;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Exports a whole table or view into a {@link TabularDocument} and, on request, into XLSX bytes.
 *
 * <p>
 * The relation is read with an unfiltered {@code SELECT *}. The relation name comes from trusted
 * configuration and is concatenated into the statement as-is: it is neither quoted nor escaped, so
 * whoever controls the configuration controls the SQL. Do not feed user input into it.
 * </p>
 *
 * <p>
 * Values are rendered through {@link ResultSet#getString(int)} only. Dates, numbers and strings all
 * become the driver's textual form; no type-aware formatting is applied. SQL {@code NULL} becomes
 * {@value TabularDocument#NULL_LITERAL}.
 * </p>
 *
 * <p>
 * The given {@link Connection} belongs to the caller and is never closed here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TabularExporter {

    private final WorkbookWriter workbookWriter;

    /**
     * Creates an exporter that renders workbooks with a default {@link WorkbookWriter}.
     */
    public TabularExporter() {
        this(new WorkbookWriter());
    }

    /**
     * Creates an exporter with the given workbook writer.
     *
     * @param workbookWriter writer used by {@link #exportToWorkbook(Connection, String)}
     */
    public TabularExporter(WorkbookWriter workbookWriter) {
        this.workbookWriter = workbookWriter;
    }

    /**
     * Reads every row of the relation.
     *
     * @param conn open JDBC connection (not closed by this method)
     * @param relationName table or view name, used verbatim
     * @return document with the header row and one row per result row
     * @throws TableExportException on query, metadata or scan failure, or a column-count mismatch
     */
    public TabularDocument export(Connection conn, String relationName)
            throws TableExportException {
        Preconditions.checkNotNull(conn, "conn must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(relationName),
                "relationName must not be blank");

        log.info("Table[{}] Export started", relationName);
        String sql = "SELECT * FROM " + relationName;

        TabularDocument document;
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData md = rs.getMetaData();
            int colCount = md.getColumnCount();
            List<String> header = new ArrayList<>(colCount);
            for (int i = 1; i <= colCount; i++) {
                header.add(StringUtils.defaultString(md.getColumnLabel(i)));
            }
            log.debug("Table[{}] Columns: {}", relationName, header);

            TabularDocument.Builder builder = TabularDocument.builder(relationName, header);
            while (rs.next()) {
                List<String> row = new ArrayList<>(colCount);
                for (int i = 1; i <= colCount; i++) {
                    String value = rs.getString(i);
                    row.add(value == null ? TabularDocument.NULL_LITERAL : value);
                }
                builder.addRow(row);
            }
            document = builder.build();
        } catch (SQLException e) {
            log.error("Table[{}] Export failed: {}", relationName, e.getMessage());
            throw new TableExportException(relationName,
                    "Failed to export table " + relationName + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            log.error("Table[{}] Export failed: {}", relationName, e.getMessage());
            throw new TableExportException(relationName, e.getMessage(), e);
        }

        log.info("Table[{}] Export completed. columns={}, rows={}", relationName,
                document.getColumnCount(), document.getRowCount());
        return document;
    }

    /**
     * Reads every row of the relation and renders it as an XLSX workbook.
     *
     * @param conn open JDBC connection (not closed by this method)
     * @param relationName table or view name, used verbatim
     * @return XLSX bytes
     * @throws TableExportException on any export or rendering failure
     */
    public byte[] exportToWorkbook(Connection conn, String relationName)
            throws TableExportException {
        return workbookWriter.write(export(conn, relationName));
    }
}
