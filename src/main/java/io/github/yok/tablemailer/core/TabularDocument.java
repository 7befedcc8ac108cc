package io.github.yok.tablemailer.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * In-memory rendering of one exported relation: a header row of column names followed by rows of
 * cell text.
 *
 * <p>
 * Every row holds exactly as many cells as there are columns; rows are never padded or truncated.
 * SQL {@code NULL} is stored as the literal {@value #NULL_LITERAL}. A document without data rows is
 * valid.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TabularDocument {

    /**
     * Cell text written for SQL {@code NULL}.
     */
    public static final String NULL_LITERAL = "NULL";

    private final String relationName;
    private final List<String> columns;
    private final List<List<String>> rows;

    private TabularDocument(String relationName, List<String> columns, List<List<String>> rows) {
        this.relationName = relationName;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Starts a document with the given header.
     *
     * @param relationName relation the document is exported from
     * @param columns column names in source order
     * @return builder
     */
    public static Builder builder(String relationName, List<String> columns) {
        return new Builder(relationName, columns);
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the number of data rows, excluding the header.
     *
     * @return data row count
     */
    public int getRowCount() {
        return rows.size();
    }

    /**
     * Accumulates rows and rejects any row whose width differs from the header.
     */
    public static final class Builder {

        private final String relationName;
        private final List<String> columns;
        private final ImmutableList.Builder<List<String>> rows = ImmutableList.builder();

        private Builder(String relationName, List<String> columns) {
            Preconditions.checkNotNull(columns, "columns must not be null");
            this.relationName = relationName;
            this.columns = ImmutableList.copyOf(columns);
        }

        /**
         * Appends one data row.
         *
         * @param cells cell text, {@link TabularDocument#NULL_LITERAL} for SQL NULL
         * @return this builder
         * @throws IllegalArgumentException if the cell count differs from the column count
         */
        public Builder addRow(List<String> cells) {
            Preconditions.checkArgument(cells.size() == columns.size(),
                    "Column count mismatch: expected %s cells but got %s", columns.size(),
                    cells.size());
            rows.add(ImmutableList.copyOf(cells));
            return this;
        }

        /**
         * Freezes the document.
         *
         * @return immutable document
         */
        public TabularDocument build() {
            return new TabularDocument(relationName, columns, rows.build());
        }
    }
}
