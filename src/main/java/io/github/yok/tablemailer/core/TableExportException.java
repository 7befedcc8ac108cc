package io.github.yok.tablemailer.core;

import lombok.Getter;

/**
 * Signals that a table or view could not be exported.
 *
 * <p>
 * Raised for query, metadata and row-scan failures, for a row whose cell count differs from the
 * header, and for failures while rendering the workbook. No partial document accompanies it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableExportException extends Exception {

    private static final long serialVersionUID = 1L;

    // Relation being exported when the failure happened
    private final String relationName;

    /**
     * Creates an exception for the given relation.
     *
     * @param relationName table or view name
     * @param message detail message
     * @param cause root cause
     */
    public TableExportException(String relationName, String message, Throwable cause) {
        super(message, cause);
        this.relationName = relationName;
    }

    /**
     * Creates an exception for the given relation without a root cause.
     *
     * @param relationName table or view name
     * @param message detail message
     */
    public TableExportException(String relationName, String message) {
        super(message);
        this.relationName = relationName;
    }
}
