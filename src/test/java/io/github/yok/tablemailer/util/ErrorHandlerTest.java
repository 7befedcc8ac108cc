package io.github.yok.tablemailer.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.sql.SQLException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Invalid configuration", cause));
            assertEquals("Invalid configuration", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Single run failed"));
            assertEquals("Single run failed", ex2.getMessage());
            assertNull(ex2.getCause());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_異常ケース_exit無効の場合_標準エラーへは出力されないこと() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ErrorHandler.disableExitForCurrentThread();
        try {
            System.setErr(new PrintStream(err));
            assertThrows(IllegalStateException.class, () -> ErrorHandler.errorAndExit("boom"));
        } finally {
            System.setErr(originalErr);
            ErrorHandler.restoreExitForCurrentThread();
        }
        Assertions.assertEquals("", err.toString());
    }

    @Test
    void logAbort_正常ケース_原因を指定する_例外が送出されないこと() {
        Assertions.assertDoesNotThrow(() -> ErrorHandler.logAbort("export", "table TEST_01",
                new RuntimeException("wrapper", new SQLException("ORA-00942"))));
    }
}
