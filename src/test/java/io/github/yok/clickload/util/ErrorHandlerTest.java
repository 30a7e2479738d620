package io.github.yok.clickload.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        ErrorHandler instance = constructor.newInstance();
        assertEquals(ErrorHandler.class, instance.getClass());
    }

    @Test
    void fatal_異常ケース_throwモードを指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.throwOnFatalForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.fatal("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 =
                    assertThrows(IllegalStateException.class, () -> ErrorHandler.fatal("boom2"));
            assertEquals("boom2", ex2.getMessage());
        } finally {
            ErrorHandler.restoreForCurrentThread();
        }
    }

    @Test
    void fatal_正常ケース_原因例外あり_根本原因が標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.fatal("boom",
                    new IllegalStateException("wrapper", new SQLException("Connection refused")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        assertTrue(message.startsWith("ERROR: boom: "));
        assertTrue(message.contains("Connection refused"));
    }

    @Test
    void fatal_正常ケース_メッセージのみ_例外が送出されず一行出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.fatal("boom2");
        } finally {
            System.setErr(originalErr);
        }
        assertEquals("ERROR: boom2", err.toString().trim());
    }
}
