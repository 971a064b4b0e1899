// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(DebugLogger.LOGGER_NAME);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        TesseraDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        TesseraDebug.setEnabled(false);

        DebugLogger.log("should not appear");
        DebugLogger.logSign("[SIGN] %s", "x");
        DebugLogger.logAuth("[AUTH] %s", "x");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        TesseraDebug.setEnabled(true);

        DebugLogger.log("payload {\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("0x***[REDACTED]***"));
    }

    @Test
    void formatsArguments() {
        TesseraDebug.setSignLogging(true);

        DebugLogger.logSign("[SIGN] type=%s size=%d", "EIP1559", 110);

        assertEquals("[SIGN] type=EIP1559 size=110", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void switchesAreIndependent() {
        TesseraDebug.setSignLogging(false);
        TesseraDebug.setAuthLogging(true);

        DebugLogger.logSign("sign");
        DebugLogger.logAuth("auth");

        assertEquals(1, appender.list.size());
        assertEquals("auth", appender.list.get(0).getFormattedMessage());
    }
}
