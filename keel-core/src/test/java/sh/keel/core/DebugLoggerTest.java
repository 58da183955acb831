// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.keel.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        KeelDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
    }

    @Test
    void silentWhenDisabled() {
        DebugLogger.logRpc("[RPC] method=%s", "getHealth");
        DebugLogger.logTx("[TX] signature=%s", "abc");
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsToggleIndependently() {
        KeelDebug.enable(KeelDebug.Channel.RPC);

        DebugLogger.logRpc("[RPC] method=%s", "getHealth");
        DebugLogger.logTx("[TX] signature=%s", "abc");
        DebugLogger.logBundle("[BUNDLE] id=%s", "b1");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("method=getHealth"));

        KeelDebug.disable(KeelDebug.Channel.RPC);
        KeelDebug.enable(KeelDebug.Channel.BUNDLE);
        DebugLogger.logRpc("[RPC] method=%s", "getSlot");
        DebugLogger.logBundle("[BUNDLE] id=%s", "b2");

        assertEquals(2, appender.list.size());
        assertTrue(appender.list.get(1).getFormattedMessage().contains("id=b2"));
        assertTrue(KeelDebug.isEnabled());
    }

    @Test
    void messageWithoutArgumentsIsNotFormatted() {
        KeelDebug.setEnabled(true);

        DebugLogger.logBundle("[BUNDLE] landed 100%");

        assertEquals("[BUNDLE] landed 100%", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void sanitizesBeforeLogging() {
        KeelDebug.setEnabled(true);

        DebugLogger.logTx("{\"secretKey\":\"%s\"}", "supersecret");

        assertFalse(appender.list.isEmpty());
        String message = appender.list.get(0).getFormattedMessage();
        assertFalse(message.contains("supersecret"));
        assertTrue(message.contains("[REDACTED]"));
    }
}
