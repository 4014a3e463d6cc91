// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.devnode.core;

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

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.devnode.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        DevnodeDebug.setEnabled(false);
        logger.detachAppender(appender);
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logRequest("nor this");
        DebugLogger.logBridge("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void requestTracingIsIndependentOfBridgeTracing() {
        DevnodeDebug.setRequestTracing(true);

        DebugLogger.logRequest("request %s", "eth_chainId");
        DebugLogger.logBridge("bridge round trip");

        assertEquals(1, appender.list.size());
        assertEquals("request eth_chainId", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        DevnodeDebug.setEnabled(true);
        DebugLogger.log("config {\"privateKey\":\"0x123\"}");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("0x***[REDACTED]***"));
    }

    @Test
    void requestTracesHideSignedTransactions() {
        DevnodeDebug.setRequestTracing(true);

        DebugLogger.logRequest("[REQUEST] %s",
                "{\"method\":\"eth_sendRawTransaction\",\"params\":[\"0xf86c0a8502540be400\"]}");

        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.startsWith("[REQUEST] "));
        assertTrue(message.contains("\"params\":[\"0x***[REDACTED]***\"]"), message);
    }
}
