package dev.tabsuite.formatter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "hello \"world\"");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00");
        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"file\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void liftsFileOutOfMdcAndAddsException() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "Formatting failed");
        event.setMDCPropertyMap(Map.of("file", "suites/login.robot", "run", "7"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("bad shape")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"file\":\"suites/login.robot\"");
        assertThat(json).contains("\"mdc\":{\"run\":\"7\"}");
        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: bad shape\"");
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
