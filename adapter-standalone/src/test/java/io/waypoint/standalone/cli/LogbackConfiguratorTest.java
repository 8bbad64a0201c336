package io.waypoint.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private static Logger root() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender() {
        return (ConsoleAppender<ILoggingEvent>) root().getAppender("STDERR");
    }

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "WARN");
    }

    @Test
    @DisplayName("json format → JsonEncoder on standard error")
    void jsonFormat() {
        LogbackConfigurator.configure("json", "DEBUG");

        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(stderrAppender().getTarget()).isEqualTo("System.err");
        assertThat(stderrAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    @DisplayName("text format → pattern with key-value pairs")
    void textFormat() {
        LogbackConfigurator.configure("text", "INFO");

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
        assertThat(stderrAppender().getEncoder())
                .isInstanceOfSatisfying(
                        PatternLayoutEncoder.class,
                        e -> assertThat(e.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    @DisplayName("Unknown level → INFO")
    void unknownLevel() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
    }
}
