package org.fuselex.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.ConfigFactory;
import org.fuselex.junit.extensions.logging.ExpectLog;
import org.fuselex.junit.extensions.logging.LogLevel;
import org.fuselex.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String ENGINE_LOGGER = "org.fuselex.lexer.engine";

    private LoggerContext context;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void restore() {
        context.getLogger(ENGINE_LOGGER).setLevel(null);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = "ERROR"
                  levels { "org.fuselex.lexer.engine" = "DEBUG" }
                }
                """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(ENGINE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configuresOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.fuselex.lexer.engine\" = INFO }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.fuselex.lexer.engine\" = TRACE }"));

        assertThat(context.getLogger(ENGINE_LOGGER).getLevel()).isEqualTo(Level.INFO);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.fuselex.lexer.engine\" = TRACE }"));

        assertThat(context.getLogger(ENGINE_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD'.*")
    void unknownLevelIsSkipped() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.fuselex.lexer.engine\" = LOUD }"));

        assertThat(context.getLogger(ENGINE_LOGGER).getLevel()).isNull();
    }

    @Test
    void logOutputGoesToStandardErrorInBothFormats() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = JSON"));

        Appender<ILoggingEvent> json = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR_JSON");
        assertThat(json).isInstanceOf(ConsoleAppender.class);
        assertThat(((ConsoleAppender<ILoggingEvent>) json).getTarget()).isEqualTo("System.err");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR_PLAIN")).isNull();

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = PLAIN"));

        Appender<ILoggingEvent> plain = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR_PLAIN");
        assertThat(plain).isInstanceOf(ConsoleAppender.class);
        assertThat(((ConsoleAppender<ILoggingEvent>) plain).getTarget()).isEqualTo("System.err");
    }

    @Test
    void missingLoggingBlockChangesNothing() {
        Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(before);
    }
}
