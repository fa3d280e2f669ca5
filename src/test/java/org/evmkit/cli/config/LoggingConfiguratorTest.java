package org.evmkit.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.evmkit.compiler").setLevel(null);
        context.getLogger("org.evmkit.test").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void testAppliesLevelsFromConfig() {
        LoggingConfigurator.configure(ConfigFactory.parseResources("test-config.conf"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.evmkit.compiler").getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    void testSecondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.evmkit.test\" = DEBUG }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.evmkit.test\" = TRACE }"));
        assertThat(context.getLogger("org.evmkit.test").getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.evmkit.test\" = TRACE }"));
        assertThat(context.getLogger("org.evmkit.test").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void testUnknownLevelIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.evmkit.test\" = LOUD }"));

        assertThat(context.getLogger("org.evmkit.test").getLevel()).isNull();
    }

    @Test
    void testAppenderForFormat() {
        assertThat(LoggingConfigurator.appenderFor("plain")).isEqualTo("STDOUT_PLAIN");
        assertThat(LoggingConfigurator.appenderFor("COLOR")).isEqualTo("STDOUT");
    }
}
