package org.cliffsynth.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
        context.getLogger("org.cliffsynth.converter").setLevel(null);
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.cliffsynth.converter" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.cliffsynth.converter").getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = INFO"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
