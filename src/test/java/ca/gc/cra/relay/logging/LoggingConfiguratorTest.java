package ca.gc.cra.relay.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level previous;

  @BeforeEach
  void captureLevel() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    previous = root.getLevel();
    root.setLevel(Level.INFO);
  }

  @AfterEach
  void restoreLevel() {
    root.setLevel(previous);
  }

  @Test
  void enableVerboseLoggingRaisesRootToDebug() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, root.getLevel());
    assertTrue(LoggingConfigurator.enableVerboseLogging());
  }
}
