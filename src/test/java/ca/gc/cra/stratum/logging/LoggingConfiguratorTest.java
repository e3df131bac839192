package ca.gc.cra.stratum.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalLevel);
  }

  @Test
  void applyLevelMapsConsoleLevelNames() {
    assertTrue(LoggingConfigurator.applyLevel("detail"));
    assertEquals(Level.INFO, root.getLevel());

    assertTrue(LoggingConfigurator.applyLevel("OFF"));
    assertEquals(Level.OFF, root.getLevel());
  }

  @Test
  void unknownLevelIsIgnored() {
    root.setLevel(Level.WARN);

    assertFalse(LoggingConfigurator.applyLevel("loud"));
    assertFalse(LoggingConfigurator.applyLevel(null));
    assertEquals(Level.WARN, root.getLevel());
  }
}
