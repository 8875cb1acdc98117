package exm.tgs.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.tgs.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetLogging() {
    Logger logger = Logging.getTGSLogger();
    logger.removeAllAppenders();
    logger.setLevel(Level.WARN);
    System.clearProperty(Settings.LOG_FILE);
    System.clearProperty(Settings.LOG_TRACE);
    Settings.reset(Settings.LOG_FILE);
    Settings.reset(Settings.LOG_TRACE);
  }

  @Test
  public void testSetupLogging() throws IOException {
    File logFile = tmp.newFile("tgs.log");
    Logger logger = Logging.setupLogging(logFile.getPath(), false);
    assertEquals(Level.DEBUG, logger.getLevel());
    logger.debug("hello");
    logger.trace("not shown");
    String text = new String(Files.readAllBytes(logFile.toPath()),
                             StandardCharsets.UTF_8);
    assertTrue(text.contains("hello"));
    assertFalse(text.contains("not shown"));
  }

  @Test
  public void testNoLogFile() {
    Level before = Logging.getTGSLogger().getLevel();
    Logger logger = Logging.setupLogging("", true);
    assertSame(Logging.getTGSLogger(), logger);
    assertEquals(before, logger.getLevel());
  }

  @Test
  public void testSetupFromSettings()
      throws IOException, InvalidOptionException {
    File logFile = tmp.newFile("trace.log");
    System.setProperty(Settings.LOG_FILE, logFile.getPath());
    System.setProperty(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupFromSettings();
    assertEquals(Level.TRACE, logger.getLevel());
  }

  @Test
  public void testUniqueWarn() {
    String msg = "unique warning " + System.nanoTime();
    assertTrue(Logging.addEmitted(Level.INFO, msg));
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.INFO, msg));
  }
}
