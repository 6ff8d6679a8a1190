package exm.vlint.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Appender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void tearDown() {
    Logger logger = Logging.getVLintLogger();
    Appender appender = logger.getAppender(Logging.FILE_APPENDER_NAME);
    if (appender != null) {
      logger.removeAppender(appender);
      appender.close();
    }
    logger.setLevel(null);
  }

  private static int appenderCount(Logger logger) {
    List<?> appenders = Collections.list(logger.getAllAppenders());
    return appenders.size();
  }

  @Test
  public void testRepeatedSetupKeepsOneAppender() throws Exception {
    Logger logger = Logging.getVLintLogger();
    logger.removeAllAppenders();
    String logfile = tmp.newFile("vlint.log").getPath();

    Logging.setupLogging(logfile, false);
    Appender first = logger.getAppender(Logging.FILE_APPENDER_NAME);
    assertNotNull(first);
    Logging.setupLogging(logfile, false);
    Logging.setupLogging(logfile, true);

    assertEquals(1, appenderCount(logger));
    assertNotSame(first, logger.getAppender(Logging.FILE_APPENDER_NAME));
    assertEquals(Level.TRACE, logger.getLevel());
  }

  @Test
  public void testLinesWrittenOnce() throws Exception {
    Logger logger = Logging.getVLintLogger();
    logger.removeAllAppenders();
    File logfile = tmp.newFile("once.log");

    Logging.setupLogging(logfile.getPath(), false);
    Logging.setupLogging(logfile.getPath(), false);
    logger.debug("single line");

    String text = new String(Files.readAllBytes(logfile.toPath()),
                             StandardCharsets.UTF_8);
    assertEquals(text.indexOf("single line"),
                 text.lastIndexOf("single line"));
    assertTrue(text.contains("single line"));
  }

  @Test
  public void testNoFileMeansNoAppender() {
    Logger logger = Logging.getVLintLogger();
    logger.removeAllAppenders();
    Logging.setupLogging("", true);
    assertEquals(0, appenderCount(logger));
  }
}
