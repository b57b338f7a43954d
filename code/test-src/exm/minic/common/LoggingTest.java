package exm.minic.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testConsoleStaysAtWarnWithLogFile() throws Exception {
    Logger logger = Logging.setupLogging("target/LoggingTest.minic.log",
                                         false);
    assertEquals(Level.DEBUG, logger.getLevel());
    assertTrue("Debug should be enabled for the log file",
               logger.isDebugEnabled());

    AppenderSkeleton console = (AppenderSkeleton)
                      Logger.getRootLogger().getAppender("console");
    assertNotNull("Expected console appender from log4j.properties",
                  console);
    assertFalse("DEBUG must not reach console",
                console.isAsSevereAsThreshold(Level.DEBUG));
    assertFalse("TRACE must not reach console",
                console.isAsSevereAsThreshold(Level.TRACE));
    assertTrue("WARN must reach console",
               console.isAsSevereAsThreshold(Level.WARN));
  }

  @Test
  public void testFileAppenderAdded() throws Exception {
    Logger logger = Logging.setupLogging("target/LoggingTest.minic.log",
                                         true);
    assertEquals(Level.TRACE, logger.getLevel());
    assertNotNull(logger.getAppender("minic-logfile"));
  }
}
