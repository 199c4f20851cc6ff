package ca.gc.cra.errors.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.errors.domain.Canonical;
import ca.gc.cra.errors.domain.Extras;
import ca.gc.cra.errors.domain.Flags;
import ca.gc.cra.errors.domain.Group;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ErrorLogsTest {
  private static final Canonical TIMEOUT = Canonical.builder()
      .namespace("ledger")
      .code("timeout")
      .message("slow")
      .flags(Flags.RETRYABLE.set(Flags.TIMEOUT))
      .build();

  @Test
  void classifiedErrorLogsKeyAndFlags() {
    List<ILoggingEvent> events = capture(Level.WARN, logger -> ErrorLogs.log(logger, TIMEOUT.wrap(new IOException("io"))));

    assertEquals(1, events.size());
    ILoggingEvent event = events.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertEquals("error key=ledger/timeout flags=110 retryable=true timeout=true message=slow cause=io",
        event.getFormattedMessage());
  }

  @Test
  void foreignErrorIsLoggedAsUnknown() {
    List<ILoggingEvent> events = capture(Level.WARN, logger -> ErrorLogs.log(logger, new IllegalStateException("bad")));

    assertEquals(1, events.size());
    String message = events.get(0).getFormattedMessage();
    assertTrue(message.startsWith("error key=cra/errors/unknown flags=1 "));
    assertTrue(message.endsWith("cause=bad"));
  }

  @Test
  void groupLogsSizeThenMembers() {
    Canonical other = Canonical.builder().namespace("svc").code("conflict").message("taken").build();

    List<ILoggingEvent> events = capture(Level.WARN, logger -> ErrorLogs.log(logger, Group.of(TIMEOUT, other)));

    assertEquals(3, events.size());
    assertEquals("error.group size=2", events.get(0).getFormattedMessage());
    assertTrue(events.get(1).getFormattedMessage().contains("key=ledger/timeout"));
    assertTrue(events.get(2).getFormattedMessage().contains("key=svc/conflict"));
  }

  @Test
  void debugAddsChainAndTruncatedStackTrace() {
    Canonical traced = TIMEOUT.withExtras(Extras.EMPTY.withStackTrace("x".repeat(32)));

    List<ILoggingEvent> events = capture(Level.DEBUG, logger -> ErrorLogs.log(logger, traced, 8));

    assertEquals(3, events.size());
    assertTrue(events.get(1).getFormattedMessage().startsWith("error.chain key=ledger/timeout chain="));
    assertEquals("error.stack key=ledger/timeout trace=xxxxxxxx... (truncated, 8 of 32 bytes)",
        events.get(2).getFormattedMessage());
  }

  @Test
  void nullErrorIsIgnored() {
    assertTrue(capture(Level.DEBUG, logger -> ErrorLogs.log(logger, null)).isEmpty());
  }

  @Test
  void rejectsNonPositiveBudget() {
    org.slf4j.Logger logger = LoggerFactory.getLogger(ErrorLogsTest.class);

    assertThrows(IllegalArgumentException.class, () -> ErrorLogs.log(logger, TIMEOUT, 0));
  }

  private static List<ILoggingEvent> capture(Level level, Consumer<org.slf4j.Logger> action) {
    Logger logger = (Logger) LoggerFactory.getLogger("ca.gc.cra.errors.logging.capture");
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setLevel(level);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      action.accept(logger);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }
    return appender.list;
  }
}
