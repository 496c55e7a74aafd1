package ca.gc.cra.logkit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logkit.domain.level.Level;
import ca.gc.cra.logkit.testutil.LogCapture;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

class FunctionalLoggerTest {
  private static final String NAME = "logkit.test.functional";
  private static final Marker AUDIT = MarkerFactory.getMarker("AUDIT");

  private final FunctionalLogger logger = Loggers.logger(NAME);

  @Test
  void supplierNotInvokedWhenLevelDisabled() {
    AtomicInteger calls = new AtomicInteger();
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.debug(() -> "expensive " + calls.incrementAndGet());
      logger.trace(AUDIT, () -> "expensive " + calls.incrementAndGet());

      assertEquals(0, calls.get());
      assertTrue(capture.events().isEmpty());
    }
  }

  @Test
  void supplierInvokedExactlyOnceWhenEnabled() {
    AtomicInteger calls = new AtomicInteger();
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.warn(() -> {
        calls.incrementAndGet();
        return "x";
      });

      assertEquals(1, calls.get());
      ILoggingEvent event = capture.single();
      assertEquals("x", event.getFormattedMessage());
      assertEquals(ch.qos.logback.classic.Level.WARN, event.getLevel());
    }
  }

  @Test
  void supplierFailurePropagatesUnchanged() {
    IllegalStateException failure = new IllegalStateException("boom");
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> logger.info(() -> {
        throw failure;
      }));

      assertSame(failure, thrown);
      assertTrue(capture.events().isEmpty());
    }
  }

  @Test
  void throwableIsAttachedToEvent() {
    IllegalArgumentException cause = new IllegalArgumentException("bad input");
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.error(cause, () -> "request failed");
      logger.warn("literal", cause);

      List<ILoggingEvent> events = capture.events();
      assertEquals(2, events.size());
      assertEquals("request failed", events.get(0).getFormattedMessage());
      assertEquals("bad input", events.get(0).getThrowableProxy().getMessage());
      assertEquals(IllegalArgumentException.class.getName(), events.get(1).getThrowableProxy().getClassName());
    }
  }

  @Test
  void markerIsForwarded() {
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.DEBUG)) {
      logger.info(AUDIT, "tagged");
      logger.debug(AUDIT, () -> "tagged lazily");

      for (ILoggingEvent event : capture.events()) {
        assertEquals(List.of(AUDIT), event.getMarkerList());
      }
      assertEquals(List.of("tagged", "tagged lazily"), capture.messages());
    }
  }

  @Test
  void textMessagesAreLiteral() {
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.info("100% {} literal");
      logger.info(new StringBuilder("built {}"));

      assertEquals(List.of("100% {} literal", "built {}"), capture.messages());
    }
  }

  @Test
  void objectMessagesReachEngineUnchanged() {
    List<Integer> payload = List.of(1, 2);
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.info(payload);
      Supplier<Object> nothing = () -> null;
      logger.info(nothing);

      List<ILoggingEvent> events = capture.events();
      assertEquals("[1, 2]", events.get(0).getFormattedMessage());
      assertSame(payload, events.get(0).getArgumentArray()[0]);
      assertEquals("null", events.get(1).getFormattedMessage());
    }
  }

  @Test
  void fatalRendersAsErrorWithFatalMarker() {
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.ERROR)) {
      logger.fatal("disk gone");
      logger.fatal(AUDIT, () -> "audit trail lost");

      List<ILoggingEvent> events = capture.events();
      assertEquals(2, events.size());
      assertEquals(ch.qos.logback.classic.Level.ERROR, events.get(0).getLevel());
      assertEquals("FATAL", events.get(0).getMarkerList().get(0).getName());

      Marker combined = events.get(1).getMarkerList().get(0);
      assertEquals("FATAL", combined.getName());
      assertTrue(combined.contains(AUDIT));
    }
  }

  @Test
  void genericLevelOverloadsRouteToMatchingLevel() {
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.TRACE)) {
      logger.log(Level.TRACE, "t");
      logger.log(Level.DEBUG, () -> "d");
      logger.log(Level.INFO, AUDIT, "i");
      logger.log(Level.WARN, new IllegalStateException("w"), () -> "w");

      List<ILoggingEvent> events = capture.events();
      assertEquals(ch.qos.logback.classic.Level.TRACE, events.get(0).getLevel());
      assertEquals(ch.qos.logback.classic.Level.DEBUG, events.get(1).getLevel());
      assertEquals(ch.qos.logback.classic.Level.INFO, events.get(2).getLevel());
      assertEquals(ch.qos.logback.classic.Level.WARN, events.get(3).getLevel());
      assertEquals("w", events.get(3).getThrowableProxy().getMessage());
    }
  }

  @Test
  void enablementFollowsEngineLevel() {
    try (LogCapture ignored = LogCapture.attach(NAME, ch.qos.logback.classic.Level.WARN)) {
      assertFalse(logger.isTraceEnabled());
      assertFalse(logger.isDebugEnabled());
      assertFalse(logger.isInfoEnabled());
      assertTrue(logger.isWarnEnabled());
      assertTrue(logger.isErrorEnabled());
      assertTrue(logger.isFatalEnabled());
      assertTrue(logger.isEnabled(Level.FATAL, AUDIT));
      assertFalse(logger.isEnabled(Level.INFO, AUDIT));
    }
  }

  @Test
  void callerDataPointsAtCallSite() {
    try (LogCapture capture = LogCapture.attach(NAME, ch.qos.logback.classic.Level.INFO)) {
      logger.info(() -> "where am I");

      StackTraceElement caller = capture.single().getCallerData()[0];
      assertEquals(FunctionalLoggerTest.class.getName(), caller.getClassName());
      assertEquals("callerDataPointsAtCallSite", caller.getMethodName());
    }
  }

  @Test
  void exposesChannelName() {
    assertEquals(NAME, logger.name());
    assertEquals(NAME, logger.channel().name());
  }
}
