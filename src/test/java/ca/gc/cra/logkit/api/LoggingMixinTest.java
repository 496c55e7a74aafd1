package ca.gc.cra.logkit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.logkit.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

class LoggingMixinTest {

  @Test
  void mixinLoggerIsNamedAfterRuntimeClass() {
    Service service = new Service();

    assertEquals(Service.class.getName(), service.log().name());
    assertSame(service.log(), new Service().log());
  }

  @Test
  void subclassGetsItsOwnLogger() {
    assertEquals(Derived.class.getName(), new Derived().log().name());
    assertEquals(Service.class.getName(), new Service().log().name());
  }

  @Test
  void companionMixinLogsAsEnclosingClass() {
    assertEquals(LoggingMixinTest.class.getName(), new Helpers().log().name());
  }

  @Test
  void mixinLoggerWritesThroughEngine() {
    try (LogCapture capture = LogCapture.attach(Service.class, Level.INFO)) {
      new Service().work();

      assertEquals("working", capture.single().getFormattedMessage());
    }
  }

  static class Service implements Logging {
    void work() {
      log().info(() -> "working");
    }
  }

  static final class Derived extends Service {}

  @Companion
  static final class Helpers implements Logging {}
}
