package ca.gc.cra.logkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.logkit.application.port.ContextMapPort;
import ca.gc.cra.logkit.application.port.ContextStackPort;
import ca.gc.cra.logkit.infrastructure.slf4j.MdcContextMap;
import ca.gc.cra.logkit.infrastructure.slf4j.MdcContextStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class CompositionRootTest {

  @AfterEach
  void tearDown() {
    CompositionRoot.reset();
  }

  @Test
  void enabledConfigWiresMdcAdapters() {
    CompositionRoot root = new CompositionRoot(new LogkitConfig(10, "TRAIL", true, true, 128));

    assertInstanceOf(MdcContextMap.class, root.contextMap());
    MdcContextStack stack = assertInstanceOf(MdcContextStack.class, root.contextStack());
    assertEquals("TRAIL", stack.key());
    assertEquals(10, root.loggerCache().maxEntries());
  }

  @Test
  void wiredMapDoesNotExposeTheStackEntry() {
    CompositionRoot root = new CompositionRoot(new LogkitConfig(10, "TRAIL", true, true, 128));
    try {
      root.contextStack().push("frame");

      assertEquals("frame", MDC.get("TRAIL"));
      assertNull(root.contextMap().get("TRAIL"));
      assertEquals(0, root.contextMap().immutableView().size());
    } finally {
      root.contextStack().clear();
      MDC.clear();
    }
  }

  @Test
  void disabledConfigWiresInertPorts() {
    CompositionRoot root = new CompositionRoot(new LogkitConfig(10, "NDC", false, false, 128));

    assertSame(ContextMapPort.DISABLED, root.contextMap());
    assertSame(ContextStackPort.DISABLED, root.contextStack());
  }

  @Test
  void globalIsLazyAndReplaceable() {
    CompositionRoot first = CompositionRoot.global();
    assertSame(first, CompositionRoot.global());

    CompositionRoot replacement = new CompositionRoot(LogkitConfig.defaults());
    assertSame(first, CompositionRoot.install(replacement));
    assertSame(replacement, CompositionRoot.global());

    CompositionRoot.reset();
    assertNotSame(replacement, CompositionRoot.global());
  }
}
