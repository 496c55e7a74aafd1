package ca.gc.cra.logkit.testutil;

import ca.gc.cra.logkit.config.CompositionRoot;
import ca.gc.cra.logkit.config.LogkitConfig;
import org.slf4j.MDC;

/** Resets thread-local MDC state and the global composition root between tests. */
public final class AmbientState {
  private AmbientState() {}

  public static void clear() {
    MDC.clear();
    MDC.getMDCAdapter().clearDequeByKey(LogkitConfig.defaults().contextStackKey());
  }

  public static CompositionRoot install(LogkitConfig config) {
    CompositionRoot root = new CompositionRoot(config);
    CompositionRoot.install(root);
    return root;
  }

  public static void resetRoot() {
    CompositionRoot.reset();
  }
}
