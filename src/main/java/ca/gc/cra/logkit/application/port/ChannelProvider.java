package ca.gc.cra.logkit.application.port;

/**
 * Port resolving named {@link LogChannel} handles from the logging engine.
 *
 * <p>Implementations return engine-managed handles; repeated calls with the same name may return the same or an
 * equivalent instance.
 *
 * @since 0.1.0
 */
public interface ChannelProvider {

  /**
   * Returns the channel registered under {@code name}, creating it in the engine if needed.
   *
   * @param name channel name; must not be {@code null}
   * @return channel handle
   */
  LogChannel getOrCreateChannel(String name);
}
