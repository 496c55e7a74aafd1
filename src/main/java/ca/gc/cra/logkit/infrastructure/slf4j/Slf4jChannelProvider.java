package ca.gc.cra.logkit.infrastructure.slf4j;

import ca.gc.cra.logkit.application.port.ChannelProvider;
import ca.gc.cra.logkit.application.port.LogChannel;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@link Slf4jLogChannel} handles from an SLF4J {@link ILoggerFactory}.
 *
 * <p>The factory is looked up lazily from {@link LoggerFactory} unless one is injected, so the provider can be
 * created before the SLF4J binding initializes.
 *
 * @since 0.1.0
 */
public final class Slf4jChannelProvider implements ChannelProvider {
  private final ILoggerFactory factory;
  private final int maxParamBytes;

  /**
   * Creates a provider backed by the active SLF4J binding.
   *
   * @param maxParamBytes byte budget for rendered trace parameters; must be positive
   */
  public Slf4jChannelProvider(int maxParamBytes) {
    this(null, maxParamBytes);
  }

  /**
   * Creates a provider backed by an explicit logger factory.
   *
   * @param factory logger factory, or {@code null} to use {@link LoggerFactory#getILoggerFactory()}
   * @param maxParamBytes byte budget for rendered trace parameters; must be positive
   */
  public Slf4jChannelProvider(ILoggerFactory factory, int maxParamBytes) {
    if (maxParamBytes <= 0) {
      throw new IllegalArgumentException("maxParamBytes must be positive");
    }
    this.factory = factory;
    this.maxParamBytes = maxParamBytes;
  }

  @Override
  public LogChannel getOrCreateChannel(String name) {
    Objects.requireNonNull(name, "name");
    ILoggerFactory effective = factory == null ? LoggerFactory.getILoggerFactory() : factory;
    return new Slf4jLogChannel(effective.getLogger(name), maxParamBytes);
  }
}
