package ca.gc.cra.logkit.infrastructure.slf4j;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J markers attached to flow-tracing and FATAL events.
 *
 * <p>{@link #ENTER} and {@link #EXIT} reference {@link #FLOW}; {@link #CATCHING} and {@link #THROWING} reference
 * {@link #EXCEPTION}, so a filter on the parent marker matches its children.
 *
 * @since 0.1.0
 */
public final class FlowMarkers {
  public static final Marker FLOW = MarkerFactory.getMarker("FLOW");
  public static final Marker ENTER = MarkerFactory.getMarker("ENTER");
  public static final Marker EXIT = MarkerFactory.getMarker("EXIT");
  public static final Marker EXCEPTION = MarkerFactory.getMarker("EXCEPTION");
  public static final Marker CATCHING = MarkerFactory.getMarker("CATCHING");
  public static final Marker THROWING = MarkerFactory.getMarker("THROWING");
  public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

  static {
    ENTER.add(FLOW);
    EXIT.add(FLOW);
    CATCHING.add(EXCEPTION);
    THROWING.add(EXCEPTION);
  }

  private FlowMarkers() {}

  /**
   * Returns the marker used for a FATAL event, referencing {@code marker} when one was supplied.
   *
   * @param marker caller marker, or {@code null}
   * @return {@link #FATAL} itself, or a detached marker named FATAL that references {@code marker}
   */
  static Marker fatal(Marker marker) {
    if (marker == null || marker == FATAL) {
      return FATAL;
    }
    Marker combined = MarkerFactory.getDetachedMarker(FATAL.getName());
    combined.add(marker);
    return combined;
  }
}
