package ca.gc.cra.logkit.domain.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Handle returned when a traced block is entered and fed back when it exits.
 *
 * <p>An entry carries either a free-form message, a list of parameters, or neither. Parameter lists may contain
 * {@code null} elements.
 *
 * @param message free-form entry text, or {@code null}
 * @param params entry parameters, or {@code null} when the entry was not created from parameters
 * @since 0.1.0
 */
public record EntryMessage(CharSequence message, List<Object> params) {

  /** Entry without message or parameters. */
  public static final EntryMessage EMPTY = new EntryMessage(null, null);

  public EntryMessage {
    params = params == null ? null : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static EntryMessage ofMessage(CharSequence message) {
    return new EntryMessage(message, null);
  }

  public static EntryMessage ofParams(Object... params) {
    if (params == null) {
      return EMPTY;
    }
    return new EntryMessage(null, Arrays.asList(params));
  }
}
