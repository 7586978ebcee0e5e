package com.gentoro.kbgen.exception;

import java.util.function.Function;

/** Helpers shared by the places that catch arbitrary throwables. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /** One-line "Type: message" summary used in skip reasons and failed focal-node results. */
  public static String summarize(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    return t.getClass().getSimpleName() + ": " + (message == null ? "" : message);
  }

  /**
   * Returns {@code t} unchanged when it already belongs to the {@link KbGenException} hierarchy,
   * otherwise wraps it with {@code wrapper}.
   */
  public static KbGenException rethrowIfUnchecked(
      Throwable t, Function<Throwable, KbGenException> wrapper) {
    if (t instanceof KbGenException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }
}
