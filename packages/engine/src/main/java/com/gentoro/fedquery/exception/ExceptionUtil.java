package com.gentoro.fedquery.exception;

import java.time.Instant;
import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or reports. If the
   * throwable is a {@link FedQueryException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof FedQueryException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        FedQueryErrorCode.UNKNOWN,
        Map.of(),
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, e.g. {@code
   * com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Message suitable for a failure report: the innermost non-blank message in the cause chain,
   * prefixed with the exception type when the throwable is not one of ours.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    if (t instanceof FedQueryException && !isBlank(t.getMessage())) {
      return t.getMessage();
    }
    Throwable current = t;
    String message = null;
    Throwable owner = t;
    while (current != null) {
      if (!isBlank(current.getMessage())) {
        message = current.getMessage();
        owner = current;
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }
    if (message == null) {
      return t.getClass().getSimpleName();
    }
    return owner.getClass().getSimpleName() + ": " + message;
  }

  /**
   * Return {@code t} unchanged when it is already a {@link FedQueryException}, otherwise wrap it
   * with the supplied code.
   */
  public static FedQueryException wrap(Throwable t, FedQueryErrorCode code, String message) {
    if (t instanceof FedQueryException ex) {
      return ex;
    }
    return new FedQueryException(code, message, t);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
