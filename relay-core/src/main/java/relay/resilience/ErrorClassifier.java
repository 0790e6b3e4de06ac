package relay.resilience;

import relay.RetryAfterException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a send failure to an {@link ErrorKind}.
 */
public final class ErrorClassifier {
  private static final List<String> NETWORK_HINTS =
      List.of("network", "timeout", "timed out", "connection", "read", "socket", "http");

  private ErrorClassifier() {
  }

  /**
   * Classifies an exception thrown by a sender. Wrapping {@link ExecutionException}s
   * are unwrapped first.
   *
   * @param error the failure, may be {@code null}
   * @return its class, {@link ErrorKind#REJECTED} when nothing more specific applies
   */
  public static ErrorKind classify(Throwable error) {
    Throwable cause = error;
    while (cause instanceof ExecutionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause == null) {
      return ErrorKind.REJECTED;
    }
    if (cause instanceof RetryAfterException) {
      return ErrorKind.RATE_LIMITED;
    }
    if (cause instanceof TimeoutException || cause instanceof InterruptedIOException) {
      return ErrorKind.TIMEOUT;
    }
    if (cause instanceof IOException || looksLikeNetwork(cause)) {
      return ErrorKind.NETWORK;
    }
    return ErrorKind.REJECTED;
  }

  private static boolean looksLikeNetwork(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof IOException) {
        return true;
      }
      String message = t.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String hint : NETWORK_HINTS) {
          if (lower.contains(hint)) {
            return true;
          }
        }
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
