package com.delta.extractor.resilience;

import com.delta.extractor.error.ExtractorException;
import com.delta.extractor.error.HttpStatusException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class FailureClassifier {
  public static final Set<Integer> TERMINAL_STATUS_CODES = Set.of(400, 401, 403, 404, 410);

  private static final List<String> TRANSIENT_MARKERS = List.of(
      "timeout",
      "timed out",
      "connection reset",
      "connection_reset",
      "connection refused",
      "connection_refused",
      "network unreachable",
      "network is unreachable",
      "network_unreachable");

  private FailureClassifier() {}

  public static FailureClass classify(Throwable error) {
    return classify(error, statusCodeOf(error));
  }

  public static FailureClass classify(Throwable error, Integer statusCode) {
    if (statusCode != null && statusCode > 0) {
      if (TERMINAL_STATUS_CODES.contains(statusCode)) {
        return FailureClass.TERMINAL;
      }
      if (statusCode >= 500 && statusCode < 600) {
        return FailureClass.RETRYABLE;
      }
    }
    if (error == null) {
      return FailureClass.TERMINAL;
    }
    if (error instanceof ExtractorException) {
      // already-classified failures (open breaker, missing field) never become retryable
      return FailureClass.TERMINAL;
    }
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < 8) {
      if (current instanceof InterruptedException) {
        return FailureClass.TERMINAL;
      }
      if (current instanceof HttpTimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof ConnectException
          || current instanceof NoRouteToHostException) {
        return FailureClass.RETRYABLE;
      }
      if (matchesTransientMarker(current.getMessage())) {
        return FailureClass.RETRYABLE;
      }
      current = current.getCause();
      depth++;
    }
    return FailureClass.TERMINAL;
  }

  public static boolean isRetryable(Throwable error) {
    return classify(error) == FailureClass.RETRYABLE;
  }

  public static Integer statusCodeOf(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < 8) {
      if (current instanceof HttpStatusException statusException) {
        return statusException.statusCode();
      }
      current = current.getCause();
      depth++;
    }
    return null;
  }

  private static boolean matchesTransientMarker(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String marker : TRANSIENT_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
