package com.delta.extractor.api;

import com.delta.extractor.error.ErrorKind;
import com.delta.extractor.error.ExtractorException;
import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.error.TransferRejectedException;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ExtractorExceptionHandler {

  @ExceptionHandler(TransferRejectedException.class)
  public ResponseEntity<Map<String, String>> handleRejected(TransferRejectedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "transfer_rejected", "message", ex.getMessage()));
  }

  @ExceptionHandler(ExtractorException.class)
  public ResponseEntity<Map<String, String>> handleExtractor(ExtractorException ex) {
    return ResponseEntity.status(statusFor(ex.kind()))
        .body(Map.of("error", ex.kind().name().toLowerCase(Locale.ROOT), "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(StateStoreException.class)
  public ResponseEntity<Map<String, String>> handleStateStore(StateStoreException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "state_store", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  static HttpStatus statusFor(ErrorKind kind) {
    return switch (kind) {
      case BREAKER_OPEN, TRANSIENT_NETWORK -> HttpStatus.SERVICE_UNAVAILABLE;
      case EXTRACTION_FAILURE -> HttpStatus.BAD_GATEWAY;
      case RESOURCE_CHANGED -> HttpStatus.CONFLICT;
      case TERMINAL_REQUEST -> HttpStatus.BAD_REQUEST;
      case STATE_INCONSISTENCY -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
