package com.gentoro.fedquery.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all engine exceptions.
 *
 * <p>Each exception carries a {@link FedQueryErrorCode} and an optional context map with
 * structured details (step id, backend, offending variable, ...) so failures can be reported
 * without parsing messages.
 */
public class FedQueryException extends RuntimeException {
  private final FedQueryErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public FedQueryException(FedQueryErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public FedQueryException(FedQueryErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public FedQueryErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public FedQueryException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
