package com.gentoro.fedquery.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened, serializable view of a failure for logs and reports. */
public record ErrorDetails(
    String type,
    String message,
    FedQueryErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
