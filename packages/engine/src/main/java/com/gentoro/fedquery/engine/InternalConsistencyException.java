package com.gentoro.fedquery.engine;

import com.gentoro.fedquery.exception.FedQueryErrorCode;
import com.gentoro.fedquery.exception.FedQueryException;

/** The engine broke one of its own guarantees, such as reading a result before it exists. */
public class InternalConsistencyException extends FedQueryException {

  public InternalConsistencyException(String message) {
    super(FedQueryErrorCode.INTERNAL_CONSISTENCY_ERROR, message);
  }
}
