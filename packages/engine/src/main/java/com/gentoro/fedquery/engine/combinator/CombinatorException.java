package com.gentoro.fedquery.engine.combinator;

import com.gentoro.fedquery.exception.FedQueryErrorCode;
import com.gentoro.fedquery.exception.FedQueryException;

/** An in-memory operation could not be applied to its inputs. Never retried. */
public class CombinatorException extends FedQueryException {

  public CombinatorException(String message) {
    super(FedQueryErrorCode.EXECUTION_ERROR, message);
  }

  public CombinatorException(String message, Throwable cause) {
    super(FedQueryErrorCode.EXECUTION_ERROR, message, cause);
  }
}
