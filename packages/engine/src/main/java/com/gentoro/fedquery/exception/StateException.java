package com.gentoro.fedquery.exception;

/** Raised when a component is used outside its lifecycle (before init, after shutdown). */
public class StateException extends FedQueryException {
  public StateException(String message) {
    super(FedQueryErrorCode.STATE_ERROR, message);
  }
}
