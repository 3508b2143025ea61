package com.gentoro.fedquery.exception;

/** Invalid or unreadable application configuration. */
public class ConfigurationException extends FedQueryException {
  public ConfigurationException(String message) {
    super(FedQueryErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(FedQueryErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
