package com.gentoro.fetchgate.exception;

/** Missing or invalid configuration. */
public class ConfigException extends FetchGateException {
  public ConfigException(String message) {
    super(FetchGateErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FetchGateErrorCode.CONFIG_ERROR, message, cause);
  }
}
