package com.gentoro.gateway.exception;

/** The tenant credential blob is absent or cannot be parsed. */
public class ConfigMissingException extends GatewayException {
  public ConfigMissingException(String message) {
    super(GatewayErrorCode.CONFIG_MISSING, message);
  }

  public ConfigMissingException(String message, Throwable cause) {
    super(GatewayErrorCode.CONFIG_MISSING, message, cause);
  }
}
