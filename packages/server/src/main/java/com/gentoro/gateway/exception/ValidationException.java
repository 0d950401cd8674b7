package com.gentoro.gateway.exception;

public class ValidationException extends GatewayException {
  public ValidationException(String message) {
    super(GatewayErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GatewayErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
