package com.gentoro.gateway.exception;

/** Operation is not valid for the current state of a resource (e.g. deployment has no URL). */
public class StateException extends GatewayException {
  public StateException(String message) {
    super(GatewayErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(GatewayErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
