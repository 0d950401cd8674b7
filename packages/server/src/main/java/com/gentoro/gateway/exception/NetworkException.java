package com.gentoro.gateway.exception;

public class NetworkException extends GatewayException {
  public NetworkException(String message) {
    super(GatewayErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(GatewayErrorCode.NETWORK_ERROR, message, cause);
  }
}
