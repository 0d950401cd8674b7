package com.gentoro.gateway.exception;

public class SerializationException extends GatewayException {
  public SerializationException(String message) {
    super(GatewayErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GatewayErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
