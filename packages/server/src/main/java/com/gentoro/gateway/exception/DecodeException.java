package com.gentoro.gateway.exception;

import java.util.Map;

/**
 * An upstream response body did not match the expected shape. Signals contract drift between the
 * gateway and the upstream protocol, not a caller error.
 */
public class DecodeException extends GatewayException {
  public DecodeException(String what, Throwable cause) {
    super(
        GatewayErrorCode.DECODE_FAILED,
        "Failed to decode " + what,
        Map.of("target", String.valueOf(what)),
        cause);
  }
}
